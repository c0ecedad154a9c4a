package me.lwhitelaw.myp.legacy;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

import me.lwhitelaw.myp.AssetException;
import me.lwhitelaw.myp.AssetException.Reason;

/**
 * Describes the entries of a legacy data file that has no index file, by registering them with a sink.
 */
@FunctionalInterface
public interface LegacyLayout {
	/**
	 * Register the entries of the file.
	 * @param file the open data file
	 * @param sink where to register entries
	 * @throws IOException if the file could not be read
	 */
	void describe(FileChannel file, EntrySink sink) throws IOException;

	/**
	 * Receives entry registrations. Registering an id twice replaces the first registration.
	 */
	interface EntrySink {
		/**
		 * Register an entry backed by a range of the data file.
		 * @param id the logical index
		 * @param offset the position of the data in the file
		 * @param length the length of the data
		 * @param extra the extra value
		 */
		void add(int id, long offset, int length, int extra);

		/**
		 * Register an entry whose data was already decoded. The buffer's remaining data is copied.
		 * @param id the logical index
		 * @param value the data
		 * @param extra the extra value
		 */
		void add(int id, ByteBuffer value, int extra);
	}

	/**
	 * A layout of consecutive fixed-size chunks: entry <i>i</i> spans <code>[i*chunkSize, (i+1)*chunkSize)</code>.
	 * A trailing partial chunk is ignored.
	 * @param chunkSize size of each chunk in bytes
	 * @return the layout
	 * @throws IllegalArgumentException if the chunk size is not positive
	 */
	static LegacyLayout chunks(int chunkSize) {
		if (chunkSize <= 0) throw new IllegalArgumentException("Invalid chunk size: " + chunkSize);
		return (file, sink) -> {
			long chunkCount = file.size() / chunkSize;
			if (chunkCount == 0) throw new AssetException("File too small for chunk format", Reason.INVALID_FORMAT);
			if (chunkCount > Integer.MAX_VALUE) throw new AssetException("Too many chunks: " + chunkCount, Reason.INVALID_FORMAT);
			for (int i = 0; i < chunkCount; i++) {
				sink.add(i, (long) i * chunkSize, chunkSize, 0);
			}
		};
	}
}
