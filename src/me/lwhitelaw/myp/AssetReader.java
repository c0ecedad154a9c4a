package me.lwhitelaw.myp;

import java.io.Closeable;
import java.nio.ByteBuffer;
import java.util.stream.IntStream;

/**
 * Read access to a file of assets addressed by a dense logical index. Implementations are safe for concurrent use.
 */
public interface AssetReader extends Closeable {
	/**
	 * Read and decode the entry at the given index.
	 * @param index the logical index
	 * @return the decoded data in a new buffer
	 * @throws RecoverableAssetException with {@link AssetException.Reason#INVALID_INDEX} if the index is out of range,
	 * {@link AssetException.Reason#ENTRY_NOT_FOUND} if no data backs it, {@link AssetException.Reason#READER_CLOSED}
	 * if the reader is closed, or {@link AssetException.Reason#CODEC_ERROR} if the data could not be decoded
	 * @throws AssetException if the backing file could not be read
	 */
	ByteBuffer read(int index);

	/**
	 * Enumerate the indices that can be read. The stream is lazy and reflects the reader at the time of the call;
	 * a closed reader yields an empty stream.
	 * @return the valid indices
	 */
	IntStream entries();

	/**
	 * Get the format-specific extra value stored alongside the entry at the given index.
	 * @param index the logical index
	 * @return the extra value
	 * @throws RecoverableAssetException for the same reasons as {@link #read(int)}, except decoding
	 */
	long extra(int index);

	/**
	 * Close the reader. Closing twice has no effect.
	 * @throws AssetException if closing fails
	 */
	@Override
	void close();
}
