package me.lwhitelaw.myp.legacy;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.IntStream;

import me.lwhitelaw.myp.AssetException;
import me.lwhitelaw.myp.AssetException.Reason;
import me.lwhitelaw.myp.AssetReader;
import me.lwhitelaw.myp.RecoverableAssetException;
import me.lwhitelaw.myp.util.Buffers;

/**
 * A reader for legacy flat data files. Entries are described by a separate index file of fixed-size records
 * <code>{uint32 offset, uint32 length, uint32 extra}</code>, little-endian, or, for files without an index, by a
 * {@link LegacyLayout}. An entry with offset <code>0xFFFFFFFF</code> or length 0 holds no data.
 * Instances are safe for concurrent use.
 */
public class FlatFileReader implements AssetReader {
	private static final int INVALID_OFFSET = 0xFFFFFFFF;

	private record FlatEntry(int id, long offset, int length, int extra, ByteBuffer decoded) {
		boolean isValid() {
			return decoded != null ? decoded.hasRemaining() : offset != Integer.toUnsignedLong(INVALID_OFFSET) && length != 0;
		}
	}

	private final Path path;
	private final ReentrantReadWriteLock lock; // guards file and entries against close
	private final FileChannel file;
	private List<FlatEntry> entries; // null once closed
	private final Map<Integer, Integer> lookup; // id -> position in entries

	private FlatFileReader(Path dataPath, FileChannel file) {
		this.path = dataPath;
		this.file = file;
		lock = new ReentrantReadWriteLock();
		entries = new ArrayList<>();
		lookup = new HashMap<>();
	}

	/**
	 * Open a data file with its index file, using default options.
	 * @param dataPath the data file
	 * @param indexPath the index file
	 * @return the reader
	 * @throws AssetException if either file could not be opened or read
	 */
	public static FlatFileReader open(Path dataPath, Path indexPath) {
		return open(dataPath, indexPath, FlatFileOptions.defaults());
	}

	/**
	 * Open a data file with its index file. Each index record describes the entry whose logical index is the record's position.
	 * @param dataPath the data file
	 * @param indexPath the index file
	 * @param options the options; the layout is not used
	 * @return the reader
	 * @throws AssetException if either file could not be opened or read
	 */
	public static FlatFileReader open(Path dataPath, Path indexPath, FlatFileOptions options) {
		FlatFileReader reader = new FlatFileReader(dataPath, openChannel(dataPath));
		try {
			reader.loadIndex(indexPath, options.entrySize());
		} catch (IOException ex) {
			reader.close();
			throw new AssetException("Failed to load index " + indexPath, ex, Reason.IO_ERROR);
		} catch (RuntimeException ex) {
			reader.close();
			throw ex;
		}
		return reader;
	}

	/**
	 * Open a data file that has no index file, using default options. The whole file is entry 0.
	 * @param dataPath the data file
	 * @return the reader
	 * @throws AssetException if the file could not be opened or read
	 */
	public static FlatFileReader openWithoutIndex(Path dataPath) {
		return openWithoutIndex(dataPath, FlatFileOptions.defaults());
	}

	/**
	 * Open a data file that has no index file. Entries are described by the options' layout; without one, the whole
	 * file is entry 0.
	 * @param dataPath the data file
	 * @param options the options
	 * @return the reader
	 * @throws AssetException if the file could not be opened or read, or the layout rejects it
	 */
	public static FlatFileReader openWithoutIndex(Path dataPath, FlatFileOptions options) {
		FlatFileReader reader = new FlatFileReader(dataPath, openChannel(dataPath));
		try {
			if (options.layout() != null) {
				options.layout().describe(reader.file, reader.new Sink());
			} else {
				long size = reader.file.size();
				if (size > Integer.MAX_VALUE) throw new AssetException("File is too large to be one entry: " + dataPath, Reason.INVALID_FORMAT);
				reader.add(0, 0, (int) size, 0, null);
			}
		} catch (IOException ex) {
			reader.close();
			throw new AssetException("Failed to describe " + dataPath, ex, Reason.IO_ERROR);
		} catch (RuntimeException ex) {
			reader.close();
			throw ex;
		}
		return reader;
	}

	private static FileChannel openChannel(Path dataPath) {
		try {
			return FileChannel.open(dataPath, StandardOpenOption.READ);
		} catch (IOException ex) {
			throw new AssetException("Failed to open " + dataPath, ex, Reason.IO_ERROR);
		}
	}

	/**
	 * Load all index records into memory. A trailing partial record is ignored.
	 */
	private void loadIndex(Path indexPath, int entrySize) throws IOException {
		try (FileChannel index = FileChannel.open(indexPath, StandardOpenOption.READ)) {
			long size = index.size();
			if (size > Integer.MAX_VALUE) throw new AssetException("Index is too large: " + indexPath, Reason.INVALID_FORMAT);
			ByteBuffer data = ByteBuffer.allocate((int) size).order(ByteOrder.LITTLE_ENDIAN);
			Buffers.readFileFully(index, data, 0);
			int count = (int) (size / entrySize);
			for (int i = 0; i < count; i++) {
				int record = i * entrySize;
				add(i, Integer.toUnsignedLong(data.getInt(record)), data.getInt(record + 4), data.getInt(record + 8), null);
			}
		}
	}

	private void add(int id, long offset, int length, int extra, ByteBuffer decoded) {
		Integer previous = lookup.put(id, entries.size());
		if (previous != null) entries.set(previous, null);
		entries.add(new FlatEntry(id, offset, length, extra, decoded));
	}

	private final class Sink implements LegacyLayout.EntrySink {
		@Override
		public void add(int id, long offset, int length, int extra) {
			FlatFileReader.this.add(id, offset, length, extra, null);
		}

		@Override
		public void add(int id, ByteBuffer value, int extra) {
			ByteBuffer copy = Buffers.copyOf(value);
			FlatFileReader.this.add(id, 0, copy.remaining(), extra, copy);
		}
	}

	@Override
	public ByteBuffer read(int index) {
		lock.readLock().lock();
		try {
			FlatEntry entry = validEntryAt(index);
			if (entry.decoded() != null) return Buffers.copyOf(entry.decoded());
			try {
				int length = (int) Math.min(Integer.toUnsignedLong(entry.length()), Integer.MAX_VALUE);
				return Buffers.readClamped(file, entry.offset(), length);
			} catch (IOException ex) {
				throw new AssetException("Failed to read entry " + index + " of " + path, ex, Reason.IO_ERROR);
			}
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Returns the third word of the entry's index record, unsigned.
	 */
	@Override
	public long extra(int index) {
		lock.readLock().lock();
		try {
			return Integer.toUnsignedLong(validEntryAt(index).extra());
		} finally {
			lock.readLock().unlock();
		}
	}

	@Override
	public IntStream entries() {
		List<FlatEntry> snapshot;
		lock.readLock().lock();
		try {
			snapshot = entries;
		} finally {
			lock.readLock().unlock();
		}
		if (snapshot == null) return IntStream.empty();
		return snapshot.stream()
				.filter(entry -> entry != null && entry.isValid())
				.mapToInt(FlatEntry::id);
	}

	/**
	 * Close this file, discarding its entries. Closing twice has no effect.
	 * @throws AssetException if the file could not be closed
	 */
	@Override
	public void close() {
		lock.writeLock().lock();
		try {
			if (entries == null) return;
			entries = null;
			file.close();
		} catch (IOException ex) {
			throw new AssetException("I/O error on close of " + path, ex, Reason.IO_ERROR);
		} finally {
			lock.writeLock().unlock();
		}
	}

	public Path getPath() {
		return path;
	}

	private FlatEntry validEntryAt(int index) {
		List<FlatEntry> e = entries;
		if (e == null) throw new RecoverableAssetException("File " + path + " is closed", Reason.READER_CLOSED);
		Integer position = lookup.get(index);
		if (position == null) throw new RecoverableAssetException("Index " + index + " is not in " + path, Reason.INVALID_INDEX);
		FlatEntry entry = e.get(position);
		if (!entry.isValid()) throw new RecoverableAssetException("No data for entry " + index, Reason.ENTRY_NOT_FOUND);
		return entry;
	}
}
