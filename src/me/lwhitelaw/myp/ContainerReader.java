package me.lwhitelaw.myp;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.IntStream;
import java.util.zip.DataFormatException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import me.lwhitelaw.myp.AssetException.Reason;
import me.lwhitelaw.myp.util.Buffers;

/**
 * A reader for a MYP container. Entries may be requested by logical index, by name hash or by name, or enumerated.
 * The whole entry table is built when the container is opened and is read-only afterwards. Instances are safe for
 * concurrent use; reads proceed concurrently, and {@link #close()} waits for reads in flight.
 */
public class ContainerReader implements AssetReader {
	private static final Logger LOG = LoggerFactory.getLogger(ContainerReader.class);

	// Upper bound on the output buffer preallocated for zlib payloads
	private static final int MAX_SIZE_HINT = 1 << 24;

	private final Path path;
	private final ContainerHeader header;
	private final ReentrantReadWriteLock lock; // guards file and table against close
	private final FileChannel file;
	private EntryTable table; // null once closed

	/**
	 * Open a container at the provided path with default options.
	 * @param filePath The path to the container to open
	 * @throws AssetException if the file could not be opened or is invalid.
	 */
	public ContainerReader(Path filePath) {
		this(filePath, ContainerOptions.defaults());
	}

	/**
	 * Open a container at the provided path. The header is checked and the whole block chain is read.
	 * @param filePath The path to the container to open
	 * @param options The options to open with
	 * @throws AssetException with {@link Reason#INVALID_FORMAT} if the file is not a valid container, or
	 * {@link Reason#IO_ERROR} if it could not be read.
	 */
	public ContainerReader(Path filePath, ContainerOptions options) {
		path = filePath;
		lock = new ReentrantReadWriteLock();
		try {
			file = FileChannel.open(filePath, StandardOpenOption.READ);
		} catch (IOException ex) {
			throw new AssetException("Failed to open container " + filePath, ex, Reason.IO_ERROR);
		}
		try {
			ContainerParser.Result result = ContainerParser.parse(file, filePath.getFileName().toString(), options);
			header = result.header();
			table = result.table();
		} catch (IOException | RuntimeException ex) {
			closeQuietlyAfter(ex);
			if (ex instanceof AssetException) throw (AssetException) ex;
			throw new AssetException("Failed to read container " + filePath, ex, Reason.IO_ERROR);
		}
	}

	@Override
	public ByteBuffer read(int index) {
		lock.readLock().lock();
		try {
			LogicalEntry entry = validEntryAt(index);
			return readPayload(entry, "entry " + index);
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Read and decode the entry with the given name hash, bypassing the logical index.
	 * @param hash the name hash
	 * @return the decoded data in a new buffer
	 * @throws RecoverableAssetException if there is no such entry, it holds no data, it could not be decoded or the reader is closed
	 */
	public ByteBuffer readByHash(long hash) {
		lock.readLock().lock();
		try {
			EntryTable t = openTable();
			LogicalEntry entry = t.resolveHash(hash);
			if (entry == null || !entry.isValid()) {
				throw new RecoverableAssetException("No entry with hash " + NameHash.hashToString(hash), Reason.ENTRY_NOT_FOUND);
			}
			return readPayload(entry, "hash " + NameHash.hashToString(hash));
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Read and decode the entry with the given name, bypassing the logical index.
	 * @param name the full entry name, such as <code>build/gumpartlegacymul/00000000.tga</code>
	 * @return the decoded data in a new buffer
	 * @throws RecoverableAssetException if there is no such entry, it holds no data, it could not be decoded or the reader is closed
	 */
	public ByteBuffer readByName(String name) {
		return readByHash(NameHash.hash(name));
	}

	/**
	 * Search the stored entries for the one with the provided name hash. Null will be returned if it is not present.
	 * @param hash the hash to search for
	 * @return the raw entry, or null if not found
	 * @throws RecoverableAssetException if the reader is closed
	 */
	public RawEntry locateEntryForHash(long hash) {
		lock.readLock().lock();
		try {
			return openTable().locate(hash);
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Get the resolved entry at a logical index.
	 * @param index the logical index
	 * @return the entry, or null if the slot is a sentinel
	 * @throws RecoverableAssetException if the index is out of range or the reader is closed
	 */
	public LogicalEntry entryAt(int index) {
		lock.readLock().lock();
		try {
			EntryTable t = openTable();
			checkIndex(t, index);
			return t.entryAt(index);
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Returns the packed extra words of the entry, the first in the low half. Entries of containers opened without
	 * extra data report {@link Format#INVALID_EXTRA} in both halves.
	 */
	@Override
	public long extra(int index) {
		lock.readLock().lock();
		try {
			return validEntryAt(index).extra();
		} finally {
			lock.readLock().unlock();
		}
	}

	@Override
	public IntStream entries() {
		EntryTable t;
		lock.readLock().lock();
		try {
			t = table;
		} finally {
			lock.readLock().unlock();
		}
		if (t == null) return IntStream.empty();
		return IntStream.range(0, t.length()).filter(t::isValid);
	}

	/**
	 * Get the number of logical slots, valid or not.
	 * @return the table length
	 * @throws RecoverableAssetException if the reader is closed
	 */
	public int getLength() {
		lock.readLock().lock();
		try {
			return openTable().length();
		} finally {
			lock.readLock().unlock();
		}
	}

	public ContainerHeader getHeader() {
		return header;
	}

	public Path getPath() {
		return path;
	}

	/**
	 * Close this container, discarding its entry table. Closing twice has no effect.
	 * @throws AssetException if the file could not be closed
	 */
	@Override
	public void close() {
		lock.writeLock().lock();
		try {
			if (table == null) return;
			table = null;
			file.close();
		} catch (IOException ex) {
			throw new AssetException("I/O error on close of " + path, ex, Reason.IO_ERROR);
		} finally {
			lock.writeLock().unlock();
		}
	}

	// Utilities, called with the read lock held

	private EntryTable openTable() {
		EntryTable t = table;
		if (t == null) throw new RecoverableAssetException("Container " + path + " is closed", Reason.READER_CLOSED);
		return t;
	}

	private static void checkIndex(EntryTable t, int index) {
		if (index < 0 || index >= t.length()) {
			throw new RecoverableAssetException("Index " + index + " is outside [0, " + t.length() + ")", Reason.INVALID_INDEX);
		}
	}

	private LogicalEntry validEntryAt(int index) {
		EntryTable t = openTable();
		checkIndex(t, index);
		LogicalEntry entry = t.entryAt(index);
		if (entry == null || !entry.isValid()) {
			throw new RecoverableAssetException("No data for entry " + index, Reason.ENTRY_NOT_FOUND);
		}
		return entry;
	}

	private ByteBuffer readPayload(LogicalEntry entry, String what) {
		ByteBuffer encoded;
		try {
			encoded = Buffers.readClamped(file, entry.offset(), (int) Math.min(entry.length(), Integer.MAX_VALUE));
		} catch (IOException ex) {
			throw new AssetException("Failed to read " + what + " of " + path, ex, Reason.IO_ERROR);
		}
		try {
			return Codec.decode(encoded, entry.compressionTag(), (int) Math.min(entry.decompressedLength(), MAX_SIZE_HINT));
		} catch (DataFormatException ex) {
			throw new RecoverableAssetException("Failed to decode " + what + " of " + path + ": " + ex.getMessage(), ex, Reason.CODEC_ERROR);
		}
	}

	private void closeQuietlyAfter(Exception cause) {
		try {
			file.close();
		} catch (IOException ex) {
			cause.addSuppressed(ex);
		}
		LOG.debug("Failed to open container {}", path, cause);
	}
}
