package me.lwhitelaw.myp.file;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import me.lwhitelaw.myp.AssetException;
import me.lwhitelaw.myp.AssetException.Reason;
import me.lwhitelaw.myp.AssetReader;
import me.lwhitelaw.myp.RecoverableAssetException;
import me.lwhitelaw.myp.util.Buffers;

/**
 * One asset file, backed by either a MYP container or a legacy data file, whichever is found. The backing reader is
 * opened lazily, on the first read or enumeration, exactly once no matter how many threads race to trigger it. If
 * opening fails the file returns to its initial state and a later call tries again.
 * <p>
 * Patches override the data of individual indices, including indices the backing file does not have, and are served
 * without opening the backing file at all. Instances are safe for concurrent use.
 */
public class UnifiedFile implements AssetReader {
	private static final Logger LOG = LoggerFactory.getLogger(UnifiedFile.class);

	private static enum State {
		NEW, INITIALIZING, READY, CLOSED
	}

	private final Source source;

	private final Object stateLock = new Object();
	private State state = State.NEW; // guarded by stateLock
	private AssetReader reader; // guarded by stateLock

	private final ReentrantReadWriteLock patchLock = new ReentrantReadWriteLock();
	private final Map<Integer, ByteBuffer> patches = new HashMap<>(); // guarded by patchLock

	/**
	 * Set up an asset file among the candidate names in a directory. Nothing is opened until first use.
	 * @param basePath the directory holding the files
	 * @param fileNames the candidate file names, see {@link Source#detect(Path, List, FileOptions)}
	 * @param options the options
	 */
	public UnifiedFile(Path basePath, List<String> fileNames, FileOptions options) {
		this(Source.detect(basePath, fileNames, options), options.patches());
	}

	/**
	 * Set up an asset file over an already chosen source.
	 * @param source the backing source
	 * @param initialPatches patches to apply immediately
	 */
	UnifiedFile(Source source, Map<Integer, ByteBuffer> initialPatches) {
		this.source = source;
		for (Map.Entry<Integer, ByteBuffer> patch : initialPatches.entrySet()) {
			patches.put(patch.getKey(), Buffers.copyOf(patch.getValue()));
		}
	}

	/**
	 * Open the backing reader now instead of on first use. Has no effect if already open.
	 * @throws AssetException if opening fails or the file is closed
	 */
	public void open() {
		ensureOpen();
	}

	/**
	 * Read the entry at the given index. A patch for the index is returned without consulting the backing file.
	 */
	@Override
	public ByteBuffer read(int index) {
		ByteBuffer patch = patchFor(index);
		if (patch != null) return patch;
		return ensureOpen().read(index);
	}

	/**
	 * Returns 0 for patched indices.
	 */
	@Override
	public long extra(int index) {
		if (patchFor(index) != null) return 0;
		return ensureOpen().extra(index);
	}

	/**
	 * Enumerate the indices of the backing file together with all patched indices, without duplicates and in no
	 * particular order.
	 * @throws AssetException if opening the backing file fails or the file is closed
	 */
	@Override
	public IntStream entries() {
		AssetReader r = ensureOpen();
		int[] patched;
		patchLock.readLock().lock();
		try {
			patched = patches.keySet().stream().mapToInt(Integer::intValue).toArray();
		} finally {
			patchLock.readLock().unlock();
		}
		return IntStream.concat(r.entries(), IntStream.of(patched)).distinct();
	}

	/**
	 * Override the data at an index. The buffer's remaining data is copied; later changes to it have no effect.
	 * @param index the logical index
	 * @param data the replacement data
	 * @throws RecoverableAssetException if the file is closed
	 */
	public void addPatch(int index, ByteBuffer data) {
		ByteBuffer copy = Buffers.copyOf(data);
		patchLock.writeLock().lock();
		try {
			// close() marks the state before it clears patches
			synchronized (stateLock) {
				if (state == State.CLOSED) throw closed();
			}
			patches.put(index, copy);
		} finally {
			patchLock.writeLock().unlock();
		}
	}

	/**
	 * Remove the patch at an index, if any, so reads of it go to the backing file again.
	 * @param index the logical index
	 */
	public void removePatch(int index) {
		patchLock.writeLock().lock();
		try {
			patches.remove(index);
		} finally {
			patchLock.writeLock().unlock();
		}
	}

	/**
	 * Close this file: drop all patches and close the backing reader if it was opened. The file cannot be reopened.
	 * Closing twice has no effect.
	 */
	@Override
	public void close() {
		AssetReader toClose;
		synchronized (stateLock) {
			if (state == State.CLOSED) return;
			state = State.CLOSED;
			toClose = reader;
			reader = null;
			stateLock.notifyAll();
		}
		patchLock.writeLock().lock();
		try {
			patches.clear();
		} finally {
			patchLock.writeLock().unlock();
		}
		if (toClose != null) toClose.close();
	}

	public Source getSource() {
		return source;
	}

	/**
	 * @return true if the backing reader is open
	 */
	public boolean isOpen() {
		synchronized (stateLock) {
			return state == State.READY;
		}
	}

	private ByteBuffer patchFor(int index) {
		patchLock.readLock().lock();
		try {
			ByteBuffer patch = patches.get(index);
			return patch == null ? null : Buffers.copyOf(patch);
		} finally {
			patchLock.readLock().unlock();
		}
	}

	/**
	 * Return the backing reader, opening it if needed. One caller runs the initializer while others wait for its outcome;
	 * if it fails, the state returns to NEW and a waiting caller takes its turn.
	 */
	private AssetReader ensureOpen() {
		synchronized (stateLock) {
			while (state != State.NEW) {
				switch (state) {
					case READY:
						return reader;
					case CLOSED:
						throw closed();
					default:
						try {
							stateLock.wait();
						} catch (InterruptedException ex) {
							Thread.currentThread().interrupt();
							throw new AssetException("Interrupted while waiting for " + source.path() + " to open", ex, Reason.UNKNOWN);
						}
				}
			}
			state = State.INITIALIZING;
		}

		AssetReader opened = null;
		try {
			opened = source.initializer().open();
		} catch (IOException | RuntimeException ex) {
			LOG.warn("Failed to initialise {}: {}", source.path(), ex.getMessage());
			if (ex instanceof AssetException) throw (AssetException) ex;
			throw new AssetException("Failed to initialise " + source.path(), ex, Reason.IO_ERROR);
		} finally {
			// failed, Errors included: back to NEW for the next caller
			if (opened == null) {
				synchronized (stateLock) {
					if (state == State.INITIALIZING) state = State.NEW;
					stateLock.notifyAll();
				}
			}
		}
		if (opened == null) throw new AssetException("No reader was opened for " + source.path(), Reason.UNKNOWN);

		synchronized (stateLock) {
			if (state == State.CLOSED) {
				// closed while initialising; nobody else will close this reader
				try {
					opened.close();
				} catch (AssetException ex) {
					LOG.warn("Failed to close {} after a concurrent close", source.path(), ex);
				}
				throw closed();
			}
			reader = opened;
			state = State.READY;
			stateLock.notifyAll();
			LOG.debug("Opened {} as {}", source.path(), source.kind());
			return opened;
		}
	}

	private RecoverableAssetException closed() {
		return new RecoverableAssetException("File " + source.path() + " is closed", Reason.READER_CLOSED);
	}
}
