package me.lwhitelaw.myp;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import me.lwhitelaw.myp.AssetException.Reason;
import me.lwhitelaw.myp.util.Buffers;

import static me.lwhitelaw.myp.Format.*;

/**
 * Reads a container's header and walks its block chain, building the {@link EntryTable}.
 */
final class ContainerParser {
	private static final Logger LOG = LoggerFactory.getLogger(ContainerParser.class);

	private ContainerParser() {}

	/**
	 * The outcome of a parse.
	 */
	record Result(ContainerHeader header, EntryTable table) {}

	/**
	 * Parse a container.
	 * @param file the open container
	 * @param fileName the container's file name, from which the entry name pattern is derived
	 * @param options the open options
	 * @return the header and the entry table
	 * @throws IOException if the file could not be read
	 * @throws AssetException with {@link Reason#INVALID_FORMAT} if the file is not a valid container
	 */
	static Result parse(FileChannel file, String fileName, ContainerOptions options) throws IOException {
		ByteBuffer hbuf = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
		Buffers.readFileFully(file, hbuf, 0);
		// check EOF
		if (hbuf.hasRemaining()) throw invalid("Truncated header");
		ContainerHeader header = ContainerHeader.fromBuffer(hbuf);
		if (!header.hasValidMagic()) throw invalid(String.format("Incorrect magic value: %08X", header.magic()));

		long fileSize = file.size();
		int length = options.length();
		if (length == 0) {
			// every counted entry needs a record somewhere in the file
			if (header.entryCount() > Integer.MAX_VALUE - 8 || header.entryCount() > fileSize / ENTRY_SIZE) {
				throw invalid("Entry count " + header.entryCount() + " cannot fit in a file of " + fileSize + " bytes");
			}
			length = (int) header.entryCount();
		}

		// Precompute the hash of every expected name
		String pattern = patternOf(fileName);
		long[] expectedHashes = new long[length];
		Map<Long, Integer> expected = new HashMap<>();
		for (int i = 0; i < length; i++) {
			long hash = NameHash.hash(entryName(pattern, i, options.extension()));
			expectedHashes[i] = hash;
			expected.put(hash, i);
		}

		EntryTable table = new EntryTable(length, options.hasExtra());
		Set<Long> visited = new HashSet<>();
		int blocks = 0;
		int unmatched = 0;
		long blockOffset = header.firstBlockOffset();
		while (blockOffset != 0) {
			if (blockOffset < 0) throw invalid("Block offset is invalid: " + Long.toUnsignedString(blockOffset));
			if (!visited.add(blockOffset)) throw invalid("Block chain loops back to offset " + blockOffset);

			ByteBuffer bbuf = ByteBuffer.allocate(BLOCK_HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
			Buffers.readFileFully(file, bbuf, blockOffset);
			if (bbuf.hasRemaining()) throw invalid("Truncated block header at offset " + blockOffset);
			long fileCount = Integer.toUnsignedLong(bbuf.getInt(BLOCK_OFFS_FILE_COUNT));
			long nextBlockOffset = bbuf.getLong(BLOCK_OFFS_NEXT_BLOCK);
			if (fileCount > header.blockCapacity()) {
				throw invalid("Block file count " + fileCount + " exceeds block capacity " + header.blockCapacity());
			}

			// Records past the end of the file read as zeroes, which makes them placeholders
			long recordStart = blockOffset + BLOCK_HEADER_SIZE;
			long available = Math.max(0, fileSize - recordStart);
			int records = (int) Math.min(fileCount, (available + ENTRY_SIZE - 1) / ENTRY_SIZE);
			ByteBuffer ebuf = ByteBuffer.allocate(records * ENTRY_SIZE).order(ByteOrder.LITTLE_ENDIAN);
			Buffers.readFileFully(file, ebuf, recordStart);
			ebuf.clear();

			for (int r = 0; r < records; r++) {
				RawEntry raw = RawEntry.fromBuffer(ebuf);
				if (raw.isPlaceholder()) continue;
				if (raw.getOffset() < 0) throw invalid("Entry offset is invalid: " + Long.toUnsignedString(raw.getOffset()));

				Integer index = expected.get(raw.getNameHash());
				if (index == null) {
					if (options.strict()) {
						throw invalid("Entry with hash " + NameHash.hashToString(raw.getNameHash()) + " matches no expected name");
					}
					unmatched++;
				} else if (Integer.toUnsignedLong(index) > options.indexLength()) {
					throw invalid("Entry index " + index + " exceeds index length " + options.indexLength());
				}
				// Only entries bound to a logical index have their extra header read
				if (index != null && table.skipsExtra(raw)) {
					table.addWithExtra(raw, readExtra(file, raw));
				} else {
					table.add(raw);
				}
			}

			blocks++;
			blockOffset = nextBlockOffset;
		}
		table.bind(expectedHashes);

		if (LOG.isDebugEnabled()) {
			LOG.debug("Parsed {}: {} blocks, {} stored entries, {} of {} logical entries bound, {} unmatched",
					fileName, blocks, table.storedCount(), table.boundCount(), length, unmatched);
		}
		return new Result(header, table);
	}

	/**
	 * Read the 8-byte extra-data header in front of an entry's payload.
	 * @return both extra words, the first in the low half
	 */
	private static long readExtra(FileChannel file, RawEntry raw) throws IOException {
		if (raw.getCompressedSize() < EXTRA_SIZE) {
			throw invalid("Entry " + NameHash.hashToString(raw.getNameHash()) + " is too small to hold extra data");
		}
		ByteBuffer xbuf = ByteBuffer.allocate(EXTRA_SIZE).order(ByteOrder.LITTLE_ENDIAN);
		Buffers.readFileFully(file, xbuf, raw.getPayloadOffset());
		if (xbuf.hasRemaining()) throw invalid("Truncated extra data at offset " + raw.getPayloadOffset());
		long extra1 = Integer.toUnsignedLong(xbuf.getInt(0));
		long extra2 = Integer.toUnsignedLong(xbuf.getInt(4));
		return extra1 | (extra2 << 32);
	}

	private static AssetException invalid(String message) {
		return new AssetException(message, Reason.INVALID_FORMAT);
	}
}
