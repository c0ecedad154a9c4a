package me.lwhitelaw.myp;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static me.lwhitelaw.myp.Format.*;

/**
 * An entry record in one of a container's blocks, as stored on disk. This class is immutable.
 * Unsigned 32-bit sizes are held in <code>int</code>s and should be read with the unsigned accessors.
 */
public class RawEntry {
	/**
	 * The size of an entry record in bytes.
	 */
	public static final int BYTES = Format.ENTRY_SIZE;

	private final long offset;
	private final int headerSize;
	private final int compressedSize;
	private final int decompressedSize;
	private final long nameHash;
	private final int checksum;
	private final short compressionTag;

	/**
	 * Construct a raw entry from the provided data.
	 * @param offset Absolute position of the entry's header in the container. Zero marks an unused slot.
	 * @param headerSize Size of the header in front of the payload.
	 * @param compressedSize Size of the payload as stored.
	 * @param decompressedSize Size of the payload after decoding.
	 * @param nameHash The {@link NameHash} of the entry's name.
	 * @param checksum The stored checksum of the payload. Not verified.
	 * @param compressionTag The compression used for the payload.
	 */
	public RawEntry(long offset, int headerSize, int compressedSize, int decompressedSize, long nameHash, int checksum, short compressionTag) {
		this.offset = offset;
		this.headerSize = headerSize;
		this.compressedSize = compressedSize;
		this.decompressedSize = decompressedSize;
		this.nameHash = nameHash;
		this.checksum = checksum;
		this.compressionTag = compressionTag;
	}

	/**
	 * Get the absolute position of the entry's header in the container.
	 * @return the entry offset
	 */
	public long getOffset() {
		return offset;
	}

	/**
	 * Get the size of the header in front of the payload.
	 * @return the header size, unsigned
	 */
	public long getHeaderSize() {
		return Integer.toUnsignedLong(headerSize);
	}

	/**
	 * Get the size of the payload as stored.
	 * @return the compressed size, unsigned
	 */
	public long getCompressedSize() {
		return Integer.toUnsignedLong(compressedSize);
	}

	/**
	 * Get the size of the payload after decoding.
	 * @return the decompressed size, unsigned
	 */
	public long getDecompressedSize() {
		return Integer.toUnsignedLong(decompressedSize);
	}

	public long getNameHash() {
		return nameHash;
	}

	public int getChecksum() {
		return checksum;
	}

	public short getCompressionTag() {
		return compressionTag;
	}

	/**
	 * Get the position of the payload: the entry offset plus its header size.
	 * @return the payload position
	 */
	public long getPayloadOffset() {
		return offset + getHeaderSize();
	}

	/**
	 * @return true if this record marks an unused slot
	 */
	public boolean isPlaceholder() {
		return offset == 0;
	}

	/**
	 * Create a raw entry from a buffer, advancing its position by {@link #BYTES}.
	 * @param buf the buffer to decode from
	 * @return a decoded raw entry
	 */
	public static RawEntry fromBuffer(ByteBuffer buf) {
		buf.order(ByteOrder.LITTLE_ENDIAN);
		int base = buf.position();
		long offset = buf.getLong(base + ENTRY_OFFS_OFFSET);
		int headerSize = buf.getInt(base + ENTRY_OFFS_HEADER_SIZE);
		int compressedSize = buf.getInt(base + ENTRY_OFFS_COMPRESSED_SIZE);
		int decompressedSize = buf.getInt(base + ENTRY_OFFS_DECOMPRESSED_SIZE);
		long nameHash = buf.getLong(base + ENTRY_OFFS_HASH);
		int checksum = buf.getInt(base + ENTRY_OFFS_CHECKSUM);
		short compressionTag = buf.getShort(base + ENTRY_OFFS_COMPRESSION);
		buf.position(base + ENTRY_SIZE);
		return new RawEntry(offset, headerSize, compressedSize, decompressedSize, nameHash, checksum, compressionTag);
	}

	/**
	 * Test if two raw entries are identical.
	 */
	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof RawEntry)) return false;
		RawEntry other = (RawEntry) obj;
		return offset == other.offset
				&& headerSize == other.headerSize
				&& compressedSize == other.compressedSize
				&& decompressedSize == other.decompressedSize
				&& nameHash == other.nameHash
				&& checksum == other.checksum
				&& compressionTag == other.compressionTag;
	}

	@Override
	public int hashCode() {
		int h = Long.hashCode(nameHash);
		h = 31 * h + Long.hashCode(offset);
		h = 31 * h + headerSize;
		h = 31 * h + compressedSize;
		h = 31 * h + decompressedSize;
		h = 31 * h + checksum;
		h = 31 * h + compressionTag;
		return h;
	}

	@Override
	public String toString() {
		return String.format("{%s, tag %d, %d (encoded: %d), offset: %016X+%d}", NameHash.hashToString(nameHash), compressionTag,
				getDecompressedSize(), getCompressedSize(), offset, getHeaderSize());
	}
}
