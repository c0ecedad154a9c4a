package me.lwhitelaw.myp;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static me.lwhitelaw.myp.Format.*;

/**
 * The fixed 28-byte header at the start of a container. Unsigned 32-bit fields are widened to <code>long</code>.
 */
public record ContainerHeader(long magic, long version, long signature, long firstBlockOffset, long blockCapacity, long entryCount) {
	/**
	 * Decode a header from a buffer holding at least {@link Format#HEADER_SIZE} bytes from its start.
	 * The magic value is not checked here.
	 * @param buf the buffer to decode from
	 * @return the decoded header
	 */
	public static ContainerHeader fromBuffer(ByteBuffer buf) {
		buf.order(ByteOrder.LITTLE_ENDIAN);
		return new ContainerHeader(
				Integer.toUnsignedLong(buf.getInt(HEADER_OFFS_MAGIC)),
				Integer.toUnsignedLong(buf.getInt(HEADER_OFFS_VERSION)),
				Integer.toUnsignedLong(buf.getInt(HEADER_OFFS_SIGNATURE)),
				buf.getLong(HEADER_OFFS_FIRST_BLOCK),
				Integer.toUnsignedLong(buf.getInt(HEADER_OFFS_BLOCK_CAPACITY)),
				Integer.toUnsignedLong(buf.getInt(HEADER_OFFS_ENTRY_COUNT)));
	}

	/**
	 * @return true if the magic value identifies a MYP container
	 */
	public boolean hasValidMagic() {
		return magic == Integer.toUnsignedLong(HEADER_MAGIC);
	}
}
