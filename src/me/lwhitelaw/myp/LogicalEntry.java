package me.lwhitelaw.myp;

/**
 * The location and encoding of one logical entry's payload, after the format's header and extra-data adjustments
 * have been applied to its {@link RawEntry}.
 * @param offset absolute position of the payload to read
 * @param length number of bytes to read
 * @param decompressedLength size of the payload once decoded
 * @param extra1 first extra word, or {@link Format#INVALID_EXTRA}
 * @param extra2 second extra word, or {@link Format#INVALID_EXTRA}
 * @param compressionTag the compression used for the payload
 */
public record LogicalEntry(long offset, long length, long decompressedLength, int extra1, int extra2, int compressionTag) {
	/**
	 * @return false for sentinel entries: zero length or the tombstone offset
	 */
	public boolean isValid() {
		return offset != Format.TOMBSTONE_OFFSET && length != 0;
	}

	/**
	 * Pack both extra words into one value, the first in the low half.
	 * @return the packed extra value
	 */
	public long extra() {
		return Integer.toUnsignedLong(extra1) | (Integer.toUnsignedLong(extra2) << 32);
	}
}
