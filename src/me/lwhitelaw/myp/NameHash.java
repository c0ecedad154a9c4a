package me.lwhitelaw.myp;

import java.nio.charset.StandardCharsets;

/**
 * The 64-bit name hash used by MYP containers to locate entries. Containers never store entry names, only
 * this hash of them, so it must be reproduced bit for bit.
 * <p>
 * All arithmetic is on 32-bit words and wraps modulo 2<sup>32</sup>; shifts are unsigned.
 */
public final class NameHash {
	private NameHash() {}

	private static final String HEX_DIGITS = "0123456789ABCDEF";

	/**
	 * Hash a name, encoded as UTF-8.
	 * @param name the name to hash
	 * @return the 64-bit hash
	 */
	public static long hash(String name) {
		return hash(name.getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * Hash a byte string. The input is consumed in 12-byte chunks, three little-endian words per chunk, mixed into three
	 * accumulators seeded with <code>length + 0xDEADBEEF</code>. A tail of 1-11 bytes is folded in and run through a final
	 * mix. If there is no tail the final mix is skipped.
	 * @param s the bytes to hash
	 * @return the 64-bit hash
	 */
	public static long hash(byte[] s) {
		int length = s.length;
		int eax = 0;
		int ecx;
		int edx;
		int ebx = length + 0xDEADBEEF;
		int esi = ebx;
		int edi = ebx;

		int i = 0;
		while (i + 12 <= length) {
			edi += word(s, i + 4);
			esi += word(s, i + 8);
			edx = word(s, i) - esi;

			edx = (edx + ebx) ^ (esi >>> 28) ^ (esi << 4);
			esi += edi;
			edi = (edi - edx) ^ (edx >>> 26) ^ (edx << 6);
			edx += esi;
			esi = (esi - edi) ^ (edi >>> 24) ^ (edi << 8);
			edi += edx;
			ebx = (edx - esi) ^ (esi >>> 16) ^ (esi << 16);
			esi += edi;
			edi = (edi - ebx) ^ (ebx >>> 13) ^ (ebx << 19);
			ebx += esi;
			esi = (esi - edi) ^ (edi >>> 28) ^ (edi << 4);
			edi += ebx;

			i += 12;
		}

		int remaining = length - i;
		if (remaining == 0) {
			return pack(esi, eax);
		}

		// fold the tail in, longest first
		switch (remaining) {
			case 11: esi += (s[i + 10] & 0xFF) << 16;
			case 10: esi += (s[i + 9] & 0xFF) << 8;
			case 9: esi += (s[i + 8] & 0xFF);
			case 8: edi += (s[i + 7] & 0xFF) << 24;
			case 7: edi += (s[i + 6] & 0xFF) << 16;
			case 6: edi += (s[i + 5] & 0xFF) << 8;
			case 5: edi += (s[i + 4] & 0xFF);
			case 4: ebx += (s[i + 3] & 0xFF) << 24;
			case 3: ebx += (s[i + 2] & 0xFF) << 16;
			case 2: ebx += (s[i + 1] & 0xFF) << 8;
			case 1: ebx += (s[i] & 0xFF);
		}

		esi = (esi ^ edi) - ((edi >>> 18) ^ (edi << 14));
		ecx = (esi ^ ebx) - ((esi >>> 21) ^ (esi << 11));
		edi = (edi ^ ecx) - ((ecx >>> 7) ^ (ecx << 25));
		esi = (esi ^ edi) - ((edi >>> 16) ^ (edi << 16));
		edx = (esi ^ ecx) - ((esi >>> 28) ^ (esi << 4));
		edi = (edi ^ edx) - ((edx >>> 18) ^ (edx << 14));
		eax = (esi ^ edi) - ((edi >>> 8) ^ (edi << 24));

		return pack(edi, eax);
	}

	/**
	 * Convert a hash to its 16-digit hexadecimal representation.
	 * @param hash hash to convert
	 * @return the hash as a string
	 */
	public static String hashToString(long hash) {
		StringBuilder sb = new StringBuilder(16);
		for (int shift = 60; shift >= 0; shift -= 4) {
			sb.append(HEX_DIGITS.charAt((int) (hash >>> shift) & 0x0F));
		}
		return sb.toString();
	}

	private static int word(byte[] s, int i) {
		return (s[i] & 0xFF) | (s[i + 1] & 0xFF) << 8 | (s[i + 2] & 0xFF) << 16 | (s[i + 3] & 0xFF) << 24;
	}

	private static long pack(int high, int low) {
		return ((long) high << 32) | (low & 0xFFFFFFFFL);
	}
}
