package me.lwhitelaw.myp;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

import static me.lwhitelaw.myp.Format.*;

/**
 * Payload decoders. Every decoder treats its input as untrusted: corrupt or truncated input is reported with
 * {@link DataFormatException}, never with a partial result.
 */
public final class Codec {
	private Codec() {}

	// A mythic run pair expands 2 input bytes to at most 255 output bytes
	private static final int MYTHIC_MAX_RATIO = 128;

	/**
	 * Decode a payload according to its compression tag. The input buffer is consumed.
	 * @param input the encoded payload
	 * @param tag the compression tag
	 * @return the decoded payload, ready for draining
	 * @throws DataFormatException if the tag is unknown or the payload is malformed
	 */
	public static ByteBuffer decode(ByteBuffer input, int tag) throws DataFormatException {
		return decode(input, tag, 0);
	}

	/**
	 * Decode a payload according to its compression tag. The input buffer is consumed.
	 * @param input the encoded payload
	 * @param tag the compression tag
	 * @param sizeHint the expected decoded size, used only to size the output of zlib decoding
	 * @return the decoded payload, ready for draining
	 * @throws DataFormatException if the tag is unknown or the payload is malformed
	 */
	public static ByteBuffer decode(ByteBuffer input, int tag, int sizeHint) throws DataFormatException {
		switch (tag) {
			case COMPRESSION_NONE: return input;
			case COMPRESSION_ZLIB: return inflate(input, sizeHint);
			case COMPRESSION_MYTHIC: return decodeMythic(input);
		}
		throw new DataFormatException("Unknown compression tag: " + tag);
	}

	/**
	 * Decompress a zlib stream. The stream must be complete; a stream that ends early is an error.
	 * @param input the zlib stream
	 * @param sizeHint the expected decompressed size, or 0 if not known
	 * @return the decompressed data
	 * @throws DataFormatException if the stream is malformed or truncated
	 */
	static ByteBuffer inflate(ByteBuffer input, int sizeHint) throws DataFormatException {
		Inflater inflater = new Inflater();
		try {
			inflater.setInput(input);
			ByteBuffer output = ByteBuffer.allocate(Math.max(sizeHint, 64));
			while (!inflater.finished()) {
				if (!output.hasRemaining()) {
					// out of space, the hint was wrong or absent
					output = ByteBuffer.allocate(output.capacity() * 2).put(output.flip());
				}
				int produced = inflater.inflate(output);
				if (produced == 0 && !inflater.finished()) {
					if (inflater.needsDictionary()) throw new DataFormatException("zlib stream needs a preset dictionary");
					if (inflater.needsInput()) throw new DataFormatException("zlib stream is truncated");
				}
			}
			output.flip(); // filling -> draining
			return output;
		} finally {
			inflater.end();
		}
	}

	/**
	 * Decode the mythic run-length scheme. The first 4 bytes hold the exact decoded size, little-endian. Then, repeatedly,
	 * a control byte: zero is followed by a length byte and that many literal bytes; any other value is a repeat count
	 * for the single byte that follows it.
	 * @param input the encoded payload
	 * @return the decoded data
	 * @throws DataFormatException if a copy would exceed the input or the declared size, or the declared size is not reached
	 */
	static ByteBuffer decodeMythic(ByteBuffer input) throws DataFormatException {
		ByteBuffer in = input.slice().order(ByteOrder.LITTLE_ENDIAN);
		input.position(input.limit());
		if (in.remaining() < Integer.BYTES) throw new DataFormatException("Data too short for mythic decompression");

		long declared = Integer.toUnsignedLong(in.getInt());
		if (declared == 0) throw new DataFormatException("Invalid decompressed size: 0");
		if (declared > (long) in.remaining() * MYTHIC_MAX_RATIO) {
			throw new DataFormatException("Decompressed size " + declared + " cannot be produced from " + in.remaining() + " bytes");
		}

		byte[] out = new byte[(int) declared];
		int produced = 0;
		while (in.hasRemaining() && produced < out.length) {
			int control = in.get() & 0xFF;
			if (control == 0) {
				// literal copy
				if (!in.hasRemaining()) throw new DataFormatException("Incomplete data at position " + in.position());
				int count = in.get() & 0xFF;
				if (count > in.remaining() || count > out.length - produced) {
					throw new DataFormatException("Data bounds exceeded during raw copy");
				}
				in.get(out, produced, count);
				produced += count;
			} else {
				// run of a single byte
				if (!in.hasRemaining() || control > out.length - produced) {
					throw new DataFormatException("Data bounds exceeded during RLE decompression");
				}
				byte value = in.get();
				Arrays.fill(out, produced, produced + control, value);
				produced += control;
			}
		}

		if (produced != out.length) {
			throw new DataFormatException("Decompressed size mismatch: got " + produced + ", expected " + out.length);
		}
		return ByteBuffer.wrap(out);
	}
}
