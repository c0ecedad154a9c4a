package me.lwhitelaw.myp.util;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

public class Buffers {
	/**
	 * Copy data from the position to the limit into a new heap buffer of exactly that size. The source buffer is not consumed.
	 * @param original buffer to copy from
	 * @return a new buffer, ready for draining, holding the remaining data of the original
	 */
	public static ByteBuffer copyOf(ByteBuffer original) {
		if (original == null) throw new NullPointerException("original buffer is null");
		ByteBuffer newBuffer = ByteBuffer.allocate(original.remaining());
		newBuffer.put(original.duplicate());
		newBuffer.flip();
		return newBuffer;
	}

	/**
	 * Copy data from the position to the limit into a new array. The source buffer is not consumed.
	 * @param buf buffer to copy from
	 * @return the remaining data as an array
	 */
	public static byte[] toArray(ByteBuffer buf) {
		byte[] out = new byte[buf.remaining()];
		buf.duplicate().get(out);
		return out;
	}

	/**
	 * Fully read data into this buffer from the file at the given position, repeating until the buffer is
	 * filled or end of stream is signalled.
	 * @param file File channel to read from
	 * @param buf Buffer to fill
	 * @param startLocation where in the file to start reading
	 * @return the number of bytes read
	 * @throws IOException if an I/O error occurs
	 */
	public static int readFileFully(FileChannel file, ByteBuffer buf, long startLocation) throws IOException {
		int bytes = 0;
		while (buf.hasRemaining()) {
			int readResult = file.read(buf,startLocation + bytes);
			if (readResult == -1) {
				return bytes;
			}
			bytes += readResult;
		}
		return bytes;
	}

	/**
	 * Read up to <code>length</code> bytes from the file at the given position. The read is clamped to the size of the file;
	 * reading past the end returns only the bytes actually available, which may be none.
	 * @param file File channel to read from
	 * @param startLocation where in the file to start reading
	 * @param length the number of bytes wanted
	 * @return a new buffer, ready for draining, holding the bytes read
	 * @throws IOException if an I/O error occurs
	 */
	public static ByteBuffer readClamped(FileChannel file, long startLocation, int length) throws IOException {
		long available = Math.max(0, file.size() - startLocation);
		int toRead = (int) Math.min(length, available);
		ByteBuffer buf = ByteBuffer.allocate(toRead);
		readFileFully(file, buf, startLocation);
		buf.flip(); // filling -> draining
		return buf;
	}
}
