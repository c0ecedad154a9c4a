package me.lwhitelaw.myp;

/**
 * Thrown when a problem has occurred reading an asset file. Readers are encouraged to provide a reason programmatically
 * in addition to the standard exception message, so callers can tell "does not exist" apart from "out of range".
 * Unless thrown as {@link RecoverableAssetException}, the reader may not be usable after this exception is thrown.
 */
public class AssetException extends RuntimeException {
	/**
	 * A reason broadly indicating why the exception was thrown.
	 */
	public static enum Reason {
		/**
		 * The reason is not known or not of any other type in this enum.
		 */
		UNKNOWN,
		/**
		 * The file is not in the expected format: the magic value is wrong, the header is truncated
		 * or the block chain is malformed.
		 */
		INVALID_FORMAT,
		/**
		 * The requested index lies outside the entry table.
		 */
		INVALID_INDEX,
		/**
		 * The requested index is in range, but no data backs it.
		 */
		ENTRY_NOT_FOUND,
		/**
		 * The reader was closed before or during the operation.
		 */
		READER_CLOSED,
		/**
		 * The entry's payload is corrupt or truncated and could not be decoded.
		 */
		CODEC_ERROR,
		/**
		 * None of the candidate files for an asset could be found.
		 */
		NO_VALID_SOURCE,
		/**
		 * There was an I/O error in the backing file.
		 */
		IO_ERROR
	}

	private final Reason reason;

	public AssetException(String message, Reason reason) {
		super(message);
		this.reason = reason;
	}

	public AssetException(String message, Exception cause) {
		super(message, cause);
		reason = Reason.UNKNOWN;
	}

	public AssetException(String message, Exception cause, Reason reason) {
		super(message, cause);
		this.reason = reason;
	}

	public Reason getReason() {
		return reason;
	}
}
