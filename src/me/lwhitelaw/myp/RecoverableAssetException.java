package me.lwhitelaw.myp;

/**
 * Thrown when a problem has occurred but the reader is still usable. Only the single request that raised it is affected.
 */
public class RecoverableAssetException extends AssetException {
	public RecoverableAssetException(String message, Reason reason) {
		super(message, reason);
	}

	public RecoverableAssetException(String message, Exception cause, Reason reason) {
		super(message, cause, reason);
	}
}
