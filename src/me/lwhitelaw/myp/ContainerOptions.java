package me.lwhitelaw.myp;

/**
 * Settings used when opening a container. Instances are immutable; the <code>with</code> methods return modified copies.
 * @param length number of logical entries to resolve, or 0 to use the entry count in the container header
 * @param indexLength the highest logical index an entry may resolve to, unsigned
 * @param extension the extension of the synthetic entry names, including its leading dot
 * @param hasExtra whether payloads start with an 8-byte extra-data header that is skipped and exposed as extras
 * @param strict whether an entry whose hash matches no expected name fails the open
 */
public record ContainerOptions(int length, long indexLength, String extension, boolean hasExtra, boolean strict) {
	private static final ContainerOptions DEFAULTS = new ContainerOptions(0, 0xFFFFFFFFL, Format.DEFAULT_EXTENSION, false, false);

	public ContainerOptions {
		if (length < 0) throw new IllegalArgumentException("length is negative: " + length);
		if (extension == null) throw new NullPointerException("extension is null");
		if (!extension.startsWith(".")) extension = "." + extension;
	}

	public static ContainerOptions defaults() {
		return DEFAULTS;
	}

	public ContainerOptions withLength(int length) {
		return new ContainerOptions(length, indexLength, extension, hasExtra, strict);
	}

	public ContainerOptions withIndexLength(long indexLength) {
		return new ContainerOptions(length, indexLength, extension, hasExtra, strict);
	}

	public ContainerOptions withExtension(String extension) {
		return new ContainerOptions(length, indexLength, extension, hasExtra, strict);
	}

	public ContainerOptions withExtra() {
		return new ContainerOptions(length, indexLength, extension, true, strict);
	}

	public ContainerOptions withStrict() {
		return new ContainerOptions(length, indexLength, extension, hasExtra, true);
	}
}
