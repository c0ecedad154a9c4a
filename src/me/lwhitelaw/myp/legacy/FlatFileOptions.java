package me.lwhitelaw.myp.legacy;

/**
 * Settings used when opening a legacy data file. Instances are immutable; the <code>with</code> methods return modified copies.
 * @param entrySize size of one index record in bytes; only the first 12 bytes of each record are used
 * @param layout how to find entries in a data file opened without an index, or null to expose the whole file as entry 0
 */
public record FlatFileOptions(int entrySize, LegacyLayout layout) {
	public static final int DEFAULT_ENTRY_SIZE = 12;
	private static final FlatFileOptions DEFAULTS = new FlatFileOptions(DEFAULT_ENTRY_SIZE, null);

	public FlatFileOptions {
		if (entrySize < DEFAULT_ENTRY_SIZE) throw new IllegalArgumentException("Index record size is too small: " + entrySize);
	}

	public static FlatFileOptions defaults() {
		return DEFAULTS;
	}

	public FlatFileOptions withEntrySize(int entrySize) {
		return new FlatFileOptions(entrySize, layout);
	}

	public FlatFileOptions withChunks(int chunkSize) {
		return new FlatFileOptions(entrySize, LegacyLayout.chunks(chunkSize));
	}

	public FlatFileOptions withLayout(LegacyLayout layout) {
		return new FlatFileOptions(entrySize, layout);
	}
}
