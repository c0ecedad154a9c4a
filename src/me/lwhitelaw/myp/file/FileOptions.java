package me.lwhitelaw.myp.file;

import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import me.lwhitelaw.myp.ContainerOptions;
import me.lwhitelaw.myp.legacy.FlatFileOptions;
import me.lwhitelaw.myp.legacy.LegacyLayout;
import me.lwhitelaw.myp.util.Buffers;

/**
 * Settings for a {@link UnifiedFile}, covering whichever backing format is found. Instances are immutable; the
 * <code>with</code> methods return modified copies.
 * @param count the expected number of entries in a container, or 0 to use the container header
 * @param container options for a container
 * @param flat options for a legacy data file
 * @param patches patches applied when the file is constructed
 */
public record FileOptions(int count, ContainerOptions container, FlatFileOptions flat, Map<Integer, ByteBuffer> patches) {
	private static final FileOptions DEFAULTS = new FileOptions(0, ContainerOptions.defaults(), FlatFileOptions.defaults(), Map.of());

	public FileOptions {
		if (count < 0) throw new IllegalArgumentException("count is negative: " + count);
		patches = Collections.unmodifiableMap(new HashMap<>(patches));
	}

	public static FileOptions defaults() {
		return DEFAULTS;
	}

	/**
	 * @return the container options with the entry count applied
	 */
	public ContainerOptions effectiveContainerOptions() {
		return count > 0 ? container.withLength(count) : container;
	}

	public FileOptions withCount(int count) {
		return new FileOptions(count, container, flat, patches);
	}

	public FileOptions withIndexLength(long indexLength) {
		return new FileOptions(count, container.withIndexLength(indexLength), flat, patches);
	}

	public FileOptions withExtension(String extension) {
		return new FileOptions(count, container.withExtension(extension), flat, patches);
	}

	public FileOptions withExtra() {
		return new FileOptions(count, container.withExtra(), flat, patches);
	}

	public FileOptions withStrict() {
		return new FileOptions(count, container.withStrict(), flat, patches);
	}

	public FileOptions withEntrySize(int entrySize) {
		return new FileOptions(count, container, flat.withEntrySize(entrySize), patches);
	}

	public FileOptions withChunks(int chunkSize) {
		return new FileOptions(count, container, flat.withChunks(chunkSize), patches);
	}

	public FileOptions withLayout(LegacyLayout layout) {
		return new FileOptions(count, container, flat.withLayout(layout), patches);
	}

	/**
	 * Add a patch. The buffer's remaining data is copied.
	 * @param index the logical index to override
	 * @param data the replacement data
	 * @return the modified options
	 */
	public FileOptions withPatch(int index, ByteBuffer data) {
		Map<Integer, ByteBuffer> modified = new HashMap<>(patches);
		modified.put(index, Buffers.copyOf(data));
		return new FileOptions(count, container, flat, modified);
	}
}
