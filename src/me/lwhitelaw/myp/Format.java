package me.lwhitelaw.myp;

/**
 * Constant values describing important values in a MYP container, along with utility methods to build entry names.
 * All values are stored in a container little-endian.
 */
public class Format {
	/*
	 * File format is as follows. See declarations for descriptions
	 *
	 * File
	 * {
	 * 		// Header
	 * 		uint32 magic = "MYP\0";
	 * 		uint32 version;
	 * 		uint32 signature;
	 * 		uint64 firstBlockOffset;
	 * 		uint32 blockCapacity;      // maximum number of entries in one block
	 * 		uint32 entryCount;         // total number of entries in the container
	 * 		// Anywhere after the header, pointed to by firstBlockOffset and chained by nextBlockOffset
	 * 		Block[] blocks;
	 * 		// Payloads, pointed to by entries
	 * 		byte[] data;
	 * }
	 *
	 * Block
	 * {
	 * 		uint32 fileCount;
	 * 		uint64 nextBlockOffset;     // zero terminates the chain
	 * 		Entry[fileCount] entries;
	 * }
	 *
	 * Entry
	 * {
	 * 		uint64 offset;              // zero marks an unused slot
	 * 		uint32 headerSize;          // bytes to skip at offset before the payload starts
	 * 		uint32 compressedSize;
	 * 		uint32 decompressedSize;
	 * 		uint64 nameHash;            // NameHash of "build/<pattern>/<index>.<ext>"
	 * 		uint32 checksum;            // not verified
	 * 		int16 compressionTag;       // 0 = none, 1 = zlib, 2 = mythic RLE
	 * }
	 */
	// Offsets into the container header
	public static final int HEADER_OFFS_MAGIC = 0; // Magic value (should be HEADER_MAGIC)
	public static final int HEADER_OFFS_VERSION = 4;
	public static final int HEADER_OFFS_SIGNATURE = 8;
	public static final int HEADER_OFFS_FIRST_BLOCK = 12; // Unsigned 64-bit absolute position of the first block
	public static final int HEADER_OFFS_BLOCK_CAPACITY = 20;
	public static final int HEADER_OFFS_ENTRY_COUNT = 24;
	public static final int HEADER_SIZE = 28;
	// Offsets into a block header
	public static final int BLOCK_OFFS_FILE_COUNT = 0;
	public static final int BLOCK_OFFS_NEXT_BLOCK = 4;
	public static final int BLOCK_HEADER_SIZE = 12;
	// Offsets into an entry record
	public static final int ENTRY_OFFS_OFFSET = 0;
	public static final int ENTRY_OFFS_HEADER_SIZE = 8;
	public static final int ENTRY_OFFS_COMPRESSED_SIZE = 12;
	public static final int ENTRY_OFFS_DECOMPRESSED_SIZE = 16;
	public static final int ENTRY_OFFS_HASH = 20;
	public static final int ENTRY_OFFS_CHECKSUM = 28;
	public static final int ENTRY_OFFS_COMPRESSION = 32;
	public static final int ENTRY_SIZE = 34;
	// Size of the inline extra-data header found in front of payloads of "has-extra" containers
	public static final int EXTRA_SIZE = 8;
	// Magic values
	public static final int HEADER_MAGIC = 0x0050594D; // "MYP\0", start of a file
	public static final int COMPRESSION_NONE = 0;
	public static final int COMPRESSION_ZLIB = 1;
	public static final int COMPRESSION_MYTHIC = 2;
	// Entries with this tag never carry an inline extra-data header
	public static final int COMPRESSION_NO_EXTRA = 3;
	// Sentinels
	public static final long TOMBSTONE_OFFSET = 0xFFFFFFFFL;
	public static final int INVALID_EXTRA = 0x0FFFFFFF;
	public static final String DEFAULT_EXTENSION = ".dat";
	public static final String CONTAINER_EXTENSION = ".uop";

	/**
	 * Build the synthetic name of the logical entry at the given index, the name whose {@link NameHash} locates
	 * the entry in the container.
	 * @param pattern the lower-cased container file name without its extension
	 * @param index the logical index
	 * @param extension the extension, including its leading dot
	 * @return a name of the form <code>build/&lt;pattern&gt;/&lt;8-digit index&gt;&lt;extension&gt;</code>
	 */
	public static String entryName(String pattern, int index, String extension) {
		return String.format("build/%s/%08d%s", pattern, Integer.toUnsignedLong(index), extension);
	}

	/**
	 * Derive the name pattern of a container from its file name: the name without its extension, lower-cased.
	 * @param fileName the file name of the container
	 * @return the name pattern
	 */
	public static String patternOf(String fileName) {
		int dot = fileName.lastIndexOf('.');
		String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
		return stem.toLowerCase(java.util.Locale.ROOT);
	}
}
