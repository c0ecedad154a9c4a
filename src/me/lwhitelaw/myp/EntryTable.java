package me.lwhitelaw.myp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static me.lwhitelaw.myp.Format.*;

/**
 * The parsed entries of a container. Raw entries are stored once, in the order they were read from the block chain,
 * and reached through two indexes: by name hash, and by dense logical index. Not thread-safe while being built;
 * read-only afterwards.
 */
final class EntryTable {
	private static final int UNBOUND = -1;

	private final boolean hasExtra;
	private final List<RawEntry> arena;
	private long[] extras; // parallel to arena, only meaningful for positions in skipped
	private final BitSet skipped; // arena positions whose extra header was read and is skipped
	private final Map<Long, Integer> byHash;
	private final int[] slots;

	/**
	 * Create an empty table.
	 * @param length number of logical slots
	 * @param hasExtra whether payloads carry an inline extra-data header
	 */
	EntryTable(int length, boolean hasExtra) {
		this.hasExtra = hasExtra;
		arena = new ArrayList<>();
		extras = new long[16];
		skipped = new BitSet();
		byHash = new HashMap<>();
		slots = new int[length];
		Arrays.fill(slots, UNBOUND);
	}

	/**
	 * Store a raw entry without an extra header; its whole payload is data. A later entry with the same hash replaces
	 * the earlier one in the hash index.
	 * @param raw the entry
	 * @return the entry's position in the arena
	 */
	int add(RawEntry raw) {
		int position = arena.size();
		arena.add(raw);
		byHash.put(raw.getNameHash(), position);
		return position;
	}

	/**
	 * Store a raw entry whose payload starts with an extra header, which reads will skip.
	 * @param raw the entry
	 * @param extra the packed extra words read from the payload
	 * @return the entry's position in the arena
	 */
	int addWithExtra(RawEntry raw, long extra) {
		int position = arena.size();
		arena.add(raw);
		if (position >= extras.length) extras = Arrays.copyOf(extras, Math.max(position + 1, extras.length * 2));
		extras[position] = extra;
		skipped.set(position);
		byHash.put(raw.getNameHash(), position);
		return position;
	}

	/**
	 * Bind every logical slot to the stored entry carrying its expected hash. Slots without one stay sentinels.
	 * @param expectedHashes the expected name hash for each logical index
	 */
	void bind(long[] expectedHashes) {
		for (int i = 0; i < slots.length; i++) {
			Integer position = byHash.get(expectedHashes[i]);
			slots[i] = position == null ? UNBOUND : position;
		}
	}

	/**
	 * Test whether a raw entry's payload starts with an inline extra-data header.
	 * @param raw the entry
	 * @return true if the header is skipped
	 */
	boolean skipsExtra(RawEntry raw) {
		return hasExtra && raw.getCompressionTag() != COMPRESSION_NO_EXTRA;
	}

	/**
	 * @return the number of logical slots
	 */
	int length() {
		return slots.length;
	}

	/**
	 * @return the number of stored raw entries
	 */
	int storedCount() {
		return arena.size();
	}

	/**
	 * @return the number of logical slots bound to a stored entry
	 */
	int boundCount() {
		int bound = 0;
		for (int slot : slots) {
			if (slot != UNBOUND) bound++;
		}
		return bound;
	}

	/**
	 * Resolve a logical slot. The index is not checked.
	 * @param index the logical index
	 * @return the entry, or null if the slot is a sentinel
	 */
	LogicalEntry entryAt(int index) {
		int position = slots[index];
		if (position == UNBOUND) return null;
		return resolve(position);
	}

	/**
	 * Test whether a logical slot holds readable data. The index is not checked.
	 * @param index the logical index
	 * @return true if reading the slot can succeed
	 */
	boolean isValid(int index) {
		LogicalEntry entry = entryAt(index);
		return entry != null && entry.isValid();
	}

	/**
	 * Find a stored entry by name hash, bypassing the logical index.
	 * @param hash the name hash
	 * @return the raw entry, or null if not present
	 */
	RawEntry locate(long hash) {
		Integer position = byHash.get(hash);
		return position == null ? null : arena.get(position);
	}

	/**
	 * Resolve a stored entry by name hash, bypassing the logical index.
	 * @param hash the name hash
	 * @return the entry, or null if not present
	 */
	LogicalEntry resolveHash(long hash) {
		Integer position = byHash.get(hash);
		return position == null ? null : resolve(position);
	}

	private LogicalEntry resolve(int position) {
		RawEntry raw = arena.get(position);
		int tag = raw.getCompressionTag() & 0xFF;
		if (skipped.get(position)) {
			long extra = extras[position];
			return new LogicalEntry(raw.getPayloadOffset() + EXTRA_SIZE, raw.getCompressedSize() - EXTRA_SIZE,
					raw.getDecompressedSize(), (int) extra, (int) (extra >>> 32), tag);
		}
		return new LogicalEntry(raw.getPayloadOffset(), raw.getCompressedSize(), raw.getDecompressedSize(),
				INVALID_EXTRA, INVALID_EXTRA, tag);
	}
}
