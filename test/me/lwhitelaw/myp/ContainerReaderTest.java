package me.lwhitelaw.myp;

import static me.lwhitelaw.myp.ContainerBuilder.name;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import me.lwhitelaw.myp.AssetException.Reason;
import me.lwhitelaw.myp.util.Buffers;

class ContainerReaderTest {
	@TempDir
	Path dir;

	private static byte[] bytes(String s) {
		return s.getBytes(StandardCharsets.US_ASCII);
	}

	private static String string(ByteBuffer buf) {
		return new String(Buffers.toArray(buf), StandardCharsets.US_ASCII);
	}

	private static List<Integer> list(IntStream stream) {
		return stream.boxed().sorted().collect(Collectors.toList());
	}

	private Path container(ContainerBuilder builder) throws IOException {
		return builder.write(dir.resolve("test.uop"));
	}

	private static void assertReason(Reason reason, AssetException ex) {
		assertEquals(reason, ex.getReason(), ex.getMessage());
	}

	@Test
	void readsEntriesByLogicalIndex() throws IOException {
		Path path = container(new ContainerBuilder()
				.entry(name("test", 0), bytes("zero"))
				.entry(name("test", 1), bytes("one"))
				.entry(name("test", 2), bytes("two")));
		try (ContainerReader reader = new ContainerReader(path)) {
			assertEquals(3, reader.getLength());
			assertEquals("zero", string(reader.read(0)));
			assertEquals("one", string(reader.read(1)));
			assertEquals("two", string(reader.read(2)));
			assertEquals(List.of(0, 1, 2), list(reader.entries()));
			assertEquals(Format.HEADER_MAGIC, reader.getHeader().magic());
			assertEquals(3, reader.getHeader().entryCount());
		}
	}

	@Test
	void patternIsLowerCased() throws IOException {
		Path path = new ContainerBuilder()
				.entry(name("gumpartlegacymul", 0), bytes("gump"))
				.write(dir.resolve("gumpartLegacyMUL.uop"));
		try (ContainerReader reader = new ContainerReader(path)) {
			assertEquals("gump", string(reader.read(0)));
		}
	}

	@Test
	void skipsEntryHeader() throws IOException {
		Path path = container(new ContainerBuilder()
				.entry(NameHash.hash(name("test", 0)), bytes("payload"), Format.COMPRESSION_NONE, 7, 6));
		try (ContainerReader reader = new ContainerReader(path)) {
			assertEquals("payload", string(reader.read(0)));
		}
	}

	@Test
	void decodesCompressedEntries() throws IOException {
		byte[] text = bytes("compressed compressed compressed compressed");
		byte[] zlib = CodecTest.deflate(text);
		byte[] mythic = CodecTest.encodeMythic(bytes("xxxxxxxxxxyz"));
		Path path = container(new ContainerBuilder()
				.entry(NameHash.hash(name("test", 0)), zlib, Format.COMPRESSION_ZLIB, text.length, 0)
				.entry(NameHash.hash(name("test", 1)), mythic, Format.COMPRESSION_MYTHIC, 12, 0));
		try (ContainerReader reader = new ContainerReader(path)) {
			assertArrayEquals(text, Buffers.toArray(reader.read(0)));
			assertEquals("xxxxxxxxxxyz", string(reader.read(1)));
		}
	}

	@Test
	void corruptPayloadIsRecoverable() throws IOException {
		Path path = container(new ContainerBuilder()
				.entry(NameHash.hash(name("test", 0)), new byte[] {1, 2, 3, 4, 5, 6}, Format.COMPRESSION_ZLIB, 100, 0)
				.entry(name("test", 1), bytes("fine")));
		try (ContainerReader reader = new ContainerReader(path)) {
			RecoverableAssetException ex = assertThrows(RecoverableAssetException.class, () -> reader.read(0));
			assertReason(Reason.CODEC_ERROR, ex);
			assertEquals("fine", string(reader.read(1)));
		}
	}

	@Test
	void rejectsIndexOutOfRange() throws IOException {
		Path path = container(new ContainerBuilder()
				.entry(name("test", 0), bytes("zero")));
		try (ContainerReader reader = new ContainerReader(path)) {
			assertReason(Reason.INVALID_INDEX, assertThrows(RecoverableAssetException.class, () -> reader.read(-1)));
			assertReason(Reason.INVALID_INDEX, assertThrows(RecoverableAssetException.class, () -> reader.read(1)));
			assertReason(Reason.INVALID_INDEX, assertThrows(RecoverableAssetException.class, () -> reader.extra(1)));
			assertReason(Reason.INVALID_INDEX, assertThrows(RecoverableAssetException.class, () -> reader.entryAt(Integer.MAX_VALUE)));
		}
	}

	@Test
	void missingEntriesAreSentinels() throws IOException {
		Path path = container(new ContainerBuilder()
				.entryCount(4)
				.entry(name("test", 0), bytes("zero"))
				.tombstone(name("test", 2))
				.entry(name("test", 3), bytes("three")));
		try (ContainerReader reader = new ContainerReader(path)) {
			assertEquals(4, reader.getLength());
			assertNull(reader.entryAt(1));
			assertNotNull(reader.entryAt(2));
			assertReason(Reason.ENTRY_NOT_FOUND, assertThrows(RecoverableAssetException.class, () -> reader.read(1)));
			assertReason(Reason.ENTRY_NOT_FOUND, assertThrows(RecoverableAssetException.class, () -> reader.read(2)));
			assertEquals(List.of(0, 3), list(reader.entries()));
			assertEquals("three", string(reader.read(3)));
		}
	}

	@Test
	void rejectsBadMagic() throws IOException {
		Path path = container(new ContainerBuilder()
				.magic(0x12345678)
				.entry(name("test", 0), bytes("zero")));
		AssetException ex = assertThrows(AssetException.class, () -> new ContainerReader(path));
		assertReason(Reason.INVALID_FORMAT, ex);
	}

	@Test
	void rejectsTruncatedHeader() throws IOException {
		Path path = Files.write(dir.resolve("test.uop"), new byte[] {'M', 'Y', 'P', 0, 5, 0, 0, 0, 0, 0});
		assertReason(Reason.INVALID_FORMAT, assertThrows(AssetException.class, () -> new ContainerReader(path)));
	}

	@Test
	void rejectsMissingFile() {
		Path path = dir.resolve("absent.uop");
		assertReason(Reason.IO_ERROR, assertThrows(AssetException.class, () -> new ContainerReader(path)));
	}

	@Test
	void rejectsTruncatedBlockHeader() throws IOException {
		ByteBuffer buf = ByteBuffer.allocate(Format.HEADER_SIZE + 4).order(ByteOrder.LITTLE_ENDIAN);
		buf.putInt(Format.HEADER_MAGIC).putInt(5).putInt(0).putLong(Format.HEADER_SIZE).putInt(100).putInt(1).putInt(1);
		Path path = Files.write(dir.resolve("test.uop"), buf.array());
		assertReason(Reason.INVALID_FORMAT, assertThrows(AssetException.class, () -> new ContainerReader(path)));
	}

	@Test
	void strictModeRejectsUnknownHashes() throws IOException {
		Path path = container(new ContainerBuilder()
				.entry(name("test", 0), bytes("zero"))
				.entry(name("other", 0), bytes("stray")));
		try (ContainerReader reader = new ContainerReader(path)) {
			assertEquals("zero", string(reader.read(0)));
			assertEquals("stray", string(reader.readByName(name("other", 0))));
		}
		AssetException ex = assertThrows(AssetException.class,
				() -> new ContainerReader(path, ContainerOptions.defaults().withStrict()));
		assertReason(Reason.INVALID_FORMAT, ex);
	}

	@Test
	void extraHeaderIsSkippedAndExposed() throws IOException {
		ByteBuffer payload = ByteBuffer.allocate(12).order(ByteOrder.LITTLE_ENDIAN);
		payload.putInt(0x11223344).putInt(5).put(bytes("data"));
		Path path = container(new ContainerBuilder()
				.entry(NameHash.hash(name("test", 0)), payload.array(), Format.COMPRESSION_NONE, 4, 2)
				.entry(NameHash.hash(name("test", 1)), bytes("raw!"), Format.COMPRESSION_NO_EXTRA, 4, 0));
		try (ContainerReader reader = new ContainerReader(path, ContainerOptions.defaults().withExtra())) {
			assertEquals("data", string(reader.read(0)));
			assertEquals(0x11223344L | (5L << 32), reader.extra(0));
			LogicalEntry entry = reader.entryAt(0);
			assertEquals(0x11223344, entry.extra1());
			assertEquals(5, entry.extra2());
			assertEquals(4, entry.length());
			// tag 3 entries carry no extra header
			assertEquals("raw!", string(reader.read(1)));
			assertEquals(Format.INVALID_EXTRA, reader.entryAt(1).extra1());
		}
	}

	@Test
	void extraHeaderIsOnlyReadForMatchedEntries() throws IOException {
		ByteBuffer payload = ByteBuffer.allocate(12).order(ByteOrder.LITTLE_ENDIAN);
		payload.putInt(7).putInt(8).put(bytes("data"));
		Path path = container(new ContainerBuilder()
				.entryCount(1)
				.entry(name("test", 0), payload.array())
				.entry(name("other", 0), bytes("zz")));
		try (ContainerReader reader = new ContainerReader(path, ContainerOptions.defaults().withExtra())) {
			assertEquals("data", string(reader.read(0)));
			assertEquals(7L | (8L << 32), reader.extra(0));
			assertEquals(List.of(0), list(reader.entries()));
			// unmatched entries keep their whole payload
			assertEquals("zz", string(reader.readByName(name("other", 0))));
		}
		AssetException ex = assertThrows(AssetException.class,
				() -> new ContainerReader(path, ContainerOptions.defaults().withExtra().withStrict()));
		assertReason(Reason.INVALID_FORMAT, ex);
	}

	@Test
	void extrasAreInvalidWithoutExtraOption() throws IOException {
		Path path = container(new ContainerBuilder()
				.entry(name("test", 0), bytes("zero")));
		try (ContainerReader reader = new ContainerReader(path)) {
			long invalid = Integer.toUnsignedLong(Format.INVALID_EXTRA);
			assertEquals(invalid | (invalid << 32), reader.extra(0));
		}
	}

	@Test
	void extraOptionRejectsTinyPayloads() throws IOException {
		Path path = container(new ContainerBuilder()
				.entry(name("test", 0), bytes("tiny")));
		AssetException ex = assertThrows(AssetException.class,
				() -> new ContainerReader(path, ContainerOptions.defaults().withExtra()));
		assertReason(Reason.INVALID_FORMAT, ex);
	}

	@Test
	void readIsClampedToEndOfFile() throws IOException {
		Path path = container(new ContainerBuilder()
				.entryWithSize(name("test", 0), bytes("tail"), 1000));
		try (ContainerReader reader = new ContainerReader(path)) {
			assertEquals("tail", string(reader.read(0)));
		}
	}

	@Test
	void recordsPastEndOfFileAreSkipped() throws IOException {
		Path path = container(new ContainerBuilder()
				.entry(name("test", 0), bytes("zero"))
				.entry(name("test", 1), bytes("one"))
				.missingRecords(3));
		try (ContainerReader reader = new ContainerReader(path)) {
			assertEquals(List.of(0, 1), list(reader.entries()));
			assertEquals("zero", string(reader.read(0)));
			assertEquals("one", string(reader.read(1)));
		}
	}

	@Test
	void rejectsEntryCountLargerThanFile() throws IOException {
		Path path = container(new ContainerBuilder()
				.entryCount(0x7FFFFFF0)
				.entry(name("test", 0), bytes("zero")));
		assertReason(Reason.INVALID_FORMAT, assertThrows(AssetException.class, () -> new ContainerReader(path)));
		// an explicit length is taken as given
		try (ContainerReader reader = new ContainerReader(path, ContainerOptions.defaults().withLength(1))) {
			assertEquals("zero", string(reader.read(0)));
		}
	}

	@Test
	void placeholdersAreSkipped() throws IOException {
		Path path = container(new ContainerBuilder()
				.entryCount(2)
				.placeholder()
				.entry(name("test", 1), bytes("one"))
				.placeholder());
		try (ContainerReader reader = new ContainerReader(path)) {
			assertEquals(List.of(1), list(reader.entries()));
			assertEquals("one", string(reader.read(1)));
			assertNull(reader.locateEntryForHash(0));
		}
	}

	@Test
	void laterEntryWinsOnHashCollision() throws IOException {
		Path path = container(new ContainerBuilder()
				.entryCount(1)
				.entry(name("test", 0), bytes("old"))
				.newBlock()
				.entry(name("test", 0), bytes("new")));
		try (ContainerReader reader = new ContainerReader(path)) {
			assertEquals("new", string(reader.read(0)));
			assertEquals("new", string(reader.readByName(name("test", 0))));
		}
	}

	@Test
	void followsBlockChain() throws IOException {
		Path path = container(new ContainerBuilder()
				.blockCapacity(2)
				.entry(name("test", 0), bytes("a"))
				.entry(name("test", 1), bytes("b"))
				.newBlock()
				.entry(name("test", 2), bytes("c"))
				.entry(name("test", 3), bytes("d"))
				.newBlock()
				.entry(name("test", 4), bytes("e")));
		try (ContainerReader reader = new ContainerReader(path)) {
			assertEquals(5, reader.getLength());
			assertEquals(List.of(0, 1, 2, 3, 4), list(reader.entries()));
			assertEquals("e", string(reader.read(4)));
		}
	}

	@Test
	void lookupByHashAndName() throws IOException {
		Path path = container(new ContainerBuilder()
				.entry(name("test", 0), bytes("zero")));
		try (ContainerReader reader = new ContainerReader(path)) {
			long hash = NameHash.hash(name("test", 0));
			RawEntry raw = reader.locateEntryForHash(hash);
			assertNotNull(raw);
			assertEquals(hash, raw.getNameHash());
			assertEquals(4, raw.getCompressedSize());
			assertNull(reader.locateEntryForHash(NameHash.hash(name("test", 1))));
			assertEquals("zero", string(reader.readByHash(hash)));
			assertEquals("zero", string(reader.readByName(name("test", 0))));
			assertReason(Reason.ENTRY_NOT_FOUND,
					assertThrows(RecoverableAssetException.class, () -> reader.readByName(name("test", 9))));
		}
	}

	@Test
	void lengthOptionOverridesHeader() throws IOException {
		Path path = container(new ContainerBuilder()
				.entry(name("test", 0), bytes("zero"))
				.entry(name("test", 1), bytes("one"))
				.entry(name("test", 2), bytes("two")));
		try (ContainerReader reader = new ContainerReader(path, ContainerOptions.defaults().withLength(2))) {
			assertEquals(2, reader.getLength());
			assertEquals(List.of(0, 1), list(reader.entries()));
			// still reachable by name
			assertEquals("two", string(reader.readByName(name("test", 2))));
		}
	}

	@Test
	void indexLengthBoundsResolvedIndices() throws IOException {
		Path path = container(new ContainerBuilder()
				.entry(name("test", 0), bytes("zero"))
				.entry(name("test", 2), bytes("two"))
				.entryCount(3));
		try (ContainerReader reader = new ContainerReader(path, ContainerOptions.defaults().withIndexLength(2))) {
			assertEquals("two", string(reader.read(2)));
		}
		AssetException ex = assertThrows(AssetException.class,
				() -> new ContainerReader(path, ContainerOptions.defaults().withIndexLength(1)));
		assertReason(Reason.INVALID_FORMAT, ex);
	}

	@Test
	void customExtension() throws IOException {
		Path path = container(new ContainerBuilder()
				.entry(Format.entryName("test", 0, ".tga"), bytes("image")));
		try (ContainerReader reader = new ContainerReader(path, ContainerOptions.defaults().withExtension("tga"))) {
			assertEquals("image", string(reader.read(0)));
		}
		try (ContainerReader reader = new ContainerReader(path)) {
			assertEquals(List.of(), list(reader.entries()));
		}
	}

	@Test
	void rejectsBlockChainLoop() throws IOException {
		Path path = container(new ContainerBuilder()
				.entry(name("test", 0), bytes("zero"))
				.newBlock()
				.entry(name("test", 1), bytes("one"))
				.loop());
		assertReason(Reason.INVALID_FORMAT, assertThrows(AssetException.class, () -> new ContainerReader(path)));
	}

	@Test
	void rejectsOverfullBlock() throws IOException {
		Path path = container(new ContainerBuilder()
				.blockCapacity(1)
				.entry(name("test", 0), bytes("zero"))
				.entry(name("test", 1), bytes("one")));
		assertReason(Reason.INVALID_FORMAT, assertThrows(AssetException.class, () -> new ContainerReader(path)));
	}

	@Test
	void closeIsIdempotent() throws IOException {
		Path path = container(new ContainerBuilder()
				.entry(name("test", 0), bytes("zero")));
		ContainerReader reader = new ContainerReader(path);
		reader.close();
		reader.close();
		assertReason(Reason.READER_CLOSED, assertThrows(RecoverableAssetException.class, () -> reader.read(0)));
		assertReason(Reason.READER_CLOSED, assertThrows(RecoverableAssetException.class, () -> reader.readByName(name("test", 0))));
		assertReason(Reason.READER_CLOSED, assertThrows(RecoverableAssetException.class, reader::getLength));
		assertEquals(0, reader.entries().count());
	}

	@Test
	void concurrentReads() throws IOException {
		ContainerBuilder builder = new ContainerBuilder();
		for (int i = 0; i < 64; i++) {
			builder.entry(name("test", i), bytes("entry" + i));
		}
		Path path = container(builder);
		try (ContainerReader reader = new ContainerReader(path)) {
			IntStream.range(0, 64 * 16).parallel().forEach(i -> {
				int index = i % 64;
				assertEquals("entry" + index, string(reader.read(index)));
			});
		}
	}
}
