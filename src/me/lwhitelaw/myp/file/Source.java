package me.lwhitelaw.myp.file;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import me.lwhitelaw.myp.AssetException;
import me.lwhitelaw.myp.AssetException.Reason;
import me.lwhitelaw.myp.AssetReader;
import me.lwhitelaw.myp.ContainerReader;
import me.lwhitelaw.myp.Format;
import me.lwhitelaw.myp.legacy.FlatFileReader;

/**
 * The backing files chosen for a {@link UnifiedFile}, and how to open them.
 * @param kind the kind of backing
 * @param path the container or data file; for {@link Kind#NONE}, the first candidate
 * @param indexPath the index file, or null
 * @param initializer opens the reader; for {@link Kind#NONE}, always fails
 */
public record Source(Kind kind, Path path, Path indexPath, Initializer initializer) {
	public static enum Kind {
		/**
		 * A MYP container.
		 */
		CONTAINER,
		/**
		 * A legacy data file with its index file.
		 */
		INDEXED,
		/**
		 * A legacy data file without an index file.
		 */
		UNINDEXED,
		/**
		 * No usable file was found.
		 */
		NONE
	}

	/**
	 * Opens the reader for a source. Called at most once per successful initialisation.
	 */
	@FunctionalInterface
	public interface Initializer {
		AssetReader open() throws IOException;
	}

	/**
	 * Choose the backing files for an asset among the candidate names, in order of preference: a container; a legacy data
	 * file with an index file, named either <code>*idx.mul</code> (or <code>staidx*</code>) or <code>*.idx</code>;
	 * a legacy data file alone. Finding nothing is not an error here: the returned source fails when opened.
	 * @param basePath the directory holding the files
	 * @param fileNames the candidate file names
	 * @param options the options to open with
	 * @return the chosen source
	 * @throws IllegalArgumentException if there are no candidate names
	 */
	public static Source detect(Path basePath, List<String> fileNames, FileOptions options) {
		if (fileNames.isEmpty()) throw new IllegalArgumentException("no candidate file names");

		for (String fileName : fileNames) {
			Path path = basePath.resolve(fileName);
			if (fileName.endsWith(Format.CONTAINER_EXTENSION) && Files.isRegularFile(path)) {
				return new Source(Kind.CONTAINER, path, null, () -> new ContainerReader(path, options.effectiveContainerOptions()));
			}
		}

		Path dataPath = null;
		Path indexPath = null;
		for (String fileName : fileNames) {
			Path path = basePath.resolve(fileName);
			if (!Files.isRegularFile(path)) continue;
			if (isIndexName(fileName)) {
				indexPath = path;
			} else if (fileName.endsWith(".mul")) {
				dataPath = path;
			}
		}

		if (dataPath != null && indexPath != null) {
			Path data = dataPath;
			Path index = indexPath;
			return new Source(Kind.INDEXED, data, index, () -> FlatFileReader.open(data, index, options.flat()));
		}
		if (dataPath != null) {
			Path data = dataPath;
			return new Source(Kind.UNINDEXED, data, null, () -> FlatFileReader.openWithoutIndex(data, options.flat()));
		}

		String message = "Could not find valid files among " + fileNames + " in " + basePath;
		return new Source(Kind.NONE, basePath.resolve(fileNames.get(0)), null, () -> {
			throw new AssetException(message, Reason.NO_VALID_SOURCE);
		});
	}

	private static boolean isIndexName(String fileName) {
		return fileName.startsWith("staidx") || fileName.endsWith("idx.mul") || fileName.endsWith(".idx");
	}
}
