package me.lwhitelaw.myp.names;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import me.lwhitelaw.myp.AssetException;
import me.lwhitelaw.myp.AssetException.Reason;

/**
 * An immutable table of animation names keyed by body id. Load it once and hand it to whatever needs names.
 * <p>
 * The source is JSON of the form <code>{"Mobs": [{"name": "...", "body": 1, "type": 0}, ...]}</code>.
 * When a body appears twice, the later name wins.
 */
public final class AnimationNames {
	private static final class AnimationList {
		@SerializedName("Mobs")
		List<AnimationEntry> mobs;
	}

	private static final class AnimationEntry {
		String name;
		int body;
	}

	private final Map<Integer, String> namesByBody;

	private AnimationNames(Map<Integer, String> namesByBody) {
		this.namesByBody = Map.copyOf(namesByBody);
	}

	/**
	 * Load a table from JSON.
	 * @param reader the JSON source; not closed
	 * @return the table
	 * @throws AssetException with {@link Reason#INVALID_FORMAT} if the JSON is malformed
	 */
	public static AnimationNames load(Reader reader) {
		AnimationList list;
		try {
			list = new Gson().fromJson(reader, AnimationList.class);
		} catch (JsonParseException ex) {
			throw new AssetException("Malformed animation list", ex, Reason.INVALID_FORMAT);
		}
		Map<Integer, String> names = new HashMap<>();
		if (list != null && list.mobs != null) {
			for (AnimationEntry mob : list.mobs) {
				if (mob == null || mob.name == null) continue;
				names.put(mob.body, mob.name);
			}
		}
		return new AnimationNames(names);
	}

	/**
	 * Load a table from a JSON file.
	 * @param path the file
	 * @return the table
	 * @throws IOException if the file could not be read
	 * @throws AssetException with {@link Reason#INVALID_FORMAT} if the JSON is malformed
	 */
	public static AnimationNames load(Path path) throws IOException {
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return load(reader);
		}
	}

	/**
	 * Get the animation name of a body.
	 * @param body the body id
	 * @return the name, or an empty string if the body is unknown
	 */
	public String nameOf(int body) {
		return namesByBody.getOrDefault(body, "");
	}

	/**
	 * @return the number of known bodies
	 */
	public int size() {
		return namesByBody.size();
	}
}
