/*-
 * #%L
 * This file is part of Pixl.
 * %%
 * Copyright (C) 2026 Pixl developers
 * %%
 * Pixl is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * Pixl is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with Pixl.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package pixl.lib.io;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Helper methods for working with Gson.
 */
public class GsonTools {
	
	private static final Gson gson = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setPrettyPrinting()
			.create();
	
	/**
	 * Get a shared Gson instance, with pretty printing enabled.
	 * @return
	 */
	public static Gson getInstance() {
		return gson;
	}
	
	/**
	 * Parse a flat JSON object into a map of strings, suitable for updating a parameter list.
	 * <p>
	 * Primitive values are converted to their string form; nested objects and arrays are rejected.
	 * 
	 * @param json
	 * @return
	 * @throws JsonParseException if the input is not a JSON object of primitive values
	 */
	public static Map<String, String> readParameterMap(String json) {
		return toParameterMap(JsonParser.parseString(json));
	}
	
	/**
	 * Parse a flat JSON object from a reader.
	 * @param reader
	 * @return
	 * @see #readParameterMap(String)
	 */
	public static Map<String, String> readParameterMap(Reader reader) {
		return toParameterMap(JsonParser.parseReader(reader));
	}
	
	/**
	 * Parse a flat JSON object from a UTF-8 file.
	 * @param path
	 * @return
	 * @throws IOException
	 * @see #readParameterMap(String)
	 */
	public static Map<String, String> readParameterMap(Path path) throws IOException {
		try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return readParameterMap(reader);
		}
	}
	
	private static Map<String, String> toParameterMap(JsonElement element) {
		if (!element.isJsonObject())
			throw new JsonParseException("Expected a JSON object, but got " + element);
		JsonObject obj = element.getAsJsonObject();
		Map<String, String> map = new LinkedHashMap<>();
		for (Entry<String, JsonElement> entry : obj.entrySet()) {
			JsonElement value = entry.getValue();
			if (!value.isJsonPrimitive())
				throw new JsonParseException("Parameter '" + entry.getKey() + "' must be a number, string or boolean, but got " + value);
			map.put(entry.getKey(), value.getAsString());
		}
		return map;
	}

}
