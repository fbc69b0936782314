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

package pixl.lib.images;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Numeric metadata values associated with an image, such as the exposure time of a photograph.
 */
public class ImageMetadata {
	
	/**
	 * Key for the exposure time, in seconds.
	 */
	public static final String EXPOSURE_TIME = "ExposureTime";
	
	private final Map<String, Double> values = new LinkedHashMap<>();
	
	/**
	 * Create an empty metadata store.
	 */
	public ImageMetadata() {}
	
	/**
	 * Create a copy of an existing metadata store.
	 * @param metadata
	 */
	public ImageMetadata(ImageMetadata metadata) {
		values.putAll(metadata.values);
	}
	
	/**
	 * Get a numeric value, if present.
	 * @param key
	 * @return
	 */
	public OptionalDouble getDouble(String key) {
		Double value = values.get(key);
		return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
	}
	
	/**
	 * Set a numeric value.
	 * @param key
	 * @param value
	 * @return this metadata, for chaining
	 */
	public ImageMetadata putDouble(String key, double value) {
		values.put(Objects.requireNonNull(key, "Metadata key must not be null"), value);
		return this;
	}
	
	/**
	 * Remove a value.
	 * @param key
	 * @return true if a value was removed
	 */
	public boolean remove(String key) {
		return values.remove(key) != null;
	}
	
	/**
	 * Query whether a value exists for the key.
	 * @param key
	 * @return
	 */
	public boolean containsKey(String key) {
		return values.containsKey(key);
	}
	
	/**
	 * Get an unmodifiable view of all keys, in insertion order.
	 * @return
	 */
	public Set<String> keys() {
		return Collections.unmodifiableSet(values.keySet());
	}
	
	@Override
	public String toString() {
		return "ImageMetadata " + values;
	}

}
