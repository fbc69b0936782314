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

/**
 * Exception thrown when an image lacks a metadata value required by an operation.
 */
public class MissingMetadataException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;
	
	private final String key;

	/**
	 * Constructor.
	 * @param key the missing metadata key
	 * @param message
	 */
	public MissingMetadataException(String key, String message) {
		super(message);
		this.key = key;
	}
	
	/**
	 * Get the key of the missing value.
	 * @return
	 */
	public String getKey() {
		return key;
	}

}
