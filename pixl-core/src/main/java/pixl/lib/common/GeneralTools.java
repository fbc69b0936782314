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

package pixl.lib.common;

import java.util.Locale;
import java.util.Optional;

/**
 * A collection of generally useful static methods.
 */
public final class GeneralTools {
	
	// Suppressed default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}
	
	/**
	 * Get the file extension of a name, lower-cased and without the dot, if one is present.
	 * 
	 * @param name
	 * @return
	 */
	public static Optional<String> getExtension(String name) {
		int ind = name.lastIndexOf('.');
		int indSep = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
		if (ind <= indSep + 1 || ind == name.length() - 1)
			return Optional.empty();
		return Optional.of(name.substring(ind + 1).toLowerCase(Locale.ROOT));
	}
	
	/**
	 * Clip a value to be within a specific range.
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static int clipValue(final int value, final int min, final int max) {
		return value < min ? min : (value > max ? max : value);
	}

}
