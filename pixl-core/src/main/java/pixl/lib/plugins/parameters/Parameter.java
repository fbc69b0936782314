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

package pixl.lib.plugins.parameters;

import java.io.Serializable;
import java.util.Locale;

/**
 * Interface defining a typed algorithm parameter, with a default value and an optional current value.
 *
 * @param <S>
 */
public interface Parameter<S> extends Serializable {
	
	/**
	 * Get the value to use if none has been set.
	 * @return
	 */
	public S getDefaultValue();

	/**
	 * Set the current value.
	 * @param value
	 * @return true if the value was accepted
	 */
	public boolean setValue(S value);

	/**
	 * Set the current value by parsing a string.
	 * @param locale locale to use for number parsing; may be null
	 * @param value
	 * @return true if the string could be parsed and the value was accepted
	 */
	public boolean setStringValue(Locale locale, String value);

	/**
	 * Clear the current value, so that the default is used.
	 */
	public void resetValue();

	/**
	 * Get the current value (may be null).
	 * @return
	 */
	public S getValue();

	/**
	 * Get the current value, or the default if none has been set.
	 * @return
	 */
	public S getValueOrDefault();
	
	/**
	 * Get a short description suitable for a prompt or command-line help.
	 * @return
	 */
	public String getPrompt();
	
	/**
	 * Query if a specified value would be valid for this parameter.
	 * @param value
	 * @return
	 */
	public boolean isValidInput(S value);
	
	/**
	 * Create a new parameter with the same prompt, default and current value.
	 * @return
	 */
	public Parameter<S> duplicate();
	
	/**
	 * Get a longer description of the parameter, or null.
	 * @return
	 */
	public String getHelpText();
	
}
