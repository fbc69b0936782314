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

import java.util.Locale;

/**
 * Parameter that can take on true or false.
 */
public class BooleanParameter extends AbstractParameter<Boolean> {

	private static final long serialVersionUID = 1L;

	BooleanParameter(String prompt, Boolean defaultValue, Boolean value, String helpText) {
		super(prompt, defaultValue, value, helpText);
	}

	/**
	 * Only "true" and "false" (ignoring case) are accepted.
	 */
	@Override
	public boolean setStringValue(Locale locale, String value) {
		if (value == null)
			return false;
		String s = value.strip();
		if ("true".equalsIgnoreCase(s))
			return setValue(Boolean.TRUE);
		if ("false".equalsIgnoreCase(s))
			return setValue(Boolean.FALSE);
		return false;
	}

	@Override
	public boolean isValidInput(Boolean value) {
		return value != null;
	}

	@Override
	public Parameter<Boolean> duplicate() {
		return new BooleanParameter(getPrompt(), getDefaultValue(), getValue(), getHelpText());
	}

}
