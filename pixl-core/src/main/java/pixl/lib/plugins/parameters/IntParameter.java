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

/**
 * Parameter to represent an integer numeric value.
 * <p>
 * May be bounded. Values set as doubles are rounded; non-integral values are rejected.
 */
public class IntParameter extends NumericParameter<Integer> {
	
	private static final long serialVersionUID = 1L;
	
	IntParameter(String prompt, Integer defaultValue, String unit, double minValue, double maxValue, Integer value, String helpText) {
		super(prompt, defaultValue, unit, minValue, maxValue, value, helpText);
	}

	@Override
	public boolean setDoubleValue(double val) {
		if (Double.isNaN(val) || val != Math.rint(val) || Math.abs(val) > Integer.MAX_VALUE)
			return false;
		return setValue((int)val);
	}

	@Override
	public Parameter<Integer> duplicate() {
		return new IntParameter(getPrompt(), getDefaultValue(), getUnit(), getLowerBound(), getUpperBound(), getValue(), getHelpText());
	}

}
