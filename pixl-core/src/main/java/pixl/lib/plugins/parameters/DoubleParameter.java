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
 * Parameter to represent a floating point numeric value.
 * <p>
 * May be bounded.
 */
public class DoubleParameter extends NumericParameter<Double> {
	
	private static final long serialVersionUID = 1L;

	DoubleParameter(String prompt, Double defaultValue, String unit, double minValue, double maxValue, Double value, String helpText) {
		super(prompt, defaultValue, unit, minValue, maxValue, value, helpText);
	}

	@Override
	public boolean setDoubleValue(double val) {
		return setValue(val);
	}

	@Override
	public Parameter<Double> duplicate() {
		return new DoubleParameter(getPrompt(), getDefaultValue(), getUnit(), getLowerBound(), getUpperBound(), getValue(), getHelpText());
	}
	
}
