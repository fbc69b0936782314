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

import java.text.NumberFormat;
import java.text.ParsePosition;
import java.util.Locale;

/**
 * Abstract parameter to represent a numeric value, optionally constrained to a range.
 * 
 * @see DoubleParameter
 * @see IntParameter
 *
 * @param <S>
 */
public abstract class NumericParameter<S extends Number> extends AbstractParameter<S> {
	
	private static final long serialVersionUID = 1L;
	
	private final String unit;
	private final double minValue;
	private final double maxValue;
	
	NumericParameter(String prompt, S defaultValue, String unit, double minValue, double maxValue, S value, String helpText) {
		super(prompt, defaultValue, value, helpText);
		if (Double.isNaN(minValue))
			minValue = Double.NEGATIVE_INFINITY;
		if (Double.isNaN(maxValue))
			maxValue = Double.POSITIVE_INFINITY;
		if (minValue > maxValue)
			throw new IllegalArgumentException("Invalid range " + minValue + "-" + maxValue + ": minValue must be <= maxValue");
		this.unit = unit;
		this.minValue = minValue;
		this.maxValue = maxValue;
	}
	
	/**
	 * Retrieve the lower bound. May be Double.NEGATIVE_INFINITY if the parameter has no lower bound.
	 * @return
	 */
	public double getLowerBound() {
		return minValue;
	}

	/**
	 * Retrieve the upper bound. May be Double.POSITIVE_INFINITY if the parameter has no upper bound.
	 * @return
	 */
	public double getUpperBound() {
		return maxValue;
	}
	
	/**
	 * Returns true if the parameter has a finite lower bound.
	 * @return
	 */
	public boolean hasLowerBound() {
		return Double.isFinite(minValue);
	}
	
	/**
	 * Returns true if the parameter has a finite upper bound.
	 * @return
	 */
	public boolean hasUpperBound() {
		return Double.isFinite(maxValue);
	}

	/**
	 * Get the unit for this parameter (may be null).
	 * @return
	 */
	public String getUnit() {
		return unit;
	}
	
	/**
	 * Set the value from a double, converting as needed.
	 * @param val
	 * @return
	 */
	public abstract boolean setDoubleValue(double val);
	
	/**
	 * Numbers are valid if they are not NaN and lie within any bounds.
	 */
	@Override
	public boolean isValidInput(S value) {
		double d = value.doubleValue();
		return !Double.isNaN(d) && d >= minValue && d <= maxValue;
	}
	
	@Override
	public boolean setStringValue(Locale locale, String value) {
		if (value == null)
			return false;
		String s = value.strip();
		if (locale != null) {
			var pos = new ParsePosition(0);
			Number number = NumberFormat.getInstance(locale).parse(s, pos);
			if (number != null && pos.getIndex() == s.length())
				return setDoubleValue(number.doubleValue());
		}
		try {
			return setDoubleValue(Double.parseDouble(s));
		} catch (NumberFormatException e) {
			return false;
		}
	}
	
}
