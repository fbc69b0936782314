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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.GsonBuilder;

/**
 * An ordered collection of keyed parameters, used to describe and configure an algorithm.
 * <p>
 * Each algorithm provides a default list; values can then be overridden from command-line options, 
 * key/value maps or JSON.
 */
public class ParameterList implements Serializable {
	
	private static final long serialVersionUID = 1L;
	
	private static final Logger logger = LoggerFactory.getLogger(ParameterList.class);
	
	private final Map<String, Parameter<?>> params = new LinkedHashMap<>();
	
	/**
	 * Create a deep copy of this parameter list.
	 * @return
	 */
	public ParameterList duplicate() {
		var copy = new ParameterList();
		for (Entry<String, Parameter<?>> entry : params.entrySet())
			copy.params.put(entry.getKey(), entry.getValue().duplicate());
		return copy;
	}
	
	/**
	 * Add an unbounded double parameter.
	 * @param key
	 * @param prompt
	 * @param defaultValue
	 * @return this list
	 */
	public ParameterList addDoubleParameter(String key, String prompt, double defaultValue) {
		return addDoubleParameter(key, prompt, defaultValue, null, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, null);
	}
	
	/**
	 * Add a bounded double parameter, optionally with a unit and help text.
	 * @param key
	 * @param prompt
	 * @param defaultValue
	 * @param unit
	 * @param lowerBound
	 * @param upperBound
	 * @param helpText
	 * @return this list
	 */
	public ParameterList addDoubleParameter(String key, String prompt, double defaultValue, String unit, double lowerBound, double upperBound, String helpText) {
		params.put(key, new DoubleParameter(prompt, defaultValue, unit, lowerBound, upperBound, null, helpText));
		return this;
	}
	
	/**
	 * Add an unbounded int parameter.
	 * @param key
	 * @param prompt
	 * @param defaultValue
	 * @return this list
	 */
	public ParameterList addIntParameter(String key, String prompt, int defaultValue) {
		return addIntParameter(key, prompt, defaultValue, null, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, null);
	}

	/**
	 * Add a bounded int parameter, optionally with a unit and help text.
	 * @param key
	 * @param prompt
	 * @param defaultValue
	 * @param unit
	 * @param lowerBound
	 * @param upperBound
	 * @param helpText
	 * @return this list
	 */
	public ParameterList addIntParameter(String key, String prompt, int defaultValue, String unit, double lowerBound, double upperBound, String helpText) {
		params.put(key, new IntParameter(prompt, defaultValue, unit, lowerBound, upperBound, null, helpText));
		return this;
	}
	
	/**
	 * Add a boolean parameter, with optional help text.
	 * @param key
	 * @param prompt
	 * @param defaultValue
	 * @param helpText
	 * @return this list
	 */
	public ParameterList addBooleanParameter(String key, String prompt, boolean defaultValue, String helpText) {
		params.put(key, new BooleanParameter(prompt, defaultValue, null, helpText));
		return this;
	}
	
	/**
	 * Returns an unmodifiable map of keys and their corresponding parameters.
	 * @return
	 */
	public Map<String, Parameter<?>> getParameters() {
		return Collections.unmodifiableMap(params);
	}
	
	/**
	 * Returns a map of keys and their current values (or defaults).
	 * @return
	 */
	public Map<String, Object> getKeyValueParameters() {
		Map<String, Object> map = new LinkedHashMap<>();
		for (Entry<String, Parameter<?>> entry : params.entrySet())
			map.put(entry.getKey(), entry.getValue().getValueOrDefault());
		return map;
	}
	
	/**
	 * Returns true if a parameter exists in this list with a specified key.
	 * @param key
	 * @return
	 */
	public boolean containsKey(final Object key) {
		return params.containsKey(key);
	}
	
	/**
	 * Get a boolean parameter value (or its default) for the specified key.
	 * @param key
	 * @return
	 * @throws IllegalArgumentException if no boolean parameter exists for the specified key
	 */
	public boolean getBooleanParameterValue(String key) {
		Parameter<?> p = params.get(key);
		if (p instanceof BooleanParameter)
			return ((BooleanParameter)p).getValueOrDefault();
		throw new IllegalArgumentException("No boolean parameter with key '" + key + "'");
	}
	
	/**
	 * Get a double parameter value (or its default) for the specified key.
	 * @param key
	 * @return
	 * @throws IllegalArgumentException if no double parameter exists for the specified key
	 */
	public double getDoubleParameterValue(String key) {
		Parameter<?> p = params.get(key);
		if (p instanceof DoubleParameter)
			return ((DoubleParameter)p).getValueOrDefault();
		throw new IllegalArgumentException("No double parameter with key '" + key + "'");
	}
	
	/**
	 * Get an integer parameter value (or its default) for the specified key.
	 * @param key
	 * @return
	 * @throws IllegalArgumentException if no integer parameter exists for the specified key
	 */
	public int getIntParameterValue(String key) {
		Parameter<?> p = params.get(key);
		if (p instanceof IntParameter)
			return ((IntParameter)p).getValueOrDefault();
		throw new IllegalArgumentException("No integer parameter with key '" + key + "'");
	}
	
	/**
	 * Update a ParameterList with the values specified in a map.
	 * <p>
	 * Unknown keys and values that cannot be parsed (or fall outside a parameter's bounds) are logged and skipped.
	 * 
	 * @param params
	 * @param mapNew
	 * @param locale The Locale to use for any parsing required.
	 * @return the number of parameters that were updated
	 */
	public static int updateParameterList(ParameterList params, Map<String, String> mapNew, Locale locale) {
		int count = 0;
		for (Entry<String, String> entry : mapNew.entrySet()) {
			String key = entry.getKey();
			Parameter<?> parameter = params.params.get(key);
			if (parameter == null)
				logger.warn("Unknown parameter {} (with value {})", key, entry.getValue());
			else if (!parameter.setStringValue(locale, entry.getValue()))
				logger.warn("Unable to set parameter {} with value {}", key, entry.getValue());
			else
				count++;
		}
		return count;
	}
	
	/**
	 * Get a JSON representation of a ParameterList's current values.
	 * <p>
	 * Numbers are always written with a decimal point, independent of the current Locale.
	 * 
	 * @param params
	 * @return
	 */
	public static String getParameterListJSON(final ParameterList params) {
		return new GsonBuilder()
				.serializeSpecialFloatingPointValues()
				.create()
				.toJson(params.getKeyValueParameters());
	}
	
	@Override
	public String toString() {
		return "ParameterList " + getKeyValueParameters();
	}

}
