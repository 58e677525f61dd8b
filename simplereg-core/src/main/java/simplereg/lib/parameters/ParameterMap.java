/*-
 * #%L
 * This file is part of SimpleReg.
 * %%
 * Copyright (C) 2024 SimpleReg developers
 * %%
 * SimpleReg is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * SimpleReg is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with SimpleReg.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package simplereg.lib.parameters;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered map from parameter names to ordered lists of string values.
 * <p>
 * The order of keys is the order in which they were first set, and the order of values
 * within a key is preserved (e.g. to give one value per resolution level).
 * Values are always stored as strings; typed getters parse them on request.
 * 
 * @author SimpleReg developers
 */
public class ParameterMap {

	private final Map<String, List<String>> map = new LinkedHashMap<>();

	/**
	 * Create an empty map.
	 */
	public ParameterMap() {}

	/**
	 * Create a copy of an existing map.
	 * @param parameterMap
	 */
	public ParameterMap(ParameterMap parameterMap) {
		for (var entry : parameterMap.map.entrySet())
			map.put(entry.getKey(), new ArrayList<>(entry.getValue()));
	}

	/**
	 * Create a map from the entries of a standard Java map, preserving its iteration order.
	 * @param entries
	 * @return
	 */
	public static ParameterMap of(Map<String, ? extends List<String>> entries) {
		var parameterMap = new ParameterMap();
		for (var entry : entries.entrySet())
			parameterMap.set(entry.getKey(), entry.getValue());
		return parameterMap;
	}

	/**
	 * Set the values for a key, replacing any existing values.
	 * @param key
	 * @param values
	 * @return this map
	 */
	public ParameterMap set(String key, List<String> values) {
		Objects.requireNonNull(key, "Parameter name must not be null");
		for (var v : values)
			Objects.requireNonNull(v, "Parameter values must not be null");
		map.put(key, new ArrayList<>(values));
		return this;
	}

	/**
	 * Set the values for a key, replacing any existing values.
	 * @param key
	 * @param values
	 * @return this map
	 */
	public ParameterMap set(String key, String... values) {
		return set(key, Arrays.asList(values));
	}

	/**
	 * Append values to a key, creating it if necessary.
	 * @param key
	 * @param values
	 * @return this map
	 */
	public ParameterMap add(String key, String... values) {
		var list = map.computeIfAbsent(Objects.requireNonNull(key), k -> new ArrayList<>());
		for (var v : values)
			list.add(Objects.requireNonNull(v));
		return this;
	}

	/**
	 * Remove a key.
	 * @param key
	 * @return true if the key was present
	 */
	public boolean remove(String key) {
		return map.remove(key) != null;
	}

	/**
	 * Returns true if the key is present.
	 * @param key
	 * @return
	 */
	public boolean containsKey(String key) {
		return map.containsKey(key);
	}

	/**
	 * Get the values for a key.
	 * @param key
	 * @return an unmodifiable list, empty if the key is not present
	 */
	public List<String> get(String key) {
		var values = map.get(key);
		return values == null ? Collections.emptyList() : Collections.unmodifiableList(values);
	}

	/**
	 * Get the value at a specific position for a key.
	 * If there are fewer values, the last value is returned; if there are none, the default.
	 * This matches the convention for per-resolution parameters.
	 * @param key
	 * @param index
	 * @param defaultValue
	 * @return
	 */
	public String getString(String key, int index, String defaultValue) {
		var values = map.get(key);
		if (values == null || values.isEmpty())
			return defaultValue;
		return values.get(Math.min(index, values.size() - 1));
	}

	/**
	 * Get the first value for a key, or the default if there is none.
	 * @param key
	 * @param defaultValue
	 * @return
	 */
	public String getString(String key, String defaultValue) {
		return getString(key, 0, defaultValue);
	}

	/**
	 * Get a value for a key parsed as a double.
	 * @param key
	 * @param index
	 * @param defaultValue
	 * @return
	 * @throws IllegalArgumentException if the value cannot be parsed
	 * @see #getString(String, int, String)
	 */
	public double getDouble(String key, int index, double defaultValue) {
		String value = getString(key, index, null);
		if (value == null)
			return defaultValue;
		try {
			return Double.parseDouble(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Parameter " + key + " value '" + value + "' is not a number", e);
		}
	}

	/**
	 * Get a value for a key parsed as an integer.
	 * @param key
	 * @param index
	 * @param defaultValue
	 * @return
	 * @throws IllegalArgumentException if the value cannot be parsed
	 * @see #getString(String, int, String)
	 */
	public int getInt(String key, int index, int defaultValue) {
		String value = getString(key, index, null);
		if (value == null)
			return defaultValue;
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Parameter " + key + " value '" + value + "' is not an integer", e);
		}
	}

	/**
	 * Get a value for a key parsed as a boolean ("true" or "false", ignoring case).
	 * @param key
	 * @param defaultValue
	 * @return
	 */
	public boolean getBoolean(String key, boolean defaultValue) {
		String value = getString(key, null);
		if (value == null)
			return defaultValue;
		return Boolean.parseBoolean(value.trim());
	}

	/**
	 * Get all keys, in insertion order.
	 * @return an unmodifiable set
	 */
	public Set<String> keySet() {
		return Collections.unmodifiableSet(map.keySet());
	}

	/**
	 * Get the number of keys.
	 * @return
	 */
	public int size() {
		return map.size();
	}

	/**
	 * Returns true if there are no keys.
	 * @return
	 */
	public boolean isEmpty() {
		return map.isEmpty();
	}

	/**
	 * Get a copy of the contents as a standard Java map, in insertion order.
	 * @return
	 */
	public Map<String, List<String>> asMap() {
		Map<String, List<String>> copy = new LinkedHashMap<>();
		for (var entry : map.entrySet())
			copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
		return Collections.unmodifiableMap(copy);
	}

	@Override
	public String toString() {
		return "ParameterMap" + map;
	}

	@Override
	public int hashCode() {
		return map.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		return map.equals(((ParameterMap)obj).map);
	}

}
