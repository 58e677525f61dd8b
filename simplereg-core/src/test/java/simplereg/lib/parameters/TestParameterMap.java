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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestParameterMap {

	@Test
	public void test_values() {
		var map = new ParameterMap()
				.set("MaximumStepLength", "4.0", "2.0")
				.set("Metric", "AdvancedMeanSquares")
				.add("Metric", "AdvancedNormalizedCorrelation");

		assertEquals(List.of("AdvancedMeanSquares", "AdvancedNormalizedCorrelation"), map.get("Metric"));
		assertEquals(4.0, map.getDouble("MaximumStepLength", 0, 1.0));
		assertEquals(2.0, map.getDouble("MaximumStepLength", 1, 1.0));
		// Last value repeats
		assertEquals(2.0, map.getDouble("MaximumStepLength", 5, 1.0));
		assertEquals(1.0, map.getDouble("Missing", 0, 1.0));
		assertEquals("fallback", map.getString("Missing", "fallback"));
		assertTrue(map.get("Missing").isEmpty());
		assertThrows(UnsupportedOperationException.class, () -> map.get("Metric").add("Other"));
	}

	@Test
	public void test_parsing() {
		var map = ParameterMap.of(Map.of(
				"Iterations", List.of("250", "abc"),
				"WriteResultImage", List.of("TRUE")));
		assertEquals(250, map.getInt("Iterations", 0, 0));
		assertThrows(IllegalArgumentException.class, () -> map.getInt("Iterations", 1, 0));
		assertThrows(IllegalArgumentException.class, () -> map.getDouble("Iterations", 1, 0));
		assertTrue(map.getBoolean("WriteResultImage", false));
		assertFalse(map.getBoolean("Missing", false));
	}

	@Test
	public void test_copies() {
		var original = new ParameterMap().set("Transform", "TranslationTransform");
		var copy = new ParameterMap(original);
		assertEquals(original, copy);
		copy.set("Transform", "AffineTransform");
		assertNotEquals(original, copy);
		assertEquals("TranslationTransform", original.getString("Transform", null));

		var copies = ParameterMaps.copyOf(original);
		original.set("Transform", "Changed");
		assertEquals("TranslationTransform", copies.get(0).getString("Transform", null));
		assertThrows(UnsupportedOperationException.class, () -> copies.add(new ParameterMap()));
	}

	@Test
	public void test_removeAndKeys() {
		var map = new ParameterMap().set("A", "1").set("B", "2").set("C", "3");
		assertEquals(List.of("A", "B", "C"), List.copyOf(map.keySet()));
		assertTrue(map.remove("B"));
		assertFalse(map.remove("B"));
		assertEquals(2, map.size());
		assertFalse(map.containsKey("B"));
		assertThrows(NullPointerException.class, () -> map.set(null, "1"));
	}

	@Test
	public void test_defaultMaps() {
		var map = ParameterMaps.getDefault("translation");
		assertEquals("TranslationTransform", map.getString(ParameterMaps.TRANSFORM, null));
		assertEquals(1, map.getInt(ParameterMaps.NUMBER_OF_RESOLUTIONS, 0, 0));
		assertEquals("AdvancedMeanSquares", map.getString("Metric", null));
		assertEquals("CompassSearch", map.getString("Optimizer", null));

		var multi = ParameterMaps.getDefault("Translation", 3);
		assertEquals(List.of("4.0", "2.0", "1.0"), multi.get("MaximumStepLength"));
		assertEquals(3, multi.get("MaximumNumberOfIterations").size());

		assertThrows(IllegalArgumentException.class, () -> ParameterMaps.getDefault("bspline"));
		assertThrows(IllegalArgumentException.class, () -> ParameterMaps.getDefault("translation", 0));
	}

}
