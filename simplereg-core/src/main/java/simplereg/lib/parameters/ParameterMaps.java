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
import java.util.List;
import java.util.Locale;

/**
 * Static methods to create and copy parameter maps.
 * 
 * @author SimpleReg developers
 */
public class ParameterMaps {

	/**
	 * Name of the key giving the transform of a registration stage.
	 */
	public static final String TRANSFORM = "Transform";

	/**
	 * Name of the key giving the number of resolution levels of a registration stage.
	 */
	public static final String NUMBER_OF_RESOLUTIONS = "NumberOfResolutions";

	private ParameterMaps() {
		throw new AssertionError();
	}

	/**
	 * Create a default parameter map for a single registration stage.
	 * <p>
	 * Only "translation" is currently recognized.
	 *
	 * @param transformName the kind of transform, e.g. "translation"
	 * @param numberOfResolutions number of resolution levels, at least 1
	 * @return a new parameter map
	 * @throws IllegalArgumentException if the transform name is unknown
	 */
	public static ParameterMap getDefault(String transformName, int numberOfResolutions) {
		if (numberOfResolutions < 1)
			throw new IllegalArgumentException("Number of resolutions must be >= 1, but was " + numberOfResolutions);
		var map = new ParameterMap()
				.set("FixedInternalImagePixelType", "float")
				.set("MovingInternalImagePixelType", "float")
				.set("Registration", "MultiResolutionRegistration")
				.set("Metric", "AdvancedMeanSquares")
				.set("Optimizer", "CompassSearch")
				.set("ResampleInterpolator", "FinalLinearInterpolator")
				.set("DefaultPixelValue", "0")
				.set("MinimumStepLength", "0.01")
				.set("WriteResultImage", "true")
				.set(NUMBER_OF_RESOLUTIONS, Integer.toString(numberOfResolutions));

		List<String> steps = new ArrayList<>();
		List<String> iterations = new ArrayList<>();
		for (int level = 0; level < numberOfResolutions; level++) {
			// Coarse levels take larger steps
			steps.add(Double.toString(Math.pow(2, numberOfResolutions - 1 - level)));
			iterations.add("250");
		}
		map.set("MaximumStepLength", steps);
		map.set("MaximumNumberOfIterations", iterations);

		switch (transformName.toLowerCase(Locale.ROOT)) {
		case "translation":
			map.set(TRANSFORM, "TranslationTransform");
			break;
		default:
			throw new IllegalArgumentException("No default parameter map for transform '" + transformName + "'");
		}
		return map;
	}

	/**
	 * Create a default parameter map with one resolution level.
	 * @param transformName
	 * @return
	 * @see #getDefault(String, int)
	 */
	public static ParameterMap getDefault(String transformName) {
		return getDefault(transformName, 1);
	}

	/**
	 * Create a deep, unmodifiable copy of a list of parameter maps.
	 * Changes to the original maps do not affect the copy.
	 * @param maps
	 * @return
	 */
	public static List<ParameterMap> copyOf(List<ParameterMap> maps) {
		List<ParameterMap> copy = new ArrayList<>();
		for (var map : maps)
			copy.add(new ParameterMap(map));
		return Collections.unmodifiableList(copy);
	}

	/**
	 * Create a deep, unmodifiable copy of parameter maps.
	 * @param maps
	 * @return
	 */
	public static List<ParameterMap> copyOf(ParameterMap... maps) {
		return copyOf(Arrays.asList(maps));
	}

}
