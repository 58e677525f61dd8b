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

package simplereg.lib.registration;

import java.util.List;

import simplereg.lib.images.Image;
import simplereg.lib.parameters.ParameterMap;
import simplereg.lib.parameters.ParameterMaps;

/**
 * Static methods for registering a single moving image to a single fixed image.
 *
 * @see RegistrationFilter
 * @author SimpleReg developers
 */
public class Registrations {

	private Registrations() {
		throw new AssertionError();
	}

	/**
	 * Register images using the given parameter maps.
	 * @param fixedImage
	 * @param movingImage
	 * @param parameterMaps one map per stage; if empty, the moving image is only resampled
	 * @return the moving image transformed onto the grid of the fixed image
	 */
	public static Image register(Image fixedImage, Image movingImage, List<ParameterMap> parameterMaps) {
		return new RegistrationFilter()
				.setFixedImage(fixedImage)
				.setMovingImage(movingImage)
				.setParameterMaps(parameterMaps)
				.execute();
	}

	/**
	 * Register images using a single parameter map.
	 * @param fixedImage
	 * @param movingImage
	 * @param parameterMap
	 * @return the moving image transformed onto the grid of the fixed image
	 */
	public static Image register(Image fixedImage, Image movingImage, ParameterMap parameterMap) {
		return register(fixedImage, movingImage, List.of(parameterMap));
	}

	/**
	 * Register images using the default parameter map for a named transform.
	 * @param fixedImage
	 * @param movingImage
	 * @param transformName the transform, e.g. "translation"
	 * @return the moving image transformed onto the grid of the fixed image
	 * @see ParameterMaps#getDefault(String)
	 */
	public static Image register(Image fixedImage, Image movingImage, String transformName) {
		return register(fixedImage, movingImage, ParameterMaps.getDefault(transformName));
	}

}
