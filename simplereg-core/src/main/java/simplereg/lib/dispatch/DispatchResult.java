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

package simplereg.lib.dispatch;

import java.util.List;

import simplereg.lib.images.Image;
import simplereg.lib.parameters.ParameterMap;
import simplereg.lib.parameters.ParameterMaps;

/**
 * Result returned by a {@link DualDispatcher}.
 * <p>
 * The image owns its pixel data and the parameter maps are independent copies, so the result
 * stays valid after the operation that produced it has finished.
 * 
 * @author SimpleReg developers
 */
public class DispatchResult {

	private final Image image;
	private final List<ParameterMap> parameterMaps;

	DispatchResult(Image image, List<ParameterMap> parameterMaps) {
		this.image = image;
		this.parameterMaps = ParameterMaps.copyOf(parameterMaps);
	}

	/**
	 * Get the output image.
	 * @return
	 */
	public Image getImage() {
		return image;
	}

	/**
	 * Get the output parameter maps, one per stage of the operation.
	 * @return an unmodifiable list
	 */
	public List<ParameterMap> getParameterMaps() {
		return parameterMaps;
	}

}
