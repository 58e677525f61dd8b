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
import java.util.Objects;

import simplereg.lib.images.TypedImage;
import simplereg.lib.parameters.ParameterMap;

/**
 * Output of a {@link DualTypedFunction}: a typed image, together with parameter maps
 * describing what was computed.
 * 
 * @author SimpleReg developers
 */
public class TypedOutput {

	private final TypedImage<?> image;
	private final List<ParameterMap> parameterMaps;

	/**
	 * Constructor.
	 * @param image the output image
	 * @param parameterMaps output parameter maps, may be empty
	 */
	public TypedOutput(TypedImage<?> image, List<ParameterMap> parameterMaps) {
		this.image = Objects.requireNonNull(image);
		this.parameterMaps = Objects.requireNonNull(parameterMaps);
	}

	/**
	 * Get the output image.
	 * @return
	 */
	public TypedImage<?> getImage() {
		return image;
	}

	/**
	 * Get the output parameter maps.
	 * @return
	 */
	public List<ParameterMap> getParameterMaps() {
		return parameterMaps;
	}

}
