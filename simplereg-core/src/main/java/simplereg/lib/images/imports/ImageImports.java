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

package simplereg.lib.images.imports;

import simplereg.lib.images.ElementKind;
import simplereg.lib.images.Image;

/**
 * Static methods to create images from Java arrays, using default spacing, origin and direction
 * where these are not given.
 *
 * @see ImportImageFilter
 * @author SimpleReg developers
 */
public class ImageImports {

	private ImageImports() {
		throw new AssertionError();
	}

	/**
	 * Create an image from a buffer of any supported element kind.
	 * @param kind element kind
	 * @param buffer Java array of the type required by the kind
	 * @param size number of pixels along each axis
	 * @param spacing pixel spacing, or null for the default
	 * @param origin physical origin, or null for the default
	 * @param direction row-major direction cosines, or null for the identity
	 * @param numberOfComponents components per pixel; must be 1 for scalar kinds
	 * @return
	 */
	public static Image importImage(ElementKind kind, Object buffer, long[] size,
			double[] spacing, double[] origin, double[] direction, int numberOfComponents) {
		return new ImportImageFilter()
				.setSize(size)
				.setSpacing(spacing)
				.setOrigin(origin)
				.setDirection(direction)
				.setBuffer(kind, buffer, numberOfComponents)
				.execute();
	}

	/**
	 * Create a scalar image with default geometry.
	 * @param kind
	 * @param buffer
	 * @param size
	 * @return
	 */
	public static Image importImage(ElementKind kind, Object buffer, long... size) {
		return importImage(kind, buffer, size, null, null, null, 1);
	}

	/**
	 * Create a signed 8-bit image with default geometry.
	 * @param buffer
	 * @param size
	 * @return
	 */
	public static Image importAsInt8(byte[] buffer, long... size) {
		return importImage(ElementKind.INT8, buffer, size);
	}

	/**
	 * Create an unsigned 8-bit image with default geometry.
	 * @param buffer
	 * @param size
	 * @return
	 */
	public static Image importAsUInt8(byte[] buffer, long... size) {
		return importImage(ElementKind.UINT8, buffer, size);
	}

	/**
	 * Create a signed 16-bit image with default geometry.
	 * @param buffer
	 * @param size
	 * @return
	 */
	public static Image importAsInt16(short[] buffer, long... size) {
		return importImage(ElementKind.INT16, buffer, size);
	}

	/**
	 * Create an unsigned 16-bit image with default geometry.
	 * @param buffer
	 * @param size
	 * @return
	 */
	public static Image importAsUInt16(short[] buffer, long... size) {
		return importImage(ElementKind.UINT16, buffer, size);
	}

	/**
	 * Create a signed 32-bit image with default geometry.
	 * @param buffer
	 * @param size
	 * @return
	 */
	public static Image importAsInt32(int[] buffer, long... size) {
		return importImage(ElementKind.INT32, buffer, size);
	}

	/**
	 * Create an unsigned 32-bit image with default geometry.
	 * @param buffer
	 * @param size
	 * @return
	 */
	public static Image importAsUInt32(int[] buffer, long... size) {
		return importImage(ElementKind.UINT32, buffer, size);
	}

	/**
	 * Create a signed 64-bit image with default geometry.
	 * @param buffer
	 * @param size
	 * @return
	 */
	public static Image importAsInt64(long[] buffer, long... size) {
		return importImage(ElementKind.INT64, buffer, size);
	}

	/**
	 * Create an unsigned 64-bit image with default geometry.
	 * @param buffer
	 * @param size
	 * @return
	 */
	public static Image importAsUInt64(long[] buffer, long... size) {
		return importImage(ElementKind.UINT64, buffer, size);
	}

	/**
	 * Create a 32-bit floating point image with default geometry.
	 * @param buffer
	 * @param size
	 * @return
	 */
	public static Image importAsFloat(float[] buffer, long... size) {
		return importImage(ElementKind.FLOAT32, buffer, size);
	}

	/**
	 * Create a 64-bit floating point image with default geometry.
	 * @param buffer
	 * @param size
	 * @return
	 */
	public static Image importAsDouble(double[] buffer, long... size) {
		return importImage(ElementKind.FLOAT64, buffer, size);
	}

}
