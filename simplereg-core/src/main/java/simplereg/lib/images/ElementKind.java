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

package simplereg.lib.images;

/**
 * Numeric representation of a single pixel component.
 * <p>
 * Each scalar kind has a vector counterpart, used for images storing more than one
 * component per pixel (e.g. RGB or displacement fields). The component of a vector kind
 * is always the scalar kind with the same bit depth and value type.
 *
 * @see TypeDescriptor
 * @author SimpleReg developers
 */
public enum ElementKind {

	/**
	 * 8-bit signed integer
	 */
	INT8(8, ValueType.SIGNED_INTEGER, Byte.MIN_VALUE, Byte.MAX_VALUE, false),
	/**
	 * 8-bit unsigned integer
	 */
	UINT8(8, ValueType.UNSIGNED_INTEGER, 0, 255, false),
	/**
	 * 16-bit signed integer
	 */
	INT16(16, ValueType.SIGNED_INTEGER, Short.MIN_VALUE, Short.MAX_VALUE, false),
	/**
	 * 16-bit unsigned integer
	 */
	UINT16(16, ValueType.UNSIGNED_INTEGER, 0, 65535, false),
	/**
	 * 32-bit signed integer
	 */
	INT32(32, ValueType.SIGNED_INTEGER, Integer.MIN_VALUE, Integer.MAX_VALUE, false),
	/**
	 * 32-bit unsigned integer
	 */
	UINT32(32, ValueType.UNSIGNED_INTEGER, 0, 4294967295L, false),
	/**
	 * 64-bit signed integer
	 */
	INT64(64, ValueType.SIGNED_INTEGER, Long.MIN_VALUE, Long.MAX_VALUE, false),
	/**
	 * 64-bit unsigned integer (the upper bound is only approximate as a double)
	 */
	UINT64(64, ValueType.UNSIGNED_INTEGER, 0, 18446744073709551615.0, false),
	/**
	 * 32-bit floating point
	 */
	FLOAT32(32, ValueType.FLOATING_POINT, -Float.MAX_VALUE, Float.MAX_VALUE, false),
	/**
	 * 64-bit floating point
	 */
	FLOAT64(64, ValueType.FLOATING_POINT, -Double.MAX_VALUE, Double.MAX_VALUE, false),

	/**
	 * Multi-component 8-bit signed integer
	 */
	VECTOR_INT8(8, ValueType.SIGNED_INTEGER, Byte.MIN_VALUE, Byte.MAX_VALUE, true),
	/**
	 * Multi-component 8-bit unsigned integer
	 */
	VECTOR_UINT8(8, ValueType.UNSIGNED_INTEGER, 0, 255, true),
	/**
	 * Multi-component 16-bit signed integer
	 */
	VECTOR_INT16(16, ValueType.SIGNED_INTEGER, Short.MIN_VALUE, Short.MAX_VALUE, true),
	/**
	 * Multi-component 16-bit unsigned integer
	 */
	VECTOR_UINT16(16, ValueType.UNSIGNED_INTEGER, 0, 65535, true),
	/**
	 * Multi-component 32-bit signed integer
	 */
	VECTOR_INT32(32, ValueType.SIGNED_INTEGER, Integer.MIN_VALUE, Integer.MAX_VALUE, true),
	/**
	 * Multi-component 32-bit unsigned integer
	 */
	VECTOR_UINT32(32, ValueType.UNSIGNED_INTEGER, 0, 4294967295L, true),
	/**
	 * Multi-component 64-bit signed integer
	 */
	VECTOR_INT64(64, ValueType.SIGNED_INTEGER, Long.MIN_VALUE, Long.MAX_VALUE, true),
	/**
	 * Multi-component 64-bit unsigned integer
	 */
	VECTOR_UINT64(64, ValueType.UNSIGNED_INTEGER, 0, 18446744073709551615.0, true),
	/**
	 * Multi-component 32-bit floating point
	 */
	VECTOR_FLOAT32(32, ValueType.FLOATING_POINT, -Float.MAX_VALUE, Float.MAX_VALUE, true),
	/**
	 * Multi-component 64-bit floating point
	 */
	VECTOR_FLOAT64(64, ValueType.FLOATING_POINT, -Double.MAX_VALUE, Double.MAX_VALUE, true);

	private final int bitsPerComponent;
	private final ValueType type;
	private final Number minValue, maxValue;
	private final boolean isVector;

	private ElementKind(int bits, ValueType type, Number minValue, Number maxValue, boolean isVector) {
		this.bitsPerComponent = bits;
		this.type = type;
		this.minValue = minValue;
		this.maxValue = maxValue;
		this.isVector = isVector;
	}

	/**
	 * Number of bits used to store one component.
	 * @return
	 *
	 * @see #getBytesPerComponent()
	 */
	public int getBitsPerComponent() {
		return bitsPerComponent;
	}

	/**
	 * Number of bytes used to store one component.
	 * @return
	 */
	public int getBytesPerComponent() {
		return (int)Math.ceil(bitsPerComponent / 8.0);
	}

	/**
	 * Get a number representing the minimum value permitted for a component (may be negative).
	 * @return
	 */
	public Number getLowerBound() {
		return minValue;
	}

	/**
	 * Get a number representing the maximum value permitted for a component.
	 * @return
	 */
	public Number getUpperBound() {
		return maxValue;
	}

	/**
	 * Returns true if the kind is a signed integer representation.
	 * @return
	 */
	public boolean isSignedInteger() {
		return type == ValueType.SIGNED_INTEGER;
	}

	/**
	 * Returns true if the kind is an unsigned integer representation.
	 * @return
	 */
	public boolean isUnsignedInteger() {
		return type == ValueType.UNSIGNED_INTEGER;
	}

	/**
	 * Returns true if the kind is a floating point representation.
	 * @return
	 */
	public boolean isFloatingPoint() {
		return type == ValueType.FLOATING_POINT;
	}

	/**
	 * Returns true if pixels of this kind may hold more than one component.
	 * @return
	 */
	public boolean isVector() {
		return isVector;
	}

	/**
	 * Get the scalar kind used for each component.
	 * For a scalar kind this is the kind itself.
	 * @return
	 */
	public ElementKind getComponentKind() {
		if (!isVector)
			return this;
		return values()[ordinal() - VECTOR_INT8.ordinal()];
	}

	/**
	 * Get the vector kind whose components have this kind.
	 * For a vector kind this is the kind itself.
	 * @return
	 */
	public ElementKind getVectorKind() {
		if (isVector)
			return this;
		return values()[ordinal() + VECTOR_INT8.ordinal()];
	}

	private enum ValueType {
		SIGNED_INTEGER, UNSIGNED_INTEGER, FLOATING_POINT;
	}

}
