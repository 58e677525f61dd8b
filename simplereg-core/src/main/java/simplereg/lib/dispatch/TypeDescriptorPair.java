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

import java.util.Objects;

import simplereg.lib.images.TypeDescriptor;

/**
 * Ordered pair of a fixed and a moving {@link TypeDescriptor}, used as the key for operations
 * parameterized by two pixel types.
 * <p>
 * Both descriptors must have the same dimension; pairs of images with different dimensions
 * can never be registered or looked up.
 * 
 * @author SimpleReg developers
 */
public final class TypeDescriptorPair {

	private final TypeDescriptor fixed;
	private final TypeDescriptor moving;

	private TypeDescriptorPair(TypeDescriptor fixed, TypeDescriptor moving) {
		this.fixed = fixed;
		this.moving = moving;
	}

	/**
	 * Create a pair.
	 * @param fixed
	 * @param moving
	 * @return
	 * @throws IncompatibleDimensionException if the dimensions differ
	 */
	public static TypeDescriptorPair of(TypeDescriptor fixed, TypeDescriptor moving) {
		Objects.requireNonNull(fixed);
		Objects.requireNonNull(moving);
		if (!fixed.hasSameDimension(moving))
			throw new IncompatibleDimensionException(fixed, moving);
		return new TypeDescriptorPair(fixed, moving);
	}

	/**
	 * Get the fixed image descriptor.
	 * @return
	 */
	public TypeDescriptor getFixed() {
		return fixed;
	}

	/**
	 * Get the moving image descriptor.
	 * @return
	 */
	public TypeDescriptor getMoving() {
		return moving;
	}

	/**
	 * Get the shared dimension.
	 * @return
	 */
	public int getDimension() {
		return fixed.getDimension();
	}

	@Override
	public String toString() {
		return "(fixed=" + fixed + ", moving=" + moving + ")";
	}

	@Override
	public int hashCode() {
		return 31 * fixed.hashCode() + moving.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TypeDescriptorPair other = (TypeDescriptorPair) obj;
		return fixed.equals(other.fixed) && moving.equals(other.moving);
	}

}
