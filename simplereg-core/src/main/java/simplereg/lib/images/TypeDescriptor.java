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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Identifies which compiled variant an {@link Image} holds: the element kind of its pixels
 * together with its number of spatial dimensions.
 * <p>
 * Descriptors are immutable and compared structurally, so they may be used directly as keys
 * when looking up type-specific operations.
 * 
 * @author SimpleReg developers
 */
public final class TypeDescriptor {

	private final ElementKind elementKind;
	private final int dimension;

	private TypeDescriptor(ElementKind elementKind, int dimension) {
		this.elementKind = elementKind;
		this.dimension = dimension;
	}

	/**
	 * Create a descriptor.
	 * @param elementKind the pixel element kind
	 * @param dimension number of spatial dimensions, at least 1
	 * @return
	 * @throws IllegalArgumentException if the dimension is less than 1
	 */
	public static TypeDescriptor of(ElementKind elementKind, int dimension) {
		Objects.requireNonNull(elementKind, "Element kind must not be null");
		if (dimension < 1)
			throw new IllegalArgumentException("Dimension must be >= 1, but was " + dimension);
		return new TypeDescriptor(elementKind, dimension);
	}

	/**
	 * Get every descriptor for which operations may be compiled, i.e. all element kinds
	 * combined with all of {@link PixelKind#SUPPORTED_DIMENSIONS}.
	 * @return an unmodifiable list
	 */
	public static List<TypeDescriptor> supported() {
		List<TypeDescriptor> list = new ArrayList<>();
		for (int d : PixelKind.SUPPORTED_DIMENSIONS) {
			for (ElementKind kind : ElementKind.values())
				list.add(new TypeDescriptor(kind, d));
		}
		return Collections.unmodifiableList(list);
	}

	/**
	 * Get the pixel element kind.
	 * @return
	 */
	public ElementKind getElementKind() {
		return elementKind;
	}

	/**
	 * Get the number of spatial dimensions.
	 * @return
	 */
	public int getDimension() {
		return dimension;
	}

	/**
	 * Returns true if both descriptors have the same number of dimensions.
	 * @param other
	 * @return
	 */
	public boolean hasSameDimension(TypeDescriptor other) {
		return dimension == other.dimension;
	}

	@Override
	public String toString() {
		return elementKind + " (" + dimension + "D)";
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + dimension;
		result = prime * result + elementKind.hashCode();
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TypeDescriptor other = (TypeDescriptor) obj;
		return dimension == other.dimension && elementKind == other.elementKind;
	}

}
