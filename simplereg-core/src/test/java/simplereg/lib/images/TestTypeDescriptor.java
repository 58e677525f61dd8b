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

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestTypeDescriptor {

	@Test
	public void test_equality() {
		var a = TypeDescriptor.of(ElementKind.UINT8, 2);
		var b = TypeDescriptor.of(ElementKind.UINT8, 2);
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		assertNotEquals(a, TypeDescriptor.of(ElementKind.UINT8, 3));
		assertNotEquals(a, TypeDescriptor.of(ElementKind.INT8, 2));
		assertEquals("UINT8 (2D)", a.toString());
	}

	@Test
	public void test_invalid() {
		assertThrows(IllegalArgumentException.class, () -> TypeDescriptor.of(ElementKind.FLOAT32, 0));
		assertThrows(NullPointerException.class, () -> TypeDescriptor.of(null, 2));
	}

	@Test
	public void test_supported() {
		var supported = TypeDescriptor.supported();
		assertEquals(ElementKind.values().length * PixelKind.SUPPORTED_DIMENSIONS.size(), supported.size());
		assertEquals(supported.size(), new HashSet<>(supported).size());
		assertTrue(supported.contains(TypeDescriptor.of(ElementKind.VECTOR_FLOAT64, 4)));
		assertFalse(supported.contains(TypeDescriptor.of(ElementKind.FLOAT64, 5)));
		assertFalse(supported.contains(TypeDescriptor.of(ElementKind.FLOAT64, 1)));
	}

	@Test
	public void test_sameDimension() {
		var a = TypeDescriptor.of(ElementKind.UINT8, 3);
		assertTrue(a.hasSameDimension(TypeDescriptor.of(ElementKind.FLOAT32, 3)));
		assertFalse(a.hasSameDimension(TypeDescriptor.of(ElementKind.UINT8, 2)));
	}

}
