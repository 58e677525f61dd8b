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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@SuppressWarnings("javadoc")
public class TestElementKind {

	@ParameterizedTest
	@EnumSource(ElementKind.class)
	public void test_componentKind(ElementKind kind) {
		var component = kind.getComponentKind();
		assertFalse(component.isVector());
		assertEquals(kind.getBitsPerComponent(), component.getBitsPerComponent());
		assertEquals(kind.isFloatingPoint(), component.isFloatingPoint());
		if (kind.isVector())
			assertEquals(kind, component.getVectorKind());
		else
			assertEquals(kind, component);
	}

	@Test
	public void test_vectorKinds() {
		assertEquals(ElementKind.VECTOR_UINT8, ElementKind.UINT8.getVectorKind());
		assertEquals(ElementKind.VECTOR_FLOAT64, ElementKind.FLOAT64.getVectorKind());
		assertEquals(ElementKind.INT16, ElementKind.VECTOR_INT16.getComponentKind());
		assertEquals(ElementKind.VECTOR_UINT32, ElementKind.VECTOR_UINT32.getVectorKind());
	}

	@Test
	public void test_bounds() {
		assertEquals(0, ElementKind.UINT8.getLowerBound().intValue());
		assertEquals(255, ElementKind.UINT8.getUpperBound().intValue());
		assertEquals(-128, ElementKind.INT8.getLowerBound().intValue());
		assertEquals(65535, ElementKind.UINT16.getUpperBound().intValue());
		assertEquals(4294967295L, ElementKind.UINT32.getUpperBound().longValue());
		assertEquals(1, ElementKind.INT8.getBytesPerComponent());
		assertEquals(8, ElementKind.VECTOR_FLOAT64.getBytesPerComponent());
	}

	@Test
	public void test_valueTypes() {
		assertTrue(ElementKind.INT32.isSignedInteger());
		assertFalse(ElementKind.INT32.isUnsignedInteger());
		assertTrue(ElementKind.UINT64.isUnsignedInteger());
		assertTrue(ElementKind.FLOAT32.isFloatingPoint());
		assertFalse(ElementKind.FLOAT32.isSignedInteger());
		assertTrue(ElementKind.VECTOR_FLOAT32.isFloatingPoint());
	}

}
