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

@SuppressWarnings("javadoc")
public class TestImageGeometry {

	private static final double EPS = 1e-9;

	@Test
	public void test_defaults() {
		var geometry = new ImageGeometry.Builder(4, 5).build();
		assertEquals(2, geometry.getDimension());
		assertArrayEquals(new long[] {4, 5}, geometry.getSize());
		assertEquals(20, geometry.getNumberOfPixels());
		assertArrayEquals(new double[] {1, 1}, geometry.getSpacing(), 0.0);
		assertArrayEquals(new double[] {0, 0}, geometry.getOrigin(), 0.0);
		assertArrayEquals(new double[] {1, 0, 0, 1}, geometry.getDirection(), 0.0);
		assertTrue(geometry.hasIdentityDirection());
	}

	@Test
	public void test_physicalPoints() {
		// 90 degree rotation
		var geometry = new ImageGeometry.Builder(10, 20)
				.spacing(0.5, 2.0)
				.origin(3, -1)
				.direction(0, -1, 1, 0)
				.build();
		assertFalse(geometry.hasIdentityDirection());

		double[] point = new double[2];
		geometry.indexToPhysicalPoint(new double[] {2, 3}, point);
		// x = 3 + (-1 * 2.0 * 3), y = -1 + (1 * 0.5 * 2)
		assertEquals(-3.0, point[0], EPS);
		assertEquals(0.0, point[1], EPS);

		double[] index = new double[2];
		geometry.physicalPointToIndex(point, index);
		assertArrayEquals(new double[] {2, 3}, index, EPS);
	}

	@Test
	public void test_isInside() {
		var geometry = new ImageGeometry.Builder(4, 4).build();
		assertTrue(geometry.isInside(new double[] {0, 0}));
		assertTrue(geometry.isInside(new double[] {-0.5, 3.5}));
		assertFalse(geometry.isInside(new double[] {-0.6, 0}));
		assertFalse(geometry.isInside(new double[] {0, 3.6}));
	}

	@Test
	public void test_invalid() {
		assertThrows(IllegalArgumentException.class, () -> new ImageGeometry.Builder().build());
		assertThrows(IllegalArgumentException.class, () -> new ImageGeometry.Builder(4, 0).build());
		assertThrows(IllegalArgumentException.class, () -> new ImageGeometry.Builder(4, 4).spacing(1).build());
		assertThrows(IllegalArgumentException.class, () -> new ImageGeometry.Builder(4, 4).spacing(1, -1).build());
		assertThrows(IllegalArgumentException.class, () -> new ImageGeometry.Builder(4, 4).spacing(1, Double.NaN).build());
		assertThrows(IllegalArgumentException.class, () -> new ImageGeometry.Builder(4, 4).origin(0, 0, 0).build());
		assertThrows(IllegalArgumentException.class, () -> new ImageGeometry.Builder(4, 4).direction(1, 0, 0).build());
		assertThrows(IllegalArgumentException.class, () -> new ImageGeometry.Builder(4, 4).direction(1, 2, 2, 4).build());
		assertThrows(IllegalArgumentException.class, () -> new ImageGeometry.Builder(1L << 32, 1L << 32).build());
		assertThrows(IllegalArgumentException.class, () -> new ImageGeometry.Builder(Long.MAX_VALUE, 2).build());
		assertEquals(1L << 40, new ImageGeometry.Builder(1L << 20, 1L << 20).build().getNumberOfPixels());
	}

	@Test
	public void test_equality() {
		var a = new ImageGeometry.Builder(4, 4, 2).spacing(1, 1, 2.5).build();
		var b = new ImageGeometry.Builder(a).build();
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		assertTrue(a.isSameGrid(b, 0.0));

		var c = new ImageGeometry.Builder(a).origin(0, 0, 1e-3).build();
		assertNotEquals(a, c);
		assertTrue(a.isSameGrid(c, 1e-2));
		assertFalse(a.isSameGrid(c, 1e-4));
	}

}
