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

import java.util.Arrays;

import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Physical layout of an image: size in pixels, pixel spacing, origin and direction cosines.
 * <p>
 * The direction is a row-major {@code d x d} matrix whose columns give the physical direction
 * of each image axis. A physical point is computed from a continuous index as
 * {@code origin + direction * (spacing .* index)}.
 * <p>
 * Instances are immutable; arrays are copied on the way in and on the way out.
 * 
 * @author SimpleReg developers
 */
public final class ImageGeometry {

	private final long[] size;
	private final long nPixels;
	private final double[] spacing;
	private final double[] origin;
	private final double[] direction;

	private final RealMatrix inverseDirection;

	private ImageGeometry(long[] size, long nPixels, double[] spacing, double[] origin, double[] direction, RealMatrix inverseDirection) {
		this.size = size;
		this.nPixels = nPixels;
		this.spacing = spacing;
		this.origin = origin;
		this.direction = direction;
		this.inverseDirection = inverseDirection;
	}

	/**
	 * Get the number of spatial dimensions.
	 * @return
	 */
	public int getDimension() {
		return size.length;
	}

	/**
	 * Get the image size in pixels along each axis.
	 * @return
	 */
	public long[] getSize() {
		return size.clone();
	}

	/**
	 * Get the size along a single axis.
	 * @param axis
	 * @return
	 */
	public long getSize(int axis) {
		return size[axis];
	}

	/**
	 * Get the total number of pixels.
	 * @return
	 */
	public long getNumberOfPixels() {
		return nPixels;
	}

	/**
	 * Get the pixel spacing along each axis.
	 * @return
	 */
	public double[] getSpacing() {
		return spacing.clone();
	}

	/**
	 * Get the physical coordinates of the center of the first pixel.
	 * @return
	 */
	public double[] getOrigin() {
		return origin.clone();
	}

	/**
	 * Get the direction cosines as a flattened, row-major matrix.
	 * @return
	 */
	public double[] getDirection() {
		return direction.clone();
	}

	/**
	 * Returns true if the direction matrix is the identity.
	 * @return
	 */
	public boolean hasIdentityDirection() {
		return Arrays.equals(direction, identity(size.length));
	}

	/**
	 * Convert a continuous index into a physical point.
	 * @param index continuous index, length {@link #getDimension()}
	 * @param point array to receive the physical point
	 */
	public void indexToPhysicalPoint(double[] index, double[] point) {
		int d = size.length;
		for (int r = 0; r < d; r++) {
			double sum = origin[r];
			for (int c = 0; c < d; c++)
				sum += direction[r * d + c] * spacing[c] * index[c];
			point[r] = sum;
		}
	}

	/**
	 * Convert a physical point into a continuous index.
	 * @param point physical point, length {@link #getDimension()}
	 * @param index array to receive the continuous index
	 */
	public void physicalPointToIndex(double[] point, double[] index) {
		int d = size.length;
		for (int r = 0; r < d; r++) {
			double sum = 0;
			for (int c = 0; c < d; c++)
				sum += inverseDirection.getEntry(r, c) * (point[c] - origin[c]);
			index[r] = sum / spacing[r];
		}
	}

	/**
	 * Returns true if the continuous index lies within the image, allowing half a pixel
	 * beyond the first and last pixel centers.
	 * @param index
	 * @return
	 */
	public boolean isInside(double[] index) {
		for (int i = 0; i < size.length; i++) {
			if (index[i] < -0.5 || index[i] > size[i] - 0.5)
				return false;
		}
		return true;
	}

	/**
	 * Returns true if both geometries have the same size, spacing, origin and direction.
	 * @param other
	 * @param tolerance absolute tolerance for spacing, origin and direction
	 * @return
	 */
	public boolean isSameGrid(ImageGeometry other, double tolerance) {
		if (!Arrays.equals(size, other.size))
			return false;
		return allClose(spacing, other.spacing, tolerance) &&
				allClose(origin, other.origin, tolerance) &&
				allClose(direction, other.direction, tolerance);
	}

	private static boolean allClose(double[] a, double[] b, double tolerance) {
		for (int i = 0; i < a.length; i++) {
			if (Math.abs(a[i] - b[i]) > tolerance)
				return false;
		}
		return true;
	}

	static double[][] toMatrix(double[] rowMajor, int d) {
		double[][] matrix = new double[d][d];
		for (int r = 0; r < d; r++)
			System.arraycopy(rowMajor, r * d, matrix[r], 0, d);
		return matrix;
	}

	/**
	 * Create a flattened identity matrix.
	 * @param d
	 * @return
	 */
	public static double[] identity(int d) {
		double[] identity = new double[d * d];
		for (int i = 0; i < d; i++)
			identity[i * d + i] = 1.0;
		return identity;
	}

	@Override
	public String toString() {
		return "ImageGeometry [size=" + Arrays.toString(size) + ", spacing=" + Arrays.toString(spacing)
				+ ", origin=" + Arrays.toString(origin) + ", direction=" + Arrays.toString(direction) + "]";
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + Arrays.hashCode(direction);
		result = prime * result + Arrays.hashCode(origin);
		result = prime * result + Arrays.hashCode(size);
		result = prime * result + Arrays.hashCode(spacing);
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
		ImageGeometry other = (ImageGeometry) obj;
		return Arrays.equals(size, other.size) && Arrays.equals(spacing, other.spacing) &&
				Arrays.equals(origin, other.origin) && Arrays.equals(direction, other.direction);
	}


	/**
	 * Builder to create a new {@link ImageGeometry}.
	 * Spacing defaults to 1 along each axis, origin to 0 and direction to the identity.
	 */
	public static class Builder {

		private long[] size;
		private double[] spacing;
		private double[] origin;
		private double[] direction;

		/**
		 * Builder for a geometry with the specified size.
		 * @param size number of pixels along each axis
		 */
		public Builder(long... size) {
			this.size = size == null ? null : size.clone();
		}

		/**
		 * Builder initialized from an existing geometry.
		 * @param geometry
		 */
		public Builder(ImageGeometry geometry) {
			this.size = geometry.getSize();
			this.spacing = geometry.getSpacing();
			this.origin = geometry.getOrigin();
			this.direction = geometry.getDirection();
		}

		/**
		 * Set the pixel spacing, or null to use the default.
		 * @param spacing
		 * @return
		 */
		public Builder spacing(double... spacing) {
			this.spacing = spacing == null ? null : spacing.clone();
			return this;
		}

		/**
		 * Set the origin, or null to use the default.
		 * @param origin
		 * @return
		 */
		public Builder origin(double... origin) {
			this.origin = origin == null ? null : origin.clone();
			return this;
		}

		/**
		 * Set the row-major direction matrix, or null to use the identity.
		 * @param direction
		 * @return
		 */
		public Builder direction(double... direction) {
			this.direction = direction == null ? null : direction.clone();
			return this;
		}

		/**
		 * Build the geometry.
		 * @return
		 * @throws IllegalArgumentException if any value is inconsistent with the size
		 */
		public ImageGeometry build() {
			if (size == null || size.length == 0)
				throw new IllegalArgumentException("Image size must have at least one dimension");
			int d = size.length;
			long nPixels = 1;
			for (long s : size) {
				if (s <= 0)
					throw new IllegalArgumentException("Image size must be positive along every axis, but was " + Arrays.toString(size));
				try {
					nPixels = Math.multiplyExact(nPixels, s);
				} catch (ArithmeticException e) {
					throw new IllegalArgumentException("Number of pixels overflows for size " + Arrays.toString(size), e);
				}
			}
			double[] spacing = this.spacing;
			if (spacing == null) {
				spacing = new double[d];
				Arrays.fill(spacing, 1.0);
			} else if (spacing.length != d) {
				throw new IllegalArgumentException("Spacing has " + spacing.length + " values, but image has " + d + " dimensions");
			}
			for (double s : spacing) {
				if (!(s > 0) || !Double.isFinite(s))
					throw new IllegalArgumentException("Spacing must be positive and finite, but was " + Arrays.toString(spacing));
			}
			double[] origin = this.origin;
			if (origin == null)
				origin = new double[d];
			else if (origin.length != d)
				throw new IllegalArgumentException("Origin has " + origin.length + " values, but image has " + d + " dimensions");
			double[] direction = this.direction;
			if (direction == null || direction.length == 0)
				direction = identity(d);
			else if (direction.length != d * d)
				throw new IllegalArgumentException("Direction must have " + (d * d) + " values for a " + d + "D image, but has " + direction.length);
			var lu = new LUDecomposition(MatrixUtils.createRealMatrix(toMatrix(direction, d)));
			if (Math.abs(lu.getDeterminant()) < 1e-12)
				throw new IllegalArgumentException("Direction matrix is singular: " + Arrays.toString(direction));
			return new ImageGeometry(size.clone(), nPixels, spacing.clone(), origin.clone(), direction.clone(), lu.getSolver().getInverse());
		}

	}

}
