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
import java.util.Objects;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;

/**
 * A concretely typed image, backed by an imglib2 {@link Img}.
 * <p>
 * Scalar images use an {@code Img} with the same dimensions as the image geometry.
 * Vector images store their components interleaved, so the {@code Img} has one extra leading axis
 * (the fastest varying in memory) with a length equal to the number of components per pixel.
 * <p>
 * An image may belong to a {@link ComputeContext}. Once that context is closed the pixel data is
 * no longer valid, and any attempt to read it fails.
 *
 * @param <T> imglib2 pixel type
 * @author SimpleReg developers
 */
public final class TypedImage<T extends RealType<T> & NativeType<T>> {

	private final PixelKind<T> pixelKind;
	private final ElementKind elementKind;
	private final int componentsPerPixel;
	private final ImageGeometry geometry;
	private final Img<T> img;
	private final ComputeContext context;

	private TypedImage(PixelKind<T> pixelKind, ElementKind elementKind, int componentsPerPixel,
			ImageGeometry geometry, Img<T> img, ComputeContext context) {
		this.pixelKind = pixelKind;
		this.elementKind = elementKind;
		this.componentsPerPixel = componentsPerPixel;
		this.geometry = geometry;
		this.img = img;
		this.context = context;
	}

	/**
	 * Wrap an existing buffer without copying.
	 * <p>
	 * For vector kinds the number of components determines the layout of the backing image,
	 * so it is fixed before the buffer is attached.
	 *
	 * @param <T>
	 * @param pixelKind storage binding of the component kind
	 * @param elementKind scalar or vector element kind, with component kind matching {@code pixelKind}
	 * @param componentsPerPixel number of interleaved components, 1 for scalar kinds
	 * @param geometry image geometry
	 * @param buffer Java array of {@link PixelKind#getBufferClass()}
	 * @return
	 * @throws IllegalArgumentException if the buffer does not have the expected class or length
	 */
	public static <T extends RealType<T> & NativeType<T>> TypedImage<T> wrap(PixelKind<T> pixelKind, ElementKind elementKind,
			int componentsPerPixel, ImageGeometry geometry, Object buffer) {
		checkKinds(pixelKind, elementKind, componentsPerPixel);
		long[] dims = imgDimensions(elementKind, componentsPerPixel, geometry);
		long expected = componentsPerPixel * geometry.getNumberOfPixels();
		long length = pixelKind.bufferLength(buffer);
		if (length != expected)
			throw new IllegalArgumentException("Buffer has " + length + " elements, but " + expected + " are required for size " +
					Arrays.toString(geometry.getSize()) + " with " + componentsPerPixel + " component(s) per pixel");
		return new TypedImage<>(pixelKind, elementKind, componentsPerPixel, geometry, pixelKind.wrap(buffer, dims), null);
	}

	/**
	 * Allocate a new, zero-filled image that is not owned by any compute context.
	 *
	 * @param <T>
	 * @param pixelKind
	 * @param elementKind
	 * @param componentsPerPixel
	 * @param geometry
	 * @return
	 */
	public static <T extends RealType<T> & NativeType<T>> TypedImage<T> allocate(PixelKind<T> pixelKind, ElementKind elementKind,
			int componentsPerPixel, ImageGeometry geometry) {
		return allocate(pixelKind, elementKind, componentsPerPixel, geometry, null);
	}

	static <T extends RealType<T> & NativeType<T>> TypedImage<T> allocate(PixelKind<T> pixelKind, ElementKind elementKind,
			int componentsPerPixel, ImageGeometry geometry, ComputeContext context) {
		checkKinds(pixelKind, elementKind, componentsPerPixel);
		long[] dims = imgDimensions(elementKind, componentsPerPixel, geometry);
		return new TypedImage<>(pixelKind, elementKind, componentsPerPixel, geometry, pixelKind.allocate(dims), context);
	}

	private static void checkKinds(PixelKind<?> pixelKind, ElementKind elementKind, int componentsPerPixel) {
		Objects.requireNonNull(pixelKind);
		if (elementKind.getComponentKind() != pixelKind.getElementKind())
			throw new IllegalArgumentException(elementKind + " cannot be stored using " + pixelKind);
		if (componentsPerPixel < 1)
			throw new IllegalArgumentException("Number of components per pixel must be >= 1, but was " + componentsPerPixel);
		if (!elementKind.isVector() && componentsPerPixel != 1)
			throw new IllegalArgumentException("Scalar kind " + elementKind + " cannot have " + componentsPerPixel + " components per pixel");
	}

	private static long[] imgDimensions(ElementKind elementKind, int componentsPerPixel, ImageGeometry geometry) {
		long[] size = geometry.getSize();
		if (!elementKind.isVector())
			return size;
		long[] dims = new long[size.length + 1];
		dims[0] = componentsPerPixel;
		System.arraycopy(size, 0, dims, 1, size.length);
		return dims;
	}

	/**
	 * Get the storage binding for the pixel components.
	 * @return
	 */
	public PixelKind<T> getPixelKind() {
		return pixelKind;
	}

	/**
	 * Get the element kind, which may be a vector kind.
	 * @return
	 */
	public ElementKind getElementKind() {
		return elementKind;
	}

	/**
	 * Get the descriptor identifying the element kind and dimension.
	 * @return
	 */
	public TypeDescriptor getTypeDescriptor() {
		return TypeDescriptor.of(elementKind, geometry.getDimension());
	}

	/**
	 * Get the number of components stored for each pixel.
	 * @return
	 */
	public int getNumberOfComponentsPerPixel() {
		return componentsPerPixel;
	}

	/**
	 * Get the image geometry.
	 * @return
	 */
	public ImageGeometry getGeometry() {
		return geometry;
	}

	/**
	 * Get the compute context that owns this image's data, or null if the image owns its own data.
	 * @return
	 */
	public ComputeContext getContext() {
		return context;
	}

	/**
	 * Get the backing imglib2 image. For vector kinds this includes the leading component axis.
	 * @return
	 * @throws IllegalStateException if the owning compute context has been closed
	 */
	public Img<T> getImg() {
		checkValid();
		return img;
	}

	/**
	 * Get a view of a single component, with the same dimensions as the image geometry.
	 * @param component
	 * @return
	 */
	public RandomAccessibleInterval<T> getComponent(int component) {
		checkValid();
		if (component < 0 || component >= componentsPerPixel)
			throw new IndexOutOfBoundsException("Component " + component + " out of range for " + componentsPerPixel + " component(s)");
		if (!elementKind.isVector())
			return img;
		return Views.hyperSlice(img, 0, component);
	}

	/**
	 * Read one component of a pixel as a double.
	 * @param component
	 * @param index pixel index, one value per spatial dimension
	 * @return
	 */
	public double getComponentAsDouble(int component, long... index) {
		return access(component, index).get().getRealDouble();
	}

	/**
	 * Set one component of a pixel from a double, using the conversion of the pixel type.
	 * @param value
	 * @param component
	 * @param index pixel index, one value per spatial dimension
	 */
	public void setComponentAsDouble(double value, int component, long... index) {
		access(component, index).get().setReal(value);
	}

	private RandomAccess<T> access(int component, long[] index) {
		checkValid();
		int d = geometry.getDimension();
		if (index.length != d)
			throw new IllegalArgumentException("Index has " + index.length + " values, but image has " + d + " dimensions");
		for (int i = 0; i < d; i++) {
			if (index[i] < 0 || index[i] >= geometry.getSize(i))
				throw new IndexOutOfBoundsException("Index " + Arrays.toString(index) + " outside image of size " + Arrays.toString(geometry.getSize()));
		}
		if (component < 0 || component >= componentsPerPixel)
			throw new IndexOutOfBoundsException("Component " + component + " out of range for " + componentsPerPixel + " component(s)");
		RandomAccess<T> ra = img.randomAccess();
		if (elementKind.isVector()) {
			ra.setPosition(component, 0);
			for (int i = 0; i < d; i++)
				ra.setPosition(index[i], i + 1);
		} else
			ra.setPosition(index);
		return ra;
	}

	/**
	 * Create a deep copy of this image. The copy is not owned by any compute context.
	 * @return
	 */
	public TypedImage<T> copy() {
		checkValid();
		return new TypedImage<>(pixelKind, elementKind, componentsPerPixel, geometry, img.copy(), null);
	}

	/**
	 * Returns true if the pixel data can still be read.
	 * @return
	 */
	public boolean isValid() {
		return context == null || !context.isClosed();
	}

	private void checkValid() {
		if (!isValid())
			throw new IllegalStateException("Pixel data of " + this + " belonged to a compute context that has been closed");
	}

	/**
	 * Zero the pixel data, called when the owning context is closed.
	 */
	void release() {
		for (T t : img)
			t.setZero();
	}

	@Override
	public String toString() {
		return "TypedImage[" + getTypeDescriptor() + (componentsPerPixel > 1 ? ", " + componentsPerPixel + " components" : "") +
				", size=" + Arrays.toString(geometry.getSize()) + "]";
	}

}
