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

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;

/**
 * A runtime-typed image.
 * <p>
 * The pixel type and dimension of an Image are only known at runtime, through its
 * {@link TypeDescriptor}. Operations that need the concrete pixel type are looked up
 * using the descriptor and then work with the underlying {@link TypedImage}.
 * <p>
 * Copying an Image with {@link #Image(Image)} is cheap: both instances share the same pixel data
 * until one of them is modified, at which point the modified instance makes its own copy.
 * The descriptor of an Image never changes.
 * 
 * @author SimpleReg developers
 */
public class Image {

	private TypedImage<?> typed;
	private AtomicInteger holders;

	private Image(TypedImage<?> typed) {
		this.typed = Objects.requireNonNull(typed);
		this.holders = new AtomicInteger(1);
	}

	/**
	 * Create an image that shares its pixel data with another image.
	 * @param image
	 */
	public Image(Image image) {
		this.typed = image.typed;
		this.holders = image.holders;
		this.holders.incrementAndGet();
	}

	/**
	 * Wrap a typed image.
	 * The pixel data is not copied.
	 * @param typed
	 * @return
	 */
	public static Image wrap(TypedImage<?> typed) {
		return new Image(typed);
	}

	/**
	 * Create a new, zero-filled scalar image.
	 * @param kind scalar element kind
	 * @param size number of pixels along each axis
	 * @return
	 */
	public static Image create(ElementKind kind, long... size) {
		return create(kind, 1, new ImageGeometry.Builder(size).build());
	}

	/**
	 * Create a new, zero-filled image.
	 * @param kind scalar or vector element kind
	 * @param componentsPerPixel must be 1 for scalar kinds
	 * @param geometry
	 * @return
	 */
	public static Image create(ElementKind kind, int componentsPerPixel, ImageGeometry geometry) {
		return new Image(TypedImage.allocate(PixelKind.of(kind), kind, componentsPerPixel, geometry));
	}

	/**
	 * Get the descriptor identifying the element kind and dimension of this image.
	 * @return
	 */
	public TypeDescriptor getTypeDescriptor() {
		return typed.getTypeDescriptor();
	}

	/**
	 * Get the element kind of this image.
	 * @return
	 */
	public ElementKind getElementKind() {
		return typed.getElementKind();
	}

	/**
	 * Get the storage binding of this image's components.
	 * @return
	 */
	public PixelKind<?> getPixelKind() {
		return typed.getPixelKind();
	}

	/**
	 * Get the number of spatial dimensions.
	 * @return
	 */
	public int getDimension() {
		return typed.getGeometry().getDimension();
	}

	/**
	 * Get the number of components per pixel; 1 for scalar images.
	 * @return
	 */
	public int getNumberOfComponentsPerPixel() {
		return typed.getNumberOfComponentsPerPixel();
	}

	/**
	 * Get the image geometry.
	 * @return
	 */
	public ImageGeometry getGeometry() {
		return typed.getGeometry();
	}

	/**
	 * Get the size in pixels along each axis.
	 * @return
	 */
	public long[] getSize() {
		return typed.getGeometry().getSize();
	}

	/**
	 * Get the image width (size along the first axis).
	 * @return
	 */
	public long getWidth() {
		return typed.getGeometry().getSize(0);
	}

	/**
	 * Get the image height (size along the second axis), or 0 for 1D images.
	 * @return
	 */
	public long getHeight() {
		return getDimension() > 1 ? typed.getGeometry().getSize(1) : 0;
	}

	/**
	 * Get the image depth (size along the third axis), or 0 for images with fewer than 3 dimensions.
	 * @return
	 */
	public long getDepth() {
		return getDimension() > 2 ? typed.getGeometry().getSize(2) : 0;
	}

	/**
	 * Get the total number of pixels.
	 * @return
	 */
	public long getNumberOfPixels() {
		return typed.getGeometry().getNumberOfPixels();
	}

	/**
	 * Get the pixel spacing.
	 * @return
	 */
	public double[] getSpacing() {
		return typed.getGeometry().getSpacing();
	}

	/**
	 * Get the physical origin.
	 * @return
	 */
	public double[] getOrigin() {
		return typed.getGeometry().getOrigin();
	}

	/**
	 * Get the direction cosines as a row-major matrix.
	 * @return
	 */
	public double[] getDirection() {
		return typed.getGeometry().getDirection();
	}

	/**
	 * Get the value of a scalar pixel, or the first component of a vector pixel.
	 * @param index
	 * @return
	 */
	public double getPixelAsDouble(long... index) {
		return typed.getComponentAsDouble(0, index);
	}

	/**
	 * Get the value of one component of a pixel.
	 * @param component
	 * @param index
	 * @return
	 */
	public double getComponentAsDouble(int component, long... index) {
		return typed.getComponentAsDouble(component, index);
	}

	/**
	 * Set the value of a scalar pixel, or the first component of a vector pixel.
	 * If the pixel data is shared it is copied first.
	 * @param value
	 * @param index
	 */
	public void setPixelAsDouble(double value, long... index) {
		setComponentAsDouble(value, 0, index);
	}

	/**
	 * Set the value of one component of a pixel.
	 * If the pixel data is shared it is copied first.
	 * @param value
	 * @param component
	 * @param index
	 */
	public void setComponentAsDouble(double value, int component, long... index) {
		makeUnique();
		typed.setComponentAsDouble(value, component, index);
	}

	/**
	 * Get the underlying typed image.
	 * Changes made through the typed image are visible to every Image sharing its data.
	 * @return
	 */
	public TypedImage<?> getTypedImage() {
		return typed;
	}

	/**
	 * Get the underlying typed image, checking that it has the expected pixel type.
	 * @param <T>
	 * @param pixelKind the expected storage binding
	 * @return
	 * @throws IllegalArgumentException if the image stores a different pixel type
	 */
	@SuppressWarnings("unchecked")
	public <T extends RealType<T> & NativeType<T>> TypedImage<T> getTypedImage(PixelKind<T> pixelKind) {
		if (typed.getPixelKind() != pixelKind)
			throw new IllegalArgumentException("Image of " + getTypeDescriptor() + " cannot be accessed as " + pixelKind);
		return (TypedImage<T>)typed;
	}

	/**
	 * Returns true if this Image is the only holder of its pixel data, and the data is not owned
	 * by a compute context.
	 * @return
	 */
	public boolean isUnique() {
		return holders.get() == 1 && typed.getContext() == null;
	}

	/**
	 * Ensure this Image exclusively owns its pixel data, making a deep copy if necessary.
	 * <p>
	 * This must be called for any image whose data belongs to a compute context before that
	 * context is closed, if the image is to be used afterwards.
	 */
	public void makeUnique() {
		if (isUnique())
			return;
		typed = typed.copy();
		holders.decrementAndGet();
		holders = new AtomicInteger(1);
	}

	@Override
	public String toString() {
		return "Image[" + typed + "]";
	}

}
