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
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;

/**
 * Transient workspace in which a dispatched operation allocates its working and output images.
 * <p>
 * Images allocated here remain owned by the context: when the context is closed their data is
 * released and they can no longer be read. Anything that must outlive the context has to be
 * copied first, see {@link #export(TypedImage)}.
 * <p>
 * A context is used by a single thread for a single operation.
 * 
 * @author SimpleReg developers
 */
public class ComputeContext implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ComputeContext.class);

	private final String name;
	private final List<TypedImage<?>> images = new ArrayList<>();
	private final Set<TypedImage<?>> borrowed = Collections.newSetFromMap(new IdentityHashMap<>());
	private boolean closed = false;

	/**
	 * Create a new context.
	 * @param name name used for logging
	 */
	public ComputeContext(String name) {
		this.name = name;
	}

	/**
	 * Allocate a zero-filled scalar image owned by this context.
	 * @param <T>
	 * @param pixelKind
	 * @param geometry
	 * @return
	 */
	public <T extends RealType<T> & NativeType<T>> TypedImage<T> allocate(PixelKind<T> pixelKind, ImageGeometry geometry) {
		return allocate(pixelKind, pixelKind.getElementKind(), 1, geometry);
	}

	/**
	 * Allocate a zero-filled image owned by this context.
	 * @param <T>
	 * @param pixelKind
	 * @param elementKind scalar or vector kind
	 * @param componentsPerPixel
	 * @param geometry
	 * @return
	 */
	public <T extends RealType<T> & NativeType<T>> TypedImage<T> allocate(PixelKind<T> pixelKind, ElementKind elementKind,
			int componentsPerPixel, ImageGeometry geometry) {
		if (closed)
			throw new IllegalStateException("Cannot allocate from closed context " + name);
		var image = TypedImage.allocate(pixelKind, elementKind, componentsPerPixel, geometry, this);
		images.add(image);
		return image;
	}

	/**
	 * Returns true if the image was allocated by this context.
	 * @param image
	 * @return
	 */
	public boolean owns(TypedImage<?> image) {
		return image.getContext() == this;
	}

	/**
	 * Mark an image as wrapping memory supplied by the caller of the operation.
	 * A borrowed output is returned by {@link #export(TypedImage)} without copying.
	 * @param <T>
	 * @param image
	 * @return the same image
	 */
	public <T extends RealType<T> & NativeType<T>> TypedImage<T> borrow(TypedImage<T> image) {
		if (owns(image))
			throw new IllegalArgumentException("Cannot borrow an image allocated by " + this);
		borrowed.add(image);
		return image;
	}

	/**
	 * Returns true if the image has been marked with {@link #borrow(TypedImage)}.
	 * @param image
	 * @return
	 */
	public boolean isBorrowed(TypedImage<?> image) {
		return borrowed.contains(image);
	}

	/**
	 * Convert the output of an operation into an Image that remains valid after this context is closed.
	 * <p>
	 * The output is deep-copied unless it was borrowed, so the result never shares pixel data with
	 * this context or with any input image.
	 * @param output
	 * @return
	 */
	public Image export(TypedImage<?> output) {
		if (closed)
			throw new IllegalStateException("Cannot export from closed context " + name);
		if (isBorrowed(output))
			return Image.wrap(output);
		return Image.wrap(output.copy());
	}

	/**
	 * Get the number of images allocated by this context.
	 * @return
	 */
	public int getAllocationCount() {
		return images.size();
	}

	/**
	 * Returns true once {@link #close()} has been called.
	 * @return
	 */
	public boolean isClosed() {
		return closed;
	}

	/**
	 * Release all images allocated by this context.
	 * Calling this more than once has no further effect.
	 */
	@Override
	public void close() {
		if (closed)
			return;
		for (var image : images)
			image.release();
		logger.trace("Closed {}, released {} image(s)", name, images.size());
		images.clear();
		borrowed.clear();
		closed = true;
	}

	@Override
	public String toString() {
		return "ComputeContext[" + name + "]";
	}

}
