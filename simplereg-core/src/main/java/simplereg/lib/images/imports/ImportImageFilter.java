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

package simplereg.lib.images.imports;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import simplereg.lib.dispatch.DispatchRegistry;
import simplereg.lib.dispatch.SingleDispatcher;
import simplereg.lib.dispatch.SingleTypedFunction;
import simplereg.lib.images.ElementKind;
import simplereg.lib.images.Image;
import simplereg.lib.images.ImageGeometry;
import simplereg.lib.images.PixelKind;
import simplereg.lib.images.TypeDescriptor;
import simplereg.lib.images.TypedImage;

/**
 * Create an {@link Image} from a Java array of pixel values.
 * <p>
 * This is intended to interface with other libraries that have their own representation of
 * an image. The buffer is wrapped rather than copied, so later changes to the array are
 * visible in the image (and vice versa).
 * <p>
 * Pixels are expected in row-major order with the first axis varying fastest. For vector images
 * the components of each pixel are stored next to one another.
 * Unsigned element kinds are read from the signed array of the same bit depth, e.g.
 * {@link #setBufferAsUInt16(short[], int)}.
 * <p>
 * Example:
 * <pre>
 * Image image = new ImportImageFilter()
 *         .setSize(512, 512)
 *         .setSpacing(0.5, 0.5)
 *         .setBufferAsUInt8(pixels)
 *         .execute();
 * </pre>
 *
 * @see ImageImports
 * @author SimpleReg developers
 */
public class ImportImageFilter {

	private static final Logger logger = LoggerFactory.getLogger(ImportImageFilter.class);

	private long[] size = new long[0];
	private double[] spacing;
	private double[] origin;
	private double[] direction;

	private Object buffer;
	private ElementKind elementKind = ElementKind.UINT8;
	private int numberOfComponents = 1;

	/**
	 * Set the number of pixels along each axis. The length determines the image dimension.
	 * @param size
	 * @return this filter
	 */
	public ImportImageFilter setSize(long... size) {
		this.size = size == null ? new long[0] : size.clone();
		return this;
	}

	/**
	 * Set the number of pixels along each axis.
	 * @param size
	 * @return this filter
	 */
	public ImportImageFilter setSize(int... size) {
		if (size == null)
			return setSize((long[])null);
		return setSize(Arrays.stream(size).asLongStream().toArray());
	}

	/**
	 * Get the number of pixels along each axis.
	 * @return
	 */
	public long[] getSize() {
		return size.clone();
	}

	/**
	 * Set the pixel spacing; if not set, 1.0 is used for each axis.
	 * @param spacing
	 * @return this filter
	 */
	public ImportImageFilter setSpacing(double... spacing) {
		this.spacing = spacing == null ? null : spacing.clone();
		return this;
	}

	/**
	 * Get the pixel spacing, or null if the default will be used.
	 * @return
	 */
	public double[] getSpacing() {
		return spacing == null ? null : spacing.clone();
	}

	/**
	 * Set the physical origin; if not set, 0.0 is used for each axis.
	 * @param origin
	 * @return this filter
	 */
	public ImportImageFilter setOrigin(double... origin) {
		this.origin = origin == null ? null : origin.clone();
		return this;
	}

	/**
	 * Get the physical origin, or null if the default will be used.
	 * @return
	 */
	public double[] getOrigin() {
		return origin == null ? null : origin.clone();
	}

	/**
	 * Set the direction cosines as a flattened row-major matrix; if not set the identity is used.
	 * @param direction
	 * @return this filter
	 */
	public ImportImageFilter setDirection(double... direction) {
		this.direction = direction == null ? null : direction.clone();
		return this;
	}

	/**
	 * Get the direction cosines, or null if the identity will be used.
	 * @return
	 */
	public double[] getDirection() {
		return direction == null ? null : direction.clone();
	}

	/**
	 * Set the buffer with an explicit element kind.
	 * @param kind element kind; vector kinds may have any number of components
	 * @param buffer Java array matching {@link PixelKind#getBufferClass()} for the kind
	 * @param numberOfComponents components per pixel; must be 1 for scalar kinds
	 * @return this filter
	 */
	public ImportImageFilter setBuffer(ElementKind kind, Object buffer, int numberOfComponents) {
		this.elementKind = kind;
		this.buffer = buffer;
		this.numberOfComponents = numberOfComponents;
		return this;
	}

	/**
	 * Set the buffer with an explicit scalar element kind.
	 * @param kind
	 * @param buffer
	 * @return this filter
	 */
	public ImportImageFilter setBuffer(ElementKind kind, Object buffer) {
		return setBuffer(kind, buffer, 1);
	}

	private ImportImageFilter setBufferAs(ElementKind scalarKind, Object buffer, int numberOfComponents) {
		return setBuffer(numberOfComponents > 1 ? scalarKind.getVectorKind() : scalarKind, buffer, numberOfComponents);
	}

	/**
	 * Set a buffer of signed 8-bit values.
	 * @param buffer
	 * @param numberOfComponents if greater than 1, a vector image is created
	 * @return this filter
	 */
	public ImportImageFilter setBufferAsInt8(byte[] buffer, int numberOfComponents) {
		return setBufferAs(ElementKind.INT8, buffer, numberOfComponents);
	}

	/**
	 * Set a buffer of signed 8-bit values, one per pixel.
	 * @param buffer
	 * @return this filter
	 */
	public ImportImageFilter setBufferAsInt8(byte[] buffer) {
		return setBufferAsInt8(buffer, 1);
	}

	/**
	 * Set a buffer of unsigned 8-bit values.
	 * @param buffer
	 * @param numberOfComponents if greater than 1, a vector image is created
	 * @return this filter
	 */
	public ImportImageFilter setBufferAsUInt8(byte[] buffer, int numberOfComponents) {
		return setBufferAs(ElementKind.UINT8, buffer, numberOfComponents);
	}

	/**
	 * Set a buffer of unsigned 8-bit values, one per pixel.
	 * @param buffer
	 * @return this filter
	 */
	public ImportImageFilter setBufferAsUInt8(byte[] buffer) {
		return setBufferAsUInt8(buffer, 1);
	}

	/**
	 * Set a buffer of signed 16-bit values.
	 * @param buffer
	 * @param numberOfComponents if greater than 1, a vector image is created
	 * @return this filter
	 */
	public ImportImageFilter setBufferAsInt16(short[] buffer, int numberOfComponents) {
		return setBufferAs(ElementKind.INT16, buffer, numberOfComponents);
	}

	/**
	 * Set a buffer of signed 16-bit values, one per pixel.
	 * @param buffer
	 * @return this filter
	 */
	public ImportImageFilter setBufferAsInt16(short[] buffer) {
		return setBufferAsInt16(buffer, 1);
	}

	/**
	 * Set a buffer of unsigned 16-bit values.
	 * @param buffer
	 * @param numberOfComponents if greater than 1, a vector image is created
	 * @return this filter
	 */
	public ImportImageFilter setBufferAsUInt16(short[] buffer, int numberOfComponents) {
		return setBufferAs(ElementKind.UINT16, buffer, numberOfComponents);
	}

	/**
	 * Set a buffer of unsigned 16-bit values, one per pixel.
	 * @param buffer
	 * @return this filter
	 */
	public ImportImageFilter setBufferAsUInt16(short[] buffer) {
		return setBufferAsUInt16(buffer, 1);
	}

	/**
	 * Set a buffer of signed 32-bit values.
	 * @param buffer
	 * @param numberOfComponents if greater than 1, a vector image is created
	 * @return this filter
	 */
	public ImportImageFilter setBufferAsInt32(int[] buffer, int numberOfComponents) {
		return setBufferAs(ElementKind.INT32, buffer, numberOfComponents);
	}

	/**
	 * Set a buffer of signed 32-bit values, one per pixel.
	 * @param buffer
	 * @return this filter
	 */
	public ImportImageFilter setBufferAsInt32(int[] buffer) {
		return setBufferAsInt32(buffer, 1);
	}

	/**
	 * Set a buffer of unsigned 32-bit values.
	 * @param buffer
	 * @param numberOfComponents if greater than 1, a vector image is created
	 * @return this filter
	 */
	public ImportImageFilter setBufferAsUInt32(int[] buffer, int numberOfComponents) {
		return setBufferAs(ElementKind.UINT32, buffer, numberOfComponents);
	}

	/**
	 * Set a buffer of unsigned 32-bit values, one per pixel.
	 * @param buffer
	 * @return this filter
	 */
	public ImportImageFilter setBufferAsUInt32(int[] buffer) {
		return setBufferAsUInt32(buffer, 1);
	}

	/**
	 * Set a buffer of signed 64-bit values.
	 * @param buffer
	 * @param numberOfComponents if greater than 1, a vector image is created
	 * @return this filter
	 */
	public ImportImageFilter setBufferAsInt64(long[] buffer, int numberOfComponents) {
		return setBufferAs(ElementKind.INT64, buffer, numberOfComponents);
	}

	/**
	 * Set a buffer of signed 64-bit values, one per pixel.
	 * @param buffer
	 * @return this filter
	 */
	public ImportImageFilter setBufferAsInt64(long[] buffer) {
		return setBufferAsInt64(buffer, 1);
	}

	/**
	 * Set a buffer of unsigned 64-bit values.
	 * @param buffer
	 * @param numberOfComponents if greater than 1, a vector image is created
	 * @return this filter
	 */
	public ImportImageFilter setBufferAsUInt64(long[] buffer, int numberOfComponents) {
		return setBufferAs(ElementKind.UINT64, buffer, numberOfComponents);
	}

	/**
	 * Set a buffer of unsigned 64-bit values, one per pixel.
	 * @param buffer
	 * @return this filter
	 */
	public ImportImageFilter setBufferAsUInt64(long[] buffer) {
		return setBufferAsUInt64(buffer, 1);
	}

	/**
	 * Set a buffer of 32-bit floating point values.
	 * @param buffer
	 * @param numberOfComponents if greater than 1, a vector image is created
	 * @return this filter
	 */
	public ImportImageFilter setBufferAsFloat(float[] buffer, int numberOfComponents) {
		return setBufferAs(ElementKind.FLOAT32, buffer, numberOfComponents);
	}

	/**
	 * Set a buffer of 32-bit floating point values, one per pixel.
	 * @param buffer
	 * @return this filter
	 */
	public ImportImageFilter setBufferAsFloat(float[] buffer) {
		return setBufferAsFloat(buffer, 1);
	}

	/**
	 * Set a buffer of 64-bit floating point values.
	 * @param buffer
	 * @param numberOfComponents if greater than 1, a vector image is created
	 * @return this filter
	 */
	public ImportImageFilter setBufferAsDouble(double[] buffer, int numberOfComponents) {
		return setBufferAs(ElementKind.FLOAT64, buffer, numberOfComponents);
	}

	/**
	 * Set a buffer of 64-bit floating point values, one per pixel.
	 * @param buffer
	 * @return this filter
	 */
	public ImportImageFilter setBufferAsDouble(double[] buffer) {
		return setBufferAsDouble(buffer, 1);
	}

	/**
	 * Get the element kind of the image that will be created.
	 * @return
	 */
	public ElementKind getElementKind() {
		return elementKind;
	}

	/**
	 * Get the number of components per pixel.
	 * @return
	 */
	public int getNumberOfComponentsPerPixel() {
		return numberOfComponents;
	}

	/**
	 * Create the image.
	 * @return an image wrapping the buffer
	 * @throws InvalidImportArgumentsException if the buffer, size or geometry are invalid
	 * @throws simplereg.lib.dispatch.UnsupportedTypeException if no implementation exists for the kind and dimension
	 */
	public Image execute() {
		var arguments = validate();
		var descriptor = TypeDescriptor.of(elementKind, size.length);
		var image = Registry.DISPATCHER.invoke(descriptor, arguments);
		logger.debug("Imported {}", image);
		return image;
	}

	private Arguments validate() {
		if (buffer == null)
			throw new InvalidImportArgumentsException("No buffer has been set");
		if (elementKind == null)
			throw new InvalidImportArgumentsException("No element kind has been set");
		if (size.length == 0)
			throw new InvalidImportArgumentsException("Image size must have at least one dimension");
		for (long s : size) {
			if (s <= 0)
				throw new InvalidImportArgumentsException("Image size must be positive along every axis, but was " + Arrays.toString(size));
		}
		if (numberOfComponents < 1)
			throw new InvalidImportArgumentsException("Number of components per pixel must be >= 1, but was " + numberOfComponents);
		if (!elementKind.isVector() && numberOfComponents != 1)
			throw new InvalidImportArgumentsException("Number of components per pixel (" + numberOfComponents +
					") can only be set for vector element kinds, not " + elementKind);

		var pixelKind = PixelKind.of(elementKind);
		if (!pixelKind.acceptsBuffer(buffer))
			throw new InvalidImportArgumentsException("Buffer of class " + buffer.getClass().getSimpleName() +
					" cannot be used for " + elementKind + ", expected " + pixelKind.getBufferClass().getSimpleName());

		ImageGeometry geometry;
		try {
			geometry = new ImageGeometry.Builder(size)
					.spacing(spacing)
					.origin(origin)
					.direction(direction)
					.build();
		} catch (IllegalArgumentException e) {
			throw new InvalidImportArgumentsException(e.getMessage(), e);
		}

		// Java arrays are indexed by int
		long expected = (long)numberOfComponents * geometry.getNumberOfPixels();
		if (expected / numberOfComponents != geometry.getNumberOfPixels() || expected > Integer.MAX_VALUE)
			throw new InvalidImportArgumentsException("Size " + Arrays.toString(size) + " with " + numberOfComponents +
					" component(s) per pixel requires more elements than a Java array can hold");
		long length = pixelKind.bufferLength(buffer);
		if (length != expected)
			throw new InvalidImportArgumentsException("Buffer has " + length + " elements, but " + expected +
					" are required for size " + Arrays.toString(size) + " with " + numberOfComponents + " component(s) per pixel");

		return new Arguments(buffer, geometry, numberOfComponents);
	}

	/**
	 * Get the registry of typed import implementations.
	 * @return
	 */
	static DispatchRegistry<TypeDescriptor, SingleTypedFunction<Arguments>> getRegistry() {
		return Registry.DISPATCHER.getRegistry();
	}

	private static SingleDispatcher<Arguments> createDispatcher() {
		var builder = DispatchRegistry.<TypeDescriptor, SingleTypedFunction<Arguments>>builder("ImportImageFilter");
		for (int d : PixelKind.SUPPORTED_DIMENSIONS) {
			for (ElementKind kind : ElementKind.values())
				builder.register(TypeDescriptor.of(kind, d), createFunction(PixelKind.of(kind), kind));
		}
		var registry = builder.build();
		logger.debug("Registered {} typed import functions", registry.size());
		return new SingleDispatcher<>(registry);
	}

	private static <T extends RealType<T> & NativeType<T>> SingleTypedFunction<Arguments> createFunction(PixelKind<T> pixelKind, ElementKind kind) {
		return (arguments, context) -> context.borrow(executeInternal(pixelKind, kind, arguments));
	}

	private static <T extends RealType<T> & NativeType<T>> TypedImage<T> executeInternal(PixelKind<T> pixelKind, ElementKind kind, Arguments arguments) {
		// The component count determines the layout of vector images, so it is bound before the buffer is attached
		int components = kind.isVector() ? arguments.numberOfComponents : 1;
		return TypedImage.wrap(pixelKind, kind, components, arguments.geometry, arguments.buffer);
	}

	@Override
	public String toString() {
		return "ImportImageFilter [size=" + Arrays.toString(size) + ", spacing=" + Arrays.toString(spacing) +
				", origin=" + Arrays.toString(origin) + ", direction=" + Arrays.toString(direction) +
				", elementKind=" + elementKind + ", numberOfComponents=" + numberOfComponents +
				", buffer=" + (buffer == null ? null : buffer.getClass().getSimpleName()) + "]";
	}


	static final class Arguments {

		private final Object buffer;
		private final ImageGeometry geometry;
		private final int numberOfComponents;

		private Arguments(Object buffer, ImageGeometry geometry, int numberOfComponents) {
			this.buffer = buffer;
			this.geometry = geometry;
			this.numberOfComponents = numberOfComponents;
		}

	}

	private static final class Registry {

		private static final SingleDispatcher<Arguments> DISPATCHER = createDispatcher();

	}

}
