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
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.ByteType;
import net.imglib2.type.numeric.integer.IntType;
import net.imglib2.type.numeric.integer.LongType;
import net.imglib2.type.numeric.integer.ShortType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.integer.UnsignedIntType;
import net.imglib2.type.numeric.integer.UnsignedLongType;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Binds a scalar {@link ElementKind} to the imglib2 pixel type used to store it.
 * <p>
 * Generic image routines are written once against {@code T extends RealType<T> & NativeType<T>};
 * a PixelKind is what fixes {@code T} when such a routine is registered for a particular
 * element kind. Vector kinds are stored using the binding of their component kind.
 * <p>
 * Unsigned kinds are backed by the signed Java array with the same bit depth
 * (e.g. {@link #UINT16} uses {@code short[]}).
 *
 * @param <T> imglib2 pixel type
 * @author SimpleReg developers
 */
public final class PixelKind<T extends RealType<T> & NativeType<T>> {

	/**
	 * Spatial dimensions for which typed operations are registered.
	 */
	public static final List<Integer> SUPPORTED_DIMENSIONS = Collections.unmodifiableList(Arrays.asList(2, 3, 4));

	/**
	 * 8-bit signed integer pixels
	 */
	public static final PixelKind<ByteType> INT8 = new PixelKind<>(ElementKind.INT8, byte[].class, ByteType::new,
			(buffer, dims) -> ArrayImgs.bytes((byte[])buffer, dims), dims -> ArrayImgs.bytes(dims));
	/**
	 * 8-bit unsigned integer pixels
	 */
	public static final PixelKind<UnsignedByteType> UINT8 = new PixelKind<>(ElementKind.UINT8, byte[].class, UnsignedByteType::new,
			(buffer, dims) -> ArrayImgs.unsignedBytes((byte[])buffer, dims), dims -> ArrayImgs.unsignedBytes(dims));
	/**
	 * 16-bit signed integer pixels
	 */
	public static final PixelKind<ShortType> INT16 = new PixelKind<>(ElementKind.INT16, short[].class, ShortType::new,
			(buffer, dims) -> ArrayImgs.shorts((short[])buffer, dims), dims -> ArrayImgs.shorts(dims));
	/**
	 * 16-bit unsigned integer pixels
	 */
	public static final PixelKind<UnsignedShortType> UINT16 = new PixelKind<>(ElementKind.UINT16, short[].class, UnsignedShortType::new,
			(buffer, dims) -> ArrayImgs.unsignedShorts((short[])buffer, dims), dims -> ArrayImgs.unsignedShorts(dims));
	/**
	 * 32-bit signed integer pixels
	 */
	public static final PixelKind<IntType> INT32 = new PixelKind<>(ElementKind.INT32, int[].class, IntType::new,
			(buffer, dims) -> ArrayImgs.ints((int[])buffer, dims), dims -> ArrayImgs.ints(dims));
	/**
	 * 32-bit unsigned integer pixels
	 */
	public static final PixelKind<UnsignedIntType> UINT32 = new PixelKind<>(ElementKind.UINT32, int[].class, UnsignedIntType::new,
			(buffer, dims) -> ArrayImgs.unsignedInts((int[])buffer, dims), dims -> ArrayImgs.unsignedInts(dims));
	/**
	 * 64-bit signed integer pixels
	 */
	public static final PixelKind<LongType> INT64 = new PixelKind<>(ElementKind.INT64, long[].class, LongType::new,
			(buffer, dims) -> ArrayImgs.longs((long[])buffer, dims), dims -> ArrayImgs.longs(dims));
	/**
	 * 64-bit unsigned integer pixels
	 */
	public static final PixelKind<UnsignedLongType> UINT64 = new PixelKind<>(ElementKind.UINT64, long[].class, UnsignedLongType::new,
			(buffer, dims) -> ArrayImgs.unsignedLongs((long[])buffer, dims), dims -> ArrayImgs.unsignedLongs(dims));
	/**
	 * 32-bit floating point pixels
	 */
	public static final PixelKind<FloatType> FLOAT32 = new PixelKind<>(ElementKind.FLOAT32, float[].class, FloatType::new,
			(buffer, dims) -> ArrayImgs.floats((float[])buffer, dims), dims -> ArrayImgs.floats(dims));
	/**
	 * 64-bit floating point pixels
	 */
	public static final PixelKind<DoubleType> FLOAT64 = new PixelKind<>(ElementKind.FLOAT64, double[].class, DoubleType::new,
			(buffer, dims) -> ArrayImgs.doubles((double[])buffer, dims), dims -> ArrayImgs.doubles(dims));

	private static final List<PixelKind<?>> SCALAR_KINDS = Collections.unmodifiableList(Arrays.<PixelKind<?>>asList(
			INT8, UINT8, INT16, UINT16, INT32, UINT32, INT64, UINT64, FLOAT32, FLOAT64
			));

	private static final Map<ElementKind, PixelKind<?>> KIND_MAP = new EnumMap<>(ElementKind.class);

	static {
		for (PixelKind<?> kind : SCALAR_KINDS)
			KIND_MAP.put(kind.getElementKind(), kind);
	}

	private final ElementKind elementKind;
	private final Class<?> bufferClass;
	private final Supplier<T> typeSupplier;
	private final BiFunction<Object, long[], Img<T>> wrapper;
	private final Function<long[], Img<T>> allocator;

	private PixelKind(ElementKind elementKind, Class<?> bufferClass, Supplier<T> typeSupplier,
			BiFunction<Object, long[], Img<T>> wrapper, Function<long[], Img<T>> allocator) {
		this.elementKind = elementKind;
		this.bufferClass = bufferClass;
		this.typeSupplier = typeSupplier;
		this.wrapper = wrapper;
		this.allocator = allocator;
	}

	/**
	 * Get the bindings for all scalar element kinds, in {@link ElementKind} order.
	 * @return an unmodifiable list
	 */
	public static List<PixelKind<?>> scalarKinds() {
		return SCALAR_KINDS;
	}

	/**
	 * Get the binding used to store components of the specified element kind.
	 * Vector kinds return the binding of their component kind.
	 * @param kind
	 * @return
	 */
	public static PixelKind<?> of(ElementKind kind) {
		return KIND_MAP.get(kind.getComponentKind());
	}

	/**
	 * Get the scalar element kind represented by this binding.
	 * @return
	 */
	public ElementKind getElementKind() {
		return elementKind;
	}

	/**
	 * Get the Java array class expected for buffers of this kind, e.g. {@code short[].class}.
	 * @return
	 */
	public Class<?> getBufferClass() {
		return bufferClass;
	}

	/**
	 * Create a new pixel variable of the bound type.
	 * @return
	 */
	public T createVariable() {
		return typeSupplier.get();
	}

	/**
	 * Returns true if the given object can be used as a buffer for this kind.
	 * @param buffer
	 * @return
	 */
	public boolean acceptsBuffer(Object buffer) {
		return buffer != null && bufferClass.equals(buffer.getClass());
	}

	/**
	 * Get the number of elements in a buffer of this kind.
	 * @param buffer
	 * @return
	 * @throws IllegalArgumentException if the buffer is not accepted by this kind
	 */
	public long bufferLength(Object buffer) {
		if (!acceptsBuffer(buffer))
			throw new IllegalArgumentException("Buffer of class " + (buffer == null ? null : buffer.getClass().getSimpleName()) +
					" cannot be used for " + elementKind);
		return java.lang.reflect.Array.getLength(buffer);
	}

	/**
	 * Wrap an existing buffer as an image, without copying.
	 * The imglib2 image stores its first axis fastest, so interleaved components must be
	 * represented by a leading component axis within {@code dims}.
	 * @param buffer array of {@link #getBufferClass()}
	 * @param dims imglib2 dimensions
	 * @return
	 */
	public Img<T> wrap(Object buffer, long... dims) {
		return wrapper.apply(buffer, dims);
	}

	/**
	 * Allocate a new zero-filled image.
	 * @param dims imglib2 dimensions
	 * @return
	 */
	public Img<T> allocate(long... dims) {
		return allocator.apply(dims);
	}

	/**
	 * Create a descriptor for scalar images of this kind.
	 * @param dimension
	 * @return
	 */
	public TypeDescriptor descriptor(int dimension) {
		return TypeDescriptor.of(elementKind, dimension);
	}

	@Override
	public String toString() {
		return "PixelKind[" + elementKind + "]";
	}

}
