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

package simplereg.lib.dispatch;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import simplereg.lib.images.ElementKind;
import simplereg.lib.images.Image;
import simplereg.lib.images.PixelKind;
import simplereg.lib.images.TypeDescriptor;
import simplereg.lib.parameters.ParameterMap;

@SuppressWarnings("javadoc")
public class TestDualDispatcher {

	private AtomicInteger counter;
	private DualDispatcher<String> dispatcher;

	@BeforeEach
	public void setUp() {
		counter = new AtomicInteger();
		var builder = DispatchRegistry.<TypeDescriptorPair, DualTypedFunction<String>>builder("Pairs");
		for (int d : PixelKind.SUPPORTED_DIMENSIONS) {
			builder.register(TypeDescriptorPair.of(TypeDescriptor.of(ElementKind.UINT8, d), TypeDescriptor.of(ElementKind.FLOAT32, d)),
					(inputs, name, context) -> {
						counter.incrementAndGet();
						var fixed = inputs.getFixedImages().get(0);
						var output = context.allocate(PixelKind.UINT8, fixed.getGeometry());
						for (var pixel : output.getImg())
							pixel.setReal(inputs.getMovingImages().size());
						return new TypedOutput(output, Collections.singletonList(new ParameterMap().set("Name", name)));
					});
		}
		dispatcher = new DualDispatcher<>(builder.build());
	}

	@Test
	public void test_invokePair() {
		var fixed = Image.create(ElementKind.UINT8, 4, 3);
		var moving = Image.create(ElementKind.FLOAT32, 5, 5);
		var result = dispatcher.invokePair(fixed, moving, "test");
		assertEquals(1, counter.get());
		assertEquals(TypeDescriptor.of(ElementKind.UINT8, 2), result.getImage().getTypeDescriptor());
		assertTrue(result.getImage().isUnique());
		assertEquals(1.0, result.getImage().getPixelAsDouble(3, 2));
		assertEquals(1, result.getParameterMaps().size());
		assertEquals("test", result.getParameterMaps().get(0).getString("Name", null));
	}

	@Test
	public void test_resultDoesNotShareInput() {
		var pair = TypeDescriptorPair.of(TypeDescriptor.of(ElementKind.UINT8, 2), TypeDescriptor.of(ElementKind.UINT8, 2));
		var identity = new DualDispatcher<String>(DispatchRegistry.<TypeDescriptorPair, DualTypedFunction<String>>builder("Identity")
				.register(pair, (inputs, name, context) -> new TypedOutput(inputs.getFixedImages().get(0).getTypedImage(), Collections.emptyList()))
				.build());
		var fixed = Image.create(ElementKind.UINT8, 3, 3);
		var moving = Image.create(ElementKind.UINT8, 3, 3);
		var result = identity.invokePair(fixed, moving, "test").getImage();
		assertNotSame(fixed.getTypedImage(), result.getTypedImage());
		assertTrue(result.isUnique());
		assertTrue(fixed.isUnique());
		result.setPixelAsDouble(42.0, 0, 0);
		assertEquals(0.0, fixed.getPixelAsDouble(0, 0));
		assertEquals(42.0, result.getPixelAsDouble(0, 0));
	}

	@Test
	public void test_incompatibleDimensionBeforeLookup() {
		var fixed = Image.create(ElementKind.UINT8, 4, 4);
		var moving = Image.create(ElementKind.FLOAT32, 4, 4, 4);
		assertThrows(IncompatibleDimensionException.class, () -> dispatcher.invokePair(fixed, moving, "test"));

		// Would not be registered, but the dimension check comes first
		var unsupportedMoving = Image.create(ElementKind.INT64, 4, 4, 4);
		assertThrows(IncompatibleDimensionException.class, () -> dispatcher.invokePair(fixed, unsupportedMoving, "test"));
		assertEquals(0, counter.get());
	}

	@Test
	public void test_heterogeneousCollection() {
		var fixedImages = Arrays.asList(
				Image.create(ElementKind.UINT8, 4, 4),
				Image.create(ElementKind.UINT16, 4, 4));
		var movingImages = List.of(Image.create(ElementKind.FLOAT32, 4, 4), Image.create(ElementKind.FLOAT32, 4, 4));

		var e = assertThrows(HeterogeneousCollectionException.class,
				() -> dispatcher.invokePair(ImagePairInputs.of(fixedImages, movingImages, null, null), "test"));
		assertEquals(1, e.getIndex());
		assertEquals("fixed images", e.getCollection());
		assertEquals(0, counter.get());

		var masks = List.of(Image.create(ElementKind.UINT16, 4, 4));
		var eMask = assertThrows(HeterogeneousCollectionException.class,
				() -> ImagePairInputs.of(fixedImages.subList(0, 1), movingImages, masks, null));
		assertEquals("fixed masks", eMask.getCollection());
		assertEquals(0, eMask.getIndex());
	}

	@Test
	public void test_unsupportedPair() {
		var fixed = Image.create(ElementKind.FLOAT32, 4, 4);
		var moving = Image.create(ElementKind.UINT8, 4, 4);
		var e = assertThrows(UnsupportedTypePairException.class, () -> dispatcher.invokePair(fixed, moving, "test"));
		assertEquals(fixed.getTypeDescriptor(), e.getFixed());
		assertEquals(moving.getTypeDescriptor(), e.getMoving());
		assertFalse(dispatcher.supports(TypeDescriptorPair.of(fixed.getTypeDescriptor(), moving.getTypeDescriptor())));
		assertEquals(0, counter.get());
	}

	@Test
	public void test_emptyCollections() {
		var image = Image.create(ElementKind.UINT8, 4, 4);
		assertThrows(IllegalArgumentException.class, () -> ImagePairInputs.of(Collections.emptyList(), List.of(image), null, null));
		assertThrows(IllegalArgumentException.class, () -> ImagePairInputs.of(List.of(image), Collections.emptyList(), null, null));
	}

	@Test
	public void test_multipleImages() {
		var fixedImages = List.of(Image.create(ElementKind.UINT8, 3, 3, 3), Image.create(ElementKind.UINT8, 3, 3, 3));
		var movingImages = List.of(Image.create(ElementKind.FLOAT32, 2, 2, 2), Image.create(ElementKind.FLOAT32, 3, 3, 3));
		var inputs = ImagePairInputs.of(fixedImages, movingImages, null, null);
		assertEquals(3, inputs.getDescriptors().getDimension());
		assertTrue(inputs.getFixedMasks().isEmpty());
		var result = dispatcher.invokePair(inputs, "multi");
		assertEquals(2.0, result.getImage().getPixelAsDouble(2, 2, 2));
	}

}
