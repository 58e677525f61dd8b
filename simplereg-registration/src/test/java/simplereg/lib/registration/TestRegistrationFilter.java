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

package simplereg.lib.registration;

import static org.junit.jupiter.api.Assertions.*;
import static simplereg.lib.registration.RegistrationTestUtils.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import simplereg.lib.dispatch.HeterogeneousCollectionException;
import simplereg.lib.dispatch.IncompatibleDimensionException;
import simplereg.lib.dispatch.TypeDescriptorPair;
import simplereg.lib.dispatch.UnsupportedTypePairException;
import simplereg.lib.images.ElementKind;
import simplereg.lib.images.Image;
import simplereg.lib.images.ImageGeometry;
import simplereg.lib.images.PixelKind;
import simplereg.lib.images.TypeDescriptor;
import simplereg.lib.images.imports.ImageImports;
import simplereg.lib.images.imports.ImportImageFilter;
import simplereg.lib.parameters.ParameterMap;
import simplereg.lib.parameters.ParameterMaps;

@SuppressWarnings("javadoc")
public class TestRegistrationFilter {

	private static final double EPS = 1e-6;

	@Test
	public void test_emptyParameterMaps() {
		var fixed = new ImportImageFilter()
				.setSize(4, 4)
				.setBufferAsUInt8(new byte[16])
				.execute();
		float[] values = new float[16];
		for (int i = 0; i < values.length; i++)
			values[i] = i * 20.25f - 10f;
		var moving = ImageImports.importAsFloat(values, 4, 4);

		var filter = new RegistrationFilter()
				.setFixedImage(fixed)
				.setMovingImage(moving)
				.setParameterMaps(Collections.emptyList());
		var result = filter.execute();

		assertSame(result, filter.getResultImage());
		assertEquals(fixed.getTypeDescriptor(), result.getTypeDescriptor());
		assertEquals(TypeDescriptor.of(ElementKind.UINT8, 2), result.getTypeDescriptor());
		assertEquals(fixed.getGeometry(), result.getGeometry());
		assertTrue(filter.getTransformParameterMaps().isEmpty());

		// Identity resampling, rounded and clamped to the fixed pixel type
		assertEquals(0.0, result.getPixelAsDouble(0, 0));
		assertEquals(10.0, result.getPixelAsDouble(1, 0));
		assertEquals(112.0, result.getPixelAsDouble(2, 1));
		assertEquals(255.0, result.getPixelAsDouble(3, 3));
		assertTrue(result.isUnique());
	}

	@Test
	public void test_noResultBeforeExecute() {
		var filter = new RegistrationFilter();
		assertThrows(IllegalStateException.class, () -> filter.getResultImage());
		assertTrue(filter.getTransformParameterMaps().isEmpty());
		assertEquals(1, filter.getParameterMaps().size());
		assertThrows(IllegalArgumentException.class, () -> filter.execute());
	}

	@Test
	public void test_translation() {
		var fixed = floatBlob2D(32, 32, 14, 15);
		var moving = floatBlob2D(32, 32, 17, 16);

		var filter = new RegistrationFilter()
				.setFixedImage(fixed)
				.setMovingImage(moving)
				.setParameterMap(ParameterMaps.getDefault("translation"));
		var result = filter.execute();

		var maps = filter.getTransformParameterMaps();
		assertEquals(1, maps.size());
		var map = maps.get(0);
		assertArrayEquals(new double[] {3.0, 1.0}, transformParameters(map), 0.05);
		assertEquals("TranslationTransform", map.getString(ParameterMaps.TRANSFORM, null));
		assertEquals("2", map.getString("NumberOfParameters", null));
		assertEquals("NoInitialTransform", map.getString("InitialTransformParametersFileName", null));
		assertEquals(List.of("32", "32"), map.get("Size"));
		assertEquals(List.of("0", "0"), map.get("Index"));
		assertEquals("float", map.getString("ResultImagePixelType", null));
		assertEquals("FinalLinearInterpolator", map.getString("ResampleInterpolator", null));

		// The result should now match the fixed image
		assertEquals(TypeDescriptor.of(ElementKind.FLOAT32, 2), result.getTypeDescriptor());
		assertEquals(fixed.getPixelAsDouble(14, 15), result.getPixelAsDouble(14, 15), 1.0);
		assertEquals(fixed.getPixelAsDouble(10, 12), result.getPixelAsDouble(10, 12), 1.0);
	}

	@Test
	public void test_stagesCompose() {
		var fixed = floatBlob2D(32, 32, 14, 15);
		var moving = floatBlob2D(32, 32, 17, 16);

		var filter = new RegistrationFilter()
				.setFixedImage(fixed)
				.setMovingImage(moving)
				.setParameterMap(ParameterMaps.getDefault("translation", 2))
				.addParameterMap(ParameterMaps.getDefault("translation"));
		filter.execute();

		var maps = filter.getTransformParameterMaps();
		assertEquals(2, maps.size());
		assertEquals("TransformParameters.0.txt", maps.get(1).getString("InitialTransformParametersFileName", null));
		double[] first = transformParameters(maps.get(0));
		double[] second = transformParameters(maps.get(1));
		assertEquals(3.0, first[0] + second[0], 0.05);
		assertEquals(1.0, first[1] + second[1], 0.05);
	}

	@Test
	public void test_physicalCoordinates() {
		float[] buffer = blob2D(24, 24, 12, 12, 3.0, 100.0, 0.0);
		var fixed = ImageImports.importAsFloat(buffer, 24, 24);
		var moving = new ImportImageFilter()
				.setSize(24, 24)
				.setOrigin(5, -2)
				.setBufferAsFloat(buffer.clone())
				.execute();

		var filter = new RegistrationFilter()
				.setFixedImage(fixed)
				.setMovingImage(moving);
		filter.execute();
		assertArrayEquals(new double[] {5.0, -2.0}, transformParameters(filter.getTransformParameterMaps().get(0)), 0.05);
	}

	@Test
	public void test_normalizedCorrelationMixedTypes() {
		var fixed = uint8Blob2D(32, 32, 15, 15);
		var moving = uint16Blob2D(32, 32, 13, 17);

		var map = ParameterMaps.getDefault("translation")
				.set("Metric", "AdvancedNormalizedCorrelation")
				.set("ResampleInterpolator", "FinalNearestNeighborInterpolator");
		var filter = new RegistrationFilter()
				.setFixedImage(fixed)
				.setMovingImage(moving)
				.setParameterMap(map);
		var result = filter.execute();

		assertEquals(TypeDescriptor.of(ElementKind.UINT8, 2), result.getTypeDescriptor());
		assertArrayEquals(new double[] {-2.0, 2.0}, transformParameters(filter.getTransformParameterMaps().get(0)), 0.25);
		assertEquals("unsigned char", filter.getTransformParameterMaps().get(0).getString("ResultImagePixelType", null));
		// Moving values exceed the fixed range
		assertEquals(255.0, result.getPixelAsDouble(15, 15));
	}

	@Test
	public void test_3D() {
		var fixed = floatBlob3D(16, 7, 8, 8);
		var moving = floatBlob3D(16, 8, 10, 7);
		var result = Registrations.register(fixed, moving, "translation");
		assertEquals(TypeDescriptor.of(ElementKind.FLOAT32, 3), result.getTypeDescriptor());
		assertEquals(fixed.getPixelAsDouble(7, 8, 8), result.getPixelAsDouble(7, 8, 8), 1.0);
	}

	@Test
	public void test_masks() {
		var fixed = floatBlob2D(32, 32, 14, 15);
		var moving = floatBlob2D(32, 32, 17, 16);

		var geometry = new ImageGeometry.Builder(32, 32).build();
		var mask = Image.create(ElementKind.FLOAT32, 1, geometry);
		for (long y = 5; y < 25; y++) {
			for (long x = 5; x < 25; x++)
				mask.setPixelAsDouble(1, x, y);
		}

		var filter = new RegistrationFilter()
				.setFixedImage(fixed)
				.setMovingImage(moving)
				.addFixedMask(mask)
				.addMovingMask(new Image(moving));
		filter.execute();
		assertArrayEquals(new double[] {3.0, 1.0}, transformParameters(filter.getTransformParameterMaps().get(0)), 0.05);

		var wrongSize = Image.create(ElementKind.FLOAT32, 16, 16);
		filter.removeFixedMasks().addFixedMask(wrongSize);
		assertThrows(IllegalArgumentException.class, () -> filter.execute());

		filter.removeFixedMasks().addFixedMask(Image.create(ElementKind.UINT8, 32, 32));
		var e = assertThrows(HeterogeneousCollectionException.class, () -> filter.execute());
		assertEquals("fixed masks", e.getCollection());
		filter.removeFixedMasks().removeMovingMasks();
		assertTrue(filter.getFixedMasks().isEmpty());
		assertTrue(filter.getMovingMasks().isEmpty());
	}

	@Test
	public void test_multipleImagePairs() {
		var filter = new RegistrationFilter()
				.addFixedImage(floatBlob2D(32, 32, 14, 15))
				.addFixedImage(floatBlob2D(32, 32, 10, 20))
				.addMovingImage(floatBlob2D(32, 32, 17, 16))
				.addMovingImage(floatBlob2D(32, 32, 13, 21));
		filter.execute();
		assertArrayEquals(new double[] {3.0, 1.0}, transformParameters(filter.getTransformParameterMaps().get(0)), 0.05);

		filter.removeMovingImages().addMovingImage(floatBlob2D(32, 32, 17, 16));
		assertThrows(IllegalArgumentException.class, () -> filter.execute());
	}

	@Test
	public void test_invalidTypes() {
		var fixed2D = Image.create(ElementKind.FLOAT32, 8, 8);
		var moving3D = Image.create(ElementKind.FLOAT32, 8, 8, 8);
		assertThrows(IncompatibleDimensionException.class, () -> Registrations.register(fixed2D, moving3D, List.of()));

		var heterogeneous = new RegistrationFilter()
				.addFixedImage(fixed2D)
				.addFixedImage(Image.create(ElementKind.INT16, 8, 8))
				.setMovingImage(Image.create(ElementKind.FLOAT32, 8, 8));
		var e = assertThrows(HeterogeneousCollectionException.class, () -> heterogeneous.execute());
		assertEquals("fixed images", e.getCollection());
		assertEquals(1, e.getIndex());

		var vector = Image.create(ElementKind.VECTOR_FLOAT32, 3, new ImageGeometry.Builder(8, 8).build());
		assertThrows(UnsupportedTypePairException.class, () -> Registrations.register(vector, fixed2D, List.of()));

		var fixed1D = Image.create(ElementKind.FLOAT32, 8);
		assertThrows(UnsupportedTypePairException.class, () -> Registrations.register(fixed1D, fixed1D, List.of()));
	}

	@Test
	public void test_invalidParameterMaps() {
		var fixed = floatBlob2D(16, 16, 8, 8);
		var moving = floatBlob2D(16, 16, 8, 8);
		var affine = new ParameterMap().set(ParameterMaps.TRANSFORM, "AffineTransform");
		assertThrows(IllegalArgumentException.class, () -> Registrations.register(fixed, moving, affine));

		var metric = ParameterMaps.getDefault("translation").set("Metric", "Unknown");
		assertThrows(IllegalArgumentException.class, () -> Registrations.register(fixed, moving, metric));

		var optimizer = ParameterMaps.getDefault("translation").set("Optimizer", "RegularStepGradientDescent");
		assertThrows(IllegalArgumentException.class, () -> Registrations.register(fixed, moving, optimizer));
	}

	@Test
	public void test_failedExecuteClearsResult() {
		var filter = new RegistrationFilter()
				.setFixedImage(floatBlob2D(16, 16, 8, 8))
				.setMovingImage(floatBlob2D(16, 16, 9, 8));
		filter.execute();
		assertNotNull(filter.getResultImage());
		assertEquals(1, filter.getTransformParameterMaps().size());

		filter.setParameterMap(new ParameterMap().set(ParameterMaps.TRANSFORM, "AffineTransform"));
		assertThrows(IllegalArgumentException.class, () -> filter.execute());
		assertThrows(IllegalStateException.class, () -> filter.getResultImage());
		assertTrue(filter.getTransformParameterMaps().isEmpty());
	}

	@Test
	public void test_pointSetsAndLogFile(@TempDir Path dir) throws IOException {
		var fixed = floatBlob2D(32, 32, 14, 15);
		var moving = floatBlob2D(32, 32, 17, 16);

		var fixedPoints = dir.resolve("fixed.txt");
		var movingPoints = dir.resolve("moving.txt");
		Files.writeString(fixedPoints, "point\n2\n13 15\n15 15\n", StandardCharsets.UTF_8);
		Files.writeString(movingPoints, "index\n1\n17 16\n", StandardCharsets.UTF_8);

		var map = ParameterMaps.getDefault("translation").set("MaximumNumberOfIterations", "0");
		var filter = new RegistrationFilter()
				.setFixedImage(fixed)
				.setMovingImage(moving)
				.setParameterMap(map)
				.setFixedPointSetFileName(fixedPoints.toString())
				.setMovingPointSetFileName(movingPoints.toString())
				.setOutputDirectory(dir.toString())
				.setLogFileName("test.log")
				.setLogToFile(true);
		filter.execute();

		// No iterations, so the result comes from the point sets alone
		assertArrayEquals(new double[] {3.0, 1.0}, transformParameters(filter.getTransformParameterMaps().get(0)), EPS);

		var log = dir.resolve("test.log");
		assertTrue(Files.exists(log));
		assertFalse(Files.readString(log, StandardCharsets.UTF_8).isBlank());

		filter.setMovingPointSetFileName(dir.resolve("missing.txt").toString());
		assertThrows(UncheckedIOException.class, () -> filter.execute());
	}

	@Test
	public void test_defaultPixelValue() {
		float[] ones = new float[64];
		Arrays.fill(ones, 1f);
		var fixed = ImageImports.importAsFloat(ones, 8, 8);
		var moving = new ImportImageFilter()
				.setSize(8, 8)
				.setOrigin(4, 0)
				.setBufferAsFloat(ones.clone())
				.execute();
		var map = ParameterMaps.getDefault("translation")
				.set("MaximumNumberOfIterations", "0")
				.set("DefaultPixelValue", "-3");
		var result = Registrations.register(fixed, moving, map);
		assertEquals(-3.0, result.getPixelAsDouble(0, 0));
		assertEquals(1.0, result.getPixelAsDouble(7, 0));
	}

	@Test
	public void test_settings() {
		var settings = new RegistrationSettings.Builder()
				.outputDirectory("out")
				.logToConsole(true)
				.build();
		var filter = new RegistrationFilter().setSettings(settings);
		assertEquals(settings, filter.getSettings());
		filter.setLogFileName("other.log");
		assertEquals("other.log", filter.getSettings().getLogFileName());
		assertEquals("out", filter.getSettings().getOutputDirectory());
	}

	@Test
	public void test_registry() {
		var registry = RegistrationFilter.getRegistry();
		var kinds = PixelKind.scalarKinds();
		assertEquals(PixelKind.SUPPORTED_DIMENSIONS.size() * kinds.size() * kinds.size(), registry.size());
		for (int d : PixelKind.SUPPORTED_DIMENSIONS) {
			for (var fixed : kinds) {
				for (var moving : kinds)
					assertTrue(registry.contains(TypeDescriptorPair.of(fixed.descriptor(d), moving.descriptor(d))));
			}
		}
		assertFalse(registry.contains(TypeDescriptorPair.of(
				TypeDescriptor.of(ElementKind.VECTOR_UINT8, 2), TypeDescriptor.of(ElementKind.UINT8, 2))));
	}

}
