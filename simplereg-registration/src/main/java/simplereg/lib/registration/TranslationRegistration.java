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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessible;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.RealRandomAccess;
import net.imglib2.RealRandomAccessible;
import net.imglib2.converter.Converter;
import net.imglib2.converter.Converters;
import net.imglib2.interpolation.InterpolatorFactory;
import net.imglib2.interpolation.randomaccess.NLinearInterpolatorFactory;
import net.imglib2.interpolation.randomaccess.NearestNeighborInterpolatorFactory;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import simplereg.lib.dispatch.ImagePairInputs;
import simplereg.lib.dispatch.TypedOutput;
import simplereg.lib.images.ComputeContext;
import simplereg.lib.images.ElementKind;
import simplereg.lib.images.Image;
import simplereg.lib.images.ImageGeometry;
import simplereg.lib.images.PixelKind;
import simplereg.lib.images.TypedImage;
import simplereg.lib.parameters.ParameterMap;
import simplereg.lib.parameters.ParameterMaps;

/**
 * Intensity-based registration with a translation transform.
 * <p>
 * Each parameter map describes one stage, and stages run in order, each one starting from
 * the translation found by the previous stage. Within a stage, every resolution level runs a
 * compass search in physical coordinates, starting with the level's maximum step length and
 * halving the step whenever no axis move improves the metric.
 * <p>
 * The transform maps a physical point in the fixed image to a physical point in the moving image.
 *
 * @param <F> fixed pixel type
 * @param <M> moving pixel type
 * @author SimpleReg developers
 */
final class TranslationRegistration<F extends RealType<F> & NativeType<F>, M extends RealType<M> & NativeType<M>> {

	private static final Logger logger = LoggerFactory.getLogger(TranslationRegistration.class);

	static final String TRANSLATION_TRANSFORM = "TranslationTransform";
	static final String LINEAR_INTERPOLATOR = "FinalLinearInterpolator";
	static final String NEAREST_NEIGHBOR_INTERPOLATOR = "FinalNearestNeighborInterpolator";

	static final String KEY_METRIC = "Metric";
	static final String KEY_OPTIMIZER = "Optimizer";
	static final String COMPASS_SEARCH_OPTIMIZER = "CompassSearch";
	static final String KEY_MAXIMUM_STEP_LENGTH = "MaximumStepLength";
	static final String KEY_MINIMUM_STEP_LENGTH = "MinimumStepLength";
	static final String KEY_MAXIMUM_NUMBER_OF_ITERATIONS = "MaximumNumberOfIterations";
	static final String KEY_RESAMPLE_INTERPOLATOR = "ResampleInterpolator";
	static final String KEY_DEFAULT_PIXEL_VALUE = "DefaultPixelValue";
	static final String KEY_TRANSFORM_PARAMETERS = "TransformParameters";

	private final PixelKind<F> fixedKind;
	private final PixelKind<M> movingKind;

	TranslationRegistration(PixelKind<F> fixedKind, PixelKind<M> movingKind) {
		this.fixedKind = fixedKind;
		this.movingKind = movingKind;
	}

	/**
	 * Run the registration.
	 * @param inputs images and masks, already checked for consistent types
	 * @param arguments settings and parameter maps
	 * @param context context for the result image
	 * @return the resampled first moving image, with one transform parameter map per stage
	 */
	TypedOutput run(ImagePairInputs inputs, RegistrationArguments arguments, ComputeContext context) {
		var fixedImages = typed(inputs.getFixedImages(), fixedKind);
		var movingImages = typed(inputs.getMovingImages(), movingKind);
		var fixedMasks = typed(inputs.getFixedMasks(), fixedKind);
		var movingMasks = typed(inputs.getMovingMasks(), movingKind);

		if (fixedImages.size() != movingImages.size())
			throw new IllegalArgumentException("Number of fixed images (" + fixedImages.size() +
					") must match number of moving images (" + movingImages.size() + ")");
		checkMasks("fixed", fixedMasks, fixedImages);
		checkMasks("moving", movingMasks, movingImages);

		var maps = arguments.getParameterMaps();
		var settings = arguments.getSettings();
		var fixed = fixedImages.get(0);
		var moving = movingImages.get(0);
		int d = fixed.getGeometry().getDimension();

		double[] translation = new double[d];
		List<ParameterMap> transformMaps = new ArrayList<>();
		ParameterMap lastMap = new ParameterMap();

		try (var log = RegistrationLog.open(settings)) {
			if (maps.isEmpty()) {
				log.log("No parameter maps, resampling {} with the identity transform", moving);
			} else {
				if (settings.hasPointSets())
					translation = pointSetTranslation(settings, fixed.getGeometry(), moving.getGeometry(), log);
				var samplers = new ArrayList<PairSampler>();
				for (int i = 0; i < fixedImages.size(); i++) {
					samplers.add(new PairSampler(
							fixedImages.get(i),
							maskFor(fixedMasks, i),
							movingImages.get(i),
							maskFor(movingMasks, i)));
				}
				var evaluator = new MetricEvaluator(samplers);
				// The first stage also reports any initial translation
				double[] previous = new double[d];
				for (int stage = 0; stage < maps.size(); stage++) {
					var map = maps.get(stage);
					translation = runStage(stage, map, evaluator, translation, log);
					double[] increment = new double[d];
					for (int j = 0; j < d; j++)
						increment[j] = translation[j] - previous[j];
					previous = translation.clone();
					transformMaps.add(createTransformParameterMap(stage, increment, map, fixed, moving));
					lastMap = map;
				}
			}

			boolean nearest = NEAREST_NEIGHBOR_INTERPOLATOR.equals(
					lastMap.getString(KEY_RESAMPLE_INTERPOLATOR, LINEAR_INTERPOLATOR));
			double defaultValue = lastMap.getDouble(KEY_DEFAULT_PIXEL_VALUE, 0, 0.0);
			var result = resample(fixed.getGeometry(), moving, translation, nearest, defaultValue, context);
			log.log("Final translation {}", Arrays.toString(translation));
			return new TypedOutput(result, transformMaps);
		}
	}

	private static <T extends RealType<T> & NativeType<T>> List<TypedImage<T>> typed(List<Image> images, PixelKind<T> pixelKind) {
		List<TypedImage<T>> list = new ArrayList<>();
		for (var image : images)
			list.add(image.getTypedImage(pixelKind));
		return list;
	}

	private static <T extends RealType<T> & NativeType<T>> void checkMasks(String name, List<TypedImage<T>> masks, List<TypedImage<T>> images) {
		if (masks.isEmpty())
			return;
		if (masks.size() != 1 && masks.size() != images.size())
			throw new IllegalArgumentException("Expected 1 or " + images.size() + " " + name + " mask(s), but got " + masks.size());
		for (int i = 0; i < images.size(); i++) {
			long[] maskSize = maskFor(masks, i).getGeometry().getSize();
			long[] imageSize = images.get(i).getGeometry().getSize();
			if (!Arrays.equals(maskSize, imageSize))
				throw new IllegalArgumentException("Size of " + name + " mask " + Arrays.toString(maskSize) +
						" does not match image size " + Arrays.toString(imageSize));
		}
	}

	private static <T> T maskFor(List<T> masks, int index) {
		if (masks.isEmpty())
			return null;
		return masks.size() == 1 ? masks.get(0) : masks.get(index);
	}

	private static double[] pointSetTranslation(RegistrationSettings settings, ImageGeometry fixedGeometry,
			ImageGeometry movingGeometry, RegistrationLog log) {
		try {
			var fixedPoints = PointSetReader.read(Path.of(settings.getFixedPointSetFileName()), fixedGeometry);
			var movingPoints = PointSetReader.read(Path.of(settings.getMovingPointSetFileName()), movingGeometry);
			double[] fixedCentroid = PointSetReader.centroid(fixedPoints);
			double[] movingCentroid = PointSetReader.centroid(movingPoints);
			double[] translation = new double[fixedCentroid.length];
			for (int j = 0; j < translation.length; j++)
				translation[j] = movingCentroid[j] - fixedCentroid[j];
			log.log("Initial translation from point sets {}", Arrays.toString(translation));
			return translation;
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	private double[] runStage(int stage, ParameterMap map, MetricEvaluator evaluator, double[] start, RegistrationLog log) {
		String transform = map.getString(ParameterMaps.TRANSFORM, "");
		if (!TRANSLATION_TRANSFORM.equals(transform))
			throw new IllegalArgumentException("Unsupported transform '" + transform + "' in parameter map " + stage);
		String optimizer = map.getString(KEY_OPTIMIZER, COMPASS_SEARCH_OPTIMIZER);
		if (!COMPASS_SEARCH_OPTIMIZER.equals(optimizer))
			throw new IllegalArgumentException("Unsupported optimizer '" + optimizer + "' in parameter map " + stage);
		var metric = SimilarityMetric.fromName(
				map.getString(KEY_METRIC, SimilarityMetric.ADVANCED_MEAN_SQUARES.getName()));
		int nResolutions = map.getInt(ParameterMaps.NUMBER_OF_RESOLUTIONS, 0, 1);
		if (nResolutions < 1)
			throw new IllegalArgumentException("Number of resolutions must be >= 1, but was " + nResolutions);
		double minStep = map.getDouble(KEY_MINIMUM_STEP_LENGTH, 0, 0.01);
		if (!(minStep > 0))
			throw new IllegalArgumentException("Minimum step length must be > 0, but was " + minStep);

		log.log("Stage {}: {} with {} resolution(s)", stage, metric.getName(), nResolutions);
		double[] translation = start;
		for (int level = 0; level < nResolutions; level++) {
			double maxStep = map.getDouble(KEY_MAXIMUM_STEP_LENGTH, level, 1.0);
			int maxIterations = map.getInt(KEY_MAXIMUM_NUMBER_OF_ITERATIONS, level, 250);
			translation = compassSearch(evaluator, metric, translation, maxStep, minStep, maxIterations);
			log.log("Stage {}, resolution {}: metric {} at {}", stage, level,
					evaluator.evaluate(metric, translation), Arrays.toString(translation));
		}
		return translation;
	}

	private double[] compassSearch(MetricEvaluator evaluator, SimilarityMetric metric, double[] start,
			double maxStep, double minStep, int maxIterations) {
		double[] current = start.clone();
		double best = evaluator.evaluate(metric, current);
		double step = maxStep;
		int iteration = 0;
		while (step >= minStep && iteration < maxIterations) {
			boolean improved = false;
			for (int axis = 0; axis < current.length && !improved; axis++) {
				for (int sign = 1; sign >= -1; sign -= 2) {
					double[] candidate = current.clone();
					candidate[axis] += sign * step;
					double value = evaluator.evaluate(metric, candidate);
					if (value < best) {
						best = value;
						current = candidate;
						improved = true;
						break;
					}
				}
			}
			if (!improved)
				step /= 2.0;
			iteration++;
		}
		logger.trace("Compass search finished after {} iteration(s) with metric {}", iteration, best);
		return current;
	}

	private TypedImage<F> resample(ImageGeometry geometry, TypedImage<M> moving, double[] translation,
			boolean nearest, double defaultValue, ComputeContext context) {
		var output = context.allocate(fixedKind, geometry);
		var movingGeometry = moving.getGeometry();
		RealRandomAccess<DoubleType> access = interpolate(moving, nearest).realRandomAccess();

		F variable = fixedKind.createVariable();
		double min = variable.getMinValue();
		double max = variable.getMaxValue();
		boolean isInteger = !fixedKind.getElementKind().isFloatingPoint();

		int d = geometry.getDimension();
		double[] index = new double[d];
		double[] point = new double[d];
		double[] movingIndex = new double[d];
		Cursor<F> cursor = output.getImg().localizingCursor();
		while (cursor.hasNext()) {
			cursor.fwd();
			cursor.localize(index);
			geometry.indexToPhysicalPoint(index, point);
			for (int j = 0; j < d; j++)
				point[j] += translation[j];
			movingGeometry.physicalPointToIndex(point, movingIndex);
			double value;
			if (movingGeometry.isInside(movingIndex)) {
				access.setPosition(movingIndex);
				value = access.get().getRealDouble();
			} else
				value = defaultValue;
			if (isInteger)
				value = Math.rint(value);
			cursor.get().setReal(Math.max(min, Math.min(max, value)));
		}
		return output;
	}

	/**
	 * Interpolate the image in double precision, extending it with its border values.
	 */
	private static <T extends RealType<T> & NativeType<T>> RealRandomAccessible<DoubleType> interpolate(TypedImage<T> image, boolean nearest) {
		RandomAccessibleInterval<T> source = image.getComponent(0);
		Converter<T, DoubleType> converter = (input, output) -> output.set(input.getRealDouble());
		RandomAccessibleInterval<DoubleType> converted = Converters.convert(source, converter, new DoubleType());
		RandomAccessible<DoubleType> extended = Views.extendBorder(converted);
		InterpolatorFactory<DoubleType, RandomAccessible<DoubleType>> factory;
		if (nearest)
			factory = new NearestNeighborInterpolatorFactory<>();
		else
			factory = new NLinearInterpolatorFactory<>();
		return Views.interpolate(extended, factory);
	}

	private ParameterMap createTransformParameterMap(int stage, double[] translation, ParameterMap map,
			TypedImage<F> fixed, TypedImage<M> moving) {
		var geometry = fixed.getGeometry();
		int d = geometry.getDimension();
		return new ParameterMap()
				.set(ParameterMaps.TRANSFORM, TRANSLATION_TRANSFORM)
				.set("NumberOfParameters", Integer.toString(d))
				.set(KEY_TRANSFORM_PARAMETERS, toStrings(translation))
				.set("InitialTransformParametersFileName",
						stage == 0 ? "NoInitialTransform" : "TransformParameters." + (stage - 1) + ".txt")
				.set("HowToCombineTransforms", "Compose")
				.set("FixedImageDimension", Integer.toString(d))
				.set("MovingImageDimension", Integer.toString(moving.getGeometry().getDimension()))
				.set("FixedInternalImagePixelType", map.getString("FixedInternalImagePixelType", "float"))
				.set("MovingInternalImagePixelType", map.getString("MovingInternalImagePixelType", "float"))
				.set("Size", toStrings(geometry.getSize()))
				.set("Index", Collections.nCopies(d, "0"))
				.set("Spacing", toStrings(geometry.getSpacing()))
				.set("Origin", toStrings(geometry.getOrigin()))
				.set("Direction", toStrings(geometry.getDirection()))
				.set("UseDirectionCosines", "true")
				.set(KEY_RESAMPLE_INTERPOLATOR, map.getString(KEY_RESAMPLE_INTERPOLATOR, LINEAR_INTERPOLATOR))
				.set(KEY_DEFAULT_PIXEL_VALUE, map.getString(KEY_DEFAULT_PIXEL_VALUE, "0"))
				.set("ResultImagePixelType", resultPixelType(fixedKind.getElementKind()));
	}

	private static List<String> toStrings(double[] values) {
		List<String> list = new ArrayList<>();
		for (double v : values)
			list.add(Double.toString(v));
		return list;
	}

	private static List<String> toStrings(long[] values) {
		List<String> list = new ArrayList<>();
		for (long v : values)
			list.add(Long.toString(v));
		return list;
	}

	static String resultPixelType(ElementKind kind) {
		switch (kind) {
		case INT8:
			return "char";
		case UINT8:
			return "unsigned char";
		case INT16:
			return "short";
		case UINT16:
			return "unsigned short";
		case INT32:
			return "int";
		case UINT32:
			return "unsigned int";
		case INT64:
			return "long";
		case UINT64:
			return "unsigned long";
		case FLOAT32:
			return "float";
		case FLOAT64:
			return "double";
		default:
			throw new IllegalArgumentException("No result pixel type for " + kind);
		}
	}


	/**
	 * Samples of one fixed/moving image pair.
	 * Fixed samples are taken once at every (unmasked) fixed pixel; moving values are interpolated
	 * for each candidate translation.
	 */
	private final class PairSampler {

		private final double[][] points;
		private final double[] fixedValues;
		private final ImageGeometry movingGeometry;
		private final RealRandomAccess<DoubleType> movingAccess;
		private final RandomAccess<M> movingMaskAccess;

		private final double[] point;
		private final double[] movingIndex;
		private final long[] maskIndex;

		PairSampler(TypedImage<F> fixed, TypedImage<F> fixedMask, TypedImage<M> moving, TypedImage<M> movingMask) {
			var geometry = fixed.getGeometry();
			int d = geometry.getDimension();
			var pointList = new ArrayList<double[]>();
			var valueList = new ArrayList<Double>();
			RandomAccess<F> maskAccess = fixedMask == null ? null : fixedMask.getComponent(0).randomAccess();
			Cursor<F> cursor = fixed.getImg().localizingCursor();
			double[] index = new double[d];
			while (cursor.hasNext()) {
				cursor.fwd();
				if (maskAccess != null) {
					maskAccess.setPosition(cursor);
					if (maskAccess.get().getRealDouble() == 0)
						continue;
				}
				cursor.localize(index);
				double[] p = new double[d];
				geometry.indexToPhysicalPoint(index, p);
				pointList.add(p);
				valueList.add(cursor.get().getRealDouble());
			}
			this.points = pointList.toArray(new double[0][]);
			this.fixedValues = new double[valueList.size()];
			for (int i = 0; i < fixedValues.length; i++)
				fixedValues[i] = valueList.get(i);

			this.movingGeometry = moving.getGeometry();
			this.movingAccess = interpolate(moving, false).realRandomAccess();
			this.movingMaskAccess = movingMask == null ? null : movingMask.getComponent(0).randomAccess();
			this.point = new double[d];
			this.movingIndex = new double[d];
			this.maskIndex = new long[d];
		}

		int size() {
			return fixedValues.length;
		}

		/**
		 * Add samples that map inside the moving image to the output arrays.
		 * @return the new number of samples in the output arrays
		 */
		int sample(double[] translation, double[] fixedOut, double[] movingOut, int offset) {
			int n = offset;
			int d = point.length;
			for (int i = 0; i < points.length; i++) {
				for (int j = 0; j < d; j++)
					point[j] = points[i][j] + translation[j];
				movingGeometry.physicalPointToIndex(point, movingIndex);
				if (!movingGeometry.isInside(movingIndex))
					continue;
				if (movingMaskAccess != null) {
					for (int j = 0; j < d; j++)
						maskIndex[j] = Math.max(0, Math.min(movingGeometry.getSize(j) - 1, Math.round(movingIndex[j])));
					movingMaskAccess.setPosition(maskIndex);
					if (movingMaskAccess.get().getRealDouble() == 0)
						continue;
				}
				movingAccess.setPosition(movingIndex);
				fixedOut[n] = fixedValues[i];
				movingOut[n] = movingAccess.get().getRealDouble();
				n++;
			}
			return n;
		}

	}


	/**
	 * Combines the samples of all image pairs for a single metric value.
	 */
	private final class MetricEvaluator {

		private final List<PairSampler> samplers;
		private final double[] fixedValues;
		private final double[] movingValues;

		MetricEvaluator(List<PairSampler> samplers) {
			this.samplers = samplers;
			int n = 0;
			for (var sampler : samplers)
				n += sampler.size();
			this.fixedValues = new double[n];
			this.movingValues = new double[n];
		}

		double evaluate(SimilarityMetric metric, double[] translation) {
			int n = 0;
			for (var sampler : samplers)
				n = sampler.sample(translation, fixedValues, movingValues, n);
			return metric.evaluate(fixedValues, movingValues, n);
		}

	}

}
