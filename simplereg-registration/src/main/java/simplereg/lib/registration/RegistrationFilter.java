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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import simplereg.lib.dispatch.DispatchRegistry;
import simplereg.lib.dispatch.DualDispatcher;
import simplereg.lib.dispatch.DualTypedFunction;
import simplereg.lib.dispatch.HeterogeneousCollectionException;
import simplereg.lib.dispatch.ImagePairInputs;
import simplereg.lib.dispatch.IncompatibleDimensionException;
import simplereg.lib.dispatch.TypeDescriptorPair;
import simplereg.lib.dispatch.UnsupportedTypePairException;
import simplereg.lib.images.Image;
import simplereg.lib.images.PixelKind;
import simplereg.lib.parameters.ParameterMap;
import simplereg.lib.parameters.ParameterMaps;

/**
 * Register moving images to fixed images.
 * <p>
 * Images, masks, settings and parameter maps are set on the filter, and {@link #execute()} runs the
 * registration using the implementation matching the pixel types and dimension of the fixed and moving
 * images. Any pair of scalar element kinds with the same dimension is supported.
 * <p>
 * Each parameter map describes one registration stage. If no parameter maps are set, the first moving
 * image is resampled onto the grid of the first fixed image without being transformed.
 * <p>
 * A filter is not thread-safe.
 * 
 * @author SimpleReg developers
 */
public class RegistrationFilter {

	private static final Logger logger = LoggerFactory.getLogger(RegistrationFilter.class);

	private static final String NAME = "RegistrationFilter";

	private final List<Image> fixedImages = new ArrayList<>();
	private final List<Image> movingImages = new ArrayList<>();
	private final List<Image> fixedMasks = new ArrayList<>();
	private final List<Image> movingMasks = new ArrayList<>();

	private RegistrationSettings.Builder settings = new RegistrationSettings.Builder();
	private List<ParameterMap> parameterMaps = new ArrayList<>();

	private Image resultImage;
	private List<ParameterMap> transformParameterMaps = Collections.emptyList();

	/**
	 * Create a filter with a default translation parameter map.
	 */
	public RegistrationFilter() {
		parameterMaps.add(ParameterMaps.getDefault("translation"));
	}

	/**
	 * Set a single fixed image, replacing any existing fixed images.
	 * @param image
	 * @return this filter
	 */
	public RegistrationFilter setFixedImage(Image image) {
		return setFixedImages(Collections.singletonList(image));
	}

	/**
	 * Set the fixed images, replacing any existing fixed images.
	 * @param images
	 * @return this filter
	 */
	public RegistrationFilter setFixedImages(List<Image> images) {
		return replace(fixedImages, images);
	}

	/**
	 * Add a fixed image.
	 * @param image
	 * @return this filter
	 */
	public RegistrationFilter addFixedImage(Image image) {
		fixedImages.add(Objects.requireNonNull(image));
		return this;
	}

	/**
	 * Remove all fixed images.
	 * @return this filter
	 */
	public RegistrationFilter removeFixedImages() {
		fixedImages.clear();
		return this;
	}

	/**
	 * Get the fixed images.
	 * @return an unmodifiable list
	 */
	public List<Image> getFixedImages() {
		return Collections.unmodifiableList(fixedImages);
	}

	/**
	 * Set a single moving image, replacing any existing moving images.
	 * @param image
	 * @return this filter
	 */
	public RegistrationFilter setMovingImage(Image image) {
		return setMovingImages(Collections.singletonList(image));
	}

	/**
	 * Set the moving images, replacing any existing moving images.
	 * @param images
	 * @return this filter
	 */
	public RegistrationFilter setMovingImages(List<Image> images) {
		return replace(movingImages, images);
	}

	/**
	 * Add a moving image.
	 * @param image
	 * @return this filter
	 */
	public RegistrationFilter addMovingImage(Image image) {
		movingImages.add(Objects.requireNonNull(image));
		return this;
	}

	/**
	 * Remove all moving images.
	 * @return this filter
	 */
	public RegistrationFilter removeMovingImages() {
		movingImages.clear();
		return this;
	}

	/**
	 * Get the moving images.
	 * @return an unmodifiable list
	 */
	public List<Image> getMovingImages() {
		return Collections.unmodifiableList(movingImages);
	}

	/**
	 * Set a single fixed mask, replacing any existing fixed masks.
	 * Masks must have the same element kind and dimension as the fixed images;
	 * nonzero pixels are used for registration.
	 * @param mask
	 * @return this filter
	 */
	public RegistrationFilter setFixedMask(Image mask) {
		return replace(fixedMasks, Collections.singletonList(mask));
	}

	/**
	 * Add a fixed mask.
	 * @param mask
	 * @return this filter
	 */
	public RegistrationFilter addFixedMask(Image mask) {
		fixedMasks.add(Objects.requireNonNull(mask));
		return this;
	}

	/**
	 * Remove all fixed masks.
	 * @return this filter
	 */
	public RegistrationFilter removeFixedMasks() {
		fixedMasks.clear();
		return this;
	}

	/**
	 * Get the fixed masks.
	 * @return an unmodifiable list
	 */
	public List<Image> getFixedMasks() {
		return Collections.unmodifiableList(fixedMasks);
	}

	/**
	 * Set a single moving mask, replacing any existing moving masks.
	 * Masks must have the same element kind and dimension as the moving images.
	 * @param mask
	 * @return this filter
	 */
	public RegistrationFilter setMovingMask(Image mask) {
		return replace(movingMasks, Collections.singletonList(mask));
	}

	/**
	 * Add a moving mask.
	 * @param mask
	 * @return this filter
	 */
	public RegistrationFilter addMovingMask(Image mask) {
		movingMasks.add(Objects.requireNonNull(mask));
		return this;
	}

	/**
	 * Remove all moving masks.
	 * @return this filter
	 */
	public RegistrationFilter removeMovingMasks() {
		movingMasks.clear();
		return this;
	}

	/**
	 * Get the moving masks.
	 * @return an unmodifiable list
	 */
	public List<Image> getMovingMasks() {
		return Collections.unmodifiableList(movingMasks);
	}

	private RegistrationFilter replace(List<Image> target, List<Image> images) {
		for (var image : images)
			Objects.requireNonNull(image, "Image must not be null");
		target.clear();
		target.addAll(images);
		return this;
	}

	/**
	 * Set the fixed point-set file.
	 * Point sets are only used if both the fixed and moving files are set.
	 * @param fileName
	 * @return this filter
	 */
	public RegistrationFilter setFixedPointSetFileName(String fileName) {
		settings.fixedPointSetFileName(fileName);
		return this;
	}

	/**
	 * Set the moving point-set file.
	 * Point sets are only used if both the fixed and moving files are set.
	 * @param fileName
	 * @return this filter
	 */
	public RegistrationFilter setMovingPointSetFileName(String fileName) {
		settings.movingPointSetFileName(fileName);
		return this;
	}

	/**
	 * Set the directory for output files.
	 * @param outputDirectory
	 * @return this filter
	 */
	public RegistrationFilter setOutputDirectory(String outputDirectory) {
		settings.outputDirectory(outputDirectory);
		return this;
	}

	/**
	 * Set the name of the log file within the output directory.
	 * @param logFileName
	 * @return this filter
	 */
	public RegistrationFilter setLogFileName(String logFileName) {
		settings.logFileName(logFileName);
		return this;
	}

	/**
	 * Specify whether progress should be written to the log file.
	 * @param logToFile
	 * @return this filter
	 */
	public RegistrationFilter setLogToFile(boolean logToFile) {
		settings.logToFile(logToFile);
		return this;
	}

	/**
	 * Specify whether progress should be logged at INFO level.
	 * @param logToConsole
	 * @return this filter
	 */
	public RegistrationFilter setLogToConsole(boolean logToConsole) {
		settings.logToConsole(logToConsole);
		return this;
	}

	/**
	 * Replace all settings.
	 * @param settings
	 * @return this filter
	 */
	public RegistrationFilter setSettings(RegistrationSettings settings) {
		this.settings = new RegistrationSettings.Builder(settings);
		return this;
	}

	/**
	 * Get the current settings.
	 * @return
	 */
	public RegistrationSettings getSettings() {
		return settings.build();
	}

	/**
	 * Set a single parameter map, replacing any existing maps.
	 * @param parameterMap
	 * @return this filter
	 */
	public RegistrationFilter setParameterMap(ParameterMap parameterMap) {
		return setParameterMaps(Collections.singletonList(parameterMap));
	}

	/**
	 * Set the parameter maps, replacing any existing maps.
	 * An empty list means the moving image is resampled without registration.
	 * @param parameterMaps
	 * @return this filter
	 */
	public RegistrationFilter setParameterMaps(List<ParameterMap> parameterMaps) {
		this.parameterMaps = new ArrayList<>(ParameterMaps.copyOf(parameterMaps));
		return this;
	}

	/**
	 * Add a parameter map for an additional stage.
	 * @param parameterMap
	 * @return this filter
	 */
	public RegistrationFilter addParameterMap(ParameterMap parameterMap) {
		parameterMaps.add(new ParameterMap(parameterMap));
		return this;
	}

	/**
	 * Get a copy of the parameter maps.
	 * @return
	 */
	public List<ParameterMap> getParameterMaps() {
		return ParameterMaps.copyOf(parameterMaps);
	}

	/**
	 * Run the registration.
	 * @return the result image, with the pixel type and grid of the first fixed image
	 * @throws IllegalArgumentException if there are no fixed or moving images, or the parameter maps are invalid
	 * @throws HeterogeneousCollectionException if images or masks in one collection have different types
	 * @throws IncompatibleDimensionException if fixed and moving images have different dimensions
	 * @throws UnsupportedTypePairException if the pixel types are not supported
	 */
	public Image execute() {
		resultImage = null;
		transformParameterMaps = Collections.emptyList();
		var inputs = ImagePairInputs.of(fixedImages, movingImages, fixedMasks, movingMasks);
		var arguments = new RegistrationArguments(settings.build(), parameterMaps);
		logger.debug("Registering {} with {} parameter map(s)", inputs, parameterMaps.size());
		var result = Registry.DISPATCHER.invokePair(inputs, arguments);
		resultImage = result.getImage();
		transformParameterMaps = result.getParameterMaps();
		return resultImage;
	}

	/**
	 * Get the result of the last call to {@link #execute()}.
	 * @return
	 * @throws IllegalStateException if the filter has not been executed
	 */
	public Image getResultImage() {
		if (resultImage == null)
			throw new IllegalStateException("No result image available, execute() must be called first");
		return resultImage;
	}

	/**
	 * Get the transform parameter maps of the last call to {@link #execute()}, one per stage.
	 * @return an unmodifiable list, empty if the filter has not been executed
	 */
	public List<ParameterMap> getTransformParameterMaps() {
		return transformParameterMaps;
	}

	static DispatchRegistry<TypeDescriptorPair, DualTypedFunction<RegistrationArguments>> getRegistry() {
		return Registry.DISPATCHER.getRegistry();
	}

	@Override
	public String toString() {
		return NAME + " [fixed=" + fixedImages.size() + ", moving=" + movingImages.size()
				+ ", parameterMaps=" + parameterMaps.size() + "]";
	}


	/**
	 * Registry of implementations for every supported pair of fixed and moving types,
	 * created on first use.
	 */
	private static class Registry {

		private static final DualDispatcher<RegistrationArguments> DISPATCHER = new DualDispatcher<>(createRegistry());

		private static DispatchRegistry<TypeDescriptorPair, DualTypedFunction<RegistrationArguments>> createRegistry() {
			var builder = DispatchRegistry.<TypeDescriptorPair, DualTypedFunction<RegistrationArguments>>builder(NAME);
			for (int d : PixelKind.SUPPORTED_DIMENSIONS) {
				for (var fixedKind : PixelKind.scalarKinds()) {
					for (var movingKind : PixelKind.scalarKinds()) {
						var pair = TypeDescriptorPair.of(fixedKind.descriptor(d), movingKind.descriptor(d));
						builder.register(pair, createFunction(fixedKind, movingKind));
					}
				}
			}
			var registry = builder.build();
			logger.debug("Registered {} fixed/moving type pairs for dimensions {}", registry.size(),
					Arrays.toString(PixelKind.SUPPORTED_DIMENSIONS.toArray()));
			return registry;
		}

		private static <F extends RealType<F> & NativeType<F>, M extends RealType<M> & NativeType<M>> DualTypedFunction<RegistrationArguments> createFunction(
				PixelKind<F> fixedKind, PixelKind<M> movingKind) {
			var registration = new TranslationRegistration<>(fixedKind, movingKind);
			return registration::run;
		}

	}

}
