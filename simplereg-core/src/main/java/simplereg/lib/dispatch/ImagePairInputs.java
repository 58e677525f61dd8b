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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import simplereg.lib.images.Image;
import simplereg.lib.images.TypeDescriptor;

/**
 * Fixed and moving images, with optional masks, passed to a two-type operation.
 * <p>
 * Creating an instance validates that the fixed images and fixed masks share one
 * {@link TypeDescriptor}, that the moving images and moving masks share another, and that
 * both have the same dimension.
 * 
 * @author SimpleReg developers
 */
public final class ImagePairInputs {

	private final List<Image> fixedImages;
	private final List<Image> movingImages;
	private final List<Image> fixedMasks;
	private final List<Image> movingMasks;
	private final TypeDescriptorPair descriptors;

	private ImagePairInputs(List<Image> fixedImages, List<Image> movingImages,
			List<Image> fixedMasks, List<Image> movingMasks, TypeDescriptorPair descriptors) {
		this.fixedImages = fixedImages;
		this.movingImages = movingImages;
		this.fixedMasks = fixedMasks;
		this.movingMasks = movingMasks;
		this.descriptors = descriptors;
	}

	/**
	 * Validate and collect inputs.
	 * @param fixedImages non-empty list of fixed images
	 * @param movingImages non-empty list of moving images
	 * @param fixedMasks fixed masks, may be empty
	 * @param movingMasks moving masks, may be empty
	 * @return
	 * @throws IllegalArgumentException if there are no fixed or no moving images
	 * @throws HeterogeneousCollectionException if a collection mixes types
	 * @throws IncompatibleDimensionException if fixed and moving dimensions differ
	 */
	public static ImagePairInputs of(List<Image> fixedImages, List<Image> movingImages,
			List<Image> fixedMasks, List<Image> movingMasks) {
		if (fixedImages == null || fixedImages.isEmpty())
			throw new IllegalArgumentException("At least one fixed image is required");
		if (movingImages == null || movingImages.isEmpty())
			throw new IllegalArgumentException("At least one moving image is required");
		fixedMasks = fixedMasks == null ? Collections.emptyList() : fixedMasks;
		movingMasks = movingMasks == null ? Collections.emptyList() : movingMasks;

		TypeDescriptor fixed = fixedImages.get(0).getTypeDescriptor();
		TypeDescriptor moving = movingImages.get(0).getTypeDescriptor();
		checkHomogeneous("fixed images", fixedImages, fixed);
		checkHomogeneous("fixed masks", fixedMasks, fixed);
		checkHomogeneous("moving images", movingImages, moving);
		checkHomogeneous("moving masks", movingMasks, moving);

		var pair = TypeDescriptorPair.of(fixed, moving);
		return new ImagePairInputs(immutableCopy(fixedImages), immutableCopy(movingImages),
				immutableCopy(fixedMasks), immutableCopy(movingMasks), pair);
	}

	/**
	 * Collect a single fixed and moving image, without masks.
	 * @param fixedImage
	 * @param movingImage
	 * @return
	 */
	public static ImagePairInputs of(Image fixedImage, Image movingImage) {
		return of(Collections.singletonList(fixedImage), Collections.singletonList(movingImage), null, null);
	}

	private static void checkHomogeneous(String name, List<Image> images, TypeDescriptor expected) {
		for (int i = 0; i < images.size(); i++) {
			var image = Objects.requireNonNull(images.get(i), () -> "Null image in " + name);
			var descriptor = image.getTypeDescriptor();
			if (!expected.equals(descriptor))
				throw new HeterogeneousCollectionException(name, i, expected, descriptor);
		}
	}

	private static List<Image> immutableCopy(List<Image> images) {
		return Collections.unmodifiableList(new ArrayList<>(images));
	}

	/**
	 * Get the fixed and moving descriptors.
	 * @return
	 */
	public TypeDescriptorPair getDescriptors() {
		return descriptors;
	}

	/**
	 * Get the fixed images.
	 * @return an unmodifiable list
	 */
	public List<Image> getFixedImages() {
		return fixedImages;
	}

	/**
	 * Get the moving images.
	 * @return an unmodifiable list
	 */
	public List<Image> getMovingImages() {
		return movingImages;
	}

	/**
	 * Get the fixed masks.
	 * @return an unmodifiable list, possibly empty
	 */
	public List<Image> getFixedMasks() {
		return fixedMasks;
	}

	/**
	 * Get the moving masks.
	 * @return an unmodifiable list, possibly empty
	 */
	public List<Image> getMovingMasks() {
		return movingMasks;
	}

	@Override
	public String toString() {
		return "ImagePairInputs[" + descriptors + ", " + fixedImages.size() + " fixed, " + movingImages.size() + " moving, "
				+ fixedMasks.size() + " fixed mask(s), " + movingMasks.size() + " moving mask(s)]";
	}

}
