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

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import simplereg.lib.images.ComputeContext;
import simplereg.lib.images.Image;

/**
 * Selects and runs the implementation of an operation registered for a combination of fixed
 * and moving image types.
 * <p>
 * The implementation is chosen by the pair of descriptors, not by each side separately, because it
 * needs both pixel types at once. Inputs are validated by {@link ImagePairInputs} before any lookup,
 * so mixed collections and mismatched dimensions fail with their own exceptions.
 * <p>
 * Each call gets its own {@link ComputeContext}; the returned image is copied out of it before
 * it is closed.
 *
 * @param <A> type of the operation's arguments
 * @author SimpleReg developers
 */
public class DualDispatcher<A> {

	private static final Logger logger = LoggerFactory.getLogger(DualDispatcher.class);

	private final DispatchRegistry<TypeDescriptorPair, DualTypedFunction<A>> registry;

	/**
	 * Create a dispatcher backed by a registry.
	 * @param registry
	 */
	public DualDispatcher(DispatchRegistry<TypeDescriptorPair, DualTypedFunction<A>> registry) {
		this.registry = Objects.requireNonNull(registry);
	}

	/**
	 * Get the registry used for lookups.
	 * @return
	 */
	public DispatchRegistry<TypeDescriptorPair, DualTypedFunction<A>> getRegistry() {
		return registry;
	}

	/**
	 * Returns true if an implementation is registered for the pair.
	 * @param pair
	 * @return
	 */
	public boolean supports(TypeDescriptorPair pair) {
		return registry.contains(pair);
	}

	/**
	 * Run the implementation registered for a single fixed and moving image.
	 * @param fixedImage
	 * @param movingImage
	 * @param arguments
	 * @return
	 * @see #invokePair(ImagePairInputs, Object)
	 */
	public DispatchResult invokePair(Image fixedImage, Image movingImage, A arguments) {
		return invokePair(ImagePairInputs.of(fixedImage, movingImage), arguments);
	}

	/**
	 * Run the implementation registered for the fixed and moving types of the inputs.
	 * Exceptions thrown by the implementation are passed on unchanged.
	 * @param inputs
	 * @param arguments
	 * @return
	 * @throws UnsupportedTypePairException if no implementation is registered
	 */
	public DispatchResult invokePair(ImagePairInputs inputs, A arguments) {
		var pair = inputs.getDescriptors();
		var function = registry.lookup(pair)
				.orElseThrow(() -> new UnsupportedTypePairException(registry.getName(), pair));
		logger.trace("Dispatching {} for {}", registry.getName(), pair);
		try (var context = new ComputeContext(registry.getName())) {
			var output = function.apply(inputs, arguments, context);
			var image = context.export(output.getImage());
			return new DispatchResult(image, output.getParameterMaps());
		}
	}

	@Override
	public String toString() {
		return "DualDispatcher[" + registry.getName() + "]";
	}

}
