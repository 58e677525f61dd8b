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
import simplereg.lib.images.TypeDescriptor;

/**
 * Selects and runs the implementation of an operation registered for a single {@link TypeDescriptor}.
 * <p>
 * Each call gets its own {@link ComputeContext}, which is closed before the call returns.
 * If the output image was allocated from that context it is copied first, so the returned
 * {@link Image} never depends on the context.
 *
 * @param <A> type of the operation's arguments
 * @author SimpleReg developers
 */
public class SingleDispatcher<A> {

	private static final Logger logger = LoggerFactory.getLogger(SingleDispatcher.class);

	private final DispatchRegistry<TypeDescriptor, SingleTypedFunction<A>> registry;

	/**
	 * Create a dispatcher backed by a registry.
	 * @param registry
	 */
	public SingleDispatcher(DispatchRegistry<TypeDescriptor, SingleTypedFunction<A>> registry) {
		this.registry = Objects.requireNonNull(registry);
	}

	/**
	 * Get the registry used for lookups.
	 * @return
	 */
	public DispatchRegistry<TypeDescriptor, SingleTypedFunction<A>> getRegistry() {
		return registry;
	}

	/**
	 * Returns true if an implementation is registered for the descriptor.
	 * @param descriptor
	 * @return
	 */
	public boolean supports(TypeDescriptor descriptor) {
		return registry.contains(descriptor);
	}

	/**
	 * Run the implementation registered for the descriptor of an image.
	 * @param image image whose descriptor selects the implementation
	 * @param arguments
	 * @return
	 * @throws UnsupportedTypeException if no implementation is registered
	 */
	public Image invoke(Image image, A arguments) {
		return invoke(image.getTypeDescriptor(), arguments);
	}

	/**
	 * Run the implementation registered for a descriptor.
	 * Exceptions thrown by the implementation are passed on unchanged.
	 * @param descriptor
	 * @param arguments
	 * @return the output, owning its pixel data unless it wraps memory supplied by the caller
	 * @throws UnsupportedTypeException if no implementation is registered
	 */
	public Image invoke(TypeDescriptor descriptor, A arguments) {
		var function = registry.lookup(descriptor)
				.orElseThrow(() -> new UnsupportedTypeException(registry.getName(), descriptor));
		logger.trace("Dispatching {} for {}", registry.getName(), descriptor);
		try (var context = new ComputeContext(registry.getName())) {
			return context.export(function.apply(arguments, context));
		}
	}

	@Override
	public String toString() {
		return "SingleDispatcher[" + registry.getName() + "]";
	}

}
