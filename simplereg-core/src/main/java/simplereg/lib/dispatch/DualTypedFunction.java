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

import simplereg.lib.images.ComputeContext;

/**
 * An operation implemented for one concrete combination of fixed and moving pixel types,
 * with a shared dimension.
 * <p>
 * Implementations are registered in a {@link DispatchRegistry} under the {@link TypeDescriptorPair}
 * they handle, and called by a {@link DualDispatcher}.
 *
 * @param <A> type of the operation's arguments
 * @author SimpleReg developers
 */
@FunctionalInterface
public interface DualTypedFunction<A> {

	/**
	 * Run the operation.
	 * @param inputs validated fixed and moving images and masks
	 * @param arguments operation arguments
	 * @param context workspace for allocating images; it is closed when the call returns
	 * @return the typed output
	 */
	TypedOutput apply(ImagePairInputs inputs, A arguments, ComputeContext context);

}
