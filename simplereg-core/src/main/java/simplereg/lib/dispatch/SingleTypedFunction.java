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
import simplereg.lib.images.TypedImage;

/**
 * An operation implemented for one concrete pixel type and dimension.
 * <p>
 * Implementations are registered in a {@link DispatchRegistry} under the
 * {@link simplereg.lib.images.TypeDescriptor TypeDescriptor} they handle, and called by a
 * {@link SingleDispatcher}.
 *
 * @param <A> type of the operation's arguments
 * @author SimpleReg developers
 */
@FunctionalInterface
public interface SingleTypedFunction<A> {

	/**
	 * Run the operation.
	 * @param arguments operation arguments
	 * @param context workspace for allocating images; it is closed when the call returns
	 * @return the output image
	 */
	TypedImage<?> apply(A arguments, ComputeContext context);

}
