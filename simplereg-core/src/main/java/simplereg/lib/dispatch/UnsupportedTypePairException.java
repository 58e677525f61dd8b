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

import simplereg.lib.images.TypeDescriptor;

/**
 * Thrown when no implementation of a two-type operation is registered for a combination of
 * fixed and moving {@link TypeDescriptor TypeDescriptors}.
 * 
 * @author SimpleReg developers
 */
public class UnsupportedTypePairException extends ImageDispatchException {

	private static final long serialVersionUID = 1L;

	private final transient TypeDescriptorPair pair;

	/**
	 * Constructor.
	 * @param operation name of the operation
	 * @param pair the pair that could not be resolved
	 */
	public UnsupportedTypePairException(String operation, TypeDescriptorPair pair) {
		super(operation + " does not support fixed image type " + pair.getFixed() +
				" combined with moving image type " + pair.getMoving());
		this.pair = pair;
	}

	/**
	 * Get the fixed image descriptor.
	 * @return
	 */
	public TypeDescriptor getFixed() {
		return pair.getFixed();
	}

	/**
	 * Get the moving image descriptor.
	 * @return
	 */
	public TypeDescriptor getMoving() {
		return pair.getMoving();
	}

}
