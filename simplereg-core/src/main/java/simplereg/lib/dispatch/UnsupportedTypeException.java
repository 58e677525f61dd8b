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
 * Thrown when no implementation of an operation is registered for a {@link TypeDescriptor}.
 * 
 * @author SimpleReg developers
 */
public class UnsupportedTypeException extends ImageDispatchException {

	private static final long serialVersionUID = 1L;

	private final transient TypeDescriptor descriptor;

	/**
	 * Constructor.
	 * @param operation name of the operation
	 * @param descriptor the descriptor that could not be resolved
	 */
	public UnsupportedTypeException(String operation, TypeDescriptor descriptor) {
		super(operation + " does not support element kind " + descriptor.getElementKind() +
				" with dimension " + descriptor.getDimension());
		this.descriptor = descriptor;
	}

	/**
	 * Get the unsupported descriptor.
	 * @return
	 */
	public TypeDescriptor getDescriptor() {
		return descriptor;
	}

}
