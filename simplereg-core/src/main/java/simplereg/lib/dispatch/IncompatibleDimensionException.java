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
 * Thrown when fixed and moving images do not have the same number of dimensions.
 * 
 * @author SimpleReg developers
 */
public class IncompatibleDimensionException extends ImageDispatchException {

	private static final long serialVersionUID = 1L;

	private final int fixedDimension;
	private final int movingDimension;

	/**
	 * Constructor.
	 * @param fixed
	 * @param moving
	 */
	public IncompatibleDimensionException(TypeDescriptor fixed, TypeDescriptor moving) {
		super("Fixed image dimension (" + fixed.getDimension() + ") does not match moving image dimension (" +
				moving.getDimension() + ")");
		this.fixedDimension = fixed.getDimension();
		this.movingDimension = moving.getDimension();
	}

	/**
	 * Get the dimension of the fixed images.
	 * @return
	 */
	public int getFixedDimension() {
		return fixedDimension;
	}

	/**
	 * Get the dimension of the moving images.
	 * @return
	 */
	public int getMovingDimension() {
		return movingDimension;
	}

}
