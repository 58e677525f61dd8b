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

package simplereg.lib.images.imports;

/**
 * Thrown when the buffer, size or geometry passed to an {@link ImportImageFilter} cannot be
 * used to create an image.
 * 
 * @author SimpleReg developers
 */
public class InvalidImportArgumentsException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	InvalidImportArgumentsException(String message) {
		super(message);
	}

	InvalidImportArgumentsException(String message, Throwable cause) {
		super(message, cause);
	}

}
