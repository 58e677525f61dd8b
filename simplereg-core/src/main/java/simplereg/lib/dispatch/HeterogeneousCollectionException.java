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
 * Thrown when the images of a collection passed to a two-type operation do not all share one
 * {@link TypeDescriptor}.
 * 
 * @author SimpleReg developers
 */
public class HeterogeneousCollectionException extends ImageDispatchException {

	private static final long serialVersionUID = 1L;

	private final String collection;
	private final int index;

	/**
	 * Constructor.
	 * @param collection name of the collection, e.g. "fixed masks"
	 * @param index index of the first mismatching image
	 * @param expected descriptor shared by the collection
	 * @param actual descriptor of the mismatching image
	 */
	public HeterogeneousCollectionException(String collection, int index, TypeDescriptor expected, TypeDescriptor actual) {
		super("Image " + index + " of " + collection + " has type " + actual + ", expected " + expected);
		this.collection = collection;
		this.index = index;
	}

	/**
	 * Get the name of the offending collection.
	 * @return
	 */
	public String getCollection() {
		return collection;
	}

	/**
	 * Get the index of the first mismatching image within the collection.
	 * @return
	 */
	public int getIndex() {
		return index;
	}

}
