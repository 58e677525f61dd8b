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

package simplereg.lib.registration;

import simplereg.lib.images.Image;
import simplereg.lib.images.imports.ImageImports;
import simplereg.lib.images.imports.ImportImageFilter;
import simplereg.lib.parameters.ParameterMap;

/**
 * Synthetic images for registration tests.
 */
class RegistrationTestUtils {

	static double gaussian(double[] position, double[] center, double sigma, double scale) {
		double dist2 = 0;
		for (int i = 0; i < position.length; i++) {
			double d = position[i] - center[i];
			dist2 += d * d;
		}
		return scale * Math.exp(-dist2 / (2 * sigma * sigma));
	}

	static float[] blob2D(int width, int height, double cx, double cy, double sigma, double scale, double offset) {
		float[] buffer = new float[width * height];
		double[] center = {cx, cy};
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++)
				buffer[y * width + x] = (float)(offset + gaussian(new double[] {x, y}, center, sigma, scale));
		}
		return buffer;
	}

	static Image floatBlob2D(int width, int height, double cx, double cy) {
		return ImageImports.importAsFloat(blob2D(width, height, cx, cy, 3.0, 100.0, 0.0), width, height);
	}

	static Image uint8Blob2D(int width, int height, double cx, double cy) {
		float[] values = blob2D(width, height, cx, cy, 3.0, 200.0, 0.0);
		byte[] buffer = new byte[values.length];
		for (int i = 0; i < values.length; i++)
			buffer[i] = (byte)Math.round(values[i]);
		return ImageImports.importAsUInt8(buffer, width, height);
	}

	static Image uint16Blob2D(int width, int height, double cx, double cy) {
		float[] values = blob2D(width, height, cx, cy, 3.0, 1000.0, 50.0);
		short[] buffer = new short[values.length];
		for (int i = 0; i < values.length; i++)
			buffer[i] = (short)Math.round(values[i]);
		return ImageImports.importAsUInt16(buffer, width, height);
	}

	static Image floatBlob3D(int size, double cx, double cy, double cz) {
		float[] buffer = new float[size * size * size];
		double[] center = {cx, cy, cz};
		int i = 0;
		for (int z = 0; z < size; z++) {
			for (int y = 0; y < size; y++) {
				for (int x = 0; x < size; x++)
					buffer[i++] = (float)gaussian(new double[] {x, y, z}, center, 2.5, 100.0);
			}
		}
		return new ImportImageFilter()
				.setSize(size, size, size)
				.setBufferAsFloat(buffer)
				.execute();
	}

	static double[] transformParameters(ParameterMap map) {
		var values = map.get(TranslationRegistration.KEY_TRANSFORM_PARAMETERS);
		double[] parameters = new double[values.size()];
		for (int i = 0; i < parameters.length; i++)
			parameters[i] = Double.parseDouble(values.get(i));
		return parameters;
	}

}
