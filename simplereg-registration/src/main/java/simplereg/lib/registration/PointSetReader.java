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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import simplereg.lib.images.ImageGeometry;

/**
 * Reader for point-set text files.
 * <p>
 * The first line is either {@code point} (physical coordinates) or {@code index} (pixel indices),
 * the second gives the number of points, and each following line holds the coordinates of one point:
 * <pre>
 * index
 * 2
 * 10 12
 * 30.5 8
 * </pre>
 * If the first line is a number, the points are assumed to be physical coordinates.
 * 
 * @author SimpleReg developers
 */
class PointSetReader {

	private static final Logger logger = LoggerFactory.getLogger(PointSetReader.class);

	private PointSetReader() {
		throw new AssertionError();
	}

	/**
	 * Read points from a file, returning them in physical coordinates.
	 * @param path the file to read
	 * @param geometry geometry used to convert indices to physical points
	 * @return
	 * @throws IOException if the file cannot be read or is malformed
	 */
	static List<double[]> read(Path path, ImageGeometry geometry) throws IOException {
		var lines = new ArrayList<String>();
		for (var line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
			line = line.strip();
			if (!line.isEmpty())
				lines.add(line);
		}
		if (lines.isEmpty())
			throw new IOException("Point set file " + path + " is empty");

		int lineIndex = 0;
		boolean isIndex = false;
		String first = lines.get(0).toLowerCase(Locale.ROOT);
		if ("index".equals(first) || "point".equals(first)) {
			isIndex = "index".equals(first);
			lineIndex++;
		}
		if (lineIndex >= lines.size())
			throw new IOException("Point set file " + path + " does not specify the number of points");

		int n;
		try {
			n = Integer.parseInt(lines.get(lineIndex++));
		} catch (NumberFormatException e) {
			throw new IOException("Invalid number of points in " + path, e);
		}
		if (n < 1 || lines.size() - lineIndex < n)
			throw new IOException("Point set file " + path + " should contain " + n + " point(s), but has " + (lines.size() - lineIndex));

		int d = geometry.getDimension();
		var points = new ArrayList<double[]>(n);
		for (int i = 0; i < n; i++) {
			String[] tokens = lines.get(lineIndex + i).split("\\s+");
			if (tokens.length != d)
				throw new IOException("Point " + i + " in " + path + " has " + tokens.length + " coordinate(s), expected " + d);
			double[] coords = new double[d];
			try {
				for (int j = 0; j < d; j++)
					coords[j] = Double.parseDouble(tokens[j]);
			} catch (NumberFormatException e) {
				throw new IOException("Invalid coordinates for point " + i + " in " + path, e);
			}
			if (isIndex) {
				double[] point = new double[d];
				geometry.indexToPhysicalPoint(coords, point);
				coords = point;
			}
			points.add(coords);
		}
		logger.debug("Read {} {} from {}", n, isIndex ? "indices" : "points", path);
		return points;
	}

	/**
	 * Compute the centroid of a list of points.
	 * @param points
	 * @return
	 */
	static double[] centroid(List<double[]> points) {
		int d = points.get(0).length;
		double[] centroid = new double[d];
		for (var p : points) {
			for (int j = 0; j < d; j++)
				centroid[j] += p[j];
		}
		for (int j = 0; j < d; j++)
			centroid[j] /= points.size();
		return centroid;
	}

}
