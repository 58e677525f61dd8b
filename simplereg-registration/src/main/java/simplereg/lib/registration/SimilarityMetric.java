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

import java.util.Arrays;

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

/**
 * Metrics comparing sampled fixed and moving intensities.
 * Lower values indicate better alignment.
 * 
 * @author SimpleReg developers
 */
enum SimilarityMetric {

	/**
	 * Mean of squared intensity differences.
	 */
	ADVANCED_MEAN_SQUARES("AdvancedMeanSquares") {
		@Override
		double evaluate(double[] fixed, double[] moving, int n) {
			if (n == 0)
				return Double.POSITIVE_INFINITY;
			var stats = new SummaryStatistics();
			for (int i = 0; i < n; i++) {
				double diff = fixed[i] - moving[i];
				stats.addValue(diff * diff);
			}
			return stats.getMean();
		}
	},

	/**
	 * Negated Pearson correlation coefficient.
	 */
	ADVANCED_NORMALIZED_CORRELATION("AdvancedNormalizedCorrelation") {
		@Override
		double evaluate(double[] fixed, double[] moving, int n) {
			if (n < 2)
				return Double.POSITIVE_INFINITY;
			double r = new PearsonsCorrelation().correlation(
					Arrays.copyOf(fixed, n), Arrays.copyOf(moving, n));
			// Constant intensities give NaN
			return Double.isNaN(r) ? 0 : -r;
		}
	};

	private final String name;

	SimilarityMetric(String name) {
		this.name = name;
	}

	/**
	 * Evaluate the metric for the first {@code n} samples.
	 * @param fixed
	 * @param moving
	 * @param n
	 * @return
	 */
	abstract double evaluate(double[] fixed, double[] moving, int n);

	/**
	 * Get the name used in parameter maps.
	 * @return
	 */
	String getName() {
		return name;
	}

	/**
	 * Get the metric with the specified parameter map name.
	 * @param name
	 * @return
	 * @throws IllegalArgumentException if the metric is not supported
	 */
	static SimilarityMetric fromName(String name) {
		for (var metric : values()) {
			if (metric.name.equals(name))
				return metric;
		}
		throw new IllegalArgumentException("Unsupported metric: " + name);
	}

}
