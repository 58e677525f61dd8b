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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestSimilarityMetric {

	@Test
	public void test_meanSquares() {
		var metric = SimilarityMetric.fromName("AdvancedMeanSquares");
		assertEquals(SimilarityMetric.ADVANCED_MEAN_SQUARES, metric);
		double[] fixed = {1, 2, 3, 100};
		double[] moving = {1, 4, 3, -100};
		assertEquals(0.0, metric.evaluate(fixed, fixed, 3));
		// Only the first 3 samples count
		assertEquals(4.0 / 3.0, metric.evaluate(fixed, moving, 3), 1e-12);
		assertEquals(Double.POSITIVE_INFINITY, metric.evaluate(fixed, moving, 0));
	}

	@Test
	public void test_normalizedCorrelation() {
		var metric = SimilarityMetric.fromName("AdvancedNormalizedCorrelation");
		double[] fixed = {1, 2, 3, 4};
		double[] scaled = {12, 14, 16, 18};
		double[] inverted = {4, 3, 2, 1};
		assertEquals(-1.0, metric.evaluate(fixed, scaled, 4), 1e-12);
		assertEquals(1.0, metric.evaluate(fixed, inverted, 4), 1e-12);
		assertEquals(0.0, metric.evaluate(fixed, new double[] {5, 5, 5, 5}, 4));
		assertEquals(Double.POSITIVE_INFINITY, metric.evaluate(fixed, scaled, 1));
	}

	@Test
	public void test_unknown() {
		assertThrows(IllegalArgumentException.class, () -> SimilarityMetric.fromName("AdvancedMattesMutualInformation"));
	}

}
