/*-
 * #%L
 * This file is part of FaceFit.
 * %%
 * Copyright (C) 2024 FaceFit developers
 * %%
 * FaceFit is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * FaceFit is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with FaceFit.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package facefit.lib.landmarks;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;

import facefit.lib.analysis.filters.MaxConvolution;
import facefit.lib.analysis.images.SimpleImage;
import facefit.lib.analysis.images.SimpleImages;
import facefit.lib.evaluators.IsotropicGaussianPointEvaluator;
import facefit.lib.geom.Point2;

@SuppressWarnings("javadoc")
public class TestLandmarkDetectionMap {
	
	private static final double FALSE_POSITIVE_RATE = 0.05;
	private static final double FALSE_NEGATIVE_RATE = 0.07;
	
	// Peak certainty at (5, 5)
	static SimpleImage createPeakedMap() {
		return SimpleImages.createDoubleImage(20, 20, (x, y) -> -0.5 * new Point2(x, y).distanceSq(5, 5));
	}
	
	@Test
	public void test_lookup() {
		var map = new LandmarkDetectionMap("tip", SimpleImages.createDoubleImage(4, 5, (x, y) -> x * 10 + y));
		assertEquals("tip", map.getTag());
		assertEquals(23, map.getLogValue(2, 3));
		assertEquals(Double.NEGATIVE_INFINITY, map.getLogValue(4, 3));
		assertEquals(Double.NEGATIVE_INFINITY, map.getLogValue(-1, 0));
		
		// Points fall in the pixel that contains them
		assertEquals(23, map.getLogValue(new Point2(2.7, 3.2)));
		assertEquals(0, map.getLogValue(new Point2(0, 0)));
		assertEquals(34, map.getLogValue(new Point2(3.99, 4.99)));
		assertEquals(Double.NEGATIVE_INFINITY, map.getLogValue(new Point2(-0.5, 0)));
		assertEquals(Double.NEGATIVE_INFINITY, map.getLogValue(new Point2(4.0, 0)));
		assertEquals(Double.NEGATIVE_INFINITY, map.getLogValue(new Point2(Double.NaN, 1)));
		assertEquals(Double.NEGATIVE_INFINITY, map.getLogValue(new Point2(1, Double.POSITIVE_INFINITY)));
	}
	
	@Test
	public void test_correctCertainty() {
		var map = new LandmarkDetectionMap("tip", createPeakedMap());
		var corrected = map.correctCertaintyForErrorRates(FALSE_POSITIVE_RATE, FALSE_NEGATIVE_RATE);
		assertEquals("tip", corrected.getTag());
		assertEquals(1 - FALSE_POSITIVE_RATE, Math.exp(corrected.getLogValue(5, 5)), 1e-12);
		assertEquals(FALSE_NEGATIVE_RATE, Math.exp(corrected.getLogValue(19, 19)), 1e-10);
		// Input map unchanged
		assertEquals(0.0, map.getLogValue(5, 5));
		
		var fromDetection = LandmarkDetectionMap.fromDetection("tip", createPeakedMap(), FALSE_POSITIVE_RATE, FALSE_NEGATIVE_RATE);
		for (int y = 0; y < 20; y++) {
			for (int x = 0; x < 20; x++)
				assertEquals(corrected.getLogValue(x, y), fromDetection.getLogValue(x, y));
		}
	}
	
	@Test
	public void test_invalidErrorRates() {
		var map = new LandmarkDetectionMap("tip", createPeakedMap());
		assertThrows(IllegalArgumentException.class, () -> map.correctCertaintyForErrorRates(-0.1, 0.1));
		assertThrows(IllegalArgumentException.class, () -> map.correctCertaintyForErrorRates(0.1, 1.5));
		assertThrows(IllegalArgumentException.class, () -> map.correctCertaintyForErrorRates(0.6, 0.6));
		assertThrows(IllegalArgumentException.class, () -> map.correctCertaintyForErrorRates(Double.NaN, 0.1));
		assertThrows(NullPointerException.class, () -> new LandmarkDetectionMap(null, createPeakedMap()));
	}
	
	@Test
	public void test_errorRatesSummingToOne() {
		var map = new LandmarkDetectionMap("tip", createPeakedMap());
		// Sum exceeds 1 by rounding error only, so every pixel becomes the false negative rate
		double falseNegativeRate = 0.5 + 1e-15;
		var corrected = map.correctCertaintyForErrorRates(0.5, falseNegativeRate);
		assertEquals(Math.log(falseNegativeRate), corrected.getLogValue(5, 5), 1e-12);
		assertEquals(Math.log(falseNegativeRate), corrected.getLogValue(19, 0), 1e-12);
		
		assertThrows(IllegalArgumentException.class, () -> map.correctCertaintyForErrorRates(0.5, 0.5 + 1e-9));
	}
	
	@Test
	public void test_gaussianNoiseAtPeak() {
		double sdev = 5.0;
		var corrected = LandmarkDetectionMap.fromDetection("tip", createPeakedMap(), FALSE_POSITIVE_RATE, FALSE_NEGATIVE_RATE);
		var noisy = corrected.precalculateIsotropicGaussianNoise(sdev);
		double expected = corrected.getLogValue(5, 5) + 
				new IsotropicGaussianPointEvaluator(sdev).logValue(Point2.origin(), Point2.origin());
		assertEquals(expected, noisy.getLogValue(5, 5), 1e-10);
	}
	
	@Test
	public void test_gaussianNoiseBruteForce() {
		double sdev = 2.0;
		var corrected = LandmarkDetectionMap.fromDetection("tip", createPeakedMap(), FALSE_POSITIVE_RATE, FALSE_NEGATIVE_RATE);
		var noisy = corrected.precalculateIsotropicGaussianNoise(sdev);
		var evaluator = new IsotropicGaussianPointEvaluator(sdev);
		var rng = new Random(5L);
		for (int i = 0; i < 50; i++) {
			var p = new Point2(rng.nextDouble() * 20, rng.nextDouble() * 20);
			double expected = MaxConvolution.exhaustiveAt(corrected.getLogValues(), evaluator, (int)p.getX(), (int)p.getY());
			assertEquals(expected, noisy.getLogValue(p), 1e-10);
		}
	}
	
	@Test
	public void test_gaussianNoiseIsMonotone() {
		// A single confident detection spreads out, decreasing with distance
		var detection = SimpleImages.createDoubleImage(15, 15, (x, y) -> x == 7 && y == 7 ? 0 : Double.NEGATIVE_INFINITY);
		var noisy = new LandmarkDetectionMap("tip", detection).precalculateIsotropicGaussianNoise(2.0);
		for (int x = 7; x < 15; x++)
			assertEquals(IsotropicGaussianPointEvaluator.logDensity((x - 7) * (x - 7), 2.0, 2), noisy.getLogValue(x, 7), 1e-12);
		for (int x = 8; x < 15; x++) {
			assertTrue(noisy.getLogValue(x, 7) < noisy.getLogValue(x - 1, 7));
			assertTrue(noisy.getLogValue(x, x) < noisy.getLogValue(x - 1, x - 1));
		}
		assertEquals(noisy.getLogValue(3, 7), noisy.getLogValue(11, 7), 1e-12);
		assertEquals(noisy.getLogValue(7, 2), noisy.getLogValue(2, 7), 1e-12);
	}

}
