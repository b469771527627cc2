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

import java.util.Objects;

import facefit.lib.analysis.filters.MaxConvolution;
import facefit.lib.analysis.filters.PairwisePenalties;
import facefit.lib.analysis.images.SimpleImage;
import facefit.lib.analysis.images.SimpleImages;
import facefit.lib.common.GeneralTools;
import facefit.lib.geom.Point2;

/**
 * Per-pixel log certainty that a landmark is located at that pixel, usually the output of 
 * an external landmark detector.
 */
public class LandmarkDetectionMap {
	
	private static final double RATE_SUM_TOLERANCE = 1e-12;
	
	private final String tag;
	private final SimpleImage logValues;
	
	/**
	 * Constructor.
	 * @param tag id of the landmark this map refers to
	 * @param logValues log certainty for every pixel
	 */
	public LandmarkDetectionMap(String tag, SimpleImage logValues) {
		this.tag = Objects.requireNonNull(tag, "Landmark tag must not be null");
		this.logValues = Objects.requireNonNull(logValues, "Detection map must not be null");
	}
	
	/**
	 * Create a detection map from raw detector output, correcting for known detector error rates.
	 * @param tag id of the landmark
	 * @param logValues log certainty for every pixel
	 * @param falsePositiveRate 
	 * @param falseNegativeRate
	 * @return
	 * @see #correctCertaintyForErrorRates(double, double)
	 */
	public static LandmarkDetectionMap fromDetection(String tag, SimpleImage logValues, double falsePositiveRate, double falseNegativeRate) {
		return new LandmarkDetectionMap(tag, logValues).correctCertaintyForErrorRates(falsePositiveRate, falseNegativeRate);
	}
	
	/**
	 * Id of the landmark this map refers to.
	 * @return
	 */
	public String getTag() {
		return tag;
	}
	
	/**
	 * Log certainty values.
	 * @return
	 */
	public SimpleImage getLogValues() {
		return logValues;
	}
	
	/**
	 * Get the log certainty at a pixel, or {@code Double.NEGATIVE_INFINITY} if the pixel is outside the map.
	 * @param x
	 * @param y
	 * @return
	 */
	public double getLogValue(int x, int y) {
		if (logValues.contains(x, y))
			return logValues.getValue(x, y);
		return Double.NEGATIVE_INFINITY;
	}
	
	/**
	 * Get the log certainty at the pixel containing the point, or {@code Double.NEGATIVE_INFINITY} if 
	 * the point is outside the map.
	 * @param point
	 * @return
	 */
	public double getLogValue(Point2 point) {
		return lookup(logValues, point);
	}
	
	/**
	 * Correct the certainty for the error rates of the detector.
	 * <p>
	 * Each certainty {@code p = exp(logValue)} becomes {@code p * (1 - fp - fn) + fn}: 
	 * a certain detection is only right with probability {@code 1 - fp}, while a missing detection 
	 * still leaves a probability of {@code fn} that the landmark is there.
	 * 
	 * @param falsePositiveRate rate of false detections, in [0, 1]
	 * @param falseNegativeRate rate of missed detections, in [0, 1]
	 * @return a new detection map with the same tag
	 * @throws IllegalArgumentException if either rate is outside [0, 1], or the rates sum to more than 1 (beyond rounding error)
	 */
	public LandmarkDetectionMap correctCertaintyForErrorRates(double falsePositiveRate, double falseNegativeRate) throws IllegalArgumentException {
		checkRate(falsePositiveRate, "False positive");
		checkRate(falseNegativeRate, "False negative");
		double sum = falsePositiveRate + falseNegativeRate;
		// Rates that sum to 1 may exceed it slightly through rounding
		if (sum > 1.0 && !GeneralTools.almostTheSame(sum, 1.0, RATE_SUM_TOLERANCE))
			throw new IllegalArgumentException("Sum of false positive and false negative rates must be <= 1, but was " + sum);
		double scale = Math.max(0.0, 1.0 - sum);
		var corrected = SimpleImages.map(logValues, v -> Math.log(Math.exp(v) * scale + falseNegativeRate));
		return new LandmarkDetectionMap(tag, corrected);
	}
	
	/**
	 * Pre-compute the best combination of detection certainty and an isotropic Gaussian noise model 
	 * for the landmark position.
	 * <p>
	 * The value at each pixel of the returned map is the maximum over all pixels of 
	 * {@code logValue(source) + log N(target - source; 0, sdev)}, so that later evaluations are single lookups.
	 * 
	 * @param sdevNoiseModel standard deviation of the landmark position noise, in pixels
	 * @return a new detection map with the same tag
	 */
	public LandmarkDetectionMap precalculateIsotropicGaussianNoise(double sdevNoiseModel) {
		var penalty = PairwisePenalties.isotropicGaussian(sdevNoiseModel);
		return new LandmarkDetectionMap(tag, MaxConvolution.separable2D(logValues, penalty));
	}
	
	static double lookup(SimpleImage image, Point2 point) {
		double px = Math.floor(point.getX());
		double py = Math.floor(point.getY());
		// Written this way round so that NaN coordinates are outside
		if (!(px >= 0 && py >= 0 && px < image.getWidth() && py < image.getHeight()))
			return Double.NEGATIVE_INFINITY;
		return image.getValue((int)px, (int)py);
	}
	
	private static void checkRate(double rate, String name) throws IllegalArgumentException {
		if (!(rate >= 0 && rate <= 1))
			throw new IllegalArgumentException(name + " rate must be between 0 and 1, but was " + rate);
	}
	
	@Override
	public String toString() {
		return "LandmarkDetectionMap [" + tag + ", " + logValues.getWidth() + "x" + logValues.getHeight() + "]";
	}

}
