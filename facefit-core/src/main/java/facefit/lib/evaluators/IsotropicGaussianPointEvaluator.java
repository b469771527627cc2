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

package facefit.lib.evaluators;

import facefit.lib.geom.Point2;

/**
 * Isotropic Gaussian noise model for 2D points.
 * <p>
 * The log value of a pair of points is the log-density of a 2D Gaussian with standard deviation 
 * {@code sdev} along each axis, evaluated at the displacement between the points.
 */
public class IsotropicGaussianPointEvaluator implements PairEvaluator<Point2> {
	
	private static final double LOG_2_PI = Math.log(2 * Math.PI);
	
	private final double sdev;
	private final double normalizer;
	
	/**
	 * Constructor.
	 * @param sdev standard deviation, in pixels
	 * @throws IllegalArgumentException if sdev is not finite and &gt; 0
	 */
	public IsotropicGaussianPointEvaluator(double sdev) throws IllegalArgumentException {
		checkStandardDeviation(sdev);
		this.sdev = sdev;
		this.normalizer = getNormalizer(sdev, 2);
	}
	
	/**
	 * Get the standard deviation.
	 * @return
	 */
	public double getStandardDeviation() {
		return sdev;
	}
	
	@Override
	public double logValue(Point2 first, Point2 second) {
		return normalizer - 0.5 * first.distanceSq(second) / sdev / sdev;
	}
	
	/**
	 * Log-density of an isotropic Gaussian in the specified number of dimensions.
	 * @param squaredDistance squared distance from the mean
	 * @param sdev standard deviation along each axis
	 * @param dimensions number of dimensions
	 * @return
	 */
	public static double logDensity(double squaredDistance, double sdev, int dimensions) {
		return getNormalizer(sdev, dimensions) - 0.5 * squaredDistance / sdev / sdev;
	}
	
	/**
	 * Log of the normalizing constant, {@code -0.5*d*log(2*pi) - d*log(sdev)}.
	 * @param sdev
	 * @param dimensions
	 * @return
	 */
	public static double getNormalizer(double sdev, int dimensions) {
		return -0.5 * dimensions * LOG_2_PI - dimensions * Math.log(sdev);
	}
	
	/**
	 * Check that a standard deviation is usable.
	 * @param sdev
	 * @throws IllegalArgumentException if sdev is not finite and &gt; 0
	 */
	public static void checkStandardDeviation(double sdev) throws IllegalArgumentException {
		if (!(sdev > 0) || !Double.isFinite(sdev))
			throw new IllegalArgumentException("Standard deviation must be finite and > 0, but was " + sdev);
	}
	
	@Override
	public String toString() {
		return "IsotropicGaussianPointEvaluator (sdev=" + sdev + ")";
	}

}
