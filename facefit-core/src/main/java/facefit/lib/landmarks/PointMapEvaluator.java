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

import facefit.lib.analysis.filters.MaxConvolution;
import facefit.lib.analysis.filters.PairwisePenalties;
import facefit.lib.analysis.images.SimpleImage;
import facefit.lib.evaluators.DistributionEvaluator;
import facefit.lib.geom.Point2;

/**
 * Evaluate point positions directly in a detection map, using an isotropic Gaussian noise model 
 * that is pre-computed when the evaluator is created.
 */
public class PointMapEvaluator implements DistributionEvaluator<Point2> {
	
	private final double sdevNoiseModel;
	private final SimpleImage probabilityMap;
	
	/**
	 * Constructor.
	 * @param sdevNoiseModel standard deviation of the point noise, in pixels
	 * @param detectionMap log certainty at every pixel
	 */
	public PointMapEvaluator(double sdevNoiseModel, SimpleImage detectionMap) {
		this.sdevNoiseModel = sdevNoiseModel;
		this.probabilityMap = MaxConvolution.separable2D(detectionMap, PairwisePenalties.isotropicGaussian(sdevNoiseModel));
	}
	
	/**
	 * Standard deviation of the noise model.
	 * @return
	 */
	public double getStandardDeviation() {
		return sdevNoiseModel;
	}

	@Override
	public double logValue(Point2 sample) {
		return LandmarkDetectionMap.lookup(probabilityMap, sample);
	}

}
