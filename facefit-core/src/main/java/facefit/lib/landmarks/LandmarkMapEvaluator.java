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

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import facefit.lib.analysis.filters.MaxConvolution;
import facefit.lib.analysis.images.SimpleImage;
import facefit.lib.evaluators.DistributionEvaluator;
import facefit.lib.evaluators.PairEvaluator;
import facefit.lib.evaluators.ProductEvaluator;
import facefit.lib.geom.Point2;

/**
 * Evaluate a sample by rendering a landmark and looking up its position in a {@link LandmarkDetectionMap}.
 * <p>
 * Detection maps usually include a noise model through pre-computation, so that each evaluation 
 * during model fitting is a single lookup. Positions outside the map have a log value of 
 * {@code Double.NEGATIVE_INFINITY}.
 *
 * @param <T> type of the sample, e.g. render parameters
 */
public class LandmarkMapEvaluator<T> implements DistributionEvaluator<T> {
	
	private static final Logger logger = LoggerFactory.getLogger(LandmarkMapEvaluator.class);
	
	private final LandmarkDetectionMap detectionMap;
	private final LandmarksRenderer<T> renderer;
	
	/**
	 * Constructor.
	 * @param detectionMap detection map for the landmark, containing the log certainty at every pixel
	 * @param renderer renderer to compute the landmark position for each sample
	 * @throws IllegalArgumentException if the renderer does not know the landmark of the detection map
	 */
	public LandmarkMapEvaluator(LandmarkDetectionMap detectionMap, LandmarksRenderer<T> renderer) throws IllegalArgumentException {
		this.detectionMap = Objects.requireNonNull(detectionMap, "Detection map must not be null");
		this.renderer = Objects.requireNonNull(renderer, "Renderer must not be null");
		if (!renderer.hasLandmarkId(detectionMap.getTag()))
			throw new IllegalArgumentException("Renderer cannot produce landmark " + detectionMap.getTag());
	}
	
	/**
	 * Get the detection map used for lookups.
	 * @return
	 */
	public LandmarkDetectionMap getDetectionMap() {
		return detectionMap;
	}

	/**
	 * {@inheritDoc}
	 * @throws IllegalStateException if the renderer cannot compute the landmark for this sample
	 */
	@Override
	public double logValue(T sample) throws IllegalStateException {
		var landmark = renderer.renderLandmark(detectionMap.getTag(), sample)
				.orElseThrow(() -> new IllegalStateException("Landmark " + detectionMap.getTag() + " is not available for " + sample));
		return detectionMap.getLogValue(landmark.getPoint());
	}
	
	/**
	 * Combine lookups in several detection maps in a {@link ProductEvaluator} (independent landmarks).
	 * The maps are used as they are.
	 * 
	 * @param <T>
	 * @param detectionMaps
	 * @param renderer
	 * @return
	 */
	public static <T> ProductEvaluator<T> combine(Collection<LandmarkDetectionMap> detectionMaps, LandmarksRenderer<T> renderer) {
		return new ProductEvaluator<T>(
				detectionMaps.stream()
				.map(map -> new LandmarkMapEvaluator<T>(map, renderer))
				.collect(Collectors.toList()));
	}
	
	/**
	 * Prepare detection maps with an isotropic Gaussian noise model for the landmark positions, 
	 * and combine them in a {@link ProductEvaluator} (independent landmarks).
	 * <p>
	 * The best combination of detection certainty and noise model is pre-computed for every pixel 
	 * with a separable max convolution.
	 * 
	 * @param <T>
	 * @param detectionMaps
	 * @param renderer
	 * @param sdevNoiseModel standard deviation of the noise model, in pixels
	 * @return
	 */
	public static <T> ProductEvaluator<T> withIsotropicGaussianNoise(Collection<LandmarkDetectionMap> detectionMaps, 
			LandmarksRenderer<T> renderer, double sdevNoiseModel) {
		logger.debug("Pre-computing {} detection maps with Gaussian noise (sdev={})", detectionMaps.size(), sdevNoiseModel);
		return new ProductEvaluator<T>(
				detectionMaps.stream()
				.map(map -> new LandmarkMapEvaluator<T>(map.precalculateIsotropicGaussianNoise(sdevNoiseModel), renderer))
				.collect(Collectors.toList()));
	}
	
	/**
	 * Prepare detection maps with an arbitrary noise model for the landmark positions, 
	 * and combine them in a {@link ProductEvaluator} (independent landmarks).
	 * <p>
	 * <b>Warning!</b> This uses an exhaustive search over all pixels for every pixel that is evaluated, 
	 * and should only be used for noise models that cannot be handled by 
	 * {@link #withIsotropicGaussianNoise(Collection, LandmarksRenderer, double)}. 
	 * Values are computed lazily and cached, so this can remain usable if only a few pixels are visited.
	 * 
	 * @param <T>
	 * @param detectionMaps
	 * @param renderer
	 * @param landmarksLikelihood noise model, called with (detected position, rendered position)
	 * @return
	 */
	public static <T> ProductEvaluator<T> withLandmarksLikelihood(Collection<LandmarkDetectionMap> detectionMaps,
			LandmarksRenderer<T> renderer, PairEvaluator<Point2> landmarksLikelihood) {
		Objects.requireNonNull(landmarksLikelihood, "Landmarks likelihood must not be null");
		return new ProductEvaluator<T>(
				detectionMaps.stream()
				.map(map -> new LandmarkMapEvaluator<T>(
						new LandmarkDetectionMap(map.getTag(), new LazyMaxConvolutionImage(map.getLogValues(), landmarksLikelihood)),
						renderer))
				.collect(Collectors.toList()));
	}
	
	
	/**
	 * Image whose pixels are computed on request by an exhaustive max convolution, and then cached.
	 */
	static class LazyMaxConvolutionImage implements SimpleImage {
		
		private final SimpleImage logValues;
		private final PairEvaluator<Point2> evaluator;
		private final Map<Integer, Double> cache = new ConcurrentHashMap<>();
		
		LazyMaxConvolutionImage(SimpleImage logValues, PairEvaluator<Point2> evaluator) {
			this.logValues = logValues;
			this.evaluator = evaluator;
		}

		@Override
		public double getValue(int x, int y) throws IndexOutOfBoundsException {
			Objects.checkIndex(x, getWidth());
			Objects.checkIndex(y, getHeight());
			return cache.computeIfAbsent(y * getWidth() + x, i -> MaxConvolution.exhaustiveAt(logValues, evaluator, x, y));
		}

		@Override
		public int getWidth() {
			return logValues.getWidth();
		}

		@Override
		public int getHeight() {
			return logValues.getHeight();
		}
		
		int getCacheSize() {
			return cache.size();
		}
		
	}

}
