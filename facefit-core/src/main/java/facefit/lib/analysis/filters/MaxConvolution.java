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

package facefit.lib.analysis.filters;

import java.util.Objects;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import facefit.lib.analysis.images.PixelOrder;
import facefit.lib.analysis.images.SimpleImage;
import facefit.lib.analysis.images.SimpleImages;
import facefit.lib.analysis.images.SimpleModifiableImage;
import facefit.lib.common.LogTools;
import facefit.lib.common.Prefs;
import facefit.lib.evaluators.PairEvaluator;
import facefit.lib.geom.Point2;

/**
 * Static methods to compute maximum convolutions, i.e. convolutions in the max-plus semiring.
 * <p>
 * For a 1D sequence {@code data} and a {@link PairwisePenalty} {@code eval}, the max convolution is
 * <pre>
 *   result[i] = max_j ( data[j] + eval(i - j) )
 * </pre>
 * In 2D, a penalty that separates additively along x and y (such as a negative squared distance or 
 * an isotropic Gaussian log-density) allows the result to be computed with one 1D pass per row, 
 * followed by one 1D pass per column.
 */
public class MaxConvolution {
	
	private static final Logger logger = LoggerFactory.getLogger(MaxConvolution.class);
	
	/**
	 * Compute the 1D max convolution of the data.
	 * <p>
	 * If the penalty is concave, a two-pass scan is used in which the best source position is tracked 
	 * as a monotonic pointer; otherwise an exhaustive search is performed.
	 * 
	 * @param data input values; must not be empty
	 * @param penalty pairwise penalty, defined for all offsets in [-(n-1), n-1]
	 * @return a new array of the same length as data
	 * @throws IllegalArgumentException if data is empty
	 * @see #maxConvolution1DExhaustive(double[], PairwisePenalty)
	 */
	public static double[] maxConvolution1D(double[] data, PairwisePenalty penalty) throws IllegalArgumentException {
		checkInput(data, penalty);
		if (penalty.isConcave())
			return maxConvolution1DConcave(data, penalty);
		LogTools.warnOnce(logger, "Penalty '{}' is not flagged as concave - max convolution will use a slow exhaustive search", penalty);
		return maxConvolution1DExhaustive(data, penalty);
	}
	
	/**
	 * Compute the 1D max convolution by an exhaustive O(n^2) search over all source positions.
	 * This is correct for any penalty.
	 * 
	 * @param data input values; must not be empty
	 * @param penalty pairwise penalty, defined for all offsets in [-(n-1), n-1]
	 * @return a new array of the same length as data
	 * @throws IllegalArgumentException if data is empty
	 */
	public static double[] maxConvolution1DExhaustive(double[] data, PairwisePenalty penalty) throws IllegalArgumentException {
		checkInput(data, penalty);
		int n = data.length;
		double[] result = new double[n];
		double self = penalty.logValue(0);
		for (int i = 0; i < n; i++) {
			double best = data[i] + self;
			for (int j = 0; j < n; j++) {
				double t = data[j] + penalty.logValue(i - j);
				if (best < t)
					best = t;
			}
			result[i] = best;
		}
		return result;
	}
	
	/**
	 * Two-pass max convolution for concave penalties.
	 * <p>
	 * The forward pass only looks at sources to the left of (or at) each position, starting from the best 
	 * source found for the previous position. The backward pass then looks at sources to the right, 
	 * for positions up to the final best source. For concave penalties the best source index is 
	 * non-decreasing in the target index, so no candidates are missed.
	 */
	static double[] maxConvolution1DConcave(double[] data, PairwisePenalty penalty) {
		int n = data.length;
		double[] result = new double[n];
		
		// Staying in place is always a candidate
		double self = penalty.logValue(0);
		for (int i = 0; i < n; i++)
			result[i] = data[i] + self;

		// Forward pass
		int maxPos = 0;
		for (int i = 0; i < n; i++) {
			int pos = i;
			for (int lag = maxPos; lag < i; lag++) {
				double t = data[lag] + penalty.logValue(i - lag);
				if (result[i] < t) {
					result[i] = t;
					pos = lag;
				}
			}
			maxPos = pos;
		}
		
		// Backward pass
		for (int i = maxPos; i >= 0; i--) {
			int pos = i;
			for (int lag = maxPos; lag > i; lag--) {
				double t = data[lag] + penalty.logValue(i - lag);
				if (result[i] < t) {
					result[i] = t;
					pos = lag;
				}
			}
			maxPos = pos;
		}
		return result;
	}
	
	/**
	 * Compute a separable 2D max convolution, using the same penalty along both axes.
	 * <p>
	 * Rows and columns are processed in parallel if {@link Prefs#getNumThreads()} is &gt; 1 and the image 
	 * contains at least {@link Prefs#getParallelPixelThreshold()} pixels.
	 * 
	 * @param image the input image; this is not modified
	 * @param penalty 1D pairwise penalty applied to the x and y displacements
	 * @return a new row-major image of the same size
	 * @see #separable2D(SimpleImage, PairwisePenalty, boolean)
	 */
	public static SimpleModifiableImage separable2D(SimpleImage image, PairwisePenalty penalty) {
		Objects.requireNonNull(image, "Image must not be null");
		long nPixels = (long)image.getWidth() * image.getHeight();
		boolean doParallel = Prefs.getNumThreads() > 1 && nPixels >= Prefs.getParallelPixelThreshold();
		return separable2D(image, penalty, doParallel);
	}
	
	/**
	 * Compute a separable 2D max convolution, using the same penalty along both axes.
	 * <p>
	 * The result is exact when the 2D penalty is the sum of the 1D penalty applied to x and y displacements 
	 * separately.
	 * 
	 * @param image the input image; this is not modified
	 * @param penalty 1D pairwise penalty applied to the x and y displacements
	 * @param doParallel if true, process rows (and then columns) in parallel
	 * @return a new row-major image of the same size
	 */
	public static SimpleModifiableImage separable2D(SimpleImage image, PairwisePenalty penalty, boolean doParallel) {
		Objects.requireNonNull(image, "Image must not be null");
		Objects.requireNonNull(penalty, "Penalty must not be null");
		int width = image.getWidth();
		int height = image.getHeight();
		var order = PixelOrder.ROW_MAJOR;
		double[] buffer = new double[width * height];
		
		long startTime = System.currentTimeMillis();
		
		// Each task writes only its own row
		var rows = IntStream.range(0, height);
		if (doParallel)
			rows = rows.parallel();
		rows.forEach(y -> {
			double[] row = maxConvolution1D(SimpleImages.getRow(image, y), penalty);
			order.setRow(buffer, width, height, y, row);
		});
		
		// Columns can only start once all rows are complete; each task reads & rewrites only its own column
		var columns = IntStream.range(0, width);
		if (doParallel)
			columns = columns.parallel();
		columns.forEach(x -> {
			double[] column = new double[height];
			order.getColumn(buffer, width, height, x, column);
			order.setColumn(buffer, width, height, x, maxConvolution1D(column, penalty));
		});
		
		long endTime = System.currentTimeMillis();
		logger.debug("Separable max convolution of {}x{} image with {} ({}) in {} ms",
				width, height, penalty, doParallel ? "parallel" : "sequential", endTime - startTime);
		
		return SimpleImages.createDoubleImage(buffer, width, height, order);
	}
	
	/**
	 * Compute the max convolution at a single pixel by an exhaustive search over all pixels of the image, 
	 * using a general (not necessarily separable) pair evaluator.
	 * 
	 * @param image the input image
	 * @param evaluator pair evaluator, called with (source, target) points
	 * @param x x-coordinate of the target pixel
	 * @param y y-coordinate of the target pixel
	 * @return {@code max_{x',y'} (image(x',y') + evaluator(source=(x',y'), target=(x,y)))}
	 */
	public static double exhaustiveAt(SimpleImage image, PairEvaluator<Point2> evaluator, int x, int y) {
		var target = new Point2(x, y);
		double best = Double.NEGATIVE_INFINITY;
		for (int ty = 0; ty < image.getHeight(); ty++) {
			for (int tx = 0; tx < image.getWidth(); tx++) {
				double t = image.getValue(tx, ty) + evaluator.logValue(new Point2(tx, ty), target);
				if (best < t)
					best = t;
			}
		}
		return best;
	}
	
	/**
	 * Compute a full 2D max convolution by exhaustive search, using a general pair evaluator.
	 * This requires O(n^2) evaluations for an image with n pixels, and should only be used for small 
	 * images or noise models that cannot be separated.
	 * 
	 * @param image the input image; this is not modified
	 * @param evaluator pair evaluator, called with (source, target) points
	 * @return a new row-major image of the same size
	 */
	public static SimpleModifiableImage exhaustive2D(SimpleImage image, PairEvaluator<Point2> evaluator) {
		Objects.requireNonNull(image, "Image must not be null");
		Objects.requireNonNull(evaluator, "Evaluator must not be null");
		logger.debug("Exhaustive max convolution of {}x{} image", image.getWidth(), image.getHeight());
		return SimpleImages.createDoubleImage(image.getWidth(), image.getHeight(), (x, y) -> exhaustiveAt(image, evaluator, x, y));
	}
	
	private static void checkInput(double[] data, PairwisePenalty penalty) throws IllegalArgumentException {
		Objects.requireNonNull(data, "Data must not be null");
		Objects.requireNonNull(penalty, "Penalty must not be null");
		if (data.length == 0)
			throw new IllegalArgumentException("Max convolution requires at least one value!");
	}

}
