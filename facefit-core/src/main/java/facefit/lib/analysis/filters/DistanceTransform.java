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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import facefit.lib.analysis.images.SimpleBinaryImage;
import facefit.lib.analysis.images.SimpleImage;
import facefit.lib.analysis.images.SimpleImages;
import facefit.lib.analysis.images.SimpleModifiableImage;

/**
 * Euclidean distance transforms of binary images, using the algorithm of Felzenszwalb &amp; Huttenlocher 
 * expressed as a separable {@link MaxConvolution} with a negative squared distance penalty.
 */
public class DistanceTransform {
	
	private static final Logger logger = LoggerFactory.getLogger(DistanceTransform.class);
	
	/**
	 * Compute the Euclidean distance from every pixel to the closest foreground pixel.
	 * <p>
	 * Foreground pixels have distance 0. If the mask has no foreground pixels, all distances are infinite.
	 * 
	 * @param mask binary image, where {@code true} indicates foreground
	 * @return a new image of the same size containing distances in pixels
	 */
	public static SimpleModifiableImage euclidean(SimpleBinaryImage mask) {
		Objects.requireNonNull(mask, "Mask must not be null");
		
		// 0 at foreground, impossible at background
		var seed = SimpleImages.seed(mask, Double.NEGATIVE_INFINITY);
		
		var negSqDistance = MaxConvolution.separable2D(seed, PairwisePenalties.negativeSquaredDistance());
		
		double[] pixels = negSqDistance.getArray(true);
		// Use 0.0 - x rather than -x so that foreground pixels are +0.0
		for (int i = 0; i < pixels.length; i++)
			pixels[i] = Math.sqrt(0.0 - pixels[i]);
		logger.trace("Computed distance transform for {}x{} mask", mask.getWidth(), mask.getHeight());
		return negSqDistance;
	}
	
	/**
	 * Compute the signed Euclidean distance transform.
	 * <p>
	 * Outside the foreground the value is the distance to the closest foreground pixel; 
	 * inside the foreground it is the negated distance to the closest background pixel. 
	 * 
	 * @param mask binary image, where {@code true} indicates foreground
	 * @return a new image of the same size containing signed distances in pixels
	 */
	public static SimpleModifiableImage signedEuclidean(SimpleBinaryImage mask) {
		Objects.requireNonNull(mask, "Mask must not be null");
		var outsideDistance = euclidean(mask);
		var insideDistance = euclidean(SimpleImages.invert(mask));
		return combineSigned(outsideDistance, insideDistance);
	}
	
	/**
	 * Combine an outside and inside distance transform into a signed distance transform.
	 * The result is the outside distance where this is &gt; 0, and the negated inside distance elsewhere.
	 * 
	 * @param outsideDistance distance to the closest foreground pixel
	 * @param insideDistance distance to the closest background pixel
	 * @return a new image of the same size
	 * @throws IllegalArgumentException if the images have different sizes
	 */
	public static SimpleModifiableImage combineSigned(SimpleImage outsideDistance, SimpleImage insideDistance) throws IllegalArgumentException {
		if (!SimpleImages.sameSize(outsideDistance, insideDistance))
			throw new IllegalArgumentException(String.format("Distance images must have the same size, but were %dx%d and %dx%d",
					outsideDistance.getWidth(), outsideDistance.getHeight(), insideDistance.getWidth(), insideDistance.getHeight()));
		return SimpleImages.createDoubleImage(outsideDistance.getWidth(), outsideDistance.getHeight(), (x, y) -> {
			double out = outsideDistance.getValue(x, y);
			return out > 0.0 ? out : -insideDistance.getValue(x, y);
		});
	}

}
