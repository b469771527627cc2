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

package facefit.imagej.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import facefit.lib.analysis.filters.DistanceTransform;
import facefit.lib.analysis.images.SimpleBinaryImage;
import facefit.lib.analysis.images.SimpleImage;
import facefit.lib.analysis.images.SimpleImages;

/**
 * Collection of static methods to help convert between ImageJ processors and FaceFit images, 
 * and to apply FaceFit distance transforms to ImageJ masks.
 */
public class IJTools {
	
	private static final Logger logger = LoggerFactory.getLogger(IJTools.class);
	
	// Suppressed default constructor for non-instantiability
	private IJTools() {
		throw new AssertionError();
	}
	
	/**
	 * Wrap an {@link ImageProcessor} as a {@link SimpleImage}. 
	 * Changes to the processor are reflected in the image.
	 * @param ip
	 * @return
	 */
	public static PixelImageIJ toSimpleImage(ImageProcessor ip) {
		return new PixelImageIJ(ip);
	}
	
	/**
	 * Create a binary mask from an {@link ImageProcessor}, where pixels with values strictly 
	 * greater than the threshold are foreground.
	 * @param ip
	 * @param threshold
	 * @return
	 */
	public static SimpleBinaryImage toBinaryImage(ImageProcessor ip, double threshold) {
		int w = ip.getWidth();
		int h = ip.getHeight();
		boolean[] mask = new boolean[w * h];
		for (int i = 0; i < mask.length; i++)
			mask[i] = ip.getf(i) > threshold;
		return SimpleImages.createBinaryImage(mask, w, h);
	}
	
	/**
	 * Create a binary mask from a typical ImageJ binary image, where non-zero pixels are foreground.
	 * @param ip
	 * @return
	 */
	public static SimpleBinaryImage toBinaryImage(ImageProcessor ip) {
		return toBinaryImage(ip, 0);
	}
	
	/**
	 * Convert a {@link SimpleImage} to a {@link FloatProcessor}. 
	 * Values are cast to float, and infinite values retained.
	 * @param image
	 * @return
	 */
	public static FloatProcessor convertToFloatProcessor(SimpleImage image) {
		int w = image.getWidth();
		int h = image.getHeight();
		double[] pixels = SimpleImages.getPixels(image, true);
		float[] values = new float[w * h];
		for (int i = 0; i < values.length; i++)
			values[i] = (float)pixels[i];
		return new FloatProcessor(w, h, values);
	}
	
	/**
	 * Compute the Euclidean distance from each pixel to the nearest non-zero pixel of an ImageJ mask.
	 * @param ip
	 * @return
	 * @see DistanceTransform#euclidean(SimpleBinaryImage)
	 */
	public static FloatProcessor distanceTransform(ImageProcessor ip) {
		logger.debug("Computing distance transform for {}x{} image", ip.getWidth(), ip.getHeight());
		return convertToFloatProcessor(DistanceTransform.euclidean(toBinaryImage(ip)));
	}

	/**
	 * Compute the signed Euclidean distance transform of an ImageJ mask: positive outside, 
	 * negative inside.
	 * @param ip
	 * @return
	 * @see DistanceTransform#signedEuclidean(SimpleBinaryImage)
	 */
	public static FloatProcessor signedDistanceTransform(ImageProcessor ip) {
		logger.debug("Computing signed distance transform for {}x{} image", ip.getWidth(), ip.getHeight());
		return convertToFloatProcessor(DistanceTransform.signedEuclidean(toBinaryImage(ip)));
	}

}
