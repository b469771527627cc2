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

import java.util.Objects;

import ij.process.ImageProcessor;
import facefit.lib.analysis.images.PixelOrder;
import facefit.lib.analysis.images.SimpleModifiableImage;

/**
 * Very simple wrapper that allows FaceFit filters to access ImageProcessor pixel values.
 * <p>
 * Values are converted to double on access, and rounded according to the processor type when set.
 */
public class PixelImageIJ implements SimpleModifiableImage {
	
	private ImageProcessor ip;
	
	/**
	 * Constructor.
	 * @param ip ImageProcessor to wrap
	 */
	public PixelImageIJ(ImageProcessor ip) {
		this.ip = Objects.requireNonNull(ip);
	}

	@Override
	public double getValue(int x, int y) throws IndexOutOfBoundsException {
		checkBounds(x, y);
		return ip.getf(x, y);
	}

	@Override
	public void setValue(int x, int y, double val) {
		checkBounds(x, y);
		ip.setf(x, y, (float)val);
	}
	
	private void checkBounds(int x, int y) {
		// ImageProcessor.getf does not check bounds
		if (!contains(x, y))
			throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") outside image of size " + getWidth() + "x" + getHeight());
	}

	@Override
	public int getWidth() {
		return ip.getWidth();
	}

	@Override
	public int getHeight() {
		return ip.getHeight();
	}

	/**
	 * Get the pixels as a new row-major array. 
	 * The direct flag is ignored, because ImageJ does not store pixels as doubles.
	 */
	@Override
	public double[] getArray(boolean direct) {
		int n = ip.getWidth() * ip.getHeight();
		double[] pixels = new double[n];
		for (int i = 0; i < n; i++) {
			pixels[i] = ip.getf(i);
		}
		return pixels;
	}

	@Override
	public PixelOrder getPixelOrder() {
		return PixelOrder.ROW_MAJOR;
	}
	
	/**
	 * Get the wrapped processor.
	 * @return
	 */
	public ImageProcessor getProcessor() {
		return ip;
	}

}
