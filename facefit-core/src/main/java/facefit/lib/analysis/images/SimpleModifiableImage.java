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

package facefit.lib.analysis.images;

/**
 * A {@link SimpleImage} backed by an array that can be modified.
 */
public interface SimpleModifiableImage extends SimpleImage {
	
	/**
	 * Set the value of a single pixel.
	 * @param x x-coordinate of the pixel to set
	 * @param y y-coordinate of the pixel to set
	 * @param val new pixel value
	 */
	void setValue(int x, int y, double val);
	
	/**
	 * Request the pixel array representing all the pixels in this image, 
	 * stored according to {@link #getPixelOrder()}.
	 * @param direct if true, the internal array will be returned if possible 
	 * @return
	 */
	double[] getArray(boolean direct);
	
	/**
	 * Get the order in which pixels are stored in the array returned by {@link #getArray(boolean)}.
	 * @return
	 */
	PixelOrder getPixelOrder();
	
}
