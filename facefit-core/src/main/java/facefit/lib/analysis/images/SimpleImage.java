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
 * A minimal interface to define a means to provide access to pixel values from a 2D, 1-channel image 
 * of double values.
 */
public interface SimpleImage {
	
	/**
	 * Get the value of a single pixel.
	 * @param x x-coordinate of the pixel
	 * @param y y-coordinate of the pixel
	 * @return the pixel value
	 * @throws IndexOutOfBoundsException if the pixel is outside the image
	 */
	double getValue(int x, int y) throws IndexOutOfBoundsException;
	
	/**
	 * Get the value of a single pixel, using an {@link AccessMode} to determine 
	 * the value if the pixel is outside the image.
	 * @param x x-coordinate of the pixel
	 * @param y y-coordinate of the pixel
	 * @param mode the boundary policy to apply to pixels outside the image
	 * @return the pixel value
	 */
	default double getValue(int x, int y, AccessMode mode) {
		if (contains(x, y))
			return getValue(x, y);
		return mode.getOutsideValue(this, x, y);
	}
	
	/**
	 * Returns true if the pixel (x, y) falls inside the image.
	 * @param x
	 * @param y
	 * @return
	 */
	default boolean contains(int x, int y) {
		return x >= 0 && y >= 0 && x < getWidth() && y < getHeight();
	}
	
	/**
	 * Width of the image.
	 * @return
	 */
	int getWidth();

	/**
	 * Height of the image.
	 * @return
	 */
	int getHeight();

}
