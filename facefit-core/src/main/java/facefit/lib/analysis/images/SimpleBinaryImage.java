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
 * A 2D binary image (mask), in which each pixel is either foreground ({@code true}) or background.
 */
public interface SimpleBinaryImage {
	
	/**
	 * Returns true if the pixel is foreground.
	 * @param x
	 * @param y
	 * @return
	 * @throws IndexOutOfBoundsException if the pixel is outside the image
	 */
	boolean isSet(int x, int y) throws IndexOutOfBoundsException;
	
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
