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

import facefit.lib.common.GeneralTools;

/**
 * Boundary policy used to read pixels that fall outside a {@link SimpleImage}.
 * <p>
 * Pixels inside the image are always read directly; an access mode is only consulted 
 * for coordinates outside the image bounds.
 * 
 * @see SimpleImage#getValue(int, int, AccessMode)
 */
public interface AccessMode {
	
	/**
	 * Get the value for a pixel outside the image.
	 * @param image the image being accessed
	 * @param x x-coordinate, which may be outside the image
	 * @param y y-coordinate, which may be outside the image
	 * @return
	 */
	double getOutsideValue(SimpleImage image, int x, int y);
	
	/**
	 * Throw an {@link IndexOutOfBoundsException} for any access outside the image.
	 * @return
	 */
	static AccessMode strict() {
		return StandardAccessModes.STRICT;
	}
	
	/**
	 * Repeat the border pixels, i.e. clamp coordinates to the image.
	 * @return
	 */
	static AccessMode repeat() {
		return StandardAccessModes.REPEAT;
	}
	
	/**
	 * Mirror the image at its borders (the border pixel itself is repeated).
	 * @return
	 */
	static AccessMode mirror() {
		return StandardAccessModes.MIRROR;
	}
	
	/**
	 * Tile the image periodically.
	 * @return
	 */
	static AccessMode periodic() {
		return StandardAccessModes.PERIODIC;
	}
	
	/**
	 * Return a fixed value for all pixels outside the image.
	 * @param outsideValue
	 * @return
	 */
	static AccessMode padded(double outsideValue) {
		return (image, x, y) -> outsideValue;
	}
	
	
	/**
	 * Standard access modes that do not require any parameters.
	 */
	enum StandardAccessModes implements AccessMode {
		
		STRICT {
			@Override
			public double getOutsideValue(SimpleImage image, int x, int y) {
				throw new IndexOutOfBoundsException(
						String.format("Pixel (%d, %d) is outside image of size %d x %d", x, y, image.getWidth(), image.getHeight()));
			}
		},
		
		REPEAT {
			@Override
			public double getOutsideValue(SimpleImage image, int x, int y) {
				return image.getValue(
						GeneralTools.clipValue(x, 0, image.getWidth()-1),
						GeneralTools.clipValue(y, 0, image.getHeight()-1));
			}
		},
		
		MIRROR {
			@Override
			public double getOutsideValue(SimpleImage image, int x, int y) {
				return image.getValue(
						mirror(x, image.getWidth()),
						mirror(y, image.getHeight()));
			}
		},
		
		PERIODIC {
			@Override
			public double getOutsideValue(SimpleImage image, int x, int y) {
				return image.getValue(
						GeneralTools.positiveModulo(x, image.getWidth()),
						GeneralTools.positiveModulo(y, image.getHeight()));
			}
		};
		
		// Reduce to a tile of size 2*n, then reflect the second half
		private static int mirror(int i, int n) {
			int p = GeneralTools.positiveModulo(i, 2 * n);
			return p < n ? p : 2 * n - p - 1;
		}
		
	}

}
