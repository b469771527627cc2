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

package facefit.lib.common;

import org.apache.commons.math3.util.Precision;

/**
 * Collection of generally useful static methods.
 */
public final class GeneralTools {
	
	// Suppress default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}
	
	/**
	 * Clip a value to be within a specific range.
	 * 
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static int clipValue(final int value, final int min, final int max) {
		return value < min ? min : (value > max ? max : value);
	}
	
	/**
	 * Clip a value to be within a specific range.
	 * 
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static double clipValue(final double value, final double min, final double max) {
		return value < min ? min : (value > max ? max : value);
	}
	
	/**
	 * Test if two doubles are approximately equal, within a specified relative tolerance.
	 * <p>
	 * Infinite values are only considered the same if they are identical.
	 * 
	 * @param n1
	 * @param n2
	 * @param tolerance
	 * @return
	 */
	public static boolean almostTheSame(double n1, double n2, double tolerance) {
		if (Double.isInfinite(n1) || Double.isInfinite(n2))
			return n1 == n2;
		return Precision.equalsWithRelativeTolerance(n1, n2, tolerance);
	}
	
	/**
	 * Get the remainder of a division, always in the range [0, m).
	 * @param i
	 * @param m the divisor; must be &gt; 0
	 * @return
	 */
	public static int positiveModulo(final int i, final int m) {
		int r = i % m;
		return r < 0 ? r + m : r;
	}
	
	/**
	 * Check a width and height are both &gt; 0.
	 * @param width
	 * @param height
	 * @throws IllegalArgumentException if either dimension is &lt;= 0
	 */
	public static void checkDimensions(final int width, final int height) throws IllegalArgumentException {
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Image dimensions must be > 0! Requested " + width + "x" + height);
	}

}
