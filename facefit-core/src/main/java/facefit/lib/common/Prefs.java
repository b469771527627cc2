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

/**
 * Core FaceFit preferences. These are held in memory only and are not persistent.
 */
public class Prefs {
	
	private static volatile int nThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
	
	private static volatile int parallelPixelThreshold = 256 * 256;
	
	/**
	 * Get the requested number of threads to use for parallelization.
	 * @return
	 */
	public static int getNumThreads() {
		return nThreads;
	}

	/**
	 * Set the requested number of threads. This will be clipped to be at least 1.
	 * Setting 1 disables parallel processing.
	 * @param n
	 */
	public static void setNumThreads(int n) {
		nThreads = Math.max(1, n);
	}
	
	/**
	 * Get the minimum number of pixels an image must contain before 
	 * row and column passes are processed in parallel.
	 * @return
	 */
	public static int getParallelPixelThreshold() {
		return parallelPixelThreshold;
	}
	
	/**
	 * Set the minimum number of pixels required for parallel processing. 
	 * This will be clipped to be at least 0.
	 * @param n
	 */
	public static void setParallelPixelThreshold(int n) {
		parallelPixelThreshold = Math.max(0, n);
	}

}
