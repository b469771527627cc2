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

/**
 * A pairwise penalty in log space, describing how plausible a displacement between a source 
 * and a target position is.
 * <p>
 * Implementations must be pure: the same offset must always give the same value, and the function 
 * must be defined for every offset that can occur within the line being processed.
 * 
 * @see PairwisePenalties
 * @see MaxConvolution
 */
@FunctionalInterface
public interface PairwisePenalty {
	
	/**
	 * Get the log-weight for a displacement.
	 * @param offset displacement between target and source position (target - source)
	 * @return the log-weight; may be {@code Double.NEGATIVE_INFINITY} for impossible displacements
	 */
	double logValue(double offset);
	
	/**
	 * Returns true if this penalty is known to be a concave function of the offset 
	 * (e.g. a negative squared distance or a Gaussian log-density).
	 * <p>
	 * Only concave penalties are eligible for the fast two-pass max convolution; 
	 * all other penalties are handled by an exhaustive search.
	 * 
	 * @return true if the penalty is concave, false if unknown
	 */
	default boolean isConcave() {
		return false;
	}

}
