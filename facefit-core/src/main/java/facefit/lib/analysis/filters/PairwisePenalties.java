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
import java.util.function.DoubleUnaryOperator;

import facefit.lib.evaluators.IsotropicGaussianPointEvaluator;

/**
 * Static methods to create common {@link PairwisePenalty} instances.
 */
public class PairwisePenalties {
	
	private static final PairwisePenalty NEGATIVE_SQUARED_DISTANCE = new DefaultPairwisePenalty(
			"Negative squared distance", d -> -(d * d), true);
	
	/**
	 * Penalty {@code -d*d}, used to compute squared Euclidean distances in log space.
	 * @return
	 */
	public static PairwisePenalty negativeSquaredDistance() {
		return NEGATIVE_SQUARED_DISTANCE;
	}
	
	/**
	 * Penalty given by the 1D isotropic Gaussian log-density with the specified standard deviation.
	 * @param sigma standard deviation, in pixels
	 * @return
	 * @throws IllegalArgumentException if sigma is not finite and &gt; 0
	 */
	public static PairwisePenalty isotropicGaussian(double sigma) throws IllegalArgumentException {
		IsotropicGaussianPointEvaluator.checkStandardDeviation(sigma);
		return new DefaultPairwisePenalty(
				"Isotropic Gaussian (sigma=" + sigma + ")",
				d -> IsotropicGaussianPointEvaluator.logDensity(d * d, sigma, 1),
				true);
	}
	
	/**
	 * Create a penalty from a function that the caller guarantees to be concave.
	 * The fast two-pass max convolution will be used with this penalty.
	 * @param fun
	 * @return
	 */
	public static PairwisePenalty concave(DoubleUnaryOperator fun) {
		Objects.requireNonNull(fun);
		return new DefaultPairwisePenalty("Concave penalty", fun, true);
	}
	
	/**
	 * Create a penalty from an arbitrary function.
	 * Max convolutions with this penalty use an exhaustive search.
	 * @param fun
	 * @return
	 */
	public static PairwisePenalty general(DoubleUnaryOperator fun) {
		Objects.requireNonNull(fun);
		return new DefaultPairwisePenalty("General penalty", fun, false);
	}
	
	
	static class DefaultPairwisePenalty implements PairwisePenalty {
		
		private final String name;
		private final DoubleUnaryOperator fun;
		private final boolean isConcave;
		
		DefaultPairwisePenalty(String name, DoubleUnaryOperator fun, boolean isConcave) {
			this.name = name;
			this.fun = fun;
			this.isConcave = isConcave;
		}

		@Override
		public double logValue(double offset) {
			return fun.applyAsDouble(offset);
		}
		
		@Override
		public boolean isConcave() {
			return isConcave;
		}
		
		@Override
		public String toString() {
			return name;
		}
		
	}

}
