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

package facefit.lib.evaluators;

/**
 * Evaluates the log-probability of a pair of samples, e.g. a noise model relating an observed 
 * and a predicted position.
 *
 * @param <T> type of the samples
 */
@FunctionalInterface
public interface PairEvaluator<T> {
	
	/**
	 * Get the log value of the pair.
	 * @param first
	 * @param second
	 * @return
	 */
	double logValue(T first, T second);
	
	/**
	 * Create a {@link DistributionEvaluator} by fixing the first element of the pair.
	 * @param reference the fixed first element
	 * @return
	 */
	default DistributionEvaluator<T> toDistributionEvaluator(T reference) {
		return sample -> logValue(reference, sample);
	}

}
