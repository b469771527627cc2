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
 * Evaluates the (unnormalized) log-probability of a sample.
 *
 * @param <T> type of the sample
 */
@FunctionalInterface
public interface DistributionEvaluator<T> {
	
	/**
	 * Get the log value of a sample.
	 * {@code Double.NEGATIVE_INFINITY} indicates the sample is impossible.
	 * @param sample
	 * @return
	 */
	double logValue(T sample);

}
