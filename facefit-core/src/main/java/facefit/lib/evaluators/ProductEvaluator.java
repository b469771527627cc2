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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Combine independent evaluators by multiplying their probabilities, i.e. summing their log values.
 *
 * @param <T> type of the sample
 */
public class ProductEvaluator<T> implements DistributionEvaluator<T> {
	
	private final List<DistributionEvaluator<T>> evaluators;
	
	/**
	 * Constructor.
	 * @param evaluators the evaluators to combine; an empty collection gives a log value of 0
	 */
	public ProductEvaluator(Collection<? extends DistributionEvaluator<T>> evaluators) {
		this.evaluators = Collections.unmodifiableList(new ArrayList<>(evaluators));
	}
	
	/**
	 * Get the evaluators combined in this product.
	 * @return an unmodifiable list
	 */
	public List<DistributionEvaluator<T>> getEvaluators() {
		return evaluators;
	}

	@Override
	public double logValue(T sample) {
		double sum = 0;
		for (var evaluator : evaluators) {
			sum += evaluator.logValue(sample);
			// Nothing can recover from an impossible sample
			if (sum == Double.NEGATIVE_INFINITY)
				break;
		}
		return sum;
	}

}
