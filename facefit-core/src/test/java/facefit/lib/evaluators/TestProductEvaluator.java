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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestProductEvaluator {
	
	@Test
	public void test_sumOfLogValues() {
		DistributionEvaluator<Double> first = v -> -v;
		DistributionEvaluator<Double> second = v -> 2 * v;
		var product = new ProductEvaluator<Double>(Arrays.asList(first, second));
		assertEquals(3.0, product.logValue(3.0));
		assertEquals(2, product.getEvaluators().size());
		
		// Empty product is certain
		var empty = new ProductEvaluator<Double>(Collections.emptyList());
		assertEquals(0.0, empty.logValue(3.0));
	}
	
	@Test
	public void test_impossibleSample() {
		List<Double> called = new ArrayList<>();
		DistributionEvaluator<Double> impossible = v -> Double.NEGATIVE_INFINITY;
		DistributionEvaluator<Double> recording = v -> {
			called.add(v);
			return Double.POSITIVE_INFINITY;
		};
		var product = new ProductEvaluator<Double>(Arrays.asList(impossible, recording));
		assertEquals(Double.NEGATIVE_INFINITY, product.logValue(1.0));
		assertEquals(0, called.size());
	}
	
	@Test
	public void test_unmodifiable() {
		DistributionEvaluator<Double> first = v -> v;
		var list = new ArrayList<DistributionEvaluator<Double>>();
		list.add(first);
		var product = new ProductEvaluator<Double>(list);
		list.add(first);
		assertEquals(1, product.getEvaluators().size());
		assertThrows(UnsupportedOperationException.class, () -> product.getEvaluators().add(first));
	}

}
