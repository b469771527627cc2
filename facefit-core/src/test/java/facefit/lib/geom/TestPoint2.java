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

package facefit.lib.geom;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestPoint2 {
	
	@Test
	public void test_distance() {
		var p = new Point2(3, 4);
		assertEquals(25.0, p.distanceSq(Point2.origin()));
		assertEquals(5.0, p.distance(Point2.origin()));
		assertEquals(5.0, Point2.origin().distance(3, 4));
		assertEquals(0.0, p.distance(p));
	}
	
	@Test
	public void test_equality() {
		assertEquals(new Point2(1.5, 2), new Point2(1.5, 2));
		assertEquals(new Point2(1.5, 2).hashCode(), new Point2(1.5, 2).hashCode());
		assertNotEquals(new Point2(1.5, 2), new Point2(2, 1.5));
		assertEquals(Point2.origin(), new Point2(0, 0));
	}

}
