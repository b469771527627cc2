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

package facefit.imagej.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import facefit.lib.analysis.filters.DistanceTransform;
import facefit.lib.analysis.images.SimpleImages;

@SuppressWarnings("javadoc")
public class TestIJTools {
	
	private static ByteProcessor createMask() {
		var bp = new ByteProcessor(9, 7);
		bp.set(2, 3, 255);
		bp.set(6, 1, 255);
		return bp;
	}
	
	@Test
	public void test_toBinaryImage() {
		var bp = createMask();
		var mask = IJTools.toBinaryImage(bp);
		assertEquals(9, mask.getWidth());
		assertEquals(7, mask.getHeight());
		assertTrue(mask.isSet(2, 3));
		assertTrue(mask.isSet(6, 1));
		assertFalse(mask.isSet(3, 2));
		
		var fp = new FloatProcessor(3, 1, new float[] {0.2f, 0.5f, 0.8f});
		var thresholded = IJTools.toBinaryImage(fp, 0.5);
		assertFalse(thresholded.isSet(0, 0));
		assertFalse(thresholded.isSet(1, 0));
		assertTrue(thresholded.isSet(2, 0));
	}
	
	@Test
	public void test_distanceTransform() {
		var bp = createMask();
		var fp = IJTools.distanceTransform(bp);
		var expected = DistanceTransform.euclidean(IJTools.toBinaryImage(bp));
		for (int y = 0; y < bp.getHeight(); y++) {
			for (int x = 0; x < bp.getWidth(); x++) {
				assertEquals((float)expected.getValue(x, y), fp.getf(x, y));
			}
		}
		assertEquals(0f, fp.getf(2, 3));
		assertEquals(5f, fp.getf(6, 6));
		assertEquals((float)Math.sqrt(5), fp.getf(4, 4));
	}
	
	@Test
	public void test_signedDistanceTransform() {
		var bp = new ByteProcessor(5, 5);
		bp.setValue(255);
		bp.setRoi(1, 1, 3, 3);
		bp.fill();
		bp.resetRoi();
		var fp = IJTools.signedDistanceTransform(bp);
		assertEquals(-2f, fp.getf(2, 2));
		assertEquals(-1f, fp.getf(1, 1));
		assertEquals(1f, fp.getf(0, 2));
		assertEquals((float)Math.sqrt(2), fp.getf(0, 0));
		// Never zero: foreground is strictly negative, background strictly positive
		for (int y = 0; y < 5; y++) {
			for (int x = 0; x < 5; x++) {
				if (bp.get(x, y) != 0)
					assertTrue(fp.getf(x, y) <= -1f);
				else
					assertTrue(fp.getf(x, y) >= 1f);
			}
		}
	}
	
	@Test
	public void test_emptyMask() {
		var fp = IJTools.distanceTransform(new ByteProcessor(4, 4));
		assertEquals(Float.POSITIVE_INFINITY, fp.getf(1, 1));
	}
	
	@Test
	public void test_convertToFloatProcessor() {
		var image = SimpleImages.createDoubleImage(3, 2, (x, y) -> x - 2.0 * y);
		var fp = IJTools.convertToFloatProcessor(image);
		assertEquals(3, fp.getWidth());
		assertEquals(2, fp.getHeight());
		assertEquals(-2f, fp.getf(0, 1));
		assertEquals(2f, fp.getf(2, 0));
	}

}
