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

package facefit.lib.io;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import facefit.lib.analysis.images.PixelOrder;
import facefit.lib.analysis.images.SimpleImage;
import facefit.lib.analysis.images.SimpleImages;
import facefit.lib.geom.Point2;
import facefit.lib.landmarks.Landmark2D;
import facefit.lib.landmarks.LandmarkDetectionMap;

@SuppressWarnings("javadoc")
public class TestGsonTools {
	
	@Test
	public void test_detectionMap() {
		var image = SimpleImages.createDoubleImage(3, 2, (x, y) -> x == 1 ? Double.NEGATIVE_INFINITY : -0.5 * (x + y));
		var map = new LandmarkDetectionMap("left.eye.pupil.center", image);
		
		var gson = GsonTools.getInstance();
		String json = gson.toJson(map);
		assertTrue(json.contains("-Infinity"));
		
		var map2 = gson.fromJson(json, LandmarkDetectionMap.class);
		assertEquals(map.getTag(), map2.getTag());
		assertEquals(3, map2.getLogValues().getWidth());
		assertEquals(2, map2.getLogValues().getHeight());
		assertArrayEquals(SimpleImages.getPixels(image, false), SimpleImages.getPixels(map2.getLogValues(), false));
		
		// Pretty printing doesn't change the content
		var map3 = GsonTools.getInstance(true).fromJson(GsonTools.getInstance(true).toJson(map), LandmarkDetectionMap.class);
		assertArrayEquals(SimpleImages.getPixels(image, false), SimpleImages.getPixels(map3.getLogValues(), false));
	}
	
	@Test
	public void test_imageRowMajor() {
		// Column-major images are written in row-major order
		var image = SimpleImages.createDoubleImage(new double[] {1, 2, 3, 4, 5, 6}, 2, 3, PixelOrder.COLUMN_MAJOR);
		var gson = GsonTools.getInstance();
		String json = gson.toJson(image, SimpleImage.class);
		assertEquals("{\"width\":2,\"height\":3,\"values\":[1.0,4.0,2.0,5.0,3.0,6.0]}", json);
		
		var image2 = gson.fromJson(json, SimpleImage.class);
		assertEquals(5.0, image2.getValue(1, 1));
		assertEquals(3.0, image2.getValue(0, 2));
	}
	
	@Test
	public void test_readImage() {
		var gson = GsonTools.getInstance();
		var image = gson.fromJson("{\"values\": [0, -Infinity, 2, 3], \"comment\": \"ignored\", \"height\": 2, \"width\": 2}", SimpleImage.class);
		assertEquals(Double.NEGATIVE_INFINITY, image.getValue(1, 0));
		assertEquals(3, image.getValue(1, 1));
		
		assertNull(gson.fromJson("null", SimpleImage.class));
		
		assertThrows(JsonParseException.class, () -> gson.fromJson("{\"width\": 2, \"height\": 2}", SimpleImage.class));
		assertThrows(JsonParseException.class, () -> gson.fromJson("{\"width\": 3, \"height\": 2, \"values\": [1, 2]}", SimpleImage.class));
		assertThrows(JsonParseException.class, () -> gson.fromJson("{\"tag\": \"nose\"}", LandmarkDetectionMap.class));
	}
	
	@Test
	public void test_landmarks() {
		var landmarks = Arrays.asList(
				new Landmark2D("nose", new Point2(10.5, 20), true),
				new Landmark2D("chin", new Point2(11, 40.25), false));
		var gson = GsonTools.getInstance();
		String json = gson.toJson(landmarks);
		List<Landmark2D> landmarks2 = gson.fromJson(json, new TypeToken<List<Landmark2D>>() {}.getType());
		assertEquals(landmarks, landmarks2);
		
		// Visible by default
		var landmark = gson.fromJson("{\"id\": \"nose\", \"x\": 1, \"y\": 2}", Landmark2D.class);
		assertEquals(new Landmark2D("nose", new Point2(1, 2), true), landmark);
		
		assertThrows(JsonParseException.class, () -> gson.fromJson("{\"id\": \"nose\", \"x\": 1}", Landmark2D.class));
	}

}
