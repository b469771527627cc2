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

package facefit.lib.landmarks;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import facefit.lib.geom.Point2;

/**
 * Renderer for tests, treating the sample as the position of the 'tip' landmark.
 * The 'nose' is one pixel to the right, and the 'hidden' landmark is never rendered.
 */
class PointRenderer implements LandmarksRenderer<Point2> {

	@Override
	public List<String> allLandmarkIds() {
		return Arrays.asList("tip", "nose", "hidden");
	}

	@Override
	public Optional<Landmark2D> renderLandmark(String id, Point2 sample) {
		switch (id) {
		case "tip":
			return Optional.of(new Landmark2D(id, sample, true));
		case "nose":
			return Optional.of(new Landmark2D(id, new Point2(sample.getX() + 1, sample.getY()), true));
		default:
			return Optional.empty();
		}
	}
	
}
