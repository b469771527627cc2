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

import java.util.List;
import java.util.Optional;

/**
 * Compute the image position of landmarks for a model sample (e.g. a set of render parameters).
 *
 * @param <T> type of the sample
 */
public interface LandmarksRenderer<T> {
	
	/**
	 * Get the ids of all landmarks this renderer can produce.
	 * @return
	 */
	List<String> allLandmarkIds();
	
	/**
	 * Returns true if the landmark id is known to this renderer.
	 * @param id
	 * @return
	 */
	default boolean hasLandmarkId(String id) {
		return allLandmarkIds().contains(id);
	}
	
	/**
	 * Render a single landmark.
	 * @param id landmark id
	 * @param sample the sample defining the landmark positions
	 * @return the landmark, or empty if it cannot be computed for this sample
	 */
	Optional<Landmark2D> renderLandmark(String id, T sample);

}
