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

import java.util.Objects;

import facefit.lib.geom.Point2;

/**
 * A named 2D landmark in an image.
 */
public final class Landmark2D {
	
	private final String id;
	private final Point2 point;
	private final boolean visible;
	
	/**
	 * Constructor.
	 * @param id landmark identifier, e.g. "left.eye.corner_outer"
	 * @param point location in pixel coordinates
	 * @param visible true if the landmark is visible (not occluded)
	 */
	public Landmark2D(String id, Point2 point, boolean visible) {
		this.id = Objects.requireNonNull(id, "Landmark id must not be null");
		this.point = Objects.requireNonNull(point, "Landmark point must not be null");
		this.visible = visible;
	}
	
	/**
	 * Landmark identifier.
	 * @return
	 */
	public String getId() {
		return id;
	}
	
	/**
	 * Location of the landmark, in pixel coordinates.
	 * @return
	 */
	public Point2 getPoint() {
		return point;
	}
	
	/**
	 * True if the landmark is visible.
	 * @return
	 */
	public boolean isVisible() {
		return visible;
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, point, visible);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Landmark2D))
			return false;
		Landmark2D other = (Landmark2D) obj;
		return id.equals(other.id) && point.equals(other.point) && visible == other.visible;
	}

	@Override
	public String toString() {
		return "Landmark2D [" + id + ", " + point.getX() + ", " + point.getY() + (visible ? "" : ", hidden") + "]";
	}

}
