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

/**
 * An immutable 2D point (x &amp; y coordinates), in pixel units.
 */
public final class Point2 {
	
	private static final Point2 ORIGIN = new Point2(0, 0);
	
	private final double x, y;
	
	/**
	 * Point constructor.
	 * @param x
	 * @param y
	 */
	public Point2(final double x, final double y) {
		this.x = x;
		this.y = y;
	}
	
	/**
	 * Get a point at location (0,0).
	 * @return
	 */
	public static Point2 origin() {
		return ORIGIN;
	}
	
	/**
	 * Get the x coordinate of this point.
	 * @return
	 */
	public double getX() {
		return x;
	}

	/**
	 * Get the y coordinate of this point.
	 * @return
	 */
	public double getY() {
		return y;
	}

	/**
	 * Calculate the squared distance between this point and a specified x and y location.
	 * @param x
	 * @param y
	 * @return
	 */
	public double distanceSq(final double x, final double y) {
		double dx = this.x - x;
		double dy = this.y - y;
		return dx * dx + dy * dy;
	}
	
	/**
	 * Calculate the squared distance between this point and another point.
	 * @param p
	 * @return
	 */
	public double distanceSq(final Point2 p) {
		return distanceSq(p.x, p.y);
	}
	
	/**
	 * Calculate the distance between this point and a specified x and y location.
	 * @param x
	 * @param y
	 * @return
	 */
	public double distance(final double x, final double y) {
		return Math.sqrt(distanceSq(x, y));
	}
	
	/**
	 * Calculate the distance between this point and another point.
	 * @param p
	 * @return
	 */
	public double distance(final Point2 p) {
		return distance(p.x, p.y);
	}
	
	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		long temp;
		temp = Double.doubleToLongBits(x);
		result = prime * result + (int) (temp ^ (temp >>> 32));
		temp = Double.doubleToLongBits(y);
		result = prime * result + (int) (temp ^ (temp >>> 32));
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Point2 other = (Point2) obj;
		return Double.doubleToLongBits(x) == Double.doubleToLongBits(other.x) &&
				Double.doubleToLongBits(y) == Double.doubleToLongBits(other.y);
	}

	@Override
	public String toString() {
		return "Point: " + x + ", " + y;
	}

}
