/*
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2026 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */
package sc.fiji.nccut.util;

/**
 * Classes implementing this interface define a point in the pixel space of a
 * data source: x is the column, y the row counted from the bottom edge.
 */
public interface PixelPoint {

	/** @return the X-coordinate of the point */
	public double getX();

	/** @return the Y-coordinate of the point */
	public double getY();

	/** @return the coordinates of this point as a {x, y} array */
	public default double[] toArray() {
		return new double[] { getX(), getY() };
	}

	/**
	 * Script friendly method for instantiating a new point.
	 *
	 * @param x the X coordinate
	 * @param y the Y coordinate
	 */
	public static ClickPoint of(final Number x, final Number y) {
		return new ClickPoint(x.doubleValue(), y.doubleValue());
	}

	/**
	 * Computes the midpoint of two points.
	 *
	 * @param p1 the first point
	 * @param p2 the second point
	 * @return the midpoint
	 */
	public static ClickPoint midpoint(final PixelPoint p1, final PixelPoint p2) {
		final double[] mid = LinAlgUtils.midpoint(p1.getX(), p1.getY(), p2.getX(), p2.getY());
		return new ClickPoint(mid[0], mid[1]);
	}

}
