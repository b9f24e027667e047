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

import java.util.Arrays;

/**
 * Two points in pixel space: the unit of transect sampling.
 */
public class Segment {

	private final double x1;
	private final double y1;
	private final double x2;
	private final double y2;

	public Segment(final double x1, final double y1, final double x2, final double y2) {
		this.x1 = x1;
		this.y1 = y1;
		this.x2 = x2;
		this.y2 = y2;
	}

	public Segment(final PixelPoint start, final PixelPoint end) {
		this(start.getX(), start.getY(), end.getX(), end.getY());
	}

	/**
	 * @param endpoints the segment as {x1, y1, x2, y2}
	 * @return the segment
	 * @throws IllegalArgumentException if {@code endpoints} does not have four
	 *           finite elements
	 */
	public static Segment of(final double[] endpoints) {
		if (endpoints == null || endpoints.length != 4)
			throw new IllegalArgumentException("Segment requires 4 coordinates: x1, y1, x2, y2");
		for (final double d : endpoints) {
			if (!Double.isFinite(d)) throw new IllegalArgumentException("Non-finite coordinate: " + Arrays.toString(endpoints));
		}
		return new Segment(endpoints[0], endpoints[1], endpoints[2], endpoints[3]);
	}

	public PixelPoint getStart() {
		return new ClickPoint(x1, y1);
	}

	public PixelPoint getEnd() {
		return new ClickPoint(x2, y2);
	}

	/** @return the segment as {x1, y1, x2, y2} */
	public double[] toArray() {
		return new double[] { x1, y1, x2, y2 };
	}

	public double length() {
		return Math.sqrt((x2 - x1) * (x2 - x1) + (y2 - y1) * (y2 - y1));
	}

	public PixelPoint midpoint() {
		return PixelPoint.midpoint(getStart(), getEnd());
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof Segment)) return false;
		return Arrays.equals(toArray(), ((Segment) o).toArray());
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(toArray());
	}

	@Override
	public String toString() {
		return Arrays.toString(toArray());
	}

}
