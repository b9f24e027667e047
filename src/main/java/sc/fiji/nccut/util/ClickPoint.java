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

import java.util.Objects;

/**
 * A {@link PixelPoint} clicked by the user. Clicks of orthogonal chains carry
 * the width of the orthogonal segment they create. Instances are immutable.
 */
public class ClickPoint implements PixelPoint {

	/** Width of clicks that do not define one */
	public static final int NO_WIDTH = -1;

	private final double x;
	private final double y;
	private final int width;

	public ClickPoint(final double x, final double y) {
		this(x, y, NO_WIDTH);
	}

	public ClickPoint(final double x, final double y, final int width) {
		this.x = x;
		this.y = y;
		this.width = width;
	}

	@Override
	public double getX() {
		return x;
	}

	@Override
	public double getY() {
		return y;
	}

	public int getWidth() {
		return width;
	}

	/**
	 * @param width the width of the new click
	 * @return a click at the same location with the specified width
	 */
	public ClickPoint withWidth(final int width) {
		return new ClickPoint(x, y, width);
	}

	public boolean hasWidth() {
		return width != NO_WIDTH;
	}

	/**
	 * @param other the point to compare to
	 * @return true if both points share the same location, irrespective of width
	 */
	public boolean isSameLocation(final PixelPoint other) {
		return other != null && x == other.getX() && y == other.getY();
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof ClickPoint)) return false;
		final ClickPoint other = (ClickPoint) o;
		return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0 && width == other.width;
	}

	@Override
	public int hashCode() {
		return Objects.hash(x, y, width);
	}

	@Override
	public String toString() {
		return "[" + x + ", " + y + ((hasWidth()) ? ", w=" + width : "") + "]";
	}

}
