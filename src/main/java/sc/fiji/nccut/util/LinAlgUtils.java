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
 * Static methods for the line algebra of transects
 */
public class LinAlgUtils {

	/** Substitute for zero run lengths and zero slopes */
	public static final double SLOPE_GUARD = .001;

	private LinAlgUtils() {
	}

	/**
	 * Slope of the line through two points. A vertical line (zero run) is
	 * assigned the slope it would have over a run of {@link #SLOPE_GUARD}.
	 */
	public static double slope(final double x1, final double y1, final double x2, final double y2) {
		final double run = x2 - x1;
		return (y2 - y1) / ((run == 0) ? SLOPE_GUARD : run);
	}

	/**
	 * @return true if a line of slope {@code m} makes an angle larger than 45
	 *         degrees with the x-axis, i.e., if the y-axis is its dominant axis
	 */
	public static boolean isSteep(final double m) {
		return Math.abs(Math.atan(m)) > Math.PI / 4;
	}

	/** Slope perpendicular to {@code m}. A zero slope is replaced by {@link #SLOPE_GUARD} */
	public static double orthogonalSlope(final double m) {
		return -1d / ((m == 0) ? SLOPE_GUARD : m);
	}

	public static double[] midpoint(final double x1, final double y1, final double x2, final double y2) {
		return new double[] { (x1 + x2) / 2d, (y1 + y2) / 2d };
	}

	/**
	 * Truncates toward zero, as a cast to a whole number does.
	 */
	public static long truncate(final double value) {
		return (long) value;
	}

}
