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
package sc.fiji.nccut.chain;

import sc.fiji.nccut.InvalidWidthException;
import sc.fiji.nccut.NcCutPrefs;
import sc.fiji.nccut.OrthogonalOutOfBoundsException;
import sc.fiji.nccut.data.DataSource;
import sc.fiji.nccut.util.LinAlgUtils;
import sc.fiji.nccut.util.PixelPoint;

/**
 * Static methods deriving orthogonal segments from chain clicks.
 */
public class ChainGeometry {

	private ChainGeometry() {
	}

	/**
	 * Computes the segment perpendicular to {@code start}-{@code end}, centered on
	 * its midpoint. Along its dominant axis the segment starts at
	 * {@code floor(mid - width/2)} and ends at {@code floor(mid + width/2 + 1)},
	 * so that sampling it visits {@code width + 1} integer positions.
	 *
	 * @param start the first click
	 * @param end   the second click
	 * @param width the width of the orthogonal segment, in pixels
	 * @return the orthogonal segment {x1, y1, x2, y2}
	 */
	public static double[] orthogonal(final PixelPoint start, final PixelPoint end, final int width) {
		final double m = LinAlgUtils.slope(start.getX(), start.getY(), end.getX(), end.getY());
		double mOrth = LinAlgUtils.orthogonalSlope(m);
		final double[] mid = LinAlgUtils.midpoint(start.getX(), start.getY(), end.getX(), end.getY());
		final boolean swap = LinAlgUtils.isSteep(mOrth);
		if (swap) {
			final double tmp = mid[0];
			mid[0] = mid[1];
			mid[1] = tmp;
			mOrth = 1 / mOrth;
		}
		final double intercept = mid[1] - mOrth * mid[0];
		final double a1 = Math.floor(mid[0] - width / 2d);
		final double a2 = Math.floor(mid[0] + width / 2d + 1);
		final double b1 = mOrth * a1 + intercept;
		final double b2 = mOrth * a2 + intercept;
		return (swap) ? new double[] { b1, a1, b2, a2 } : new double[] { a1, b1, a2, b2 };
	}

	/**
	 * Validates the width and bounds of an orthogonal segment.
	 *
	 * @param start  the first click
	 * @param end    the second click
	 * @param width  the width of the orthogonal segment, in pixels
	 * @param source the data source the segment is to be sampled from
	 * @return the orthogonal segment {x1, y1, x2, y2}
	 * @throws InvalidWidthException           if width lies outside the range set
	 *                                         in {@link NcCutPrefs}
	 * @throws OrthogonalOutOfBoundsException if a sampled position of the
	 *                                         segment leaves the source
	 */
	public static double[] orthogonal(final PixelPoint start, final PixelPoint end, final int width,
			final DataSource source) {
		if (!NcCutPrefs.isValidWidth(width))
			throw new InvalidWidthException(width, NcCutPrefs.getMinWidth(), NcCutPrefs.getMaxWidth());
		final double[] coords = orthogonal(start, end, width);
		final double[] sampled = lastSampled(coords);
		if (!inBounds(new double[] { coords[0], coords[1], sampled[0], sampled[1] }, source.getWidth(),
				source.getHeight()))
			throw new OrthogonalOutOfBoundsException(coords);
		return coords;
	}

	/* the end of the segment is exclusive: samples stop one step short of it */
	private static double[] lastSampled(final double[] coords) {
		final double dx = coords[2] - coords[0];
		final double dy = coords[3] - coords[1];
		final double steps = Math.max(Math.abs(dx), Math.abs(dy));
		if (steps == 0) return new double[] { coords[2], coords[3] };
		return new double[] { coords[2] - dx / steps, coords[3] - dy / steps };
	}

	/**
	 * @param coords the segment {x1, y1, x2, y2}
	 * @param width  the pixel width of the data source
	 * @param height the pixel height of the data source
	 * @return true if no coordinate is negative nor exceeds the pixel extent of
	 *         its axis
	 */
	public static boolean inBounds(final double[] coords, final long width, final long height) {
		for (final double c : coords) {
			if (c < 0) return false;
		}
		return coords[0] <= width && coords[2] <= width && coords[1] <= height && coords[3] <= height;
	}

}
