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
package sc.fiji.nccut.data;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * A 2D raster addressed in pixel space: x is the column, y the row counted from
 * the bottom edge, so that y grows upwards. Implementations are immutable for
 * the duration of a query.
 */
public interface DataSource {

	/** @return the number of pixels along x */
	long getWidth();

	/** @return the number of pixels along y */
	long getHeight();

	/** @return true for gridded fields, false for images */
	boolean isGridded();

	/** @return the label of the x-axis ("x" for images) */
	String getXName();

	/** @return the label of the y-axis ("y" for images) */
	String getYName();

	/**
	 * @return true if pixel positions can be converted to physical coordinates
	 *         on both axes
	 */
	boolean hasNumericAxes();

	/**
	 * Converts a pixel position into physical coordinates. Sources without
	 * numeric axes return the pixel position.
	 */
	double[] toPhysical(double px, double py);

	/** Inverse of {@link #toPhysical(double, double)} */
	double[] toPixel(double cx, double cy);

	/**
	 * @return the physical envelope of the source, as {xMin, yMin, xMax, yMax}
	 */
	double[] getEnvelope();

	/**
	 * @return the native data as an (x, y) image, or (x, y, channel) image for
	 *         multichannel sources
	 */
	RandomAccessibleInterval<DoubleType> getImg();

}
