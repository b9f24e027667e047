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

import java.util.Arrays;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.DoubleType;
import sc.fiji.nccut.util.ImgUtils;

/**
 * A {@link DataSource} holding a scalar variable sampled on a rectilinear X/Y
 * (and optionally Z) grid. Values are stored as {@code values[z][y][x]}. The
 * pixel space of a field is the uniform working grid of its axes (see
 * {@link Axis}). For 3D fields, queries address the active Z level (see
 * {@link #slice(int)}).
 */
public class GriddedField implements DataSource {

	private final String name;
	private final Axis xAxis;
	private final Axis yAxis;
	private final Axis zAxis;
	private final double[][][] values;
	private final int zIndex;
	private final RandomAccessibleInterval<DoubleType> img;

	/**
	 * Creates a 2D field.
	 *
	 * @param name   the variable name
	 * @param values the [y][x] values
	 * @param xAxis  the x-axis
	 * @param yAxis  the y-axis
	 */
	public GriddedField(final String name, final double[][] values, final Axis xAxis, final Axis yAxis) {
		this(name, new double[][][] { values }, xAxis, yAxis, null);
	}

	/**
	 * Creates a 3D field.
	 *
	 * @param name   the variable name
	 * @param values the [z][y][x] values
	 * @param xAxis  the x-axis
	 * @param yAxis  the y-axis
	 * @param zAxis  the z-axis, or null if {@code values} holds a single level
	 * @throws IllegalArgumentException if axes do not match the dimensions of
	 *           {@code values} or if axes share names
	 */
	public GriddedField(final String name, final double[][][] values, final Axis xAxis, final Axis yAxis,
			final Axis zAxis) {
		this(name, validate(name, values, xAxis, yAxis, zAxis), xAxis, yAxis, zAxis, 0);
	}

	private GriddedField(final String name, final double[][][] values, final Axis xAxis, final Axis yAxis,
			final Axis zAxis, final int zIndex) {
		this.name = name;
		this.values = values;
		this.xAxis = xAxis;
		this.yAxis = yAxis;
		this.zAxis = zAxis;
		this.zIndex = zIndex;
		img = ImgUtils.wrap(values[zIndex]);
	}

	private static double[][][] validate(final String name, final double[][][] values, final Axis xAxis,
			final Axis yAxis, final Axis zAxis) {
		if (name == null || name.trim().isEmpty())
			throw new IllegalArgumentException("Variable name cannot be empty");
		if (xAxis == null || yAxis == null)
			throw new IllegalArgumentException("Field requires both x and y axes");
		if (values == null || values.length == 0)
			throw new IllegalArgumentException("Field has no values");
		if (zAxis == null && values.length != 1)
			throw new IllegalArgumentException("Field has " + values.length + " levels but no z-axis");
		if (zAxis != null && zAxis.size() != values.length)
			throw new IllegalArgumentException("z-axis has " + zAxis.size() + " values but field has "
					+ values.length + " levels");
		final String zName = (zAxis == null) ? null : zAxis.getName();
		if (xAxis.getName().equals(yAxis.getName()) || xAxis.getName().equals(zName)
				|| yAxis.getName().equals(zName))
			throw new IllegalArgumentException("Axes must be distinct");
		for (final double[][] level : values) {
			if (level.length != yAxis.size())
				throw new IllegalArgumentException("y-axis has " + yAxis.size() + " values but field has "
						+ level.length + " rows");
			for (final double[] row : level) {
				if (row.length != xAxis.size())
					throw new IllegalArgumentException("x-axis has " + xAxis.size() + " values but field has "
							+ row.length + " columns");
			}
		}
		return values;
	}

	/**
	 * Returns the field restricted to one Z level. The returned field shares the
	 * value arrays of this one.
	 *
	 * @param zIndex the index of the Z level
	 * @return the field at the specified level
	 */
	public GriddedField slice(final int zIndex) {
		if (zIndex < 0 || zIndex >= values.length)
			throw new IndexOutOfBoundsException("Invalid z index: " + zIndex);
		return new GriddedField(name, values, xAxis, yAxis, zAxis, zIndex);
	}

	public String getName() {
		return name;
	}

	public Axis getXAxis() {
		return xAxis;
	}

	public Axis getYAxis() {
		return yAxis;
	}

	/** @return the z-axis or null for 2D fields */
	public Axis getZAxis() {
		return zAxis;
	}

	public boolean is3D() {
		return zAxis != null;
	}

	public int getNumLevels() {
		return values.length;
	}

	/** @return the index of the active Z level */
	public int getZIndex() {
		return zIndex;
	}

	/** @return the coordinate of the active Z level, or NaN for 2D fields */
	public double getZValue() {
		return (zAxis == null) ? Double.NaN : zAxis.nativeCoord(zIndex);
	}

	/** @return the native value at grid point (x, y) of the active level */
	public double getValue(final int x, final int y) {
		return values[zIndex][y][x];
	}

	@Override
	public long getWidth() {
		return xAxis.getWorkingSize();
	}

	@Override
	public long getHeight() {
		return yAxis.getWorkingSize();
	}

	@Override
	public boolean isGridded() {
		return true;
	}

	@Override
	public String getXName() {
		return xAxis.getName();
	}

	@Override
	public String getYName() {
		return yAxis.getName();
	}

	@Override
	public boolean hasNumericAxes() {
		return xAxis.isNumeric() && yAxis.isNumeric();
	}

	@Override
	public double[] toPhysical(final double px, final double py) {
		return new double[] { xAxis.pixelToCoord(px), yAxis.pixelToCoord(py) };
	}

	@Override
	public double[] toPixel(final double cx, final double cy) {
		return new double[] { xAxis.coordToPixel(cx), yAxis.coordToPixel(cy) };
	}

	@Override
	public double[] getEnvelope() {
		final double[] x = xAxis.getEnvelope();
		final double[] y = yAxis.getEnvelope();
		return new double[] { x[0], y[0], x[1], y[1] };
	}

	/** @return the native values of the active level as an (x, y) image */
	@Override
	public RandomAccessibleInterval<DoubleType> getImg() {
		return img;
	}

	@Override
	public String toString() {
		return name + " (" + xAxis.getName() + ", " + yAxis.getName()
				+ ((zAxis == null) ? "" : ", " + zAxis.getName() + "=" + getZValue()) + ") "
				+ Arrays.toString(new long[] { getWidth(), getHeight() });
	}

}
