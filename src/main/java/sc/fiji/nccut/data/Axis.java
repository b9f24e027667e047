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

import sc.fiji.nccut.analysis.CoordinateMapper;

/**
 * A named coordinate axis of a {@link GriddedField}. Besides the native grid
 * coordinates, an axis defines the uniform <i>working grid</i> of the field:
 * pixel {@code p} sits at coordinate {@code origin + p * step}, where the
 * origin is the smallest coordinate and the step the smallest distance between
 * adjacent coordinates. Non-numeric axes use their indices as coordinates.
 */
public class Axis {

	private static final double SNAP_TOLERANCE = 1e-9;

	private final String name;
	private final String unit;
	private final double[] values;
	private final CoordinateMapper mapper;
	private final double origin;
	private final double step;
	private final int workingSize;

	public Axis(final String name, final double[] values) {
		this(name, null, values);
	}

	/**
	 * @param name   the axis name, e.g., "lon"
	 * @param unit   the unit of the coordinates (informative only), or null
	 * @param values the native grid coordinates
	 */
	public Axis(final String name, final String unit, final double[] values) {
		if (name == null || name.trim().isEmpty())
			throw new IllegalArgumentException("Axis name cannot be empty");
		if (values == null || values.length == 0)
			throw new IllegalArgumentException("Axis '" + name + "' has no values");
		this.name = name;
		this.unit = unit;
		this.values = values.clone();
		mapper = CoordinateMapper.forAxis(this.values);
		if (mapper.isNumeric()) {
			double min = Double.MAX_VALUE;
			double max = -Double.MAX_VALUE;
			double minDelta = Double.MAX_VALUE;
			for (int i = 0; i < values.length; i++) {
				min = Math.min(min, values[i]);
				max = Math.max(max, values[i]);
				if (i > 0) minDelta = Math.min(minDelta, Math.abs(values[i] - values[i - 1]));
			}
			origin = min;
			step = minDelta;
			workingSize = (int) Math.round((max - min) / minDelta) + 1;
		} else {
			origin = 0;
			step = 1;
			workingSize = values.length;
		}
	}

	public String getName() {
		return name;
	}

	public String getUnit() {
		return unit;
	}

	public double[] getValues() {
		return values.clone();
	}

	public int size() {
		return values.length;
	}

	public boolean isNumeric() {
		return mapper.isNumeric();
	}

	public CoordinateMapper getMapper() {
		return mapper;
	}

	/** @return the spacing of the working grid */
	public double getStep() {
		return step;
	}

	/** @return the coordinate of working-grid pixel 0 */
	public double getOrigin() {
		return origin;
	}

	/** @return the number of pixels of the working grid along this axis */
	public int getWorkingSize() {
		return workingSize;
	}

	public double pixelToCoord(final double pixel) {
		return origin + pixel * step;
	}

	public double coordToPixel(final double coord) {
		return (coord - origin) / step;
	}

	/** @return the coordinate range {min, max} of the axis */
	public double[] getEnvelope() {
		return new double[] { origin, pixelToCoord(workingSize - 1) };
	}

	/** @return the coordinate of the native grid point {@code index} */
	public double nativeCoord(final int index) {
		return (mapper.isNumeric()) ? values[index] : index;
	}

	/**
	 * Piecewise-linear inverse of the native grid: the fractional native index of
	 * a coordinate, clamped to the extent of the axis. Results within
	 * {@value #SNAP_TOLERANCE} of an integer are snapped to it.
	 *
	 * @param coord the coordinate
	 * @return the fractional native index
	 */
	public double linearIndexOf(final double coord) {
		final int last = values.length - 1;
		double index;
		if (!mapper.isNumeric() || last == 0) {
			index = Math.max(0, Math.min(last, coord));
		} else {
			final boolean ascending = values[last] > values[0];
			final double sign = (ascending) ? 1 : -1;
			if (sign * coord <= sign * values[0]) {
				index = 0;
			} else if (sign * coord >= sign * values[last]) {
				index = last;
			} else {
				int lo = 0;
				int hi = last;
				while (hi - lo > 1) {
					final int mid = (lo + hi) >>> 1;
					if (sign * values[mid] <= sign * coord)
						lo = mid;
					else
						hi = mid;
				}
				index = lo + (coord - values[lo]) / (values[hi] - values[lo]);
			}
		}
		final double rounded = Math.rint(index);
		return (Math.abs(index - rounded) < SNAP_TOLERANCE) ? rounded : index;
	}

	@Override
	public String toString() {
		return name + ((unit == null) ? "" : " [" + unit + "]") + ": " + values.length + " values "
				+ ((isNumeric()) ? Arrays.toString(getEnvelope()) : "(non-numeric)");
	}

}
