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
package sc.fiji.nccut.analysis;

import java.util.Arrays;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.analysis.solvers.UnivariateSolver;

import sc.fiji.nccut.DegenerateAxisException;
import sc.fiji.nccut.NcCutUtils;

/**
 * Maps fractional indices of a rectilinear coordinate axis to coordinates and
 * back. Coordinates between grid points are interpolated with a monotone cubic
 * spline through {@code (i, axisValues[i])}, so that non-uniformly spaced axes
 * map smoothly. Beyond the first and last grid points both directions are
 * extrapolated linearly using the end slopes of the spline.
 * <p>
 * Axes whose values are not strictly monotonic (or that include non-finite
 * values) cannot be inverted: they are considered non-numeric (categorical) and
 * mapped with the identity, i.e., coordinates are indices. Axes with fewer than
 * two distinct values are degenerate and also mapped with the identity.
 * </p>
 */
public class CoordinateMapper {

	private static final int MAX_EVAL = 200;
	private static final CoordinateMapper IDENTITY = new CoordinateMapper(null, null);

	private final double[] values;
	private final PolynomialSplineFunction spline;
	private final double startSlope;
	private final double endSlope;
	private final boolean ascending;

	private CoordinateMapper(final double[] values, final PolynomialSplineFunction spline) {
		this.values = values;
		this.spline = spline;
		if (spline == null) {
			startSlope = endSlope = 1;
			ascending = true;
		} else {
			final int n = values.length;
			final PolynomialSplineFunction derivative = spline.polynomialSplineDerivative();
			ascending = values[n - 1] > values[0];
			startSlope = nonZeroSlope(derivative.value(0), values[1] - values[0]);
			endSlope = nonZeroSlope(derivative.value(n - 1), values[n - 1] - values[n - 2]);
		}
	}

	/**
	 * Builds a mapper for the specified axis. Degenerate and non-numeric axes are
	 * recovered by falling back to the identity mapper.
	 *
	 * @param axisValues the grid coordinates of the axis
	 * @return the mapper
	 */
	public static CoordinateMapper forAxis(final double[] axisValues) {
		try {
			checkDistinct(axisValues);
		} catch (final DegenerateAxisException ex) {
			NcCutUtils.log(ex.getMessage() + ": Falling back to index-based mapping");
			return IDENTITY;
		}
		if (!isStrictlyMonotonic(axisValues)) {
			NcCutUtils.log("Axis is not strictly monotonic: Treating it as non-numeric");
			return IDENTITY;
		}
		return new CoordinateMapper(axisValues.clone(), fit(axisValues));
	}

	/** @return the mapper of a non-numeric axis: coordinates are indices */
	public static CoordinateMapper identity() {
		return IDENTITY;
	}

	/**
	 * Converts a fractional index into a coordinate.
	 *
	 * @param axisValues the grid coordinates of the axis
	 * @param index      the fractional index
	 * @return the interpolated (or extrapolated) coordinate. For axes including
	 *         non-finite values, the index itself
	 * @throws DegenerateAxisException if the axis has fewer than 2 distinct values
	 */
	public static double indexToCoord(final double[] axisValues, final double index) {
		checkDistinct(axisValues);
		if (!allFinite(axisValues)) return index;
		if (isStrictlyMonotonic(axisValues)) return forAxis(axisValues).toCoord(index);
		// shape-preserving fit still applies to non-monotonic sequences
		return new CoordinateMapper(axisValues, fit(axisValues)).toCoord(index);
	}

	/**
	 * Converts a coordinate into a fractional index. Axes that are not strictly
	 * monotonic are mapped with the identity.
	 *
	 * @param axisValues the grid coordinates of the axis
	 * @param coord      the coordinate
	 * @return the fractional index
	 */
	public static double coordToIndex(final double[] axisValues, final double coord) {
		return forAxis(axisValues).toIndex(coord);
	}

	/** @return false if this mapper is the identity fallback of a non-numeric or degenerate axis */
	public boolean isNumeric() {
		return spline != null;
	}

	public double toCoord(final double index) {
		if (spline == null) return index;
		final int last = values.length - 1;
		if (index < 0) return values[0] + startSlope * index;
		if (index > last) return values[last] + endSlope * (index - last);
		return spline.value(index);
	}

	public double toIndex(final double coord) {
		if (spline == null) return coord;
		final int last = values.length - 1;
		final double sign = (ascending) ? 1 : -1;
		if (sign * coord < sign * values[0]) return (coord - values[0]) / startSlope;
		if (sign * coord > sign * values[last]) return last + (coord - values[last]) / endSlope;
		int lo = 0;
		int hi = last;
		while (hi - lo > 1) {
			final int mid = (lo + hi) >>> 1;
			if (sign * values[mid] <= sign * coord)
				lo = mid;
			else
				hi = mid;
		}
		if (coord == values[lo]) return lo;
		if (coord == values[hi]) return hi;
		final PolynomialFunction segment = spline.getPolynomials()[lo];
		final UnivariateFunction f = t -> segment.value(t) - coord;
		final UnivariateSolver solver = new BrentSolver(1e-12);
		return lo + solver.solve(MAX_EVAL, f, 0, 1);
	}

	/**
	 * @param values the values to assess
	 * @return true if the values are finite and strictly increasing or strictly
	 *         decreasing
	 */
	public static boolean isStrictlyMonotonic(final double[] values) {
		if (values == null || values.length < 2 || !allFinite(values)) return false;
		final boolean ascending = values[1] > values[0];
		for (int i = 1; i < values.length; i++) {
			if (ascending && !(values[i] > values[i - 1])) return false;
			if (!ascending && !(values[i] < values[i - 1])) return false;
		}
		return true;
	}

	private static PolynomialSplineFunction fit(final double[] axisValues) {
		final double[] indices = new double[axisValues.length];
		Arrays.setAll(indices, i -> i);
		return new MonotoneCubicInterpolator().interpolate(indices, axisValues);
	}

	private static void checkDistinct(final double[] axisValues) {
		if (axisValues == null || Arrays.stream(axisValues).filter(Double::isFinite).distinct().count() < 2)
			throw new DegenerateAxisException("Axis has fewer than 2 distinct values");
	}

	private static boolean allFinite(final double[] values) {
		for (final double v : values) {
			if (!Double.isFinite(v)) return false;
		}
		return true;
	}

	private static double nonZeroSlope(final double slope, final double secant) {
		return (slope == 0) ? secant : slope;
	}

}
