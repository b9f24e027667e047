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

import org.apache.commons.math3.analysis.interpolation.UnivariateInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.apache.commons.math3.exception.util.LocalizedFormats;
import org.apache.commons.math3.util.MathArrays;

/**
 * Piecewise cubic Hermite interpolation that preserves the monotonicity of the
 * data (Fritsch-Carlson). Knot derivatives are the weighted harmonic mean of
 * the adjacent secant slopes, zero at local extrema, with one-sided
 * three-point estimates at both ends. With only two knots the interpolant is
 * the straight line through them.
 */
public class MonotoneCubicInterpolator implements UnivariateInterpolator {

	/**
	 * @param x the abscissas, strictly increasing
	 * @param y the ordinates
	 * @return the interpolating function, defined over {@code [x[0], x[n-1]]}
	 */
	@Override
	public PolynomialSplineFunction interpolate(final double[] x, final double[] y) {
		if (x.length != y.length) throw new DimensionMismatchException(x.length, y.length);
		if (x.length < 2) throw new NumberIsTooSmallException(LocalizedFormats.NUMBER_OF_POINTS, x.length, 2, true);
		MathArrays.checkOrder(x);
		final int n = x.length;
		final double[] h = new double[n - 1];
		final double[] delta = new double[n - 1];
		for (int k = 0; k < n - 1; k++) {
			h[k] = x[k + 1] - x[k];
			delta[k] = (y[k + 1] - y[k]) / h[k];
		}
		final double[] d = derivatives(h, delta);
		final PolynomialFunction[] polynomials = new PolynomialFunction[n - 1];
		for (int k = 0; k < n - 1; k++) {
			final double c2 = (3 * delta[k] - 2 * d[k] - d[k + 1]) / h[k];
			final double c3 = (d[k] + d[k + 1] - 2 * delta[k]) / (h[k] * h[k]);
			polynomials[k] = new PolynomialFunction(new double[] { y[k], d[k], c2, c3 });
		}
		return new PolynomialSplineFunction(x.clone(), polynomials);
	}

	static double[] derivatives(final double[] h, final double[] delta) {
		final int n = h.length + 1;
		final double[] d = new double[n];
		if (n == 2) {
			d[0] = d[1] = delta[0];
			return d;
		}
		for (int k = 1; k < n - 1; k++) {
			if (Math.signum(delta[k - 1]) != Math.signum(delta[k]) || delta[k - 1] == 0 || delta[k] == 0) {
				d[k] = 0;
			} else {
				final double w1 = 2 * h[k] + h[k - 1];
				final double w2 = h[k] + 2 * h[k - 1];
				d[k] = (w1 + w2) / (w1 / delta[k - 1] + w2 / delta[k]);
			}
		}
		d[0] = edgeDerivative(h[0], h[1], delta[0], delta[1]);
		d[n - 1] = edgeDerivative(h[n - 2], h[n - 3], delta[n - 2], delta[n - 3]);
		return d;
	}

	/* one-sided three-point estimate, kept shape-preserving */
	private static double edgeDerivative(final double h0, final double h1, final double m0, final double m1) {
		final double d = ((2 * h0 + h1) * m0 - h0 * m1) / (h0 + h1);
		if (Math.signum(d) != Math.signum(m0)) return 0;
		if (Math.signum(m0) != Math.signum(m1) && Math.abs(d) > Math.abs(3 * m0)) return 3 * m0;
		return d;
	}

}
