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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.junit.Test;

public class MonotoneCubicInterpolatorTest {

	private static final double EPSILON = 1e-12;

	@Test
	public void testInterpolatesKnots() {
		final double[] x = { 0, 1, 2, 3, 4, 5 };
		final double[] y = { 0, 1, 3, 7, 15, 16 };
		final PolynomialSplineFunction f = new MonotoneCubicInterpolator().interpolate(x, y);
		for (int i = 0; i < x.length; i++) {
			assertEquals("Knot " + i, y[i], f.value(x[i]), EPSILON);
		}
	}

	@Test
	public void testPreservesMonotonicity() {
		final double[] x = { 0, 1, 2, 3, 4, 5 };
		final double[] y = { 0, 0.1, 0.2, 10, 10.1, 30 };
		final PolynomialSplineFunction f = new MonotoneCubicInterpolator().interpolate(x, y);
		double previous = f.value(0);
		for (double t = 0.01; t <= 5; t += 0.01) {
			final double current = f.value(t);
			assertTrue("Not monotonic at " + t, current >= previous - EPSILON);
			previous = current;
		}
	}

	@Test
	public void testFlatAtLocalExtremum() {
		final double[] x = { 0, 1, 2 };
		final double[] y = { 0, 1, 0 };
		final PolynomialSplineFunction f = new MonotoneCubicInterpolator().interpolate(x, y);
		assertEquals("Derivative at extremum", 0, f.polynomialSplineDerivative().value(1), EPSILON);
		for (double t = 0; t <= 2; t += 0.05) {
			assertTrue("Overshoot at " + t, f.value(t) <= 1 + EPSILON);
		}
	}

	@Test
	public void testUniformDataIsLinear() {
		final double[] x = { 0, 1, 2, 3 };
		final double[] y = { 5, 7, 9, 11 };
		final PolynomialSplineFunction f = new MonotoneCubicInterpolator().interpolate(x, y);
		assertEquals(6, f.value(0.5), EPSILON);
		assertEquals(10.5, f.value(2.75), EPSILON);
	}

	@Test
	public void testTwoKnots() {
		final PolynomialSplineFunction f = new MonotoneCubicInterpolator().interpolate(new double[] { 0, 2 },
				new double[] { 1, 5 });
		assertEquals(3, f.value(1), EPSILON);
	}

}
