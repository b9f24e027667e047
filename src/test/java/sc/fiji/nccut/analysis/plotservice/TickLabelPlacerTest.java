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
package sc.fiji.nccut.analysis.plotservice;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TickLabelPlacerTest {

	private static final double EPSILON = 1e-9;
	private static final double[][] RANGES = { { 0, 1 }, { -3.7, 12.2 }, { 0.0012, 0.0089 }, { 1e5, 3.2e5 },
			{ -250, -30 }, { 17, 17.5 }, { -1, 1 } };

	@Test
	public void testTicksCoverRangeAndAreEvenlySpaced() {
		for (final double[] range : RANGES) {
			for (int m = 2; m <= 9; m++) {
				final TickSet set = TickLabelPlacer.place(range[0], range[1], m);
				final double[] ticks = set.getTicks();
				final String id = range[0] + "-" + range[1] + " (m=" + m + ")";
				assertTrue("At least 2 ticks for " + id, ticks.length >= 2);
				assertTrue("Covers min " + id, ticks[0] <= range[0] + EPSILON * Math.abs(range[0]));
				assertTrue("Covers max " + id, ticks[ticks.length - 1] >= range[1] - EPSILON * Math.abs(range[1]));
				for (int i = 1; i < ticks.length; i++) {
					assertTrue("Ascending " + id, ticks[i] > ticks[i - 1]);
					assertEquals("Evenly spaced " + id, set.getStep(), ticks[i] - ticks[i - 1],
							EPSILON * Math.max(1, set.getStep()));
				}
			}
		}
	}

	@Test
	public void testNiceTicks() {
		assertArrayEquals(new double[] { 0, 0.2, 0.4, 0.6, 0.8, 1 }, TickLabelPlacer.place(0, 1, 5).getTicks(),
				EPSILON);
		assertArrayEquals(new double[] { 0, 20, 40, 60, 80, 100 }, TickLabelPlacer.place(0, 100, 5).getTicks(),
				EPSILON);
		assertArrayEquals(new double[] { -5, 0, 5, 10, 15 }, TickLabelPlacer.place(-3.7, 12.2, 5).getTicks(),
				EPSILON);
	}

	@Test
	public void testDegenerateRange() {
		final TickSet set = TickLabelPlacer.place(3, 3, 5);
		assertArrayEquals(new double[] { 3 }, set.getTicks(), 0);
	}

	@Test
	public void testSwappedRange() {
		assertArrayEquals(TickLabelPlacer.place(0, 10, 5).getTicks(), TickLabelPlacer.place(10, 0, 5).getTicks(), 0);
	}

	@Test
	public void testDeterministic() {
		assertArrayEquals(TickLabelPlacer.place(-3.7, 12.2, 6).getTicks(),
				TickLabelPlacer.place(-3.7, 12.2, 6).getTicks(), 0);
	}

	@Test
	public void testScaleExponent() {
		assertEquals(5, TickLabelPlacer.place(1e5, 3.2e5, 5).getScaleExponent());
		assertEquals(-3, TickLabelPlacer.place(0.0012, 0.0089, 5).getScaleExponent());
		assertEquals(0, TickLabelPlacer.place(0, 100, 5).getScaleExponent());
		assertArrayEquals(new String[] { "0", "20", "40", "60", "80", "100" },
				TickLabelPlacer.place(0, 100, 5).getLabels());
		assertArrayEquals(new String[] { "1.0", "1.5", "2.0", "2.5", "3.0", "3.5" },
				TickLabelPlacer.place(1e5, 3.2e5, 5).getLabels());
	}

	@Test(timeout = 5000)
	public void testExtremeMagnitudes() {
		assertArrayEquals(new double[] { -1e308, -5e307, 0, 5e307, 1e308 },
				TickLabelPlacer.place(-1e308, 1e308, 5).getTicks(), 1e293);
		assertArrayEquals(new double[] { -1e-300, -5e-301, 0, 5e-301, 1e-300 },
				TickLabelPlacer.place(-1e-300, 1e-300, 5).getTicks(), 1e-315);
		final double[] narrow = TickLabelPlacer.place(1e5, 1e5 + 1e-9, 5).getTicks();
		assertTrue(narrow[0] <= 1e5 + 1e-11);
		assertTrue(narrow[narrow.length - 1] >= 1e5 + 1e-9 - 1e-11);
	}

	@Test(timeout = 5000, expected = IllegalArgumentException.class)
	public void testTicksBeyondDoubleRange() {
		TickLabelPlacer.place(-1.7e308, 1.7e308, 5);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidTarget() {
		TickLabelPlacer.place(0, 1, 1);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNonFiniteRange() {
		TickLabelPlacer.place(0, Double.POSITIVE_INFINITY, 5);
	}

}
