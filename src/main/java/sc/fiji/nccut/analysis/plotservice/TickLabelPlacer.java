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

import java.math.BigDecimal;

import sc.fiji.nccut.NcCutPrefs;
import sc.fiji.nccut.NcCutUtils;

/**
 * Places axis ticks using the extended Wilkinson algorithm (Talbot, Lin and
 * Hanrahan, "An Extension of Wilkinson's Algorithm for Positioning Tick
 * Labels on Axes", InfoVis 2010). Candidate labelings are scored on
 * simplicity, coverage, density and legibility. The search is pruned as soon
 * as the best attainable score of a branch falls below the best labeling
 * found so far. Only labelings covering the whole data range are accepted.
 */
public class TickLabelPlacer {

	/** Nice step multipliers, in order of preference */
	private static final int[] Q = { 1, 5, 2, 4, 3 };
	/** Weights of simplicity, coverage, density and legibility */
	private static final double[] W = { 0.25, 0.2, 0.5, 0.05 };
	private static final double EPSILON = 1e-10;

	/* labels beyond these magnitudes are scaled by a power of ten */
	private static final double SCI_UPPER = 1e4;
	private static final double SCI_LOWER = 1e-2;

	private TickLabelPlacer() {
	}

	/**
	 * Places ticks using the target count set in {@link NcCutPrefs}.
	 *
	 * @see #place(double, double, int)
	 */
	public static TickSet place(final double dMin, final double dMax) {
		return place(dMin, dMax, NcCutPrefs.getTickTarget());
	}

	/**
	 * @param dMin        the lower end of the data range
	 * @param dMax        the upper end of the data range. Swapped with
	 *                    {@code dMin} if smaller
	 * @param targetCount the desired number of ticks
	 * @return the ticks. A single tick if {@code dMin == dMax}
	 * @throws IllegalArgumentException if {@code targetCount < 2}, the range
	 *           is not finite, or covering ticks exceed the double range
	 */
	public static TickSet place(final double dMin, final double dMax, final int targetCount) {
		if (!Double.isFinite(dMin) || !Double.isFinite(dMax))
			throw new IllegalArgumentException("Data range must be finite");
		if (targetCount < 2)
			throw new IllegalArgumentException("Target tick count must be >= 2");
		final double lo = Math.min(dMin, dMax);
		final double hi = Math.max(dMin, dMax);
		if (hi - lo == 0) {
			return new TickSet(new double[] { lo }, 0, scaleExponent(lo, lo));
		}
		// search on [lo, hi] scaled to a unit magnitude, then shift the exponent back
		final int shift = (int) Math.floor(Math.log10(Math.max(Math.abs(lo), Math.abs(hi))));
		final double scale = Math.pow(10, shift);
		final double nLo = lo / scale;
		final double nHi = hi / scale;
		final Labeling best = (nHi - nLo > 0) ? search(nLo, nHi, targetCount) : null;
		if (best == null) {
			NcCutUtils.warn("No labeling found for [" + lo + ", " + hi + "]");
			return new TickSet(new double[] { lo, hi }, hi - lo, scaleExponent(lo, hi));
		}
		final Labeling labeling = best.shifted(shift);
		final double[] ticks = new double[labeling.k];
		for (int i = 0; i < labeling.k; i++) {
			ticks[i] = labeling.tick(i);
			if (!Double.isFinite(ticks[i]))
				throw new IllegalArgumentException("Ticks of [" + lo + ", " + hi + "] exceed the double range");
		}
		return new TickSet(ticks, labeling.step().doubleValue(), scaleExponent(ticks[0], ticks[ticks.length - 1]));
	}

	private static Labeling search(final double dMin, final double dMax, final int m) {
		Labeling best = null;
		double bestScore = -2;
		int j = 1;
		while (true) {
			boolean exhausted = false;
			for (int qi = 0; qi < Q.length; qi++) {
				final int q = Q[qi];
				final double sm = simplicityMax(qi, j);
				if (W[0] * sm + W[1] + W[2] + W[3] < bestScore) {
					exhausted = true;
					break;
				}
				for (int k = 2;; k++) {
					final double dm = densityMax(k, m);
					if (W[0] * sm + W[1] + W[2] * dm + W[3] < bestScore) break;
					final double delta = (dMax - dMin) / (k + 1) / j / q;
					for (int z = (int) Math.ceil(Math.log10(delta));; z++) {
						final double step = j * q * Math.pow(10, z);
						final double cm = coverageMax(dMin, dMax, step * (k - 1));
						if (W[0] * sm + W[1] * cm + W[2] * dm + W[3] < bestScore) break;
						final long minStart = (long) Math.floor(dMax / step) * j - (long) (k - 1) * j;
						final long maxStart = (long) Math.ceil(dMin / step) * j;
						for (long start = minStart; start <= maxStart; start++) {
							final Labeling candidate = new Labeling(start, j, q, z, k);
							final double lMin = candidate.tick(0);
							final double lMax = candidate.tick(k - 1);
							if (lMin > dMin || lMax < dMax) continue;
							final double lStep = candidate.step().doubleValue();
							final double s = simplicity(qi, j, lMin, lMax, lStep);
							final double c = coverage(dMin, dMax, lMin, lMax);
							final double g = density(k, m, dMin, dMax, lMin, lMax);
							final double score = W[0] * s + W[1] * c + W[2] * g + W[3];
							if (score > bestScore) {
								bestScore = score;
								best = candidate;
							}
						}
					}
				}
			}
			if (exhausted) break;
			j++;
		}
		return best;
	}

	private static double simplicity(final int qi, final int j, final double lMin, final double lMax,
			final double lStep) {
		final double rem = floorMod(lMin, lStep);
		final boolean zeroIncluded = (rem < EPSILON || lStep - rem < EPSILON) && lMin <= 0 && lMax >= 0;
		return 1 - qi / (Q.length - 1d) - j + ((zeroIncluded) ? 1 : 0);
	}

	private static double simplicityMax(final int qi, final int j) {
		return 1 - qi / (Q.length - 1d) - j + 1;
	}

	private static double coverage(final double dMin, final double dMax, final double lMin, final double lMax) {
		final double range = dMax - dMin;
		return 1 - 0.5 * (Math.pow(dMax - lMax, 2) + Math.pow(dMin - lMin, 2)) / Math.pow(0.1 * range, 2);
	}

	private static double coverageMax(final double dMin, final double dMax, final double span) {
		final double range = dMax - dMin;
		if (span > range) {
			final double half = (span - range) / 2;
			return 1 - 0.5 * (2 * half * half) / Math.pow(0.1 * range, 2);
		}
		return 1;
	}

	private static double density(final int k, final int m, final double dMin, final double dMax,
			final double lMin, final double lMax) {
		final double r = (k - 1) / (lMax - lMin);
		final double rt = (m - 1) / (Math.max(lMax, dMax) - Math.min(dMin, lMin));
		return 2 - Math.max(r / rt, rt / r);
	}

	private static double densityMax(final int k, final int m) {
		return (k >= m) ? 2 - (k - 1d) / (m - 1d) : 1;
	}

	private static double floorMod(final double a, final double n) {
		return a - n * Math.floor(a / n);
	}

	private static int scaleExponent(final double first, final double last) {
		final double magnitude = Math.max(Math.abs(first), Math.abs(last));
		if (magnitude >= SCI_UPPER || (magnitude > 0 && magnitude < SCI_LOWER))
			return (int) Math.floor(Math.log10(magnitude));
		return 0;
	}

	/* ticks (start + i * j) * q * 10^z, for i in [0, k) */
	private static class Labeling {
		final long start;
		final int j;
		final int q;
		final int z;
		final int k;

		Labeling(final long start, final int j, final int q, final int z, final int k) {
			this.start = start;
			this.j = j;
			this.q = q;
			this.z = z;
			this.k = k;
		}

		Labeling shifted(final int exponent) {
			return new Labeling(start, j, q, z + exponent, k);
		}

		BigDecimal unit() {
			return BigDecimal.valueOf(q).scaleByPowerOfTen(z);
		}

		BigDecimal step() {
			return unit().multiply(BigDecimal.valueOf(j));
		}

		double tick(final int i) {
			return unit().multiply(BigDecimal.valueOf(start + (long) i * j)).doubleValue();
		}
	}

}
