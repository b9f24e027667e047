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

import java.util.Arrays;

import sc.fiji.nccut.NcCutUtils;

/**
 * Ascending, evenly spaced axis ticks.
 */
public class TickSet {

	private final double[] ticks;
	private final double step;
	private final int scaleExponent;

	/**
	 * @param ticks         the ascending tick values
	 * @param step          the spacing between ticks (0 for a single tick)
	 * @param scaleExponent the power of ten labels should be scaled by, or 0
	 */
	public TickSet(final double[] ticks, final double step, final int scaleExponent) {
		this.ticks = ticks;
		this.step = step;
		this.scaleExponent = scaleExponent;
	}

	public double[] getTicks() {
		return ticks.clone();
	}

	public int size() {
		return ticks.length;
	}

	public double getStep() {
		return step;
	}

	/**
	 * @return the exponent of the common power-of-ten factor for tick labels (as
	 *         in "x10^exponent"), or 0 if labels do not require scientific
	 *         notation
	 */
	public int getScaleExponent() {
		return scaleExponent;
	}

	/**
	 * @return the tick labels, divided by the power-of-ten factor, with as many
	 *         decimal places as the step requires
	 */
	public String[] getLabels() {
		final double scale = Math.pow(10, scaleExponent);
		final double scaledStep = step / scale;
		int digits = 0;
		if (scaledStep > 0) {
			double shifted = scaledStep;
			while (digits < 10 && Math.abs(shifted - Math.rint(shifted)) > 1e-6) {
				shifted *= 10;
				digits++;
			}
		}
		final String[] labels = new String[ticks.length];
		for (int i = 0; i < ticks.length; i++) {
			final double value = ticks[i] / scale;
			labels[i] = (digits == 0) ? String.valueOf(Math.round(value))
					: NcCutUtils.getDecimalFormat(1, digits).format(value);
		}
		return labels;
	}

	@Override
	public String toString() {
		return Arrays.toString(ticks) + ((scaleExponent == 0) ? "" : " x10^" + scaleExponent);
	}

}
