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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

/**
 * Defines a transect profile: values sampled along a segment, in the order the
 * segment was drawn.
 */
public class Profile implements Iterable<ProfileEntry> {

	private final List<ProfileEntry> profile;
	private String xLabel = "x";
	private String yLabel = "y";
	private String identifier;

	/** Instantiates a new empty profile. */
	public Profile() {
		profile = new ArrayList<>();
	}

	/**
	 * Default constructor.
	 *
	 * @param x      sampled x-coordinates
	 * @param y      sampled y-coordinates
	 * @param values sampled values
	 */
	public Profile(final double[] x, final double[] y, final double[] values) {
		if (x == null || y == null || values == null)
			throw new IllegalArgumentException("Arrays cannot be null");
		final int n = x.length;
		if (n == 0 || n != y.length || n != values.length)
			throw new IllegalArgumentException("Arrays cannot be empty and must have the same length");
		profile = new ArrayList<>(n);
		for (int i = 0; i < n; i++) {
			profile.add(new ProfileEntry(x[i], y[i], values[i]));
		}
	}

	public void add(final ProfileEntry entry) {
		profile.add(entry);
	}

	public int size() {
		return profile.size();
	}

	public boolean isEmpty() {
		return profile.isEmpty();
	}

	public ProfileEntry get(final int index) {
		return profile.get(index);
	}

	public List<ProfileEntry> entries() {
		return Collections.unmodifiableList(profile);
	}

	public double[] xValues() {
		return profile.stream().mapToDouble(e -> e.x).toArray();
	}

	public double[] yValues() {
		return profile.stream().mapToDouble(e -> e.y).toArray();
	}

	public double[] values() {
		return profile.stream().mapToDouble(e -> e.value).toArray();
	}

	/** Reverses the order of entries in place */
	public void reverse() {
		Collections.reverse(profile);
	}

	public String getXLabel() {
		return xLabel;
	}

	public String getYLabel() {
		return yLabel;
	}

	public void setLabels(final String xLabel, final String yLabel) {
		this.xLabel = xLabel;
		this.yLabel = yLabel;
	}

	public String identifier() {
		return identifier;
	}

	public void setIdentifier(final String identifier) {
		this.identifier = identifier;
	}

	/**
	 * @return the statistics of the (finite) sampled values
	 */
	public SummaryStatistics getStatistics() {
		final SummaryStatistics stats = new SummaryStatistics();
		for (final ProfileEntry e : profile) {
			if (Double.isFinite(e.value)) stats.addValue(e.value);
		}
		return stats;
	}

	/**
	 * Computes the element-wise mean of profiles of equal length, e.g., the cuts
	 * of an orthogonal chain sharing one width. Coordinates of the average
	 * profile are the mean locations of the averaged entries.
	 *
	 * @param profiles the profiles to be averaged
	 * @return the average profile
	 * @throws IllegalArgumentException if profiles is empty or profiles differ
	 *           in length
	 */
	public static Profile average(final Collection<Profile> profiles) {
		if (profiles == null || profiles.isEmpty())
			throw new IllegalArgumentException("No profiles to average");
		final Iterator<Profile> it = profiles.iterator();
		final Profile first = it.next();
		final int n = first.size();
		final double[] x = new double[n];
		final double[] y = new double[n];
		final double[] v = new double[n];
		for (final Profile p : profiles) {
			if (p.size() != n)
				throw new IllegalArgumentException("Profiles must have the same length: " + n + " vs " + p.size());
			for (int i = 0; i < n; i++) {
				final ProfileEntry e = p.profile.get(i);
				x[i] += e.x;
				y[i] += e.y;
				v[i] += e.value;
			}
		}
		final int count = profiles.size();
		for (int i = 0; i < n; i++) {
			x[i] /= count;
			y[i] /= count;
			v[i] /= count;
		}
		final Profile avg = new Profile(x, y, v);
		avg.setLabels(first.xLabel, first.yLabel);
		avg.setIdentifier("Average");
		return avg;
	}

	@Override
	public Iterator<ProfileEntry> iterator() {
		return profile.iterator();
	}

	@Override
	public String toString() {
		return ((identifier == null) ? "Profile" : identifier) + " [" + size() + " samples]";
	}

}
