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

import java.util.concurrent.Callable;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.RealRandomAccess;
import net.imglib2.type.numeric.real.DoubleType;
import sc.fiji.nccut.data.DataSource;
import sc.fiji.nccut.data.GriddedField;
import sc.fiji.nccut.util.ImgUtils;
import sc.fiji.nccut.util.LinAlgUtils;
import sc.fiji.nccut.util.Logger;
import sc.fiji.nccut.util.Segment;

/**
 * Samples a {@link DataSource} along a segment, at unit pixel steps along the
 * dominant axis of the segment, using bilinear interpolation. Multichannel
 * (RGB) images are averaged across channels. Profile coordinates are reported
 * in physical units whenever the source axes are numeric.
 */
public class TransectSampler implements Callable<Profile> {

	/* padding of the interpolation window around the segment */
	private static final long PAD_BEFORE = 3;
	private static final long PAD_AFTER = 4;

	private final DataSource source;
	private final double[] endpoints;
	private final Logger logger;
	private Profile profile;

	public TransectSampler(final DataSource source, final Segment segment) {
		this(source, segment.toArray());
	}

	/**
	 * @param source    the data source to be sampled
	 * @param endpoints the segment {x1, y1, x2, y2}, in source pixels
	 */
	public TransectSampler(final DataSource source, final double[] endpoints) {
		if (source == null) throw new IllegalArgumentException("Data source cannot be null");
		this.source = source;
		this.endpoints = Segment.of(endpoints).toArray();
		logger = new Logger(TransectSampler.class);
	}

	/**
	 * The profile, or null if it has not been sampled yet.
	 *
	 * @return the profile
	 */
	public Profile getProfile() {
		return profile;
	}

	/**
	 * Samples the segment.
	 *
	 * @return the profile, in the order the segment was drawn
	 * @throws sc.fiji.nccut.OutOfBoundsException if the segment lies outside the
	 *           source
	 */
	@Override
	public Profile call() {
		final Subset subset = new SubsetExtractor().extract(source, endpoints);
		final Profile blockProfile = sample(subset.getEndpoints(), subset.getBlock(), source.isGridded());
		final long[] offset = subset.getOffset();
		profile = new Profile();
		for (final ProfileEntry e : blockProfile) {
			final double[] coords = source.toPhysical(e.x + offset[0], e.y + offset[1]);
			profile.add(new ProfileEntry(coords[0], coords[1], e.value));
		}
		profile.setLabels(source.getXName(), source.getYName());
		logger.debug(profile.size() + " samples along " + Segment.of(endpoints));
		return profile;
	}

	/**
	 * Samples the segment at every Z level of a 3D gridded field.
	 *
	 * @return the [z][sample] matrix of values
	 * @throws IllegalArgumentException if the source is not a 3D gridded field
	 */
	public double[][] sampleAllZ() {
		if (!(source instanceof GriddedField) || !((GriddedField) source).is3D())
			throw new IllegalArgumentException("All-Z sampling requires a 3D gridded field");
		final GriddedField field = (GriddedField) source;
		final double[][] matrix = new double[field.getNumLevels()][];
		for (int z = 0; z < matrix.length; z++) {
			matrix[z] = new TransectSampler(field.slice(z), endpoints).call().values();
		}
		return matrix;
	}

	/**
	 * Samples a block of data along a segment. The dominant axis of the segment
	 * is walked at unit steps over {@code [int(start), int(end))}. A segment with
	 * an empty range yields a single sample at its first endpoint.
	 *
	 * @param endpoints the segment {x1, y1, x2, y2}, in block pixels
	 * @param block     the (x, y) block, or (x, y, channel) block for images
	 * @param isGridded whether the block was extracted from a gridded field.
	 *                  Image blocks with 3 dimensions are channel-averaged
	 * @return the profile, in block pixels and in the order the segment was drawn
	 */
	public static Profile sample(final double[] endpoints, final RandomAccessibleInterval<DoubleType> block,
			final boolean isGridded) {
		final boolean steep = LinAlgUtils.isSteep(
				LinAlgUtils.slope(endpoints[0], endpoints[1], endpoints[2], endpoints[3]));
		// dominant (a) and secondary (b) coordinates
		final int ia = (steep) ? 1 : 0;
		final int ib = 1 - ia;
		double a1 = endpoints[ia];
		double b1 = endpoints[ib];
		double a2 = endpoints[ia + 2];
		double b2 = endpoints[ib + 2];
		final boolean reversed = a1 > a2;
		if (reversed) {
			double tmp = a1;
			a1 = a2;
			a2 = tmp;
			tmp = b1;
			b1 = b2;
			b2 = tmp;
		}
		final double m = LinAlgUtils.slope(a1, b1, a2, b2);

		final long[] lo = { (long) Math.floor(Math.min(endpoints[0], endpoints[2])),
				(long) Math.floor(Math.min(endpoints[1], endpoints[3])) };
		final long[] hi = { (long) Math.floor(Math.max(endpoints[0], endpoints[2])),
				(long) Math.floor(Math.max(endpoints[1], endpoints[3])) };
		RandomAccessibleInterval<DoubleType> window = ImgUtils.subInterval(block, lo, hi, PAD_BEFORE, PAD_AFTER);
		if (!isGridded && window.numDimensions() == 3) window = ImgUtils.averageChannels(window);
		final RealRandomAccess<DoubleType> access = ImgUtils.interpolant(window).realRandomAccess();

		final long start = LinAlgUtils.truncate(a1);
		final int n = (int) Math.max(1, LinAlgUtils.truncate(a2) - start);
		final boolean emptyRange = LinAlgUtils.truncate(a2) <= start;
		final double[] x = new double[n];
		final double[] y = new double[n];
		final double[] v = new double[n];
		final double[] pos = new double[2];
		for (int i = 0; i < n; i++) {
			final double a = (emptyRange) ? a1 : start + i;
			final double b = (emptyRange) ? b1 : m * (a - a1) + b1;
			pos[ia] = a;
			pos[ib] = b;
			access.setPosition(pos);
			x[i] = pos[0];
			y[i] = pos[1];
			v[i] = access.get().get();
		}
		final Profile result = new Profile(x, y, v);
		if (reversed) result.reverse();
		return result;
	}

}
