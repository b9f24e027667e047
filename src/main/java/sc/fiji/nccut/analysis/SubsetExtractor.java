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

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.RealRandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import sc.fiji.nccut.OutOfBoundsException;
import sc.fiji.nccut.data.Axis;
import sc.fiji.nccut.data.DataSource;
import sc.fiji.nccut.data.GriddedField;
import sc.fiji.nccut.util.ImgUtils;
import sc.fiji.nccut.util.Logger;

/**
 * Computes the smallest block of a data source required to sample a segment.
 * For gridded fields, native grid cells covering the segment (plus one cell of
 * margin) are regridded onto the uniform working grid using rectilinear
 * bilinear interpolation. Images are passed through unchanged.
 */
public class SubsetExtractor {

	private static final double EPSILON = 1e-9;

	private final Logger logger;

	public SubsetExtractor() {
		logger = new Logger(SubsetExtractor.class);
	}

	/**
	 * @param source    the data source
	 * @param endpoints the segment {x1, y1, x2, y2}, in source pixels
	 * @return the subset
	 * @throws OutOfBoundsException if neither endpoint lies within the source
	 */
	public Subset extract(final DataSource source, final double[] endpoints) {
		final double[] p1 = source.toPhysical(endpoints[0], endpoints[1]);
		final double[] p2 = source.toPhysical(endpoints[2], endpoints[3]);
		final double[] env = source.getEnvelope();
		final double[] min = { env[0], env[1] };
		final double[] max = { env[2], env[3] };
		if (ImgUtils.outOfBounds(p1, min, max) && ImgUtils.outOfBounds(p2, min, max)) {
			throw new OutOfBoundsException(String.format("Both endpoints of [%.2f, %.2f, %.2f, %.2f] lie outside %s",
					endpoints[0], endpoints[1], endpoints[2], endpoints[3], source));
		}
		if (!(source instanceof GriddedField)) {
			return new Subset(source.getImg(), endpoints.clone(), new long[] { 0, 0 });
		}
		final GriddedField field = (GriddedField) source;
		final long[][] xWindow = window(field.getXAxis(), p1[0], p2[0]);
		final long[][] yWindow = window(field.getYAxis(), p1[1], p2[1]);
		final long[] box = { xWindow[0][0], yWindow[0][0], xWindow[0][1], yWindow[0][1] };
		final long px0 = xWindow[1][0];
		final long py0 = yWindow[1][0];
		final Img<DoubleType> block = regrid(field, box, xWindow[1], yWindow[1]);
		logger.debug("Native box " + Arrays.toString(box) + " regridded onto "
				+ block.dimension(0) + "x" + block.dimension(1) + " block at (" + px0 + ", " + py0 + ")");
		final double[] rescaled = { endpoints[0] - px0, endpoints[1] - py0, endpoints[2] - px0,
				endpoints[3] - py0 };
		return new Subset(block, rescaled, new long[] { px0, py0 });
	}

	/*
	 * Returns {{nativeMin, nativeMax}, {pixelMin, pixelMax}} for one axis: the
	 * integer-aligned native index range covering both coordinates plus one cell
	 * of margin, and the working-grid pixels spanning it
	 */
	private static long[][] window(final Axis axis, final double c1, final double c2) {
		final CoordinateMapper mapper = axis.getMapper();
		final double i1 = mapper.toIndex(c1);
		final double i2 = mapper.toIndex(c2);
		final long last = axis.size() - 1;
		final long lo = Math.max(0, Math.min(last, (long) Math.floor(Math.min(i1, i2)) - 1));
		final long hi = Math.min(last, Math.max(lo, (long) Math.ceil(Math.max(i1, i2)) + 1));
		final double cLo = axis.nativeCoord((int) lo);
		final double cHi = axis.nativeCoord((int) hi);
		final long maxPixel = axis.getWorkingSize() - 1;
		final long pLo = Math.max(0,
				(long) Math.floor(axis.coordToPixel(Math.min(cLo, cHi)) + EPSILON));
		final long pHi = Math.min(maxPixel,
				Math.max(pLo, (long) Math.ceil(axis.coordToPixel(Math.max(cLo, cHi)) - EPSILON)));
		return new long[][] { { lo, hi }, { pLo, pHi } };
	}

	private static Img<DoubleType> regrid(final GriddedField field, final long[] box, final long[] xPixels,
			final long[] yPixels) {
		final RandomAccessibleInterval<DoubleType> nativeBlock = Views.interval(field.getImg(),
				Intervals.createMinMax(box));
		final RealRandomAccess<DoubleType> access = ImgUtils.interpolant(nativeBlock).realRandomAccess();
		final Axis xAxis = field.getXAxis();
		final Axis yAxis = field.getYAxis();
		final Img<DoubleType> block = ArrayImgs.doubles(xPixels[1] - xPixels[0] + 1, yPixels[1] - yPixels[0] + 1);
		final Cursor<DoubleType> cursor = block.localizingCursor();
		final double[] pos = new double[2];
		while (cursor.hasNext()) {
			cursor.fwd();
			pos[0] = xAxis.linearIndexOf(xAxis.pixelToCoord(xPixels[0] + cursor.getLongPosition(0)));
			pos[1] = yAxis.linearIndexOf(yAxis.pixelToCoord(yPixels[0] + cursor.getLongPosition(1)));
			access.setPosition(pos);
			cursor.get().set(access.get().get());
		}
		return block;
	}

}
