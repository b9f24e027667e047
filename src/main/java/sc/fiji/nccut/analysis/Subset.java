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

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * The block of data needed to sample one segment, with the segment endpoints
 * expressed relative to the block origin. {@code offset} is the position of
 * the block origin in the pixel space of the source.
 */
public class Subset {

	private final RandomAccessibleInterval<DoubleType> block;
	private final double[] endpoints;
	private final long[] offset;

	public Subset(final RandomAccessibleInterval<DoubleType> block, final double[] endpoints, final long[] offset) {
		this.block = block;
		this.endpoints = endpoints;
		this.offset = offset;
	}

	public RandomAccessibleInterval<DoubleType> getBlock() {
		return block;
	}

	/** @return the rescaled segment {x1, y1, x2, y2} */
	public double[] getEndpoints() {
		return endpoints.clone();
	}

	/** @return the origin offset {x, y} of the block, in source pixels */
	public long[] getOffset() {
		return offset.clone();
	}

}
