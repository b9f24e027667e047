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
package sc.fiji.nccut.data;

import ij.ImagePlus;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.DoubleType;
import sc.fiji.nccut.util.ImgUtils;

/**
 * A {@link DataSource} wrapping the active plane of an ImageJ image. Pixel
 * space and physical space coincide. RGB images are exposed as 3-channel
 * data.
 */
public class RasterImage implements DataSource {

	private final ImagePlus imp;
	private final RandomAccessibleInterval<DoubleType> img;

	public RasterImage(final ImagePlus imp) {
		if (imp == null || imp.getProcessor() == null)
			throw new IllegalArgumentException("Invalid image");
		this.imp = imp;
		img = ImgUtils.impToRai(imp);
	}

	public ImagePlus getImagePlus() {
		return imp;
	}

	public boolean isRGB() {
		return imp.getType() == ImagePlus.COLOR_RGB;
	}

	@Override
	public long getWidth() {
		return imp.getWidth();
	}

	@Override
	public long getHeight() {
		return imp.getHeight();
	}

	@Override
	public boolean isGridded() {
		return false;
	}

	@Override
	public String getXName() {
		return "x";
	}

	@Override
	public String getYName() {
		return "y";
	}

	@Override
	public boolean hasNumericAxes() {
		return false;
	}

	@Override
	public double[] toPhysical(final double px, final double py) {
		return new double[] { px, py };
	}

	@Override
	public double[] toPixel(final double cx, final double cy) {
		return new double[] { cx, cy };
	}

	@Override
	public double[] getEnvelope() {
		return new double[] { 0, 0, getWidth() - 1, getHeight() - 1 };
	}

	@Override
	public RandomAccessibleInterval<DoubleType> getImg() {
		return img;
	}

	/**
	 * @return the value at pixel (x, y), averaged across channels for RGB images
	 */
	public double getValue(final int x, final int y) {
		final int row = imp.getHeight() - 1 - y;
		if (isRGB()) {
			final int[] rgb = imp.getProcessor().getPixel(x, row, null);
			return (rgb[0] + rgb[1] + rgb[2]) / 3d;
		}
		return imp.getProcessor().getf(x, row);
	}

	@Override
	public String toString() {
		return imp.getTitle() + " (" + getWidth() + "x" + getHeight() + ")";
	}

}
