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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import ij.ImagePlus;
import ij.process.ByteProcessor;
import net.imglib2.RandomAccess;
import net.imglib2.type.numeric.real.DoubleType;
import sc.fiji.nccut.OutOfBoundsException;
import sc.fiji.nccut.TestData;
import sc.fiji.nccut.data.Axis;
import sc.fiji.nccut.data.GriddedField;
import sc.fiji.nccut.data.RasterImage;

public class SubsetExtractorTest {

	private static final double EPSILON = 1e-9;

	private final SubsetExtractor extractor = new SubsetExtractor();

	@Test(expected = OutOfBoundsException.class)
	public void testBothEndpointsOutsideImage() {
		final RasterImage source = new RasterImage(new ImagePlus("blank", new ByteProcessor(100, 100)));
		extractor.extract(source, new double[] { -50, -50, -10, -20 });
	}

	@Test
	public void testOneEndpointInsideImage() {
		final RasterImage source = new RasterImage(new ImagePlus("blank", new ByteProcessor(100, 100)));
		final Subset subset = extractor.extract(source, new double[] { -50, -50, 10, 20 });
		assertArrayEquals(new long[] { 0, 0 }, subset.getOffset());
		assertArrayEquals(new double[] { -50, -50, 10, 20 }, subset.getEndpoints(), 0);
		assertEquals(100, subset.getBlock().dimension(0));
	}

	@Test(expected = OutOfBoundsException.class)
	public void testBothEndpointsOutsideField() {
		final GriddedField field = TestData.uniformField(60, 40, 1);
		extractor.extract(field, new double[] { 70, 5, 90, 30 });
	}

	@Test
	public void testUniformFieldBlockMatchesNativeValues() {
		final GriddedField field = TestData.uniformField(60, 40, 1);
		final Subset subset = extractor.extract(field, new double[] { 20, 10, 30, 15 });
		final long[] offset = subset.getOffset();
		assertTrue("Block must include a margin", offset[0] < 20 && offset[1] < 10);
		final double[] rescaled = subset.getEndpoints();
		assertArrayEquals(new double[] { 20 - offset[0], 10 - offset[1], 30 - offset[0], 15 - offset[1] },
				rescaled, 0);
		final RandomAccess<DoubleType> ra = subset.getBlock().randomAccess();
		for (long y = 0; y < subset.getBlock().dimension(1); y++) {
			for (long x = 0; x < subset.getBlock().dimension(0); x++) {
				ra.setPosition(new long[] { x, y });
				assertEquals(TestData.fieldValue((int) (x + offset[0]), (int) (y + offset[1]), 0),
						ra.get().get(), EPSILON);
			}
		}
	}

	@Test
	public void testNonUniformFieldIsRegridded() {
		final double[] x = { 0, 1, 2, 4, 8 };
		final double[] y = { 0, 2, 3 };
		final double[][] values = new double[y.length][x.length];
		for (int j = 0; j < y.length; j++)
			for (int i = 0; i < x.length; i++)
				values[j][i] = 2 * x[i] + 3 * y[j];
		final GriddedField field = new GriddedField("v", values, new Axis("x", x), new Axis("y", y));
		assertEquals("Working grid width", 9, field.getWidth());
		assertEquals("Working grid height", 4, field.getHeight());
		final Subset subset = extractor.extract(field, new double[] { 0, 0, 8, 3 });
		final RandomAccess<DoubleType> ra = subset.getBlock().randomAccess();
		final long[] offset = subset.getOffset();
		for (long py = 0; py < subset.getBlock().dimension(1); py++) {
			for (long px = 0; px < subset.getBlock().dimension(0); px++) {
				ra.setPosition(new long[] { px, py });
				final double[] c = field.toPhysical(px + offset[0], py + offset[1]);
				assertEquals(2 * c[0] + 3 * c[1], ra.get().get(), EPSILON);
			}
		}
	}

}
