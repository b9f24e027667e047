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
import static org.junit.Assert.assertSame;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.Before;
import org.junit.Test;

import ij.ImagePlus;
import sc.fiji.nccut.NcCutPrefs;
import sc.fiji.nccut.OutOfBoundsException;
import sc.fiji.nccut.TestData;
import sc.fiji.nccut.data.Axis;
import sc.fiji.nccut.data.GriddedField;
import sc.fiji.nccut.data.RasterImage;
import sc.fiji.nccut.util.ImgUtils;
import sc.fiji.nccut.util.Segment;

/**
 * Tests for transect sampling. Horizontal, diagonal and vertical segments must
 * reproduce direct indexing of the data.
 */
public class TransectSamplerTest {

	private static final double EPSILON = 1e-12;

	private ImagePlus imp;
	private RasterImage image;

	@Before
	public void setUp() {
		NcCutPrefs.clearAll();
		imp = TestData.rgbImage(TestData.RGB_WIDTH, TestData.RGB_HEIGHT);
		image = new RasterImage(imp);
	}

	@Test
	public void testHorizontalSegmentOnImage() {
		final Profile profile = new TransectSampler(image, new double[] { 1000, 200, 1200, 200 }).call();
		assertEquals(200, profile.size());
		for (int i = 0; i < profile.size(); i++) {
			final ProfileEntry e = profile.get(i);
			assertEquals(1000 + i, e.x, 0);
			assertEquals(200, e.y, 0);
			assertEquals("Row 200, column " + (1000 + i), TestData.rgbMean(imp, 1000 + i, 200), e.value, EPSILON);
		}
	}

	@Test
	public void testDiagonalSegmentOnImage() {
		final Profile profile = new TransectSampler(image, new double[] { 1000, 200, 1200, 400 }).call();
		assertEquals(200, profile.size());
		for (int i = 0; i < profile.size(); i++) {
			final ProfileEntry e = profile.get(i);
			assertEquals(1000 + i, e.x, 0);
			assertEquals(200 + i, e.y, 0);
			assertEquals(TestData.rgbMean(imp, 1000 + i, 200 + i), e.value, EPSILON);
		}
	}

	@Test
	public void testVerticalSegmentOnImage() {
		final Profile profile = new TransectSampler(image, new double[] { 1000, 100, 1000, 400 }).call();
		assertEquals(300, profile.size());
		for (int i = 0; i < profile.size(); i++) {
			final ProfileEntry e = profile.get(i);
			assertEquals(1000, e.x, 0);
			assertEquals("y must ascend", 100 + i, e.y, 0);
			assertEquals(TestData.rgbMean(imp, 1000, 100 + i), e.value, EPSILON);
		}
	}

	@Test
	public void testProfileFollowsClickDirection() {
		final Profile forward = new TransectSampler(image, new double[] { 1000, 200, 1200, 200 }).call();
		final Profile backward = new TransectSampler(image, new double[] { 1200, 200, 1000, 200 }).call();
		final double[] expected = forward.values();
		final double[] actual = backward.values();
		assertEquals(expected.length, actual.length);
		for (int i = 0; i < expected.length; i++) {
			assertEquals(expected[expected.length - 1 - i], actual[i], EPSILON);
		}
	}

	@Test
	public void testZeroLengthSegment() {
		final Profile profile = new TransectSampler(image, new double[] { 500, 300, 500, 300 }).call();
		assertEquals(1, profile.size());
		assertEquals(TestData.rgbMean(imp, 500, 300), profile.get(0).value, EPSILON);
	}

	@Test(expected = OutOfBoundsException.class)
	public void testSegmentOutsideImage() {
		new TransectSampler(image, new Segment(-100, -100, -10, -50)).call();
	}

	@Test
	public void testHorizontalSegmentOnField() {
		final GriddedField field = TestData.uniformField(60, 40, 1);
		final Profile profile = new TransectSampler(field, new double[] { 5, 10, 45, 10 }).call();
		assertEquals("lon", profile.getXLabel());
		assertEquals("lat", profile.getYLabel());
		assertEquals(40, profile.size());
		for (int i = 0; i < profile.size(); i++) {
			final ProfileEntry e = profile.get(i);
			assertEquals(10 + 0.25 * (5 + i), e.x, EPSILON);
			assertEquals(-5 + 0.5 * 10, e.y, EPSILON);
			assertEquals(TestData.fieldValue(5 + i, 10, 0), e.value, 1e-9);
		}
	}

	@Test
	public void testDiagonalAndVerticalSegmentsOnField() {
		final GriddedField field = TestData.uniformField(60, 40, 1);
		final Profile diagonal = new TransectSampler(field, new double[] { 5, 5, 30, 30 }).call();
		assertEquals(25, diagonal.size());
		for (int i = 0; i < diagonal.size(); i++) {
			assertEquals(TestData.fieldValue(5 + i, 5 + i, 0), diagonal.get(i).value, 1e-9);
		}
		final Profile vertical = new TransectSampler(field, new double[] { 12, 2, 12, 35 }).call();
		assertEquals(33, vertical.size());
		for (int i = 0; i < vertical.size(); i++) {
			assertEquals(-5 + 0.5 * (2 + i), vertical.get(i).y, EPSILON);
			assertEquals(TestData.fieldValue(12, 2 + i, 0), vertical.get(i).value, 1e-9);
		}
	}

	@Test
	public void testNonUniformFieldReproducesLinearData() {
		final double[] x = { 0, 1, 2, 4, 8, 9, 10 };
		final double[] y = { 0, 1, 3, 4 };
		final double[][] values = new double[y.length][x.length];
		for (int j = 0; j < y.length; j++)
			for (int i = 0; i < x.length; i++)
				values[j][i] = 2 * x[i] - 3 * y[j];
		final GriddedField field = new GriddedField("v", values, new Axis("x", x), new Axis("y", y));
		final Profile profile = new TransectSampler(field, new double[] { 0, 0, 10, 4 }).call();
		for (final ProfileEntry e : profile) {
			assertEquals(2 * e.x - 3 * e.y, e.value, 1e-9);
		}
	}

	@Test
	public void testSampleAllZ() {
		final GriddedField field = TestData.uniformField(30, 20, 4);
		final double[] segment = { 2, 3, 25, 12 };
		final double[][] matrix = new TransectSampler(field, segment).sampleAllZ();
		assertEquals(4, matrix.length);
		for (int z = 0; z < matrix.length; z++) {
			final double[] expected = new TransectSampler(field.slice(z), segment).call().values();
			assertArrayEquals("Level " + z, expected, matrix[z], 0);
		}
		assertEquals(300, matrix[3][0] - matrix[0][0], 1e-9);
	}

	@Test
	public void testParallelSampling() throws Exception {
		final GriddedField field = TestData.uniformField(30, 20, 1);
		assertSame(image.getImg(), image.getImg());
		assertSame(field.getImg(), field.getImg());
		final double[][] segments = { { 1000, 200, 1200, 200 }, { 1000, 100, 1000, 400 }, { 1000, 200, 1200, 400 },
				{ 50, 50, 300, 80 } };
		final ExecutorService executor = Executors.newFixedThreadPool(4);
		try {
			final List<Future<Profile>> futures = new ArrayList<>();
			for (final double[] segment : segments) {
				futures.add(executor.submit(new TransectSampler(image, segment)));
				futures.add(executor.submit(new TransectSampler(field, new double[] { 2, 3, 25, 12 })));
			}
			final double[] fieldValues = new TransectSampler(field, new double[] { 2, 3, 25, 12 }).call().values();
			for (int i = 0; i < segments.length; i++) {
				final double[] expected = new TransectSampler(image, segments[i]).call().values();
				assertArrayEquals(expected, futures.get(2 * i).get().values(), 0);
				assertArrayEquals(fieldValues, futures.get(2 * i + 1).get().values(), 0);
			}
		}
		finally {
			executor.shutdown();
		}
	}

	@Test
	public void testStaticSamplingOnBlock() {
		final double[][] values = new double[10][10];
		for (int j = 0; j < 10; j++)
			for (int i = 0; i < 10; i++)
				values[j][i] = i + 10 * j;
		final Profile profile = TransectSampler.sample(new double[] { 1, 2.5, 8, 2.5 },
				ImgUtils.wrap(values), true);
		assertEquals(7, profile.size());
		for (int i = 0; i < profile.size(); i++) {
			assertEquals(1 + i + 25, profile.get(i).value, 1e-12);
		}
	}

}
