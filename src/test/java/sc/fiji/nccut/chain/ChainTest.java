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
package sc.fiji.nccut.chain;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import ij.ImagePlus;
import ij.process.FloatProcessor;
import sc.fiji.nccut.NcCutPrefs;
import sc.fiji.nccut.OrthogonalOutOfBoundsException;
import sc.fiji.nccut.analysis.Profile;
import sc.fiji.nccut.data.RasterImage;
import sc.fiji.nccut.util.ClickPoint;

public class ChainTest {

	private RasterImage source;

	@Before
	public void setUp() {
		NcCutPrefs.clearAll();
		final FloatProcessor fp = new FloatProcessor(100, 100);
		for (int y = 0; y < 100; y++)
			for (int x = 0; x < 100; x++)
				fp.setf(x, y, (float) Math.sin(x * 0.1) * y);
		source = new RasterImage(new ImagePlus("float", fp));
	}

	@Test
	public void testInlineChain() {
		final Chain chain = new Chain(ChainKind.INLINE);
		assertTrue(chain.addPoint(new ClickPoint(10, 10), source));
		assertTrue(chain.getSegments().isEmpty());
		assertTrue(chain.addPoint(new ClickPoint(40, 10), source));
		assertFalse("Duplicate click must be ignored", chain.addPoint(new ClickPoint(40, 10), source));
		assertTrue(chain.addPoint(new ClickPoint(40, 60), source));
		assertEquals(3, chain.size());
		assertEquals(2, chain.getSegments().size());
		assertArrayEquals(new double[] { 40, 10, 40, 60 }, chain.getSegments().get(1), 0);
		final Map<String, Profile> profiles = chain.sample(source);
		assertEquals(2, profiles.size());
		assertEquals(30, profiles.get("Cut 1").size());
		assertEquals(50, profiles.get("Cut 2").size());
	}

	@Test
	public void testDeleteLastPointRemovesSegment() {
		final Chain chain = new Chain(ChainKind.INLINE);
		chain.addPoint(new ClickPoint(10, 10), source);
		chain.addPoint(new ClickPoint(40, 10), source);
		chain.addPoint(new ClickPoint(40, 60), source);
		assertEquals(new ClickPoint(40, 60), chain.deleteLastPoint());
		assertEquals(1, chain.getSegments().size());
		chain.deleteLastPoint();
		chain.deleteLastPoint();
		assertTrue(chain.isEmpty());
		assertNull(chain.deleteLastPoint());
	}

	@Test
	public void testOrthogonalClickRollback() {
		final Chain chain = new Chain(ChainKind.ORTHOGONAL);
		chain.setWidth(20);
		chain.addPoint(new ClickPoint(30, 50), source);
		chain.addPoint(new ClickPoint(50, 50), source);
		assertEquals(1, chain.getSegments().size());
		try {
			chain.addPoint(new ClickPoint(95, 50, 100), source);
			fail("Out of bounds orthogonal segment accepted");
		} catch (final OrthogonalOutOfBoundsException expected) {
			assertEquals("Chain must be unchanged", 2, chain.size());
			assertEquals(1, chain.getSegments().size());
			assertEquals(new ClickPoint(50, 50, 20), chain.getLastPoint());
		}
	}

	@Test
	public void testWidthOfFirstClickFollowsChainWidth() {
		final Chain chain = new Chain(ChainKind.ORTHOGONAL);
		assertEquals(NcCutPrefs.DEF_WIDTH, chain.getWidth());
		chain.addPoint(new ClickPoint(30, 50), source);
		chain.setWidth(12);
		assertEquals(12, chain.getPoints().get(0).getWidth());
		chain.addPoint(new ClickPoint(60, 50), source);
		chain.setWidth(16);
		assertEquals("Only a lone click follows the chain width", 12, chain.getPoints().get(0).getWidth());
		assertArrayEquals(new int[] { 12, 12 }, chain.getWidths());
	}

	@Test
	public void testClicksCannotBeAlteredFromOutside() {
		final Chain chain = new Chain(ChainKind.ORTHOGONAL);
		chain.setWidth(20);
		final ClickPoint first = new ClickPoint(30, 50);
		chain.addPoint(first, source);
		chain.setWidth(24);
		assertEquals("Caller's click untouched", ClickPoint.NO_WIDTH, first.getWidth());
		chain.addPoint(new ClickPoint(50, 50), source);
		final ClickPoint last = chain.getLastPoint();
		final ClickPoint wider = last.withWidth(80);
		assertEquals(80, wider.getWidth());
		assertEquals(24, last.getWidth());
		assertArrayEquals(new int[] { 24, 24 }, chain.getWidths());
		assertEquals(1, chain.getSegments().size());
	}

	@Test
	public void testAverage() {
		final Chain chain = new Chain(ChainKind.ORTHOGONAL);
		chain.setWidth(10);
		chain.addPoint(new ClickPoint(20, 50), source);
		chain.addPoint(new ClickPoint(40, 50), source);
		chain.addPoint(new ClickPoint(60, 50), source);
		chain.addPoint(new ClickPoint(80, 50), source);
		final Map<String, Profile> cuts = chain.sample(source);
		final Profile average = chain.average(source);
		assertEquals(11, average.size());
		for (int i = 0; i < average.size(); i++) {
			double sum = 0;
			for (final Profile cut : cuts.values()) sum += cut.get(i).value;
			assertEquals(sum / cuts.size(), average.get(i).value, 1e-9);
		}
	}

	@Test(expected = IllegalStateException.class)
	public void testAverageOfMixedWidths() {
		final Chain chain = new Chain(ChainKind.ORTHOGONAL);
		chain.addPoint(new ClickPoint(20, 50, 10), source);
		chain.addPoint(new ClickPoint(40, 50, 10), source);
		chain.addPoint(new ClickPoint(60, 50, 20), source);
		chain.average(source);
	}

}
