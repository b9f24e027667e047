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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import sc.fiji.nccut.TestData;

public class GriddedFieldTest {

	@Test
	public void testWorkingGrid() {
		final Axis axis = new Axis("x", new double[] { 0, 0.5, 1.5, 3.5 });
		assertTrue(axis.isNumeric());
		assertEquals(0.5, axis.getStep(), 0);
		assertEquals(8, axis.getWorkingSize());
		assertEquals(1.5, axis.pixelToCoord(3), 0);
		assertEquals(2, axis.linearIndexOf(1.5), 0);
		assertEquals(2.5, axis.linearIndexOf(2.5), 1e-12);
	}

	@Test
	public void testDescendingAxis() {
		final Axis axis = new Axis("lat", new double[] { 40, 30, 20, 10 });
		assertEquals(10, axis.getOrigin(), 0);
		assertEquals(4, axis.getWorkingSize());
		assertEquals(3, axis.linearIndexOf(10), 0);
		assertEquals(0.5, axis.linearIndexOf(35), 1e-12);
	}

	@Test
	public void testNonNumericAxisUsesIndices() {
		final Axis axis = new Axis("station", new double[] { 3, 1, 2 });
		assertFalse(axis.isNumeric());
		assertEquals(3, axis.getWorkingSize());
		assertEquals(2, axis.pixelToCoord(2), 0);
		final GriddedField field = new GriddedField("v", new double[][] { { 1, 2, 3 }, { 4, 5, 6 } }, axis,
				new Axis("time", new double[] { 0, 1 }));
		assertFalse(field.hasNumericAxes());
		assertArrayEquals(new double[] { 2, 1 }, field.toPhysical(2, 1), 0);
	}

	@Test
	public void testSlices() {
		final GriddedField field = TestData.uniformField(10, 8, 3);
		assertTrue(field.is3D());
		assertEquals(3, field.getNumLevels());
		final GriddedField slice = field.slice(2);
		assertEquals(10, slice.getZValue(), 0);
		assertEquals(TestData.fieldValue(4, 5, 2), slice.getValue(4, 5), 0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testAxisSizeMismatch() {
		new GriddedField("v", new double[][] { { 1, 2, 3 } }, new Axis("x", new double[] { 0, 1 }),
				new Axis("y", new double[] { 0 }));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testDuplicateAxes() {
		new GriddedField("v", new double[][] { { 1, 2 } }, new Axis("x", new double[] { 0, 1 }),
				new Axis("x", new double[] { 0 }));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testLevelsWithoutZAxis() {
		new GriddedField("v", new double[2][1][2], new Axis("x", new double[] { 0, 1 }),
				new Axis("y", new double[] { 0 }), null);
	}

}
