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

/**
 * Utility class defining a transect profile entry
 */
public class ProfileEntry {

	/** The entry's x-coordinate (physical units when available, else pixels) */
	public double x;

	/** The entry's y-coordinate (physical units when available, else pixels) */
	public double y;

	/** The sampled value at this entry's location */
	public double value;

	public ProfileEntry(final Number x, final Number y, final Number value) {
		this.x = x.doubleValue();
		this.y = y.doubleValue();
		this.value = value.doubleValue();
	}

	public ProfileEntry(final double x, final double y, final double value) {
		this.x = x;
		this.y = y;
		this.value = value;
	}

	@Override
	public String toString() {
		return "(" + x + ", " + y + "): " + value;
	}

}
