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
package sc.fiji.nccut;

/**
 * Thrown when the orthogonal segment derived from two chain clicks exits the
 * pixel bounds of the data source.
 */
public class OrthogonalOutOfBoundsException extends TransectException {

	private static final long serialVersionUID = 1L;

	private final double[] coordinates;

	public OrthogonalOutOfBoundsException(final double[] coordinates) {
		super(String.format("Orthogonal point out of bounds: [%.2f, %.2f, %.2f, %.2f]", coordinates[0],
				coordinates[1], coordinates[2], coordinates[3]));
		this.coordinates = coordinates.clone();
	}

	/**
	 * @return the rejected endpoints, as {@code [x1, y1, x2, y2]}
	 */
	public double[] getCoordinates() {
		return coordinates.clone();
	}

}
