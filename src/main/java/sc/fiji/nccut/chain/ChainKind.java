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

import java.util.regex.Pattern;

/**
 * The two chain tools.
 */
public enum ChainKind {

	/** Each clicked segment is itself sampled */
	INLINE("Chain"),
	/** Each clicked segment yields a sampled segment perpendicular to it */
	ORTHOGONAL("Orthogonal Chain");

	private final String prefix;

	ChainKind(final String prefix) {
		this.prefix = prefix;
	}

	/**
	 * @param number the 1-based chain number
	 * @return the chain label, e.g., "Orthogonal Chain 2"
	 */
	public String label(final int number) {
		return prefix + " " + number;
	}

	/**
	 * @param label a chain label
	 * @return true if the label names a chain of this kind
	 */
	public boolean matches(final String label) {
		return label != null && label.matches(Pattern.quote(prefix) + " \\d+");
	}

}
