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

import ij.Prefs;

/**
 * Class handling NcCut preferences. Values are kept in ImageJ's preferences
 * store under the {@code nccut.} prefix and persisted by
 * {@link Prefs#savePreferences()}.
 */
public class NcCutPrefs {

	public static final int DEF_MIN_WIDTH = 1;
	public static final int DEF_MAX_WIDTH = 400;
	public static final int DEF_WIDTH = 40;
	public static final int DEF_TICK_TARGET = 5;
	public static final boolean DEF_DEBUG_MODE = false;

	private static final String MIN_WIDTH = "nccut.minWidth";
	private static final String MAX_WIDTH = "nccut.maxWidth";
	private static final String WIDTH = "nccut.width";
	private static final String TICK_TARGET = "nccut.tickTarget";
	private static final String DEBUG = "nccut.debug";

	private NcCutPrefs() {}

	public static int getMinWidth() {
		// Prefs.getInt() cannot parse doubles. We'll cast from double instead
		return (int) Prefs.get(MIN_WIDTH, DEF_MIN_WIDTH);
	}

	public static int getMaxWidth() {
		return (int) Prefs.get(MAX_WIDTH, DEF_MAX_WIDTH);
	}

	/**
	 * Sets the range of valid orthogonal widths.
	 *
	 * @param min the smallest accepted width (inclusive)
	 * @param max the largest accepted width (inclusive)
	 * @throws IllegalArgumentException if {@code min < 1} or {@code max < min}
	 */
	public static void setWidthRange(final int min, final int max) {
		if (min < 1 || max < min)
			throw new IllegalArgumentException("Invalid width range: " + min + "-" + max);
		Prefs.set(MIN_WIDTH, min);
		Prefs.set(MAX_WIDTH, max);
	}

	public static boolean isValidWidth(final int width) {
		return width >= getMinWidth() && width <= getMaxWidth();
	}

	/** @return the width assigned to orthogonal clicks lacking an explicit one */
	public static int getDefaultWidth() {
		return (int) Prefs.get(WIDTH, DEF_WIDTH);
	}

	public static void setDefaultWidth(final int width) {
		if (!isValidWidth(width))
			throw new InvalidWidthException(width, getMinWidth(), getMaxWidth());
		Prefs.set(WIDTH, width);
	}

	public static int getTickTarget() {
		return (int) Prefs.get(TICK_TARGET, DEF_TICK_TARGET);
	}

	public static void setTickTarget(final int target) {
		if (target < 2) throw new IllegalArgumentException("Tick target must be >= 2");
		Prefs.set(TICK_TARGET, target);
	}

	public static boolean isDebugMode() {
		return Prefs.get(DEBUG, DEF_DEBUG_MODE);
	}

	public static void setDebugMode(final boolean debug) {
		Prefs.set(DEBUG, debug);
		NcCutUtils.setDebugMode(debug);
	}

	/** Restores all NcCut preferences to their defaults. */
	public static void clearAll() {
		Prefs.set(MIN_WIDTH, null);
		Prefs.set(MAX_WIDTH, null);
		Prefs.set(WIDTH, null);
		Prefs.set(TICK_TARGET, null);
		Prefs.set(DEBUG, null);
		NcCutUtils.setDebugMode(DEF_DEBUG_MODE);
	}

	/** Persists current preferences to ImageJ's preferences file. */
	public static void save() {
		Prefs.savePreferences();
	}

}
