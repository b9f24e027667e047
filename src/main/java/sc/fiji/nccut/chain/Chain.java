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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import sc.fiji.nccut.InvalidWidthException;
import sc.fiji.nccut.NcCutPrefs;
import sc.fiji.nccut.TransectException;
import sc.fiji.nccut.analysis.Profile;
import sc.fiji.nccut.analysis.TransectSampler;
import sc.fiji.nccut.data.DataSource;
import sc.fiji.nccut.util.ClickPoint;
import sc.fiji.nccut.util.Logger;
import sc.fiji.nccut.util.Segment;

/**
 * An ordered sequence of clicks and the segments derived from them. Inline
 * chains sample each clicked segment; orthogonal chains sample, for each pair of
 * consecutive clicks, the segment perpendicular to it (see
 * {@link ChainGeometry}). Derived segments are keyed by the index of the click
 * that created them.
 */
public class Chain {

	private final ChainKind kind;
	private final List<ClickPoint> clicks;
	private final Map<Integer, double[]> segments;
	private final Logger logger;
	private int width;

	public Chain(final ChainKind kind) {
		this.kind = kind;
		clicks = new ArrayList<>();
		segments = new LinkedHashMap<>();
		logger = new Logger(Chain.class);
		width = NcCutPrefs.getDefaultWidth();
	}

	public ChainKind getKind() {
		return kind;
	}

	/**
	 * Appends a click. Clicks of orthogonal chains lacking a width are assigned
	 * the current width of the chain. If the click creates an invalid orthogonal
	 * segment the click is discarded and the chain is left unchanged.
	 *
	 * @param point  the click, in source pixels
	 * @param source the data source the chain is drawn on
	 * @return true if the click was appended, false if it was ignored (a
	 *         duplicate of the last click of an inline chain)
	 * @throws InvalidWidthException if the width of the click is not valid
	 * @throws sc.fiji.nccut.OrthogonalOutOfBoundsException if the derived
	 *           segment leaves the source
	 */
	public boolean addPoint(final ClickPoint point, final DataSource source) {
		final ClickPoint last = getLastPoint();
		if (kind == ChainKind.INLINE && point.isSameLocation(last)) {
			logger.debug("Ignoring duplicated click " + point);
			return false;
		}
		final ClickPoint click = new ClickPoint(point.getX(), point.getY(),
				(kind == ChainKind.ORTHOGONAL) ? (point.hasWidth() ? point.getWidth() : width) : ClickPoint.NO_WIDTH);
		if (kind == ChainKind.ORTHOGONAL && !NcCutPrefs.isValidWidth(click.getWidth()))
			throw new InvalidWidthException(click.getWidth(), NcCutPrefs.getMinWidth(), NcCutPrefs.getMaxWidth());
		clicks.add(click);
		if (last == null) return true;
		final int index = clicks.size() - 1;
		try {
			final double[] segment = (kind == ChainKind.ORTHOGONAL)
					? ChainGeometry.orthogonal(last, click, click.getWidth(), source)
					: new Segment(last, click).toArray();
			segments.put(index, segment);
		} catch (final TransectException ex) {
			clicks.remove(index);
			logger.debug("Click " + click + " rejected: " + ex.getMessage());
			throw ex;
		}
		return true;
	}

	/**
	 * Removes the last click and the segment it created.
	 *
	 * @return the removed click, or null if the chain is empty
	 */
	public ClickPoint deleteLastPoint() {
		if (clicks.isEmpty()) return null;
		final int index = clicks.size() - 1;
		segments.remove(index);
		return clicks.remove(index);
	}

	/**
	 * Sets the width of subsequent orthogonal clicks. While the chain holds a
	 * single click, the width of that click is updated as well.
	 *
	 * @param width the new width
	 * @throws InvalidWidthException if width is outside the valid range
	 */
	public void setWidth(final int width) {
		if (!NcCutPrefs.isValidWidth(width))
			throw new InvalidWidthException(width, NcCutPrefs.getMinWidth(), NcCutPrefs.getMaxWidth());
		this.width = width;
		if (kind == ChainKind.ORTHOGONAL && clicks.size() == 1) clicks.set(0, clicks.get(0).withWidth(width));
	}

	public int getWidth() {
		return width;
	}

	public List<ClickPoint> getPoints() {
		return Collections.unmodifiableList(clicks);
	}

	public ClickPoint getLastPoint() {
		return (clicks.isEmpty()) ? null : clicks.get(clicks.size() - 1);
	}

	public int size() {
		return clicks.size();
	}

	public boolean isEmpty() {
		return clicks.isEmpty();
	}

	/** @return the derived segments {x1, y1, x2, y2}, in click order */
	public List<double[]> getSegments() {
		final List<double[]> list = new ArrayList<>();
		segments.values().forEach(s -> list.add(s.clone()));
		return list;
	}

	/** @return the widths of all clicks (orthogonal chains) */
	public int[] getWidths() {
		return clicks.stream().mapToInt(ClickPoint::getWidth).toArray();
	}

	/**
	 * Samples all derived segments.
	 *
	 * @param source the data source
	 * @return the profiles keyed by cut label ("Cut 1", "Cut 2", ...)
	 */
	public Map<String, Profile> sample(final DataSource source) {
		final Map<String, Profile> profiles = new LinkedHashMap<>();
		int cut = 1;
		for (final double[] segment : segments.values()) {
			final String label = "Cut " + cut++;
			final Profile profile = new TransectSampler(source, segment).call();
			profile.setIdentifier(label);
			profiles.put(label, profile);
		}
		return profiles;
	}

	/**
	 * Averages the cuts of an orthogonal chain whose cuts share one width.
	 *
	 * @param source the data source
	 * @return the average profile
	 * @throws IllegalStateException if the chain is not orthogonal, has no cuts,
	 *           or its cuts differ in width
	 */
	public Profile average(final DataSource source) {
		if (kind != ChainKind.ORTHOGONAL)
			throw new IllegalStateException("Only orthogonal chains can be averaged");
		if (segments.isEmpty())
			throw new IllegalStateException("Chain has no cuts");
		final long nWidths = clicks.stream().skip(1).mapToInt(ClickPoint::getWidth).distinct().count();
		if (nWidths != 1)
			throw new IllegalStateException("Cuts must share the same width");
		return Profile.average(sample(source).values());
	}

	@Override
	public String toString() {
		return kind + " chain: " + clicks;
	}

}
