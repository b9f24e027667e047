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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import sc.fiji.nccut.NcCutUtils;
import sc.fiji.nccut.analysis.Profile;
import sc.fiji.nccut.data.DataSource;
import sc.fiji.nccut.util.ClickPoint;

/**
 * Manages the chains of one kind drawn on a data source. Clicks are always
 * appended to the most recent chain.
 */
public class ChainManager {

	private final ChainKind kind;
	private final DataSource source;
	private final List<Chain> chains;
	private int width;

	public ChainManager(final ChainKind kind, final DataSource source) {
		if (kind == null || source == null)
			throw new IllegalArgumentException("Kind and source cannot be null");
		this.kind = kind;
		this.source = source;
		chains = new ArrayList<>();
		chains.add(new Chain(kind));
		width = chains.get(0).getWidth();
	}

	public ChainKind getKind() {
		return kind;
	}

	public DataSource getSource() {
		return source;
	}

	/** @return the chain receiving clicks */
	public Chain getCurrentChain() {
		return chains.get(chains.size() - 1);
	}

	/**
	 * Appends a click to the current chain.
	 *
	 * @see Chain#addPoint(ClickPoint, DataSource)
	 */
	public boolean addPoint(final ClickPoint point) {
		return getCurrentChain().addPoint(point, source);
	}

	public boolean addPoint(final double x, final double y) {
		return addPoint(new ClickPoint(x, y));
	}

	/**
	 * Starts a new chain. Only allowed once the current chain holds at least two
	 * clicks.
	 *
	 * @return true if a new chain was started
	 */
	public boolean newChain() {
		if (getCurrentChain().size() < 2) {
			NcCutUtils.log("New chain requires at least 2 clicks on the current one");
			return false;
		}
		chains.add(newEmptyChain());
		return true;
	}

	/**
	 * Removes the last click. If the current chain is empty, it is discarded
	 * first and the click is removed from the previous chain.
	 *
	 * @return the removed click, or null if there are no clicks
	 */
	public ClickPoint deletePoint() {
		if (getCurrentChain().isEmpty() && chains.size() > 1) chains.remove(chains.size() - 1);
		return getCurrentChain().deleteLastPoint();
	}

	/**
	 * Removes the most recent chain. An empty trailing chain is discarded
	 * together with it.
	 */
	public void deleteChain() {
		if (getCurrentChain().isEmpty() && chains.size() > 1) chains.remove(chains.size() - 1);
		chains.remove(chains.size() - 1);
		if (chains.isEmpty()) chains.add(newEmptyChain());
	}

	/** Removes all chains. */
	public void clear() {
		chains.clear();
		chains.add(newEmptyChain());
	}

	private Chain newEmptyChain() {
		final Chain chain = new Chain(kind);
		chain.setWidth(width);
		return chain;
	}

	/**
	 * Sets the width of subsequent orthogonal clicks.
	 *
	 * @see Chain#setWidth(int)
	 */
	public void setWidth(final int width) {
		getCurrentChain().setWidth(width);
		this.width = width;
	}

	public int getWidth() {
		return width;
	}

	/** @return the non-empty chains in creation order */
	public List<Chain> getChains() {
		final List<Chain> list = new ArrayList<>();
		chains.forEach(c -> {
			if (!c.isEmpty()) list.add(c);
		});
		return Collections.unmodifiableList(list);
	}

	/**
	 * Appends chains created elsewhere (e.g., loaded from a file). An unfinished
	 * current chain (fewer than two clicks) is discarded first. Subsequent
	 * clicks start a new chain.
	 *
	 * @param loaded the chains to append
	 */
	public void addChains(final Collection<Chain> loaded) {
		if (loaded.isEmpty()) return;
		for (final Chain chain : loaded) {
			if (chain.getKind() != kind)
				throw new IllegalArgumentException("Cannot add " + chain.getKind() + " chain to " + kind + " manager");
		}
		if (getCurrentChain().size() < 2) {
			if (!getCurrentChain().isEmpty()) NcCutUtils.log("Discarding unfinished chain " + getCurrentChain());
			chains.remove(chains.size() - 1);
		}
		chains.addAll(loaded);
		chains.add(newEmptyChain());
	}

	/**
	 * @param chain a managed chain
	 * @return the chain label, e.g., "Chain 1"
	 */
	public String getLabel(final Chain chain) {
		final int index = getChains().indexOf(chain);
		if (index < 0) throw new IllegalArgumentException("Chain not managed by this manager");
		return kind.label(index + 1);
	}

	/**
	 * Samples every chain.
	 *
	 * @return the profiles keyed by chain label and cut label
	 */
	public Map<String, Map<String, Profile>> sampleAll() {
		final Map<String, Map<String, Profile>> result = new LinkedHashMap<>();
		final List<Chain> list = getChains();
		for (int i = 0; i < list.size(); i++) {
			result.put(kind.label(i + 1), list.get(i).sample(source));
		}
		return result;
	}

}
