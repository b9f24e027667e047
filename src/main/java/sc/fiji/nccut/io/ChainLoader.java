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
package sc.fiji.nccut.io;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import sc.fiji.nccut.TransectException;
import sc.fiji.nccut.chain.Chain;
import sc.fiji.nccut.chain.ChainKind;
import sc.fiji.nccut.chain.ChainManager;
import sc.fiji.nccut.data.DataSource;
import sc.fiji.nccut.util.ClickPoint;
import sc.fiji.nccut.util.Logger;

/**
 * Loads chains exported by {@link ChainExporter}. The document is searched
 * recursively for records of the manager's chain kind. Clicks are converted
 * back into pixels and replayed, so that derived segments and profiles are
 * recomputed on the manager's data source. Loading is all-or-nothing: if any
 * click is rejected, none of the chains in the document are kept.
 */
public class ChainLoader {

	private static final double SNAP_TOLERANCE = 1e-6;

	private final ChainManager manager;
	private final Logger logger;

	public ChainLoader(final ChainManager manager) {
		this.manager = manager;
		logger = new Logger(ChainLoader.class);
	}

	public List<Chain> load(final File file) throws IOException {
		final String contents = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
		try {
			return load(new JSONObject(contents));
		} catch (final JSONException ex) {
			throw new IOException("Not a valid chains file: " + file.getName(), ex);
		}
	}

	/**
	 * Loads all chain records of the manager's kind and appends them to the
	 * manager.
	 *
	 * @param document the JSON document
	 * @return the loaded chains, in chain number order
	 * @throws TransectException if the document has malformed records or a click
	 *           could not be replayed. The manager is left unchanged
	 */
	public List<Chain> load(final JSONObject document) {
		final List<Map.Entry<Integer, JSONObject>> records = new ArrayList<>();
		collectRecords(document, manager.getKind(), records);
		records.sort(Map.Entry.comparingByKey());
		final List<Chain> loaded = new ArrayList<>();
		for (final Map.Entry<Integer, JSONObject> record : records) {
			try {
				loaded.add(replay(record.getValue()));
			} catch (final TransectException | JSONException ex) {
				logger.warn("Discarding " + loaded.size() + " loaded chain(s): "
						+ manager.getKind().label(record.getKey()) + " is invalid");
				throw new TransectException("Could not load " + manager.getKind().label(record.getKey()) + ": "
						+ ex.getMessage(), ex);
			}
		}
		manager.addChains(loaded);
		logger.debug(loaded.size() + " chain(s) loaded");
		return loaded;
	}

	private static void collectRecords(final JSONObject object, final ChainKind kind,
			final List<Map.Entry<Integer, JSONObject>> records) {
		// sorted keys for a deterministic traversal
		final Map<String, Object> children = new TreeMap<>();
		for (final String key : object.keySet()) {
			children.put(key, object.get(key));
		}
		for (final Map.Entry<String, Object> child : children.entrySet()) {
			if (!(child.getValue() instanceof JSONObject)) continue;
			final JSONObject value = (JSONObject) child.getValue();
			if (kind.matches(child.getKey())) {
				final String label = child.getKey();
				final int number = Integer.parseInt(label.substring(label.lastIndexOf(' ') + 1));
				records.add(Map.entry(number, value));
			} else {
				collectRecords(value, kind, records);
			}
		}
	}

	private Chain replay(final JSONObject record) {
		final DataSource source = manager.getSource();
		final JSONArray xs = record.getJSONArray(ChainExporter.CLICK_PREFIX + source.getXName());
		final JSONArray ys = record.getJSONArray(ChainExporter.CLICK_PREFIX + source.getYName());
		final boolean orthogonal = manager.getKind() == ChainKind.ORTHOGONAL;
		final JSONArray widths = (orthogonal) ? record.getJSONArray(ChainExporter.WIDTH) : null;
		if (xs.length() != ys.length() || (widths != null && widths.length() != xs.length()))
			throw new TransectException("Click arrays differ in length");
		final Chain chain = new Chain(manager.getKind());
		for (int i = 0; i < xs.length(); i++) {
			final double[] pixel = source.toPixel(xs.getDouble(i), ys.getDouble(i));
			final int width = (orthogonal) ? widths.getInt(i) : ClickPoint.NO_WIDTH;
			chain.addPoint(new ClickPoint(snap(pixel[0]), snap(pixel[1]), width), source);
		}
		return chain;
	}

	/* undoes rounding errors of the pixel-to-physical conversion */
	private static double snap(final double pixel) {
		final double rounded = Math.rint(pixel);
		return (Math.abs(pixel - rounded) < SNAP_TOLERANCE) ? rounded : pixel;
	}

}
