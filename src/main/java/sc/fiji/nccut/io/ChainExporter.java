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
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;

import sc.fiji.nccut.NcCutUtils;
import sc.fiji.nccut.analysis.Profile;
import sc.fiji.nccut.chain.Chain;
import sc.fiji.nccut.chain.ChainKind;
import sc.fiji.nccut.chain.ChainManager;
import sc.fiji.nccut.data.DataSource;
import sc.fiji.nccut.data.GriddedField;
import sc.fiji.nccut.util.ClickPoint;

/**
 * Exports chains and their profiles as JSON. Each chain is stored under its
 * label ("Chain N" or "Orthogonal Chain N") as a record holding the clicks
 * ({@code "Click <x-axis name>"}, {@code "Click <y-axis name>"}, in physical
 * units when available), the click widths ({@code "Width"}, orthogonal chains
 * only) and one {@code "Cut N"} entry per derived segment with the profile
 * {@code "x"}, {@code "y"} and {@code "Cut"} (values) arrays. Records of
 * gridded fields are nested under the variable name and, for 3D fields, under
 * the Z value of the sampled level.
 */
public class ChainExporter {

	public static final String EXTENSION = ".json";
	public static final String CLICK_PREFIX = "Click ";
	public static final String WIDTH = "Width";
	public static final String CUT_PREFIX = "Cut ";
	public static final String CUT_X = "x";
	public static final String CUT_Y = "y";
	public static final String CUT_VALUES = "Cut";

	private final ChainManager manager;

	public ChainExporter(final ChainManager manager) {
		this.manager = manager;
	}

	/**
	 * @return the JSON document of all chains of the manager
	 */
	public JSONObject toJSON() {
		final DataSource source = manager.getSource();
		final JSONObject chainsRecord = new JSONObject();
		final Map<String, Map<String, Profile>> profiles = manager.sampleAll();
		final List<Chain> chains = manager.getChains();
		for (int i = 0; i < chains.size(); i++) {
			final String label = manager.getKind().label(i + 1);
			chainsRecord.put(label, toJSON(chains.get(i), profiles.get(label), source));
		}
		if (!(source instanceof GriddedField)) return chainsRecord;
		final GriddedField field = (GriddedField) source;
		final JSONObject content = (field.is3D())
				? new JSONObject().put(String.valueOf(field.getZValue()), chainsRecord)
				: chainsRecord;
		return new JSONObject().put(field.getName(), content);
	}

	private static JSONObject toJSON(final Chain chain, final Map<String, Profile> profiles,
			final DataSource source) {
		final JSONObject record = new JSONObject();
		final JSONArray xClicks = new JSONArray();
		final JSONArray yClicks = new JSONArray();
		for (final ClickPoint click : chain.getPoints()) {
			final double[] coords = source.toPhysical(click.getX(), click.getY());
			xClicks.put(coords[0]);
			yClicks.put(coords[1]);
		}
		record.put(CLICK_PREFIX + source.getXName(), xClicks);
		record.put(CLICK_PREFIX + source.getYName(), yClicks);
		if (chain.getKind() == ChainKind.ORTHOGONAL) {
			record.put(WIDTH, new JSONArray(chain.getWidths()));
		}
		for (final Map.Entry<String, Profile> entry : profiles.entrySet()) {
			final Profile profile = entry.getValue();
			final JSONObject cut = new JSONObject();
			cut.put(CUT_X, toJSONArray(profile.xValues()));
			cut.put(CUT_Y, toJSONArray(profile.yValues()));
			cut.put(CUT_VALUES, toJSONArray(profile.values()));
			record.put(entry.getKey(), cut);
		}
		return record;
	}

	/* JSON has no representation for non-finite numbers: they become null */
	private static JSONArray toJSONArray(final double[] values) {
		final JSONArray array = new JSONArray();
		for (final double v : values) {
			if (Double.isFinite(v))
				array.put(v);
			else
				array.put(JSONObject.NULL);
		}
		return array;
	}

	/**
	 * Saves all chains to a new file. An existing file is never overwritten: a
	 * numeric suffix is appended to the file name instead.
	 *
	 * @param directory the output directory
	 * @param name      the file name, without extension. Only letters, digits,
	 *                  '_', '-', '/' and ':' are accepted
	 * @return the saved file
	 * @throws IllegalArgumentException if name is not valid
	 * @throws IOException if the file could not be written
	 */
	public File save(final File directory, final String name) throws IOException {
		final File file = NcCutUtils.getValidOutputFile(directory, name, EXTENSION);
		if (file == null) throw new IllegalArgumentException("Invalid file name: " + name);
		save(file);
		return file;
	}

	public void save(final File file) throws IOException {
		try (Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
			toJSON().write(writer, 2, 0);
		}
		NcCutUtils.log("Chains saved to " + file.getAbsolutePath());
	}

}
