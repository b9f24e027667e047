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

import java.io.File;
import java.text.DecimalFormat;
import java.text.NumberFormat;
import java.util.Locale;
import java.util.regex.Pattern;

import org.scijava.Context;
import org.scijava.log.LogService;
import org.scijava.log.StderrLogService;
import org.scijava.util.FileUtils;

/** Static utilities for NcCut **/
public class NcCutUtils {

	/* Output names may contain letters, digits, '_', '-', and path separators */
	private static final Pattern INVALID_NAME_CHARS = Pattern.compile("[^A-Za-z0-9_\\-/:]");

	private static Context context;
	private static LogService logService;
	private static boolean debug;

	private NcCutUtils() {}

	private static synchronized LogService logService() {
		if (logService == null) {
			logService = (context == null) ? new StderrLogService() : context.getService(LogService.class);
		}
		return logService;
	}

	/**
	 * Sets the SciJava context whose {@link LogService} should receive NcCut's
	 * messages. Without a context messages are printed to the standard error
	 * stream.
	 *
	 * @param context the context, or null to revert to standard error logging
	 */
	public static synchronized void setContext(final Context context) {
		NcCutUtils.context = context;
		logService = null;
	}

	public static synchronized Context getContext() {
		return context;
	}

	public static synchronized void log(final String string) {
		if (!isDebugMode()) return;
		logService().info("[NcCut] " + string);
	}

	public static synchronized void warn(final String string) {
		logService().warn("[NcCut] " + string);
	}

	public static synchronized void error(final String string) {
		logService().error("[NcCut] " + string);
	}

	public static synchronized void error(final String string, final Throwable t) {
		if (t == null)
			logService().error("[NcCut] " + string);
		else
			logService().error("[NcCut] " + string, t);
	}

	/**
	 * Assesses if NcCut is running in debug mode
	 *
	 * @return the debug flag
	 */
	public static boolean isDebugMode() {
		return debug;
	}

	/**
	 * Enables/disables debug mode
	 *
	 * @param b verbose flag
	 */
	public static void setDebugMode(final boolean b) {
		if (isDebugMode() && !b) {
			log("Exiting debug mode...");
		}
		debug = b;
		if (b) log("Entering debug mode...");
	}

	public static String stripExtension(final String filename) {
		final int lastDot = filename.lastIndexOf(".");
		return (lastDot > 0) ? filename.substring(0, lastDot) : filename;
	}

	/**
	 * Validates a user-proposed output name and resolves it against an output
	 * directory. Any extension typed by the user is discarded in favor of
	 * {@code extension}. If the resulting file already exists, a "(n)" suffix is
	 * appended until the name is free.
	 *
	 * @param directory the output directory
	 * @param name      the proposed file name, possibly including sub-directories
	 * @param extension the extension (including the leading dot) of the file type
	 * @return the output file, or null if {@code name} is blank, contains
	 *         characters other than letters, digits, '_', '-', '/' or ':', or
	 *         refers to a sub-directory that does not exist
	 */
	public static File getValidOutputFile(final File directory, final String name, final String extension) {
		if (name == null) return null;
		String fname = name;
		final int dot = fname.indexOf('.');
		if (dot >= 1) fname = fname.substring(0, dot);
		if (fname.isEmpty() || INVALID_NAME_CHARS.matcher(fname).find()) return null;
		final int lastSlash = fname.lastIndexOf('/');
		if (lastSlash >= 0 && !new File(directory, fname.substring(0, lastSlash + 1)).isDirectory()) return null;
		return getUniquelySuffixedFile(new File(directory, fname + extension));
	}

	/**
	 * @param referenceFile the preferred file
	 * @return {@code referenceFile} if it does not exist, otherwise the first
	 *         non-existing "name(n).ext" sibling. Never an existing file
	 */
	public static File getUniquelySuffixedFile(final File referenceFile) {
		if (!referenceFile.exists()) return referenceFile;
		final String extension = "." + FileUtils.getExtension(referenceFile);
		final String filenameWithoutExt = stripExtension(referenceFile.getName());
		for (int i = 1;; i++) {
			final File putativeUniqueFile = new File(referenceFile.getParentFile(),
					filenameWithoutExt + "(" + i + ")" + extension);
			if (!putativeUniqueFile.exists())
				return putativeUniqueFile;
		}
	}

	public static String formatDouble(final double value, final int digits) {
		return (Double.isNaN(value)) ? "NaN" : getDecimalFormat(value, digits).format(value);
	}

	public static DecimalFormat getDecimalFormat(final double value, final int digits) {
		final StringBuilder pattern = new StringBuilder("0.");
		while (pattern.length() < digits + 2)
			pattern.append("0");
		final double absValue = Math.abs(value);
		if ((absValue > 0 && absValue < 0.01) || absValue >= 1000) pattern.append("E0");
		final NumberFormat nf = NumberFormat.getNumberInstance(Locale.US);
		final DecimalFormat df = (DecimalFormat)nf;
		df.applyLocalizedPattern(pattern.toString());
		return df;
	}

}
