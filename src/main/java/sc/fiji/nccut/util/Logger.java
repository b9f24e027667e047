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
package sc.fiji.nccut.util;

import org.scijava.Context;
import org.scijava.log.LogService;
import org.scijava.log.StderrLogService;
import org.scijava.plugin.Parameter;

import sc.fiji.nccut.NcCutPrefs;
import sc.fiji.nccut.NcCutUtils;

/**
 * Logs messages prefixed by the identifier of the calling component. Debug
 * messages are only emitted when debug mode is enabled (see
 * {@link NcCutPrefs#isDebugMode()}).
 *
 * Relies on the LogService of the SciJava context set in
 * {@link NcCutUtils#setContext(Context)}, or on a standard error logger when
 * no context exists.
 */
public class Logger {

	@Parameter
	private LogService logService;

	private boolean debug;
	private final String callerIdentifier;

	public Logger(final Class<?> clazz) {
		this(NcCutUtils.getContext(), clazz.getSimpleName());
	}

	/**
	 * Constructs a new Logger with the specified context and caller identifier.
	 *
	 * @param context the SciJava context for dependency injection, or null
	 * @param callerIdentifier the identifier for the calling class/component
	 */
	public Logger(final Context context, final String callerIdentifier) {
		if (context == null)
			logService = new StderrLogService();
		else
			context.inject(this);
		this.callerIdentifier = callerIdentifier;
		setDebug(NcCutUtils.isDebugMode() || NcCutPrefs.isDebugMode() || logService.isDebug());
	}

	public void info(final Object msg) {
		logService.info(callerIdentifier + ": " + msg);
	}

	/**
	 * Logs a debug message (only if debug mode is enabled).
	 *
	 * @param msg the debug message to log
	 */
	public void debug(final Object msg) {
		if (debug) logService.info(callerIdentifier + ": " + msg);
	}

	public void warn(final String string) {
		logService.warn(callerIdentifier + ": " + string);
	}

	public void error(final String string, final Throwable t) {
		logService.error(callerIdentifier + ": " + string, t);
	}

	public boolean isDebug() {
		return debug;
	}

	public void setDebug(final boolean debug) {
		this.debug = debug;
	}

}
