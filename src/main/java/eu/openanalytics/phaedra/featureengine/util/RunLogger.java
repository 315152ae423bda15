/**
 * Phaedra II
 *
 * Copyright (C) 2016-2025 Open Analytics
 *
 * ===========================================================================
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the Apache License as published by
 * The Apache Software Foundation, either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * Apache License for more details.
 *
 * You should have received a copy of the Apache License
 * along with this program.  If not, see <http://www.apache.org/licenses/>
 */
package eu.openanalytics.phaedra.featureengine.util;

import org.slf4j.Logger;

import eu.openanalytics.phaedra.featureengine.execution.RunContext;

/**
 * Logs messages of a run with a consistent prefix.
 */
public class RunLogger {

	private RunLogger() {
	}

	/**
	 * Important: never pass user input as formatString. To log an external string, pass "%s" as formatString
	 * and the string as the sole formatArg.
	 */
	public static void log(Logger logger, RunContext ctx, String formatString, Object... formatArgs) {
		logger.info(prefix(ctx) + String.format(formatString, formatArgs));
	}

	public static void debug(Logger logger, RunContext ctx, String formatString, Object... formatArgs) {
		if (logger.isDebugEnabled()) {
			logger.debug(prefix(ctx) + String.format(formatString, formatArgs));
		}
	}

	public static void error(Logger logger, RunContext ctx, Throwable ex, String formatString, Object... formatArgs) {
		logger.error(prefix(ctx) + String.format(formatString, formatArgs), ex);
	}

	private static String prefix(RunContext ctx) {
		return String.format("Run [R=%s M=%s] ", ctx.getRunId(), ctx.getMode());
	}
}
