package org.metricshub.timewarp;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Time Warp
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.metricshub.timewarp.util.TwLogger;
import org.slf4j.Logger;

/**
 * Entry point of the stand-alone {@code timewarp} command.
 * To embed the engine in a host, use {@link TimeWarp}.
 */
public final class Main {

	private static final Logger LOG = TwLogger.getLogger(Main.class);

	private Main() {}

	/**
	 * Runs the program named on the command line and exits with
	 * {@link Cli#EXIT_OK}, {@link Cli#EXIT_RUNTIME_ERROR} or
	 * {@link Cli#EXIT_SYNTAX_ERROR}.
	 *
	 * @param args Command line arguments to the VM.
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		int code;
		try {
			code = new Cli().execute(args);
		} catch (Exception e) {
			LOG.debug("Unexpected failure", e);
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			code = Cli.EXIT_RUNTIME_ERROR;
		}
		System.exit(code);
	}
}
