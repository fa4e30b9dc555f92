package org.metricshub.timewarp.util;

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
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Locale;

/**
 * A simple container for the parameters of a Time Warp run.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when driving the engine programmatically, from within Java code.
 */
public class TwSettings {

	/**
	 * Shared defaults. Never modify this instance; create a new
	 * {@code TwSettings} instead.
	 */
	public static final TwSettings DEFAULT_SETTINGS = new TwSettings();

	/**
	 * Where the command line host reads input lines from.
	 * By default, this is {@link System#in}.
	 */
	private InputStream input = System.in;

	/**
	 * Where the command line host writes program output;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Locale used when the host formats numbers;
	 * <code>US-English</code> by default.
	 */
	private Locale locale = Locale.US;

	/**
	 * Width of a BASIC print zone, the column step of a <code>,</code>
	 * separator in <code>PRINT</code>.
	 */
	private int printZoneWidth = 14;

	/**
	 * Seed of <code>RND</code> and <code>random</code>. The same seed gives
	 * the same sequence, which keeps test runs reproducible.
	 */
	private long randomSeed = 1L;

	/**
	 * Whether Prolog unification refuses to bind a variable to a term that
	 * contains it. Off by default, like classic Prolog systems.
	 */
	private boolean occursCheck = false;

	/** Maximum depth of Pascal procedure and function activations. */
	private int maxCallDepth = 10000;

	/**
	 * Maximum number of instructions (BASIC, Pascal) or resolution steps
	 * (Prolog) of a whole run; <code>0</code> means unlimited.
	 */
	private long maxInstructions = 0L;

	/** Whether the command line host prints draw primitives as text. */
	private boolean graphicsTrace = false;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("locale = ").append(getLocale()).append(newLine);
		desc.append("printZoneWidth = ").append(getPrintZoneWidth()).append(newLine);
		desc.append("randomSeed = ").append(getRandomSeed()).append(newLine);
		desc.append("occursCheck = ").append(isOccursCheck()).append(newLine);
		desc.append("maxCallDepth = ").append(getMaxCallDepth()).append(newLine);
		desc.append("maxInstructions = ").append(getMaxInstructions()).append(newLine);
		desc.append("graphicsTrace = ").append(isGraphicsTrace()).append(newLine);

		return desc.toString();
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public InputStream getInput() {
		return input;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setInput(InputStream input) {
		this.input = input;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}

	public Locale getLocale() {
		return locale;
	}

	public void setLocale(Locale locale) {
		this.locale = locale;
	}

	public int getPrintZoneWidth() {
		return printZoneWidth;
	}

	/**
	 * @param printZoneWidth column width of a print zone, at least 1
	 */
	public void setPrintZoneWidth(int printZoneWidth) {
		if (printZoneWidth < 1) {
			throw new IllegalArgumentException("Print zone width must be positive: " + printZoneWidth);
		}
		this.printZoneWidth = printZoneWidth;
	}

	public long getRandomSeed() {
		return randomSeed;
	}

	public void setRandomSeed(long randomSeed) {
		this.randomSeed = randomSeed;
	}

	public boolean isOccursCheck() {
		return occursCheck;
	}

	public void setOccursCheck(boolean occursCheck) {
		this.occursCheck = occursCheck;
	}

	public int getMaxCallDepth() {
		return maxCallDepth;
	}

	public void setMaxCallDepth(int maxCallDepth) {
		if (maxCallDepth < 1) {
			throw new IllegalArgumentException("Maximum call depth must be positive: " + maxCallDepth);
		}
		this.maxCallDepth = maxCallDepth;
	}

	public long getMaxInstructions() {
		return maxInstructions;
	}

	/**
	 * @param maxInstructions instruction budget of a run, <code>0</code> for
	 *        no limit
	 */
	public void setMaxInstructions(long maxInstructions) {
		if (maxInstructions < 0) {
			throw new IllegalArgumentException("Instruction budget must not be negative: " + maxInstructions);
		}
		this.maxInstructions = maxInstructions;
	}

	public boolean isGraphicsTrace() {
		return graphicsTrace;
	}

	public void setGraphicsTrace(boolean graphicsTrace) {
		this.graphicsTrace = graphicsTrace;
	}
}
