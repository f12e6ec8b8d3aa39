package org.metricshub.jst.util;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jst
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
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A simple container for the parameters of a simulation session.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking Jst programmatically, from within Java code.
 */
public class JstSettings {

	/** Default settings, shared. Do not modify. */
	public static final JstSettings DEFAULT_SETTINGS = new JstSettings();

	/**
	 * Duration of one scan cycle, in milliseconds, used when the caller does
	 * not pass its own delta;
	 * <code>100</code> by default.
	 */
	private long scanTimeMs = 100;

	/**
	 * Number of scan cycles executed by the command line;
	 * <code>1</code> by default.
	 */
	private int scanCount = 1;

	/**
	 * Maximum number of iterations of a single FOR, WHILE or REPEAT
	 * statement within one scan before a runtime fault is raised;
	 * <code>100000</code> by default.
	 */
	private int maxLoopIterations = 100_000;

	/**
	 * Whether the ladder transformer skips unsupported constructs with a
	 * warning (<code>true</code>, the default) or renders them as
	 * "unsupported" marker nodes.
	 */
	private boolean warnOnUnsupported = true;

	/**
	 * Whether the ladder transformer also lowers assignments nested in
	 * IF and CASE bodies;
	 * <code>false</code> by default.
	 */
	private boolean includeIntermediates = false;

	/**
	 * Variable assignments applied after the variables are initialized
	 * (-v assignments). Values are ST literals, e.g. <code>TRUE</code>,
	 * <code>42</code>, <code>T#5s</code>.
	 */
	private Map<String, String> variables = new LinkedHashMap<String, String>();

	/**
	 * Output stream;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("scanTimeMs = ").append(getScanTimeMs()).append(newLine);
		desc.append("scanCount = ").append(getScanCount()).append(newLine);
		desc.append("maxLoopIterations = ").append(getMaxLoopIterations()).append(newLine);
		desc.append("warnOnUnsupported = ").append(isWarnOnUnsupported()).append(newLine);
		desc.append("includeIntermediates = ").append(isIncludeIntermediates()).append(newLine);
		desc.append("variables = ").append(getVariables()).append(newLine);

		return desc.toString();
	}

	public long getScanTimeMs() {
		return scanTimeMs;
	}

	/**
	 * @param scanTimeMs duration of one scan, must not be negative
	 */
	public void setScanTimeMs(long scanTimeMs) {
		if (scanTimeMs < 0) {
			throw new IllegalArgumentException("Scan time must not be negative: " + scanTimeMs);
		}
		this.scanTimeMs = scanTimeMs;
	}

	public int getScanCount() {
		return scanCount;
	}

	/**
	 * @param scanCount number of scans run by the command line, must not be negative
	 */
	public void setScanCount(int scanCount) {
		if (scanCount < 0) {
			throw new IllegalArgumentException("Scan count must not be negative: " + scanCount);
		}
		this.scanCount = scanCount;
	}

	public int getMaxLoopIterations() {
		return maxLoopIterations;
	}

	/**
	 * @param maxLoopIterations iteration cap of a single loop statement, at least 1
	 */
	public void setMaxLoopIterations(int maxLoopIterations) {
		if (maxLoopIterations < 1) {
			throw new IllegalArgumentException("Loop iteration cap must be at least 1: " + maxLoopIterations);
		}
		this.maxLoopIterations = maxLoopIterations;
	}

	public boolean isWarnOnUnsupported() {
		return warnOnUnsupported;
	}

	public void setWarnOnUnsupported(boolean warnOnUnsupported) {
		this.warnOnUnsupported = warnOnUnsupported;
	}

	public boolean isIncludeIntermediates() {
		return includeIntermediates;
	}

	public void setIncludeIntermediates(boolean includeIntermediates) {
		this.includeIntermediates = includeIntermediates;
	}

	/**
	 * @return the live map of -v assignments, in insertion order
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Map<String, String> getVariables() {
		return variables;
	}

	/**
	 * Adds a -v assignment.
	 *
	 * @param name variable name
	 * @param literal ST literal to assign
	 */
	public void putVariable(String name, String literal) {
		variables.put(name, literal);
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}
}
