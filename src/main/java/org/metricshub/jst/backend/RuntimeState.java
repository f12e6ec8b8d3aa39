package org.metricshub.jst.backend;

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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.metricshub.jst.ast.Declaration;
import org.metricshub.jst.ast.Program;

/**
 * Per-program bookkeeping of the scan-cycle interpreter that does not belong
 * in the {@link org.metricshub.jst.jrt.Store}: the declaration table, the
 * loop cap, the re-entrance guard and the scan counters.
 */
public class RuntimeState {

	private final Map<String, Declaration> declarations = new HashMap<String, Declaration>();
	private final int maxLoopIterations;
	private boolean inScan;
	private long scanCount;
	private long elapsedMs;

	RuntimeState(Program program, int maxLoopIterations) {
		for (Declaration declaration : program.getDeclarations()) {
			declarations.put(declaration.getName(), declaration);
		}
		this.maxLoopIterations = maxLoopIterations;
	}

	/**
	 * @param name variable name
	 * @return the declaration, or {@code null} for a name the program does not declare
	 */
	public Declaration getDeclaration(String name) {
		return declarations.get(name);
	}

	Map<String, Declaration> getDeclarations() {
		return Collections.unmodifiableMap(declarations);
	}

	public int getMaxLoopIterations() {
		return maxLoopIterations;
	}

	/**
	 * @return the number of completed scans, faulted ones included
	 */
	public long getScanCount() {
		return scanCount;
	}

	/**
	 * @return the sum of the deltas of every completed scan, in milliseconds
	 */
	public long getElapsedMs() {
		return elapsedMs;
	}

	public boolean isInScan() {
		return inScan;
	}

	boolean enterScan() {
		if (inScan) {
			return false;
		}
		inScan = true;
		return true;
	}

	void exitScan(long deltaMs) {
		inScan = false;
		scanCount++;
		elapsedMs += deltaMs;
	}
}
