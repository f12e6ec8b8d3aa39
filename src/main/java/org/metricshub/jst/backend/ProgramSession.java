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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.jst.ast.AstBuilder;
import org.metricshub.jst.ast.CompileResult;
import org.metricshub.jst.ast.Program;
import org.metricshub.jst.frontend.StParser;
import org.metricshub.jst.jrt.StRuntimeException;
import org.metricshub.jst.jrt.Store;
import org.metricshub.jst.jrt.Value;
import org.metricshub.jst.jrt.ValueKind;
import org.metricshub.jst.util.Diagnostic;
import org.metricshub.jst.util.JstLogger;
import org.metricshub.jst.util.JstSettings;
import org.metricshub.jst.util.SourceSpan;
import org.slf4j.Logger;

/**
 * Owns one loaded program with its {@link Store} and {@link RuntimeState},
 * and drives its scans.
 * <p>
 * The store is created once and kept across scans; {@link #reload(String)}
 * compiles a new source, then clears and reinitializes the store.
 */
public class ProgramSession {

	private static final Logger LOGGER = JstLogger.getLogger(ProgramSession.class);

	private final JstSettings settings;
	private final ScanCycleInterpreter interpreter;
	private final VariableInitializer initializer = new VariableInitializer();
	private final Store store = new Store();
	private Program program = Program.empty();
	private RuntimeState runtimeState;
	private List<Diagnostic> loadDiagnostics = Collections.emptyList();

	public ProgramSession() {
		this(JstSettings.DEFAULT_SETTINGS);
	}

	public ProgramSession(JstSettings settings) {
		this.settings = settings == null ? JstSettings.DEFAULT_SETTINGS : settings;
		this.interpreter = new ScanCycleInterpreter(this.settings);
		this.runtimeState = interpreter.createRuntimeState(program);
	}

	/**
	 * Compiles and loads a program. On syntax errors the session holds an
	 * empty program.
	 *
	 * @param source Structured Text source
	 * @return the compilation and initialization diagnostics
	 */
	public List<Diagnostic> reload(String source) {
		CompileResult compiled = new AstBuilder().build(new StParser().parse(source));
		return load(compiled.getProgram(), compiled.getDiagnostics());
	}

	/**
	 * Loads an already compiled program.
	 *
	 * @param newProgram the program
	 * @return the initialization diagnostics
	 */
	public List<Diagnostic> load(Program newProgram) {
		return load(newProgram, Collections.<Diagnostic>emptyList());
	}

	private List<Diagnostic> load(Program newProgram, List<Diagnostic> compileDiagnostics) {
		List<Diagnostic> diagnostics = new ArrayList<Diagnostic>(compileDiagnostics);
		program = newProgram;
		diagnostics.addAll(initializer.clearAndInitialize(program, store));
		runtimeState = interpreter.createRuntimeState(program);
		loadDiagnostics = Collections.unmodifiableList(diagnostics);
		LOGGER.debug("Loaded program '{}' with {} diagnostic(s)", program.getName(), diagnostics.size());
		return loadDiagnostics;
	}

	/**
	 * Runs one scan with the configured scan time.
	 *
	 * @return the diagnostics of the scan
	 */
	public List<Diagnostic> scan() {
		return scan(settings.getScanTimeMs());
	}

	/**
	 * @param deltaMs elapsed time since the previous scan
	 * @return the diagnostics of the scan
	 */
	public List<Diagnostic> scan(long deltaMs) {
		return interpreter.runScanCycle(program, store, runtimeState, deltaMs);
	}

	/**
	 * Writes a declared variable from outside the program, e.g. an input
	 * forced by the user.
	 *
	 * @param name variable name
	 * @param value new value, converted to the declared type where allowed
	 * @throws StRuntimeException when the variable does not exist or the
	 *         value does not fit
	 */
	public void assign(String name, Value value) {
		ValueKind kind = store.getKind(name);
		if (kind == null) {
			throw new StRuntimeException("Undeclared variable '" + name + "'");
		}
		store.setValue(name, ExpressionInterpreter.coerce(value, kind, name, SourceSpan.UNKNOWN));
	}

	public Program getProgram() {
		return program;
	}

	public Store getStore() {
		return store;
	}

	public RuntimeState getRuntimeState() {
		return runtimeState;
	}

	/**
	 * @return the diagnostics of the last load
	 */
	public List<Diagnostic> getLoadDiagnostics() {
		return loadDiagnostics;
	}

	public long getScanCount() {
		return runtimeState.getScanCount();
	}

	public long getElapsedMs() {
		return runtimeState.getElapsedMs();
	}
}
