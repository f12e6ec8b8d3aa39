package org.metricshub.jst;

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
import java.io.IOException;
import java.util.List;
import org.metricshub.jst.ast.AstBuilder;
import org.metricshub.jst.ast.CompileResult;
import org.metricshub.jst.ast.Program;
import org.metricshub.jst.backend.ProgramSession;
import org.metricshub.jst.backend.RuntimeState;
import org.metricshub.jst.backend.ScanCycleInterpreter;
import org.metricshub.jst.backend.VariableInitializer;
import org.metricshub.jst.frontend.ParseResult;
import org.metricshub.jst.frontend.StParser;
import org.metricshub.jst.frontend.SyntaxNode;
import org.metricshub.jst.jrt.Store;
import org.metricshub.jst.ladder.LadderTransformer;
import org.metricshub.jst.ladder.TransformOptions;
import org.metricshub.jst.ladder.TransformResult;
import org.metricshub.jst.util.Diagnostic;
import org.metricshub.jst.util.JstSettings;
import org.metricshub.jst.util.ScriptSource;

/**
 * Entry point into the parsing, execution and ladder transformation of a
 * Structured Text program, when Jst is used as a library.
 * <p>
 * The work happens in stages:
 * <ul>
 * <li>Parse the source, producing a syntax tree and syntax diagnostics.
 * <li>Build the typed AST ({@link Program}) with stable node ids.
 * <li>Initialize a {@link Store} from the declarations, then run scan
 * cycles against it, <strong>or</strong> transform the AST into a ladder
 * diagram.
 * </ul>
 * None of these methods throw for bad source or runtime faults: the problems
 * are returned as {@link Diagnostic}s.
 *
 * @see org.metricshub.jst.backend.ScanCycleInterpreter
 * @see org.metricshub.jst.ladder.LadderTransformer
 */
public class Jst {

	private final JstSettings settings;

	/**
	 * The last syntax tree produced by {@link #parse(String)} or
	 * {@link #compile(String)}.
	 */
	private SyntaxNode lastSyntaxTree;

	/**
	 * Create a new instance of Jst with the default settings
	 */
	public Jst() {
		this(JstSettings.DEFAULT_SETTINGS);
	}

	/**
	 * @param settings scan time, loop cap and ladder options
	 */
	public Jst(JstSettings settings) {
		this.settings = settings == null ? JstSettings.DEFAULT_SETTINGS : settings;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public JstSettings getSettings() {
		return settings;
	}

	/**
	 * @return the last syntax tree, or {@code null} if nothing was parsed
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public SyntaxNode getLastSyntaxTree() {
		return lastSyntaxTree;
	}

	/**
	 * @param source Structured Text source
	 * @return the syntax tree and the syntax errors
	 */
	public ParseResult parse(String source) {
		ParseResult result = new StParser().parse(source);
		lastSyntaxTree = result.getTree();
		return result;
	}

	/**
	 * @param source Structured Text source
	 * @return the syntax tree and the syntax errors
	 * @throws IOException when the source cannot be read
	 */
	public ParseResult parse(ScriptSource source) throws IOException {
		ParseResult result = new StParser().parse(source);
		lastSyntaxTree = result.getTree();
		return result;
	}

	/**
	 * Parses the source and builds its AST.
	 *
	 * @param source Structured Text source
	 * @return the program (empty on syntax errors) and every diagnostic
	 */
	public CompileResult compile(String source) {
		return new AstBuilder().build(parse(source));
	}

	/**
	 * @param source Structured Text source
	 * @return the program (empty on syntax errors) and every diagnostic
	 * @throws IOException when the source cannot be read
	 */
	public CompileResult compile(ScriptSource source) throws IOException {
		return new AstBuilder().build(parse(source));
	}

	/**
	 * @param program a program
	 * @return a fresh runtime state using the configured loop cap
	 */
	public RuntimeState createRuntimeState(Program program) {
		return new ScanCycleInterpreter(settings).createRuntimeState(program);
	}

	/**
	 * @param program a program
	 * @param store the store to initialize
	 * @return the initialization problems
	 */
	public List<Diagnostic> initializeVariables(Program program, Store store) {
		return new VariableInitializer().initializeVariables(program, store);
	}

	/**
	 * Runs one scan.
	 *
	 * @param program the program
	 * @param store its initialized store
	 * @param state its runtime state
	 * @param deltaMs elapsed time since the previous scan
	 * @return the faults and warnings of the scan
	 */
	public List<Diagnostic> runScanCycle(Program program, Store store, RuntimeState state, long deltaMs) {
		return new ScanCycleInterpreter(settings).runScanCycle(program, store, state, deltaMs);
	}

	/**
	 * Transforms a program with the ladder options of the settings.
	 *
	 * @param program the program
	 * @return the ladder graph and its warnings
	 */
	public TransformResult transform(Program program) {
		return transform(program, TransformOptions.from(settings));
	}

	public TransformResult transform(Program program, TransformOptions options) {
		return new LadderTransformer().transform(program, options);
	}

	/**
	 * @param source Structured Text source
	 * @param options ladder options
	 * @return the ladder graph and its warnings, syntax errors included
	 */
	public TransformResult transform(String source, TransformOptions options) {
		return new LadderTransformer().transform(source, options);
	}

	/**
	 * Compiles a program into a new session with an initialized store.
	 *
	 * @param source Structured Text source
	 * @return the session; its load diagnostics tell whether it compiled
	 */
	public ProgramSession load(String source) {
		ProgramSession session = new ProgramSession(settings);
		session.reload(source);
		return session;
	}
}
