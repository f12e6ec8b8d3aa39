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
import java.util.List;
import org.metricshub.jst.ast.Assignment;
import org.metricshub.jst.ast.CaseClause;
import org.metricshub.jst.ast.CaseLabel;
import org.metricshub.jst.ast.CaseStatement;
import org.metricshub.jst.ast.ConditionalBranch;
import org.metricshub.jst.ast.Declaration;
import org.metricshub.jst.ast.Expression;
import org.metricshub.jst.ast.ForStatement;
import org.metricshub.jst.ast.FunctionBlockCall;
import org.metricshub.jst.ast.IfStatement;
import org.metricshub.jst.ast.MemberRef;
import org.metricshub.jst.ast.OutputBinding;
import org.metricshub.jst.ast.ParameterBinding;
import org.metricshub.jst.ast.Program;
import org.metricshub.jst.ast.RepeatStatement;
import org.metricshub.jst.ast.Statement;
import org.metricshub.jst.ast.StorageClass;
import org.metricshub.jst.ast.VariableRef;
import org.metricshub.jst.ast.WhileStatement;
import org.metricshub.jst.jrt.FunctionBlockInstance;
import org.metricshub.jst.jrt.FunctionBlockType;
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
 * Executes one PLC scan cycle of a {@link Program} against a {@link Store}.
 * <p>
 * A scan has two phases: the statement pass runs the statements in source
 * order, then the time-advance pass adds the scan delta to every running
 * timer. A runtime fault abandons the rest of the statement pass; updates
 * made before the fault are kept and the time-advance pass still runs.
 * Faults and warnings are returned as diagnostics, never thrown.
 */
public class ScanCycleInterpreter {

	private static final Logger LOGGER = JstLogger.getLogger(ScanCycleInterpreter.class);

	/** How a statement completed */
	private enum Flow {
		NORMAL,
		EXIT,
		RETURN
	}

	private final JstSettings settings;
	private final VariableInitializer initializer = new VariableInitializer();

	public ScanCycleInterpreter() {
		this(JstSettings.DEFAULT_SETTINGS);
	}

	/**
	 * @param settings provides the loop iteration cap
	 */
	public ScanCycleInterpreter(JstSettings settings) {
		this.settings = settings == null ? JstSettings.DEFAULT_SETTINGS : settings;
	}

	/**
	 * @param program the program to run
	 * @return the state to pass to every {@link #runScanCycle} of this program
	 */
	public RuntimeState createRuntimeState(Program program) {
		return new RuntimeState(program, settings.getMaxLoopIterations());
	}

	/**
	 * Runs one scan cycle.
	 *
	 * @param program the program to run
	 * @param store variables and instances, initialized by {@link VariableInitializer}
	 * @param state the state created for this program
	 * @param deltaMs time elapsed since the previous scan, in milliseconds
	 * @return the runtime faults and warnings of this scan
	 */
	public List<Diagnostic> runScanCycle(Program program, Store store, RuntimeState state, long deltaMs) {
		if (deltaMs < 0) {
			throw new IllegalArgumentException("deltaMs must not be negative: " + deltaMs);
		}
		List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
		if (!state.enterScan()) {
			diagnostics.add(Diagnostic.runtimeFault("A scan cycle is already running on this runtime state", SourceSpan.UNKNOWN));
			return diagnostics;
		}
		try {
			Execution execution = new Execution(store, state, diagnostics);
			try {
				execution.resetTemporaries(program);
				execution.run(program.getStatements());
			} catch (StRuntimeException e) {
				LOGGER.debug("Runtime fault at {}: {}", e.getSpan(), e.getMessage());
				diagnostics.add(Diagnostic.runtimeFault(e.getMessage(), e.getSpan()));
			}
			store.updateTimers(deltaMs);
		} finally {
			state.exitScan(deltaMs);
		}
		return diagnostics;
	}

	/**
	 * State of one statement pass.
	 */
	private final class Execution {

		private final Store store;
		private final RuntimeState state;
		private final List<Diagnostic> diagnostics;
		private final ExpressionInterpreter evaluator;
		private int loopDepth;

		private Execution(Store store, RuntimeState state, List<Diagnostic> diagnostics) {
			this.store = store;
			this.state = state;
			this.diagnostics = diagnostics;
			this.evaluator = new ExpressionInterpreter(store, diagnostics);
		}

		private void resetTemporaries(Program program) {
			for (Declaration declaration : program.getDeclarations()) {
				if (declaration.getStorageClass() == StorageClass.VAR_TEMP) {
					initializer.reinitialize(declaration, store, diagnostics);
				}
			}
		}

		private Flow run(List<Statement> statements) {
			for (Statement statement : statements) {
				Flow flow = execute(statement);
				if (flow != Flow.NORMAL) {
					return flow;
				}
			}
			return Flow.NORMAL;
		}

		private Flow execute(Statement statement) {
			try {
				switch (statement.getKind()) {
				case ASSIGNMENT:
					assign((Assignment) statement);
					return Flow.NORMAL;
				case FB_CALL:
					call((FunctionBlockCall) statement);
					return Flow.NORMAL;
				case IF:
					return ifStatement((IfStatement) statement);
				case CASE:
					return caseStatement((CaseStatement) statement);
				case FOR:
					return forStatement((ForStatement) statement);
				case WHILE:
					return whileStatement((WhileStatement) statement);
				case REPEAT:
					return repeatStatement((RepeatStatement) statement);
				case RETURN:
					return Flow.RETURN;
				case EXIT:
					// EXIT outside a loop is ignored
					return loopDepth > 0 ? Flow.EXIT : Flow.NORMAL;
				default:
					throw new StRuntimeException(statement.getSpan(), "Unsupported statement " + statement.getKind());
				}
			} catch (StRuntimeException e) {
				if (!e.getSpan().isKnown()) {
					throw new StRuntimeException(statement.getSpan(), e.getMessage());
				}
				throw e;
			}
		}

		private void assign(Assignment assignment) {
			Value value = evaluator.evaluate(assignment.getValue());
			write(assignment.getTarget(), value, assignment.getSpan());
		}

		private void write(Expression target, Value value, SourceSpan span) {
			if (target instanceof VariableRef) {
				writeVariable(((VariableRef) target).getName(), value, span);
			} else if (target instanceof MemberRef) {
				MemberRef member = (MemberRef) target;
				writeMember(instance(member.getInstanceName(), span), member.getMember(), value, span);
			} else {
				throw new StRuntimeException(span, "Cannot assign to " + target);
			}
		}

		private void writeVariable(String name, Value value, SourceSpan span) {
			ValueKind kind = store.getKind(name);
			if (kind == null) {
				if (store.containsInstance(name)) {
					throw new StRuntimeException(span, "Cannot assign to function block instance '" + name + "'");
				}
				throw new StRuntimeException(span, "Undeclared variable '" + name + "'");
			}
			Declaration declaration = state.getDeclaration(name);
			if (declaration != null && declaration.isConstant()) {
				throw new StRuntimeException(span, "Cannot assign to CONSTANT '" + name + "'");
			}
			store.setValue(name, ExpressionInterpreter.coerce(value, kind, name, span));
		}

		private void writeMember(FunctionBlockInstance instance, String member, Value value, SourceSpan span) {
			ValueKind kind = instance.getType().getMemberKind(member);
			if (kind == null) {
				throw new StRuntimeException(span, instance.getType() + " instance '" + instance.getName() + "' has no member " + member);
			}
			instance.setMember(member, ExpressionInterpreter.coerce(value, kind, instance.getName() + "." + member, span));
		}

		private FunctionBlockInstance instance(String name, SourceSpan span) {
			FunctionBlockInstance instance = store.getInstance(name);
			if (instance == null) {
				if (store.containsVariable(name)) {
					throw new StRuntimeException(span, "'" + name + "' is not a function block instance");
				}
				throw new StRuntimeException(span, "Unknown function block instance '" + name + "'");
			}
			return instance;
		}

		/**
		 * Evaluates every bound input in source order, writes them (PT first
		 * for timers), executes the block, then copies the bound outputs.
		 */
		private void call(FunctionBlockCall call) {
			FunctionBlockInstance instance = instance(call.getInstanceName(), call.getSpan());
			List<Value> values = new ArrayList<Value>(call.getInputs().size());
			for (ParameterBinding input : call.getInputs()) {
				values.add(evaluator.evaluate(input.getValue()));
			}
			if (instance.getType().getCategory() == FunctionBlockType.Category.TIMER) {
				for (int i = 0; i < values.size(); i++) {
					ParameterBinding input = call.getInputs().get(i);
					if ("PT".equals(input.getParameter())) {
						writeMember(instance, input.getParameter(), values.get(i), input.getSpan());
					}
				}
			}
			for (int i = 0; i < values.size(); i++) {
				ParameterBinding input = call.getInputs().get(i);
				if (instance.getType().getCategory() != FunctionBlockType.Category.TIMER || !"PT".equals(input.getParameter())) {
					writeMember(instance, input.getParameter(), values.get(i), input.getSpan());
				}
			}
			instance.execute();
			for (OutputBinding output : call.getOutputs()) {
				if (!instance.getType().getOutputs().contains(output.getParameter())) {
					throw new StRuntimeException(output.getSpan(), instance.getType() + " has no output " + output.getParameter());
				}
				write(output.getTarget(), instance.getMember(output.getParameter()), output.getSpan());
			}
		}

		private Flow ifStatement(IfStatement statement) {
			for (ConditionalBranch branch : statement.getBranches()) {
				if (evaluator.evaluateCondition(branch.getCondition())) {
					return run(branch.getBody());
				}
			}
			return run(statement.getElseBody());
		}

		private Flow caseStatement(CaseStatement statement) {
			long selector = evaluator.evaluateInt(statement.getSelector());
			for (CaseClause clause : statement.getClauses()) {
				for (CaseLabel label : clause.getLabels()) {
					long low = evaluator.evaluateInt(label.getLow());
					boolean match = label.isRange() ? low <= selector && selector <= evaluator.evaluateInt(label.getHigh()) : low == selector;
					if (match) {
						return run(clause.getBody());
					}
				}
			}
			return run(statement.getElseBody());
		}

		private Flow forStatement(ForStatement statement) {
			String variable = statement.getVariable();
			if (store.getKind(variable) != ValueKind.INT) {
				throw new StRuntimeException(statement.getSpan(), "FOR loop variable '" + variable + "' must be a declared INT");
			}
			long from = evaluator.evaluateInt(statement.getFrom());
			long to = evaluator.evaluateInt(statement.getTo());
			long step = statement.getStep() == null ? 1 : evaluator.evaluateInt(statement.getStep());
			if (step == 0) {
				throw new StRuntimeException(statement.getSpan(), "FOR loop step must not be 0");
			}
			store.setValue(variable, Value.ofInt(from));
			int iterations = 0;
			loopDepth++;
			try {
				long i = from;
				while (step > 0 ? i <= to : i >= to) {
					iterations = countIteration(iterations, statement);
					Flow flow = run(statement.getBody());
					if (flow == Flow.EXIT) {
						break;
					}
					if (flow == Flow.RETURN) {
						return flow;
					}
					i = store.getValue(variable).asLong() + step;
					store.setValue(variable, Value.ofInt(i));
				}
			} finally {
				loopDepth--;
			}
			return Flow.NORMAL;
		}

		private Flow whileStatement(WhileStatement statement) {
			int iterations = 0;
			loopDepth++;
			try {
				while (evaluator.evaluateCondition(statement.getCondition())) {
					iterations = countIteration(iterations, statement);
					Flow flow = run(statement.getBody());
					if (flow == Flow.EXIT) {
						break;
					}
					if (flow == Flow.RETURN) {
						return flow;
					}
				}
			} finally {
				loopDepth--;
			}
			return Flow.NORMAL;
		}

		private Flow repeatStatement(RepeatStatement statement) {
			int iterations = 0;
			loopDepth++;
			try {
				do {
					iterations = countIteration(iterations, statement);
					Flow flow = run(statement.getBody());
					if (flow == Flow.EXIT) {
						break;
					}
					if (flow == Flow.RETURN) {
						return flow;
					}
				} while (!evaluator.evaluateCondition(statement.getCondition()));
			} finally {
				loopDepth--;
			}
			return Flow.NORMAL;
		}

		private int countIteration(int iterations, Statement loop) {
			if (iterations >= state.getMaxLoopIterations()) {
				throw new StRuntimeException(loop.getSpan(), "Loop exceeded " + state.getMaxLoopIterations() + " iterations");
			}
			return iterations + 1;
		}
	}
}
