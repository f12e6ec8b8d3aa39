package org.metricshub.jst.ladder;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jst.ast.Assignment;
import org.metricshub.jst.ast.AstBuilder;
import org.metricshub.jst.ast.BinaryOp;
import org.metricshub.jst.ast.BinaryOperator;
import org.metricshub.jst.ast.CaseClause;
import org.metricshub.jst.ast.CaseLabel;
import org.metricshub.jst.ast.CaseStatement;
import org.metricshub.jst.ast.CompileResult;
import org.metricshub.jst.ast.ConditionalBranch;
import org.metricshub.jst.ast.Declaration;
import org.metricshub.jst.ast.Expression;
import org.metricshub.jst.ast.FunctionBlockCall;
import org.metricshub.jst.ast.FunctionCall;
import org.metricshub.jst.ast.IfStatement;
import org.metricshub.jst.ast.Literal;
import org.metricshub.jst.ast.MemberRef;
import org.metricshub.jst.ast.OutputBinding;
import org.metricshub.jst.ast.ParameterBinding;
import org.metricshub.jst.ast.Program;
import org.metricshub.jst.ast.StandardFunction;
import org.metricshub.jst.ast.Statement;
import org.metricshub.jst.ast.UnaryOp;
import org.metricshub.jst.ast.UnaryOperator;
import org.metricshub.jst.ast.VariableRef;
import org.metricshub.jst.frontend.StParser;
import org.metricshub.jst.jrt.FunctionBlockType;
import org.metricshub.jst.jrt.Value;
import org.metricshub.jst.jrt.ValueKind;
import org.metricshub.jst.util.Diagnostic;
import org.metricshub.jst.util.JstLogger;
import org.slf4j.Logger;

/**
 * Converts a {@link Program} into an equivalent ladder diagram.
 * <p>
 * Every top-level boolean assignment becomes one rung running from a left
 * power rail through the contact network of the expression to a coil and a
 * right power rail. AND becomes a series connection, OR parallel branches
 * opening and closing at junctions, NOT a normally-closed contact (pushed
 * down compound expressions with De Morgan's laws), and comparisons become
 * comparator boxes. Timer and counter calls become one rung ending with the
 * function block box.
 * <p>
 * The transformation is a pure function of the program: it never reads a
 * store and never throws for a valid program. Statements without a ladder
 * equivalent are skipped with a warning, or rendered as an
 * <code>unsupported</code> marker node, depending on the
 * {@link TransformOptions}.
 */
public class LadderTransformer {

	private static final Logger LOGGER = JstLogger.getLogger(LadderTransformer.class);

	static final int COLUMN_WIDTH = 150;
	static final int ROW_HEIGHT = 100;
	static final int MARGIN = 50;

	/**
	 * Parses and builds the source, then transforms it. Syntax errors are
	 * returned as warnings along with an empty graph.
	 *
	 * @param source Structured Text source
	 * @param options transformation options
	 * @return the graph and the warnings
	 */
	public TransformResult transform(String source, TransformOptions options) {
		CompileResult compiled = new AstBuilder().build(new StParser().parse(source));
		if (compiled.hasErrors()) {
			List<Diagnostic> warnings = new ArrayList<Diagnostic>();
			for (Diagnostic diagnostic : compiled.getDiagnostics()) {
				if (diagnostic.isError()) {
					warnings.add(Diagnostic.warning(diagnostic.getMessage(), diagnostic.getSpan()));
				}
			}
			return new TransformResult(new LadderGraph(), warnings);
		}
		return transform(compiled.getProgram(), options);
	}

	/**
	 * @param program the program to transform
	 * @param options transformation options
	 * @return the graph and the warnings about skipped statements
	 */
	public TransformResult transform(Program program, TransformOptions options) {
		Transformation transformation = new Transformation(program, options == null ? new TransformOptions() : options);
		for (Statement statement : program.getStatements()) {
			transformation.statement(statement, new Series(), false);
		}
		LOGGER.debug(
				"Transformed program '{}' into {} rung(s), {} warning(s)",
				program.getName(),
				transformation.rungCount,
				transformation.warnings.size());
		return new TransformResult(transformation.graph, transformation.warnings);
	}

	static int x(int column) {
		return column * COLUMN_WIDTH + MARGIN;
	}

	static int y(int row) {
		return row * ROW_HEIGHT + MARGIN;
	}

	// CIRCUITS

	/** A contact network before layout */
	private abstract static class Circuit {}

	/** One node */
	private static final class Element extends Circuit {
		private final String id;
		private final LadderNodeType type;
		private final Map<String, Object> data = new LinkedHashMap<String, Object>();

		private Element(String id, LadderNodeType type) {
			this.id = id;
			this.type = type;
		}

		private Element with(String key, Object value) {
			data.put(key, value);
			return this;
		}
	}

	/** Parts connected one after the other; no part is a plain wire */
	private static final class Series extends Circuit {
		private final List<Circuit> parts = new ArrayList<Circuit>();

		private Series add(Circuit circuit) {
			if (circuit instanceof Series) {
				parts.addAll(((Series) circuit).parts);
			} else {
				parts.add(circuit);
			}
			return this;
		}
	}

	/** Branches between a split and a merge junction */
	private static final class Parallel extends Circuit {
		private final String id;
		private final List<Circuit> branches = new ArrayList<Circuit>();

		private Parallel(String id) {
			this.id = id;
		}

		private Parallel add(Circuit circuit) {
			if (circuit instanceof Parallel) {
				branches.addAll(((Parallel) circuit).branches);
			} else {
				branches.add(circuit);
			}
			return this;
		}
	}

	private static Circuit series(Circuit... circuits) {
		Series series = new Series();
		for (Circuit circuit : circuits) {
			series.add(circuit);
		}
		return series.parts.size() == 1 ? series.parts.get(0) : series;
	}

	/** Placed circuit: its output nodes, the next free column and the rows it spans */
	private static final class Placement {
		private final List<String> outputs;
		private final int nextColumn;
		private final int height;

		private Placement(List<String> outputs, int nextColumn, int height) {
			this.outputs = outputs;
			this.nextColumn = nextColumn;
			this.height = height;
		}
	}

	/** Raised while lowering a statement that has no ladder equivalent */
	private static final class UnsupportedConstructException extends Exception {
		private static final long serialVersionUID = 1L;

		private UnsupportedConstructException(String message) {
			super(message);
		}
	}

	/**
	 * State of one transformation.
	 */
	private static final class Transformation {

		private final Program program;
		private final TransformOptions options;
		private final LadderGraph graph = new LadderGraph();
		private final List<Diagnostic> warnings = new ArrayList<Diagnostic>();
		private int rowOffset;
		private int rungCount;

		private Transformation(Program program, TransformOptions options) {
			this.program = program;
			this.options = options;
		}

		// STATEMENTS

		private void statement(Statement statement, Circuit guard, boolean nested) {
			try {
				switch (statement.getKind()) {
				case ASSIGNMENT:
					assignment((Assignment) statement, guard);
					break;
				case FB_CALL:
					call((FunctionBlockCall) statement, guard);
					break;
				case IF:
					ifStatement((IfStatement) statement, guard);
					break;
				case CASE:
					caseStatement((CaseStatement) statement, guard);
					break;
				case FOR:
				case WHILE:
				case REPEAT:
					throw new UnsupportedConstructException(statement.getKind() + " loop has no ladder equivalent");
				default:
					throw new UnsupportedConstructException(statement.getKind() + " statement has no ladder equivalent");
				}
			} catch (UnsupportedConstructException e) {
				unsupported(statement, nested ? e.getMessage() + " (nested)" : e.getMessage());
			}
		}

		private void assignment(Assignment assignment, Circuit guard) throws UnsupportedConstructException {
			Expression target = assignment.getTarget();
			Expression value = assignment.getValue();
			if (isBooleanTarget(target, value)) {
				Element coil = new Element(assignment.getId() + ":coil", LadderNodeType.COIL)
						.with("variable", target.toString())
						.with("coilType", "normal");
				emit(assignment.getId().getValue(), series(guard, lower(value, false)), coil);
				return;
			}
			if (value instanceof MemberRef) {
				Declaration instance = program.findDeclaration(((MemberRef) value).getInstanceName());
				if (instance != null && instance.isFunctionBlock()) {
					Element box = functionBlockBox(instance, assignment.getId() + ":" + instance.getName(), null);
					if (box != null) {
						emit(assignment.getId().getValue(), guard, box);
						return;
					}
				}
			}
			throw new UnsupportedConstructException("Assignment of a non-boolean value to " + target + " has no ladder equivalent");
		}

		private void call(FunctionBlockCall call, Circuit guard) throws UnsupportedConstructException {
			Declaration instance = program.findDeclaration(call.getInstanceName());
			if (instance == null || !instance.isFunctionBlock()) {
				throw new UnsupportedConstructException("Call of unknown function block instance '" + call.getInstanceName() + "'");
			}
			Element box = functionBlockBox(instance, call.getId() + ":" + instance.getName(), call);
			if (box == null) {
				throw new UnsupportedConstructException(instance.getTypeName() + " function block has no ladder equivalent");
			}
			FunctionBlockType type = instance.getDataType().getFunctionBlockType();
			Expression enable;
			if (type.getCategory() == FunctionBlockType.Category.TIMER) {
				enable = call.findInput("IN");
			} else if (type == FunctionBlockType.CTD) {
				enable = call.findInput("CD");
			} else {
				enable = call.findInput("CU") != null ? call.findInput("CU") : call.findInput("CD");
			}
			Circuit network = enable == null ? new Series() : lower(enable, false);
			List<Element> tail = new ArrayList<Element>();
			tail.add(box);
			for (OutputBinding output : call.getOutputs()) {
				if ("Q".equals(output.getParameter())) {
					tail.add(new Element(call.getId() + ":coil", LadderNodeType.COIL)
							.with("variable", output.getTarget().toString())
							.with("coilType", "normal"));
					break;
				}
			}
			emit(call.getId().getValue(), series(guard, network), tail.toArray(new Element[0]));
		}

		/**
		 * @return the timer or counter box of an instance, {@code null} for
		 *         other function blocks
		 */
		private Element functionBlockBox(Declaration instance, String id, FunctionBlockCall call) {
			FunctionBlockType type = instance.getDataType().getFunctionBlockType();
			if (type.getCategory() == FunctionBlockType.Category.TIMER) {
				Expression preset = preset(instance, call, "PT");
				return new Element(id, LadderNodeType.TIMER)
						.with("instanceName", instance.getName())
						.with("timerType", type.name())
						.with("presetTime", preset == null ? Value.ZERO_TIME.toString() : preset.toString());
			}
			if (type.getCategory() == FunctionBlockType.Category.COUNTER) {
				Expression preset = preset(instance, call, "PV");
				Object presetValue = 0L;
				if (preset instanceof Literal && ((Literal) preset).getValue().getKind() == ValueKind.INT) {
					presetValue = ((Literal) preset).getValue().asLong();
				} else if (preset != null) {
					presetValue = preset.toString();
				}
				return new Element(id, LadderNodeType.COUNTER)
						.with("instanceName", instance.getName())
						.with("counterType", type.name())
						.with("presetValue", presetValue);
			}
			return null;
		}

		/**
		 * @return the input bound in the call, else the declared preset, else {@code null}
		 */
		private static Expression preset(Declaration instance, FunctionBlockCall call, String parameter) {
			if (call != null && call.findInput(parameter) != null) {
				return call.findInput(parameter);
			}
			for (ParameterBinding binding : instance.getPresets()) {
				if (binding.getParameter().equals(parameter)) {
					return binding.getValue();
				}
			}
			return null;
		}

		private void ifStatement(IfStatement statement, Circuit guard) throws UnsupportedConstructException {
			if (isSetReset(statement)) {
				ConditionalBranch branch = statement.getBranches().get(0);
				Circuit condition = lower(branch.getCondition(), false);
				for (Statement body : branch.getBody()) {
					Assignment assignment = (Assignment) body;
					boolean set = ((Literal) assignment.getValue()).getValue().asBool();
					Element coil = new Element(assignment.getId() + ":coil", LadderNodeType.COIL)
							.with("variable", assignment.getTarget().toString())
							.with("coilType", set ? "set" : "reset");
					emit(assignment.getId().getValue(), series(guard, condition), coil);
				}
				return;
			}
			if (!options.isIncludeIntermediates()) {
				throw new UnsupportedConstructException("IF statement has no ladder equivalent unless intermediate statements are included");
			}
			List<Circuit> earlier = new ArrayList<Circuit>();
			for (ConditionalBranch branch : statement.getBranches()) {
				Circuit condition = lower(branch.getCondition(), false);
				Circuit branchGuard = series(guard, series(earlier.toArray(new Circuit[0])), condition);
				for (Statement body : branch.getBody()) {
					statement(body, branchGuard, true);
				}
				earlier.add(lower(branch.getCondition(), true));
			}
			Circuit elseGuard = series(guard, series(earlier.toArray(new Circuit[0])));
			for (Statement body : statement.getElseBody()) {
				statement(body, elseGuard, true);
			}
		}

		/**
		 * <code>IF c THEN X := TRUE; Y := FALSE; END_IF</code> without ELSIF or
		 * ELSE maps to set and reset coils.
		 */
		private static boolean isSetReset(IfStatement statement) {
			if (statement.getBranches().size() != 1 || statement.hasElse()) {
				return false;
			}
			List<Statement> body = statement.getBranches().get(0).getBody();
			if (body.isEmpty()) {
				return false;
			}
			for (Statement st : body) {
				if (!(st instanceof Assignment)) {
					return false;
				}
				Expression value = ((Assignment) st).getValue();
				if (!(value instanceof Literal) || ((Literal) value).getValue().getKind() != ValueKind.BOOL) {
					return false;
				}
			}
			return true;
		}

		private void caseStatement(CaseStatement statement, Circuit guard) throws UnsupportedConstructException {
			if (!options.isIncludeIntermediates()) {
				throw new UnsupportedConstructException("CASE statement has no ladder equivalent unless intermediate statements are included");
			}
			String selector = statement.getSelector().toString();
			List<Circuit> notMatched = new ArrayList<Circuit>();
			for (CaseClause clause : statement.getClauses()) {
				Parallel matched = new Parallel(clause.getId() + ":labels");
				for (CaseLabel label : clause.getLabels()) {
					String id = label.getLow().getId().getValue();
					if (label.isRange()) {
						matched.add(series(
								comparator(id + "~ge", BinaryOperator.GE, selector, label.getLow().toString()),
								comparator(id + "~le", BinaryOperator.LE, selector, label.getHigh().toString())));
						notMatched.add(new Parallel(id + ":outside")
								.add(comparator(id + "~lt", BinaryOperator.LT, selector, label.getLow().toString()))
								.add(comparator(id + "~gt", BinaryOperator.GT, selector, label.getHigh().toString())));
					} else {
						matched.add(comparator(id, BinaryOperator.EQ, selector, label.getLow().toString()));
						notMatched.add(comparator(id + "~ne", BinaryOperator.NE, selector, label.getLow().toString()));
					}
				}
				Circuit clauseGuard = series(guard, matched.branches.size() == 1 ? matched.branches.get(0) : matched);
				for (Statement body : clause.getBody()) {
					statement(body, clauseGuard, true);
				}
			}
			Circuit elseGuard = series(guard, series(notMatched.toArray(new Circuit[0])));
			for (Statement body : statement.getElseBody()) {
				statement(body, elseGuard, true);
			}
		}

		private void unsupported(Statement statement, String reason) {
			LOGGER.debug("Unsupported statement at {}: {}", statement.getSpan(), reason);
			if (options.isWarnOnUnsupported()) {
				warnings.add(Diagnostic.warning("Skipped: " + reason, statement.getSpan()));
				return;
			}
			Element marker = new Element(statement.getId() + ":unsupported", LadderNodeType.UNSUPPORTED)
					.with("statementKind", statement.getKind().name())
					.with("text", statement.toString())
					.with("reason", reason);
			emit(statement.getId().getValue(), new Series(), marker);
		}

		// EXPRESSIONS

		/**
		 * Lowers a boolean expression into a contact network.
		 *
		 * @param expression the expression
		 * @param negated whether the network must conduct when the expression is FALSE
		 */
		private Circuit lower(Expression expression, boolean negated) throws UnsupportedConstructException {
			return lower(expression, negated, "");
		}

		private Circuit lower(Expression expression, boolean negated, String variant) throws UnsupportedConstructException {
			String id = expression.getId() + variant;
			switch (expression.getKind()) {
			case LITERAL:
				Value value = ((Literal) expression).getValue();
				if (value.getKind() != ValueKind.BOOL) {
					break;
				}
				if (value.asBool() != negated) {
					// always conducts
					return new Series();
				}
				return new Element(id, LadderNodeType.CONTACT)
						.with("variable", "FALSE")
						.with("contactType", "NO")
						.with("constant", Boolean.TRUE);
			case VARIABLE:
			case MEMBER:
				return new Element(id, LadderNodeType.CONTACT)
						.with("variable", expression.toString())
						.with("contactType", negated ? "NC" : "NO");
			case UNARY:
				UnaryOp unary = (UnaryOp) expression;
				if (unary.getOperator() == UnaryOperator.NOT) {
					return lower(unary.getOperand(), !negated, variant);
				}
				break;
			case BINARY:
				return lowerBinary((BinaryOp) expression, negated, id, variant);
			default:
				break;
			}
			throw new UnsupportedConstructException("Expression " + expression + " cannot be expressed with contacts");
		}

		private Circuit lowerBinary(BinaryOp op, boolean negated, String id, String variant) throws UnsupportedConstructException {
			Expression left = op.getLeft();
			Expression right = op.getRight();
			switch (op.getOperator()) {
			case AND:
				if (negated) {
					return new Parallel(id).add(lower(left, true, variant)).add(lower(right, true, variant));
				}
				return series(lower(left, false, variant), lower(right, false, variant));
			case OR:
				if (negated) {
					return series(lower(left, true, variant), lower(right, true, variant));
				}
				return new Parallel(id).add(lower(left, false, variant)).add(lower(right, false, variant));
			case XOR:
				// A XOR B = (A AND NOT B) OR (NOT A AND B)
				return new Parallel(id)
						.add(series(lower(left, false, variant + "~a"), lower(right, !negated, variant + "~a")))
						.add(series(lower(left, true, variant + "~b"), lower(right, negated, variant + "~b")));
			default:
				if (op.getOperator().isComparison()) {
					BinaryOperator operator = negated ? op.getOperator().negate() : op.getOperator();
					return comparator(id, operator, left.toString(), right.toString());
				}
				throw new UnsupportedConstructException("Arithmetic expression " + op + " cannot be expressed with contacts");
			}
		}

		private static Element comparator(String id, BinaryOperator operator, String left, String right) {
			return new Element(id, LadderNodeType.COMPARATOR)
					.with("operator", operator.getSymbol())
					.with("left", left)
					.with("right", right);
		}

		private boolean isBooleanTarget(Expression target, Expression value) {
			if (target instanceof VariableRef) {
				Declaration declaration = program.findDeclaration(((VariableRef) target).getName());
				if (declaration != null) {
					return !declaration.isFunctionBlock() && declaration.getDataType().getValueKind() == ValueKind.BOOL;
				}
			} else if (target instanceof MemberRef) {
				ValueKind kind = memberKind((MemberRef) target);
				if (kind != null) {
					return kind == ValueKind.BOOL;
				}
			}
			return isBooleanShape(value);
		}

		/**
		 * Tells whether an expression looks boolean when the declarations
		 * cannot tell.
		 */
		private boolean isBooleanShape(Expression expression) {
			switch (expression.getKind()) {
			case LITERAL:
				return ((Literal) expression).getValue().getKind() == ValueKind.BOOL;
			case VARIABLE:
				Declaration declaration = program.findDeclaration(((VariableRef) expression).getName());
				return declaration == null || declaration.getDataType().getValueKind() == ValueKind.BOOL;
			case MEMBER:
				ValueKind kind = memberKind((MemberRef) expression);
				return kind == null || kind == ValueKind.BOOL;
			case UNARY:
				UnaryOp unary = (UnaryOp) expression;
				return unary.getOperator() == UnaryOperator.NOT && isBooleanShape(unary.getOperand());
			case BINARY:
				BinaryOp op = (BinaryOp) expression;
				if (op.getOperator().isComparison()) {
					return true;
				}
				return op.getOperator().isLogical() && isBooleanShape(op.getLeft()) && isBooleanShape(op.getRight());
			case CALL:
				return ((FunctionCall) expression).getFunction() == StandardFunction.TO_BOOL;
			default:
				return false;
			}
		}

		private ValueKind memberKind(MemberRef member) {
			Declaration declaration = program.findDeclaration(member.getInstanceName());
			if (declaration == null || !declaration.isFunctionBlock()) {
				return null;
			}
			return declaration.getDataType().getFunctionBlockType().getMemberKind(member.getMember());
		}

		// LAYOUT

		/**
		 * Lays out one rung below the previous ones: left rail, network, tail
		 * elements, right rail.
		 */
		private void emit(String rungId, Circuit network, Element... tail) {
			int row = rowOffset;
			LadderNode left = graph.addNode(rungId + ":left", LadderNodeType.POWER_RAIL, x(0), y(row), rail("left"));
			Placement placement = place(network, Collections.singletonList(left.getId()), 1, row);
			List<String> outputs = placement.outputs;
			int column = placement.nextColumn;
			for (Element element : tail) {
				Placement placed = place(element, outputs, column, row);
				outputs = placed.outputs;
				column = placed.nextColumn;
			}
			LadderNode right = graph.addNode(rungId + ":right", LadderNodeType.POWER_RAIL, x(column), y(row), rail("right"));
			for (String output : outputs) {
				graph.addEdge(output, right.getId());
			}
			rowOffset += placement.height;
			rungCount++;
		}

		private static Map<String, Object> rail(String side) {
			Map<String, Object> data = new LinkedHashMap<String, Object>();
			data.put("side", side);
			return data;
		}

		private Placement place(Circuit circuit, List<String> inputs, int column, int row) {
			if (circuit instanceof Element) {
				Element element = (Element) circuit;
				LadderNode node = graph.addNode(element.id, element.type, x(column), y(row), element.data);
				for (String input : inputs) {
					graph.addEdge(input, node.getId());
				}
				return new Placement(Collections.singletonList(node.getId()), column + 1, 1);
			}
			if (circuit instanceof Series) {
				List<String> outputs = inputs;
				int next = column;
				int height = 1;
				for (Circuit part : ((Series) circuit).parts) {
					Placement placed = place(part, outputs, next, row);
					outputs = placed.outputs;
					next = placed.nextColumn;
					height = Math.max(height, placed.height);
				}
				return new Placement(outputs, next, height);
			}
			Parallel parallel = (Parallel) circuit;
			LadderNode split = graph.addNode(parallel.id + ":split", LadderNodeType.JUNCTION, x(column), y(row), junction("split"));
			for (String input : inputs) {
				graph.addEdge(input, split.getId());
			}
			List<Placement> branches = new ArrayList<Placement>();
			int branchRow = row;
			int mergeColumn = column + 1;
			for (Circuit branch : parallel.branches) {
				Placement placed = place(branch, Collections.singletonList(split.getId()), column + 1, branchRow);
				branches.add(placed);
				branchRow += placed.height;
				mergeColumn = Math.max(mergeColumn, placed.nextColumn);
			}
			LadderNode merge = graph.addNode(parallel.id + ":merge", LadderNodeType.JUNCTION, x(mergeColumn), y(row), junction("merge"));
			for (Placement placed : branches) {
				for (String output : placed.outputs) {
					graph.addEdge(output, merge.getId());
				}
			}
			return new Placement(Collections.singletonList(merge.getId()), mergeColumn + 1, branchRow - row);
		}

		private static Map<String, Object> junction(String role) {
			Map<String, Object> data = new LinkedHashMap<String, Object>();
			data.put("role", role);
			return data;
		}
	}
}
