package org.metricshub.jst.ast;

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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.metricshub.jst.frontend.ParseResult;
import org.metricshub.jst.frontend.SyntaxKind;
import org.metricshub.jst.frontend.SyntaxNode;
import org.metricshub.jst.frontend.TimeLiterals;
import org.metricshub.jst.jrt.FunctionBlockType;
import org.metricshub.jst.jrt.Value;
import org.metricshub.jst.jrt.ValueKind;
import org.metricshub.jst.util.Diagnostic;
import org.metricshub.jst.util.JstLogger;
import org.metricshub.jst.util.SourceSpan;
import org.slf4j.Logger;

/**
 * Lowers the {@link SyntaxNode} tree produced by the parser into a typed
 * {@link Program}.
 * <p>
 * Building never fails: every semantic problem found on the way (undeclared
 * names, unknown types, misuse of function blocks, suspicious types) is
 * reported as a SEMANTIC_WARNING and the program is built anyway, leaving the
 * final word to the interpreter. Declarations with an unknown type and
 * duplicate declarations are dropped.
 * <p>
 * Statement ids are derived from the statement kind and a hash of its
 * canonical syntax, so they survive edits to unrelated lines. Function block
 * member and parameter names are normalized to upper case.
 * <p>
 * An instance keeps state while building and must not be shared between
 * threads.
 */
public class AstBuilder {

	private static final Logger LOGGER = JstLogger.getLogger(AstBuilder.class);

	private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
	private final Map<String, Declaration> symbols = new LinkedHashMap<String, Declaration>();
	private final Map<String, Integer> ordinals = new HashMap<String, Integer>();
	private int loopDepth;
	private boolean checkReferences;

	/**
	 * Builds a program from the result of the parser.
	 *
	 * @param parsed the parse result
	 * @return the program with the syntax errors of the parser followed by
	 *         the warnings of the builder
	 */
	public CompileResult build(ParseResult parsed) {
		CompileResult built = build(parsed.getTree());
		List<Diagnostic> all = new ArrayList<Diagnostic>(parsed.getDiagnostics());
		all.addAll(built.getDiagnostics());
		return new CompileResult(built.getProgram(), all);
	}

	/**
	 * Builds a program from a parse tree.
	 *
	 * @param tree a PROGRAM node, or {@code null} when parsing failed
	 * @return the program with the warnings found while building it; an
	 *         empty program when the tree is {@code null}
	 */
	public CompileResult build(SyntaxNode tree) {
		reset(true);
		if (tree == null) {
			return new CompileResult(Program.empty(), diagnostics);
		}
		if (tree.getKind() != SyntaxKind.PROGRAM) {
			throw new IllegalArgumentException("Expecting a PROGRAM node, got " + tree.getKind());
		}
		List<Declaration> declarations = new ArrayList<Declaration>();
		List<Statement> statements = new ArrayList<Statement>();
		for (SyntaxNode child : tree.getChildren()) {
			if (child.getKind() == SyntaxKind.VAR_BLOCK) {
				varBlock(child, declarations);
			} else if (child.getKind() == SyntaxKind.STATEMENT_LIST) {
				statements.addAll(statementList(child));
			}
		}
		Program program = new Program(tree.getText(), declarations, statements);
		LOGGER.debug(
				"Built program '{}': {} declaration(s), {} statement(s), {} warning(s)",
				program.getName(),
				declarations.size(),
				statements.size(),
				diagnostics.size());
		return new CompileResult(program, diagnostics);
	}

	/**
	 * Builds a standalone expression, without checking its references.
	 *
	 * @param tree an expression node as returned by
	 *        {@link org.metricshub.jst.frontend.StParser#parseExpression(String)}
	 * @return the expression
	 */
	public Expression buildExpression(SyntaxNode tree) {
		reset(false);
		return expression(tree, NodeId.of("expr"));
	}

	/**
	 * @return the warnings of the last {@link #buildExpression(SyntaxNode)}
	 */
	public List<Diagnostic> getDiagnostics() {
		return new ArrayList<Diagnostic>(diagnostics);
	}

	private void reset(boolean withReferenceChecks) {
		diagnostics.clear();
		symbols.clear();
		ordinals.clear();
		loopDepth = 0;
		checkReferences = withReferenceChecks;
	}

	private void warn(String message, SourceSpan span) {
		diagnostics.add(Diagnostic.warning(message, span));
	}

	// DECLARATIONS

	private void varBlock(SyntaxNode block, List<Declaration> declarations) {
		StorageClass storageClass = StorageClass.fromKeyword(block.getText());
		boolean constant = false;
		boolean retain = false;
		for (SyntaxNode child : block.getChildren()) {
			if (child.getKind() == SyntaxKind.MODIFIER) {
				constant |= "CONSTANT".equals(child.getText());
				retain |= "RETAIN".equals(child.getText());
			} else {
				varDecl(child, storageClass, constant, retain, declarations);
			}
		}
	}

	private void varDecl(SyntaxNode decl, StorageClass storageClass, boolean constant, boolean retain, List<Declaration> declarations) {
		List<SyntaxNode> names = new ArrayList<SyntaxNode>();
		SyntaxNode typeRef = null;
		SyntaxNode init = null;
		for (SyntaxNode child : decl.getChildren()) {
			if (child.getKind() == SyntaxKind.IDENTIFIER) {
				names.add(child);
			} else if (child.getKind() == SyntaxKind.TYPE_REF) {
				typeRef = child;
			} else {
				init = child;
			}
		}
		String typeName = typeRef.getText();
		DataType dataType = DataType.fromName(typeName);
		if (dataType == null) {
			warn("Unknown data type '" + typeName + "', declaration ignored", typeRef.getSpan());
			return;
		}
		for (SyntaxNode nameNode : names) {
			String name = nameNode.getText();
			if (symbols.containsKey(name)) {
				warn("Duplicate declaration of '" + name + "'", nameNode.getSpan());
				continue;
			}
			NodeId id = NodeId.of("decl-" + name);
			Expression initialValue = null;
			List<ParameterBinding> presets = null;
			if (init != null && init.getKind() == SyntaxKind.INIT_LIST) {
				if (dataType.isFunctionBlock()) {
					presets = presets(init, dataType.getFunctionBlockType(), name, id);
				} else {
					warn("A parameter list can only initialize a function block, '" + name + "' is " + typeName, init.getSpan());
				}
			} else if (init != null) {
				if (dataType.isFunctionBlock()) {
					warn("Function block instance '" + name + "' cannot have an initial value", init.getSpan());
				} else {
					initialValue = expression(init, id.child("init"));
					checkAssignable(dataType.getValueKind(), initialValue, name);
				}
			}
			SourceSpan span = nameNode.getSpan().to(decl.getSpan());
			Declaration declaration = new Declaration(
					id,
					span,
					name,
					dataType,
					typeName,
					storageClass,
					constant,
					retain,
					initialValue,
					presets);
			symbols.put(name, declaration);
			declarations.add(declaration);
		}
	}

	private List<ParameterBinding> presets(SyntaxNode initList, FunctionBlockType type, String instanceName, NodeId id) {
		List<ParameterBinding> presets = new ArrayList<ParameterBinding>();
		for (SyntaxNode argument : initList.getChildren()) {
			String parameter = memberName(argument.getText());
			if (!type.getInputs().contains(parameter)) {
				warn("'" + argument.getText() + "' is not an input of " + type + " instance '" + instanceName + "'", argument.getSpan());
			}
			Expression value = expression(argument.getChild(0), id.child(parameter));
			checkAssignable(type.getMemberKind(parameter), value, instanceName + "." + parameter);
			presets.add(new ParameterBinding(parameter, value, argument.getSpan()));
		}
		return presets;
	}

	// STATEMENTS

	private List<Statement> statementList(SyntaxNode list) {
		List<Statement> statements = new ArrayList<Statement>();
		for (SyntaxNode child : list.getChildren()) {
			statements.add(statement(child));
		}
		return statements;
	}

	private Statement statement(SyntaxNode node) {
		switch (node.getKind()) {
		case ASSIGNMENT:
			return assignment(node, statementId(StatementKind.ASSIGNMENT, node));
		case FB_CALL:
			return functionBlockCall(node, statementId(StatementKind.FB_CALL, node));
		case IF:
			return ifStatement(node, statementId(StatementKind.IF, node));
		case CASE:
			return caseStatement(node, statementId(StatementKind.CASE, node));
		case FOR:
			return forStatement(node, statementId(StatementKind.FOR, node));
		case WHILE:
			return whileStatement(node, statementId(StatementKind.WHILE, node));
		case REPEAT:
			return repeatStatement(node, statementId(StatementKind.REPEAT, node));
		case RETURN:
			return new ReturnStatement(statementId(StatementKind.RETURN, node), node.getSpan());
		case EXIT:
			if (loopDepth == 0) {
				warn("EXIT outside a loop is ignored", node.getSpan());
			}
			return new ExitStatement(statementId(StatementKind.EXIT, node), node.getSpan());
		default:
			throw new IllegalArgumentException("Not a statement: " + node.getKind());
		}
	}

	/**
	 * Computes a content-stable id: the statement kind, the hash of its
	 * canonical syntax, and an ordinal when the same text was already seen.
	 */
	private NodeId statementId(StatementKind kind, SyntaxNode node) {
		String base = kind.name().toLowerCase(Locale.ROOT) + "-" + String.format("%08x", node.toCanonicalString().hashCode());
		Integer seen = ordinals.get(base);
		int ordinal = seen == null ? 1 : seen + 1;
		ordinals.put(base, ordinal);
		return NodeId.of(ordinal == 1 ? base : base + "#" + ordinal);
	}

	private Assignment assignment(SyntaxNode node, NodeId id) {
		SyntaxNode targetNode = node.getChild(0);
		Expression target = expression(targetNode, id.child("target"));
		Expression value = expression(node.getChild(1), id.child("value"));
		if (target instanceof VariableRef) {
			Declaration declaration = symbols.get(((VariableRef) target).getName());
			if (declaration != null) {
				if (declaration.isFunctionBlock()) {
					warn("Cannot assign to function block instance '" + declaration.getName() + "'", targetNode.getSpan());
				} else {
					if (declaration.isConstant()) {
						warn("Assignment to CONSTANT '" + declaration.getName() + "'", targetNode.getSpan());
					}
					checkAssignable(declaration.getDataType().getValueKind(), value, declaration.getName());
				}
			}
		} else if (target instanceof MemberRef) {
			MemberRef member = (MemberRef) target;
			FunctionBlockType type = instanceType(member.getInstanceName());
			if (type != null && type.hasMember(member.getMember()) && !type.getInputs().contains(member.getMember())) {
				warn("Cannot assign to output " + member + ", only inputs can be written", targetNode.getSpan());
			}
			if (type != null) {
				checkAssignable(type.getMemberKind(member.getMember()), value, member.toString());
			}
		}
		return new Assignment(id, node.getSpan(), target, value);
	}

	private FunctionBlockCall functionBlockCall(SyntaxNode node, NodeId id) {
		String instanceName = node.getText();
		FunctionBlockType type = null;
		Declaration declaration = symbols.get(instanceName);
		if (declaration == null) {
			warn("Undeclared function block instance '" + instanceName + "'", node.getSpan());
		} else if (!declaration.isFunctionBlock()) {
			warn("'" + instanceName + "' is not a function block instance and cannot be called", node.getSpan());
		} else {
			type = declaration.getDataType().getFunctionBlockType();
		}
		List<ParameterBinding> inputs = new ArrayList<ParameterBinding>();
		List<OutputBinding> outputs = new ArrayList<OutputBinding>();
		for (SyntaxNode argument : node.getChildren()) {
			String parameter = memberName(argument.getText());
			if (argument.getKind() == SyntaxKind.OUTPUT_ARGUMENT) {
				if (type != null && !type.getOutputs().contains(parameter)) {
					warn("'" + argument.getText() + "' is not an output of " + type + " instance '" + instanceName + "'", argument.getSpan());
				}
				Expression target = expression(argument.getChild(0), id.child("out-" + parameter));
				outputs.add(new OutputBinding(parameter, target, argument.getSpan()));
			} else {
				if (type != null && !type.getInputs().contains(parameter)) {
					warn("'" + argument.getText() + "' is not an input of " + type + " instance '" + instanceName + "'", argument.getSpan());
				}
				Expression value = expression(argument.getChild(0), id.child(parameter));
				if (type != null) {
					checkAssignable(type.getMemberKind(parameter), value, instanceName + "." + parameter);
				}
				inputs.add(new ParameterBinding(parameter, value, argument.getSpan()));
			}
		}
		return new FunctionBlockCall(id, node.getSpan(), instanceName, inputs, outputs);
	}

	private IfStatement ifStatement(SyntaxNode node, NodeId id) {
		List<ConditionalBranch> branches = new ArrayList<ConditionalBranch>();
		List<Statement> elseBody = null;
		for (SyntaxNode child : node.getChildren()) {
			if (child.getKind() == SyntaxKind.IF_BRANCH) {
				NodeId branchId = id.child("branch" + branches.size());
				Expression condition = expression(child.getChild(0), branchId.child("cond"));
				checkCondition(condition);
				branches.add(new ConditionalBranch(branchId, child.getSpan(), condition, statementList(child.getChild(1))));
			} else {
				elseBody = statementList(child.getChild(0));
			}
		}
		return new IfStatement(id, node.getSpan(), branches, elseBody);
	}

	private CaseStatement caseStatement(SyntaxNode node, NodeId id) {
		Expression selector = expression(node.getChild(0), id.child("selector"));
		ValueKind selectorKind = inferKind(selector);
		if (selectorKind != null && selectorKind != ValueKind.INT) {
			warn("CASE selector " + selector + " should be an INT, not " + selectorKind, selector.getSpan());
		}
		List<CaseClause> clauses = new ArrayList<CaseClause>();
		List<Statement> elseBody = null;
		for (int i = 1; i < node.getChildCount(); i++) {
			SyntaxNode child = node.getChild(i);
			if (child.getKind() == SyntaxKind.ELSE_CLAUSE) {
				elseBody = statementList(child.getChild(0));
				continue;
			}
			NodeId clauseId = id.child("clause" + clauses.size());
			List<CaseLabel> labels = new ArrayList<CaseLabel>();
			for (SyntaxNode labelNode : child.getChild(0).getChildren()) {
				NodeId labelId = clauseId.child("label" + labels.size());
				if (labelNode.getKind() == SyntaxKind.CASE_RANGE) {
					labels.add(new CaseLabel(expression(labelNode.getChild(0), labelId.child("low")), expression(labelNode.getChild(1), labelId.child("high"))));
				} else {
					labels.add(new CaseLabel(expression(labelNode, labelId), null));
				}
			}
			clauses.add(new CaseClause(clauseId, child.getSpan(), labels, statementList(child.getChild(1))));
		}
		return new CaseStatement(id, node.getSpan(), selector, clauses, elseBody);
	}

	private ForStatement forStatement(SyntaxNode node, NodeId id) {
		SyntaxNode variableNode = node.getChild(0);
		String variable = variableNode.getText();
		Declaration declaration = symbols.get(variable);
		if (declaration == null) {
			warn("Undeclared loop variable '" + variable + "'", variableNode.getSpan());
		} else if (declaration.getDataType().getValueKind() != ValueKind.INT) {
			warn("FOR loop variable '" + variable + "' should be an INT, not " + declaration.getTypeName(), variableNode.getSpan());
		}
		Expression from = expression(node.getChild(1), id.child("from"));
		Expression to = expression(node.getChild(2), id.child("to"));
		Expression step = null;
		int bodyIndex = 3;
		if (node.getChild(3).getKind() == SyntaxKind.STEP) {
			step = expression(node.getChild(3).getChild(0), id.child("step"));
			bodyIndex = 4;
		}
		List<Statement> body = loopBody(node.getChild(bodyIndex));
		return new ForStatement(id, node.getSpan(), variable, from, to, step, body);
	}

	private WhileStatement whileStatement(SyntaxNode node, NodeId id) {
		Expression condition = expression(node.getChild(0), id.child("cond"));
		checkCondition(condition);
		return new WhileStatement(id, node.getSpan(), condition, loopBody(node.getChild(1)));
	}

	private RepeatStatement repeatStatement(SyntaxNode node, NodeId id) {
		List<Statement> body = loopBody(node.getChild(0));
		Expression condition = expression(node.getChild(1), id.child("until"));
		checkCondition(condition);
		return new RepeatStatement(id, node.getSpan(), body, condition);
	}

	private List<Statement> loopBody(SyntaxNode list) {
		loopDepth++;
		try {
			return statementList(list);
		} finally {
			loopDepth--;
		}
	}

	// EXPRESSIONS

	private Expression expression(SyntaxNode node, NodeId id) {
		SourceSpan span = node.getSpan();
		switch (node.getKind()) {
		case BOOL_LITERAL:
			return new Literal(id, span, Value.ofBool("TRUE".equals(node.getText())));
		case INT_LITERAL:
			return new Literal(id, span, integerLiteral(node));
		case REAL_LITERAL:
			return new Literal(id, span, Value.ofReal(Double.parseDouble(node.getText().replace("_", ""))));
		case TIME_LITERAL:
			return new Literal(id, span, Value.ofTime(TimeLiterals.parse(node.getText())));
		case VARIABLE:
			checkVariable(node.getText(), span);
			return new VariableRef(id, span, node.getText());
		case MEMBER_ACCESS:
			return memberRef(node, id);
		case UNARY:
			return new UnaryOp(id, span, UnaryOperator.fromSymbol(node.getText()), expression(node.getChild(0), id.child("o")));
		case BINARY:
			return new BinaryOp(
					id,
					span,
					BinaryOperator.fromSymbol(node.getText()),
					expression(node.getChild(0), id.child("l")),
					expression(node.getChild(1), id.child("r")));
		case FUNCTION_CALL:
			return functionCall(node, id);
		default:
			throw new IllegalArgumentException("Not an expression: " + node.getKind());
		}
	}

	private Value integerLiteral(SyntaxNode node) {
		String image = node.getText().replace("_", "");
		try {
			int hash = image.indexOf('#');
			if (hash > 0) {
				return Value.ofInt(Long.parseUnsignedLong(image.substring(hash + 1), Integer.parseInt(image.substring(0, hash))));
			}
			return Value.ofInt(Long.parseLong(image));
		} catch (NumberFormatException e) {
			warn("Integer literal " + node.getText() + " is out of range, using 0", node.getSpan());
			return Value.ZERO_INT;
		}
	}

	private MemberRef memberRef(SyntaxNode node, NodeId id) {
		String instanceName = node.getText();
		String member = memberName(node.getChild(0).getText());
		if (checkReferences) {
			Declaration declaration = symbols.get(instanceName);
			if (declaration == null) {
				warn("Undeclared function block instance '" + instanceName + "'", node.getSpan());
			} else if (!declaration.isFunctionBlock()) {
				warn("'" + instanceName + "' is not a function block instance and has no member '" + member + "'", node.getSpan());
			} else if (!declaration.getDataType().getFunctionBlockType().hasMember(member)) {
				warn(declaration.getTypeName() + " instance '" + instanceName + "' has no member '" + member + "'", node.getSpan());
			}
		}
		return new MemberRef(id, node.getSpan(), instanceName, member);
	}

	private FunctionCall functionCall(SyntaxNode node, NodeId id) {
		String name = node.getText();
		StandardFunction function = StandardFunction.resolve(name);
		if (function == null) {
			warn("Unknown function '" + name + "'", node.getSpan());
		}
		boolean named = node.getChildCount() > 0;
		for (SyntaxNode argument : node.getChildren()) {
			named &= argument.getText() != null;
		}
		List<Expression> arguments = new ArrayList<Expression>();
		if (named && function != null && !function.getParameterNames().isEmpty()) {
			namedArguments(node, id, function, arguments);
		} else {
			for (SyntaxNode argument : node.getChildren()) {
				arguments.add(expression(argument.getChild(0), id.child("a" + arguments.size())));
			}
		}
		if (function != null && (arguments.size() < function.getMinArguments() || arguments.size() > function.getMaxArguments())) {
			warn(function + " called with " + arguments.size() + " argument(s)", node.getSpan());
		}
		return new FunctionCall(id, node.getSpan(), name, function, arguments);
	}

	/**
	 * Orders <code>LIMIT(MN := 0, MX := 10, IN := x)</code> arguments along the
	 * formal parameter list.
	 */
	private void namedArguments(SyntaxNode node, NodeId id, StandardFunction function, List<Expression> arguments) {
		Map<String, SyntaxNode> byName = new HashMap<String, SyntaxNode>();
		for (SyntaxNode argument : node.getChildren()) {
			String parameter = memberName(argument.getText());
			if (!function.getParameterNames().contains(parameter)) {
				warn(function + " has no parameter '" + argument.getText() + "'", argument.getSpan());
			} else {
				byName.put(parameter, argument);
			}
		}
		for (String parameter : function.getParameterNames()) {
			SyntaxNode argument = byName.get(parameter);
			if (argument == null) {
				warn("Missing parameter " + parameter + " in call to " + function, node.getSpan());
				return;
			}
			arguments.add(expression(argument.getChild(0), id.child("a" + arguments.size())));
		}
	}

	private static String memberName(String name) {
		return name.toUpperCase(Locale.ROOT);
	}

	// CHECKS

	private void checkVariable(String name, SourceSpan span) {
		if (!checkReferences) {
			return;
		}
		Declaration declaration = symbols.get(name);
		if (declaration == null) {
			warn("Undeclared variable '" + name + "'", span);
		} else if (declaration.isFunctionBlock()) {
			warn("Function block instance '" + name + "' used as a value", span);
		}
	}

	private void checkCondition(Expression condition) {
		ValueKind kind = inferKind(condition);
		if (kind != null && kind != ValueKind.BOOL) {
			warn("Condition " + condition + " is " + kind + ", not BOOL", condition.getSpan());
		}
	}

	private void checkAssignable(ValueKind target, Expression value, String what) {
		ValueKind kind = inferKind(value);
		if (target != null && kind != null && !kind.isImplicitlyConvertibleTo(target)) {
			warn("Type mismatch: cannot assign " + kind + " to " + target + " " + what, value.getSpan());
		}
	}

	private FunctionBlockType instanceType(String instanceName) {
		Declaration declaration = symbols.get(instanceName);
		return declaration == null ? null : declaration.getDataType().getFunctionBlockType();
	}

	/**
	 * Static type of an expression, as far as it can be told from the
	 * declarations.
	 *
	 * @return the kind, or {@code null} when unknown
	 */
	private ValueKind inferKind(Expression expression) {
		switch (expression.getKind()) {
		case LITERAL:
			return ((Literal) expression).getValue().getKind();
		case VARIABLE:
			Declaration declaration = symbols.get(((VariableRef) expression).getName());
			return declaration == null ? null : declaration.getDataType().getValueKind();
		case MEMBER:
			MemberRef member = (MemberRef) expression;
			FunctionBlockType type = instanceType(member.getInstanceName());
			return type == null ? null : type.getMemberKind(member.getMember());
		case UNARY:
			return inferKind(((UnaryOp) expression).getOperand());
		case BINARY:
			return inferBinaryKind((BinaryOp) expression);
		case CALL:
			return inferCallKind((FunctionCall) expression);
		default:
			return null;
		}
	}

	private ValueKind inferBinaryKind(BinaryOp op) {
		BinaryOperator operator = op.getOperator();
		if (operator.isComparison()) {
			return ValueKind.BOOL;
		}
		ValueKind left = inferKind(op.getLeft());
		ValueKind right = inferKind(op.getRight());
		if (operator.isLogical()) {
			return left == right ? left : null;
		}
		switch (operator) {
		case POW:
			return ValueKind.REAL;
		case MOD:
			return ValueKind.INT;
		default:
			if (left == null || right == null) {
				return null;
			}
			if (left == ValueKind.TIME || right == ValueKind.TIME) {
				return ValueKind.TIME;
			}
			if (left == ValueKind.REAL || right == ValueKind.REAL) {
				return ValueKind.REAL;
			}
			return left == ValueKind.INT && right == ValueKind.INT ? ValueKind.INT : null;
		}
	}

	private ValueKind inferCallKind(FunctionCall call) {
		StandardFunction function = call.getFunction();
		if (function == null) {
			return null;
		}
		if (function.getConversionTarget() != null) {
			return function.getConversionTarget();
		}
		List<Expression> arguments = call.getArguments();
		switch (function) {
		case TRUNC:
			return ValueKind.INT;
		case ABS:
		case MIN:
		case MAX:
			return arguments.isEmpty() ? null : inferKind(arguments.get(0));
		case LIMIT:
		case SEL:
		case MUX:
			return arguments.size() < 2 ? null : inferKind(arguments.get(1));
		default:
			return ValueKind.REAL;
		}
	}
}
