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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.jst.ast.BinaryOp;
import org.metricshub.jst.ast.Declaration;
import org.metricshub.jst.ast.Expression;
import org.metricshub.jst.ast.FunctionCall;
import org.metricshub.jst.ast.MemberRef;
import org.metricshub.jst.ast.ParameterBinding;
import org.metricshub.jst.ast.Program;
import org.metricshub.jst.ast.UnaryOp;
import org.metricshub.jst.ast.VariableRef;
import org.metricshub.jst.jrt.FunctionBlockInstance;
import org.metricshub.jst.jrt.StRuntimeException;
import org.metricshub.jst.jrt.Store;
import org.metricshub.jst.jrt.Value;
import org.metricshub.jst.jrt.ValueKind;
import org.metricshub.jst.util.Diagnostic;
import org.metricshub.jst.util.JstLogger;
import org.slf4j.Logger;

/**
 * Sets the declared variables of a program to their initial values and
 * creates its function block instances.
 * <p>
 * Only declared names are touched, in declaration order. An initial value
 * may read names declared before it; any other reference, or a value that
 * does not fit the declared type, is reported and the zero value of the type
 * is used instead.
 */
public class VariableInitializer {

	private static final Logger LOGGER = JstLogger.getLogger(VariableInitializer.class);

	/**
	 * @param program the program whose declarations are initialized
	 * @param store the store to write
	 * @return the problems found, never {@code null}
	 */
	public List<Diagnostic> initializeVariables(Program program, Store store) {
		List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
		Set<String> visible = new HashSet<String>();
		for (Declaration declaration : program.getDeclarations()) {
			initialize(declaration, store, visible, diagnostics);
			visible.add(declaration.getName());
		}
		LOGGER.debug("Initialized {} declaration(s), {} diagnostic(s)", program.getDeclarations().size(), diagnostics.size());
		return diagnostics;
	}

	/**
	 * Empties the store, then initializes it. Used when a program is reloaded.
	 *
	 * @param program the program whose declarations are initialized
	 * @param store the store to reset
	 * @return the problems found, never {@code null}
	 */
	public List<Diagnostic> clearAndInitialize(Program program, Store store) {
		store.clear();
		return initializeVariables(program, store);
	}

	/**
	 * Initializes one declaration, every other name of the store being
	 * readable. Used to reset VAR_TEMP variables at the start of a scan.
	 */
	void reinitialize(Declaration declaration, Store store, List<Diagnostic> diagnostics) {
		initialize(declaration, store, null, diagnostics);
	}

	private void initialize(Declaration declaration, Store store, Set<String> visible, List<Diagnostic> diagnostics) {
		if (declaration.isFunctionBlock()) {
			FunctionBlockInstance instance = store.initInstance(declaration.getName(), declaration.getDataType().getFunctionBlockType());
			for (ParameterBinding preset : declaration.getPresets()) {
				ValueKind kind = instance.getType().getMemberKind(preset.getParameter());
				if (kind != null && !instance.getType().getInputs().contains(preset.getParameter())) {
					diagnostics.add(Diagnostic.warning(
							"Cannot preset " + declaration.getName() + "." + preset.getParameter() + ": only inputs can be preset; preset ignored",
							preset.getValue().getSpan()));
					continue;
				}
				Value value = evaluate(preset.getValue(), kind, declaration.getName() + "." + preset.getParameter(), store, visible, diagnostics);
				if (kind != null) {
					instance.setMember(preset.getParameter(), value);
				}
			}
			return;
		}
		ValueKind kind = declaration.getDataType().getValueKind();
		Value value = Value.zero(kind);
		if (declaration.getInitialValue() != null) {
			value = evaluate(declaration.getInitialValue(), kind, declaration.getName(), store, visible, diagnostics);
		}
		store.declare(declaration.getName(), value);
	}

	private Value evaluate(Expression expression, ValueKind kind, String what, Store store, Set<String> visible, List<Diagnostic> diagnostics) {
		if (kind == null) {
			diagnostics.add(Diagnostic.warning("Unknown member " + what + ", preset ignored", expression.getSpan()));
			return null;
		}
		if (visible != null) {
			String reference = firstInvisibleReference(expression, visible);
			if (reference != null) {
				diagnostics.add(Diagnostic.warning(
						"Initial value of " + what + " references '" + reference + "', which is not declared before it; using "
								+ Value.zero(kind),
						expression.getSpan()));
				return Value.zero(kind);
			}
		}
		try {
			Value value = new ExpressionInterpreter(store, diagnostics).evaluate(expression);
			return ExpressionInterpreter.coerce(value, kind, what, expression.getSpan());
		} catch (StRuntimeException e) {
			diagnostics.add(Diagnostic.warning("Cannot initialize " + what + ": " + e.getMessage() + "; using " + Value.zero(kind), expression.getSpan()));
			return Value.zero(kind);
		}
	}

	/**
	 * @return the first name read by the expression that is not in visible,
	 *         or {@code null}
	 */
	private static String firstInvisibleReference(Expression expression, Set<String> visible) {
		switch (expression.getKind()) {
		case VARIABLE:
			String name = ((VariableRef) expression).getName();
			return visible.contains(name) ? null : name;
		case MEMBER:
			String instance = ((MemberRef) expression).getInstanceName();
			return visible.contains(instance) ? null : instance;
		case UNARY:
			return firstInvisibleReference(((UnaryOp) expression).getOperand(), visible);
		case BINARY:
			BinaryOp op = (BinaryOp) expression;
			String left = firstInvisibleReference(op.getLeft(), visible);
			return left != null ? left : firstInvisibleReference(op.getRight(), visible);
		case CALL:
			for (Expression argument : ((FunctionCall) expression).getArguments()) {
				String found = firstInvisibleReference(argument, visible);
				if (found != null) {
					return found;
				}
			}
			return null;
		default:
			return null;
		}
	}
}
