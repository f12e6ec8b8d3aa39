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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.jst.ast.AstBuilder;
import org.metricshub.jst.ast.Expression;
import org.metricshub.jst.backend.ExpressionInterpreter;
import org.metricshub.jst.frontend.ParseResult;
import org.metricshub.jst.frontend.StParser;
import org.metricshub.jst.jrt.StRuntimeException;
import org.metricshub.jst.jrt.Store;
import org.metricshub.jst.jrt.Value;
import org.metricshub.jst.util.Diagnostic;

/**
 * Utility class to evaluate standalone Structured Text expressions.
 */
public final class ExpressionEvaluator {

	private ExpressionEvaluator() {}

	/**
	 * Evaluates an expression that reads no variable, e.g. <code>T#1s + T#500ms</code>.
	 *
	 * @param expression the expression text
	 * @return its value
	 * @throws StRuntimeException on a syntax error or an evaluation fault
	 */
	public static Value eval(String expression) {
		return eval(expression, new Store());
	}

	/**
	 * @param expression the expression text
	 * @param store the variables and instances the expression may read
	 * @return its value
	 * @throws StRuntimeException on a syntax error or an evaluation fault
	 */
	public static Value eval(String expression, Store store) {
		ParseResult parsed = new StParser().parseExpression(expression);
		if (!parsed.isSuccess()) {
			if (parsed.getDiagnostics().isEmpty()) {
				throw new StRuntimeException("Invalid expression '" + expression + "'");
			}
			Diagnostic first = parsed.getDiagnostics().get(0);
			throw new StRuntimeException(first.getSpan(), "Invalid expression '" + expression + "': " + first.getMessage());
		}
		Expression ast = new AstBuilder().buildExpression(parsed.getTree());
		List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
		return new ExpressionInterpreter(store == null ? new Store() : store, diagnostics).evaluate(ast);
	}
}
