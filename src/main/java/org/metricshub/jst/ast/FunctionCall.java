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
import java.util.Collections;
import java.util.List;
import org.metricshub.jst.util.SourceSpan;

/**
 * Call of a standard function inside an expression, e.g.
 * <code>LIMIT(0, Level, 100)</code>. Arguments are in positional order.
 */
public final class FunctionCall extends Expression {

	private final String name;
	private final StandardFunction function;
	private final List<Expression> arguments;

	/**
	 * @param id node id
	 * @param span source location
	 * @param name function name as written
	 * @param function the resolved function, {@code null} when unknown
	 * @param arguments positional arguments
	 */
	public FunctionCall(NodeId id, SourceSpan span, String name, StandardFunction function, List<Expression> arguments) {
		super(id, span);
		this.name = name;
		this.function = function;
		this.arguments = Collections.unmodifiableList(new ArrayList<Expression>(arguments));
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the resolved function, or {@code null} when the name is unknown
	 */
	public StandardFunction getFunction() {
		return function;
	}

	public List<Expression> getArguments() {
		return arguments;
	}

	@Override
	public ExpressionKind getKind() {
		return ExpressionKind.CALL;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(name).append('(');
		for (int i = 0; i < arguments.size(); i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(arguments.get(i));
		}
		return sb.append(')').toString();
	}
}
