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

import org.metricshub.jst.util.SourceSpan;

/**
 * <code>OUTPUT => variable</code> in a function block call: the output is
 * copied to the variable once the block has executed.
 */
public final class OutputBinding {

	private final String parameter;
	private final Expression target;
	private final SourceSpan span;

	public OutputBinding(String parameter, Expression target, SourceSpan span) {
		this.parameter = parameter;
		this.target = target;
		this.span = span;
	}

	public String getParameter() {
		return parameter;
	}

	public Expression getTarget() {
		return target;
	}

	public SourceSpan getSpan() {
		return span;
	}

	@Override
	public String toString() {
		return parameter + " => " + target;
	}
}
