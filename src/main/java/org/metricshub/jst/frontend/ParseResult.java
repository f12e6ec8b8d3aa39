package org.metricshub.jst.frontend;

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
import org.metricshub.jst.util.Diagnostic;

/**
 * Outcome of {@link StParser#parse}: a syntax tree, or no tree and at least
 * one syntax error.
 */
public final class ParseResult {

	private final SyntaxNode tree;
	private final List<Diagnostic> diagnostics;

	ParseResult(SyntaxNode tree, List<Diagnostic> diagnostics) {
		this.tree = tree;
		this.diagnostics = Collections.unmodifiableList(new ArrayList<Diagnostic>(diagnostics));
	}

	/**
	 * @return the syntax tree, or {@code null} when the source has syntax errors
	 */
	public SyntaxNode getTree() {
		return tree;
	}

	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}

	public boolean isSuccess() {
		return tree != null;
	}
}
