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

/**
 * Root of the typed syntax tree: declarations then statements, in source
 * order.
 */
public final class Program {

	private static final Program EMPTY = new Program("", Collections.<Declaration>emptyList(), Collections.<Statement>emptyList());

	private final String name;
	private final List<Declaration> declarations;
	private final List<Statement> statements;

	public Program(String name, List<Declaration> declarations, List<Statement> statements) {
		this.name = name == null ? "" : name;
		this.declarations = Collections.unmodifiableList(new ArrayList<Declaration>(declarations));
		this.statements = Collections.unmodifiableList(new ArrayList<Statement>(statements));
	}

	/**
	 * @return a program with no declaration and no statement
	 */
	public static Program empty() {
		return EMPTY;
	}

	/**
	 * @return the PROGRAM name, empty for an anonymous program
	 */
	public String getName() {
		return name;
	}

	public List<Declaration> getDeclarations() {
		return declarations;
	}

	public List<Statement> getStatements() {
		return statements;
	}

	/**
	 * @param variableName a declared name, case-sensitive
	 * @return its declaration, or {@code null}
	 */
	public Declaration findDeclaration(String variableName) {
		for (Declaration declaration : declarations) {
			if (declaration.getName().equals(variableName)) {
				return declaration;
			}
		}
		return null;
	}

	public boolean isEmpty() {
		return declarations.isEmpty() && statements.isEmpty();
	}
}
