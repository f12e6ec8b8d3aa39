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

import java.io.PrintStream;
import java.util.List;

/**
 * Prints a {@link Program} as an indented listing, one statement per line,
 * each prefixed with its node id.
 */
public final class AstPrinter {

	private final PrintStream ps;

	public AstPrinter(PrintStream ps) {
		this.ps = ps;
	}

	public void dump(Program program) {
		ps.println("PROGRAM " + program.getName());
		for (Declaration declaration : program.getDeclarations()) {
			ps.println("  " + declaration.getStorageClass() + (declaration.isConstant() ? " CONSTANT " : " ") + declaration);
		}
		dump(program.getStatements(), 1);
	}

	private void dump(List<Statement> statements, int level) {
		for (Statement statement : statements) {
			line(level, statement.getId() + " : " + statement);
			switch (statement.getKind()) {
			case IF:
				IfStatement ifStatement = (IfStatement) statement;
				for (ConditionalBranch branch : ifStatement.getBranches()) {
					line(level + 1, "WHEN " + branch.getCondition());
					dump(branch.getBody(), level + 2);
				}
				if (ifStatement.hasElse()) {
					line(level + 1, "ELSE");
					dump(ifStatement.getElseBody(), level + 2);
				}
				break;
			case CASE:
				CaseStatement caseStatement = (CaseStatement) statement;
				for (CaseClause clause : caseStatement.getClauses()) {
					line(level + 1, "LABELS " + clause.getLabels());
					dump(clause.getBody(), level + 2);
				}
				if (caseStatement.hasElse()) {
					line(level + 1, "ELSE");
					dump(caseStatement.getElseBody(), level + 2);
				}
				break;
			case FOR:
				dump(((ForStatement) statement).getBody(), level + 1);
				break;
			case WHILE:
				dump(((WhileStatement) statement).getBody(), level + 1);
				break;
			case REPEAT:
				dump(((RepeatStatement) statement).getBody(), level + 1);
				break;
			default:
				break;
			}
		}
	}

	private void line(int level, String text) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < level; i++) {
			sb.append("  ");
		}
		ps.println(sb.append(text));
	}
}
