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

/**
 * Kinds of {@link SyntaxNode}. The comment of each constant lists its
 * children.
 */
public enum SyntaxKind {
	/** text: program name, or empty; children: VAR_BLOCK*, STATEMENT_LIST */
	PROGRAM,
	/** text: VAR keyword; children: [MODIFIER], VAR_DECL* */
	VAR_BLOCK,
	/** text: CONSTANT or RETAIN */
	MODIFIER,
	/** children: IDENTIFIER+, TYPE_REF, [initial value expression | INIT_LIST] */
	VAR_DECL,
	/** text: identifier */
	IDENTIFIER,
	/** text: type name */
	TYPE_REF,
	/** children: ARGUMENT* */
	INIT_LIST,
	/** children: statements */
	STATEMENT_LIST,
	/** children: target (VARIABLE or MEMBER_ACCESS), expression */
	ASSIGNMENT,
	/** text: instance name; children: ARGUMENT or OUTPUT_ARGUMENT */
	FB_CALL,
	/** text: parameter name, or null when positional; children: expression */
	ARGUMENT,
	/** text: output name; children: VARIABLE or MEMBER_ACCESS receiving it */
	OUTPUT_ARGUMENT,
	/** children: IF_BRANCH+, [ELSE_CLAUSE] */
	IF,
	/** children: condition, STATEMENT_LIST */
	IF_BRANCH,
	/** children: STATEMENT_LIST */
	ELSE_CLAUSE,
	/** children: selector, CASE_CLAUSE*, [ELSE_CLAUSE] */
	CASE,
	/** children: CASE_LABELS, STATEMENT_LIST */
	CASE_CLAUSE,
	/** children: expressions or CASE_RANGE */
	CASE_LABELS,
	/** children: low, high */
	CASE_RANGE,
	/** children: IDENTIFIER, from, to, [STEP], STATEMENT_LIST */
	FOR,
	/** children: expression */
	STEP,
	/** children: condition, STATEMENT_LIST */
	WHILE,
	/** children: STATEMENT_LIST, condition */
	REPEAT,
	RETURN,
	EXIT,
	/** text: operator; children: left, right */
	BINARY,
	/** text: operator; children: operand */
	UNARY,
	/** text: TRUE or FALSE */
	BOOL_LITERAL,
	/** text: literal image, e.g. 1_000 or 16#FF */
	INT_LITERAL,
	/** text: literal image */
	REAL_LITERAL,
	/** text: literal image, e.g. T#1s */
	TIME_LITERAL,
	/** text: variable name */
	VARIABLE,
	/** text: instance name; children: IDENTIFIER of the member */
	MEMBER_ACCESS,
	/** text: function name; children: ARGUMENT* */
	FUNCTION_CALL
}
