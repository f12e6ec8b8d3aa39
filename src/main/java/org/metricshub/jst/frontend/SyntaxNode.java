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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.jst.util.SourceSpan;

/**
 * Node of the concrete syntax tree produced by {@link StParser}.
 * <p>
 * The tree is deliberately untyped: a {@link SyntaxKind}, an optional text
 * (identifier, operator or literal image) and ordered children. The
 * {@link org.metricshub.jst.ast.AstBuilder} lowers it into typed AST nodes.
 */
public class SyntaxNode {

	private final SyntaxKind kind;
	private final String text;
	private final List<SyntaxNode> children = new ArrayList<SyntaxNode>();
	private SourceSpan span;

	public SyntaxNode(SyntaxKind kind, String text, SourceSpan span) {
		this.kind = kind;
		this.text = text;
		this.span = span;
	}

	public SyntaxKind getKind() {
		return kind;
	}

	/**
	 * @return identifier, operator or literal image; {@code null} for structural nodes
	 */
	public String getText() {
		return text;
	}

	public SourceSpan getSpan() {
		return span;
	}

	void setSpan(SourceSpan span) {
		this.span = span;
	}

	public List<SyntaxNode> getChildren() {
		return Collections.unmodifiableList(children);
	}

	public SyntaxNode getChild(int index) {
		return children.get(index);
	}

	public int getChildCount() {
		return children.size();
	}

	/**
	 * @param kind a node kind
	 * @return the first child of that kind, or {@code null}
	 */
	public SyntaxNode findChild(SyntaxKind kind) {
		for (SyntaxNode child : children) {
			if (child.kind == kind) {
				return child;
			}
		}
		return null;
	}

	SyntaxNode add(SyntaxNode child) {
		if (child != null) {
			children.add(child);
		}
		return this;
	}

	/**
	 * Canonical text of the subtree: kinds, texts and structure, without
	 * positions, whitespace or comments. Two subtrees parsed from sources
	 * that differ only in layout have the same canonical text.
	 *
	 * @return the canonical form
	 */
	public String toCanonicalString() {
		StringBuilder sb = new StringBuilder();
		appendCanonical(sb);
		return sb.toString();
	}

	private void appendCanonical(StringBuilder sb) {
		sb.append(kind.name());
		if (text != null) {
			sb.append('\'').append(text).append('\'');
		}
		if (!children.isEmpty()) {
			sb.append('(');
			for (int i = 0; i < children.size(); i++) {
				if (i > 0) {
					sb.append(',');
				}
				children.get(i).appendCanonical(sb);
			}
			sb.append(')');
		}
	}

	/**
	 * Dump a meaningful text representation of this
	 * syntax tree node to the output (print) stream.
	 *
	 * @param ps The print stream to dump the text representation.
	 */
	public void dump(PrintStream ps) {
		dump(ps, 0);
	}

	private void dump(PrintStream ps, int depth) {
		StringBuilder line = new StringBuilder();
		for (int i = 0; i < depth; i++) {
			line.append("  ");
		}
		line.append(kind);
		if (text != null) {
			line.append(' ').append(text);
		}
		line.append("  @").append(span);
		ps.println(line);
		for (SyntaxNode child : children) {
			child.dump(ps, depth + 1);
		}
	}

	@Override
	public String toString() {
		return text == null ? kind.toString() : kind + " " + text;
	}
}
