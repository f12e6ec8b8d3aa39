package org.metricshub.jst.util;

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

import java.util.Objects;

/**
 * Location of a fragment of Structured Text source code.
 * <p>
 * Offsets are 0-based character positions, lines and columns are 1-based.
 * {@link #UNKNOWN} is used when no position is available (e.g. a fault
 * raised outside of any statement).
 */
public final class SourceSpan {

	/** Span used when the location is not known */
	public static final SourceSpan UNKNOWN = new SourceSpan(-1, 0, -1, -1);

	private final int offset;
	private final int length;
	private final int line;
	private final int column;

	/**
	 * @param offset 0-based offset of the first character
	 * @param length number of characters covered
	 * @param line 1-based line of the first character
	 * @param column 1-based column of the first character
	 */
	public SourceSpan(int offset, int length, int line, int column) {
		this.offset = offset;
		this.length = length;
		this.line = line;
		this.column = column;
	}

	public int getOffset() {
		return offset;
	}

	public int getLength() {
		return length;
	}

	/**
	 * @return offset just after the last character covered
	 */
	public int getEnd() {
		return offset + length;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public boolean isKnown() {
		return offset >= 0;
	}

	/**
	 * Creates the smallest span that covers both this span and the other one.
	 *
	 * @param other the span to merge with
	 * @return the merged span
	 */
	public SourceSpan to(SourceSpan other) {
		if (!isKnown()) {
			return other;
		}
		if (other == null || !other.isKnown()) {
			return this;
		}
		SourceSpan first = offset <= other.offset ? this : other;
		int end = Math.max(getEnd(), other.getEnd());
		return new SourceSpan(first.offset, end - first.offset, first.line, first.column);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SourceSpan)) {
			return false;
		}
		SourceSpan that = (SourceSpan) o;
		return offset == that.offset && length == that.length && line == that.line && column == that.column;
	}

	@Override
	public int hashCode() {
		return Objects.hash(offset, length, line, column);
	}

	@Override
	public String toString() {
		if (!isKnown()) {
			return "?";
		}
		return line + ":" + column;
	}
}
