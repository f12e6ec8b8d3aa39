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

import org.metricshub.jst.util.SourceSpan;

/**
 * A grammar error. The parser catches it at statement and declaration
 * boundaries, records it, and resumes after the next <code>;</code>.
 */
public class ParserException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final transient SourceSpan span;
	private final String reason;

	/**
	 * @param msg description of the problem
	 * @param sourceDescription name of the source, for messages
	 * @param span location of the offending token
	 */
	public ParserException(String msg, String sourceDescription, SourceSpan span) {
		super(msg + " (" + sourceDescription + ":" + span + ")");
		this.reason = msg;
		this.span = span;
	}

	public SourceSpan getSpan() {
		return span;
	}

	/**
	 * @return the message without the location suffix
	 */
	public String getReason() {
		return reason;
	}
}
