package org.metricshub.jst.jrt;

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
 * Raised while executing a program when a statement cannot be completed:
 * undeclared variable, type mismatch, runaway loop, etc.
 * <p>
 * The scan-cycle interpreter catches it, turns it into a runtime fault
 * diagnostic and abandons the rest of the current scan.
 */
public class StRuntimeException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final transient SourceSpan span;

	/**
	 * @param msg a {@link java.lang.String} object
	 */
	public StRuntimeException(String msg) {
		super(msg);
		this.span = SourceSpan.UNKNOWN;
	}

	public StRuntimeException(String msg, Throwable cause) {
		super(msg, cause);
		this.span = SourceSpan.UNKNOWN;
	}

	/**
	 * @param span location of the offending code
	 * @param msg a {@link java.lang.String} object
	 */
	public StRuntimeException(SourceSpan span, String msg) {
		super(msg);
		this.span = span == null ? SourceSpan.UNKNOWN : span;
	}

	/**
	 * Returns the location associated with this exception or
	 * {@link SourceSpan#UNKNOWN} if unavailable.
	 *
	 * @return the offending location
	 */
	public SourceSpan getSpan() {
		return span;
	}

	/**
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return span.getLine();
	}
}
