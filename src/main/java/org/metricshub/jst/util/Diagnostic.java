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

import java.util.Collection;
import java.util.Objects;

/**
 * A message about the source code or its execution, returned to the caller
 * instead of being thrown.
 */
public final class Diagnostic {

	private final DiagnosticKind kind;
	private final Severity severity;
	private final String message;
	private final SourceSpan span;

	/**
	 * @param kind stage that produced the diagnostic
	 * @param severity how serious it is
	 * @param message human readable message
	 * @param span location in the source, {@link SourceSpan#UNKNOWN} when not known
	 */
	public Diagnostic(DiagnosticKind kind, Severity severity, String message, SourceSpan span) {
		this.kind = Objects.requireNonNull(kind, "kind");
		this.severity = Objects.requireNonNull(severity, "severity");
		this.message = Objects.requireNonNull(message, "message");
		this.span = span == null ? SourceSpan.UNKNOWN : span;
	}

	public static Diagnostic syntaxError(String message, SourceSpan span) {
		return new Diagnostic(DiagnosticKind.SYNTAX_ERROR, Severity.ERROR, message, span);
	}

	public static Diagnostic warning(String message, SourceSpan span) {
		return new Diagnostic(DiagnosticKind.SEMANTIC_WARNING, Severity.WARNING, message, span);
	}

	/**
	 * A semantic problem that prevented a value from being computed, such as an
	 * initial value referencing an undeclared variable.
	 *
	 * @param message human readable message
	 * @param span location in the source
	 * @return a new SEMANTIC_WARNING diagnostic with ERROR severity
	 */
	public static Diagnostic semanticError(String message, SourceSpan span) {
		return new Diagnostic(DiagnosticKind.SEMANTIC_WARNING, Severity.ERROR, message, span);
	}

	public static Diagnostic runtimeFault(String message, SourceSpan span) {
		return new Diagnostic(DiagnosticKind.RUNTIME_FAULT, Severity.ERROR, message, span);
	}

	public DiagnosticKind getKind() {
		return kind;
	}

	public Severity getSeverity() {
		return severity;
	}

	public String getMessage() {
		return message;
	}

	public SourceSpan getSpan() {
		return span;
	}

	public boolean isError() {
		return severity == Severity.ERROR;
	}

	/**
	 * @param diagnostics diagnostics to inspect
	 * @return whether at least one of them is an error
	 */
	public static boolean hasErrors(Collection<Diagnostic> diagnostics) {
		for (Diagnostic diagnostic : diagnostics) {
			if (diagnostic.isError()) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @param diagnostics diagnostics to inspect
	 * @param kind the kind to look for
	 * @return whether at least one of them is of the specified kind
	 */
	public static boolean hasKind(Collection<Diagnostic> diagnostics, DiagnosticKind kind) {
		for (Diagnostic diagnostic : diagnostics) {
			if (diagnostic.kind == kind) {
				return true;
			}
		}
		return false;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Diagnostic)) {
			return false;
		}
		Diagnostic that = (Diagnostic) o;
		return kind == that.kind && severity == that.severity && message.equals(that.message) && span.equals(that.span);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, severity, message, span);
	}

	/**
	 * @return the diagnostic formatted as {@code KIND severity (line:column): message}
	 */
	@Override
	public String toString() {
		return kind + " " + severity + " (" + span + "): " + message;
	}
}
