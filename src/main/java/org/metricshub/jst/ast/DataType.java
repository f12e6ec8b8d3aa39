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

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.metricshub.jst.jrt.FunctionBlockType;
import org.metricshub.jst.jrt.ValueKind;

/**
 * Declared type of a variable: an elementary kind or a function block.
 */
public enum DataType {
	BOOL(ValueKind.BOOL, null),
	INT(ValueKind.INT, null),
	REAL(ValueKind.REAL, null),
	TIME(ValueKind.TIME, null),
	TON(null, FunctionBlockType.TON),
	TOF(null, FunctionBlockType.TOF),
	TP(null, FunctionBlockType.TP),
	CTU(null, FunctionBlockType.CTU),
	CTD(null, FunctionBlockType.CTD),
	CTUD(null, FunctionBlockType.CTUD),
	R_TRIG(null, FunctionBlockType.R_TRIG),
	F_TRIG(null, FunctionBlockType.F_TRIG),
	SR(null, FunctionBlockType.SR),
	RS(null, FunctionBlockType.RS);

	private static final Map<String, DataType> ALIASES = new HashMap<String, DataType>();

	static {
		for (DataType type : values()) {
			ALIASES.put(type.name(), type);
		}
		for (String name : new String[] { "SINT", "DINT", "LINT", "USINT", "UINT", "UDINT", "ULINT", "BYTE", "WORD", "DWORD", "LWORD" }) {
			ALIASES.put(name, INT);
		}
		ALIASES.put("LREAL", REAL);
		ALIASES.put("LTIME", TIME);
	}

	private final ValueKind valueKind;
	private final FunctionBlockType functionBlockType;

	DataType(ValueKind valueKind, FunctionBlockType functionBlockType) {
		this.valueKind = valueKind;
		this.functionBlockType = functionBlockType;
	}

	/**
	 * @return the kind of values held, or {@code null} for function blocks
	 */
	public ValueKind getValueKind() {
		return valueKind;
	}

	/**
	 * @return the function block type, or {@code null} for elementary types
	 */
	public FunctionBlockType getFunctionBlockType() {
		return functionBlockType;
	}

	public boolean isFunctionBlock() {
		return functionBlockType != null;
	}

	/**
	 * Resolves a type name as written in a declaration, case-insensitive,
	 * including the integer and real aliases (DINT, UINT, LREAL, ...).
	 *
	 * @param name type name
	 * @return the type, or {@code null} when the name is not supported
	 */
	public static DataType fromName(String name) {
		return ALIASES.get(name.toUpperCase(Locale.ROOT));
	}
}
