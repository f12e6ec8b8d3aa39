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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * The catalog of standard function blocks known to the interpreter, with
 * their input and output members.
 */
public enum FunctionBlockType {
	TON(Category.TIMER, members("IN", "PT"), members("Q", "ET")),
	TOF(Category.TIMER, members("IN", "PT"), members("Q", "ET")),
	TP(Category.TIMER, members("IN", "PT"), members("Q", "ET")),
	CTU(Category.COUNTER, members("CU", "R", "PV"), members("Q", "QU", "CV")),
	CTD(Category.COUNTER, members("CD", "LD", "PV"), members("Q", "QD", "CV")),
	CTUD(Category.COUNTER, members("CU", "CD", "R", "LD", "PV"), members("Q", "QU", "QD", "CV")),
	R_TRIG(Category.EDGE, members("CLK"), members("Q", "M")),
	F_TRIG(Category.EDGE, members("CLK"), members("Q", "M")),
	SR(Category.BISTABLE, members("S1", "R"), members("Q1")),
	RS(Category.BISTABLE, members("S", "R1"), members("Q1"));

	/** Families of function blocks sharing one instance implementation */
	public enum Category {
		TIMER,
		COUNTER,
		EDGE,
		BISTABLE
	}

	private final Category category;
	private final Set<String> inputs;
	private final Set<String> outputs;

	FunctionBlockType(Category category, Set<String> inputs, Set<String> outputs) {
		this.category = category;
		this.inputs = inputs;
		this.outputs = outputs;
	}

	private static Set<String> members(String... names) {
		return Collections.unmodifiableSet(new LinkedHashSet<String>(Arrays.asList(names)));
	}

	public Category getCategory() {
		return category;
	}

	public Set<String> getInputs() {
		return inputs;
	}

	public Set<String> getOutputs() {
		return outputs;
	}

	/**
	 * @param member a member name, e.g. <code>Q</code>
	 * @return whether instances of this type expose that member
	 */
	public boolean hasMember(String member) {
		return inputs.contains(member) || outputs.contains(member);
	}

	/**
	 * @param member a member name
	 * @return the kind of value the member holds, {@code null} when this type
	 *         has no such member
	 */
	public ValueKind getMemberKind(String member) {
		if (!hasMember(member)) {
			return null;
		}
		if ("PT".equals(member) || "ET".equals(member)) {
			return ValueKind.TIME;
		}
		if ("PV".equals(member) || "CV".equals(member)) {
			return ValueKind.INT;
		}
		return ValueKind.BOOL;
	}

	/**
	 * @param name a type name as written in a declaration, case-insensitive
	 * @return the matching type, or {@code null} when it is not a function block
	 */
	public static FunctionBlockType fromName(String name) {
		String upper = name.toUpperCase(Locale.ROOT);
		for (FunctionBlockType type : values()) {
			if (type.name().equals(upper)) {
				return type;
			}
		}
		return null;
	}
}
