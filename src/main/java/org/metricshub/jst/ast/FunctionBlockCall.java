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
import org.metricshub.jst.util.SourceSpan;

/**
 * <code>Timer1(IN := Start, PT := T#5s, Q => Done);</code>
 */
public final class FunctionBlockCall extends Statement {

	private final String instanceName;
	private final List<ParameterBinding> inputs;
	private final List<OutputBinding> outputs;

	public FunctionBlockCall(NodeId id, SourceSpan span, String instanceName, List<ParameterBinding> inputs, List<OutputBinding> outputs) {
		super(id, span);
		this.instanceName = instanceName;
		this.inputs = Collections.unmodifiableList(new ArrayList<ParameterBinding>(inputs));
		this.outputs = Collections.unmodifiableList(new ArrayList<OutputBinding>(outputs));
	}

	public String getInstanceName() {
		return instanceName;
	}

	public List<ParameterBinding> getInputs() {
		return inputs;
	}

	/**
	 * @param parameter input name
	 * @return the bound expression, or {@code null} when the input is not bound
	 */
	public Expression findInput(String parameter) {
		for (ParameterBinding binding : inputs) {
			if (binding.getParameter().equals(parameter)) {
				return binding.getValue();
			}
		}
		return null;
	}

	public List<OutputBinding> getOutputs() {
		return outputs;
	}

	@Override
	public StatementKind getKind() {
		return StatementKind.FB_CALL;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(instanceName).append('(');
		boolean first = true;
		for (ParameterBinding input : inputs) {
			sb.append(first ? "" : ", ").append(input);
			first = false;
		}
		for (OutputBinding output : outputs) {
			sb.append(first ? "" : ", ").append(output);
			first = false;
		}
		return sb.append(");").toString();
	}
}
