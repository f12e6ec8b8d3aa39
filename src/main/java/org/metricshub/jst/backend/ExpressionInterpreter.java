package org.metricshub.jst.backend;

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
import java.util.List;
import org.metricshub.jst.ast.BinaryOp;
import org.metricshub.jst.ast.BinaryOperator;
import org.metricshub.jst.ast.Expression;
import org.metricshub.jst.ast.FunctionCall;
import org.metricshub.jst.ast.Literal;
import org.metricshub.jst.ast.MemberRef;
import org.metricshub.jst.ast.UnaryOp;
import org.metricshub.jst.ast.VariableRef;
import org.metricshub.jst.jrt.FunctionBlockInstance;
import org.metricshub.jst.jrt.StRuntimeException;
import org.metricshub.jst.jrt.Store;
import org.metricshub.jst.jrt.Value;
import org.metricshub.jst.jrt.ValueKind;
import org.metricshub.jst.util.Diagnostic;
import org.metricshub.jst.util.SourceSpan;

/**
 * Evaluates expressions against a {@link Store}.
 * <p>
 * Both operands of every binary operator are evaluated, there is no
 * short-circuit. Type errors raise a {@link StRuntimeException}; an integer
 * division by zero yields 0 and adds a warning to the diagnostic sink.
 */
public class ExpressionInterpreter {

	private final Store store;
	private final List<Diagnostic> diagnostics;

	/**
	 * @param store variables and function block instances to read
	 * @param diagnostics receives the warnings raised while evaluating
	 */
	public ExpressionInterpreter(Store store, List<Diagnostic> diagnostics) {
		this.store = store;
		this.diagnostics = diagnostics;
	}

	/**
	 * @param expression the expression to evaluate
	 * @return its value
	 * @throws StRuntimeException on type errors and unknown names
	 */
	public Value evaluate(Expression expression) {
		switch (expression.getKind()) {
		case LITERAL:
			return ((Literal) expression).getValue();
		case VARIABLE:
			return readVariable((VariableRef) expression);
		case MEMBER:
			return readMember((MemberRef) expression);
		case UNARY:
			return unary((UnaryOp) expression);
		case BINARY:
			return binary((BinaryOp) expression);
		case CALL:
			return call((FunctionCall) expression);
		default:
			throw new StRuntimeException(expression.getSpan(), "Cannot evaluate " + expression);
		}
	}

	/**
	 * Evaluates an IF, WHILE or UNTIL condition.
	 *
	 * @param condition the condition
	 * @return its boolean value
	 * @throws StRuntimeException when the condition is not a BOOL
	 */
	public boolean evaluateCondition(Expression condition) {
		Value value = evaluate(condition);
		if (value.getKind() != ValueKind.BOOL) {
			throw new StRuntimeException(condition.getSpan(), "Condition " + condition + " is " + value.getKind() + ", not BOOL");
		}
		return value.asBool();
	}

	/**
	 * @param expression an expression expected to be an INT
	 * @return its value
	 * @throws StRuntimeException when it is not an INT
	 */
	public long evaluateInt(Expression expression) {
		Value value = evaluate(expression);
		if (value.getKind() != ValueKind.INT) {
			throw new StRuntimeException(expression.getSpan(), expression + " is " + value.getKind() + ", expected INT");
		}
		return value.asLong();
	}

	/**
	 * Converts a value for storage in a slot of the specified kind. Only the
	 * implicit INT to REAL widening is allowed.
	 *
	 * @param value the value to store
	 * @param target kind of the slot
	 * @param what name of the slot, for the error message
	 * @param span location of the assignment
	 * @return the converted value
	 * @throws StRuntimeException when the kinds do not match
	 */
	public static Value coerce(Value value, ValueKind target, String what, SourceSpan span) {
		if (value.getKind() == target) {
			return value;
		}
		if (value.getKind().isImplicitlyConvertibleTo(target)) {
			return value.convertTo(target);
		}
		throw new StRuntimeException(span, "Type mismatch: cannot assign " + value.getKind() + " " + value + " to " + target + " " + what);
	}

	private Value readVariable(VariableRef ref) {
		Value value = store.getValue(ref.getName());
		if (value == null) {
			if (store.containsInstance(ref.getName())) {
				throw new StRuntimeException(ref.getSpan(), "Function block instance '" + ref.getName() + "' cannot be used as a value");
			}
			throw new StRuntimeException(ref.getSpan(), "Undeclared variable '" + ref.getName() + "'");
		}
		return value;
	}

	private Value readMember(MemberRef ref) {
		FunctionBlockInstance instance = store.getInstance(ref.getInstanceName());
		if (instance == null) {
			throw new StRuntimeException(ref.getSpan(), "Unknown function block instance '" + ref.getInstanceName() + "'");
		}
		if (!instance.getType().hasMember(ref.getMember())) {
			throw new StRuntimeException(ref.getSpan(), instance.getType() + " instance '" + ref.getInstanceName() + "' has no member " + ref.getMember());
		}
		return instance.getMember(ref.getMember());
	}

	private Value unary(UnaryOp op) {
		Value operand = evaluate(op.getOperand());
		switch (op.getOperator()) {
		case NOT:
			if (operand.getKind() == ValueKind.BOOL) {
				return Value.ofBool(!operand.asBool());
			}
			if (operand.getKind() == ValueKind.INT) {
				return Value.ofInt(~operand.asLong());
			}
			break;
		case NEGATE:
			if (operand.getKind() == ValueKind.INT) {
				return Value.ofInt(-operand.asLong());
			}
			if (operand.getKind() == ValueKind.REAL) {
				return Value.ofReal(-operand.asDouble());
			}
			if (operand.getKind() == ValueKind.TIME) {
				return Value.ofTime(-operand.asLong());
			}
			break;
		default:
			break;
		}
		throw new StRuntimeException(op.getSpan(), "Operator " + op.getOperator().getSymbol() + " cannot be applied to " + operand.getKind());
	}

	private Value binary(BinaryOp op) {
		Value left = evaluate(op.getLeft());
		Value right = evaluate(op.getRight());
		BinaryOperator operator = op.getOperator();
		if (operator.isLogical()) {
			return logical(operator, left, right, op.getSpan());
		}
		if (operator.isComparison()) {
			return comparison(operator, left, right, op.getSpan());
		}
		return arithmetic(operator, left, right, op.getSpan());
	}

	private static Value logical(BinaryOperator operator, Value left, Value right, SourceSpan span) {
		if (left.getKind() == ValueKind.BOOL && right.getKind() == ValueKind.BOOL) {
			boolean l = left.asBool();
			boolean r = right.asBool();
			switch (operator) {
			case AND:
				return Value.ofBool(l && r);
			case OR:
				return Value.ofBool(l || r);
			default:
				return Value.ofBool(l ^ r);
			}
		}
		if (left.getKind() == ValueKind.INT && right.getKind() == ValueKind.INT) {
			long l = left.asLong();
			long r = right.asLong();
			switch (operator) {
			case AND:
				return Value.ofInt(l & r);
			case OR:
				return Value.ofInt(l | r);
			default:
				return Value.ofInt(l ^ r);
			}
		}
		throw mismatch(operator, left, right, span);
	}

	private static Value comparison(BinaryOperator operator, Value left, Value right, SourceSpan span) {
		if (left.getKind() == ValueKind.BOOL || right.getKind() == ValueKind.BOOL) {
			if (left.getKind() != right.getKind() || (operator != BinaryOperator.EQ && operator != BinaryOperator.NE)) {
				throw mismatch(operator, left, right, span);
			}
		}
		int c = compare(left, right, span);
		switch (operator) {
		case EQ:
			return Value.ofBool(c == 0);
		case NE:
			return Value.ofBool(c != 0);
		case LT:
			return Value.ofBool(c < 0);
		case LE:
			return Value.ofBool(c <= 0);
		case GT:
			return Value.ofBool(c > 0);
		default:
			return Value.ofBool(c >= 0);
		}
	}

	/**
	 * Orders two values: numbers among themselves (widening INT to REAL), TIME
	 * with TIME and BOOL with BOOL.
	 *
	 * @param left left value
	 * @param right right value
	 * @param span location used in the error
	 * @return negative, zero or positive
	 * @throws StRuntimeException when the kinds cannot be compared
	 */
	static int compare(Value left, Value right, SourceSpan span) {
		ValueKind l = left.getKind();
		ValueKind r = right.getKind();
		if (l == ValueKind.BOOL && r == ValueKind.BOOL) {
			return Boolean.compare(left.asBool(), right.asBool());
		}
		if ((l == ValueKind.INT && r == ValueKind.INT) || (l == ValueKind.TIME && r == ValueKind.TIME)) {
			return Long.compare(left.asLong(), right.asLong());
		}
		if (left.isNumeric() && right.isNumeric()) {
			return Double.compare(left.asDouble(), right.asDouble());
		}
		throw new StRuntimeException(span, "Cannot compare " + l + " " + left + " with " + r + " " + right);
	}

	private Value arithmetic(BinaryOperator operator, Value left, Value right, SourceSpan span) {
		ValueKind l = left.getKind();
		ValueKind r = right.getKind();
		if (l == ValueKind.BOOL || r == ValueKind.BOOL) {
			throw mismatch(operator, left, right, span);
		}
		if (l == ValueKind.TIME || r == ValueKind.TIME) {
			return timeArithmetic(operator, left, right, span);
		}
		switch (operator) {
		case POW:
			return Value.ofReal(Math.pow(left.asDouble(), right.asDouble()));
		case MOD:
			if (l != ValueKind.INT || r != ValueKind.INT) {
				throw mismatch(operator, left, right, span);
			}
			if (right.asLong() == 0) {
				return divisionByZero(ValueKind.INT, span);
			}
			return Value.ofInt(left.asLong() % right.asLong());
		default:
			break;
		}
		if (l == ValueKind.INT && r == ValueKind.INT) {
			long a = left.asLong();
			long b = right.asLong();
			switch (operator) {
			case ADD:
				return Value.ofInt(a + b);
			case SUB:
				return Value.ofInt(a - b);
			case MUL:
				return Value.ofInt(a * b);
			default:
				if (b == 0) {
					return divisionByZero(ValueKind.INT, span);
				}
				return Value.ofInt(a / b);
			}
		}
		double a = left.asDouble();
		double b = right.asDouble();
		switch (operator) {
		case ADD:
			return Value.ofReal(a + b);
		case SUB:
			return Value.ofReal(a - b);
		case MUL:
			return Value.ofReal(a * b);
		default:
			return Value.ofReal(a / b);
		}
	}

	private Value timeArithmetic(BinaryOperator operator, Value left, Value right, SourceSpan span) {
		ValueKind l = left.getKind();
		ValueKind r = right.getKind();
		switch (operator) {
		case ADD:
		case SUB:
			if (l == ValueKind.TIME && r == ValueKind.TIME) {
				long sum = operator == BinaryOperator.ADD ? left.asLong() + right.asLong() : left.asLong() - right.asLong();
				return Value.ofTime(sum);
			}
			break;
		case MUL:
			if (l == ValueKind.TIME && r != ValueKind.TIME) {
				return scaleTime(left.asLong(), right, false, span);
			}
			if (r == ValueKind.TIME && l != ValueKind.TIME) {
				return scaleTime(right.asLong(), left, false, span);
			}
			break;
		case DIV:
			if (l == ValueKind.TIME && r != ValueKind.TIME) {
				return scaleTime(left.asLong(), right, true, span);
			}
			break;
		default:
			break;
		}
		throw mismatch(operator, left, right, span);
	}

	private Value scaleTime(long ms, Value factor, boolean divide, SourceSpan span) {
		if (factor.getKind() == ValueKind.INT) {
			long f = factor.asLong();
			if (!divide) {
				return Value.ofTime(ms * f);
			}
			return f == 0 ? divisionByZero(ValueKind.TIME, span) : Value.ofTime(ms / f);
		}
		double f = factor.asDouble();
		if (divide && f == 0.0) {
			return divisionByZero(ValueKind.TIME, span);
		}
		return Value.ofTime(Math.round(divide ? ms / f : ms * f));
	}

	private Value divisionByZero(ValueKind kind, SourceSpan span) {
		diagnostics.add(Diagnostic.warning("Division by zero, result forced to 0", span));
		return Value.zero(kind);
	}

	private static StRuntimeException mismatch(BinaryOperator operator, Value left, Value right, SourceSpan span) {
		return new StRuntimeException(
				span,
				"Operator " + operator.getSymbol() + " cannot be applied to " + left.getKind() + " and " + right.getKind());
	}

	private Value call(FunctionCall call) {
		if (call.getFunction() == null) {
			throw new StRuntimeException(call.getSpan(), "Unknown function '" + call.getName() + "'");
		}
		List<Value> arguments = new ArrayList<Value>(call.getArguments().size());
		for (Expression argument : call.getArguments()) {
			arguments.add(evaluate(argument));
		}
		return StandardFunctions.invoke(call.getFunction(), arguments, call.getSpan());
	}
}
