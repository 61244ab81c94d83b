package org.javai.swan.ast;

import java.util.Objects;

public record UnaryExpr(UnaryOperator operator, Expression operand, Position position) implements Expression {

	public UnaryExpr {
		Objects.requireNonNull(operator, "operator must not be null");
		Objects.requireNonNull(operand, "operand must not be null");
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitUnary(this);
	}
}
