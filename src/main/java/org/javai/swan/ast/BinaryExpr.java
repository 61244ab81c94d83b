package org.javai.swan.ast;

import java.util.Objects;

/**
 * A binary operation. The position is that of the operator token.
 */
public record BinaryExpr(BinaryOperator operator, Expression left, Expression right, Position position)
		implements Expression {

	public BinaryExpr {
		Objects.requireNonNull(operator, "operator must not be null");
		Objects.requireNonNull(left, "left must not be null");
		Objects.requireNonNull(right, "right must not be null");
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitBinary(this);
	}
}
