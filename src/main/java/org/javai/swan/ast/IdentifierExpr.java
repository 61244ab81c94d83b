package org.javai.swan.ast;

import java.util.Objects;

public record IdentifierExpr(String name, Position position) implements Expression {

	public IdentifierExpr {
		Objects.requireNonNull(name, "name must not be null");
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitIdentifier(this);
	}
}
