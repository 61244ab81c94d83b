package org.javai.swan.ast;

public record BooleanLiteral(boolean value, Position position) implements Literal {

	@Override
	public String text() {
		return Boolean.toString(value);
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitBoolean(this);
	}
}
