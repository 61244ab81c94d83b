package org.javai.swan.ast;

import java.util.Objects;

/**
 * A double-quoted string literal. The value excludes the quotes; the language has no
 * escape sequences.
 */
public record StringLiteral(String value, Position position) implements Literal {

	public StringLiteral {
		Objects.requireNonNull(value, "value must not be null");
	}

	@Override
	public String text() {
		return value;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitString(this);
	}
}
