package org.javai.swan.ast;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * An unsigned integer or decimal literal. Held as a {@link BigDecimal} so that the
 * written form, including trailing zeros, survives a round trip.
 */
public record NumberLiteral(BigDecimal value, Position position) implements Literal {

	public NumberLiteral {
		Objects.requireNonNull(value, "value must not be null");
	}

	public static NumberLiteral parse(String text, Position position) {
		return new NumberLiteral(new BigDecimal(text), position);
	}

	@Override
	public String text() {
		return value.toPlainString();
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitNumber(this);
	}
}
