package org.javai.swan.ast;

import java.util.Objects;

/**
 * {@code point x, y}
 */
public record ChartPoint(Expression x, Expression y, Position position) {

	public ChartPoint {
		Objects.requireNonNull(x, "x must not be null");
		Objects.requireNonNull(y, "y must not be null");
	}
}
