package org.javai.swan.ast;

import java.util.Objects;

public record QueryArg(String key, Expression value, Position position) {

	public QueryArg {
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(value, "value must not be null");
	}
}
