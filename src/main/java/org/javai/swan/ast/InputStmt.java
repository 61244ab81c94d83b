package org.javai.swan.ast;

import java.util.Objects;

public record InputStmt(String name, Position position) implements Statement {

	public InputStmt {
		Objects.requireNonNull(name, "name must not be null");
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitInput(this);
	}
}
