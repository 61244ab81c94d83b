package org.javai.swan.ast;

import java.util.Objects;

public record FieldStmt(String name, Position position) implements Statement {

	public FieldStmt {
		Objects.requireNonNull(name, "name must not be null");
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitField(this);
	}
}
