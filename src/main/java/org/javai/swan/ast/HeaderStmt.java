package org.javai.swan.ast;

import java.util.Objects;

public record HeaderStmt(String text, Position position) implements Statement {

	public HeaderStmt {
		Objects.requireNonNull(text, "text must not be null");
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitHeader(this);
	}
}
