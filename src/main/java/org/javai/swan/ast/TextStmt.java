package org.javai.swan.ast;

import java.util.Objects;

public record TextStmt(String text, Position position) implements Statement {

	public TextStmt {
		Objects.requireNonNull(text, "text must not be null");
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitText(this);
	}
}
