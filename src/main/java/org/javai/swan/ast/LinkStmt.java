package org.javai.swan.ast;

import java.util.Objects;

public record LinkStmt(String label, NavTarget nav, Position position) implements Statement {

	public LinkStmt {
		Objects.requireNonNull(label, "label must not be null");
		Objects.requireNonNull(nav, "a link always navigates");
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitLink(this);
	}
}
