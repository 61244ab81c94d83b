package org.javai.swan.ast;

import java.util.Objects;

public record SubmitStmt(String label, String action, Position position) implements ActionStmt {

	public SubmitStmt {
		Objects.requireNonNull(label, "label must not be null");
		Objects.requireNonNull(action, "action must not be null");
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitSubmit(this);
	}
}
