package org.javai.swan.ast;

import java.util.List;
import java.util.Objects;

public record ConditionalStmt(Expression condition, List<Statement> body, Position position) implements Statement {

	public ConditionalStmt {
		Objects.requireNonNull(condition, "condition must not be null");
		body = List.copyOf(body);
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitConditional(this);
	}
}
