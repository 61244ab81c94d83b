package org.javai.swan.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code on <action> { outcome -> Page ... }}
 */
public record HandlerStmt(String action, List<OutcomeClause> outcomes, Position position) implements Statement {

	public HandlerStmt {
		Objects.requireNonNull(action, "action must not be null");
		outcomes = List.copyOf(outcomes);
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitHandler(this);
	}
}
