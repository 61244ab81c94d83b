package org.javai.swan.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * Declares a query parameter accepted by a page.
 *
 * @param name the parameter name
 * @param valueType declared type, or {@code null} when untyped
 * @param defaultValue default literal, or {@code null} when there is none
 * @param position position of the {@code query} keyword
 */
public record QueryStmt(String name, QueryType valueType, Literal defaultValue, Position position)
		implements Statement {

	public QueryStmt {
		Objects.requireNonNull(name, "name must not be null");
	}

	public Optional<QueryType> type() {
		return Optional.ofNullable(valueType);
	}

	public Optional<Literal> defaultLiteral() {
		return Optional.ofNullable(defaultValue);
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitQuery(this);
	}
}
