package org.javai.swan.ast;

import java.util.Objects;

/**
 * Embeds a component by name. The name is resolved by the semantic checker, never
 * linked as an object reference.
 */
public record UseStmt(String component, Position position) implements Statement {

	public UseStmt {
		Objects.requireNonNull(component, "component must not be null");
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitUse(this);
	}
}
