package org.javai.swan.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * A button. Buttons without a navigation target are valid anywhere a button is.
 *
 * @param label the button caption
 * @param nav the navigation edge, or {@code null} for a non-navigating button
 * @param position position of the {@code button} keyword
 */
public record ButtonStmt(String label, NavTarget nav, Position position) implements Statement {

	public ButtonStmt {
		Objects.requireNonNull(label, "label must not be null");
	}

	public Optional<NavTarget> navTarget() {
		return Optional.ofNullable(nav);
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitButton(this);
	}
}
