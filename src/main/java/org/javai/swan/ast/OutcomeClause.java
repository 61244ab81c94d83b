package org.javai.swan.ast;

import java.util.Objects;

/**
 * One {@code outcome -> Page} line of a handler. Outcome labels are free words such as
 * {@code success} or {@code error}.
 */
public record OutcomeClause(String outcome, String target, Position position) {

	public OutcomeClause {
		Objects.requireNonNull(outcome, "outcome must not be null");
		Objects.requireNonNull(target, "target must not be null");
	}
}
