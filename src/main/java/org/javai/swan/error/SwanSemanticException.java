package org.javai.swan.error;

import java.util.Objects;
import org.javai.swan.ast.Position;
import org.javai.swan.semantic.SemanticRule;

/**
 * Exception thrown when a syntactically valid program violates a static semantic rule.
 * Program-level violations may have no position.
 */
public class SwanSemanticException extends SwanException {

	private final SemanticRule rule;

	public SwanSemanticException(SemanticRule rule, String detail, Position position) {
		super("[" + Objects.requireNonNull(rule, "rule must not be null").code() + "] " + detail, position);
		this.rule = rule;
	}

	public SwanSemanticException(SemanticRule rule, String detail) {
		this(rule, detail, null);
	}

	public SemanticRule rule() {
		return rule;
	}
}
