package org.javai.swan.ast;

import java.util.List;
import java.util.Objects;

/**
 * A reusable, non-routable unit embedded into pages and other components with
 * {@code use}.
 */
public record ComponentDecl(String name, List<Statement> body, Position position) implements ScopeDecl {

	public ComponentDecl {
		Objects.requireNonNull(name, "name must not be null");
		body = List.copyOf(body);
	}

	@Override
	public String kind() {
		return "component";
	}
}
