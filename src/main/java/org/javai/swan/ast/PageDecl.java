package org.javai.swan.ast;

import java.util.List;
import java.util.Objects;

/**
 * A routable page; the only valid navigation target.
 */
public record PageDecl(String name, List<Statement> body, Position position) implements ScopeDecl {

	public PageDecl {
		Objects.requireNonNull(name, "name must not be null");
		body = List.copyOf(body);
	}

	@Override
	public String kind() {
		return "page";
	}
}
