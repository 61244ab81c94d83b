package org.javai.swan.ast;

import java.util.Objects;

/**
 * {@code app Name { entry Page }}
 */
public record AppDecl(String name, String entry, Position position) {

	public AppDecl {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(entry, "entry must not be null");
	}
}
