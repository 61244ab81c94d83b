package org.javai.swan.ast;

import java.util.List;

/**
 * A named declaration owning a statement body. Pages and components live in separate
 * namespaces.
 */
public sealed interface ScopeDecl permits PageDecl, ComponentDecl {

	String name();

	List<Statement> body();

	Position position();

	/**
	 * Human-readable kind, used in diagnostics.
	 */
	String kind();
}
