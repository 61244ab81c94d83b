package org.javai.swan.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Root of a SWAN document: exactly one app declaration plus pages and components in
 * source order.
 */
public record Program(AppDecl app, List<PageDecl> pages, List<ComponentDecl> components) {

	public Program {
		Objects.requireNonNull(app, "app must not be null");
		pages = List.copyOf(pages);
		components = List.copyOf(components);
	}

	/**
	 * First page declared with the given name.
	 */
	public Optional<PageDecl> page(String name) {
		return pages.stream().filter(p -> p.name().equals(name)).findFirst();
	}

	/**
	 * First component declared with the given name.
	 */
	public Optional<ComponentDecl> component(String name) {
		return components.stream().filter(c -> c.name().equals(name)).findFirst();
	}
}
