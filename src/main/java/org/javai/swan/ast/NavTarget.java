package org.javai.swan.ast;

import java.util.List;
import java.util.Objects;

/**
 * A navigation edge: {@code -> Page ?key=expr&key2=expr2}. The target page is held by
 * name and resolved statically by the semantic checker.
 *
 * @param target name of the destination page
 * @param queryArgs query bindings in source order, empty when none were given
 * @param position position of the {@code ->} token
 */
public record NavTarget(String target, List<QueryArg> queryArgs, Position position) {

	public NavTarget {
		Objects.requireNonNull(target, "target must not be null");
		queryArgs = queryArgs == null ? List.of() : List.copyOf(queryArgs);
	}

	public static NavTarget to(String target, Position position) {
		return new NavTarget(target, List.of(), position);
	}

	public boolean hasQueryArgs() {
		return !queryArgs.isEmpty();
	}
}
