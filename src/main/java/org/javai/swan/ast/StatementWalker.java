package org.javai.swan.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Utility class for walking statement bodies. Every fact the semantic checker needs
 * (actions, queries, navigation edges, component uses, tables, charts) is gathered
 * through this one traversal, parameterized by what is extracted and how deep it
 * descends.
 */
public final class StatementWalker {

	/**
	 * Which nested blocks a walk descends into.
	 */
	public enum Descent {
		/** Recurse only into {@code if} bodies. */
		CONDITIONALS,
		/** Recurse into {@code if} bodies and table row action blocks. */
		NESTED_BLOCKS
	}

	private StatementWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Visits every statement in pre-order (a block statement before its children),
	 * so callers see statements in source order.
	 *
	 * @param body the statements to walk
	 * @param descent which nested blocks to enter
	 * @param action invoked once per statement
	 */
	public static void walk(List<Statement> body, Descent descent, Consumer<Statement> action) {
		if (body == null) {
			return;
		}
		for (Statement statement : body) {
			action.accept(statement);
			if (statement instanceof ConditionalStmt conditional) {
				walk(conditional.body(), descent, action);
			}
			else if (descent == Descent.NESTED_BLOCKS && statement instanceof TableStmt table) {
				for (TableRow row : table.rows()) {
					walk(row.actions(), descent, action);
				}
			}
		}
	}

	/**
	 * Collects facts from a body. The extractor returns the facts contributed by a single
	 * statement (an empty list when it contributes none); nested blocks are handled
	 * here, not by the extractor.
	 *
	 * @param <T> the fact type
	 * @param body the statements to walk
	 * @param descent which nested blocks to enter
	 * @param extractor maps one statement to its facts
	 * @return all facts, in source order
	 */
	public static <T> List<T> collect(List<Statement> body, Descent descent,
			Function<Statement, List<? extends T>> extractor) {
		List<T> facts = new ArrayList<>();
		walk(body, descent, statement -> facts.addAll(extractor.apply(statement)));
		return facts;
	}

	/**
	 * Collects all statements of one variant.
	 */
	public static <S extends Statement> List<S> collectOfType(List<Statement> body, Descent descent,
			Class<S> type) {
		List<S> matches = new ArrayList<>();
		walk(body, descent, statement -> {
			if (type.isInstance(statement)) {
				matches.add(type.cast(statement));
			}
		});
		return matches;
	}

	/**
	 * Navigation edges contributed by a single statement: a button's or link's
	 * target, or every outcome target of a handler.
	 */
	public static List<String> navigationTargets(Statement statement) {
		if (statement instanceof ButtonStmt button) {
			return button.navTarget().map(nav -> List.of(nav.target())).orElse(List.of());
		}
		if (statement instanceof LinkStmt link) {
			return List.of(link.nav().target());
		}
		if (statement instanceof HandlerStmt handler) {
			return handler.outcomes().stream().map(OutcomeClause::target).toList();
		}
		return List.of();
	}
}
