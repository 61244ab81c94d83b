package org.javai.swan.ast;

import java.util.List;
import java.util.Optional;

/**
 * One table row.
 *
 * @param cells cell expressions in column order
 * @param actions per-row action block, or {@code null} when the row has none
 * @param position position of the {@code row} keyword
 */
public record TableRow(List<Expression> cells, List<Statement> actions, Position position) {

	public TableRow {
		cells = List.copyOf(cells);
		actions = actions == null ? null : List.copyOf(actions);
	}

	public Optional<List<Statement>> actionBlock() {
		return Optional.ofNullable(actions);
	}
}
