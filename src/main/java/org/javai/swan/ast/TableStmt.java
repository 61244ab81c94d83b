package org.javai.swan.ast;

import java.util.List;
import java.util.Objects;

/**
 * A data table: column labels followed by rows of cell expressions. Shape rules
 * (non-empty, one cell per column) are enforced by the semantic checker.
 */
public record TableStmt(String name, List<String> columns, List<TableRow> rows, Position position)
		implements Statement {

	public TableStmt {
		Objects.requireNonNull(name, "name must not be null");
		columns = List.copyOf(columns);
		rows = List.copyOf(rows);
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitTable(this);
	}
}
