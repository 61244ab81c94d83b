package org.javai.swan.ast;

import java.util.List;
import java.util.Objects;

public record ChartStmt(String name, ChartType chartType, List<ChartSeries> series, Position position)
		implements Statement {

	public ChartStmt {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(chartType, "chartType must not be null");
		series = List.copyOf(series);
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitChart(this);
	}
}
