package org.javai.swan.ast;

import java.util.List;
import java.util.Objects;

public record ChartSeries(String label, List<ChartPoint> points, Position position) {

	public ChartSeries {
		Objects.requireNonNull(label, "label must not be null");
		points = List.copyOf(points);
	}
}
