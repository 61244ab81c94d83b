package org.javai.swan.ast;

public enum ChartType {
	BAR("bar"),
	LINE("line"),
	PIE("pie"),
	AREA("area"),
	SCATTER("scatter");

	private final String keyword;

	ChartType(String keyword) {
		this.keyword = keyword;
	}

	public String keyword() {
		return keyword;
	}
}
