package org.javai.swan.ast;

public enum UnaryOperator {
	NOT("!");

	private final String symbol;

	UnaryOperator(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}
