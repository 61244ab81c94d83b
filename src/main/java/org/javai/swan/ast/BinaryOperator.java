package org.javai.swan.ast;

/**
 * Binary operators, listed from the loosest binding to the tightest.
 */
public enum BinaryOperator {
	OR("||"),
	AND("&&"),
	EQ("=="),
	NEQ("!="),
	LT("<"),
	GT(">"),
	LTE("<="),
	GTE(">="),
	PLUS("+");

	private final String symbol;

	BinaryOperator(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}

	public boolean isComparison() {
		return switch (this) {
			case EQ, NEQ, LT, GT, LTE, GTE -> true;
			default -> false;
		};
	}
}
