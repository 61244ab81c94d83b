package org.javai.swan.ast;

/**
 * A location in SWAN source text. Line and column are both 1-based.
 */
public record Position(int line, int column) {

	public static Position of(int line, int column) {
		return new Position(line, column);
	}

	@Override
	public String toString() {
		return line + ":" + column;
	}
}
