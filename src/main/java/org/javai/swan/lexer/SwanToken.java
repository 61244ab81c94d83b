package org.javai.swan.lexer;

import org.javai.swan.ast.Position;

/**
 * A token of SWAN source text.
 *
 * @param type the token type
 * @param text the token value; string literals exclude their quotes
 * @param line 1-based line of the first character
 * @param column 1-based column of the first character
 */
public record SwanToken(TokenType type, String text, int line, int column) {

	public Position position() {
		return new Position(line, column);
	}

	public boolean is(TokenType expected) {
		return type == expected;
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING(\"" + text + "\")";
			case NUMBER, IDENT -> type + "(" + text + ")";
			default -> type.toString();
		};
	}
}
