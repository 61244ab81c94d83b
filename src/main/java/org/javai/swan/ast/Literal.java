package org.javai.swan.ast;

/**
 * The three literal forms of the language: strings, numbers and booleans.
 */
public sealed interface Literal extends Expression permits StringLiteral, NumberLiteral, BooleanLiteral {

	/**
	 * The literal as it is written in source, without quotes for strings.
	 */
	String text();
}
