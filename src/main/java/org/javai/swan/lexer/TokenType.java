package org.javai.swan.lexer;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Token types of the SWAN language: reserved words, literals, identifiers and
 * punctuation.
 */
public enum TokenType {
	// Reserved words
	APP("app", true),
	PAGE("page", true),
	COMPONENT("component", true),
	ENTRY("entry", true),
	USE("use", true),
	HEADER("header", true),
	TEXT("text", true),
	BUTTON("button", true),
	LINK("link", true),
	FIELD("field", true),
	INPUT("input", true),
	SUBMIT("submit", true),
	CLICK("click", true),
	ON("on", true),
	IF("if", true),
	QUERY("query", true),
	STRING_TYPE("string", true),
	NUMBER_TYPE("number", true),
	BOOLEAN_TYPE("boolean", true),
	TRUE("true", true),
	FALSE("false", true),
	TABLE("table", true),
	COLUMNS("columns", true),
	ROW("row", true),
	CHART("chart", true),
	SERIES("series", true),
	POINT("point", true),
	BAR("bar", true),
	LINE("line", true),
	PIE("pie", true),
	AREA("area", true),
	SCATTER("scatter", true),

	// Identifiers and literals
	IDENT("identifier", false),
	STRING("string literal", false),
	NUMBER("number literal", false),

	// Operators and punctuation
	ARROW("->", false),
	LBRACE("{", false),
	RBRACE("}", false),
	LBRACKET("[", false),
	RBRACKET("]", false),
	COMMA(",", false),
	DOT(".", false),
	EQ("==", false),
	NEQ("!=", false),
	LTE("<=", false),
	GTE(">=", false),
	LT("<", false),
	GT(">", false),
	AND("&&", false),
	OR("||", false),
	BANG("!", false),
	ASSIGN("=", false),
	COLON(":", false),
	QUESTION("?", false),
	AMPERSAND("&", false),
	PLUS("+", false),

	EOF("end of input", false);

	private static final Map<String, TokenType> KEYWORDS;

	static {
		Map<String, TokenType> keywords = new HashMap<>();
		for (TokenType type : values()) {
			if (type.keyword) {
				keywords.put(type.text, type);
			}
		}
		KEYWORDS = Collections.unmodifiableMap(keywords);
	}

	private final String text;
	private final boolean keyword;

	TokenType(String text, boolean keyword) {
		this.text = text;
		this.keyword = keyword;
	}

	/**
	 * Source spelling for reserved words and punctuation; a description for the
	 * other types.
	 */
	public String text() {
		return text;
	}

	public boolean isKeyword() {
		return keyword;
	}

	/**
	 * Looks up a reserved word. Only exact matches are keywords: {@code tables} or
	 * {@code Page} are plain identifiers.
	 */
	public static Optional<TokenType> keyword(String word) {
		return Optional.ofNullable(KEYWORDS.get(word));
	}
}
