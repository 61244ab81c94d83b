package org.javai.swan.ast;

/**
 * Declared type of a page query parameter.
 */
public enum QueryType {
	STRING("string"),
	NUMBER("number"),
	BOOLEAN("boolean");

	private final String keyword;

	QueryType(String keyword) {
		this.keyword = keyword;
	}

	public String keyword() {
		return keyword;
	}
}
