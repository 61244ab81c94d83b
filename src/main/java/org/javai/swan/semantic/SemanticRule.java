package org.javai.swan.semantic;

/**
 * The fourteen static rules enforced by {@link SemanticChecker}.
 */
public enum SemanticRule {
	SR_1("SR-1", "app must define a non-empty entry"),
	SR_2("SR-2", "entry must name a declared page"),
	SR_3("SR-3", "navigation targets must be declared pages"),
	SR_4("SR-4", "every page must be reachable from the entry page (strict mode)"),
	SR_5("SR-5", "component composition must be acyclic"),
	SR_6("SR-6", "names must be unique and component uses must resolve"),
	SR_7("SR-7", "query parameters may only be declared by pages"),
	SR_8("SR-8", "query parameter names must be unique within a page"),
	SR_9("SR-9", "navigation query arguments must be declared by the target page"),
	SR_10("SR-10", "every table row must have one cell per column"),
	SR_11("SR-11", "tables must declare at least one column and one row"),
	SR_12("SR-12", "charts must have at least one series"),
	SR_13("SR-13", "chart series must have at least one point"),
	SR_14("SR-14", "pie charts must have exactly one series");

	private final String code;
	private final String description;

	SemanticRule(String code, String description) {
		this.code = code;
		this.description = description;
	}

	/**
	 * The rule code as written in diagnostics, e.g. {@code SR-6}.
	 */
	public String code() {
		return code;
	}

	public String description() {
		return description;
	}
}
