package org.javai.swan;

/**
 * Options controlling how a SWAN document is validated.
 *
 * @param strictMode when true, every page must also be reachable from the entry page
 *     (rule SR-4)
 */
public record ParseOptions(boolean strictMode) {

	private static final ParseOptions DEFAULTS = new ParseOptions(false);
	private static final ParseOptions STRICT = new ParseOptions(true);

	public static ParseOptions defaults() {
		return DEFAULTS;
	}

	public static ParseOptions strict() {
		return STRICT;
	}

	public ParseOptions withStrictMode(boolean strictMode) {
		return strictMode ? STRICT : DEFAULTS;
	}
}
