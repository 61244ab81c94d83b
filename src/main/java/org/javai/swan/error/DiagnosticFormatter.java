package org.javai.swan.error;

import java.util.Objects;
import org.javai.swan.ast.Position;

/**
 * Renders a {@link SwanException} as a compiler-style diagnostic with a source excerpt.
 *
 * <p>Example output:
 * <pre>
 * error[SR-3]: Navigation target "Missing" must be a page ("Missing" is not defined)
 *   --> home.swan:4:19
 *    |
 *  4 |   button "Next" -> Missing
 *    |                   ^^
 * </pre>
 *
 * The underline starts at the reported column and runs to the end of the word found
 * there. Errors without a position render the header line only.
 */
public final class DiagnosticFormatter {

	private DiagnosticFormatter() {
		// Utility class - no instantiation
	}

	public static String format(String source, SwanException error) {
		return format(source, null, error);
	}

	/**
	 * @param source the text that was parsed
	 * @param filename optional name shown in the location line (may be null)
	 * @param error the failure to render
	 */
	public static String format(String source, String filename, SwanException error) {
		Objects.requireNonNull(error, "error must not be null");
		StringBuilder sb = new StringBuilder();
		sb.append("error");
		if (error instanceof SwanSemanticException semantic) {
			sb.append('[').append(semantic.rule().code()).append(']');
			sb.append(": ").append(stripRulePrefix(semantic.detail()));
		}
		else {
			sb.append(": ").append(error.detail());
		}
		sb.append('\n');

		if (error.position().isEmpty() || source == null) {
			return sb.toString();
		}
		Position position = error.position().get();
		String[] lines = source.split("\n", -1);

		sb.append("  --> ");
		if (filename != null) {
			sb.append(filename).append(':');
		}
		sb.append(position.line()).append(':').append(position.column()).append('\n');

		if (position.line() < 1 || position.line() > lines.length) {
			return sb.toString();
		}
		String lineContent = lines[position.line() - 1].replace("\r", "");
		int gutterWidth = String.valueOf(position.line()).length();
		String gutter = " ".repeat(gutterWidth + 1);

		sb.append(gutter).append("|\n");
		sb.append(String.format("%" + gutterWidth + "d", position.line())).append(" | ").append(lineContent).append('\n');
		sb.append(gutter).append("| ")
			.append(" ".repeat(Math.max(0, position.column() - 1)))
			.append("^".repeat(underlineLength(lineContent, position.column())))
			.append('\n');
		return sb.toString();
	}

	private static int underlineLength(String line, int column) {
		int start = column - 1;
		if (start < 0 || start >= line.length()) {
			return 1;
		}
		int end = start;
		while (end < line.length() && !Character.isWhitespace(line.charAt(end))) {
			end++;
		}
		return Math.max(1, end - start);
	}

	private static String stripRulePrefix(String detail) {
		int close = detail.indexOf("] ");
		return detail.startsWith("[") && close > 0 ? detail.substring(close + 2) : detail;
	}
}
