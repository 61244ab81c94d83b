package org.javai.swan.error;

import java.util.Objects;
import org.javai.swan.ast.Position;

/**
 * Exception thrown when SWAN source text cannot be tokenized or does not match the
 * grammar. Always positioned.
 */
public class SwanSyntaxException extends SwanException {

	public SwanSyntaxException(String detail, Position position) {
		super(detail, Objects.requireNonNull(position, "syntax errors are always positioned"));
	}
}
