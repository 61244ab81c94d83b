package org.javai.swan.error;

import java.util.Optional;
import org.javai.swan.ast.Position;

/**
 * Base exception for every failure of the SWAN front end. A failed parse never yields a
 * partial program.
 */
public class SwanException extends RuntimeException {

	private final String detail;
	private final Position position;

	public SwanException(String detail, Position position) {
		super(position != null ? detail + " at " + position : detail);
		this.detail = detail;
		this.position = position;
	}

	/**
	 * The message without the position suffix.
	 */
	public String detail() {
		return detail;
	}

	public Optional<Position> position() {
		return Optional.ofNullable(position);
	}
}
