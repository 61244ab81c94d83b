package org.javai.swan;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.javai.swan.ast.Program;
import org.javai.swan.lexer.SwanToken;
import org.javai.swan.lexer.SwanTokenizer;
import org.javai.swan.parser.SwanParser;
import org.javai.swan.semantic.SemanticChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the SWAN front end: tokenizes, parses and checks a document.
 *
 * <p>Usage:
 * <pre>{@code
 * Program program = Swan.parse(source, ParseOptions.strict());
 * }</pre>
 *
 * Every call starts from scratch and shares no state with other calls, so concurrent use
 * with independent inputs is safe.
 */
public final class Swan {

	private static final Logger logger = LoggerFactory.getLogger(Swan.class);

	private Swan() {
		// Utility class - no instantiation
	}

	/**
	 * Parses and validates a document with default options (strict mode off).
	 */
	public static Program parse(String source) {
		return parse(source, ParseOptions.defaults());
	}

	/**
	 * Parses and validates a document.
	 *
	 * @param source SWAN source text
	 * @param options validation options
	 * @return the validated program
	 * @throws org.javai.swan.error.SwanSyntaxException if the text is not valid SWAN syntax
	 * @throws org.javai.swan.error.SwanSemanticException if a semantic rule is violated
	 */
	public static Program parse(String source, ParseOptions options) {
		Objects.requireNonNull(source, "source must not be null");
		Objects.requireNonNull(options, "options must not be null");

		List<SwanToken> tokens = new SwanTokenizer(source).tokenize();
		Program program = new SwanParser(tokens).parseProgram();
		SemanticChecker.check(program, options);
		return program;
	}

	public static Program parseFile(Path path) {
		return parseFile(path, ParseOptions.defaults());
	}

	/**
	 * Reads a UTF-8 file and parses it.
	 *
	 * @throws UncheckedIOException if the file cannot be read
	 */
	public static Program parseFile(Path path, ParseOptions options) {
		Objects.requireNonNull(path, "path must not be null");
		logger.debug("Parsing SWAN file {}", path);
		String source;
		try {
			source = Files.readString(path, StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read SWAN file: " + path, e);
		}
		return parse(source, options);
	}
}
