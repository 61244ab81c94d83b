package org.javai.swan.lexer;

import java.util.ArrayList;
import java.util.List;
import org.javai.swan.ast.Position;
import org.javai.swan.error.SwanSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tokenizer for SWAN source text.
 * Converts the input string into a fully materialized list of tokens, dropping
 * whitespace and {@code //} line comments. The list always ends with an EOF token.
 */
public class SwanTokenizer {

	private static final Logger logger = LoggerFactory.getLogger(SwanTokenizer.class);

	private final String input;
	private int pos = 0;
	private int line = 1;
	private int column = 1;

	public SwanTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens (includes EOF token at end)
	 * @throws SwanSyntaxException at the first character sequence that is not a token
	 */
	public List<SwanToken> tokenize() {
		List<SwanToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespaceAndComments();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new SwanToken(TokenType.EOF, "", line, column));
		logger.trace("Tokenized {} characters into {} tokens", input.length(), tokens.size());
		return tokens;
	}

	private SwanToken nextToken() {
		int startLine = line;
		int startColumn = column;
		char c = peek();

		if (c == '"') {
			return scanString();
		}
		if (isDigit(c)) {
			return scanNumber();
		}
		if (isIdentifierStart(c)) {
			return scanWord();
		}

		advance();
		TokenType type = switch (c) {
			case '-' -> match('>') ? TokenType.ARROW : null;
			case '=' -> match('=') ? TokenType.EQ : TokenType.ASSIGN;
			case '!' -> match('=') ? TokenType.NEQ : TokenType.BANG;
			case '<' -> match('=') ? TokenType.LTE : TokenType.LT;
			case '>' -> match('=') ? TokenType.GTE : TokenType.GT;
			case '&' -> match('&') ? TokenType.AND : TokenType.AMPERSAND;
			case '|' -> match('|') ? TokenType.OR : null;
			case '{' -> TokenType.LBRACE;
			case '}' -> TokenType.RBRACE;
			case '[' -> TokenType.LBRACKET;
			case ']' -> TokenType.RBRACKET;
			case ',' -> TokenType.COMMA;
			case '.' -> TokenType.DOT;
			case ':' -> TokenType.COLON;
			case '?' -> TokenType.QUESTION;
			case '+' -> TokenType.PLUS;
			default -> null;
		};
		if (type == null) {
			throw new SwanSyntaxException("Unexpected character '" + c + "'", new Position(startLine, startColumn));
		}
		return new SwanToken(type, type.text(), startLine, startColumn);
	}

	private SwanToken scanString() {
		int startLine = line;
		int startColumn = column;
		advance(); // consume opening "

		int start = pos;
		while (!isAtEnd() && peek() != '"') {
			advance();
		}

		if (isAtEnd()) {
			throw new SwanSyntaxException("Unterminated string literal", new Position(startLine, startColumn));
		}

		String value = input.substring(start, pos);
		advance(); // consume closing "
		return new SwanToken(TokenType.STRING, value, startLine, startColumn);
	}

	private SwanToken scanNumber() {
		int startColumn = column;
		int start = pos;

		while (!isAtEnd() && isDigit(peek())) {
			advance();
		}

		// A dot only belongs to the number when a digit follows it
		if (!isAtEnd() && peek() == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1))) {
			advance(); // consume '.'
			while (!isAtEnd() && isDigit(peek())) {
				advance();
			}
		}

		return new SwanToken(TokenType.NUMBER, input.substring(start, pos), line, startColumn);
	}

	private SwanToken scanWord() {
		int startColumn = column;
		int start = pos;

		while (!isAtEnd() && isIdentifierPart(peek())) {
			advance();
		}

		String word = input.substring(start, pos);
		TokenType type = TokenType.keyword(word).orElse(TokenType.IDENT);
		return new SwanToken(type, word, line, startColumn);
	}

	private void skipWhitespaceAndComments() {
		while (!isAtEnd()) {
			char c = peek();
			if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
				advance();
			}
			else if (c == '/' && pos + 1 < input.length() && input.charAt(pos + 1) == '/') {
				while (!isAtEnd() && peek() != '\n') {
					advance();
				}
			}
			else {
				break;
			}
		}
	}

	private boolean match(char expected) {
		if (isAtEnd() || peek() != expected) {
			return false;
		}
		advance();
		return true;
	}

	private char peek() {
		return input.charAt(pos);
	}

	private char advance() {
		char c = input.charAt(pos++);
		if (c == '\n') {
			line++;
			column = 1;
		}
		else {
			column++;
		}
		return c;
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	private boolean isIdentifierPart(char c) {
		return isIdentifierStart(c) || isDigit(c) || c == '_';
	}
}
