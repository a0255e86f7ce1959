package org.javai.onboarding.dsl.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for the onboarding DSL.
 * <p>
 * Whitespace and {@code ;} line comments are dropped. Double-quoted strings are
 * returned as single STRING tokens so that verb-shaped text inside them is never
 * mistaken for an invocation. {@code @attr{...}} references are returned whole.
 */
public class DslTokenizer {

	private static final String ATTR_PREFIX = "@attr{";

	private final String input;
	private int pos = 0;

	public DslTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens (includes EOF token at end)
	 * @throws DslSyntaxException if invalid syntax is encountered
	 */
	public List<DslToken> tokenize() {
		List<DslToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespaceAndComments();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new DslToken(DslToken.TokenType.EOF, "", pos));
		return tokens;
	}

	private DslToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '(' -> {
				advance();
				yield new DslToken(DslToken.TokenType.LPAREN, "(", start);
			}
			case ')' -> {
				advance();
				yield new DslToken(DslToken.TokenType.RPAREN, ")", start);
			}
			case '"' -> scanString();
			case '@' -> scanAttributeReference();
			default -> {
				if (isDigit(c) || ((c == '-' || c == '+') && pos + 1 < input.length() && isDigit(input.charAt(pos + 1)))) {
					yield scanNumber();
				} else if (isIdentifierStart(c)) {
					yield scanIdentifier();
				} else {
					throw new DslSyntaxException("Unexpected character: '" + c + "' at position " + pos, pos);
				}
			}
		};
	}

	private DslToken scanString() {
		int start = pos;
		advance(); // opening "

		StringBuilder sb = new StringBuilder();
		while (!isAtEnd() && peek() != '"') {
			char c = advance();
			if (c == '\\' && !isAtEnd()) {
				char next = advance();
				sb.append(switch (next) {
					case 'n' -> '\n';
					case 't' -> '\t';
					case 'r' -> '\r';
					case '"' -> '"';
					case '\\' -> '\\';
					default -> next;
				});
			} else {
				sb.append(c);
			}
		}

		if (isAtEnd()) {
			throw new MalformedLiteralException("Unterminated string at position " + start, start);
		}

		advance(); // closing "
		return new DslToken(DslToken.TokenType.STRING, sb.toString(), start);
	}

	private DslToken scanAttributeReference() {
		int start = pos;
		if (!input.startsWith(ATTR_PREFIX, pos)) {
			throw new DslSyntaxException("Expected '" + ATTR_PREFIX + "' at position " + start, start);
		}
		pos += ATTR_PREFIX.length();
		int bodyStart = pos;
		while (!isAtEnd() && peek() != '}') {
			if (peek() == '\n') {
				break;
			}
			advance();
		}
		if (isAtEnd() || peek() != '}') {
			throw new MalformedLiteralException("Unterminated attribute reference at position " + start, start);
		}
		String body = input.substring(bodyStart, pos);
		advance(); // closing }
		return new DslToken(DslToken.TokenType.ATTR_REF, body, start);
	}

	private DslToken scanNumber() {
		int start = pos;

		if (peek() == '-' || peek() == '+') {
			advance();
		}

		while (!isAtEnd() && isDigit(peek())) {
			advance();
		}

		if (!isAtEnd() && peek() == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1))) {
			advance(); // '.'
			while (!isAtEnd() && isDigit(peek())) {
				advance();
			}
		}

		String value = input.substring(start, pos);
		return new DslToken(DslToken.TokenType.NUMBER, value, start);
	}

	private DslToken scanIdentifier() {
		int start = pos;

		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}

		String value = input.substring(start, pos);
		return new DslToken(DslToken.TokenType.IDENTIFIER, value, start);
	}

	private void skipWhitespaceAndComments() {
		while (!isAtEnd()) {
			char c = peek();
			if (isWhitespace(c)) {
				advance();
			} else if (c == ';') {
				while (!isAtEnd() && peek() != '\n') {
					advance();
				}
			} else {
				return;
			}
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r';
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || isDigit(c) || c == '.' || c == '-';
	}
}
