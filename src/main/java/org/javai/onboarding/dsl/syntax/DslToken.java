package org.javai.onboarding.dsl.syntax;

/**
 * Represents a token of the onboarding DSL.
 *
 * @param type the token type
 * @param value the token value (string contents are unescaped, attribute references keep their braces body)
 * @param position the character position in the input string
 */
public record DslToken(TokenType type, String value, int position) {

	public enum TokenType {
		IDENTIFIER,    // verbs, argument keywords, bare symbols
		STRING,        // "quoted strings"
		NUMBER,        // integers and decimals
		ATTR_REF,      // @attr{id} or @attr{id:name}
		LPAREN,        // (
		RPAREN,        // )
		EOF            // end of input
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING(\"" + value + "\")";
			case ATTR_REF -> "ATTR_REF(@attr{" + value + "})";
			case NUMBER, IDENTIFIER -> type + "(" + value + ")";
			default -> type.toString();
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}
}
