package org.javai.onboarding.dsl.syntax;

/**
 * Syntax error inside a quoted literal: an unterminated string or an {@code @attr{...}}
 * reference missing its closing brace.
 */
public class MalformedLiteralException extends DslSyntaxException {

	public MalformedLiteralException(String message, int position) {
		super(message, position);
	}
}
