package org.javai.onboarding.dsl.syntax;

import org.javai.onboarding.DslException;

/**
 * Exception thrown when DSL text cannot be tokenized or parsed.
 */
public class DslSyntaxException extends DslException {

	private final int position;

	public DslSyntaxException(String message, int position) {
		super(message);
		this.position = position;
	}

	/**
	 * Character offset in the input where the problem was detected.
	 */
	public int position() {
		return position;
	}
}
