package org.javai.onboarding.validate;

import org.javai.onboarding.DslException;

/**
 * Raised when DSL text is well formed but does not fit a domain's vocabulary.
 */
public class DslValidationException extends DslException {

	private final String domain;

	public DslValidationException(String domain, String message) {
		super(message);
		this.domain = domain;
	}

	public String domain() {
		return domain;
	}
}
