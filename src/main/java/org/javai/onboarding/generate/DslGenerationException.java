package org.javai.onboarding.generate;

import org.javai.onboarding.DslException;

/**
 * A template matched but did not produce valid DSL.
 */
public class DslGenerationException extends DslException {

	public DslGenerationException(String message) {
		super(message);
	}

	public DslGenerationException(String message, Throwable cause) {
		super(message, cause);
	}
}
