package org.javai.onboarding.vocabulary;

import org.javai.onboarding.DslException;

/**
 * Raised when a vocabulary is malformed or cannot be loaded.
 */
public class VocabularyException extends DslException {

	public VocabularyException(String message) {
		super(message);
	}

	public VocabularyException(String message, Throwable cause) {
		super(message, cause);
	}
}
