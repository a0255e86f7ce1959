package org.javai.onboarding.dictionary;

import org.javai.onboarding.DslException;

/**
 * Base type for failures to turn an attribute id into a name.
 */
public class AttributeResolutionException extends DslException {

	public AttributeResolutionException(String message) {
		super(message);
	}

	public AttributeResolutionException(String message, Throwable cause) {
		super(message, cause);
	}
}
