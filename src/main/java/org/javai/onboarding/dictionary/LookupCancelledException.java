package org.javai.onboarding.dictionary;

/**
 * The lookup context was cancelled or its deadline passed before the lookup completed.
 */
public class LookupCancelledException extends AttributeResolutionException {

	public LookupCancelledException(String message) {
		super(message);
	}
}
