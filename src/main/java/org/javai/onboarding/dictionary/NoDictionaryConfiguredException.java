package org.javai.onboarding.dictionary;

/**
 * Single-id resolution was requested from a resolver that has no repository.
 */
public class NoDictionaryConfiguredException extends AttributeResolutionException {

	public NoDictionaryConfiguredException() {
		super("no attribute dictionary configured");
	}
}
