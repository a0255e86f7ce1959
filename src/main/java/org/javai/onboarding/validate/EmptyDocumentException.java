package org.javai.onboarding.validate;

/**
 * The document contains no recognisable verb. Blank and comment-only text end up here.
 */
public class EmptyDocumentException extends DslValidationException {

	public EmptyDocumentException(String domain) {
		super(domain, "no " + domain + " verbs found in DSL");
	}
}
