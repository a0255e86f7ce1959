package org.javai.onboarding.validate;

/**
 * A verb-shaped form head that is neither a vocabulary verb nor an argument of its enclosing verb.
 */
public class VerbNotFoundException extends DslValidationException {

	private final String verb;

	public VerbNotFoundException(String domain, String verb) {
		super(domain, "invalid " + domain + " verb: " + verb);
		this.verb = verb;
	}

	public String verb() {
		return verb;
	}
}
