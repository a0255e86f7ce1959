package org.javai.onboarding.statemachine;

import org.javai.onboarding.DslException;

/**
 * A state change that is not the immediate successor, or that names an unknown state.
 */
public class IllegalTransitionException extends DslException {

	private final String from;
	private final String to;

	public IllegalTransitionException(String from, String to, String message) {
		super(message);
		this.from = from;
		this.to = to;
	}

	public String from() {
		return from;
	}

	public String to() {
		return to;
	}
}
