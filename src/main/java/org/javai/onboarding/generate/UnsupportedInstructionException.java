package org.javai.onboarding.generate;

import org.javai.onboarding.DslException;

public class UnsupportedInstructionException extends DslException {

	private final String instruction;

	public UnsupportedInstructionException(String domain, String instruction) {
		super("unsupported " + domain + " instruction: " + instruction);
		this.instruction = instruction;
	}

	public String instruction() {
		return instruction;
	}
}
