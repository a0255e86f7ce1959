package org.javai.onboarding.registry;

import org.javai.onboarding.DslException;

public class DuplicateDomainException extends DslException {

	public DuplicateDomainException(String name) {
		super("domain " + name + " is already registered");
	}
}
