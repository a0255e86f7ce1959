package org.javai.onboarding.registry;

import org.javai.onboarding.DslException;

public class DomainNotFoundException extends DslException {

	public DomainNotFoundException(String message) {
		super(message);
	}

	public static DomainNotFoundException named(String name) {
		return new DomainNotFoundException("domain " + name + " not found");
	}
}
