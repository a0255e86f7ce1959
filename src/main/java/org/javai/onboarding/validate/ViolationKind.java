package org.javai.onboarding.validate;

public enum ViolationKind {
	UNKNOWN_VERB,
	EMPTY_DOCUMENT,
	SYNTAX,
	INVALID_ARGUMENT_VALUE
}
