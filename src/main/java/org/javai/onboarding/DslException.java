package org.javai.onboarding;

/**
 * Root of the exceptions raised by the DSL semantic layer.
 * <p>
 * Every failure in this layer is reported to the caller as a subtype of this exception;
 * none of them is fatal to the process.
 */
public class DslException extends RuntimeException {

	public DslException(String message) {
		super(message);
	}

	public DslException(String message, Throwable cause) {
		super(message, cause);
	}
}
