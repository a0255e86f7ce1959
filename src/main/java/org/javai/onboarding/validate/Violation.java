package org.javai.onboarding.validate;

/**
 * One problem found while validating a document.
 *
 * @param kind category of the problem
 * @param message human readable description
 * @param subject the verb, argument or token the problem concerns; may be {@code null}
 * @param position character offset in the source, or -1 when not tied to a location
 */
public record Violation(ViolationKind kind, String message, String subject, int position) {
}
