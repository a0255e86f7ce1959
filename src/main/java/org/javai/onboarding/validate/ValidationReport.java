package org.javai.onboarding.validate;

import java.util.List;
import java.util.Optional;

/**
 * Result of validating a document against one domain's vocabulary.
 */
public record ValidationReport(String domain, List<Violation> violations) {

	public ValidationReport {
		violations = violations != null ? List.copyOf(violations) : List.of();
	}

	public static ValidationReport valid(String domain) {
		return new ValidationReport(domain, List.of());
	}

	public boolean isValid() {
		return violations.isEmpty();
	}

	public Optional<Violation> firstViolation() {
		return violations.isEmpty() ? Optional.empty() : Optional.of(violations.get(0));
	}

	public List<Violation> violationsOf(ViolationKind kind) {
		return violations.stream().filter(v -> v.kind() == kind).toList();
	}
}
