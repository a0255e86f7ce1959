package org.javai.onboarding.session;

/**
 * Identifies one accumulated document: a session working in one domain.
 */
public record SessionKey(String sessionId, String domain) {

	public SessionKey {
		if (sessionId == null || sessionId.isBlank()) {
			throw new IllegalArgumentException("sessionId must not be blank");
		}
		if (domain == null || domain.isBlank()) {
			throw new IllegalArgumentException("domain must not be blank");
		}
	}
}
