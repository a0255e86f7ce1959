package org.javai.onboarding.session;

import java.util.Map;
import java.util.Objects;
import org.javai.onboarding.registry.Domain;

/**
 * Handle on one accumulated document, bound to its key.
 */
public final class DslSession {

	private final SessionAccumulator accumulator;
	private final SessionKey key;

	DslSession(SessionAccumulator accumulator, SessionKey key) {
		this.accumulator = Objects.requireNonNull(accumulator, "accumulator must not be null");
		this.key = Objects.requireNonNull(key, "key must not be null");
	}

	public SessionKey key() {
		return key;
	}

	public String append(String fragment) {
		return accumulator.accumulateDsl(key, fragment);
	}

	public String appendValidated(String fragment, Domain domain) {
		return accumulator.accumulateValidated(key, fragment, domain);
	}

	public String dsl() {
		return accumulator.getDsl(key);
	}

	/**
	 * Context recovered from the whole document by the given domain.
	 */
	public Map<String, Object> context(Domain domain) {
		return domain.extractContext(dsl());
	}
}
