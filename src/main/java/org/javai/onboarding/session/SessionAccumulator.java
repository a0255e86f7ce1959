package org.javai.onboarding.session;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.javai.onboarding.registry.Domain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only DSL documents keyed by session and domain.
 * <p>
 * Appends for one key are serialised by {@link ConcurrentHashMap#compute}, so concurrent
 * fragments for the same session never interleave or get lost; different keys do not contend.
 * Text is only ever appended. {@link #clear(SessionKey)} drops a whole session.
 */
public class SessionAccumulator {

	private static final Logger logger = LoggerFactory.getLogger(SessionAccumulator.class);

	public static final String DEFAULT_SEPARATOR = "\n";

	private final Map<SessionKey, String> documents = new ConcurrentHashMap<>();
	private final String separator;

	public SessionAccumulator() {
		this(DEFAULT_SEPARATOR);
	}

	public SessionAccumulator(String separator) {
		if (separator == null || separator.isEmpty()) {
			throw new IllegalArgumentException("separator must not be empty");
		}
		this.separator = separator;
	}

	/**
	 * Appends a fragment and returns the whole document.
	 */
	public String accumulateDsl(SessionKey key, String fragment) {
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(fragment, "fragment must not be null");
		String updated = documents.compute(key, (k, existing) -> join(existing, fragment));
		logger.debug("Session {} in {} now holds {} characters", key.sessionId(), key.domain(), updated.length());
		return updated;
	}

	/**
	 * Appends a fragment only if the resulting document still passes the domain's verb
	 * validation. The check runs under the key's lock, so it sees exactly the text being extended.
	 *
	 * @throws org.javai.onboarding.DslException if the combined document is invalid; the session is left unchanged
	 */
	public String accumulateValidated(SessionKey key, String fragment, Domain domain) {
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(fragment, "fragment must not be null");
		Objects.requireNonNull(domain, "domain must not be null");
		if (!domain.name().equals(key.domain())) {
			throw new IllegalArgumentException("session " + key + " does not belong to domain " + domain.name());
		}
		return documents.compute(key, (k, existing) -> {
			String candidate = join(existing, fragment);
			domain.validateVerbs(candidate);
			return candidate;
		});
	}

	/**
	 * The accumulated document, or an empty string for an unknown session.
	 */
	public String getDsl(SessionKey key) {
		Objects.requireNonNull(key, "key must not be null");
		return documents.getOrDefault(key, "");
	}

	public boolean contains(SessionKey key) {
		return documents.containsKey(key);
	}

	public List<SessionKey> sessions() {
		return List.copyOf(documents.keySet());
	}

	/**
	 * @return whether a session was removed
	 */
	public boolean clear(SessionKey key) {
		Objects.requireNonNull(key, "key must not be null");
		return documents.remove(key) != null;
	}

	public DslSession session(SessionKey key) {
		return new DslSession(this, key);
	}

	private String join(String existing, String fragment) {
		if (existing == null || existing.isEmpty()) {
			return fragment;
		}
		return existing + separator + fragment;
	}
}
