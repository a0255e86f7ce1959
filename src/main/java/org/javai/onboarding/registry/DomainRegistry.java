package org.javai.onboarding.registry;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.javai.onboarding.vocabulary.Vocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the domains available to the platform.
 * <p>
 * Domains are registered at startup and read thereafter. Registration takes a lock so the
 * duplicate check and the insert happen together; reads go straight to the concurrent map.
 * Domain names are unique.
 */
public class DomainRegistry implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(DomainRegistry.class);

	private final Map<String, Domain> domains = new ConcurrentHashMap<>();
	private final ReentrantLock registrationLock = new ReentrantLock();
	private volatile boolean shutdown;

	/**
	 * @throws DuplicateDomainException if a domain with the same name is already registered
	 * @throws IllegalStateException if the registry has been shut down
	 */
	public void register(Domain domain) {
		Objects.requireNonNull(domain, "domain must not be null");
		String name = domain.name();
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("domain name must not be empty");
		}
		registrationLock.lock();
		try {
			if (shutdown) {
				throw new IllegalStateException("registry has been shut down");
			}
			if (domains.containsKey(name)) {
				throw new DuplicateDomainException(name);
			}
			domains.put(name, domain);
		}
		finally {
			registrationLock.unlock();
		}
		logger.info("Registered domain {} v{} with {} verbs", name, domain.version(), domain.vocabulary().verbCount());
	}

	/**
	 * @return whether a domain was removed
	 */
	public boolean unregister(String name) {
		registrationLock.lock();
		try {
			boolean removed = domains.remove(name) != null;
			if (removed) {
				logger.debug("Unregistered domain {}", name);
			}
			return removed;
		}
		finally {
			registrationLock.unlock();
		}
	}

	/**
	 * @throws DomainNotFoundException if no domain has that name
	 */
	public Domain get(String name) {
		return find(name).orElseThrow(() -> DomainNotFoundException.named(name));
	}

	public Optional<Domain> find(String name) {
		if (name == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(domains.get(name));
	}

	public boolean contains(String name) {
		return name != null && domains.containsKey(name);
	}

	/**
	 * All domains sorted by name.
	 */
	public List<Domain> list() {
		return domains.values().stream()
				.sorted(Comparator.comparing(Domain::name))
				.toList();
	}

	public List<String> names() {
		return list().stream().map(Domain::name).toList();
	}

	public int size() {
		return domains.size();
	}

	public boolean isEmpty() {
		return domains.isEmpty();
	}

	public Vocabulary getVocabulary(String name) {
		return get(name).vocabulary();
	}

	public RegistryMetrics getMetrics() {
		Map<String, DomainMetrics> perDomain = new LinkedHashMap<>();
		for (Domain domain : list()) {
			perDomain.put(domain.name(), domain.metrics());
		}
		return RegistryMetrics.of(perDomain);
	}

	/**
	 * Removes every domain and refuses further registrations.
	 */
	public void shutdown() {
		registrationLock.lock();
		try {
			if (shutdown) {
				return;
			}
			shutdown = true;
			int count = domains.size();
			domains.clear();
			logger.info("Domain registry shut down, released {} domains", count);
		}
		finally {
			registrationLock.unlock();
		}
	}

	public boolean isShutdown() {
		return shutdown;
	}

	@Override
	public void close() {
		shutdown();
	}
}
