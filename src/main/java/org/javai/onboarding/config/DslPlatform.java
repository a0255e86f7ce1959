package org.javai.onboarding.config;

import java.time.Clock;
import java.util.Objects;
import org.javai.onboarding.dictionary.AttributeResolver;
import org.javai.onboarding.dictionary.JsonDictionaryLoader;
import org.javai.onboarding.domain.onboarding.OnboardingDomain;
import org.javai.onboarding.domain.ubo.UboDomain;
import org.javai.onboarding.registry.Domain;
import org.javai.onboarding.registry.DomainRegistry;
import org.javai.onboarding.registry.DomainRouter;
import org.javai.onboarding.registry.RoutingRequest;
import org.javai.onboarding.registry.RoutingResult;
import org.javai.onboarding.session.SessionAccumulator;
import org.javai.onboarding.vocabulary.VocabularyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Everything needed to serve DSL requests, wired from one {@link DslPlatformConfig}: vocabularies,
 * the attribute dictionary, the enabled domains, the domain registry and router, and the session
 * accumulator.
 * <p>
 * Create one per application and close it on shutdown.
 *
 * <pre>
 * try (DslPlatform platform = DslPlatform.create(DslPlatformConfig.defaults())) {
 *     Domain domain = platform.domain("onboarding");
 *     domain.validateVerbs("(case.create (cbu.id \"CBU-1234\"))");
 * }
 * </pre>
 */
public final class DslPlatform implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(DslPlatform.class);

	private final DslPlatformConfig config;
	private final VocabularyRegistry vocabularies;
	private final AttributeResolver attributeResolver;
	private final DomainRegistry registry;
	private final DomainRouter router;
	private final SessionAccumulator sessions;

	private DslPlatform(DslPlatformConfig config, VocabularyRegistry vocabularies, AttributeResolver attributeResolver,
			DomainRegistry registry) {
		this.config = config;
		this.vocabularies = vocabularies;
		this.attributeResolver = attributeResolver;
		this.registry = registry;
		this.router = new DomainRouter(registry);
		this.sessions = new SessionAccumulator(config.fragmentSeparator());
	}

	public static DslPlatform create(DslPlatformConfig config) {
		return create(config, Clock.systemUTC(), DslPlatform.class.getClassLoader());
	}

	/**
	 * @throws IllegalArgumentException if an enabled domain is unknown or a resource is missing
	 * @throws org.javai.onboarding.vocabulary.VocabularyException if a vocabulary cannot be loaded
	 */
	public static DslPlatform create(DslPlatformConfig config, Clock clock, ClassLoader loader) {
		Objects.requireNonNull(config, "config must not be null");
		Objects.requireNonNull(clock, "clock must not be null");
		Objects.requireNonNull(loader, "loader must not be null");

		VocabularyRegistry vocabularies = VocabularyRegistry.create()
				.registerResources(config.vocabularyResources(), loader);
		AttributeResolver attributeResolver = config.dictionaryResource() != null
				? new AttributeResolver(new JsonDictionaryLoader().repositoryFrom(config.dictionaryResource(), loader))
				: AttributeResolver.withoutDictionary();

		DomainRegistry registry = new DomainRegistry();
		for (String name : config.enabledDomains()) {
			registry.register(newDomain(name, vocabularies, attributeResolver, config, clock));
		}
		logger.info("DSL platform ready with domains {} (dictionary: {})", registry.names(),
				attributeResolver.hasDictionary() ? config.dictionaryResource() : "none");
		return new DslPlatform(config, vocabularies, attributeResolver, registry);
	}

	private static Domain newDomain(String name, VocabularyRegistry vocabularies, AttributeResolver attributeResolver,
			DslPlatformConfig config, Clock clock) {
		switch (name) {
			case OnboardingDomain.NAME:
				return new OnboardingDomain(vocabularies.requireVocabulary(name), attributeResolver,
						config.lookupTimeout(), clock);
			case UboDomain.NAME:
				return new UboDomain(vocabularies.requireVocabulary(name), attributeResolver,
						config.lookupTimeout(), clock);
			default:
				throw new IllegalArgumentException("Unknown domain: " + name);
		}
	}

	public DslPlatformConfig config() {
		return config;
	}

	public VocabularyRegistry vocabularies() {
		return vocabularies;
	}

	public AttributeResolver attributeResolver() {
		return attributeResolver;
	}

	public DomainRegistry registry() {
		return registry;
	}

	public DomainRouter router() {
		return router;
	}

	public SessionAccumulator sessions() {
		return sessions;
	}

	/**
	 * @throws org.javai.onboarding.registry.DomainNotFoundException if the domain is not registered
	 */
	public Domain domain(String name) {
		return registry.get(name);
	}

	public RoutingResult route(RoutingRequest request) {
		return router.route(request);
	}

	@Override
	public void close() {
		registry.shutdown();
	}
}
