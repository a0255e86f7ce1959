package org.javai.onboarding.domain.onboarding;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.javai.onboarding.dictionary.AttributeResolver;
import org.javai.onboarding.domain.AbstractDomain;
import org.javai.onboarding.registry.RoutingHints;
import org.javai.onboarding.statemachine.ProgressMarker;
import org.javai.onboarding.statemachine.VerbMarkerContextExtractor;
import org.javai.onboarding.vocabulary.Vocabulary;
import org.javai.onboarding.vocabulary.VocabularyRegistry;

/**
 * Client onboarding: from case creation through products, KYC, services, resources and
 * attribute binding to an active workflow and a closed case.
 * <p>
 * Attribute references in generated DSL are resolved through the {@link AttributeResolver}
 * this domain was built with.
 */
public class OnboardingDomain extends AbstractDomain {

	public static final String NAME = "onboarding";

	public static final Duration DEFAULT_LOOKUP_TIMEOUT = Duration.ofSeconds(5);

	private static final RoutingHints ROUTING_HINTS = new RoutingHints(
			List.of("onboard", "onboarding", "case", "cbu", "custody", "fund accounting", "transfer agent", "kyc",
					"products", "services", "resources"),
			List.of("cbu_id", "nature_purpose"),
			List.of("client onboarding"));

	private final AttributeResolver attributeResolver;

	public OnboardingDomain(Vocabulary vocabulary, AttributeResolver attributeResolver, Duration lookupTimeout,
			Clock clock) {
		super(vocabulary, contextExtractor(), OnboardingTemplates.all(clock), attributeResolver, lookupTimeout,
				clock);
		this.attributeResolver = attributeResolver != null ? attributeResolver : AttributeResolver.withoutDictionary();
	}

	/**
	 * Build the domain from the bundled vocabulary resource.
	 */
	public static OnboardingDomain create(AttributeResolver attributeResolver) {
		Vocabulary vocabulary = VocabularyRegistry.create().registerResource(VocabularyRegistry.resourceFor(NAME));
		return new OnboardingDomain(vocabulary, attributeResolver, DEFAULT_LOOKUP_TIMEOUT, Clock.systemUTC());
	}

	public static OnboardingDomain create() {
		return create(AttributeResolver.withoutDictionary());
	}

	/**
	 * Progress markers in workflow order. A case with only a {@code cbu_id} is in {@code CREATE}.
	 */
	static VerbMarkerContextExtractor contextExtractor() {
		return VerbMarkerContextExtractor.builder()
				.capture("cbu.id", "cbu_id")
				.capture("nature-purpose", "nature_purpose")
				.marker(ProgressMarker.captured("cbu_id", "CREATE"))
				.marker(ProgressMarker.verb("products.add", "products", "PRODUCTS_ADDED"))
				.marker(ProgressMarker.verb("kyc.start", "kyc_started", "KYC_STARTED"))
				.marker(ProgressMarker.verb("services.discover", "services_discovered", "SERVICES_DISCOVERED"))
				.marker(ProgressMarker.verb("resources.plan", "resources_planned", "RESOURCES_PLANNED"))
				.marker(ProgressMarker.verb("values.bind", "attributes_bound", "ATTRIBUTES_BOUND"))
				.marker(ProgressMarker.verb("workflow.transition", "workflow_active", "WORKFLOW_ACTIVE"))
				.terminal("case.close", "COMPLETE")
				.build();
	}

	public AttributeResolver attributeResolver() {
		return attributeResolver;
	}

	@Override
	public RoutingHints routingHints() {
		return ROUTING_HINTS;
	}
}
