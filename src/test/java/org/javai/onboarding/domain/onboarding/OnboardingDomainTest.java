package org.javai.onboarding.domain.onboarding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.javai.onboarding.dictionary.AttributeReference;
import org.javai.onboarding.dictionary.AttributeResolver;
import org.javai.onboarding.dictionary.JsonDictionaryLoader;
import org.javai.onboarding.dictionary.LookupContext;
import org.javai.onboarding.generate.GenerationRequest;
import org.javai.onboarding.generate.GenerationResponse;
import org.javai.onboarding.generate.UnsupportedInstructionException;
import org.javai.onboarding.registry.DomainMetrics;
import org.javai.onboarding.statemachine.IllegalTransitionException;
import org.javai.onboarding.validate.VerbNotFoundException;
import org.javai.onboarding.vocabulary.Vocabulary;
import org.javai.onboarding.vocabulary.VocabularyRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("OnboardingDomain")
class OnboardingDomainTest {

	private static final Vocabulary VOCABULARY = VocabularyRegistry.create()
			.registerResource(VocabularyRegistry.resourceFor(OnboardingDomain.NAME));
	private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

	private static final String CREATE_CASE = "(case.create (cbu.id \"CBU-1234\") (nature-purpose \"UCITS equity fund\"))";

	private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
	private final AttributeResolver resolver = new AttributeResolver(new JsonDictionaryLoader()
			.repositoryFrom(JsonDictionaryLoader.DEFAULT_RESOURCE, getClass().getClassLoader()));
	private final OnboardingDomain domain = new OnboardingDomain(VOCABULARY, resolver, Duration.ofSeconds(5), clock);

	@Test
	@DisplayName("describes itself from the vocabulary")
	void identity() {
		assertThat(domain.name()).isEqualTo("onboarding");
		assertThat(domain.version()).isEqualTo("1.0.0");
		assertThat(domain.description()).isNotBlank();
		assertThat(domain.isHealthy()).isTrue();
		assertThat(domain.initialState()).isEqualTo("CREATE");
		assertThat(domain.validStates()).containsExactly("CREATE", "PRODUCTS_ADDED", "KYC_STARTED",
				"SERVICES_DISCOVERED", "RESOURCES_PLANNED", "ATTRIBUTES_BOUND", "WORKFLOW_ACTIVE", "COMPLETE");
		assertThat(domain.attributeResolver()).isSameAs(resolver);
	}

	@Nested
	@DisplayName("Workflow state")
	class WorkflowState {

		@Test
		@DisplayName("a created case yields its id, purpose and CREATE")
		void createdCase() {
			Map<String, Object> context = domain.extractContext(CREATE_CASE);

			assertThat(context).containsExactly(
					Map.entry("cbu_id", "CBU-1234"),
					Map.entry("nature_purpose", "UCITS equity fund"),
					Map.entry("current_state", "CREATE"));
			assertThat(domain.getCurrentState(context)).isEqualTo("CREATE");
		}

		@Test
		@DisplayName("accumulated steps advance the state")
		void accumulatedSteps() {
			String document = CREATE_CASE + "\n(products.add \"CUSTODY\" \"FUND_ACCOUNTING\")\n"
					+ "(kyc.start (requirements (document \"CertificateOfIncorporation\") (jurisdiction \"LU\")))";

			Map<String, Object> context = domain.extractContext(document);

			assertThat(context).containsEntry("products", true).containsEntry("current_state", "KYC_STARTED");
			assertThat(domain.getCurrentState(context)).isEqualTo("KYC_STARTED");
		}

		@Test
		@DisplayName("a document with stray punctuation gives an empty context")
		void strayPunctuation() {
			Map<String, Object> context = domain.extractContext(
					"(case.create (cbu.id \"CBU-1234\"))\n(products.add CUSTODY, FUND_ACCOUNTING)");

			assertThat(context).isEmpty();
			assertThat(domain.getCurrentState(context)).isEqualTo("CREATE");
		}

		@Test
		@DisplayName("an empty context is in the initial state")
		void emptyContext() {
			assertThat(domain.getCurrentState(Map.of())).isEqualTo("CREATE");
		}

		@Test
		@DisplayName("closing the case completes it")
		void closedCase() {
			Map<String, Object> context = domain.extractContext(CREATE_CASE
					+ "\n(case.close (reason \"Onboarding completed successfully\") (final-state \"ACTIVE\"))");

			assertThat(context).containsEntry("current_state", "COMPLETE");
		}

		@Test
		@DisplayName("a missing source state is an illegal transition")
		void nullSourceState() {
			assertThatThrownBy(() -> domain.validateStateTransition(null, "CREATE"))
					.isInstanceOf(IllegalTransitionException.class)
					.hasMessage("unknown state: null");
		}

		@Test
		@DisplayName("only the next state is a legal transition")
		void transitions() {
			domain.validateStateTransition("CREATE", "PRODUCTS_ADDED");

			assertThatThrownBy(() -> domain.validateStateTransition("CREATE", "KYC_STARTED"))
					.isInstanceOf(IllegalTransitionException.class)
					.hasMessageContaining("expected PRODUCTS_ADDED");
			assertThatThrownBy(() -> domain.validateStateTransition("COMPLETE", "CREATE"))
					.isInstanceOf(IllegalTransitionException.class);
		}
	}

	@Nested
	@DisplayName("Generation")
	class Generation {

		@Test
		@DisplayName("create case takes the id and purpose from the instruction")
		void createCase() {
			GenerationResponse response = domain.generateDsl(
					GenerationRequest.of("Create case CBU-77 for \"Luxembourg SICAV\""));

			assertThat(response.dsl()).isEqualTo(
					"(case.create (cbu.id \"CBU-77\") (nature-purpose \"Luxembourg SICAV\"))");
			assertThat(response.verb()).isEqualTo("case.create");
			assertThat(response.parameters()).containsEntry("pattern", "onboarding_create_case");
		}

		@Test
		@DisplayName("create case derives an id from the clock when none is given")
		void createCaseDefaults() {
			GenerationResponse response = domain.generateDsl(GenerationRequest.of("create case for a new fund"));

			assertThat(response.dsl()).isEqualTo(
					"(case.create (cbu.id \"CBU-9200\") (nature-purpose \"Investment fund setup\"))");
			assertThat(response.parameters()).containsEntry("generated_at", NOW.toString());
		}

		@Test
		@DisplayName("add products lists the products named")
		void addProducts() {
			GenerationResponse response = domain.generateDsl(
					GenerationRequest.of("add products custody and transfer agent"));

			assertThat(response.dsl()).isEqualTo("(products.add \"CUSTODY\" \"TRANSFER_AGENT\")");
		}

		@Test
		@DisplayName("plan resources embeds named attribute references")
		void planResources() {
			GenerationResponse response = domain.generateDsl(GenerationRequest.of("plan resources"));

			assertThat(response.dsl())
					.contains("@attr{" + OnboardingAttributes.CUSTODY_ACCOUNT_NUMBER + ":custody.account_number}")
					.contains("@attr{" + OnboardingAttributes.TA_SHARE_CLASS + ":transfer_agency.share_class}");
			assertThat(AttributeReference.findAll(response.dsl())).hasSize(6).allMatch(AttributeReference::isNamed);
		}

		@Test
		@DisplayName("workflow transition reads its states from the context")
		void workflowTransition() {
			GenerationResponse response = domain.generateDsl(new GenerationRequest("workflow transition",
					Map.of("from_state", "ATTRIBUTES_BOUND", "to_state", "WORKFLOW_ACTIVE")));

			assertThat(response.dsl()).isEqualTo("(workflow.transition (from \"ATTRIBUTES_BOUND\") (to \"WORKFLOW_ACTIVE\"))");
		}

		@Test
		@DisplayName("every step template renders valid onboarding DSL")
		void everyTemplateValidates() {
			for (String instruction : List.of("create case", "add products", "start kyc", "discover services",
					"plan resources", "bind attributes", "workflow transition", "close case")) {
				GenerationResponse response = domain.generateDsl(GenerationRequest.of(instruction));

				assertThat(domain.validate(response.dsl()).isValid()).as(instruction).isTrue();
			}
		}

		@Test
		@DisplayName("an unknown instruction is unsupported")
		void unsupported() {
			assertThatThrownBy(() -> domain.generateDsl(GenerationRequest.of("order lunch")))
					.isInstanceOf(UnsupportedInstructionException.class)
					.hasMessage("unsupported onboarding instruction: order lunch");
		}
	}

	@Nested
	@DisplayName("Attribute enhancement")
	class Enhancement {

		@Test
		@DisplayName("bare references gain names and stay valid")
		void enhanceThenValidate() {
			LookupContext context = LookupContext.background();
			String dsl = "(values.bind @attr{" + OnboardingAttributes.CUSTODY_ACCOUNT_NUMBER + "} \"CUST-ACC-001\""
					+ " @attr{" + OnboardingAttributes.ACCOUNTING_FUND_CODE + "} \"FA-FUND-001\")";

			String enhanced = resolver.enhanceDslWithAttributeNames(context, dsl);

			assertThat(enhanced).isEqualTo("(values.bind @attr{" + OnboardingAttributes.CUSTODY_ACCOUNT_NUMBER
					+ ":custody.account_number} \"CUST-ACC-001\" @attr{" + OnboardingAttributes.ACCOUNTING_FUND_CODE
					+ ":accounting.fund_code} \"FA-FUND-001\")");
			assertThat(resolver.enhanceDslWithAttributeNames(context, enhanced)).isEqualTo(enhanced);
			domain.validateVerbs(enhanced);
			resolver.validateAttributeReferences(context, enhanced);
		}
	}

	@Test
	@DisplayName("metrics count validations and generations")
	void metrics() {
		domain.validateVerbs(CREATE_CASE);
		assertThatThrownBy(() -> domain.validateVerbs("(invalid.verb)")).isInstanceOf(VerbNotFoundException.class);
		domain.validate("(entity.register (type \"SLEEPING\") (jurisdiction \"LU\"))");
		domain.generateDsl(GenerationRequest.of("start kyc"));
		assertThatThrownBy(() -> domain.generateDsl(GenerationRequest.of("order lunch")))
				.isInstanceOf(UnsupportedInstructionException.class);

		DomainMetrics metrics = domain.metrics();

		assertThat(metrics.domain()).isEqualTo("onboarding");
		assertThat(metrics.verbCount()).isEqualTo(54);
		assertThat(metrics.categoryCount()).isEqualTo(13);
		assertThat(metrics.stateCount()).isEqualTo(8);
		assertThat(metrics.validations()).isEqualTo(3);
		assertThat(metrics.validationFailures()).isEqualTo(2);
		assertThat(metrics.generations()).isEqualTo(2);
		assertThat(metrics.generationFailures()).isEqualTo(1);
		assertThat(metrics.healthy()).isTrue();
		assertThat(metrics.memoryFootprintBytes()).isPositive();
		assertThat(metrics.collectedAt()).isEqualTo(NOW);
	}
}
