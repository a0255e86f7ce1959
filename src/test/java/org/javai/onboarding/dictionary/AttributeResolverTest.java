package org.javai.onboarding.dictionary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.Level;
import org.javai.onboarding.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AttributeResolver")
class AttributeResolverTest {

	private static final String ACCOUNT_NUMBER = "456789ab-cdef-1234-5678-9abcdef01301";
	private static final String ACCOUNT_TYPE = "456789ab-cdef-1234-5678-9abcdef01303";
	private static final String UNKNOWN = "deadbeef-0000-0000-0000-000000000000";

	private final InMemoryDictionaryRepository repository = new InMemoryDictionaryRepository(List.of(
			Attribute.of(ACCOUNT_NUMBER, "custody.account_number", "Custody account number"),
			Attribute.of(ACCOUNT_TYPE, "custody.account_type", "Type of custody account")));

	private final AttributeResolver resolver = new AttributeResolver(repository);
	private final AttributeResolver withoutDictionary = AttributeResolver.withoutDictionary();
	private final LookupContext context = LookupContext.background();

	@Nested
	@DisplayName("Single resolution")
	class SingleResolution {

		@Test
		@DisplayName("returns the dictionary name")
		void resolvesName() {
			assertThat(resolver.resolveAttributeName(context, ACCOUNT_NUMBER)).isEqualTo("custody.account_number");
		}

		@Test
		@DisplayName("an unknown id is an error naming the id")
		void unknownId() {
			assertThatThrownBy(() -> resolver.resolveAttributeName(context, UNKNOWN))
					.isInstanceOf(AttributeNotFoundException.class)
					.hasMessage("attribute not found: " + UNKNOWN);
		}

		@Test
		@DisplayName("without a dictionary it fails")
		void noDictionary() {
			assertThatThrownBy(() -> withoutDictionary.resolveAttributeName(context, ACCOUNT_NUMBER))
					.isInstanceOf(NoDictionaryConfiguredException.class)
					.isInstanceOf(AttributeResolutionException.class);
		}

		@Test
		@DisplayName("a cancelled context fails as a resolution error")
		void cancelledContext() {
			LookupContext cancelled = LookupContext.background();
			cancelled.cancel();

			assertThatThrownBy(() -> resolver.resolveAttributeName(cancelled, ACCOUNT_NUMBER))
					.isInstanceOf(LookupCancelledException.class)
					.isInstanceOf(AttributeResolutionException.class)
					.hasMessage("lookup cancelled");
		}

		@Test
		@DisplayName("an expired deadline fails as a resolution error")
		void expiredContext() {
			Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:05Z"), ZoneOffset.UTC);
			LookupContext expired = LookupContext.withDeadline(Instant.parse("2026-03-01T10:00:00Z"), clock);

			assertThatThrownBy(() -> resolver.resolveAttributeName(expired, ACCOUNT_NUMBER))
					.isInstanceOf(LookupCancelledException.class)
					.hasMessageContaining("deadline exceeded");
		}
	}

	@Nested
	@DisplayName("Bulk resolution")
	class BulkResolution {

		@Test
		@DisplayName("unknown ids map to themselves and are logged")
		void lenientFallback() {
			try (LogCaptorAppender appender = LogCaptorAppender.create(AttributeResolver.class, Level.WARN)) {
				Map<String, String> names = resolver.resolveAttributesByIds(context, List.of(ACCOUNT_NUMBER, UNKNOWN));

				assertThat(names).containsExactly(
						Map.entry(ACCOUNT_NUMBER, "custody.account_number"),
						Map.entry(UNKNOWN, UNKNOWN));
				assertThat(appender.messagesAt(Level.WARN))
						.anyMatch(message -> message.contains(UNKNOWN) && message.contains("using id as name"));
			}
		}

		@Test
		@DisplayName("without a dictionary every id maps to itself")
		void noDictionary() {
			assertThat(withoutDictionary.resolveAttributesByIds(context, List.of(ACCOUNT_NUMBER)))
					.containsEntry(ACCOUNT_NUMBER, ACCOUNT_NUMBER);
		}

		@Test
		@DisplayName("a cancelled context falls back instead of failing")
		void cancelledContext() {
			LookupContext cancelled = LookupContext.background();
			cancelled.cancel();

			assertThat(resolver.resolveAttributesByIds(cancelled, List.of(ACCOUNT_NUMBER)))
					.containsEntry(ACCOUNT_NUMBER, ACCOUNT_NUMBER);
		}

		@Test
		@DisplayName("null or empty ids give an empty map")
		void nullIds() {
			assertThat(resolver.resolveAttributesByIds(context, null)).isEmpty();
			assertThat(resolver.resolveAttributesByIds(context, List.of())).isEmpty();
		}
	}

	@Nested
	@DisplayName("Document enhancement")
	class Enhancement {

		@Test
		@DisplayName("bare references gain their names")
		void addsNames() {
			String enhanced = resolver.enhanceDslWithAttributeNames(context,
					"(case.create @attr{" + ACCOUNT_NUMBER + "})");

			assertThat(enhanced).isEqualTo("(case.create @attr{" + ACCOUNT_NUMBER + ":custody.account_number})");
		}

		@Test
		@DisplayName("enhancing twice equals enhancing once")
		void idempotent() {
			String dsl = "(values.bind @attr{" + ACCOUNT_NUMBER + "} \"X\" @attr{" + UNKNOWN + "} \"Y\" @attr{"
					+ ACCOUNT_TYPE + ":custody.account_type} \"Z\")";

			String once = resolver.enhanceDslWithAttributeNames(context, dsl);
			String twice = resolver.enhanceDslWithAttributeNames(context, once);

			assertThat(twice).isEqualTo(once);
			assertThat(once).contains("@attr{" + UNKNOWN + "}");
		}

		@Test
		@DisplayName("named references are left as written, even when the name is stale")
		void namedReferencesAreFrozen() {
			String dsl = "(values.bind @attr{" + ACCOUNT_NUMBER + ":legacy.account} \"X\")";

			assertThat(resolver.enhanceDslWithAttributeNames(context, dsl)).isEqualTo(dsl);
		}

		@Test
		@DisplayName("without a dictionary the text is unchanged")
		void noDictionary() {
			String dsl = "(case.create @attr{" + ACCOUNT_NUMBER + "})";

			assertThat(withoutDictionary.enhanceDslWithAttributeNames(context, dsl)).isEqualTo(dsl);
		}
	}

	@Nested
	@DisplayName("Reference generation and validation")
	class References {

		@Test
		@DisplayName("a known id gives a named reference that validates")
		void knownIdRoundTrip() {
			String reference = resolver.generateAttributeReference(context, ACCOUNT_NUMBER);

			assertThat(reference).isEqualTo("@attr{" + ACCOUNT_NUMBER + ":custody.account_number}");
			assertThatCode(() -> resolver.validateAttributeReferences(context, reference)).doesNotThrowAnyException();
		}

		@Test
		@DisplayName("an unknown id gives a bare reference that fails validation")
		void unknownIdRoundTrip() {
			String reference = resolver.generateAttributeReference(context, UNKNOWN);

			assertThat(reference).isEqualTo("@attr{" + UNKNOWN + "}");
			assertThatThrownBy(() -> resolver.validateAttributeReferences(context, reference))
					.isInstanceOf(AttributeNotFoundException.class)
					.hasMessageContaining("@attr{" + UNKNOWN + "}")
					.satisfies(e -> assertThat(((AttributeNotFoundException) e).attributeId()).isEqualTo(UNKNOWN));
		}

		@Test
		@DisplayName("an empty id is rejected")
		void emptyId() {
			assertThatThrownBy(() -> resolver.generateAttributeReference(context, " "))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessage("attribute id must not be empty");
		}

		@Test
		@DisplayName("without a dictionary references are bare and validation is skipped")
		void noDictionary() {
			assertThat(withoutDictionary.generateAttributeReference(context, UNKNOWN)).isEqualTo("@attr{" + UNKNOWN + "}");
			assertThatCode(() -> withoutDictionary.validateAttributeReferences(context, "@attr{" + UNKNOWN + "}"))
					.doesNotThrowAnyException();
		}

		@Test
		@DisplayName("validation reports the first unknown reference")
		void firstUnknownReference() {
			String dsl = "(values.bind @attr{" + ACCOUNT_NUMBER + "} \"X\" @attr{" + UNKNOWN + ":made.up} \"Y\")";

			assertThatThrownBy(() -> resolver.validateAttributeReferences(context, dsl))
					.isInstanceOf(AttributeNotFoundException.class)
					.hasMessageContaining("@attr{" + UNKNOWN + ":made.up}");
		}
	}
}
