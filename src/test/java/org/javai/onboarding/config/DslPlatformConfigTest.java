package org.javai.onboarding.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.javai.onboarding.dictionary.JsonDictionaryLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DslPlatformConfig")
class DslPlatformConfigTest {

	@Nested
	@DisplayName("Defaults and builder")
	class Defaults {

		@Test
		@DisplayName("defaults enable both bundled domains with the bundled dictionary")
		void defaults() {
			DslPlatformConfig config = DslPlatformConfig.defaults();

			assertThat(config.lookupTimeout()).isEqualTo(Duration.ofSeconds(5));
			assertThat(config.fragmentSeparator()).isEqualTo("\n");
			assertThat(config.enabledDomains()).containsExactly("onboarding", "ubo");
			assertThat(config.vocabularyResources()).containsExactly(
					"META-INF/dsl-vocabulary-onboarding.yml", "META-INF/dsl-vocabulary-ubo.yml");
			assertThat(config.dictionaryResource()).isEqualTo(JsonDictionaryLoader.DEFAULT_RESOURCE);
		}

		@Test
		@DisplayName("vocabularies follow the enabled domains unless set")
		void derivedVocabularies() {
			DslPlatformConfig derived = DslPlatformConfig.builder().enabledDomains(List.of("ubo")).build();
			DslPlatformConfig explicit = DslPlatformConfig.builder()
					.enabledDomains(List.of("ubo"))
					.vocabularyResources(List.of("vocabulary/sample-vocabulary.yml"))
					.build();

			assertThat(derived.vocabularyResources()).containsExactly("META-INF/dsl-vocabulary-ubo.yml");
			assertThat(explicit.vocabularyResources()).containsExactly("vocabulary/sample-vocabulary.yml");
		}

		@Test
		@DisplayName("a blank dictionary means none")
		void blankDictionary() {
			assertThat(DslPlatformConfig.builder().dictionaryResource(" ").build().dictionaryResource()).isNull();
		}

		@Test
		@DisplayName("the timeout must be positive and the separator non-empty")
		void invalidValues() {
			assertThatThrownBy(() -> DslPlatformConfig.builder().lookupTimeout(Duration.ZERO).build())
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessage("lookupTimeout must be positive");
			assertThatThrownBy(() -> DslPlatformConfig.builder().lookupTimeout(null).build())
					.isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> DslPlatformConfig.builder().fragmentSeparator("").build())
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessage("fragmentSeparator must not be empty");
		}
	}

	@Nested
	@DisplayName("YAML")
	class YamlDocuments {

		@Test
		@DisplayName("the bundled file matches the defaults")
		void bundledFile() {
			assertThat(DslPlatformConfig.loadDefault(getClass().getClassLoader()))
					.isEqualTo(DslPlatformConfig.defaults());
		}

		@Test
		@DisplayName("reads every key")
		void everyKey() {
			DslPlatformConfig config = load("""
					lookup-timeout-millis: 1500
					fragment-separator: " ; "
					dictionary-resource: dictionary/custom.json
					enabled-domains: [ubo]
					vocabulary-resources:
					  - META-INF/dsl-vocabulary-ubo.yml
					  - vocabulary/sample-vocabulary.yml
					""");

			assertThat(config.lookupTimeout()).isEqualTo(Duration.ofMillis(1500));
			assertThat(config.fragmentSeparator()).isEqualTo(" ; ");
			assertThat(config.dictionaryResource()).isEqualTo("dictionary/custom.json");
			assertThat(config.enabledDomains()).containsExactly("ubo");
			assertThat(config.vocabularyResources()).hasSize(2);
		}

		@Test
		@DisplayName("absent keys keep their defaults and a null dictionary disables it")
		void partialFile() {
			DslPlatformConfig config = load("""
					lookup-timeout-millis: 250
					dictionary-resource:
					""");

			assertThat(config.lookupTimeout()).isEqualTo(Duration.ofMillis(250));
			assertThat(config.enabledDomains()).isEqualTo(DslPlatformConfig.DEFAULT_DOMAINS);
			assertThat(config.dictionaryResource()).isNull();
		}

		@Test
		@DisplayName("an empty document gives the defaults")
		void emptyDocument() {
			assertThat(load("")).isEqualTo(DslPlatformConfig.defaults());
		}

		@Test
		@DisplayName("malformed documents are rejected")
		void malformed() {
			assertThatThrownBy(() -> load("- just\n- a list\n"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessage("Platform configuration must be a mapping");
			assertThatThrownBy(() -> load("lookup-timeout-millis: soon\n"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessage("lookup-timeout-millis must be a number");
			assertThatThrownBy(() -> load("enabled-domains: onboarding\n"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessage("enabled-domains must be a list");
			assertThatThrownBy(() -> load("key: [unclosed\n"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageStartingWith("Invalid platform configuration");
		}

		private DslPlatformConfig load(String yaml) {
			InputStream in = new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8));
			return DslPlatformConfig.load(in);
		}
	}
}
