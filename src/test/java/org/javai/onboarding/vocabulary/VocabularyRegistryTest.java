package org.javai.onboarding.vocabulary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("VocabularyRegistry")
class VocabularyRegistryTest {

	private final ClassLoader loader = getClass().getClassLoader();

	@Test
	@DisplayName("bundled vocabularies are found by domain name")
	void loadsBundledVocabulary() {
		VocabularyRegistry registry = VocabularyRegistry.create();

		Vocabulary onboarding = registry.registerResource(VocabularyRegistry.resourceFor("onboarding"));

		assertThat(onboarding.domain()).isEqualTo("onboarding");
		assertThat(registry.vocabularyFor("onboarding")).containsSame(onboarding);
		assertThat(VocabularyRegistry.resourceFor("ubo")).isEqualTo("META-INF/dsl-vocabulary-ubo.yml");
	}

	@Test
	@DisplayName("the first registration for a domain wins")
	void firstRegistrationWins() {
		VocabularyRegistry registry = VocabularyRegistry.create();
		Vocabulary first = registry.registerResource("vocabulary/sample-vocabulary.yml", loader);

		Vocabulary second = registry.registerResource("vocabulary/sample-vocabulary.yml", loader);

		assertThat(second).isSameAs(first);
		assertThat(registry.vocabularies()).hasSize(1);
	}

	@Test
	@DisplayName("META-INF scanning picks up every bundled vocabulary")
	void scansMetaInf() {
		VocabularyRegistry registry = VocabularyRegistry.create().registerMetaInfVocabularies(loader);

		assertThat(registry.vocabularies()).extracting(Vocabulary::domain).contains("onboarding", "ubo");
	}

	@Test
	@DisplayName("bulk registration loads each listed resource")
	void registersResources() {
		VocabularyRegistry registry = VocabularyRegistry.create().registerResources(
				List.of(VocabularyRegistry.resourceFor("onboarding"), "vocabulary/sample-vocabulary.yml"), loader);

		assertThat(registry.vocabularies()).extracting(Vocabulary::domain).containsExactly("onboarding", "sample");
	}

	@Test
	@DisplayName("vocabularies can be loaded from the filesystem")
	void registersPath(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("tiny.yml");
		Files.writeString(file, """
				domain: { id: tiny, version: 1.0.0 }
				states: [OPEN]
				categories:
				  core: { verbs: [tiny.ping] }
				verbs:
				  tiny.ping: { category: core }
				""");

		Vocabulary tiny = VocabularyRegistry.create().registerPath(file);

		assertThat(tiny.domain()).isEqualTo("tiny");
		assertThat(tiny.hasVerb("tiny.ping")).isTrue();
	}

	@Test
	@DisplayName("a missing resource is an argument error")
	void missingResource() {
		assertThatThrownBy(() -> VocabularyRegistry.create().registerResource("vocabulary/nope.yml", loader))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("vocabulary/nope.yml");
	}

	@Test
	@DisplayName("requireVocabulary names the missing domain")
	void requireVocabulary() {
		assertThatThrownBy(() -> VocabularyRegistry.create().requireVocabulary("payments"))
				.isInstanceOf(VocabularyException.class)
				.hasMessageContaining("payments");
	}

	@Test
	@DisplayName("vocabularies render to JSON for tooling")
	void rendersJson() {
		Vocabulary sample = VocabularyRegistry.create().registerResource("vocabulary/sample-vocabulary.yml", loader);

		ObjectNode json = VocabularyJsonMapper.toJson(sample);

		assertThat(json.get("domain").asText()).isEqualTo("sample");
		assertThat(json.get("states").size()).isEqualTo(3);
		assertThat(json.get("verbs").size()).isEqualTo(4);
		ObjectNode review = (ObjectNode) json.get("verbs").get(1);
		assertThat(review.get("name").asText()).isEqualTo("doc.review");
		assertThat(review.get("toState").asText()).isEqualTo("REVIEWED");
		assertThat(review.get("arguments").get(0).get("values").size()).isEqualTo(2);
		assertThat(VocabularyJsonMapper.toPrettyString(sample)).contains("\"doc.publish\"");
	}
}
