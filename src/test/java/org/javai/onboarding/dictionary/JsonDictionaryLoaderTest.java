package org.javai.onboarding.dictionary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JsonDictionaryLoader")
class JsonDictionaryLoaderTest {

	private final JsonDictionaryLoader loader = new JsonDictionaryLoader();

	@Test
	@DisplayName("loads the bundled onboarding dictionary")
	void bundledDictionary() {
		InMemoryDictionaryRepository repository = loader.repositoryFrom(JsonDictionaryLoader.DEFAULT_RESOURCE,
				getClass().getClassLoader());

		assertThat(repository.size()).isEqualTo(24);
		assertThat(repository.getById(LookupContext.background(), "456789ab-cdef-1234-5678-9abcdef01301"))
				.hasValueSatisfying(attribute -> {
					assertThat(attribute.name()).isEqualTo("custody.account_number");
					assertThat(attribute.source()).isNotNull();
					assertThat(attribute.sink()).isNotNull();
					assertThat(attribute.constraints()).isNotEmpty();
				});
	}

	@Test
	@DisplayName("unknown fields are ignored")
	void ignoresUnknownFields() {
		String json = """
				{"attributes": [
				  {"id": "abcdef12-0000-0000-0000-000000000001", "name": "x.y", "colour": "blue",
				   "tags": ["a"], "sensitivity": "PUBLIC"}
				], "version": 3}
				""";

		List<Attribute> attributes = loader.load(stream(json));

		assertThat(attributes).singleElement().satisfies(attribute -> {
			assertThat(attribute.name()).isEqualTo("x.y");
			assertThat(attribute.tags()).containsExactly("a");
			assertThat(attribute.constraints()).isEmpty();
		});
	}

	@Test
	@DisplayName("a document without attributes is empty")
	void emptyDocument() {
		assertThat(loader.load(stream("{}"))).isEmpty();
	}

	@Test
	@DisplayName("an attribute without a name is rejected")
	void missingName() {
		assertThatThrownBy(() -> loader.load(stream("{\"attributes\": [{\"id\": \"abcdef12\"}]}")))
				.isInstanceOf(IllegalStateException.class)
				.hasMessage("Failed to read attribute dictionary");
	}

	@Test
	@DisplayName("a missing resource is reported by path")
	void missingResource() {
		assertThatThrownBy(() -> loader.loadResource("dictionary/absent.json", getClass().getClassLoader()))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Resource not found: dictionary/absent.json");
	}

	private static InputStream stream(String text) {
		return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
	}
}
