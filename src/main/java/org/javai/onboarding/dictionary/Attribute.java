package org.javai.onboarding.dictionary;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Dictionary entry for a semantically named data field.
 *
 * <p>Example JSON:
 * <pre>
 * {
 *   "id": "456789ab-cdef-1234-5678-9abcdef01301",
 *   "name": "custody.account_number",
 *   "long_description": "Custody account number at the custodian bank",
 *   "group_id": "custody",
 *   "mask": "string",
 *   "domain": "custody",
 *   "sensitivity": "CONFIDENTIAL"
 * }
 * </pre>
 *
 * @param id stable identifier referenced from DSL as {@code @attr{id}}
 * @param name dotted semantic name, e.g. {@code custody.account_number}
 * @param longDescription human readable description
 * @param groupId grouping used by dictionary tooling
 * @param mask value mask or type hint
 * @param domain business domain owning the attribute
 * @param tags free-form tags
 * @param sensitivity data classification
 * @param constraints validation constraints keyed by name
 * @param source where values come from, may be {@code null}
 * @param sink where values go, may be {@code null}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Attribute(
		@JsonProperty("id") String id,
		@JsonProperty("name") String name,
		@JsonProperty("long_description") String longDescription,
		@JsonProperty("group_id") String groupId,
		@JsonProperty("mask") String mask,
		@JsonProperty("domain") String domain,
		@JsonProperty("tags") List<String> tags,
		@JsonProperty("sensitivity") String sensitivity,
		@JsonProperty("constraints") Map<String, Object> constraints,
		@JsonProperty("source") SourceMetadata source,
		@JsonProperty("sink") SinkMetadata sink
) {

	public Attribute {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("Attribute id must not be blank");
		}
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Attribute '" + id + "' must have a name");
		}
		tags = tags != null ? List.copyOf(tags) : List.of();
		constraints = constraints != null ? Map.copyOf(constraints) : Map.of();
	}

	public static Attribute of(String id, String name, String longDescription) {
		return new Attribute(id, name, longDescription, null, null, null, null, null, null, null, null);
	}
}
