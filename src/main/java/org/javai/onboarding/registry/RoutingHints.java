package org.javai.onboarding.registry;

import java.util.List;
import java.util.Locale;

/**
 * @param keywords words in a message that suggest the domain
 * @param contextKeys session context keys that only this domain produces
 * @param aliases alternative names accepted by an explicit "switch to ... domain"
 */
public record RoutingHints(List<String> keywords, List<String> contextKeys, List<String> aliases) {

	public RoutingHints {
		keywords = keywords != null ? keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList() : List.of();
		contextKeys = contextKeys != null ? List.copyOf(contextKeys) : List.of();
		aliases = aliases != null ? aliases.stream().map(a -> a.toLowerCase(Locale.ROOT)).toList() : List.of();
	}

	public static RoutingHints none() {
		return new RoutingHints(List.of(), List.of(), List.of());
	}
}
