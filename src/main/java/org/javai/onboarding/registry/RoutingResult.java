package org.javai.onboarding.registry;

import java.util.List;

/**
 * @param domainName the chosen domain
 * @param strategy the strategy that chose it
 * @param confidence how sure the strategy is, between 0 and 1
 * @param reason human readable explanation
 * @param matchedKeywords keywords that matched, for keyword routing
 */
public record RoutingResult(
		String domainName,
		RoutingStrategy strategy,
		double confidence,
		String reason,
		List<String> matchedKeywords
) {

	public RoutingResult {
		matchedKeywords = matchedKeywords != null ? List.copyOf(matchedKeywords) : List.of();
	}

	static RoutingResult of(String domainName, RoutingStrategy strategy, String reason) {
		return new RoutingResult(domainName, strategy, strategy.confidence(), reason, List.of());
	}
}
