package org.javai.onboarding.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Totals across every registered domain plus the per-domain snapshots they were summed from.
 */
public record RegistryMetrics(
		int totalDomains,
		int totalVerbs,
		int healthyDomains,
		long totalMemoryBytes,
		Map<String, DomainMetrics> domains
) {

	public RegistryMetrics {
		domains = domains != null ? Collections.unmodifiableMap(new LinkedHashMap<>(domains)) : Map.of();
	}

	static RegistryMetrics of(Map<String, DomainMetrics> domains) {
		int verbs = 0;
		int healthy = 0;
		long memory = 0;
		for (DomainMetrics metrics : domains.values()) {
			verbs += metrics.verbCount();
			healthy += metrics.healthy() ? 1 : 0;
			memory += metrics.memoryFootprintBytes();
		}
		return new RegistryMetrics(domains.size(), verbs, healthy, memory, domains);
	}
}
