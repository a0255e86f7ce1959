package org.javai.onboarding.registry;

import java.time.Instant;

/**
 * Point-in-time counters for one domain.
 *
 * @param domain domain name
 * @param version domain version
 * @param verbCount number of verbs in the vocabulary
 * @param categoryCount number of verb categories
 * @param stateCount number of workflow states
 * @param validations documents validated so far
 * @param validationFailures validations that failed
 * @param generations generation requests served
 * @param generationFailures generation requests that failed
 * @param healthy whether the domain reports itself healthy
 * @param memoryFootprintBytes rough size of the vocabulary held in memory
 * @param collectedAt when the snapshot was taken
 */
public record DomainMetrics(
		String domain,
		String version,
		int verbCount,
		int categoryCount,
		int stateCount,
		long validations,
		long validationFailures,
		long generations,
		long generationFailures,
		boolean healthy,
		long memoryFootprintBytes,
		Instant collectedAt
) {
}
