package org.javai.onboarding.registry;

/**
 * How a routing decision was reached, with the confidence each strategy reports.
 */
public enum RoutingStrategy {
	EXPLICIT(1.0),
	VERB(0.9),
	CONTEXT(0.8),
	KEYWORD(0.7),
	DEFAULT(0.2);

	private final double confidence;

	RoutingStrategy(double confidence) {
		this.confidence = confidence;
	}

	public double confidence() {
		return confidence;
	}
}
