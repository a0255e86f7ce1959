package org.javai.onboarding.registry;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * @param message the user's message or DSL text
 * @param sessionId session the message belongs to
 * @param currentDomain domain the session is using, may be {@code null}
 * @param context session context values, e.g. {@code cbu_id}
 */
public record RoutingRequest(String message, String sessionId, String currentDomain, Map<String, Object> context) {

	public RoutingRequest {
		context = context != null ? Collections.unmodifiableMap(new HashMap<>(context)) : Map.of();
	}

	public static RoutingRequest of(String message, String sessionId) {
		return new RoutingRequest(message, sessionId, null, Map.of());
	}
}
