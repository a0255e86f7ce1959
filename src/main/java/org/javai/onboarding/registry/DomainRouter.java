package org.javai.onboarding.registry;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the domain that should handle a message.
 * <p>
 * Strategies are tried in order, the first that finds a registered domain wins:
 * <ol>
 * <li>explicit "switch to X domain";</li>
 * <li>DSL verbs in the message owned by a domain's vocabulary, or prefixed with a domain name;</li>
 * <li>session context keys or a {@code current_state} only one domain knows;</li>
 * <li>domain keywords, the longest match winning;</li>
 * <li>the session's current domain, else the first domain by name.</li>
 * </ol>
 */
public class DomainRouter {

	private static final Logger logger = LoggerFactory.getLogger(DomainRouter.class);

	private static final Pattern DOMAIN_SWITCH = Pattern.compile(
			"switch\\s+to\\s+([a-z][a-z0-9 -]*?)\\s+domain", Pattern.CASE_INSENSITIVE);

	private static final Pattern VERB = Pattern.compile("\\(\\s*([a-z][a-z0-9-]*(?:\\.[a-z-]+)+)");

	private final DomainRegistry registry;

	public DomainRouter(DomainRegistry registry) {
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
	}

	/**
	 * @throws IllegalArgumentException if the request or its message is missing
	 * @throws DomainNotFoundException if no domain is registered
	 */
	public RoutingResult route(RoutingRequest request) {
		if (request == null) {
			throw new IllegalArgumentException("routing request cannot be null");
		}
		if (request.message() == null || request.message().isBlank()) {
			throw new IllegalArgumentException("message cannot be empty");
		}
		List<Domain> domains = registry.list();
		if (domains.isEmpty()) {
			throw new DomainNotFoundException("no domains registered");
		}
		RoutingResult result = routeByExplicitSwitch(request, domains)
				.or(() -> routeByVerbs(request, domains))
				.or(() -> routeByContext(request, domains))
				.or(() -> routeByKeywords(request, domains))
				.orElseGet(() -> routeByDefault(request, domains));
		logger.debug("Routed session {} to {} by {}", request.sessionId(), result.domainName(), result.strategy());
		return result;
	}

	Optional<RoutingResult> routeByExplicitSwitch(RoutingRequest request, List<Domain> domains) {
		Matcher matcher = DOMAIN_SWITCH.matcher(request.message());
		if (!matcher.find()) {
			return Optional.empty();
		}
		String requested = matcher.group(1).trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
		for (Domain domain : domains) {
			String name = domain.name();
			if (name.equals(requested) || name.startsWith(requested + "-")
					|| domain.routingHints().aliases().contains(requested.replace('-', ' '))) {
				return Optional.of(RoutingResult.of(name, RoutingStrategy.EXPLICIT,
						"explicit switch to " + name));
			}
		}
		return Optional.empty();
	}

	Optional<RoutingResult> routeByVerbs(RoutingRequest request, List<Domain> domains) {
		Matcher matcher = VERB.matcher(request.message());
		while (matcher.find()) {
			String verb = matcher.group(1);
			for (Domain domain : domains) {
				if (domain.vocabulary().hasVerb(verb)) {
					return Optional.of(RoutingResult.of(domain.name(), RoutingStrategy.VERB,
							"verb " + verb + " belongs to " + domain.name()));
				}
			}
			String prefix = verb.substring(0, verb.indexOf('.'));
			for (Domain domain : domains) {
				if (domain.name().equals(prefix)) {
					return Optional.of(RoutingResult.of(domain.name(), RoutingStrategy.VERB,
							"verb " + verb + " is prefixed with " + domain.name()));
				}
			}
		}
		return Optional.empty();
	}

	Optional<RoutingResult> routeByContext(RoutingRequest request, List<Domain> domains) {
		Map<String, Object> context = request.context();
		if (context.isEmpty()) {
			return Optional.empty();
		}
		for (Domain domain : domains) {
			for (String key : domain.routingHints().contextKeys()) {
				if (context.containsKey(key)) {
					return Optional.of(RoutingResult.of(domain.name(), RoutingStrategy.CONTEXT,
							"context key " + key + " belongs to " + domain.name()));
				}
			}
		}
		Object state = context.get("current_state");
		if (state != null) {
			for (Domain domain : domains) {
				if (domain.validStates().contains(state.toString())) {
					return Optional.of(RoutingResult.of(domain.name(), RoutingStrategy.CONTEXT,
							"state " + state + " belongs to " + domain.name()));
				}
			}
		}
		return Optional.empty();
	}

	Optional<RoutingResult> routeByKeywords(RoutingRequest request, List<Domain> domains) {
		String message = request.message().toLowerCase(Locale.ROOT);
		String bestDomain = null;
		String bestKeyword = null;
		List<String> matched = new ArrayList<>();
		for (Domain domain : domains) {
			for (String keyword : domain.routingHints().keywords()) {
				if (message.contains(keyword)) {
					matched.add(keyword);
					if (bestKeyword == null || keyword.length() > bestKeyword.length()) {
						bestKeyword = keyword;
						bestDomain = domain.name();
					}
				}
			}
		}
		if (bestDomain == null) {
			return Optional.empty();
		}
		return Optional.of(new RoutingResult(bestDomain, RoutingStrategy.KEYWORD,
				RoutingStrategy.KEYWORD.confidence(), "keyword " + bestKeyword + " belongs to " + bestDomain, matched));
	}

	RoutingResult routeByDefault(RoutingRequest request, List<Domain> domains) {
		String current = request.currentDomain();
		if (current != null && registry.contains(current)) {
			return RoutingResult.of(current, RoutingStrategy.DEFAULT, "staying in current domain " + current);
		}
		String first = domains.get(0).name();
		return RoutingResult.of(first, RoutingStrategy.DEFAULT, "defaulting to " + first);
	}
}
