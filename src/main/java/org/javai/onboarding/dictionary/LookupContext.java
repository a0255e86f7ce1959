package org.javai.onboarding.dictionary;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Cancellation and deadline carried through every dictionary lookup.
 * <p>
 * Repositories call {@link #checkActive()} before doing work; resolvers treat the resulting
 * {@link LookupCancelledException} like any other resolution failure. A context can be
 * cancelled from another thread.
 */
public final class LookupContext {

	private final Instant deadline;
	private final Clock clock;
	private volatile boolean cancelled;

	private LookupContext(Instant deadline, Clock clock) {
		this.deadline = deadline;
		this.clock = clock;
	}

	/**
	 * A context with no deadline that is only ever cancelled explicitly.
	 */
	public static LookupContext background() {
		return new LookupContext(null, Clock.systemUTC());
	}

	public static LookupContext withTimeout(Duration timeout) {
		return withTimeout(timeout, Clock.systemUTC());
	}

	public static LookupContext withTimeout(Duration timeout, Clock clock) {
		Objects.requireNonNull(timeout, "timeout must not be null");
		Objects.requireNonNull(clock, "clock must not be null");
		if (timeout.isNegative()) {
			throw new IllegalArgumentException("timeout must not be negative");
		}
		return new LookupContext(clock.instant().plus(timeout), clock);
	}

	public static LookupContext withDeadline(Instant deadline, Clock clock) {
		Objects.requireNonNull(deadline, "deadline must not be null");
		Objects.requireNonNull(clock, "clock must not be null");
		return new LookupContext(deadline, clock);
	}

	public void cancel() {
		cancelled = true;
	}

	public boolean isCancelled() {
		return cancelled;
	}

	public Optional<Instant> deadline() {
		return Optional.ofNullable(deadline);
	}

	public boolean isExpired() {
		return deadline != null && !clock.instant().isBefore(deadline);
	}

	public boolean isActive() {
		return !cancelled && !isExpired();
	}

	/**
	 * @throws LookupCancelledException if the context was cancelled or its deadline has passed
	 */
	public void checkActive() {
		if (cancelled) {
			throw new LookupCancelledException("lookup cancelled");
		}
		if (isExpired()) {
			throw new LookupCancelledException("lookup deadline exceeded at " + deadline);
		}
	}
}
