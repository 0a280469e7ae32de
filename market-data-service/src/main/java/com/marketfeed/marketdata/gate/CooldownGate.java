package com.marketfeed.marketdata.gate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Enforces a minimum spacing between calls to one rate-limited upstream endpoint.
 *
 * <p>Each call reserves its dispatch slot before it is issued:
 * <pre>
 *   dispatchAt = max(now, lastDispatch + cooldown)
 *   lastDispatch = dispatchAt
 *   wait (dispatchAt - now), then call
 * </pre>
 * The slot is taken whether the call later succeeds or fails, so overlapping slow calls and
 * error loops both keep the spacing. The wait is a {@code Mono.delay}; no thread is blocked.
 *
 * <p>Independent of the cache TTL: the TTL decides how often a fetch is attempted, the gate
 * decides how close together attempts against the same endpoint may land.
 */
public class CooldownGate {

    private static final Logger log = LoggerFactory.getLogger(CooldownGate.class);

    private final String name;
    private final Duration cooldown;
    private final Clock clock;

    private long lastDispatchMillis;
    private boolean dispatched;

    public CooldownGate(String name, Duration cooldown, Clock clock) {
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative: " + cooldown);
        }
        this.name     = name;
        this.cooldown = cooldown;
        this.clock    = clock;
    }

    public <T> Mono<T> guard(Supplier<Mono<T>> call) {
        return Mono.defer(() -> {
            Duration wait = reserveDispatchSlot();
            if (wait.isZero()) {
                return Mono.defer(call);
            }
            log.info("COOLDOWN_WAIT gate={} waitMs={}", name, wait.toMillis());
            return Mono.delay(wait).then(Mono.defer(call));
        });
    }

    public Duration cooldown() {
        return cooldown;
    }

    /** Reserves the next dispatch slot and returns how long the caller must wait for it. */
    synchronized Duration reserveDispatchSlot() {
        long now = clock.millis();
        long dispatchAt = dispatched ? Math.max(now, lastDispatchMillis + cooldown.toMillis()) : now;
        lastDispatchMillis = dispatchAt;
        dispatched = true;
        return Duration.ofMillis(dispatchAt - now);
    }
}
