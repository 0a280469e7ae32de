package com.marketfeed.marketdata.gate;

import com.marketfeed.marketdata.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class CooldownGateTest {

    private static final Duration COOLDOWN = Duration.ofSeconds(5);

    private MutableClock clock;
    private CooldownGate gate;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T12:00:00Z"));
        gate  = new CooldownGate("lp-bounds", COOLDOWN, clock);
    }

    @Test
    @DisplayName("first call dispatches immediately")
    void firstCallNoWait() {
        assertEquals(Duration.ZERO, gate.reserveDispatchSlot());
    }

    @Test
    @DisplayName("back-to-back reservations are spaced by the cooldown")
    void overlappingCallsKeepSpacing() {
        assertEquals(Duration.ZERO, gate.reserveDispatchSlot());
        assertEquals(COOLDOWN, gate.reserveDispatchSlot());
        assertEquals(COOLDOWN.multipliedBy(2), gate.reserveDispatchSlot());
    }

    @Test
    @DisplayName("partial elapse waits only the remainder")
    void remainderOnly() {
        gate.reserveDispatchSlot();
        clock.advance(Duration.ofSeconds(3));

        assertEquals(Duration.ofSeconds(2), gate.reserveDispatchSlot());
    }

    @Test
    @DisplayName("no wait once the cooldown has elapsed")
    void elapsedCooldown() {
        gate.reserveDispatchSlot();
        clock.advance(Duration.ofSeconds(6));

        assertEquals(Duration.ZERO, gate.reserveDispatchSlot());
    }

    @Test
    @DisplayName("a failed call still consumes its slot")
    void failureReservesSlot() {
        Mono<String> failing = gate.guard(() -> Mono.error(new IllegalStateException("HTTP 500")));
        assertThrows(IllegalStateException.class, failing::block);

        assertEquals(COOLDOWN, gate.reserveDispatchSlot());
    }

    @Test
    @DisplayName("second call is suspended for the remaining cooldown")
    void suspendsWithoutBlocking() {
        gate.reserveDispatchSlot();
        AtomicBoolean dispatched = new AtomicBoolean();

        StepVerifier.withVirtualTime(() -> gate.guard(() -> {
                dispatched.set(true);
                return Mono.just("bounds");
            }))
            .expectSubscription()
            .expectNoEvent(Duration.ofSeconds(4))
            .then(() -> assertFalse(dispatched.get()))
            .thenAwait(Duration.ofSeconds(1))
            .expectNext("bounds")
            .verifyComplete();

        assertTrue(dispatched.get());
    }

    @Test
    @DisplayName("negative cooldown rejected")
    void negativeCooldown() {
        assertThrows(IllegalArgumentException.class,
            () -> new CooldownGate("x", Duration.ofMillis(-1), clock));
    }
}
