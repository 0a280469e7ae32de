package com.marketfeed.marketdata.cache;

import com.marketfeed.common.exception.FetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Reactive TTL cache for upstream market data, one entry per {@link ResourceKey}.
 *
 * <p><strong>Fetch Once → Serve Many:</strong>
 * <ol>
 *   <li>Fresh entry ({@code now - fetchedAt < ttl}) and no forced refresh → served immediately.</li>
 *   <li>A fetch already in flight for the key → the caller joins it; N concurrent callers
 *       produce exactly one upstream call and all see the same value or the same error.</li>
 *   <li>Otherwise a new fetch is started and registered. Success replaces the entry;
 *       failure is propagated to every waiter and never cached.</li>
 * </ol>
 *
 * <p>TTLs are per {@link ResourceClass}; a miss or expiry in one key never touches another.
 * Invalidation drops entries only. A fetch in flight is left to finish and may repopulate
 * the entry afterwards.
 */
public class FreshValueCache {

    private static final Logger log = LoggerFactory.getLogger(FreshValueCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final Clock clock;
    private final Map<ResourceClass, Duration> ttls;

    private final ConcurrentHashMap<ResourceKey, CacheEntry<?>> entries  = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ResourceKey, Mono<?>>       inFlight = new ConcurrentHashMap<>();

    public FreshValueCache(Clock clock, Map<ResourceClass, Duration> ttls) {
        this.clock = clock;
        this.ttls  = new EnumMap<>(ResourceClass.class);
        for (ResourceClass resourceClass : ResourceClass.values()) {
            this.ttls.put(resourceClass, ttls.getOrDefault(resourceClass, DEFAULT_TTL));
        }
    }

    public <T> Mono<T> get(ResourceKey key, Supplier<Mono<T>> fetcher) {
        return get(key, fetcher, false);
    }

    /**
     * @param fetcher       upstream call; invoked at most once per refresh regardless of caller count
     * @param forceRefresh  skip the freshness check (an in-flight fetch is still joined)
     * @return the cached or freshly fetched value; errors with {@link FetchException}
     */
    @SuppressWarnings("unchecked")
    public <T> Mono<T> get(ResourceKey key, Supplier<Mono<T>> fetcher, boolean forceRefresh) {
        return Mono.defer(() -> {
            if (!forceRefresh) {
                CacheEntry<?> entry = entries.get(key);
                if (entry != null && isFresh(entry)) {
                    log.debug("CACHE_HIT key={} ageMs={}", key, age(entry).toMillis());
                    return Mono.just((T) entry.value());
                }
            }
            Mono<?> running = inFlight.get(key);
            if (running != null) {
                log.info("CACHE_JOIN key={} reason=fetch-in-progress", key);
                return (Mono<T>) running;
            }
            return (Mono<T>) inFlight.computeIfAbsent(key, k -> newFlight(k, fetcher, forceRefresh));
        });
    }

    public void invalidate(ResourceClass resourceClass) {
        int removed = 0;
        for (ResourceKey key : entries.keySet()) {
            if (key.resourceClass() == resourceClass && entries.remove(key) != null) {
                removed++;
            }
        }
        log.info("CACHE_INVALIDATE class={} entries={}", resourceClass.prefix(), removed);
    }

    public void invalidate(ResourceKey key) {
        entries.remove(key);
        log.info("CACHE_INVALIDATE key={}", key);
    }

    public void invalidateAll() {
        log.info("CACHE_INVALIDATE_ALL entries={}", entries.size());
        for (ResourceClass resourceClass : ResourceClass.values()) {
            invalidate(resourceClass);
        }
    }

    /**
     * Freshness per key: every present entry plus the four asset-independent classes,
     * which are always reported. No side effects.
     */
    public Map<String, Boolean> getCacheStatus() {
        Map<String, Boolean> status = new TreeMap<>();
        for (ResourceClass resourceClass : ResourceClass.values()) {
            if (!resourceClass.perAsset()) {
                status.put(resourceClass.prefix(), false);
            }
        }
        entries.forEach((key, entry) -> status.put(key.id(), isFresh(entry)));
        return status;
    }

    /** Age of every present entry. */
    public Map<String, Duration> getCacheAges() {
        Map<String, Duration> ages = new TreeMap<>();
        entries.forEach((key, entry) -> ages.put(key.id(), age(entry)));
        return ages;
    }

    public Duration ttl(ResourceClass resourceClass) {
        return ttls.get(resourceClass);
    }

    // ── single flight ─────────────────────────────────────────────────────────

    private <T> Mono<T> newFlight(ResourceKey key, Supplier<Mono<T>> fetcher, boolean forced) {
        log.info("CACHE_MISS key={} forced={}", key, forced);
        AtomicReference<Mono<T>> self = new AtomicReference<>();

        Mono<T> flight = Mono.defer(fetcher)
            .switchIfEmpty(Mono.error(() -> new FetchException(key.id(), "Upstream returned no value")))
            .onErrorMap(e -> !(e instanceof FetchException),
                        e -> new FetchException(key.id(), "Fetch failed: " + e.getMessage(), e))
            .doOnNext(value -> {
                entries.put(key, new CacheEntry<>(key, value, clock.instant()));
                inFlight.remove(key, self.get()); // before subscribers see the value
                log.info("CACHE_REFRESH key={} ttlSeconds={}", key, ttl(key.resourceClass()).toSeconds());
            })
            .doOnError(e -> {
                inFlight.remove(key, self.get());
                log.error("CACHE_FETCH_FAILED key={} reason={}", key, e.getMessage());
            })
            .doFinally(signal -> inFlight.remove(key, self.get()))
            .cache();

        self.set(flight);
        return flight;
    }

    private boolean isFresh(CacheEntry<?> entry) {
        return age(entry).compareTo(ttl(entry.key().resourceClass())) < 0;
    }

    private Duration age(CacheEntry<?> entry) {
        return Duration.between(entry.fetchedAt(), clock.instant());
    }
}
