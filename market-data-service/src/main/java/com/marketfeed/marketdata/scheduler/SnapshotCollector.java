package com.marketfeed.marketdata.scheduler;

import com.marketfeed.marketdata.service.MarketDataService;
import com.marketfeed.marketdata.snapshot.SnapshotStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Keeps the snapshot history filled by force-refreshing {@code lp-bounds:<asset>} for every
 * tracked asset on a fixed interval.
 *
 * <pre>
 *   delay(interval) → refresh each asset in turn → repeat
 * </pre>
 *
 * <p>Refreshes go through the cache, so the cooldown gate spaces the upstream calls and each
 * successful call lands in the store exactly once. A failed asset is logged and skipped; the
 * loop always reschedules.
 */
@Component
public class SnapshotCollector {

    private static final Logger log = LoggerFactory.getLogger(SnapshotCollector.class);

    private final MarketDataService marketDataService;
    private final SnapshotStore snapshotStore;

    @Value("${market-feed.collector.enabled:true}")
    private boolean enabled = true;

    @Value("${market-feed.collector.interval:PT5M}")
    private Duration interval = Duration.ofMinutes(5);

    private volatile Disposable nextCycle;
    private volatile boolean stopped;

    public SnapshotCollector(MarketDataService marketDataService, SnapshotStore snapshotStore) {
        this.marketDataService = marketDataService;
        this.snapshotStore     = snapshotStore;
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Snapshot collector disabled");
            return;
        }
        log.info("Snapshot collector started. assets={} intervalSeconds={}",
                 snapshotStore.trackedAssets(), interval.toSeconds());
        scheduleNextCycle(Duration.ZERO);
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        Disposable cycle = nextCycle;
        if (cycle != null) {
            cycle.dispose();
        }
    }

    /** One pass over every tracked asset. Emits the number of assets refreshed successfully. */
    Mono<Long> collectOnce() {
        return Flux.fromIterable(snapshotStore.trackedAssets())
            .concatMap(asset -> marketDataService.getLpBounds(asset, true)
                .map(bounds -> asset)
                .onErrorResume(e -> {
                    log.error("SNAPSHOT_COLLECT_FAILED asset={} reason={}", asset, e.getMessage());
                    return Mono.empty();
                }))
            .count();
    }

    // ── loop ──────────────────────────────────────────────────────────────────

    private void scheduleNextCycle(Duration delay) {
        if (stopped) {
            return;
        }
        nextCycle = Mono.delay(delay)
            .then(collectOnce())
            .subscribe(
                refreshed -> {
                    log.info("SNAPSHOT_COLLECT_CYCLE refreshed={} assets={} nextIntervalSeconds={}",
                             refreshed, snapshotStore.trackedAssets().size(), interval.toSeconds());
                    scheduleNextCycle(interval);
                },
                err -> {
                    log.error("Snapshot collection cycle failed, rescheduling", err);
                    scheduleNextCycle(interval);
                }
            );
    }
}
