package com.marketfeed.marketdata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.marketfeed.marketdata.cache.FreshValueCache;
import com.marketfeed.marketdata.cache.ResourceClass;
import com.marketfeed.marketdata.gate.CooldownGate;
import com.marketfeed.marketdata.snapshot.SnapshotFileRepository;
import com.marketfeed.marketdata.snapshot.SnapshotStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Wires the cache, the LP-bounds cooldown gate and the snapshot store.
 *
 * <p>Store lifecycle: constructed → {@link SnapshotStore#load()} → serves appends →
 * {@link SnapshotStore#flush()} on context shutdown.
 */
@Configuration
public class MarketFeedConfig {

    static final String TTL_PREFIX = "market-feed.cache.ttl.";

    @Value("${market-feed.assets:BTC,ETH}")
    private String assetsConfig;

    @Value("${market-feed.cooldown.lp-bounds:PT5S}")
    private Duration lpBoundsCooldown;

    @Value("${market-feed.snapshots.path:data/lp-bounds-snapshots.json}")
    private String snapshotsPath;

    @Value("${market-feed.snapshots.retention:P7D}")
    private Duration snapshotRetention;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    private List<String> trackedAssets() {
        return Arrays.stream(assetsConfig.split(","))
            .map(String::trim)
            .filter(a -> !a.isEmpty())
            .map(String::toUpperCase)
            .distinct()
            .toList();
    }

    @Bean
    public FreshValueCache freshValueCache(Clock clock, Environment environment) {
        Map<ResourceClass, Duration> ttls = new EnumMap<>(ResourceClass.class);
        for (ResourceClass resourceClass : ResourceClass.values()) {
            ttls.put(resourceClass, environment.getProperty(
                TTL_PREFIX + resourceClass.prefix(), Duration.class, FreshValueCache.DEFAULT_TTL));
        }
        return new FreshValueCache(clock, ttls);
    }

    @Bean
    public CooldownGate lpBoundsGate(Clock clock) {
        return new CooldownGate("lp-bounds", lpBoundsCooldown, clock);
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler snapshotPersistScheduler() {
        return Schedulers.newSingle("snapshot-persist");
    }

    @Bean
    public SnapshotFileRepository snapshotFileRepository(ObjectMapper objectMapper) {
        return new SnapshotFileRepository(Path.of(snapshotsPath), objectMapper);
    }

    @Bean(initMethod = "load", destroyMethod = "flush")
    public SnapshotStore snapshotStore(SnapshotFileRepository snapshotFileRepository, Clock clock,
                                       Scheduler snapshotPersistScheduler) {
        return new SnapshotStore(snapshotFileRepository, clock, snapshotRetention,
                                 trackedAssets(), snapshotPersistScheduler);
    }
}
