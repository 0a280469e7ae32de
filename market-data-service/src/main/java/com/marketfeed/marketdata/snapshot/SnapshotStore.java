package com.marketfeed.marketdata.snapshot;

import com.marketfeed.common.model.ProbabilityDistribution;
import com.marketfeed.common.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongPredicate;

/**
 * Append-only, retention-bounded history of LP-bounds forecasts, one ordered sequence per asset.
 *
 * <p>Lifecycle: {@link #load()} once at startup → {@link #append} after every successful
 * upstream forecast fetch → {@link #flush()} before shutdown.
 *
 * <p>Every append prunes snapshots older than the retention window and hands a copy of the
 * whole store to the persistence scheduler; a prune that removes anything is persisted the
 * same way. Writes run one at a time in submission order, so
 * an older state never lands on disk after a newer one. A failed write is logged and shows up
 * in {@link #getPersistenceStatus()}; the in-memory append stands and the next successful
 * write carries it.
 *
 * <p>The store is the only writer of the snapshot file.
 */
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    public static final String VERSION = "1.0";

    private final SnapshotFileRepository repository;
    private final Clock clock;
    private final Duration retention;
    private final List<String> trackedAssets;
    private final Scheduler persistScheduler;

    private final Map<String, List<Snapshot>> snapshots = new LinkedHashMap<>();
    private final Object writeLock = new Object();
    private long revision;
    private long lastWrittenRevision = -1;
    private volatile PersistenceStatus persistenceStatus = PersistenceStatus.initial();

    public SnapshotStore(SnapshotFileRepository repository, Clock clock, Duration retention,
                         Collection<String> trackedAssets, Scheduler persistScheduler) {
        this.repository       = repository;
        this.clock            = clock;
        this.retention        = retention;
        this.trackedAssets    = trackedAssets.stream().map(SnapshotStore::normalize).distinct().toList();
        this.persistScheduler = persistScheduler;
        resetToEmpty();
    }

    /**
     * Replaces in-memory state with the durable document. A missing file, an unreadable file or
     * a version other than {@value #VERSION} all start an empty store; nothing is thrown.
     * Sequences filed under a blank asset name are skipped.
     */
    public synchronized void load() {
        resetToEmpty();
        try {
            Optional<SnapshotDocument> stored = repository.read();
            if (stored.isEmpty()) {
                log.info("No snapshot file found, starting empty. path={}", repository.path());
            } else if (!VERSION.equals(stored.get().version())) {
                log.warn("Snapshot file version mismatch, starting empty. path={} found={} expected={}",
                         repository.path(), stored.get().version(), VERSION);
            } else if (stored.get().snapshots() == null) {
                log.warn("Snapshot file has no snapshots section, starting empty. path={}", repository.path());
            } else {
                stored.get().snapshots().forEach((asset, sequence) -> {
                    if (asset == null || asset.isBlank()) {
                        log.warn("Skipping snapshot sequence without an asset name. path={} entries={}",
                                 repository.path(), sequence == null ? 0 : sequence.size());
                    } else if (sequence != null) {
                        List<Snapshot> list = sequenceFor(asset);
                        sequence.stream().filter(Objects::nonNull).forEach(list::add);
                    }
                });
            }
        } catch (SnapshotPersistenceException e) {
            log.warn("Snapshot file unreadable, starting empty. path={} reason={}",
                     repository.path(), e.getMessage());
            resetToEmpty();
        }
        int pruned = pruneLocked();
        log.info("Snapshot store loaded. counts={} pruned={}", counts(), pruned);
        if (pruned > 0) {
            schedulePersist(toDocument(), ++revision);
        }
    }

    /**
     * Records {@code bounds} as the asset's newest snapshot, prunes and schedules persistence.
     * Returns as soon as memory is updated.
     */
    public Snapshot append(String asset, ProbabilityDistribution bounds) {
        Snapshot snapshot = new Snapshot(clock.millis(), bounds);
        SnapshotDocument document;
        long documentRevision;
        synchronized (this) {
            sequenceFor(asset).add(snapshot);
            int pruned = pruneLocked();
            document = toDocument();
            documentRevision = ++revision;
            log.info("SNAPSHOT_APPEND asset={} timestamp={} count={} pruned={}",
                     normalize(asset), snapshot.timestamp(), sequenceFor(asset).size(), pruned);
        }
        schedulePersist(document, documentRevision);
        return snapshot;
    }

    /** Writes the current state synchronously. @return {@code true} on success */
    public boolean flush() {
        SnapshotDocument document;
        long documentRevision;
        synchronized (this) {
            document = toDocument();
            documentRevision = revision;
        }
        return writeAndRecord(document, documentRevision);
    }

    /** Drops every snapshot older than the retention window. @return number removed */
    public synchronized int prune() {
        int removed = pruneLocked();
        if (removed > 0) {
            schedulePersist(toDocument(), ++revision);
        }
        return removed;
    }

    /** Snapshots of {@code asset} whose timestamp satisfies {@code predicate}, in stored order. */
    public synchronized List<Snapshot> query(String asset, LongPredicate predicate) {
        List<Snapshot> sequence = snapshots.get(normalize(asset));
        if (sequence == null) {
            return List.of();
        }
        return sequence.stream().filter(s -> predicate.test(s.timestamp())).toList();
    }

    /**
     * Snapshot closest in time to {@code targetTimestamp}. On an exact tie the one stored
     * first wins.
     */
    public synchronized Optional<Snapshot> nearest(String asset, long targetTimestamp) {
        Snapshot best = null;
        long bestDistance = Long.MAX_VALUE;
        for (Snapshot snapshot : snapshots.getOrDefault(normalize(asset), List.of())) {
            long distance = Math.abs(snapshot.timestamp() - targetTimestamp);
            if (distance < bestDistance) {
                best = snapshot;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Sufficient when the asset has at least {@code minCount} snapshots and the oldest is at
     * least {@code minAge} old.
     */
    public synchronized DataSufficiency sufficiency(String asset, int minCount, Duration minAge) {
        List<Snapshot> sequence = snapshots.getOrDefault(normalize(asset), List.of());
        long now = clock.millis();
        Duration oldestAge = sequence.isEmpty() ? Duration.ZERO
            : Duration.ofMillis(now - sequence.stream().mapToLong(Snapshot::timestamp).min().getAsLong());
        boolean sufficient = !sequence.isEmpty() && sequence.size() >= minCount
            && oldestAge.compareTo(minAge) >= 0;
        return new DataSufficiency(normalize(asset), sufficient, sequence.size(), oldestAge);
    }

    public synchronized Map<String, Integer> counts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        snapshots.forEach((asset, sequence) -> counts.put(asset, sequence.size()));
        return counts;
    }

    public List<String> trackedAssets() {
        return trackedAssets;
    }

    public PersistenceStatus getPersistenceStatus() {
        return persistenceStatus;
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private void schedulePersist(SnapshotDocument document, long documentRevision) {
        Mono.fromRunnable(() -> writeAndRecord(document, documentRevision))
            .subscribeOn(persistScheduler)
            .subscribe(
                v -> {},
                e -> log.error("Snapshot persistence task failed unexpectedly", e)
            );
    }

    // A document older than the one already on disk is dropped, never written over it.
    private boolean writeAndRecord(SnapshotDocument document, long documentRevision) {
        synchronized (writeLock) {
            if (documentRevision < lastWrittenRevision) {
                log.debug("Skipping superseded snapshot write. revision={} written={}",
                          documentRevision, lastWrittenRevision);
                return true;
            }
            return write(document, documentRevision);
        }
    }

    private boolean write(SnapshotDocument document, long documentRevision) {
        try {
            repository.write(document);
            lastWrittenRevision = documentRevision;
            PersistenceStatus previous = persistenceStatus;
            persistenceStatus = new PersistenceStatus(clock.instant(), previous.lastFailureAt(), previous.lastError());
            return true;
        } catch (SnapshotPersistenceException e) {
            log.error("SNAPSHOT_PERSIST_FAILED path={} reason={}", repository.path(), e.getMessage(), e);
            PersistenceStatus previous = persistenceStatus;
            persistenceStatus = new PersistenceStatus(previous.lastSuccessAt(), clock.instant(), e.getMessage());
            return false;
        }
    }

    private int pruneLocked() {
        long cutoff = clock.millis() - retention.toMillis();
        int removed = 0;
        for (List<Snapshot> sequence : snapshots.values()) {
            int before = sequence.size();
            sequence.removeIf(s -> s.timestamp() < cutoff);
            removed += before - sequence.size();
        }
        return removed;
    }

    private SnapshotDocument toDocument() {
        Map<String, List<Snapshot>> copy = new LinkedHashMap<>();
        snapshots.forEach((asset, sequence) -> copy.put(asset, List.copyOf(sequence)));
        return new SnapshotDocument(VERSION, copy);
    }

    private List<Snapshot> sequenceFor(String asset) {
        return snapshots.computeIfAbsent(normalize(asset), a -> new ArrayList<>());
    }

    private void resetToEmpty() {
        snapshots.clear();
        trackedAssets.forEach(this::sequenceFor);
    }

    private static String normalize(String asset) {
        if (asset == null || asset.isBlank()) {
            throw new IllegalArgumentException("asset is required");
        }
        return asset.trim().toUpperCase(Locale.ROOT);
    }
}
