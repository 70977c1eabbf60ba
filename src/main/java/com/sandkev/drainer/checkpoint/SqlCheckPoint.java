package com.sandkev.drainer.checkpoint;

import com.sandkev.drainer.checkpoint.store.CheckpointDao;
import com.sandkev.drainer.safepoint.SafePoint;
import com.sandkev.drainer.safepoint.SafePointSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link CheckPoint} kept as one JSON row per cluster in a SQL backend.
 *
 * <p>Only safe points popped from the {@link SafePointSource} (or forced values) are written, and
 * every offset is pulled back by {@link #SAFETY_MARGIN} so a restart replays a little instead of
 * skipping anything. {@code load}/{@code save} hold the write lock across the backend round trip;
 * {@code check}/{@code pos} share the read lock and never touch the backend.
 */
@Slf4j
public class SqlCheckPoint implements CheckPoint {

    public static final long SAFETY_MARGIN = 5000L;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final CheckpointDao dao;
    private final CheckpointCodec codec;
    private final SafePointSource safePoints;
    private final Clock clock;
    private final long clusterId;
    private final long initialCommitTs;
    private final Duration saveInterval;

    // guarded by lock
    private long commitTs;
    private Map<String, Position> positions = new HashMap<>();
    private Instant saveTime = Instant.EPOCH;

    public SqlCheckPoint(CheckpointDao dao,
                         CheckpointCodec codec,
                         SafePointSource safePoints,
                         Clock clock,
                         long clusterId,
                         long initialCommitTs,
                         Duration saveInterval) {
        this.dao = dao;
        this.codec = codec;
        this.safePoints = safePoints;
        this.clock = clock;
        this.clusterId = clusterId;
        this.initialCommitTs = initialCommitTs;
        this.saveInterval = saveInterval;
    }

    @Override
    public void load() {
        lock.writeLock().lock();
        try {
            Optional<String> blob;
            try {
                blob = dao.find(clusterId);
            } catch (DataAccessException e) {
                log.error("Select checkpoint for cluster {} failed", cluster(), e);
                throw new CheckpointException("Failed to load checkpoint for cluster " + cluster(), e);
            }

            if (blob.isEmpty()) {
                commitTs = initialCommitTs;
                positions = new HashMap<>();
                log.info("No checkpoint stored for cluster {}, starting from commitTS={}", cluster(), commitTs);
                return;
            }

            CheckpointSnapshot cp = codec.decode(blob.get());
            commitTs = cp.commitTs() == 0 ? initialCommitTs : cp.commitTs();
            positions = new HashMap<>(cp.positions());
            log.info("Loaded checkpoint for cluster {}: {}", cluster(), describe(commitTs, positions));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void save(long ts, Map<String, Position> poss) {
        lock.writeLock().lock();
        try {
            // counts against the throttle even if the write below fails
            saveTime = clock.instant();

            SafePoint safe = safePoints.popSafe();
            long safeTs;
            Map<String, Position> safePoss;
            if (safe.forceSave()) {
                safeTs = ts;
                safePoss = poss == null ? Map.of() : poss;
            } else if (!safe.ok()) {
                log.debug("No safe point yet for cluster {}, skipping save", cluster());
                return;
            } else {
                safeTs = safe.commitTs();
                safePoss = safe.positions();
            }

            CheckpointSnapshot next = new CheckpointSnapshot(safeTs, applySafetyMargin(safePoss));
            String blob = codec.encode(next);
            try {
                dao.upsert(clusterId, blob);
            } catch (DataAccessException e) {
                log.error("Write checkpoint for cluster {} failed", cluster(), e);
                throw new CheckpointException("Failed to save checkpoint for cluster " + cluster(), e);
            }

            commitTs = next.commitTs();
            positions = new HashMap<>(next.positions());
            log.debug("Saved checkpoint for cluster {} (forced={}): {}", cluster(), safe.forceSave(), blob);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean check(long ts, Map<String, Position> poss) {
        lock.readLock().lock();
        try {
            safePoints.pushPending(ts, poss);
            return Duration.between(saveTime, clock.instant()).compareTo(saveInterval) >= 0;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public CheckpointSnapshot pos() {
        lock.readLock().lock();
        try {
            return new CheckpointSnapshot(commitTs, positions);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        CheckpointSnapshot cp = pos();
        return describe(cp.commitTs(), cp.positions());
    }

    /** Offsets above the margin move back by it; the rest restart the segment from 0. */
    static Map<String, Position> applySafetyMargin(Map<String, Position> poss) {
        Map<String, Position> out = new HashMap<>();
        poss.forEach((nodeId, p) -> out.put(nodeId,
                p.offset() > SAFETY_MARGIN ? Position.of(p.suffix(), p.offset() - SAFETY_MARGIN)
                                           : Position.of(p.suffix(), 0L)));
        return out;
    }

    private static String describe(long ts, Map<String, Position> poss) {
        return "binlog commitTS = " + ts + " and positions = " + poss;
    }

    private String cluster() { return Long.toUnsignedString(clusterId); }
}
