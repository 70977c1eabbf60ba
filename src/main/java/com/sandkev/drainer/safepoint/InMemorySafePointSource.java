package com.sandkev.drainer.safepoint;

import com.sandkev.drainer.checkpoint.Position;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * In-process {@link SafePointSource}. Candidates wait here until the apply path reports, through
 * {@link #markApplied(long)}, that everything up to their commit ts is durable downstream.
 */
@Slf4j
public class InMemorySafePointSource implements SafePointSource {

    private final NavigableMap<Long, Map<String, Position>> pending = new TreeMap<>();
    private long appliedTs = Long.MIN_VALUE;
    private long safeTs = Long.MIN_VALUE;
    private SafePoint safe;
    private boolean forceSave;

    @Override
    public synchronized void pushPending(long commitTs, Map<String, Position> positions) {
        pending.put(commitTs, positions == null ? Map.of() : Map.copyOf(positions));
        if (commitTs <= appliedTs) promote();
    }

    /** The apply path has made everything up to {@code commitTs} durable. */
    public synchronized void markApplied(long commitTs) {
        if (commitTs <= appliedTs) return;
        appliedTs = commitTs;
        promote();
    }

    /** Make the next {@link #popSafe()} a forced save, e.g. on shutdown. */
    public synchronized void requestForceSave() {
        forceSave = true;
    }

    @Override
    public synchronized SafePoint popSafe() {
        if (forceSave) {
            forceSave = false;
            return SafePoint.forced();
        }
        if (safe == null) return SafePoint.none();
        SafePoint out = safe;
        safe = null;
        return out;
    }

    synchronized int pendingCount() {
        return pending.size();
    }

    private void promote() {
        NavigableMap<Long, Map<String, Position>> covered = pending.headMap(appliedTs, true);
        if (covered.isEmpty()) return;
        Map.Entry<Long, Map<String, Position>> last = covered.lastEntry();
        // never hand out a point older than one already certified
        if (last.getKey() >= safeTs) {
            safeTs = last.getKey();
            safe = SafePoint.of(last.getKey(), last.getValue());
            log.debug("Safe point advanced to commitTS={}", last.getKey());
        }
        covered.clear();
    }
}
