package com.sandkev.drainer.safepoint;

import com.sandkev.drainer.checkpoint.Position;

import java.util.Map;

/**
 * Shared aggregator of checkpoint candidates. Called concurrently by the checkpoint store and by
 * producers, so implementations must be thread-safe.
 */
public interface SafePointSource {

    void pushPending(long commitTs, Map<String, Position> positions);

    /** Take the current safe point, or a force flag, or {@link SafePoint#none()}. */
    SafePoint popSafe();
}
