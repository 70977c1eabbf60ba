package com.sandkev.drainer.checkpoint;

import java.util.Map;

/**
 * Resume point of the drainer: a commit timestamp plus one {@link Position} per upstream node.
 * Implementations must keep the semantics below when swapping the backend.
 */
public interface CheckPoint {

    /** Replace the in-memory state with what the backend holds for this cluster. */
    void load();

    /**
     * Persist the current safe point. With a forced save the given {@code ts}/{@code positions}
     * are written instead; without any safe point this is a no-op.
     */
    void save(long ts, Map<String, Position> positions);

    /** Report a pending candidate and tell the caller whether a {@link #save} is due. */
    boolean check(long ts, Map<String, Position> positions);

    /** Copy of the last loaded or saved state. */
    CheckpointSnapshot pos();
}
