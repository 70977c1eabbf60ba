package com.sandkev.drainer.safepoint;

import com.sandkev.drainer.checkpoint.Position;

import java.util.Map;

/** Result of {@link SafePointSource#popSafe()}. */
public record SafePoint(boolean forceSave, boolean ok, long commitTs, Map<String, Position> positions) {

    public SafePoint {
        positions = positions == null ? Map.of() : Map.copyOf(positions);
    }

    public static SafePoint none() {                                     // nothing certified yet
        return new SafePoint(false, false, 0L, Map.of());
    }
    public static SafePoint forced() {                                   // caller's values win
        return new SafePoint(true, false, 0L, Map.of());
    }
    public static SafePoint of(long commitTs, Map<String, Position> positions) {
        return new SafePoint(false, true, commitTs, positions);
    }
}
