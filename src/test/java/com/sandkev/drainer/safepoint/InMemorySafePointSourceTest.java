package com.sandkev.drainer.safepoint;

import com.sandkev.drainer.checkpoint.Position;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySafePointSourceTest {

    private final InMemorySafePointSource source = new InMemorySafePointSource();

    @Test
    void nothingAppliedYet_popsNone() {
        source.pushPending(10L, Map.of("n1", Position.of("a", 1)));

        assertThat(source.popSafe()).isEqualTo(SafePoint.none());
    }

    @Test
    void markApplied_promotesHighestCoveredCandidate() {
        source.pushPending(10L, Map.of("n1", Position.of("a", 1)));
        source.pushPending(20L, Map.of("n1", Position.of("a", 2)));
        source.pushPending(30L, Map.of("n1", Position.of("a", 3)));

        source.markApplied(25L);

        assertThat(source.popSafe()).isEqualTo(SafePoint.of(20L, Map.of("n1", Position.of("a", 2))));
        assertThat(source.pendingCount()).isEqualTo(1);
        assertThat(source.popSafe().ok()).isFalse();              // popping clears it
    }

    @Test
    void lateCandidateBelowWatermark_isPromotedImmediately() {
        source.markApplied(50L);

        source.pushPending(40L, Map.of("n1", Position.of("a", 4)));

        assertThat(source.popSafe().commitTs()).isEqualTo(40L);
    }

    @Test
    void neverHandsOutOlderPointThanAlreadyCertified() {
        source.pushPending(40L, Map.of());
        source.markApplied(40L);
        assertThat(source.popSafe().commitTs()).isEqualTo(40L);

        source.pushPending(30L, Map.of());

        assertThat(source.popSafe().ok()).isFalse();
    }

    @Test
    void watermarkDoesNotMoveBackwards() {
        source.markApplied(100L);
        source.markApplied(10L);

        source.pushPending(60L, Map.of());

        assertThat(source.popSafe().commitTs()).isEqualTo(60L);
    }

    @Test
    void forceSave_winsOnceThenClears() {
        source.pushPending(10L, Map.of());
        source.markApplied(10L);
        source.requestForceSave();

        SafePoint first = source.popSafe();
        assertThat(first.forceSave()).isTrue();
        assertThat(first.ok()).isFalse();

        SafePoint second = source.popSafe();
        assertThat(second.forceSave()).isFalse();
        assertThat(second.commitTs()).isEqualTo(10L);
    }
}
