package com.sandkev.drainer.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/** Immutable (commitTS, positions) pair; the persisted blob and the answer to {@link CheckPoint#pos()}. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"commitTS", "positions"})
public record CheckpointSnapshot(
        @JsonProperty("commitTS") long commitTs,
        @JsonProperty("positions") Map<String, Position> positions
) {
    public CheckpointSnapshot {
        positions = positions == null ? Map.of() : Map.copyOf(positions);
    }
}
