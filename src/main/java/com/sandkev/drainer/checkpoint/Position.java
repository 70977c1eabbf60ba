package com.sandkev.drainer.checkpoint;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

/**
 * Resume offset within one upstream stream. {@code suffix} names the segment the offset is
 * relative to. Numeric suffixes are read as strings and written back as numbers; a missing
 * suffix means segment {@code "0"}.
 */
@JsonPropertyOrder({"Suffix", "Offset"})
public record Position(
        @JsonProperty("Suffix") @JsonSerialize(using = SuffixSerializer.class) String suffix,
        @JsonProperty("Offset") long offset
) {
    public static final String DEFAULT_SUFFIX = "0";

    public Position {
        suffix = (suffix == null || suffix.isEmpty()) ? DEFAULT_SUFFIX : suffix;
        if (offset < 0) throw new IllegalArgumentException("Position.offset must be >= 0, was " + offset);
    }

    public static Position of(String suffix, long offset) {
        return new Position(suffix, offset);
    }
}
