package com.sandkev.drainer.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/** JSON blob stored in the {@code checkpoint} column. */
@Slf4j
public class CheckpointCodec {

    private final ObjectMapper om;

    public CheckpointCodec(ObjectMapper om) { this.om = om; }

    public CheckpointCodec() { this(new ObjectMapper()); }

    public String encode(CheckpointSnapshot snapshot) {
        try {
            return om.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            log.error("Json encode of checkpoint {} failed", snapshot, e);
            throw new CheckpointException("Failed to encode checkpoint " + snapshot, e);
        }
    }

    public CheckpointSnapshot decode(String blob) {
        CheckpointSnapshot cp;
        try {
            cp = om.readValue(blob, CheckpointSnapshot.class);
        } catch (JsonProcessingException e) {
            log.error("Json decode of stored checkpoint failed: {}", blob, e);
            throw new CheckpointDecodeException("Stored checkpoint is not valid: " + blob, e);
        }
        if (cp == null) {
            log.error("Stored checkpoint decodes to null: {}", blob);
            throw new CheckpointDecodeException("Stored checkpoint is null: " + blob, null);
        }
        return cp;
    }
}
