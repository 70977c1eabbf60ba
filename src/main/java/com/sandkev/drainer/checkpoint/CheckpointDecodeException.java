package com.sandkev.drainer.checkpoint;

/** Stored blob could not be read back. Never replaced by defaults. */
public class CheckpointDecodeException extends CheckpointException {

    public CheckpointDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
