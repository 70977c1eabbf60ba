package com.sandkev.drainer.checkpoint.store;

import java.util.Optional;

public interface CheckpointDao {
    void createTableIfMissing();

    /** Blob stored for the cluster; when the backend returns several rows the last one wins. */
    Optional<String> find(long clusterId);

    void upsert(long clusterId, String checkpoint);
}
