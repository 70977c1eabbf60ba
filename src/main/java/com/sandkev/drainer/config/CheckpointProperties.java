package com.sandkev.drainer.config;

import com.sandkev.drainer.checkpoint.store.BackendAddress;
import com.sandkev.drainer.checkpoint.store.SqlDialect;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.regex.Pattern;

@ConfigurationProperties("checkpoint")
public record CheckpointProperties(
        Db db,
        String schema,               // default tidb_binlog
        String table,                // default checkpoint
        String clusterId,            // unsigned 64-bit, default 0
        long initialCommitTs,
        Duration saveInterval,       // default 3s
        SqlDialect dialect           // default FLASH
) {
    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_]+");

    public CheckpointProperties {
        db = db == null ? new Db(null, 0, null, null, null) : db;
        schema = isBlank(schema) ? "tidb_binlog" : schema;
        table = isBlank(table) ? "checkpoint" : table;
        saveInterval = saveInterval == null ? Duration.ofSeconds(3) : saveInterval;
        dialect = dialect == null ? SqlDialect.FLASH : dialect;
        clusterId = isBlank(clusterId) ? "0" : clusterId.trim();
        unsigned("checkpoint.cluster-id", clusterId);
        requireName("checkpoint.schema", schema);
        requireName("checkpoint.table", table);
        if (saveInterval.isNegative()) throw new IllegalArgumentException("checkpoint.save-interval must not be negative");
    }

    /**
     * @param host comma-separated {@code host[:port]} list, only the first entry is used
     * @param url  full JDBC url; overrides host/port when set
     */
    public record Db(String host, int port, String user, String password, String url) {
        public Db {
            host = isBlank(host) ? "127.0.0.1" : host;
            port = port == 0 ? 9000 : port;
        }
    }

    /** Cluster id as the bit pattern stored in the {@code clusterid} column. */
    public long clusterIdBits() {
        return unsigned("checkpoint.cluster-id", clusterId);
    }

    public String jdbcUrl() {
        if (!isBlank(db.url())) return db.url();
        return dialect.jdbcUrl(BackendAddress.parse(db.host(), db.port()).get(0));
    }

    private static void requireName(String key, String value) {
        if (!NAME.matcher(value).matches()) {
            throw new IllegalArgumentException(key + " must match " + NAME + ", was '" + value + "'");
        }
    }

    private static long unsigned(String key, String value) {
        try {
            return Long.parseUnsignedLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an unsigned 64-bit integer, was '" + value + "'", e);
        }
    }

    private static boolean isBlank(String s) { return s == null || s.isBlank(); }
}
