package com.sandkev.drainer.checkpoint.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;

import java.util.Optional;

@Slf4j
public class CheckpointDaoImpl implements CheckpointDao {

    private final JdbcTemplate jdbc;
    private final SqlDialect dialect;
    private final String schema;
    private final String table;

    public CheckpointDaoImpl(JdbcTemplate jdbc, SqlDialect dialect, String schema, String table) {
        this.jdbc = jdbc;
        this.dialect = dialect;
        this.schema = schema;
        this.table = table;
    }

    @Override
    public void createTableIfMissing() {
        jdbc.execute(dialect.createSchema(schema));
        jdbc.execute(dialect.createTable(schema, table));
        log.info("Checkpoint table {}.{} ready ({})", schema, table, dialect);
    }

    @Override
    public Optional<String> find(long clusterId) {
        // no uniqueness guarantee on every backend: keep scanning, last row wins
        ResultSetExtractor<String> lastRow = rs -> {
            String last = null;
            while (rs.next()) last = rs.getString(1);
            return last;
        };
        String blob = jdbc.query(dialect.select(schema, table), lastRow, clusterId);
        return (blob == null || blob.isEmpty()) ? Optional.empty() : Optional.of(blob);
    }

    @Override
    public void upsert(long clusterId, String checkpoint) {
        jdbc.update(dialect.upsert(schema, table), clusterId, checkpoint);
    }
}
