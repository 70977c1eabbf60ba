package com.sandkev.drainer.checkpoint.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class CheckpointDaoImplTest {

    private JdbcTemplate jdbc;
    private CheckpointDaoImpl dao;

    @BeforeEach
    void setUp() {
        var ds = new DriverManagerDataSource("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        jdbc = new JdbcTemplate(ds);
        dao = new CheckpointDaoImpl(jdbc, SqlDialect.H2, "tidb_binlog", "checkpoint");
    }

    @Test
    void createTableIfMissing_isIdempotent() {
        dao.createTableIfMissing();
        dao.createTableIfMissing();

        Integer n = jdbc.queryForObject("select count(*) from \"tidb_binlog\".\"checkpoint\"", Integer.class);
        assertThat(n).isZero();
    }

    @Test
    void find_unknownCluster_isEmpty() {
        dao.createTableIfMissing();

        assertThat(dao.find(1L)).isEmpty();
    }

    @Test
    void upsert_keepsOneRowPerCluster() {
        dao.createTableIfMissing();

        dao.upsert(1L, "{\"commitTS\":1}");
        dao.upsert(1L, "{\"commitTS\":2}");
        dao.upsert(2L, "{\"commitTS\":9}");

        assertThat(dao.find(1L)).contains("{\"commitTS\":2}");
        assertThat(dao.find(2L)).contains("{\"commitTS\":9}");
        Integer n = jdbc.queryForObject(
                "select count(*) from \"tidb_binlog\".\"checkpoint\" where \"clusterid\" = 1", Integer.class);
        assertThat(n).isEqualTo(1);
    }

    @Test
    void find_unsignedClusterIdAboveLongMax() {
        dao.createTableIfMissing();
        long clusterId = Long.parseUnsignedLong("18446744073709551615");

        dao.upsert(clusterId, "{\"commitTS\":5}");

        assertThat(dao.find(clusterId)).contains("{\"commitTS\":5}");
    }

    @Test
    void find_withoutUniqueKey_lastRowWins() {
        // a table created elsewhere without the primary key
        jdbc.execute("create schema \"tidb_binlog\"");
        jdbc.execute("create table \"tidb_binlog\".\"checkpoint\" (\"clusterid\" bigint, \"checkpoint\" varchar)");
        dao.createTableIfMissing();
        jdbc.update("insert into \"tidb_binlog\".\"checkpoint\" values (?, ?)", 7L, "first");
        jdbc.update("insert into \"tidb_binlog\".\"checkpoint\" values (?, ?)", 7L, "second");

        assertThat(dao.find(7L)).contains("second");
    }

    @Test
    void find_emptyBlobCountsAsMissing() {
        dao.createTableIfMissing();
        dao.upsert(3L, "");

        assertThat(dao.find(3L)).isEmpty();
    }
}
