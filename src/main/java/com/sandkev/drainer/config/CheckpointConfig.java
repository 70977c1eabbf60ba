package com.sandkev.drainer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.drainer.checkpoint.CheckPoint;
import com.sandkev.drainer.checkpoint.CheckpointCodec;
import com.sandkev.drainer.checkpoint.CheckpointException;
import com.sandkev.drainer.checkpoint.SqlCheckPoint;
import com.sandkev.drainer.checkpoint.store.CheckpointDao;
import com.sandkev.drainer.checkpoint.store.CheckpointDaoImpl;
import com.sandkev.drainer.safepoint.InMemorySafePointSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(CheckpointProperties.class)
@RequiredArgsConstructor
public class CheckpointConfig {
    private final CheckpointProperties props;

    @Bean
    public DataSource checkpointDataSource() {
        String url = props.jdbcUrl();
        log.info("Checkpoint backend {} ({})", url, props.dialect());
        return DataSourceBuilder.create()
                .url(url)
                .username(props.db().user())
                .password(props.db().password())
                .build();
    }

    @Bean
    public JdbcTemplate checkpointJdbcTemplate(DataSource checkpointDataSource) {
        return new JdbcTemplate(checkpointDataSource);
    }

    @Bean
    public CheckpointDao checkpointDao(JdbcTemplate checkpointJdbcTemplate) {
        return new CheckpointDaoImpl(checkpointJdbcTemplate, props.dialect(), props.schema(), props.table());
    }

    @Bean
    public InMemorySafePointSource safePointSource() {
        return new InMemorySafePointSource();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Creates the table if needed and loads the stored state before anything else can use it. */
    @Bean
    public CheckPoint checkPoint(CheckpointDao checkpointDao,
                                 ObjectMapper objectMapper,
                                 InMemorySafePointSource safePointSource,
                                 Clock clock) {
        try {
            checkpointDao.createTableIfMissing();
        } catch (DataAccessException e) {
            log.error("Create checkpoint table {}.{} failed", props.schema(), props.table(), e);
            throw new CheckpointException("Failed to create checkpoint table " + props.schema() + "." + props.table(), e);
        }
        SqlCheckPoint cp = new SqlCheckPoint(
                checkpointDao,
                new CheckpointCodec(objectMapper),
                safePointSource,
                clock,
                props.clusterIdBits(),
                props.initialCommitTs(),
                props.saveInterval());
        cp.load();
        return cp;
    }
}
