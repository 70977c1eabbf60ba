package com.sandkev.drainer;

import com.sandkev.drainer.checkpoint.CheckPoint;
import com.sandkev.drainer.checkpoint.Position;
import com.sandkev.drainer.safepoint.InMemorySafePointSource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@ActiveProfiles("h2")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class DrainerApplicationTest {

    @Autowired
    CheckPoint checkPoint;
    @Autowired
    InMemorySafePointSource safePoints;
    @Autowired
    JdbcTemplate jdbc;

    @Test
    void startsLoadedAndPersistsSafePoints() {
        assertThat(checkPoint.pos().commitTs()).isGreaterThanOrEqualTo(400_000L);

        checkPoint.check(500_000L, Map.of("pump-1", Position.of("7", 12_000)));
        safePoints.markApplied(500_000L);
        checkPoint.save(500_000L, Map.of());

        assertThat(checkPoint.pos().commitTs()).isEqualTo(500_000L);
        assertThat(checkPoint.pos().positions()).containsEntry("pump-1", Position.of("7", 7_000));
        String stored = jdbc.queryForObject(
                "select \"checkpoint\" from \"tidb_binlog\".\"checkpoint\" where \"clusterid\" = ?", String.class, 42L);
        assertThat(stored).contains("\"commitTS\":500000").contains("\"Offset\":7000");
    }
}
