package com.atlas.database;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.atlas.observability.HealthStatus;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DataSourceHealthCheck")
class DataSourceHealthCheckTest {

    @Test
    @DisplayName("reports OK when SELECT 1 succeeds")
    void ok() {
        JdbcDataSource h2 = new JdbcDataSource();
        h2.setURL("jdbc:h2:mem:health;DB_CLOSE_DELAY=-1");

        var health = new DataSourceHealthCheck(h2).check().join();

        assertThat(health.status()).isEqualTo(HealthStatus.OK);
        assertThat(health.name()).isEqualTo("database");
    }

    @Test
    @DisplayName("reports ERROR with a generic message when the pool fails")
    void error() throws Exception {
        DataSource broken = mock(DataSource.class);
        when(broken.getConnection()).thenThrow(new SQLException("password=hunter2 refused"));

        var health = new DataSourceHealthCheck(broken).check().join();

        assertThat(health.status()).isEqualTo(HealthStatus.ERROR);
        assertThat(health.message()).isEqualTo("database unreachable").doesNotContain("hunter2");
    }
}
