package net.tenure.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.tenure.core.spi.TxRunner;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInstance;

import javax.sql.DataSource;
import java.util.Optional;

/**
 * Shared database for the acceptance tests.
 * TENURE_JDBC_URL / TENURE_JDBC_USERNAME / TENURE_JDBC_PASSWORD point the tests at a real server;
 * without them an in-memory H2 database is used.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    protected static DataSource ds;
    protected TxRunner tx;

    @BeforeAll
    void setupDb() {
        String url = System.getenv("TENURE_JDBC_URL");
        String user = System.getenv("TENURE_JDBC_USERNAME");
        String pass = System.getenv("TENURE_JDBC_PASSWORD");

        if (url == null || url.isBlank()) {
            url = "jdbc:h2:mem:tenure;DB_CLOSE_DELAY=-1";
            user = "sa";
            pass = "";
        }

        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(url);
        cfg.setUsername(user);
        cfg.setPassword(Optional.ofNullable(pass).orElse(""));
        cfg.setMaximumPoolSize(10);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        cfg.setIdleTimeout(60_000);
        ds = new HikariDataSource(cfg);

        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration")
                .baselineOnMigrate(true)
                .load()
                .migrate();

        tx = new JdbcTxRunner(ds);
    }

    /** Every test starts from empty tables. */
    @BeforeEach
    void clearTables() throws Exception {
        tx.required(() -> {
            try (var st = TxContext.require().createStatement()) {
                st.executeUpdate("DELETE FROM TB_LEASE_DOCUMENT");
                st.executeUpdate("DELETE FROM TB_LEASE_KEY");
            }
            return null;
        });
    }

    @AfterAll
    void cleanup() {
        if (ds instanceof HikariDataSource h) h.close();
    }
}
