package net.tenure.integration.spring;

import net.tenure.adapter.jdbc.store.JdbcKeyValueStore;
import net.tenure.adapter.jdbc.store.JdbcLeaseDocumentStore;
import net.tenure.core.spi.Clock;
import net.tenure.core.spi.KeyValueStore;
import net.tenure.core.spi.LeaseDocumentStore;
import net.tenure.core.spi.TxRunner;
import net.tenure.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/** JDBC-backed stores and the Spring transaction bridge. Expects a DataSource, a transaction manager and a Clock. */
@Configuration(proxyBeanMethods = false)
public class TenureSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean
    public LeaseDocumentStore leaseDocumentStore() {
        return new JdbcLeaseDocumentStore();
    }

    @Bean
    public KeyValueStore keyValueStore(Clock clock) {
        return new JdbcKeyValueStore(clock);
    }
}
