package net.tenure.bootstrap.autoconfigure;

import net.tenure.bootstrap.props.TenureProperties;
import net.tenure.bootstrap.runner.ElectionAutoStarter;
import net.tenure.core.backend.StoreBackedBackendFactory;
import net.tenure.core.engine.ElectionEngine;
import net.tenure.core.engine.ElectionTimings;
import net.tenure.core.event.LoggingEventSink;
import net.tenure.core.registry.NodeRegistry;
import net.tenure.core.spi.Clock;
import net.tenure.core.spi.EventSink;
import net.tenure.core.spi.KeyValueStore;
import net.tenure.core.spi.LeaseDocumentStore;
import net.tenure.core.spi.StorageBackendFactory;
import net.tenure.core.spi.TxRunner;
import net.tenure.integration.spring.TenureSpringConfig;
import net.tenure.integration.spring.event.SpringEventSink;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration",
        "org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration",
        "org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration"
})
@EnableConfigurationProperties(TenureProperties.class)
public class TenureAutoConfiguration {

    // --- SPI defaults ---

    @Bean
    @ConditionalOnMissingBean
    public Clock tenureClock() {
        return Clock.system();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventSink electionEventSink(ApplicationEventPublisher publisher) {
        return EventSink.composite(new LoggingEventSink(), new SpringEventSink(publisher));
    }

    // --- core assembly ---

    @Bean
    @ConditionalOnMissingBean
    public NodeRegistry nodeRegistry(TenureProperties props) {
        return NodeRegistry.ofSize(props.getNodes().getCount(), props.getNodes().getIdPrefix());
    }

    @Bean
    @ConditionalOnMissingBean
    public ElectionTimings electionTimings(TenureProperties props) {
        var e = props.getElection();
        return new ElectionTimings(e.getCompetitionJitter(), e.getFollowerBackoff(),
                e.getHeartbeatInterval(), e.getLeaseDuration());
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public ElectionEngine electionEngine(NodeRegistry registry,
                                         StorageBackendFactory backends,
                                         EventSink sink,
                                         ElectionTimings timings,
                                         Clock clock) {
        return new ElectionEngine(registry, backends, sink, timings, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "tenure.election", name = "auto-start")
    public ElectionAutoStarter electionAutoStarter(ElectionEngine engine, TenureProperties props) {
        return new ElectionAutoStarter(engine, props.getElection().getAutoStart());
    }

    // --- stores (tenure.store.type) ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "tenure.store", name = "type", havingValue = "memory", matchIfMissing = true)
    static class MemoryStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public StorageBackendFactory storageBackendFactory(Clock clock, ElectionTimings timings) {
            return StoreBackedBackendFactory.inMemory(clock, timings.leaseDuration());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "tenure.store", name = "type", havingValue = "jdbc")
    @Import(TenureSpringConfig.class) // integration-spring: jdbc stores + tx
    static class JdbcStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public StorageBackendFactory storageBackendFactory(LeaseDocumentStore documents,
                                                           KeyValueStore keys,
                                                           TxRunner tx,
                                                           ElectionTimings timings) {
            return new StoreBackedBackendFactory(documents, keys, tx, timings.leaseDuration());
        }
    }
}
