package io.governor.spring.boot;

import io.governor.blocklist.EnrichmentBlocklist;
import io.governor.breaker.QuotaCircuitBreaker;
import io.governor.config.GovernorConfig;
import io.governor.consumer.EnrichmentConsumer;
import io.governor.dead.DeadLetterAdmin;
import io.governor.dead.DeadLetterIngester;
import io.governor.jdbc.DataSourceConnectionProvider;
import io.governor.jdbc.dialect.JdbcDialect;
import io.governor.jdbc.dialect.JdbcDialects;
import io.governor.queue.InMemoryJobQueue;
import io.governor.queue.JobQueue;
import io.governor.queue.QueueWorker;
import io.governor.schedule.EnrichmentScheduler;
import io.governor.schedule.EnrichmentSweep;
import io.governor.schedule.RetentionCleaner;
import io.governor.spi.BudgetLedger;
import io.governor.spi.CatalogStore;
import io.governor.spi.ConnectionProvider;
import io.governor.spi.DeadLetterStore;
import io.governor.spi.EnrichmentClient;
import io.governor.spi.GovernorMetrics;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the enrichment governor.
 *
 * <p>Wires the JDBC stores for the detected dialect, the quota breaker, the sweep,
 * retention cleanup and the dead-letter admin from a {@link DataSource} and
 * {@link GovernorProperties}. The consumer and its polling worker are only created
 * when the application provides an {@link EnrichmentClient}.
 *
 * <p>Components read their settings through {@link PropertiesConfigSupplier} on
 * each run. Queue sizing is fixed when the queue bean is created.
 *
 * @see GovernorProperties
 * @see GovernorMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(QuotaCircuitBreaker.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(GovernorProperties.class)
public class GovernorAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public PropertiesConfigSupplier governorConfigSupplier(GovernorProperties props) {
        return new PropertiesConfigSupplier(props);
    }

    @Bean
    @ConditionalOnMissingBean
    public JdbcDialect governorDialect(DataSource dataSource) {
        return JdbcDialects.detect(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider governorConnectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public BudgetLedger budgetLedger(JdbcDialect dialect, GovernorProperties props) {
        return dialect.budgetLedger(props.getTables().getBudgetLedger());
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterStore deadLetterStore(JdbcDialect dialect, GovernorProperties props) {
        return dialect.deadLetterStore(props.getTables().getDeadLetter());
    }

    @Bean
    @ConditionalOnMissingBean
    public CatalogStore catalogStore(JdbcDialect dialect, GovernorProperties props) {
        return dialect.catalogStore(props.getTables().getCatalog(), props.getTables().getDeadLetter());
    }

    @Bean
    @ConditionalOnMissingBean
    public QuotaCircuitBreaker quotaCircuitBreaker(ConnectionProvider connectionProvider, BudgetLedger ledger) {
        return new QuotaCircuitBreaker(connectionProvider, ledger);
    }

    @Bean
    @ConditionalOnMissingBean
    public EnrichmentBlocklist enrichmentBlocklist(GovernorProperties props) {
        return props.toBlocklist();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterIngester deadLetterIngester(ConnectionProvider connectionProvider,
                                                 DeadLetterStore store,
                                                 PropertiesConfigSupplier config,
                                                 ObjectProvider<GovernorMetrics> metricsProvider) {
        return new DeadLetterIngester(connectionProvider, store, config,
                metricsProvider.getIfAvailable(), null);
    }

    @Bean
    @ConditionalOnMissingBean(JobQueue.class)
    public InMemoryJobQueue enrichmentJobQueue(PropertiesConfigSupplier configSupplier,
                                               GovernorProperties props,
                                               DeadLetterIngester ingester) {
        GovernorConfig config = configSupplier.get();
        return InMemoryJobQueue.builder()
                .maxBatchSize(config.maxEnqueueBatch())
                .maxDeliveries(props.getConsumer().getMaxDeliveries())
                .defaultRetryDelay(config.defaultRetryDelay())
                .deadLetterSink(ingester)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public EnrichmentSweep enrichmentSweep(ConnectionProvider connectionProvider,
                                           QuotaCircuitBreaker breaker,
                                           CatalogStore catalogStore,
                                           JobQueue queue,
                                           EnrichmentBlocklist blocklist,
                                           PropertiesConfigSupplier config,
                                           ObjectProvider<GovernorMetrics> metricsProvider) {
        return EnrichmentSweep.builder()
                .connectionProvider(connectionProvider)
                .breaker(breaker)
                .catalogStore(catalogStore)
                .queue(queue)
                .blocklist(blocklist)
                .config(config)
                .metrics(metricsProvider.getIfAvailable())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetentionCleaner retentionCleaner(ConnectionProvider connectionProvider,
                                             BudgetLedger ledger,
                                             DeadLetterStore deadLetterStore,
                                             PropertiesConfigSupplier config,
                                             ObjectProvider<GovernorMetrics> metricsProvider) {
        return RetentionCleaner.builder()
                .connectionProvider(connectionProvider)
                .ledger(ledger)
                .deadLetterStore(deadLetterStore)
                .config(config)
                .metrics(metricsProvider.getIfAvailable())
                .build();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "enrichment.scheduler", name = "enabled", matchIfMissing = true)
    public EnrichmentScheduler enrichmentScheduler(EnrichmentSweep sweep,
                                                   RetentionCleaner cleaner,
                                                   GovernorProperties props) {
        return EnrichmentScheduler.builder()
                .sweep(sweep)
                .cleaner(cleaner)
                .intervalSeconds(props.getScheduler().getIntervalSeconds())
                .initialDelaySeconds(props.getScheduler().getInitialDelaySeconds())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterAdmin deadLetterAdmin(ConnectionProvider connectionProvider,
                                           DeadLetterStore store,
                                           JobQueue queue,
                                           PropertiesConfigSupplier config,
                                           ObjectProvider<GovernorMetrics> metricsProvider) {
        return DeadLetterAdmin.builder()
                .connectionProvider(connectionProvider)
                .store(store)
                .queue(queue)
                .config(config)
                .metrics(metricsProvider.getIfAvailable())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(EnrichmentClient.class)
    public EnrichmentConsumer enrichmentConsumer(ConnectionProvider connectionProvider,
                                                 CatalogStore catalogStore,
                                                 QuotaCircuitBreaker breaker,
                                                 EnrichmentClient client,
                                                 PropertiesConfigSupplier config,
                                                 ObjectProvider<GovernorMetrics> metricsProvider) {
        return EnrichmentConsumer.builder()
                .connectionProvider(connectionProvider)
                .catalogStore(catalogStore)
                .breaker(breaker)
                .client(client)
                .config(config)
                .metrics(metricsProvider.getIfAvailable())
                .build();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean({EnrichmentClient.class, InMemoryJobQueue.class})
    public QueueWorker enrichmentQueueWorker(InMemoryJobQueue queue,
                                             EnrichmentConsumer consumer,
                                             GovernorProperties props) {
        return QueueWorker.builder()
                .queue(queue)
                .consumer(consumer)
                .batchSize(props.getConsumer().getBatchSize())
                .intervalMs(props.getConsumer().getPollIntervalMs())
                .build();
    }
}
