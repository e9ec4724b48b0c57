/**
 * Budget-governed enrichment of catalog records.
 *
 * <p>A periodic {@linkplain io.governor.schedule.EnrichmentSweep sweep} finds
 * pending records and enqueues jobs within the remaining budget. A
 * {@linkplain io.governor.consumer.EnrichmentConsumer consumer} drains the queue,
 * reserving one request per job against the day's
 * {@linkplain io.governor.spi.BudgetLedger ledger} row before calling the
 * external lookup service. Jobs that exhaust their queue retries land in the
 * dead-letter store, where operators {@linkplain io.governor.dead.DeadLetterAdmin
 * list, replay or acknowledge} them.
 *
 * <p>No locks are taken anywhere: the daily ledger row and the dead-letter
 * {@code status} column are coordinated purely with conditional writes whose
 * rows-affected count is authoritative.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>governor-core</b>: model, SPIs, breaker, consumer, admin, scheduler (no external deps)</li>
 *   <li><b>governor-jdbc</b>: H2 and PostgreSQL stores</li>
 *   <li><b>governor-micrometer</b>: {@link io.governor.spi.GovernorMetrics} for Micrometer</li>
 *   <li><b>governor-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * <h2>Manual Wiring</h2>
 * <pre>{@code
 * var dialect   = JdbcDialects.detect(dataSource);
 * var conns     = new DataSourceConnectionProvider(dataSource);
 * var config    = GovernorConfig.builder().dailyLimit(500).monthlyLimit(2000).build();
 * var breaker   = new QuotaCircuitBreaker(conns, dialect.budgetLedger());
 * var deadStore = dialect.deadLetterStore();
 *
 * var queue = InMemoryJobQueue.builder()
 *     .deadLetterSink(new DeadLetterIngester(conns, deadStore, () -> config, null, null))
 *     .build();
 *
 * var consumer = EnrichmentConsumer.builder()
 *     .connectionProvider(conns)
 *     .catalogStore(dialect.catalogStore())
 *     .breaker(breaker)
 *     .client(myLookupClient)
 *     .config(config)
 *     .build();
 * }</pre>
 */
package io.governor;
