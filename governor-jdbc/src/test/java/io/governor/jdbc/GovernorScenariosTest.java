package io.governor.jdbc;

import io.governor.EnrichmentApiException;
import io.governor.breaker.QuotaCircuitBreaker;
import io.governor.breaker.SkipReason;
import io.governor.config.GovernorConfig;
import io.governor.consumer.BatchOutcome;
import io.governor.consumer.EnrichmentConsumer;
import io.governor.dead.DeadLetterAdmin;
import io.governor.dead.DeadLetterIngester;
import io.governor.dead.DeadLetterPage;
import io.governor.dead.DeadLetterStats;
import io.governor.dead.ListRequest;
import io.governor.dead.ReplayResult;
import io.governor.jdbc.dialect.JdbcDialect;
import io.governor.jdbc.dialect.JdbcDialects;
import io.governor.model.DeadLetterEntry;
import io.governor.model.DeadLetterRecord;
import io.governor.model.DeadLetterStatus;
import io.governor.model.EnrichmentJob;
import io.governor.model.EnrichmentStatus;
import io.governor.queue.DeadLetterSink;
import io.governor.queue.InMemoryJobQueue;
import io.governor.queue.QueueMessage;
import io.governor.schedule.CleanupReport;
import io.governor.schedule.EnrichmentSweep;
import io.governor.schedule.RetentionCleaner;
import io.governor.schedule.SweepReport;
import io.governor.spi.BudgetLedger;
import io.governor.spi.CatalogStore;
import io.governor.spi.ConnectionProvider;
import io.governor.spi.DeadLetterQuery;
import io.governor.spi.DeadLetterStore;
import io.governor.spi.EnrichmentClient;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Wires the real stores against H2 and drives whole flows through them.
 */
class GovernorScenariosTest {

    private static final Instant NOW = Instant.parse("2024-05-20T10:00:00Z");
    private static final String TODAY = "2024-05-20";

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final AtomicInteger lookups = new AtomicInteger();

    private JdbcDataSource dataSource;
    private ConnectionProvider connections;
    private BudgetLedger ledger;
    private DeadLetterStore deadLetters;
    private CatalogStore catalog;
    private QuotaCircuitBreaker breaker;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = TestSchemas.h2();
        connections = new DataSourceConnectionProvider(dataSource);
        JdbcDialect dialect = JdbcDialects.detect(dataSource);
        ledger = dialect.budgetLedger();
        deadLetters = dialect.deadLetterStore();
        catalog = dialect.catalogStore();
        breaker = new QuotaCircuitBreaker(connections, ledger, clock);
    }

    @Test
    void dailyLimitStopsTheThirdLookup() throws Exception {
        seed("r-1", "r-2", "r-3");
        GovernorConfig config = GovernorConfig.builder().dailyLimit(2).build();

        BatchOutcome outcome = consumer(config, job -> OptionalDouble.of(5.0))
                .handleBatch(deliver(queue(config, null), "r-1", "r-2", "r-3"));

        assertEquals(2, outcome.enriched());
        assertEquals(1, outcome.overBudget());
        assertEquals(3, outcome.acked());
        assertEquals(2, lookups.get());
        assertEquals(2, usedToday());
        assertEquals(EnrichmentStatus.PENDING, status("r-3"));
    }

    @Test
    void killSwitchAcksEverythingWithoutSpending() throws Exception {
        seed("r-1", "r-2", "r-3", "r-4", "r-5");
        GovernorConfig config = GovernorConfig.builder().killSwitch(true).build();

        BatchOutcome outcome = consumer(config, job -> OptionalDouble.of(1.0))
                .handleBatch(deliver(queue(config, null), "r-1", "r-2", "r-3", "r-4", "r-5"));

        assertEquals(SkipReason.KILL_SWITCH, outcome.batchSkipReason());
        assertEquals(5, outcome.acked());
        assertEquals(0, lookups.get());
        assertEquals(0, countRows("budget_ledger"));
    }

    @Test
    void failedLookupsStillSpendBudget() throws Exception {
        seed("r-1");
        GovernorConfig config = GovernorConfig.builder().dailyLimit(10).build();

        BatchOutcome outcome = consumer(config, job -> {
            throw new EnrichmentApiException(500, "upstream error");
        }).handleBatch(deliver(queue(config, null), "r-1"));

        assertEquals(1, outcome.retried());
        assertEquals(1, usedToday());
    }

    @Test
    void exhaustedMessageIsDeadLetteredThenReplayedOnce() throws Exception {
        seed("r-1");
        GovernorConfig config = GovernorConfig.builder().dailyLimit(10).build();
        DeadLetterIngester ingester = new DeadLetterIngester(connections, deadLetters, () -> config, null, clock);
        InMemoryJobQueue queue = InMemoryJobQueue.builder()
                .maxDeliveries(1)
                .defaultRetryDelay(Duration.ZERO)
                .deadLetterSink(ingester)
                .clock(clock)
                .build();
        consumer(config, job -> {
            throw new EnrichmentApiException(503, "unavailable");
        }).handleBatch(deliver(queue, "r-1"));

        DeadLetterAdmin admin = admin(config, queue);
        DeadLetterPage page = admin.list(ListRequest.pending());
        assertEquals(1, page.totalCount());
        DeadLetterEntry entry = page.entries().get(0);
        assertEquals("r-1", entry.recordId());
        assertEquals(1, entry.failureCount());

        ReplayResult first = admin.replay(List.of(entry.id()), null);
        ReplayResult second = admin.replay(List.of(entry.id()), null);

        assertEquals(new ReplayResult(1, 1, 1, 0), first);
        assertEquals(0, second.claimed());
        DeadLetterEntry replayed = admin.find(entry.id()).orElseThrow();
        assertEquals(DeadLetterStatus.REPLAYED, replayed.status());
        assertEquals(1, replayed.replayCount());
        List<QueueMessage> redelivered = queue.receive(10);
        assertEquals(1, redelivered.size());
        assertEquals("r-1", redelivered.get(0).job().recordId());
    }

    @Test
    void replayedMessageThatFailsAgainIsCountedAsRepeatFailure() throws Exception {
        seed("r-1");
        GovernorConfig config = GovernorConfig.builder().dailyLimit(10).build();
        DeadLetterIngester ingester = new DeadLetterIngester(connections, deadLetters, () -> config, null, clock);
        InMemoryJobQueue queue = InMemoryJobQueue.builder()
                .maxDeliveries(1)
                .defaultRetryDelay(Duration.ZERO)
                .deadLetterSink(ingester)
                .clock(clock)
                .build();
        EnrichmentConsumer failing = consumer(config, job -> {
            throw new EnrichmentApiException(503, "unavailable");
        });
        failing.handleBatch(deliver(queue, "r-1"));
        DeadLetterAdmin admin = admin(config, queue);
        long id = admin.list(ListRequest.pending()).entries().get(0).id();

        assertEquals(1, admin.replay(List.of(id), null).replayed());
        failing.handleBatch(queue.receive(10));

        DeadLetterStats stats = admin.stats();
        assertEquals(1, stats.byStatus().get(DeadLetterStatus.PENDING));
        assertEquals(0, stats.byStatus().get(DeadLetterStatus.REPLAYED));
        assertEquals(1, stats.repeatFailures().size());
        DeadLetterEntry repeat = stats.repeatFailures().get(0);
        assertEquals(id, repeat.id());
        assertEquals("r-1", repeat.recordId());
        assertEquals(1, repeat.replayCount());
        assertEquals(1, admin.list(ListRequest.pending()).totalCount());
    }

    @Test
    void corruptedPayloadStaysPending() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            deadLetters.ingest(conn, new DeadLetterRecord(
                    "m-1", "r-1", "Pale Ale", "Acme", "boom", 3, "enrichment", "{\"recordId\":"), NOW);
        }
        GovernorConfig config = GovernorConfig.defaults();
        InMemoryJobQueue queue = queue(config, null);
        DeadLetterAdmin admin = admin(config, queue);
        long id = admin.list(ListRequest.pending()).entries().get(0).id();

        ReplayResult result = admin.replay(List.of(id), Duration.ZERO);

        assertEquals(1, result.claimed());
        assertEquals(1, result.failed());
        assertEquals(0, result.replayed());
        assertEquals(DeadLetterStatus.PENDING, admin.find(id).orElseThrow().status());
        assertEquals(0, queue.size());
    }

    @Test
    void sweepEnqueuesWithinBudgetAndSkipsBlocklisted() throws Exception {
        seed("r-1", "r-2", "r-3", "r-4");
        TestSchemas.insertCatalog(dataSource, "r-0", "Texas Flight");
        GovernorConfig config = GovernorConfig.builder().dailyLimit(3).build();
        try (Connection conn = dataSource.getConnection()) {
            ledger.reserve(conn, TODAY, 3, NOW);
        }
        InMemoryJobQueue queue = queue(config, null);

        SweepReport report = EnrichmentSweep.builder()
                .connectionProvider(connections)
                .breaker(breaker)
                .catalogStore(catalog)
                .queue(queue)
                .config(config)
                .clock(clock)
                .build()
                .runOnce();

        assertEquals(2, report.effectiveBatch());
        assertEquals(1, report.blocked());
        assertEquals(1, report.queued());
        assertEquals(EnrichmentStatus.SKIPPED, status("r-0"));
        assertEquals(1, queue.size());
    }

    @Test
    void retentionCleanupIsIdempotent() throws Exception {
        GovernorConfig config = GovernorConfig.builder().cleanupBatchSize(2).build();
        try (Connection conn = dataSource.getConnection()) {
            for (int day = 1; day <= 5; day++) {
                ledger.reserve(conn, "2023-01-0" + day, 10, NOW);
            }
            ledger.reserve(conn, TODAY, 10, NOW);
            deadLetters.ingest(conn, new DeadLetterRecord(
                    "m-1", "r-1", "Pale Ale", "Acme", "boom", 3, "enrichment", "{}"), NOW.minus(Duration.ofDays(90)));
            long id = deadLetters.list(conn, new DeadLetterQuery(null, null, null, 1, false))
                    .get(0).id();
            deadLetters.acknowledge(conn, List.of(id), NOW.minus(Duration.ofDays(60)));
        }
        RetentionCleaner cleaner = RetentionCleaner.builder()
                .connectionProvider(connections)
                .ledger(ledger)
                .deadLetterStore(deadLetters)
                .config(config)
                .clock(clock)
                .build();

        CleanupReport first = cleaner.runOnce();
        CleanupReport second = cleaner.runOnce();

        assertEquals(5, first.ledgerDeleted());
        assertEquals(1, first.acknowledgedDeleted());
        assertEquals(0, second.total());
        assertEquals(1, usedToday());
    }

    private EnrichmentConsumer consumer(GovernorConfig config, Function<EnrichmentJob, OptionalDouble> lookup) {
        EnrichmentClient client = new EnrichmentClient() {
            @Override
            public OptionalDouble lookup(EnrichmentJob job) {
                lookups.incrementAndGet();
                return lookup.apply(job);
            }

            @Override
            public String sourceName() {
                return "test";
            }
        };
        return EnrichmentConsumer.builder()
                .connectionProvider(connections)
                .catalogStore(catalog)
                .breaker(breaker)
                .client(client)
                .config(config)
                .sleeper(duration -> { })
                .clock(clock)
                .build();
    }

    private DeadLetterAdmin admin(GovernorConfig config, InMemoryJobQueue queue) {
        return DeadLetterAdmin.builder()
                .connectionProvider(connections)
                .store(deadLetters)
                .queue(queue)
                .config(config)
                .clock(clock)
                .build();
    }

    private InMemoryJobQueue queue(GovernorConfig config, DeadLetterSink sink) {
        return InMemoryJobQueue.builder()
                .defaultRetryDelay(config.defaultRetryDelay())
                .deadLetterSink(sink)
                .clock(clock)
                .build();
    }

    private static List<QueueMessage> deliver(InMemoryJobQueue queue, String... recordIds) {
        for (String id : recordIds) {
            queue.send(new EnrichmentJob(id, "Beer " + id, "Acme"), Duration.ZERO);
        }
        return queue.receive(recordIds.length);
    }

    private void seed(String... ids) throws Exception {
        for (String id : ids) {
            TestSchemas.insertCatalog(dataSource, id, "Beer " + id);
        }
    }

    private int usedToday() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            return ledger.usedOn(conn, TODAY);
        }
    }

    private EnrichmentStatus status(String id) throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            return catalog.findStatus(conn, id).orElseThrow();
        }
    }

    private int countRows(String table) throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            return JdbcTemplate.queryForInt(conn, "SELECT COUNT(*) FROM " + table);
        }
    }
}
