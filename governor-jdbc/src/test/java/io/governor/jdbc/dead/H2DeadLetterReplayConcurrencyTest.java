package io.governor.jdbc.dead;

import io.governor.config.GovernorConfig;
import io.governor.dead.DeadLetterAdmin;
import io.governor.dead.ReplayResult;
import io.governor.jdbc.DataSourceConnectionProvider;
import io.governor.jdbc.TestSchemas;
import io.governor.model.DeadLetterRecord;
import io.governor.model.DeadLetterStatus;
import io.governor.model.EnrichmentJob;
import io.governor.queue.InMemoryJobQueue;
import io.governor.queue.QueueMessage;
import io.governor.spi.DeadLetterQuery;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

class H2DeadLetterReplayConcurrencyTest {

    private static final Instant NOW = Instant.parse("2024-05-20T10:00:00Z");
    private static final int ROWS = 30;

    private JdbcDataSource dataSource;
    private H2DeadLetterStore store;
    private InMemoryJobQueue queue;
    private DeadLetterAdmin admin;
    private List<Long> ids;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = TestSchemas.h2();
        store = new H2DeadLetterStore();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        queue = InMemoryJobQueue.builder().clock(clock).build();
        admin = DeadLetterAdmin.builder()
                .connectionProvider(new DataSourceConnectionProvider(dataSource))
                .store(store)
                .queue(queue)
                .config(GovernorConfig.defaults())
                .clock(clock)
                .build();
        try (Connection conn = dataSource.getConnection()) {
            for (int i = 0; i < ROWS; i++) {
                String recordId = "r-" + i;
                store.ingest(conn, new DeadLetterRecord("m-" + i, recordId, "Beer " + i, "Acme", "boom", 3,
                        "enrichment", new EnrichmentJob(recordId, "Beer " + i, "Acme").toJson()), NOW);
            }
            ids = store.list(conn, new DeadLetterQuery(DeadLetterStatus.PENDING, null, null, ROWS, false))
                    .stream()
                    .map(e -> e.id())
                    .sorted(Comparator.naturalOrder())
                    .toList();
        }
    }

    @RepeatedTest(5)
    void overlappingReplaysClaimDisjointRows() throws Exception {
        List<Long> first = ids.subList(0, 20);
        List<Long> second = ids.subList(10, ROWS);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<ReplayResult> a = pool.submit(() -> {
                start.await();
                return admin.replay(first, null);
            });
            Future<ReplayResult> b = pool.submit(() -> {
                start.await();
                return admin.replay(second, null);
            });
            start.countDown();

            ReplayResult ra = a.get(30, TimeUnit.SECONDS);
            ReplayResult rb = b.get(30, TimeUnit.SECONDS);
            assertEquals(ROWS, ra.claimed() + rb.claimed());
            assertEquals(ROWS, ra.replayed() + rb.replayed());
        } finally {
            pool.shutdownNow();
        }

        List<QueueMessage> sent = queue.receive(ROWS * 2);
        assertEquals(ROWS, sent.size());
        Set<String> recordIds = sent.stream().map(m -> m.job().recordId()).collect(Collectors.toSet());
        assertEquals(ROWS, recordIds.size());
        try (Connection conn = dataSource.getConnection()) {
            assertEquals(ROWS, store.count(conn, DeadLetterStatus.REPLAYED, null));
            assertEquals(0, store.count(conn, DeadLetterStatus.REPLAYING, null));
        }
    }
}
