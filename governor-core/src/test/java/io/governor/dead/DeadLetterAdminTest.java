package io.governor.dead;

import io.governor.config.GovernorConfig;
import io.governor.dead.AdminRequestException.ErrorCode;
import io.governor.model.DeadLetterEntry;
import io.governor.model.DeadLetterStatus;
import io.governor.model.EnrichmentJob;
import io.governor.model.PageCursor;
import io.governor.queue.JobQueue;
import io.governor.stub.MutableClock;
import io.governor.stub.RecordingMetrics;
import io.governor.stub.StubDeadLetterStore;
import io.governor.util.JsonCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeadLetterAdminTest {

    private static final Instant NOW = Instant.parse("2024-05-20T10:00:00Z");

    private StubDeadLetterStore store;
    private CapturingQueue queue;
    private RecordingMetrics metrics;
    private MutableClock clock;
    private DeadLetterAdmin admin;

    @BeforeEach
    void setUp() {
        store = new StubDeadLetterStore();
        queue = new CapturingQueue();
        metrics = new RecordingMetrics();
        clock = new MutableClock(NOW);
        admin = DeadLetterAdmin.builder()
                .connectionProvider(() -> null)
                .store(store)
                .queue(queue)
                .config(GovernorConfig.builder().maxReplayBatch(3).maxAcknowledgeBatch(3).build())
                .metrics(metrics)
                .clock(clock)
                .build();
    }

    @Test
    void listDefaultsToPendingAndOmitsRawPayload() {
        long pending = store.add("r1", NOW.minusSeconds(60), payload("r1"));
        long acked = store.add("r2", NOW.minusSeconds(30), payload("r2"));
        admin.acknowledge(List.of(acked));

        DeadLetterPage page = admin.list(ListRequest.pending());

        assertEquals(1, page.totalCount());
        assertEquals(pending, page.entries().get(0).id());
        assertNull(page.entries().get(0).rawMessage());
        assertFalse(page.hasMore());
        assertNull(page.nextCursor());
    }

    @Test
    void listAllStatusesWithRaw() {
        store.add("r1", NOW.minusSeconds(60), payload("r1"));
        long acked = store.add("r2", NOW.minusSeconds(30), payload("r2"));
        admin.acknowledge(List.of(acked));

        DeadLetterPage page = admin.list(ListRequest.pending().withStatus("all").withRaw(true));

        assertEquals(2, page.totalCount());
        assertNotNull(page.entries().get(0).rawMessage());
    }

    @Test
    void cursorPagesWithoutOverlapOrGaps() {
        Instant sameSecond = NOW.minusSeconds(5);
        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            ids.add(store.add("r" + i, i < 3 ? sameSecond : NOW.minusSeconds(100 + i), payload("r" + i)));
        }

        List<Long> seen = new ArrayList<>();
        ListRequest request = ListRequest.pending().withLimit(2);
        DeadLetterPage page;
        do {
            page = admin.list(request);
            page.entries().forEach(e -> seen.add(e.id()));
            request = request.withCursor(page.nextCursor());
        } while (page.hasMore());

        assertEquals(List.of(ids.get(2), ids.get(1), ids.get(0), ids.get(3), ids.get(4)), seen);
    }

    @Test
    void listFiltersByRecordId() {
        store.add("r1", NOW.minusSeconds(3), payload("r1"));
        store.add("r2", NOW.minusSeconds(2), payload("r2"));
        store.add("r1", NOW.minusSeconds(1), payload("r1"));

        DeadLetterPage page = admin.list(ListRequest.pending().withRecordId("r1"));

        assertEquals(2, page.totalCount());
        assertTrue(page.entries().stream().allMatch(e -> e.recordId().equals("r1")));
    }

    @Test
    void limitIsCappedAndValidated() {
        LongStream.range(0, 105).forEach(i -> store.add("r" + i, NOW.minusSeconds(i), payload("r" + i)));

        DeadLetterPage page = admin.list(ListRequest.pending().withLimit(500));

        assertEquals(ListRequest.MAX_LIMIT, page.entries().size());
        assertTrue(page.hasMore());
        assertEquals(105, page.totalCount());

        AdminRequestException e = assertThrows(AdminRequestException.class,
                () -> admin.list(ListRequest.pending().withLimit(0)));
        assertEquals(ErrorCode.INVALID_REQUEST, e.code());
    }

    @Test
    void rejectsUnknownStatusAndBadCursor() {
        assertEquals(ErrorCode.INVALID_REQUEST, assertThrows(AdminRequestException.class,
                () -> admin.list(ListRequest.pending().withStatus("exploded"))).code());
        assertEquals(ErrorCode.INVALID_CURSOR, assertThrows(AdminRequestException.class,
                () -> admin.list(ListRequest.pending().withCursor("%%%not-base64"))).code());
        assertEquals(ErrorCode.INVALID_CURSOR, assertThrows(AdminRequestException.class,
                () -> admin.list(ListRequest.pending().withCursor("e30"))).code());
    }

    @Test
    void cursorEncodingIsUrlSafe() {
        CursorCodec codec = new CursorCodec(JsonCodec.getDefault());
        PageCursor cursor = new PageCursor(Instant.ofEpochMilli(1_716_199_200_123L), 987_654_321L);

        String encoded = codec.encode(cursor);

        assertFalse(encoded.contains("="));
        assertFalse(encoded.contains("+"));
        assertFalse(encoded.contains("/"));
        assertEquals(cursor, codec.decode(encoded));
    }

    @Test
    void replayReenqueuesAndMarksReplayed() {
        long id = store.add("r1", NOW.minusSeconds(60), payload("r1"));

        ReplayResult result = admin.replay(List.of(id), Duration.ofSeconds(30));

        assertEquals(new ReplayResult(1, 1, 1, 0), result);
        assertEquals(List.of(new EnrichmentJob("r1", "Name r1", null)), queue.sent);
        assertEquals(List.of(Duration.ofSeconds(30)), queue.delays);
        DeadLetterEntry entry = store.get(id);
        assertEquals(DeadLetterStatus.REPLAYED, entry.status());
        assertEquals(1, entry.replayCount());
        assertEquals(NOW, entry.replayedAt());
        assertEquals(1, metrics.replayed.get());
    }

    @Test
    void replaySkipsRowsThatAreNotPending() {
        long pending = store.add("r1", NOW, payload("r1"));
        long acked = store.add("r2", NOW, payload("r2"));
        admin.acknowledge(List.of(acked));

        ReplayResult result = admin.replay(List.of(pending, acked, 999L), null);

        assertEquals(3, result.requested());
        assertEquals(1, result.claimed());
        assertEquals(1, result.replayed());
        assertEquals(DeadLetterStatus.ACKNOWLEDGED, store.get(acked).status());
    }

    @Test
    void malformedPayloadStaysPending() {
        long good = store.add("r1", NOW, payload("r1"));
        long bad = store.add("r2", NOW, "{\"name\":\"no id\"}");

        ReplayResult result = admin.replay(List.of(good, bad), null);

        assertEquals(1, result.replayed());
        assertEquals(1, result.failed());
        assertEquals(DeadLetterStatus.PENDING, store.get(bad).status());
        assertEquals(0, store.get(bad).replayCount());
    }

    @Test
    void sendFailureReleasesClaim() {
        long id = store.add("r1", NOW, payload("r1"));
        queue.failing = true;

        ReplayResult result = admin.replay(List.of(id), null);

        assertEquals(0, result.replayed());
        assertEquals(1, result.failed());
        assertEquals(DeadLetterStatus.PENDING, store.get(id).status());
    }

    @Test
    void replayedRowCannotBeReplayedAgain() {
        long id = store.add("r1", NOW, payload("r1"));
        admin.replay(List.of(id), null);

        ReplayResult second = admin.replay(List.of(id), null);

        assertEquals(0, second.claimed());
        assertEquals(1, queue.sent.size());
    }

    @Test
    void idsAreValidatedDedupedAndTruncated() {
        assertEquals(ErrorCode.INVALID_REQUEST,
                assertThrows(AdminRequestException.class, () -> admin.replay(List.of(), null)).code());
        assertEquals(ErrorCode.INVALID_REQUEST,
                assertThrows(AdminRequestException.class, () -> admin.acknowledge(null)).code());
        assertEquals(ErrorCode.INVALID_ID,
                assertThrows(AdminRequestException.class, () -> admin.acknowledge(List.of(1L, 0L))).code());
        assertEquals(ErrorCode.INVALID_ID,
                assertThrows(AdminRequestException.class, () -> admin.acknowledge(Arrays.asList(1L, null))).code());
        assertEquals(ErrorCode.INVALID_REQUEST, assertThrows(AdminRequestException.class,
                () -> admin.replay(List.of(1L), Duration.ofSeconds(-1))).code());

        long a = store.add("a", NOW, payload("a"));
        long b = store.add("b", NOW, payload("b"));
        long c = store.add("c", NOW, payload("c"));
        long d = store.add("d", NOW, payload("d"));

        ReplayResult result = admin.replay(List.of(a, a, b, c, d), null);

        assertEquals(3, result.requested());
        assertEquals(DeadLetterStatus.PENDING, store.get(d).status());
    }

    @Test
    void acknowledgeCountsOnlyPendingRows() {
        long a = store.add("a", NOW, payload("a"));
        long b = store.add("b", NOW, payload("b"));

        assertEquals(2, admin.acknowledge(List.of(a, b)));
        assertEquals(0, admin.acknowledge(List.of(a, b)));
        assertEquals(NOW, store.get(a).acknowledgedAt());
    }

    @Test
    void statsSummariseTheStore() {
        store.add("a", NOW.minus(Duration.ofMinutes(90)), payload("a"));
        store.add("b", NOW.minus(Duration.ofHours(30)), payload("b"));
        long c = store.add("c", NOW.minusSeconds(10), payload("c"));
        long d = store.add("d", NOW.minusSeconds(10), payload("d"));
        admin.acknowledge(List.of(c));
        admin.replay(List.of(d), null);

        DeadLetterStats stats = admin.stats();

        assertEquals(2, stats.byStatus().get(DeadLetterStatus.PENDING));
        assertEquals(1, stats.byStatus().get(DeadLetterStatus.ACKNOWLEDGED));
        assertEquals(1, stats.byStatus().get(DeadLetterStatus.REPLAYED));
        assertEquals(0, stats.byStatus().get(DeadLetterStatus.REPLAYING));
        assertEquals(30.0, stats.oldestPendingAgeHours());
        assertEquals(1, stats.last24h().replayed());
        assertEquals(1, stats.last24h().acknowledged());
        assertEquals(3, stats.last24h().newFailures());
        assertEquals("brewer", stats.topFailingSources().get(0).source());
        assertEquals(2, stats.topFailingSources().get(0).count());
    }

    @Test
    void statsWithNoPendingRowsHaveNoAge() {
        assertNull(admin.stats().oldestPendingAgeHours());
    }

    @Test
    void ageIsRoundedToOneDecimal() {
        assertEquals(1.5, DeadLetterAdmin.ageInHours(NOW.minus(Duration.ofMinutes(90)), NOW));
        assertEquals(0.1, DeadLetterAdmin.ageInHours(NOW.minus(Duration.ofMinutes(3)), NOW));
        assertEquals(0.0, DeadLetterAdmin.ageInHours(NOW.plusSeconds(60), NOW));
    }

    @Test
    void storeOutageSurfacesAsUnavailable() {
        store.setFailing(true);

        assertEquals(ErrorCode.STORE_UNAVAILABLE,
                assertThrows(AdminRequestException.class, () -> admin.list(ListRequest.pending())).code());
        assertEquals(ErrorCode.STORE_UNAVAILABLE,
                assertThrows(AdminRequestException.class, () -> admin.stats()).code());
        assertEquals(ErrorCode.STORE_UNAVAILABLE,
                assertThrows(AdminRequestException.class, () -> admin.acknowledge(List.of(1L))).code());
    }

    private static String payload(String recordId) {
        return new EnrichmentJob(recordId, "Name " + recordId, null).toJson();
    }

    private static final class CapturingQueue implements JobQueue {
        final List<EnrichmentJob> sent = new ArrayList<>();
        final List<Duration> delays = new ArrayList<>();
        boolean failing;

        @Override
        public void send(EnrichmentJob job, Duration delay) {
            if (failing) {
                throw new IllegalStateException("queue down");
            }
            sent.add(job);
            delays.add(delay);
        }

        @Override
        public void sendBatch(List<EnrichmentJob> jobs) {
            jobs.forEach(j -> send(j, Duration.ZERO));
        }

        @Override
        public int maxBatchSize() {
            return 100;
        }
    }
}
