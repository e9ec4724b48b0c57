package io.governor.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GovernorConfigTest {

    @Test
    void defaults() {
        GovernorConfig config = GovernorConfig.defaults();

        assertFalse(config.killSwitch());
        assertEquals(500, config.dailyLimit());
        assertEquals(2000, config.monthlyLimit());
        assertEquals(Duration.ofDays(90), config.ledgerRetention());
        assertEquals(Duration.ofDays(30), config.deadLetterRetention());
        assertEquals(Duration.ofSeconds(2), config.interCallDelay());
        assertEquals(Duration.ofSeconds(120), config.rateLimitRetryDelay());
        assertEquals(50, config.maxReplayBatch());
        assertEquals(100, config.maxAcknowledgeBatch());
        assertEquals(100, config.maxEnqueueBatch());
        assertEquals(1000, config.cleanupBatchSize());
        assertEquals(0.7, config.confidence());
        assertEquals("enrichment", config.sourceQueue());
    }

    @Test
    void toBuilderCopiesEveryField() {
        GovernorConfig original = GovernorConfig.builder()
                .killSwitch(true)
                .dailyLimit(3)
                .monthlyLimit(7)
                .interCallDelay(Duration.ZERO)
                .sourceQueue("beers")
                .build();

        GovernorConfig copy = original.toBuilder().dailyLimit(4).build();

        assertTrue(copy.killSwitch());
        assertEquals(4, copy.dailyLimit());
        assertEquals(7, copy.monthlyLimit());
        assertEquals(Duration.ZERO, copy.interCallDelay());
        assertEquals("beers", copy.sourceQueue());
    }

    @Test
    void zeroLimitsAreAllowed() {
        GovernorConfig config = GovernorConfig.builder().dailyLimit(0).monthlyLimit(0).build();

        assertEquals(0, config.dailyLimit());
        assertEquals(0, config.monthlyLimit());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> GovernorConfig.builder().dailyLimit(-1).build());
        assertThrows(IllegalArgumentException.class, () -> GovernorConfig.builder().monthlyLimit(-1).build());
        assertThrows(IllegalArgumentException.class, () -> GovernorConfig.builder().maxReplayBatch(0).build());
        assertThrows(IllegalArgumentException.class, () -> GovernorConfig.builder().cleanupBatchSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> GovernorConfig.builder().confidence(1.5).build());
        assertThrows(IllegalArgumentException.class,
                () -> GovernorConfig.builder().interCallDelay(Duration.ofSeconds(-1)).build());
        assertThrows(NullPointerException.class, () -> GovernorConfig.builder().sourceQueue(null).build());
    }
}
