package io.governor.spring.boot;

import io.governor.blocklist.EnrichmentBlocklist;
import io.governor.config.GovernorConfig;
import io.governor.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the enrichment governor.
 *
 * @see GovernorAutoConfiguration
 */
@ConfigurationProperties(prefix = "enrichment")
public class GovernorProperties {

    private final Quota quota = new Quota();
    private final Retention retention = new Retention();
    private final Consumer consumer = new Consumer();
    private final Admin admin = new Admin();
    private final Scheduler scheduler = new Scheduler();
    private final Tables tables = new Tables();
    private final Blocklist blocklist = new Blocklist();
    private final Metrics metrics = new Metrics();

    public Quota getQuota() {
        return quota;
    }

    public Retention getRetention() {
        return retention;
    }

    public Consumer getConsumer() {
        return consumer;
    }

    public Admin getAdmin() {
        return admin;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Tables getTables() {
        return tables;
    }

    public Blocklist getBlocklist() {
        return blocklist;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Builds the runtime configuration. Validation happens here, so an invalid
     * value fails context startup.
     */
    public GovernorConfig toConfig() {
        return GovernorConfig.builder()
                .killSwitch(quota.isKillSwitch())
                .dailyLimit(quota.getDailyLimit())
                .monthlyLimit(quota.getMonthlyLimit())
                .ledgerRetention(retention.getLedger())
                .deadLetterRetention(retention.getDeadLetter())
                .cleanupBatchSize(retention.getBatchSize())
                .interCallDelay(consumer.getInterCallDelay())
                .rateLimitRetryDelay(consumer.getRateLimitRetryDelay())
                .defaultRetryDelay(consumer.getDefaultRetryDelay())
                .confidence(consumer.getConfidence())
                .sourceQueue(consumer.getSourceQueue())
                .maxReplayBatch(admin.getMaxReplayBatch())
                .maxAcknowledgeBatch(admin.getMaxAcknowledgeBatch())
                .maxEnqueueBatch(scheduler.getMaxEnqueueBatch())
                .build();
    }

    public EnrichmentBlocklist toBlocklist() {
        EnrichmentBlocklist.Builder builder = blocklist.isIncludeDefaults()
                ? EnrichmentBlocklist.builder()
                : EnrichmentBlocklist.empty();
        return builder.names(blocklist.getNames())
                .patterns(blocklist.getPatterns())
                .build();
    }

    public static class Quota {
        /**
         * Stops all sweeps and drains consumed batches without calling the lookup service.
         */
        private boolean killSwitch = false;

        /**
         * Maximum lookups per UTC day. Enforced atomically per request.
         */
        private int dailyLimit = 500;

        /**
         * Soft ceiling on lookups per UTC calendar month.
         */
        private int monthlyLimit = 2000;

        public boolean isKillSwitch() {
            return killSwitch;
        }

        public void setKillSwitch(boolean killSwitch) {
            this.killSwitch = killSwitch;
        }

        public int getDailyLimit() {
            return dailyLimit;
        }

        public void setDailyLimit(int dailyLimit) {
            this.dailyLimit = dailyLimit;
        }

        public int getMonthlyLimit() {
            return monthlyLimit;
        }

        public void setMonthlyLimit(int monthlyLimit) {
            this.monthlyLimit = monthlyLimit;
        }
    }

    public static class Retention {
        private Duration ledger = Duration.ofDays(90);
        private Duration deadLetter = Duration.ofDays(30);

        /**
         * Rows deleted per cleanup statement.
         */
        private int batchSize = 1000;

        public Duration getLedger() {
            return ledger;
        }

        public void setLedger(Duration ledger) {
            this.ledger = ledger;
        }

        public Duration getDeadLetter() {
            return deadLetter;
        }

        public void setDeadLetter(Duration deadLetter) {
            this.deadLetter = deadLetter;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Consumer {
        private Duration interCallDelay = Duration.ofSeconds(2);
        private Duration rateLimitRetryDelay = Duration.ofSeconds(120);
        private Duration defaultRetryDelay = Duration.ofSeconds(60);
        private double confidence = 0.7;
        private String sourceQueue = "enrichment";

        /**
         * Deliveries before the in-memory queue dead-letters a message.
         */
        private int maxDeliveries = 3;
        private int batchSize = 10;
        private long pollIntervalMs = 1000;

        public Duration getInterCallDelay() {
            return interCallDelay;
        }

        public void setInterCallDelay(Duration interCallDelay) {
            this.interCallDelay = interCallDelay;
        }

        public Duration getRateLimitRetryDelay() {
            return rateLimitRetryDelay;
        }

        public void setRateLimitRetryDelay(Duration rateLimitRetryDelay) {
            this.rateLimitRetryDelay = rateLimitRetryDelay;
        }

        public Duration getDefaultRetryDelay() {
            return defaultRetryDelay;
        }

        public void setDefaultRetryDelay(Duration defaultRetryDelay) {
            this.defaultRetryDelay = defaultRetryDelay;
        }

        public double getConfidence() {
            return confidence;
        }

        public void setConfidence(double confidence) {
            this.confidence = confidence;
        }

        public String getSourceQueue() {
            return sourceQueue;
        }

        public void setSourceQueue(String sourceQueue) {
            this.sourceQueue = sourceQueue;
        }

        public int getMaxDeliveries() {
            return maxDeliveries;
        }

        public void setMaxDeliveries(int maxDeliveries) {
            this.maxDeliveries = maxDeliveries;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }
    }

    public static class Admin {
        private int maxReplayBatch = 50;
        private int maxAcknowledgeBatch = 100;

        public int getMaxReplayBatch() {
            return maxReplayBatch;
        }

        public void setMaxReplayBatch(int maxReplayBatch) {
            this.maxReplayBatch = maxReplayBatch;
        }

        public int getMaxAcknowledgeBatch() {
            return maxAcknowledgeBatch;
        }

        public void setMaxAcknowledgeBatch(int maxAcknowledgeBatch) {
            this.maxAcknowledgeBatch = maxAcknowledgeBatch;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private long intervalSeconds = 3600;
        private long initialDelaySeconds = 60;
        private int maxEnqueueBatch = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }

        public long getInitialDelaySeconds() {
            return initialDelaySeconds;
        }

        public void setInitialDelaySeconds(long initialDelaySeconds) {
            this.initialDelaySeconds = initialDelaySeconds;
        }

        public int getMaxEnqueueBatch() {
            return maxEnqueueBatch;
        }

        public void setMaxEnqueueBatch(int maxEnqueueBatch) {
            this.maxEnqueueBatch = maxEnqueueBatch;
        }
    }

    public static class Tables {
        private String budgetLedger = TableNames.BUDGET_LEDGER;
        private String deadLetter = TableNames.DEAD_LETTER;
        private String catalog = TableNames.CATALOG;

        public String getBudgetLedger() {
            return budgetLedger;
        }

        public void setBudgetLedger(String budgetLedger) {
            this.budgetLedger = budgetLedger;
        }

        public String getDeadLetter() {
            return deadLetter;
        }

        public void setDeadLetter(String deadLetter) {
            this.deadLetter = deadLetter;
        }

        public String getCatalog() {
            return catalog;
        }

        public void setCatalog(String catalog) {
            this.catalog = catalog;
        }
    }

    public static class Blocklist {
        /**
         * Start from the built-in names and patterns.
         */
        private boolean includeDefaults = true;
        private List<String> names = new ArrayList<>();

        /**
         * Case-insensitive regular expressions matched anywhere in the name.
         */
        private List<String> patterns = new ArrayList<>();

        public boolean isIncludeDefaults() {
            return includeDefaults;
        }

        public void setIncludeDefaults(boolean includeDefaults) {
            this.includeDefaults = includeDefaults;
        }

        public List<String> getNames() {
            return names;
        }

        public void setNames(List<String> names) {
            this.names = names;
        }

        public List<String> getPatterns() {
            return patterns;
        }

        public void setPatterns(List<String> patterns) {
            this.patterns = patterns;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "enrichment";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
