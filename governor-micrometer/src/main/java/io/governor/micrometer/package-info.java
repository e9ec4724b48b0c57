/**
 * Micrometer bridge for the governor's sweep, consumer, dead-letter and cleanup metrics.
 *
 * <p>{@link io.governor.micrometer.MicrometerGovernorMetrics} implements the
 * {@link io.governor.spi.GovernorMetrics} SPI with counters and gauges.
 */
package io.governor.micrometer;
