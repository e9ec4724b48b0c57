/**
 * Dead-letter ingestion and operator actions.
 *
 * <p>State machine: {@code pending -> replaying -> {replayed | pending}} and
 * {@code pending -> acknowledged}. Both terminal states are removed by
 * {@link io.governor.schedule.RetentionCleaner} after the retention horizon.
 * Every transition is a conditional update whose rows-affected count is
 * authoritative, so concurrent operators never double-process a row.
 */
package io.governor.dead;
