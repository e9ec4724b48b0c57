/**
 * Queue consumer: per-batch budget gate, sequential rate-limited lookups and
 * retry classification.
 */
package io.governor.consumer;
