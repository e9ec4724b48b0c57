/**
 * Quota circuit breaker and ledger period helpers.
 */
package io.governor.breaker;
