/**
 * Value types shared by the governor: jobs, catalog state, ledger reservations
 * and dead-letter entries.
 */
package io.governor.model;
