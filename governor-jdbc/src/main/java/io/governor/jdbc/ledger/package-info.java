/**
 * JDBC budget ledger implementations.
 */
package io.governor.jdbc.ledger;
