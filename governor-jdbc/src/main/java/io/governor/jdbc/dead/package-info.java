/**
 * JDBC dead-letter stores: {@link io.governor.jdbc.dead.H2DeadLetterStore} and
 * {@link io.governor.jdbc.dead.PostgresDeadLetterStore}.
 */
package io.governor.jdbc.dead;
