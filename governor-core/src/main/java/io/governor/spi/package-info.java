/**
 * Service provider interfaces: the durable stores, the external lookup service,
 * connection supply and telemetry.
 *
 * <p>Store methods take an explicit {@link java.sql.Connection}; the facades in
 * {@code breaker}, {@code consumer}, {@code dead} and {@code schedule} obtain one
 * per operation from a {@link io.governor.spi.ConnectionProvider}.
 */
package io.governor.spi;
