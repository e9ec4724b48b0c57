/**
 * JDBC catalog store.
 */
package io.governor.jdbc.catalog;
