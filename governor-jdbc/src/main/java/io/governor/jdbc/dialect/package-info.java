/**
 * Database dialects and their {@link java.util.ServiceLoader} registry.
 */
package io.governor.jdbc.dialect;
