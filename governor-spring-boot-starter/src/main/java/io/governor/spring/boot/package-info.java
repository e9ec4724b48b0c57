/**
 * Spring Boot auto-configuration for the enrichment governor.
 *
 * <p>Properties bind under the {@code enrichment} prefix; see
 * {@link io.governor.spring.boot.GovernorProperties}.
 */
package io.governor.spring.boot;
