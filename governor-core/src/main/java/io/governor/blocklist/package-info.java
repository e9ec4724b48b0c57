/**
 * Names that are never sent for enrichment.
 */
package io.governor.blocklist;
