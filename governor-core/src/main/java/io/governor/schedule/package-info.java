/**
 * Sweep, manual trigger, retention cleanup and the periodic scheduler.
 */
package io.governor.schedule;
