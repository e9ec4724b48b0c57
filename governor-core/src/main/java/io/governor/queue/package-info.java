/**
 * Queue contracts and an in-process implementation.
 */
package io.governor.queue;
