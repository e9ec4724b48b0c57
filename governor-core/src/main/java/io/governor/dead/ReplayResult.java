package io.governor.dead;

/**
 * Outcome of a replay call.
 *
 * @param requested distinct ids considered after truncation
 * @param claimed   rows this call moved from {@code pending} to {@code replaying}
 * @param replayed  rows re-enqueued and marked {@code replayed}
 * @param failed    claimed rows returned to {@code pending}
 */
public record ReplayResult(int requested, int claimed, int replayed, int failed) {
}
