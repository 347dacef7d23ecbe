package com.codeheadsystems.pairing.server.store;

/**
 * Aggregate token counts.
 *
 * @param total        all token records
 * @param active       records not revoked
 * @param revoked      revoked records
 * @param expired      records past expiry
 * @param recentlyUsed records used since the recent-use cutoff
 */
public record TokenStats(long total, long active, long revoked, long expired, long recentlyUsed) {
}
