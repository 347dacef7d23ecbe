package com.codeheadsystems.pairing.model.token;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code GET /api/client-tokens/stats} response.
 *
 * @param total        all token records
 * @param active       records that are not revoked
 * @param revoked      revoked records
 * @param expired      records past their expiry
 * @param recentlyUsed records used within the last 24 hours
 */
public record TokenStatsResponse(
    @JsonProperty("total") long total,
    @JsonProperty("active") long active,
    @JsonProperty("revoked") long revoked,
    @JsonProperty("expired") long expired,
    @JsonProperty("recentlyUsed") long recentlyUsed) {
}
