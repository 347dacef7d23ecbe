package com.codeheadsystems.pairing.model.token;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * A stored client token record. Neither the credential nor its hash is exposed.
 *
 * @param id            token id
 * @param clientId      owning client
 * @param assignedAreas credential scope
 * @param createdAt     ISO-8601 issue time
 * @param expiresAt     ISO-8601 expiry
 * @param lastUsedAt    ISO-8601 time of last successful use, or null
 * @param isRevoked     whether the token has been revoked
 * @param revokedAt     ISO-8601 revocation time, or null
 * @param revokedReason revocation reason, or null
 */
public record TokenResponse(
    @JsonProperty("id") String id,
    @JsonProperty("clientId") String clientId,
    @JsonProperty("assignedAreas") List<String> assignedAreas,
    @JsonProperty("createdAt") String createdAt,
    @JsonProperty("expiresAt") String expiresAt,
    @JsonProperty("lastUsedAt") String lastUsedAt,
    @JsonProperty("isRevoked") boolean isRevoked,
    @JsonProperty("revokedAt") String revokedAt,
    @JsonProperty("revokedReason") String revokedReason) {
}
