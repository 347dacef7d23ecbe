package com.codeheadsystems.pairing.model.token;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Used by: {@code POST /api/client-tokens} response. The plaintext {@code token} is never
 * returned again.
 *
 * @param tokenId       id of the stored token record
 * @param token         the plaintext client credential
 * @param clientId      owning client
 * @param assignedAreas credential scope
 * @param expiresAt     ISO-8601 expiry
 */
public record CreateTokenResponse(
    @JsonProperty("tokenId") String tokenId,
    @JsonProperty("token") String token,
    @JsonProperty("clientId") String clientId,
    @JsonProperty("assignedAreas") List<String> assignedAreas,
    @JsonProperty("expiresAt") String expiresAt) {
}
