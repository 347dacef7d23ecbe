package com.codeheadsystems.pairing.model.pairing;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Result of a completed pairing. The {@code token} is the plaintext client credential and
 * is returned exactly once; the server keeps only its hash.
 * <p>
 * Used by: {@code POST /api/pairing/{id}/complete} response
 *
 * @param clientId      id of the newly created client
 * @param clientName    the client's display name
 * @param token         the plaintext client credential
 * @param assignedAreas the credential's area scope
 * @param expiresAt     ISO-8601 expiry of the credential
 */
public record CompletePairingResponse(
    @JsonProperty("clientId") String clientId,
    @JsonProperty("clientName") String clientName,
    @JsonProperty("token") String token,
    @JsonProperty("assignedAreas") List<String> assignedAreas,
    @JsonProperty("expiresAt") String expiresAt) {
}
