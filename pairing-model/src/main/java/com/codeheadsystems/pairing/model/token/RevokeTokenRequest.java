package com.codeheadsystems.pairing.model.token;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /api/client-tokens/{tokenId}/revoke} request.
 *
 * @param reason optional revocation reason, forwarded to the client
 */
public record RevokeTokenRequest(@JsonProperty("reason") String reason) {
}
