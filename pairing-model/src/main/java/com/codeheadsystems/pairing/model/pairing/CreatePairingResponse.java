package com.codeheadsystems.pairing.model.pairing;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Returned to the administrator when a pairing session is opened. This is the only
 * response that ever carries the PIN.
 * <p>
 * Used by: {@code POST /api/pairing/create} response
 *
 * @param id        the pairing session id
 * @param pin       the 6-digit PIN to show on the administrator's screen
 * @param expiresAt ISO-8601 instant after which the PIN is no longer accepted
 */
public record CreatePairingResponse(
    @JsonProperty("id") String id,
    @JsonProperty("pin") String pin,
    @JsonProperty("expiresAt") String expiresAt) {
}
