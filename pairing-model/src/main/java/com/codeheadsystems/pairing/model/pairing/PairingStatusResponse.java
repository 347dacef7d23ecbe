package com.codeheadsystems.pairing.model.pairing;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public view of a pairing session. Never carries the PIN.
 * <p>
 * Used by: {@code GET /api/pairing/{id}} response
 *
 * @param id         the pairing session id
 * @param status     {@code pending}, {@code verified}, {@code completed} or {@code expired}
 * @param deviceName device name, once verified
 * @param deviceType device type, once verified
 * @param expiresAt  ISO-8601 PIN expiry
 * @param createdAt  ISO-8601 creation time
 */
public record PairingStatusResponse(
    @JsonProperty("id") String id,
    @JsonProperty("status") String status,
    @JsonProperty("deviceName") String deviceName,
    @JsonProperty("deviceType") String deviceType,
    @JsonProperty("expiresAt") String expiresAt,
    @JsonProperty("createdAt") String createdAt) {
}
