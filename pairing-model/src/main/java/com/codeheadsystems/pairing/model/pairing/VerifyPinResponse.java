package com.codeheadsystems.pairing.model.pairing;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /api/pairing/{id}/verify} response
 *
 * @param sessionId  the pairing session id
 * @param status     the session status after verification, always {@code verified}
 * @param deviceName the recorded device name
 * @param deviceType the recorded device type
 * @param message    human-readable next step
 */
public record VerifyPinResponse(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("status") String status,
    @JsonProperty("deviceName") String deviceName,
    @JsonProperty("deviceType") String deviceType,
    @JsonProperty("message") String message) {
}
