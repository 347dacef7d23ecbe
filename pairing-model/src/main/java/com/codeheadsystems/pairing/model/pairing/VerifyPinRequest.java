package com.codeheadsystems.pairing.model.pairing;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sent by the device being paired.
 * <p>
 * Used by: {@code POST /api/pairing/{id}/verify} request
 *
 * @param pin        the 6-digit PIN read from the administrator's screen
 * @param deviceName name the device reports for itself, 1 to 100 characters
 * @param deviceType one of {@code mobile}, {@code tablet}, {@code desktop}, {@code other}
 */
public record VerifyPinRequest(
    @JsonProperty("pin") String pin,
    @JsonProperty("deviceName") String deviceName,
    @JsonProperty("deviceType") String deviceType) {
}
