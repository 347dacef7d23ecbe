package com.codeheadsystems.pairing.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /api/auth/login} response.
 *
 * @param token     the administrator bearer credential
 * @param username  the authenticated user name
 * @param expiresAt ISO-8601 expiry of the credential
 */
public record LoginResponse(
    @JsonProperty("token") String token,
    @JsonProperty("username") String username,
    @JsonProperty("expiresAt") String expiresAt) {
}
