package com.codeheadsystems.pairing.model.token;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /api/client-tokens/cleanup} response.
 *
 * @param deletedCount number of expired token records removed
 */
public record CleanupResponse(@JsonProperty("deletedCount") int deletedCount) {
}
