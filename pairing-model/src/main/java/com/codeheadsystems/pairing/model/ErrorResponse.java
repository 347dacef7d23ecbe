package com.codeheadsystems.pairing.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned for every failed request.
 *
 * @param error   machine-readable error kind, e.g. {@code VALIDATION}
 * @param message human-readable message
 * @param field   the offending request field for validation errors, otherwise absent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("message") String message,
    @JsonProperty("field") String field) {
}
