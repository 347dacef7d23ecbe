package com.codeheadsystems.pairing.model.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Used by: {@code PUT /api/clients/{id}} request. Absent fields are left unchanged.
 *
 * @param name          new display name
 * @param assignedAreas new area list
 */
public record UpdateClientRequest(
    @JsonProperty("name") String name,
    @JsonProperty("assignedAreas") List<String> assignedAreas) {
}
