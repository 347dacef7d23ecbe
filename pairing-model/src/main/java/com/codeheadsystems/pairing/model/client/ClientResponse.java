package com.codeheadsystems.pairing.model.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * A paired client as seen by administrators and by the client itself.
 *
 * @param id            the client id
 * @param name          display name
 * @param deviceType    device type reported during pairing
 * @param assignedAreas areas the client may access
 * @param isActive      false once the client has been deleted
 * @param createdAt     ISO-8601 creation time
 * @param lastSeenAt    ISO-8601 time of the last authenticated request, or null
 */
public record ClientResponse(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("deviceType") String deviceType,
    @JsonProperty("assignedAreas") List<String> assignedAreas,
    @JsonProperty("isActive") boolean isActive,
    @JsonProperty("createdAt") String createdAt,
    @JsonProperty("lastSeenAt") String lastSeenAt) {
}
