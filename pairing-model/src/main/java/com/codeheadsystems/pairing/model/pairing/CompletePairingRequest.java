package com.codeheadsystems.pairing.model.pairing;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Sent by the administrator to approve a verified device.
 * <p>
 * Used by: {@code POST /api/pairing/{id}/complete} request
 *
 * @param clientName    display name for the new client, 1 to 100 characters
 * @param assignedAreas area identifiers the client may access; absent means none
 */
public record CompletePairingRequest(
    @JsonProperty("clientName") String clientName,
    @JsonProperty("assignedAreas") List<String> assignedAreas) {
}
