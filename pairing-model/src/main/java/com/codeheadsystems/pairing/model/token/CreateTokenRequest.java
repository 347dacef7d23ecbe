package com.codeheadsystems.pairing.model.token;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Used by: {@code POST /api/client-tokens} request.
 *
 * @param clientId      the existing client to issue a credential for
 * @param assignedAreas scope of the new credential; absent means the client's current areas
 */
public record CreateTokenRequest(
    @JsonProperty("clientId") String clientId,
    @JsonProperty("assignedAreas") List<String> assignedAreas) {
}
