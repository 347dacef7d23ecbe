package com.codeheadsystems.pairing.model.token;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Used by: {@code PATCH /api/client-tokens/{tokenId}} request.
 *
 * @param assignedAreas the new credential scope
 */
public record UpdateTokenAreasRequest(@JsonProperty("assignedAreas") List<String> assignedAreas) {
}
