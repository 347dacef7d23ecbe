package com.codeheadsystems.pairing.server.resource;

import com.codeheadsystems.pairing.model.client.ClientResponse;
import com.codeheadsystems.pairing.model.token.TokenResponse;
import com.codeheadsystems.pairing.model.token.TokenStatsResponse;
import com.codeheadsystems.pairing.server.store.Client;
import com.codeheadsystems.pairing.server.store.ClientToken;
import com.codeheadsystems.pairing.server.store.DeviceType;
import com.codeheadsystems.pairing.server.store.TokenStats;
import java.time.Instant;

/**
 * Converts store records to wire models. Instants are rendered as ISO-8601 strings.
 */
final class WireMapper {

  private WireMapper() {
  }

  static String iso(Instant instant) {
    return instant == null ? null : instant.toString();
  }

  static String wire(DeviceType deviceType) {
    return deviceType == null ? null : deviceType.wireName();
  }

  static ClientResponse toResponse(Client client) {
    return new ClientResponse(client.id(), client.name(), wire(client.deviceType()),
        client.assignedAreas(), client.active(), iso(client.createdAt()), iso(client.lastSeenAt()));
  }

  static TokenResponse toResponse(ClientToken token) {
    return new TokenResponse(token.id(), token.clientId(), token.assignedAreas(),
        iso(token.createdAt()), iso(token.expiresAt()), iso(token.lastUsedAt()),
        token.revoked(), iso(token.revokedAt()), token.revokedReason());
  }

  static TokenStatsResponse toResponse(TokenStats stats) {
    return new TokenStatsResponse(stats.total(), stats.active(), stats.revoked(),
        stats.expired(), stats.recentlyUsed());
  }
}
