package com.codeheadsystems.pairing.server.store;

import java.time.Instant;
import java.util.List;

/**
 * A paired device.
 *
 * @param id            the client id
 * @param name          display name
 * @param deviceType    device type reported while pairing
 * @param assignedAreas areas the client may access, as edited by administrators
 * @param active        false once soft-deleted
 * @param createdAt     creation time
 * @param lastSeenAt    time of the last successful credential check, or null
 */
public record Client(
    String id,
    String name,
    DeviceType deviceType,
    List<String> assignedAreas,
    boolean active,
    Instant createdAt,
    Instant lastSeenAt) {

  /**
   * Instantiates a new Client.
   */
  public Client {
    assignedAreas = assignedAreas == null ? List.of() : List.copyOf(assignedAreas);
  }

  /**
   * With name and areas client.
   *
   * @param newName  the new name
   * @param newAreas the new areas
   * @return the client
   */
  public Client withDetails(String newName, List<String> newAreas) {
    return new Client(id, newName, deviceType, newAreas, active, createdAt, lastSeenAt);
  }

  /**
   * Deactivated client.
   *
   * @return the client
   */
  public Client deactivated() {
    return new Client(id, name, deviceType, assignedAreas, false, createdAt, lastSeenAt);
  }

  /**
   * With last seen client.
   *
   * @param seenAt the seen at
   * @return the client
   */
  public Client withLastSeen(Instant seenAt) {
    return new Client(id, name, deviceType, assignedAreas, active, createdAt, seenAt);
  }
}
