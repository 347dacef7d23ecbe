package com.codeheadsystems.pairing.server.manager;

import com.codeheadsystems.pairing.server.exception.PairingException;
import com.codeheadsystems.pairing.server.notify.EventType;
import com.codeheadsystems.pairing.server.notify.NotificationRegistry;
import com.codeheadsystems.pairing.server.store.Client;
import com.codeheadsystems.pairing.server.store.ClientStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Administrator operations on paired clients.
 * <p>
 * Editing a client's areas also rewrites the scope of each of its non-revoked tokens, since
 * the token row is what authorizes live requests, and tells the connected client which areas
 * were added or removed. Deleting a client is a soft delete that revokes its tokens and
 * disconnects it.
 */
public class ClientManager {

  /**
   * Revocation reason recorded when a client is deleted.
   */
  public static final String DELETED_REASON = "Client deleted by administrator";

  private static final Logger log = LoggerFactory.getLogger(ClientManager.class);

  private final ClientStore clientStore;
  private final NotificationRegistry notificationRegistry;
  private final Clock clock;

  /**
   * Instantiates a new Client manager.
   *
   * @param clientStore          the client store
   * @param notificationRegistry the notification registry
   * @param clock                the clock
   */
  public ClientManager(ClientStore clientStore, NotificationRegistry notificationRegistry, Clock clock) {
    this.clientStore = clientStore;
    this.notificationRegistry = notificationRegistry;
    this.clock = clock;
  }

  /**
   * List active clients.
   *
   * @return the list
   */
  public List<Client> listActiveClients() {
    return clientStore.listActiveClients();
  }

  /**
   * Gets an active client.
   *
   * @param clientId the client id
   * @return the client
   * @throws PairingException NOT_FOUND if unknown or deleted
   */
  public Client getClient(String clientId) {
    return clientStore.findClient(clientId)
        .filter(Client::active)
        .orElseThrow(() -> PairingException.notFound("Client not found"));
  }

  /**
   * Updates name and/or areas. Null arguments leave the value unchanged.
   *
   * @param clientId      the client id
   * @param name          the new name, or null
   * @param assignedAreas the new areas, or null
   * @return the updated client
   */
  public Client updateClient(String clientId, String name, List<String> assignedAreas) {
    if (name == null && assignedAreas == null) {
      throw PairingException.validation("Nothing to update", "name");
    }
    Client existing = getClient(clientId);
    String newName = name == null ? existing.name() : Validation.name(name, "name");
    List<String> newAreas = assignedAreas == null
        ? existing.assignedAreas()
        : Validation.areas(assignedAreas, "assignedAreas");

    Client updated = clientStore.updateClient(clientId, newName, newAreas)
        .orElseThrow(() -> PairingException.notFound("Client not found"));
    if (assignedAreas == null) {
      return updated;
    }

    int tokens = clientStore.updateClientTokenAreas(clientId, newAreas);
    List<String> added = new ArrayList<>(newAreas);
    added.removeAll(existing.assignedAreas());
    List<String> removed = new ArrayList<>(existing.assignedAreas());
    removed.removeAll(newAreas);
    log.info("Client {} areas updated: +{} -{} ({} token(s) rescoped)", clientId, added, removed, tokens);

    for (String areaId : added) {
      notificationRegistry.notify(clientId, EventType.AREA_ADDED, Map.of("areaId", areaId));
    }
    for (String areaId : removed) {
      notificationRegistry.notify(clientId, EventType.AREA_REMOVED, Map.of("areaId", areaId));
    }
    return updated;
  }

  /**
   * Soft-deletes a client, revokes all of its tokens and disconnects it.
   *
   * @param clientId the client id
   * @throws PairingException NOT_FOUND if unknown or already deleted
   */
  public void deleteClient(String clientId) {
    if (!clientStore.deactivateClient(clientId)) {
      throw PairingException.notFound("Client not found");
    }
    int revoked = clientStore.revokeClientTokens(clientId, DELETED_REASON, clock.instant());
    log.info("Client {} deleted, {} token(s) revoked", clientId, revoked);
    notificationRegistry.disconnectClient(clientId, DELETED_REASON);
  }
}
