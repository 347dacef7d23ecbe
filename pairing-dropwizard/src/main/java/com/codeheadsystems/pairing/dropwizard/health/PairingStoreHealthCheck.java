package com.codeheadsystems.pairing.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.pairing.server.notify.NotificationRegistry;
import com.codeheadsystems.pairing.server.store.ClientStore;
import com.codeheadsystems.pairing.server.store.PairingSessionStore;

/**
 * Health check that verifies both stores answer and reports their sizes with the number of
 * live connections.
 */
public class PairingStoreHealthCheck extends HealthCheck {

  private final PairingSessionStore sessionStore;
  private final ClientStore clientStore;
  private final NotificationRegistry notificationRegistry;

  /**
   * Instantiates a new Pairing store health check.
   *
   * @param sessionStore         the session store
   * @param clientStore          the client store
   * @param notificationRegistry the notification registry
   */
  public PairingStoreHealthCheck(PairingSessionStore sessionStore, ClientStore clientStore,
                                 NotificationRegistry notificationRegistry) {
    this.sessionStore = sessionStore;
    this.clientStore = clientStore;
    this.notificationRegistry = notificationRegistry;
  }

  @Override
  protected Result check() {
    int sessions;
    int clients;
    try {
      sessions = sessionStore.count();
      clients = clientStore.clientCount();
    } catch (RuntimeException e) {
      return Result.unhealthy(e);
    }
    return Result.healthy("clients=%d sessions=%d connections=%d admins=%d",
        clients, sessions, notificationRegistry.connectedClientCount(),
        notificationRegistry.adminListenerCount());
  }
}
