package com.codeheadsystems.pairing.server.notify;

import com.codeheadsystems.pairing.server.store.Client;
import com.codeheadsystems.pairing.server.store.ClientStore;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local map from client id to its live connection, plus the set of administrator
 * listeners.
 * <p>
 * At most one connection is tracked per client; a later {@link #register} replaces the
 * earlier one. Delivery is best effort: events for a client without a connection are
 * dropped, nothing is queued or retried, and a failing connection is logged and forgotten
 * without the failure reaching the caller.
 * <p>
 * Connections that went away without the transport noticing are found by
 * {@link #pruneStale()}, which {@link #startKeepAlive} runs periodically.
 * <p>
 * Constructed once per process and passed to whatever handles connections. Call
 * {@link #shutdown()} on application stop to release the scheduler.
 */
public class NotificationRegistry {

  /**
   * Message sent with every {@link EventType#TOKEN_REVOKED} event.
   */
  public static final String REVOKED_MESSAGE =
      "Your access token has been revoked. Please re-pair your device.";

  private static final Logger log = LoggerFactory.getLogger(NotificationRegistry.class);
  private static final List<String> FEATURES = List.of("area_updates", "token_revocation");

  private final ClientStore clientStore;
  private final Clock clock;
  private final Duration disconnectGrace;

  private final ConcurrentHashMap<String, ConnectionHandle> connections = new ConcurrentHashMap<>();
  private final Set<ConnectionHandle> adminListeners = ConcurrentHashMap.newKeySet();

  private final ScheduledExecutorService scheduler =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "notification-scheduler");
        t.setDaemon(true);
        return t;
      });
  private ScheduledFuture<?> keepAliveTask;

  /**
   * Instantiates a new Notification registry.
   *
   * @param clientStore     source of active clients for area fan-out
   * @param clock           clock for event timestamps
   * @param disconnectGrace delay between the revocation event and closing the connection
   */
  public NotificationRegistry(ClientStore clientStore, Clock clock, Duration disconnectGrace) {
    this.clientStore = clientStore;
    this.clock = clock;
    this.disconnectGrace = disconnectGrace;
  }

  /**
   * Associates a client with its current connection, closing and replacing any earlier one,
   * and sends {@link EventType#CONNECTED} over it.
   *
   * @param clientId the client id
   * @param handle   the connection
   */
  public void register(String clientId, ConnectionHandle handle) {
    ConnectionHandle previous = connections.put(clientId, handle);
    if (previous != null && previous != handle) {
      log.debug("Replaced connection for client {}", clientId);
      closeQuietly("client " + clientId, previous);
    }
    log.info("Client {} connected ({} connected)", clientId, connections.size());
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("clientId", clientId);
    payload.put("message", "Connected to pairing backend");
    payload.put("features", FEATURES);
    notify(clientId, EventType.CONNECTED, payload);
  }

  /**
   * Removes a client's connection, whichever it is.
   *
   * @param clientId the client id
   */
  public void unregister(String clientId) {
    if (connections.remove(clientId) != null) {
      log.info("Client {} disconnected ({} connected)", clientId, connections.size());
    }
  }

  /**
   * Removes a client's connection only if it is still {@code handle}. Transports call this
   * when a connection closes so that a replaced connection cannot evict its successor.
   *
   * @param clientId the client id
   * @param handle   the closing connection
   */
  public void unregister(String clientId, ConnectionHandle handle) {
    if (connections.remove(clientId, handle)) {
      log.info("Client {} disconnected ({} connected)", clientId, connections.size());
    }
  }

  /**
   * Adds an administrator listener and sends it {@link EventType#CONNECTED}.
   *
   * @param username the administrator
   * @param handle   the connection
   */
  public void registerAdmin(String username, ConnectionHandle handle) {
    adminListeners.add(handle);
    log.info("Admin {} connected ({} admin listeners)", username, adminListeners.size());
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("username", username);
    payload.put("message", "Connected to pairing backend");
    deliver("admin " + username, handle, EventType.CONNECTED, payload);
  }

  /**
   * Removes an administrator listener.
   *
   * @param handle the connection
   */
  public void unregisterAdmin(ConnectionHandle handle) {
    adminListeners.remove(handle);
  }

  /**
   * Pushes an event to a client's connection, if it has one.
   *
   * @param clientId  the client id
   * @param eventType the event type
   * @param payload   the payload; a {@code timestamp} entry is added
   * @return true if the event was handed to a connection
   */
  public boolean notify(String clientId, EventType eventType, Map<String, Object> payload) {
    ConnectionHandle handle = connections.get(clientId);
    if (handle == null) {
      log.debug("Client {} not connected, dropping {}", clientId, eventType.wireName());
      return false;
    }
    if (!deliver("client " + clientId, handle, eventType, payload)) {
      connections.remove(clientId, handle);
      return false;
    }
    return true;
  }

  /**
   * Pushes an event to every connected, active client whose assigned areas contain
   * {@code areaId}. Active clients are read from the store on every call.
   *
   * @param areaId    the area id
   * @param eventType the event type
   * @param payload   the payload
   * @return the number of clients the event was handed to
   */
  public int notifyByArea(String areaId, EventType eventType, Map<String, Object> payload) {
    int delivered = 0;
    for (Client client : clientStore.listActiveClients()) {
      if (client.assignedAreas().contains(areaId) && notify(client.id(), eventType, payload)) {
        delivered++;
      }
    }
    log.debug("{} for area {} delivered to {} client(s)", eventType.wireName(), areaId, delivered);
    return delivered;
  }

  /**
   * Pushes an event to every connected client.
   *
   * @param eventType the event type
   * @param payload   the payload
   * @return the number of clients the event was handed to
   */
  public int notifyAll(EventType eventType, Map<String, Object> payload) {
    int delivered = 0;
    for (String clientId : List.copyOf(connections.keySet())) {
      if (notify(clientId, eventType, payload)) {
        delivered++;
      }
    }
    return delivered;
  }

  /**
   * Pushes an event to every administrator listener.
   *
   * @param eventType the event type
   * @param payload   the payload
   * @return the number of listeners the event was handed to
   */
  public int notifyAdmins(EventType eventType, Map<String, Object> payload) {
    int delivered = 0;
    for (ConnectionHandle handle : List.copyOf(adminListeners)) {
      if (deliver("admin listener", handle, eventType, payload)) {
        delivered++;
      } else {
        adminListeners.remove(handle);
      }
    }
    return delivered;
  }

  /**
   * Sends {@link EventType#TOKEN_REVOKED} to a client's connection, then closes and
   * unregisters it after the grace delay.
   *
   * @param clientId the client id
   * @param reason   the reason shown to the client
   * @return true if the client had a connection
   */
  public boolean disconnectClient(String clientId, String reason) {
    ConnectionHandle handle = connections.get(clientId);
    if (handle == null) {
      log.debug("Client {} not connected, nothing to disconnect", clientId);
      return false;
    }
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("reason", reason);
    payload.put("message", REVOKED_MESSAGE);
    deliver("client " + clientId, handle, EventType.TOKEN_REVOKED, payload);
    try {
      scheduler.schedule(() -> closeAndRemove(clientId, handle),
          disconnectGrace.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      log.debug("Disconnect scheduler stopped, closing client {} immediately", clientId);
      closeAndRemove(clientId, handle);
    }
    return true;
  }

  /**
   * Whether a client currently has a connection.
   *
   * @param clientId the client id
   * @return true if connected
   */
  public boolean isConnected(String clientId) {
    return connections.containsKey(clientId);
  }

  /**
   * Number of connected clients.
   *
   * @return the count
   */
  public int connectedClientCount() {
    return connections.size();
  }

  /**
   * Number of administrator listeners.
   *
   * @return the count
   */
  public int adminListenerCount() {
    return adminListeners.size();
  }

  /**
   * Drops every connection and admin listener that reports itself closed or whose keep-alive
   * write fails, closing it.
   *
   * @return the number of connections dropped
   */
  public int pruneStale() {
    int pruned = 0;
    for (Map.Entry<String, ConnectionHandle> entry : List.copyOf(connections.entrySet())) {
      String target = "client " + entry.getKey();
      if (!isAlive(target, entry.getValue()) && connections.remove(entry.getKey(), entry.getValue())) {
        closeQuietly(target, entry.getValue());
        pruned++;
      }
    }
    for (ConnectionHandle handle : List.copyOf(adminListeners)) {
      if (!isAlive("admin listener", handle) && adminListeners.remove(handle)) {
        closeQuietly("admin listener", handle);
        pruned++;
      }
    }
    if (pruned > 0) {
      log.info("Pruned {} stale connection(s) ({} connected, {} admin listeners)",
          pruned, connections.size(), adminListeners.size());
    }
    return pruned;
  }

  /**
   * Runs {@link #pruneStale()} every {@code interval}. Calling it again while running has no
   * effect.
   *
   * @param interval the keep-alive interval
   */
  public synchronized void startKeepAlive(Duration interval) {
    if (keepAliveTask != null) {
      return;
    }
    keepAliveTask = scheduler.scheduleAtFixedRate(() -> {
      try {
        pruneStale();
      } catch (RuntimeException e) {
        log.error("Keep-alive pass failed", e);
      }
    }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    log.info("Connection keep-alive every {}", interval);
  }

  /**
   * Stops the scheduler. Pending disconnects and keep-alives are abandoned.
   */
  public synchronized void shutdown() {
    if (keepAliveTask != null) {
      keepAliveTask.cancel(false);
    }
    scheduler.shutdownNow();
  }

  private boolean isAlive(String target, ConnectionHandle handle) {
    try {
      if (!handle.isOpen()) {
        return false;
      }
      handle.keepAlive();
      return true;
    } catch (RuntimeException e) {
      log.debug("Keep-alive to {} failed: {}", target, e.getMessage());
      return false;
    }
  }

  private void closeQuietly(String target, ConnectionHandle handle) {
    try {
      handle.close();
    } catch (RuntimeException e) {
      log.warn("Failed to close connection for {}: {}", target, e.getMessage());
    }
  }

  private boolean deliver(String target, ConnectionHandle handle, EventType eventType,
                          Map<String, Object> payload) {
    Map<String, Object> event = new LinkedHashMap<>(payload);
    event.put("timestamp", clock.instant().toString());
    try {
      handle.send(eventType, event);
      return true;
    } catch (RuntimeException e) {
      log.warn("Failed to deliver {} to {}: {}", eventType.wireName(), target, e.getMessage());
      return false;
    }
  }

  private void closeAndRemove(String clientId, ConnectionHandle handle) {
    closeQuietly("client " + clientId, handle);
    unregister(clientId, handle);
  }
}
