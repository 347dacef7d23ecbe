package com.codeheadsystems.pairing.server.notify;

import java.util.Map;

/**
 * A live realtime connection as seen by the {@link NotificationRegistry}. The transport
 * (server-sent events, websockets) supplies the implementation.
 * <p>
 * {@link #send} must not block on delivery acknowledgement. Both methods may throw
 * {@link RuntimeException} when the underlying connection is already gone; the registry
 * catches and logs it.
 */
public interface ConnectionHandle {

  /**
   * Queues one event for delivery.
   *
   * @param eventType the event type
   * @param payload   the payload, including its {@code timestamp}
   */
  void send(EventType eventType, Map<String, Object> payload);

  /**
   * Writes a no-op keep-alive over the connection so that a peer which went away is noticed.
   */
  void keepAlive();

  /**
   * Whether the underlying connection is still usable. Transports report false once the peer
   * has gone or a write has failed.
   *
   * @return true if open
   */
  boolean isOpen();

  /**
   * Closes the underlying connection.
   */
  void close();
}
