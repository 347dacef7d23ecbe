package com.codeheadsystems.pairing.server.resource;

import com.codeheadsystems.pairing.server.notify.NotificationRegistry;
import jakarta.annotation.security.PermitAll;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.SecurityContext;
import jakarta.ws.rs.sse.Sse;
import jakarta.ws.rs.sse.SseEventSink;

/**
 * Realtime event stream: {@code GET /api/events} as server-sent events.
 * <p>
 * A client credential registers the stream as that client's connection; an administrator
 * credential registers it as an admin listener. The stream stays open until the registry
 * closes it or a write to it fails.
 */
@Path("/api/events")
public class EventStreamResource {

  private final NotificationRegistry notificationRegistry;

  /**
   * Instantiates a new Event stream resource.
   *
   * @param notificationRegistry the notification registry
   */
  public EventStreamResource(NotificationRegistry notificationRegistry) {
    this.notificationRegistry = notificationRegistry;
  }

  @GET
  @PermitAll
  @Produces(MediaType.SERVER_SENT_EVENTS)
  public void stream(@Context SecurityContext securityContext,
                     @Context SseEventSink sink,
                     @Context Sse sse) {
    Principals.require(securityContext).match(
        admin -> {
          notificationRegistry.registerAdmin(admin.username(),
              new SseConnectionHandle(sink, sse, "admin " + admin.username()));
          return null;
        },
        client -> {
          notificationRegistry.register(client.clientId(),
              new SseConnectionHandle(sink, sse, "client " + client.clientId()));
          return null;
        });
  }
}
