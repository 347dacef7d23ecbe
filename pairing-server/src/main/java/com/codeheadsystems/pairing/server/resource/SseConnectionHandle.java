package com.codeheadsystems.pairing.server.resource;

import com.codeheadsystems.pairing.server.notify.ConnectionHandle;
import com.codeheadsystems.pairing.server.notify.EventType;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.sse.OutboundSseEvent;
import jakarta.ws.rs.sse.Sse;
import jakarta.ws.rs.sse.SseEventSink;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConnectionHandle} over a server-sent events sink. Each event is named after its
 * {@link EventType} and carries the payload as JSON.
 */
public class SseConnectionHandle implements ConnectionHandle {

  private static final Logger log = LoggerFactory.getLogger(SseConnectionHandle.class);

  private final SseEventSink sink;
  private final Sse sse;
  private final String owner;
  private volatile boolean writeFailed;

  /**
   * Instantiates a new Sse connection handle.
   *
   * @param sink  the sink
   * @param sse   the sse
   * @param owner principal name, for logs
   */
  public SseConnectionHandle(SseEventSink sink, Sse sse, String owner) {
    this.sink = sink;
    this.sse = sse;
    this.owner = owner;
  }

  @Override
  public void send(EventType eventType, Map<String, Object> payload) {
    if (!isOpen()) {
      throw new IllegalStateException("Event stream for " + owner + " is closed");
    }
    OutboundSseEvent event = sse.newEventBuilder()
        .name(eventType.wireName())
        .mediaType(MediaType.APPLICATION_JSON_TYPE)
        .data(Map.class, payload)
        .build();
    write(event, eventType.wireName());
  }

  @Override
  public void keepAlive() {
    if (!isOpen()) {
      throw new IllegalStateException("Event stream for " + owner + " is closed");
    }
    write(sse.newEventBuilder().comment("keep-alive").build(), "keep-alive");
  }

  @Override
  public boolean isOpen() {
    return !writeFailed && !sink.isClosed();
  }

  @Override
  public void close() {
    sink.close();
  }

  private void write(OutboundSseEvent event, String name) {
    sink.send(event).whenComplete((ignored, failure) -> {
      if (failure != null) {
        writeFailed = true;
        log.debug("Event {} to {} not written: {}", name, owner, failure.getMessage());
      }
    });
  }
}
