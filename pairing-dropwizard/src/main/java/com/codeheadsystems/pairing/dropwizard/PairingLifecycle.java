package com.codeheadsystems.pairing.dropwizard;

import com.codeheadsystems.pairing.server.manager.ExpirySweeper;
import com.codeheadsystems.pairing.server.notify.NotificationRegistry;
import io.dropwizard.lifecycle.Managed;
import java.time.Duration;

/**
 * Ties the expiry sweep and the notification registry to the application lifecycle.
 */
public class PairingLifecycle implements Managed {

  private final ExpirySweeper expirySweeper;
  private final NotificationRegistry notificationRegistry;
  private final Duration keepAliveInterval;

  /**
   * Instantiates a new Pairing lifecycle.
   *
   * @param expirySweeper        the expiry sweeper
   * @param notificationRegistry the notification registry
   * @param keepAliveInterval    interval between connection keep-alive passes
   */
  public PairingLifecycle(ExpirySweeper expirySweeper, NotificationRegistry notificationRegistry,
                          Duration keepAliveInterval) {
    this.expirySweeper = expirySweeper;
    this.notificationRegistry = notificationRegistry;
    this.keepAliveInterval = keepAliveInterval;
  }

  @Override
  public void start() {
    expirySweeper.start();
    notificationRegistry.startKeepAlive(keepAliveInterval);
  }

  @Override
  public void stop() {
    expirySweeper.stop();
    notificationRegistry.shutdown();
  }
}
