package com.codeheadsystems.pairing.dropwizard;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

import com.codeheadsystems.pairing.server.manager.ExpirySweeper;
import com.codeheadsystems.pairing.server.notify.NotificationRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PairingLifecycleTest {

  @Mock private ExpirySweeper expirySweeper;
  @Mock private NotificationRegistry notificationRegistry;

  private static final Duration KEEP_ALIVE = Duration.ofSeconds(30);

  @Test
  void start_startsSweeperAndKeepAlive() {
    new PairingLifecycle(expirySweeper, notificationRegistry, KEEP_ALIVE).start();

    verify(expirySweeper).start();
    verify(notificationRegistry).startKeepAlive(KEEP_ALIVE);
    verifyNoMoreInteractions(notificationRegistry);
  }

  @Test
  void stop_stopsSweeperThenRegistry() {
    new PairingLifecycle(expirySweeper, notificationRegistry, KEEP_ALIVE).stop();

    InOrder order = inOrder(expirySweeper, notificationRegistry);
    order.verify(expirySweeper).stop();
    order.verify(notificationRegistry).shutdown();
  }
}
