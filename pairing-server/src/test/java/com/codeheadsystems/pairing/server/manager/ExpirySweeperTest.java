package com.codeheadsystems.pairing.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.pairing.server.auth.TokenService;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * The type Expiry sweeper test.
 */
@ExtendWith(MockitoExtension.class)
class ExpirySweeperTest {

  private static final Duration RETENTION = Duration.ofDays(1);

  @Mock private PairingSessionManager pairingSessionManager;
  @Mock private TokenService tokenService;

  @Test
  void sweep_runsEveryStep() {
    when(pairingSessionManager.expirePendingSessions()).thenReturn(2);
    when(pairingSessionManager.expireStaleVerifiedSessions()).thenReturn(1);
    when(pairingSessionManager.purgeTerminalSessions(RETENTION)).thenReturn(4);
    when(tokenService.sweepExpired()).thenReturn(3);
    ExpirySweeper sweeper = new ExpirySweeper(pairingSessionManager, tokenService, Duration.ofMinutes(5), RETENTION);

    ExpirySweeper.SweepResult result = sweeper.sweep();

    assertThat(result).isEqualTo(new ExpirySweeper.SweepResult(2, 1, 4, 3));
    assertThat(result.hasChanges()).isTrue();
  }

  @Test
  void sweep_failingStepDoesNotStopOthers() {
    when(pairingSessionManager.expirePendingSessions()).thenThrow(new IllegalStateException("boom"));
    when(pairingSessionManager.expireStaleVerifiedSessions()).thenReturn(0);
    when(pairingSessionManager.purgeTerminalSessions(RETENTION)).thenReturn(0);
    when(tokenService.sweepExpired()).thenReturn(5);
    ExpirySweeper sweeper = new ExpirySweeper(pairingSessionManager, tokenService, Duration.ofMinutes(5), RETENTION);

    assertThat(sweeper.sweep()).isEqualTo(new ExpirySweeper.SweepResult(-1, 0, 0, 5));
  }

  @Test
  void sweep_nothingToDo_hasNoChanges() {
    ExpirySweeper sweeper = new ExpirySweeper(pairingSessionManager, tokenService, Duration.ofMinutes(5), RETENTION);

    assertThat(sweeper.sweep().hasChanges()).isFalse();
  }

  @Test
  void start_schedulesSweepsUntilStopped() {
    ExpirySweeper sweeper = new ExpirySweeper(pairingSessionManager, tokenService, Duration.ofMillis(10), RETENTION);

    sweeper.start();
    sweeper.start();
    try {
      verify(tokenService, timeout(2000).atLeast(2)).sweepExpired();
    } finally {
      sweeper.stop();
      sweeper.stop();
    }
    verify(pairingSessionManager, atLeastOnce()).purgeTerminalSessions(RETENTION);
  }
}
