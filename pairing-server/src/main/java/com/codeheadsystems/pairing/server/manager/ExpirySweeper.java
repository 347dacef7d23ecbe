package com.codeheadsystems.pairing.server.manager;

import com.codeheadsystems.pairing.server.auth.TokenService;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic background sweep over pairing sessions and token records.
 * <p>
 * Each pass expires lapsed pending sessions, expires verified sessions left unapproved,
 * purges old terminal sessions and deletes expired token records. Every step uses the
 * stores' conditional writes, so the sweep can interleave with live requests. A failing step
 * is logged and the remaining steps still run; the next tick retries.
 * <p>
 * Call {@link #start()} on application start and {@link #stop()} on shutdown. In Dropwizard
 * this is done by a {@code Managed} wrapper.
 */
public class ExpirySweeper {

  private static final Logger log = LoggerFactory.getLogger(ExpirySweeper.class);

  private final PairingSessionManager pairingSessionManager;
  private final TokenService tokenService;
  private final Duration interval;
  private final Duration sessionRetention;

  private ScheduledExecutorService executor;

  /**
   * Instantiates a new Expiry sweeper.
   *
   * @param pairingSessionManager the pairing session manager
   * @param tokenService          the token service
   * @param interval              time between passes
   * @param sessionRetention      how long terminal sessions are kept
   */
  public ExpirySweeper(PairingSessionManager pairingSessionManager, TokenService tokenService,
                       Duration interval, Duration sessionRetention) {
    this.pairingSessionManager = pairingSessionManager;
    this.tokenService = tokenService;
    this.interval = interval;
    this.sessionRetention = sessionRetention;
  }

  /**
   * Schedules the sweep at a fixed rate. Calling it twice has no further effect.
   */
  public synchronized void start() {
    if (executor != null) {
      return;
    }
    executor = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "pairing-expiry-sweeper");
      t.setDaemon(true);
      return t;
    });
    long millis = interval.toMillis();
    executor.scheduleAtFixedRate(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
    log.info("Expiry sweeper started, interval {}", interval);
  }

  /**
   * Cancels the schedule and waits briefly for a running pass to finish.
   */
  public synchronized void stop() {
    if (executor == null) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    executor = null;
    log.info("Expiry sweeper stopped");
  }

  /**
   * Runs one pass.
   *
   * @return counts from each step; -1 marks a step that failed
   */
  public SweepResult sweep() {
    SweepResult result = new SweepResult(
        step("expire pending sessions", pairingSessionManager::expirePendingSessions),
        step("expire verified sessions", pairingSessionManager::expireStaleVerifiedSessions),
        step("purge terminal sessions",
            () -> pairingSessionManager.purgeTerminalSessions(sessionRetention)),
        step("delete expired tokens", tokenService::sweepExpired));
    if (result.hasChanges()) {
      log.info("Sweep: {}", result);
    }
    return result;
  }

  private static int step(String name, IntSupplier action) {
    try {
      return action.getAsInt();
    } catch (RuntimeException e) {
      log.error("Sweep step '{}' failed", name, e);
      return -1;
    }
  }

  /**
   * Counts from one sweep pass.
   *
   * @param expiredPending  pending sessions expired
   * @param expiredVerified verified sessions expired
   * @param purgedSessions  terminal sessions deleted
   * @param deletedTokens   token records deleted
   */
  public record SweepResult(int expiredPending, int expiredVerified, int purgedSessions,
                            int deletedTokens) {

    /**
     * Whether any step changed or failed to change something.
     *
     * @return true if any count is non-zero
     */
    public boolean hasChanges() {
      return expiredPending != 0 || expiredVerified != 0 || purgedSessions != 0 || deletedTokens != 0;
    }
  }
}
