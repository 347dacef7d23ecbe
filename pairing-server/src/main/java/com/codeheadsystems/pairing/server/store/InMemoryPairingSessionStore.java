package com.codeheadsystems.pairing.server.store;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link PairingSessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Conditional transitions run inside {@link ConcurrentHashMap#computeIfPresent}, which holds
 * the entry's lock for the duration of the check and the write. All sessions are lost on
 * server restart. Suitable for development and integration testing only.
 */
public class InMemoryPairingSessionStore implements PairingSessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryPairingSessionStore.class);

  private final ConcurrentHashMap<String, PairingSession> sessions = new ConcurrentHashMap<>();

  /**
   * Instantiates a new In memory pairing session store.
   */
  public InMemoryPairingSessionStore() {
    log.warn("Using in-memory pairing session store; sessions will NOT survive restarts");
  }

  @Override
  public void create(PairingSession session) {
    if (sessions.putIfAbsent(session.id(), session) != null) {
      throw new IllegalStateException("Duplicate pairing session id: " + session.id());
    }
    log.debug("Stored pairing session id={}", session.id());
  }

  @Override
  public Optional<PairingSession> load(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(sessions.get(id));
  }

  @Override
  public Optional<PairingSession> verify(String id, String pin, String deviceName,
                                         DeviceType deviceType, Instant now, int maxFailedAttempts) {
    if (id == null || pin == null) {
      return Optional.empty();
    }
    AtomicReference<PairingSession> won = new AtomicReference<>();
    sessions.computeIfPresent(id, (key, current) -> {
      if (current.status() != SessionStatus.PENDING) {
        return current;
      }
      if (!current.isPinLive(now)) {
        log.debug("Pairing session id={} expired on verify", key);
        return current.withExpired();
      }
      if (!pinMatches(current.pin(), pin)) {
        PairingSession counted = current.withFailedPinAttempt();
        if (counted.failedPinAttempts() >= maxFailedAttempts) {
          log.warn("Pairing session id={} expired after {} wrong PIN(s)", key, counted.failedPinAttempts());
          return counted.withExpired();
        }
        return counted;
      }
      PairingSession verified = current.withVerified(deviceName, deviceType, now);
      won.set(verified);
      return verified;
    });
    return Optional.ofNullable(won.get());
  }

  @Override
  public Optional<PairingSession> complete(String id, String clientId, List<String> assignedAreas,
                                           Instant now, Instant verifiedAfter) {
    if (id == null) {
      return Optional.empty();
    }
    AtomicReference<PairingSession> won = new AtomicReference<>();
    sessions.computeIfPresent(id, (key, current) -> {
      if (current.status() != SessionStatus.VERIFIED
          || !current.verifiedAt().isAfter(verifiedAfter)) {
        return current;
      }
      PairingSession completed = current.withCompleted(clientId, assignedAreas, now);
      won.set(completed);
      return completed;
    });
    return Optional.ofNullable(won.get());
  }

  @Override
  public int expirePending(Instant now) {
    return expireWhere(s -> s.status() == SessionStatus.PENDING && !s.expiresAt().isAfter(now));
  }

  @Override
  public int expireVerified(Instant verifiedAtOrBefore) {
    return expireWhere(s -> s.status() == SessionStatus.VERIFIED
        && !s.verifiedAt().isAfter(verifiedAtOrBefore));
  }

  @Override
  public int purgeTerminal(Instant createdBefore) {
    AtomicInteger removed = new AtomicInteger();
    for (String id : sessions.keySet()) {
      sessions.computeIfPresent(id, (key, current) -> {
        if (current.status().isTerminal() && current.createdAt().isBefore(createdBefore)) {
          removed.incrementAndGet();
          return null;
        }
        return current;
      });
    }
    return removed.get();
  }

  @Override
  public boolean delete(String id) {
    return id != null && sessions.remove(id) != null;
  }

  @Override
  public int count() {
    return sessions.size();
  }

  private int expireWhere(Predicate<PairingSession> condition) {
    AtomicInteger expired = new AtomicInteger();
    for (String id : sessions.keySet()) {
      sessions.computeIfPresent(id, (key, current) -> {
        if (condition.test(current)) {
          expired.incrementAndGet();
          return current.withExpired();
        }
        return current;
      });
    }
    return expired.get();
  }

  private static boolean pinMatches(String expected, String candidate) {
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8),
        candidate.getBytes(StandardCharsets.UTF_8));
  }
}
