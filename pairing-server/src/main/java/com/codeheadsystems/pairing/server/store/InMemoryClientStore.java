package com.codeheadsystems.pairing.server.store;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link ClientStore} backed by {@link ConcurrentHashMap}s.
 * <p>
 * Token hash uniqueness is enforced by a hash-to-id index claimed with
 * {@link ConcurrentHashMap#putIfAbsent}. All clients and tokens are lost on server restart.
 * Suitable for development and integration testing only.
 */
public class InMemoryClientStore implements ClientStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryClientStore.class);

  private final ConcurrentHashMap<String, Client> clients = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, ClientToken> tokens = new ConcurrentHashMap<>();
  // Unique index: tokenHash → token id, kept in sync with tokens.
  private final ConcurrentHashMap<String, String> hashToTokenId = new ConcurrentHashMap<>();

  /**
   * Instantiates a new In memory client store.
   */
  public InMemoryClientStore() {
    log.warn("Using in-memory client store; clients and tokens will NOT survive restarts");
  }

  @Override
  public void createClient(Client client) {
    if (clients.putIfAbsent(client.id(), client) != null) {
      throw new IllegalStateException("Duplicate client id: " + client.id());
    }
    log.debug("Stored client id={}", client.id());
  }

  @Override
  public Optional<Client> findClient(String clientId) {
    if (clientId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(clients.get(clientId));
  }

  @Override
  public List<Client> listActiveClients() {
    return clients.values().stream()
        .filter(Client::active)
        .sorted(Comparator.comparing(Client::createdAt))
        .toList();
  }

  @Override
  public Optional<Client> updateClient(String clientId, String name, List<String> assignedAreas) {
    return updateClientIf(clientId, Client::active, c -> c.withDetails(name, assignedAreas));
  }

  @Override
  public boolean deactivateClient(String clientId) {
    return updateClientIf(clientId, Client::active, Client::deactivated).isPresent();
  }

  @Override
  public int clientCount() {
    return clients.size();
  }

  @Override
  public void saveToken(ClientToken token) {
    if (hashToTokenId.putIfAbsent(token.tokenHash(), token.id()) != null) {
      throw new IllegalStateException("Duplicate token hash");
    }
    if (tokens.putIfAbsent(token.id(), token) != null) {
      hashToTokenId.remove(token.tokenHash(), token.id());
      throw new IllegalStateException("Duplicate token id: " + token.id());
    }
    log.debug("Stored token id={} for client {}", token.id(), token.clientId());
  }

  @Override
  public Optional<ClientToken> findTokenByHash(String tokenHash) {
    if (tokenHash == null) {
      return Optional.empty();
    }
    String id = hashToTokenId.get(tokenHash);
    return id == null ? Optional.empty() : Optional.ofNullable(tokens.get(id));
  }

  @Override
  public Optional<ClientToken> findTokenById(String tokenId) {
    if (tokenId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(tokens.get(tokenId));
  }

  @Override
  public List<ClientToken> listTokens(String clientId) {
    return tokens.values().stream()
        .filter(t -> clientId == null || clientId.equals(t.clientId()))
        .sorted(Comparator.comparing(ClientToken::createdAt).reversed())
        .toList();
  }

  @Override
  public boolean revokeToken(String tokenHash, String reason, Instant now) {
    if (tokenHash == null) {
      return false;
    }
    String id = hashToTokenId.get(tokenHash);
    if (id == null) {
      return false;
    }
    return updateTokenIf(id, t -> !t.revoked(), t -> t.withRevoked(now, reason)).isPresent();
  }

  @Override
  public int revokeClientTokens(String clientId, String reason, Instant now) {
    return updateTokensWhere(t -> clientId.equals(t.clientId()) && !t.revoked(),
        t -> t.withRevoked(now, reason));
  }

  @Override
  public void recordUsage(String tokenId, String clientId, Instant now) {
    tokens.computeIfPresent(tokenId, (key, current) -> current.withLastUsed(now));
    clients.computeIfPresent(clientId, (key, current) -> current.withLastSeen(now));
  }

  @Override
  public Optional<ClientToken> updateTokenAreas(String tokenId, List<String> assignedAreas) {
    if (tokenId == null) {
      return Optional.empty();
    }
    return updateTokenIf(tokenId, t -> !t.revoked(), t -> t.withAssignedAreas(assignedAreas));
  }

  @Override
  public int updateClientTokenAreas(String clientId, List<String> assignedAreas) {
    return updateTokensWhere(t -> clientId.equals(t.clientId()) && !t.revoked(),
        t -> t.withAssignedAreas(assignedAreas));
  }

  @Override
  public int deleteExpiredTokens(Instant now) {
    AtomicInteger deleted = new AtomicInteger();
    for (String id : tokens.keySet()) {
      tokens.computeIfPresent(id, (key, current) -> {
        if (current.isExpired(now)) {
          hashToTokenId.remove(current.tokenHash(), key);
          deleted.incrementAndGet();
          return null;
        }
        return current;
      });
    }
    return deleted.get();
  }

  @Override
  public TokenStats tokenStats(Instant now, Instant recentSince) {
    List<ClientToken> snapshot = List.copyOf(tokens.values());
    long revoked = snapshot.stream().filter(ClientToken::revoked).count();
    long expired = snapshot.stream().filter(t -> t.isExpired(now)).count();
    long recent = snapshot.stream()
        .filter(t -> t.lastUsedAt() != null && t.lastUsedAt().isAfter(recentSince))
        .count();
    return new TokenStats(snapshot.size(), snapshot.size() - revoked, revoked, expired, recent);
  }

  private Optional<Client> updateClientIf(String clientId, Predicate<Client> condition,
                                          UnaryOperator<Client> update) {
    if (clientId == null) {
      return Optional.empty();
    }
    AtomicReference<Client> updated = new AtomicReference<>();
    clients.computeIfPresent(clientId, (key, current) -> {
      if (!condition.test(current)) {
        return current;
      }
      Client next = update.apply(current);
      updated.set(next);
      return next;
    });
    return Optional.ofNullable(updated.get());
  }

  private Optional<ClientToken> updateTokenIf(String tokenId, Predicate<ClientToken> condition,
                                              UnaryOperator<ClientToken> update) {
    AtomicReference<ClientToken> updated = new AtomicReference<>();
    tokens.computeIfPresent(tokenId, (key, current) -> {
      if (!condition.test(current)) {
        return current;
      }
      ClientToken next = update.apply(current);
      updated.set(next);
      return next;
    });
    return Optional.ofNullable(updated.get());
  }

  private int updateTokensWhere(Predicate<ClientToken> condition, UnaryOperator<ClientToken> update) {
    AtomicInteger changed = new AtomicInteger();
    for (String id : tokens.keySet()) {
      updateTokenIf(id, condition, update).ifPresent(t -> changed.incrementAndGet());
    }
    return changed.get();
  }
}
