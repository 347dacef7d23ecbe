package com.codeheadsystems.pairing.server.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for clients and their token records.
 * <p>
 * Implementations must be thread-safe and must enforce uniqueness of
 * {@link ClientToken#tokenHash()}. There is no caching layer in front of a store: every read
 * reflects the latest committed revocation, so credential checks see revocations immediately.
 * <p>
 * Revocation is a conditional write ({@code ... WHERE is_revoked = 0}); a revoked token is
 * never un-revoked.
 */
public interface ClientStore {

  /**
   * Persists a new client.
   *
   * @param client the client
   * @throws IllegalStateException if the id is already taken
   */
  void createClient(Client client);

  /**
   * Finds a client by id, active or not.
   *
   * @param clientId the client id
   * @return the client, or empty if unknown
   */
  Optional<Client> findClient(String clientId);

  /**
   * Lists active clients, oldest first.
   *
   * @return the active clients
   */
  List<Client> listActiveClients();

  /**
   * Replaces the name and areas of an active client.
   *
   * @param clientId      the client id
   * @param name          the new name
   * @param assignedAreas the new areas
   * @return the updated client, or empty if unknown or inactive
   */
  Optional<Client> updateClient(String clientId, String name, List<String> assignedAreas);

  /**
   * Marks an active client inactive.
   *
   * @param clientId the client id
   * @return true if the client was active and is now inactive
   */
  boolean deactivateClient(String clientId);

  /**
   * Number of stored clients, active or not.
   *
   * @return the count
   */
  int clientCount();

  /**
   * Persists a new token record.
   *
   * @param token the token
   * @throws IllegalStateException if the token hash or id is already present
   */
  void saveToken(ClientToken token);

  /**
   * Finds a token by its credential hash.
   *
   * @param tokenHash the token hash
   * @return the token, or empty if unknown
   */
  Optional<ClientToken> findTokenByHash(String tokenHash);

  /**
   * Finds a token by id.
   *
   * @param tokenId the token id
   * @return the token, or empty if unknown
   */
  Optional<ClientToken> findTokenById(String tokenId);

  /**
   * Lists tokens, newest first.
   *
   * @param clientId restricts the list to one client when non-null
   * @return the tokens
   */
  List<ClientToken> listTokens(String clientId);

  /**
   * Revokes a token if it exists and is not already revoked.
   *
   * @param tokenHash the token hash
   * @param reason    the reason, may be null
   * @param now       the revocation time
   * @return true only for the call that performed the revocation
   */
  boolean revokeToken(String tokenHash, String reason, Instant now);

  /**
   * Revokes every non-revoked token of a client.
   *
   * @param clientId the client id
   * @param reason   the reason
   * @param now      the revocation time
   * @return the number of tokens revoked
   */
  int revokeClientTokens(String clientId, String reason, Instant now);

  /**
   * Records a successful credential check: sets the token's {@code lastUsedAt} and the
   * client's {@code lastSeenAt}.
   *
   * @param tokenId  the token id
   * @param clientId the client id
   * @param now      the now
   */
  void recordUsage(String tokenId, String clientId, Instant now);

  /**
   * Replaces the scope of a non-revoked token.
   *
   * @param tokenId       the token id
   * @param assignedAreas the new scope
   * @return the updated token, or empty if unknown or revoked
   */
  Optional<ClientToken> updateTokenAreas(String tokenId, List<String> assignedAreas);

  /**
   * Replaces the scope of every non-revoked token of a client.
   *
   * @param clientId      the client id
   * @param assignedAreas the new scope
   * @return the number of tokens updated
   */
  int updateClientTokenAreas(String clientId, List<String> assignedAreas);

  /**
   * Deletes token records that are expired at {@code now}, that is {@code expiresAt <= now},
   * matching {@link ClientToken#isExpired}.
   *
   * @param now the now
   * @return the number of records deleted
   */
  int deleteExpiredTokens(Instant now);

  /**
   * Aggregate token counts.
   *
   * @param now         instant used for the expired count
   * @param recentSince tokens used after this instant count as recently used
   * @return the stats
   */
  TokenStats tokenStats(Instant now, Instant recentSince);
}
