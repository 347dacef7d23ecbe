package com.codeheadsystems.pairing.server.auth;

import static org.assertj.core.api.Assertions.assertThat;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.codeheadsystems.pairing.server.MutableClock;
import com.codeheadsystems.pairing.server.store.ClientToken;
import com.codeheadsystems.pairing.server.store.InMemoryClientStore;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TokenServiceTest {

  static final byte[] SECRET = "test-secret-must-be-at-least-32-bytes!".getBytes(StandardCharsets.UTF_8);
  private static final byte[] WRONG_SECRET = "wrong-secret-must-be-at-least-32-bytes".getBytes(StandardCharsets.UTF_8);
  private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

  private MutableClock clock;
  private InMemoryClientStore clientStore;
  private TokenService tokenService;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    clientStore = new InMemoryClientStore();
    tokenService = newService(SECRET, Duration.ofDays(3650));
  }

  private TokenService newService(byte[] secret, Duration clientTtl) {
    return new TokenService(secret, "test-issuer", "test-audience", clientTtl,
        Duration.ofHours(24), clientStore, clock);
  }

  @Test
  void issue_persistsRecordKeyedByHash() {
    IssuedCredential issued = tokenService.issue("client_1", List.of("area_1", "area_2"));

    ClientToken stored = clientStore.findTokenByHash(tokenService.hash(issued.credential())).orElseThrow();
    assertThat(stored).isEqualTo(issued.token());
    assertThat(stored.clientId()).isEqualTo("client_1");
    assertThat(stored.assignedAreas()).containsExactly("area_1", "area_2");
    assertThat(stored.expiresAt()).isEqualTo(T0.plus(Duration.ofDays(3650)));
    assertThat(stored.tokenHash()).doesNotContain(issued.credential());
  }

  @Test
  void issue_embedsClientClaims() {
    IssuedCredential issued = tokenService.issue("client_1", List.of("area_1"));

    var decoded = JWT.decode(issued.credential());
    assertThat(decoded.getClaim("role").asString()).isEqualTo("client");
    assertThat(decoded.getClaim("type").asString()).isEqualTo("client");
    assertThat(decoded.getClaim("clientId").asString()).isEqualTo("client_1");
    assertThat(decoded.getIssuer()).isEqualTo("test-issuer");
    assertThat(decoded.getAudience()).containsExactly("test-audience");
  }

  @Test
  void issue_twiceForSameClient_producesDistinctHashes() {
    IssuedCredential first = tokenService.issue("client_1", List.of());
    IssuedCredential second = tokenService.issue("client_1", List.of());

    assertThat(first.token().tokenHash()).isNotEqualTo(second.token().tokenHash());
  }

  @Test
  void hash_isDeterministicAndDistinguishesInputs() {
    assertThat(tokenService.hash("abc")).isEqualTo(tokenService.hash("abc"));
    assertThat(tokenService.hash("abc")).isNotEqualTo(tokenService.hash("abd"));
    assertThat(tokenService.hash("abc")).hasSize(64).matches("[0-9a-f]+");
  }

  @Test
  void verify_roundTrip() {
    IssuedCredential issued = tokenService.issue("client_1", List.of("area_1"));

    Optional<ClientClaims> claims = tokenService.verify(issued.credential());

    assertThat(claims).contains(new ClientClaims("client_1", List.of("area_1")));
  }

  @Test
  void verify_wrongSecret_returnsEmpty() {
    IssuedCredential issued = tokenService.issue("client_1", List.of());

    assertThat(newService(WRONG_SECRET, Duration.ofDays(1)).verify(issued.credential())).isEmpty();
  }

  @Test
  void verify_expired_returnsEmpty() {
    IssuedCredential issued = tokenService.issue("client_1", List.of());
    clock.advance(Duration.ofDays(3651));

    assertThat(tokenService.verify(issued.credential())).isEmpty();
  }

  @Test
  void verify_tampered_returnsEmpty() {
    String credential = tokenService.issue("client_1", List.of()).credential();
    String tampered = credential.substring(0, credential.length() - 2) + "XX";

    assertThat(tokenService.verify(tampered)).isEmpty();
  }

  @Test
  void verify_wrongAudience_returnsEmpty() {
    String credential = JWT.create()
        .withIssuer("test-issuer")
        .withAudience("someone-else")
        .withClaim("role", "client")
        .withClaim("clientId", "client_1")
        .withIssuedAt(T0)
        .withExpiresAt(T0.plusSeconds(3600))
        .sign(Algorithm.HMAC256(SECRET));

    assertThat(tokenService.verify(credential)).isEmpty();
  }

  @Test
  void verify_adminCredential_returnsEmpty() {
    AdminCredential admin = tokenService.issueAdmin("root");

    assertThat(tokenService.verify(admin.credential())).isEmpty();
  }

  @Test
  void verify_garbage_returnsEmpty() {
    assertThat(tokenService.verify("not-a-jwt")).isEmpty();
    assertThat(tokenService.verify("")).isEmpty();
    assertThat(tokenService.verify(null)).isEmpty();
  }

  @Test
  void verifyAdmin_roundTrip_andRejectsClientCredential() {
    AdminCredential admin = tokenService.issueAdmin("root");

    assertThat(tokenService.verifyAdmin(admin.credential())).contains("root");
    assertThat(admin.expiresAt()).isEqualTo(T0.plus(Duration.ofHours(24)));
    assertThat(tokenService.verifyAdmin(tokenService.issue("client_1", List.of()).credential())).isEmpty();
  }

  @Test
  void verifyAdmin_expired_returnsEmpty() {
    AdminCredential admin = tokenService.issueAdmin("root");
    clock.advance(Duration.ofHours(25));

    assertThat(tokenService.verifyAdmin(admin.credential())).isEmpty();
  }

  @Test
  void revoke_trueThenFalse() {
    IssuedCredential issued = tokenService.issue("client_1", List.of());

    assertThat(tokenService.revoke(issued.token().tokenHash(), "lost device")).isTrue();
    assertThat(tokenService.revoke(issued.token().tokenHash(), "lost device")).isFalse();
    assertThat(tokenService.revoke("unknown-hash", null)).isFalse();
    assertThat(clientStore.findTokenById(issued.token().id()).orElseThrow().revoked()).isTrue();
  }

  @Test
  void sweepExpired_deletesOnlyExpiredRecords() {
    TokenService shortLived = newService(SECRET, Duration.ofHours(1));
    IssuedCredential expiring = shortLived.issue("client_1", List.of());
    IssuedCredential lasting = tokenService.issue("client_1", List.of());
    clock.advance(Duration.ofHours(2));

    assertThat(tokenService.sweepExpired()).isEqualTo(1);
    assertThat(clientStore.findTokenById(expiring.token().id())).isEmpty();
    assertThat(clientStore.findTokenById(lasting.token().id())).isPresent();
  }

  @Test
  void abbreviate_keepsEightCharacters() {
    assertThat(TokenService.abbreviate("0123456789abcdef")).isEqualTo("01234567");
    assertThat(TokenService.abbreviate("abc")).isEqualTo("abc");
  }
}
