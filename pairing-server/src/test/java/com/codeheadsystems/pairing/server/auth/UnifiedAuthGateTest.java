package com.codeheadsystems.pairing.server.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.codeheadsystems.pairing.server.MutableClock;
import com.codeheadsystems.pairing.server.exception.ErrorKind;
import com.codeheadsystems.pairing.server.exception.PairingException;
import com.codeheadsystems.pairing.server.store.Client;
import com.codeheadsystems.pairing.server.store.ClientToken;
import com.codeheadsystems.pairing.server.store.DeviceType;
import com.codeheadsystems.pairing.server.store.InMemoryClientStore;
import java.time.Duration;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UnifiedAuthGateTest {

  private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

  private MutableClock clock;
  private InMemoryClientStore clientStore;
  private TokenService tokenService;
  private UnifiedAuthGate gate;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    clientStore = new InMemoryClientStore();
    tokenService = new TokenService(TokenServiceTest.SECRET, "test-issuer", "test-audience",
        Duration.ofDays(3650), Duration.ofHours(24), clientStore, clock);
    gate = new UnifiedAuthGate(tokenService, clientStore, clock);
    clientStore.createClient(new Client("client_1", "Kitchen", DeviceType.TABLET,
        List.of("area_1"), true, T0, null));
  }

  private static void assertRejected(ThrowingCallable call) {
    assertThatThrownBy(call)
        .isInstanceOf(PairingException.class)
        .hasMessage("Authentication failed")
        .satisfies(e -> assertThat(((PairingException) e).kind()).isEqualTo(ErrorKind.AUTHENTICATION));
  }

  @Test
  void missingCredential_rejected() {
    assertRejected(() -> gate.authenticate(null));
    assertRejected(() -> gate.authenticate("  "));
  }

  @Test
  void undecodableCredential_rejected() {
    assertRejected(() -> gate.authenticate("not-a-jwt"));
  }

  @Test
  void nullPayloadSegment_rejected() {
    assertRejected(() -> gate.authenticate(b64("{\"alg\":\"HS256\"}") + "." + b64("null") + ".sig"));
    assertRejected(() -> gate.authenticate(b64("{}") + "." + b64("null") + ".sig"));
  }

  @Test
  void nullHeaderSegment_withRoleClaim_rejected() {
    assertRejected(() -> gate.authenticate(b64("null") + "." + b64("{\"role\":\"client\"}") + ".sig"));
    assertRejected(() -> gate.authenticate(b64("null") + "." + b64("{\"role\":\"admin\"}") + ".sig"));
  }

  @Test
  void storeFailure_duringClientCheck_rejected() {
    IssuedCredential issued = tokenService.issue("client_1", List.of("area_1"));
    UnifiedAuthGate failing = new UnifiedAuthGate(tokenService, new InMemoryClientStore() {
      @Override
      public Optional<ClientToken> findTokenByHash(String tokenHash) {
        throw new IllegalStateException("store offline");
      }
    }, clock);

    assertRejected(() -> failing.authenticate(issued.credential()));
  }

  private static String b64(String json) {
    return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void adminCredential_resolvesAdminPrincipal() {
    String credential = tokenService.issueAdmin("root").credential();

    AuthenticatedPrincipal principal = gate.authenticate(credential);

    assertThat(principal).isEqualTo(new AdminPrincipal("root"));
    assertThat(principal.getName()).isEqualTo("root");
  }

  @Test
  void clientCredential_resolvesClientPrincipal_andRecordsUsage() {
    IssuedCredential issued = tokenService.issue("client_1", List.of("area_1"));
    clock.advance(Duration.ofMinutes(5));

    AuthenticatedPrincipal principal = gate.authenticate(issued.credential());

    assertThat(principal).isEqualTo(new ClientPrincipal("client_1", List.of("area_1"), issued.token().id()));
    assertThat(clientStore.findTokenById(issued.token().id()).orElseThrow().lastUsedAt())
        .isEqualTo(T0.plus(Duration.ofMinutes(5)));
    assertThat(clientStore.findClient("client_1").orElseThrow().lastSeenAt())
        .isEqualTo(T0.plus(Duration.ofMinutes(5)));
  }

  @Test
  void clientPrincipal_carriesScopeOfStoredRecord() {
    IssuedCredential issued = tokenService.issue("client_1", List.of("area_1"));
    clientStore.updateTokenAreas(issued.token().id(), List.of("area_7"));

    ClientPrincipal principal = (ClientPrincipal) gate.authenticate(issued.credential());

    assertThat(principal.assignedAreas()).containsExactly("area_7");
    assertThat(principal.canAccess("area_1")).isFalse();
  }

  @Test
  void revokedCredential_rejected() {
    IssuedCredential issued = tokenService.issue("client_1", List.of("area_1"));
    assertThat(gate.authenticate(issued.credential())).isInstanceOf(ClientPrincipal.class);

    tokenService.revoke(issued.token().tokenHash(), "lost");

    assertRejected(() -> gate.authenticate(issued.credential()));
  }

  @Test
  void credentialWithoutStoredRecord_rejected() {
    String credential = JWT.create()
        .withIssuer("test-issuer")
        .withAudience("test-audience")
        .withClaim("role", "client")
        .withClaim("clientId", "client_1")
        .withIssuedAt(T0)
        .withExpiresAt(T0.plusSeconds(3600))
        .sign(Algorithm.HMAC256(TokenServiceTest.SECRET));

    assertRejected(() -> gate.authenticate(credential));
  }

  @Test
  void inactiveClient_rejected() {
    IssuedCredential issued = tokenService.issue("client_1", List.of("area_1"));
    clientStore.deactivateClient("client_1");

    assertRejected(() -> gate.authenticate(issued.credential()));
  }

  @Test
  void unknownRole_rejected() {
    String credential = JWT.create()
        .withIssuer("test-issuer")
        .withAudience("test-audience")
        .withClaim("role", "guest")
        .sign(Algorithm.HMAC256(TokenServiceTest.SECRET));

    assertRejected(() -> gate.authenticate(credential));
  }

  @Test
  void forgedAdminRole_rejected() {
    String forged = JWT.create()
        .withIssuer("test-issuer")
        .withAudience("test-audience")
        .withClaim("role", "admin")
        .withClaim("username", "root")
        .withExpiresAt(T0.plusSeconds(3600))
        .sign(Algorithm.HMAC256("another-secret-that-is-long-enough!!"));

    assertRejected(() -> gate.authenticate(forged));
  }

  @Test
  void match_dispatchesOnVariant() {
    AuthenticatedPrincipal admin = new AdminPrincipal("root");
    AuthenticatedPrincipal client = new ClientPrincipal("client_1", List.of(), "token_1");

    assertThat(admin.<String>match(a -> "admin:" + a.username(), c -> "client")).isEqualTo("admin:root");
    assertThat(client.<String>match(a -> "admin", c -> "client:" + c.clientId())).isEqualTo("client:client_1");
  }
}
