package com.codeheadsystems.pairing.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.pairing.server.MutableClock;
import com.codeheadsystems.pairing.server.auth.AdminCredential;
import com.codeheadsystems.pairing.server.auth.TokenService;
import com.codeheadsystems.pairing.server.exception.ErrorKind;
import com.codeheadsystems.pairing.server.exception.PairingException;
import com.codeheadsystems.pairing.server.store.InMemoryClientStore;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * The type Admin login manager test.
 */
class AdminLoginManagerTest {

  private static final byte[] SECRET = "admin-login-test-secret-of-32-bytes!!!".getBytes(StandardCharsets.UTF_8);

  private TokenService tokenService;

  @BeforeEach
  void setUp() {
    tokenService = new TokenService(SECRET, "test-issuer", "test-audience", Duration.ofDays(3650),
        Duration.ofHours(24), new InMemoryClientStore(), new MutableClock(Instant.parse("2026-03-01T12:00:00Z")));
  }

  private static void assertFails(ThrowingCallable call, ErrorKind kind) {
    assertThatThrownBy(call)
        .isInstanceOf(PairingException.class)
        .satisfies(e -> assertThat(((PairingException) e).kind()).isEqualTo(kind));
  }

  @Test
  void login_correctCredentials_issuesAdminCredential() {
    AdminLoginManager manager = new AdminLoginManager("admin", "s3cret", tokenService);

    AdminCredential credential = manager.login("admin", "s3cret");

    assertThat(credential.username()).isEqualTo("admin");
    assertThat(tokenService.verifyAdmin(credential.credential())).contains("admin");
  }

  @Test
  void login_wrongCredentials_authenticationFailure() {
    AdminLoginManager manager = new AdminLoginManager("admin", "s3cret", tokenService);

    assertFails(() -> manager.login("admin", "wrong"), ErrorKind.AUTHENTICATION);
    assertFails(() -> manager.login("root", "s3cret"), ErrorKind.AUTHENTICATION);
  }

  @Test
  void login_missingFields_validation() {
    AdminLoginManager manager = new AdminLoginManager("admin", "s3cret", tokenService);

    assertFails(() -> manager.login(null, "s3cret"), ErrorKind.VALIDATION);
    assertFails(() -> manager.login("admin", ""), ErrorKind.VALIDATION);
  }

  @Test
  void login_notConfigured_alwaysFails() {
    AdminLoginManager manager = new AdminLoginManager("", "", tokenService);

    assertFails(() -> manager.login("admin", "anything"), ErrorKind.AUTHENTICATION);
    assertFails(() -> new AdminLoginManager(null, null, tokenService).login("a", "b"), ErrorKind.AUTHENTICATION);
  }
}
