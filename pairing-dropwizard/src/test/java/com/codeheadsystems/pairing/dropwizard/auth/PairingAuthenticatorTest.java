package com.codeheadsystems.pairing.dropwizard.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.codeheadsystems.pairing.server.auth.AdminPrincipal;
import com.codeheadsystems.pairing.server.auth.UnifiedAuthGate;
import com.codeheadsystems.pairing.server.exception.PairingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PairingAuthenticatorTest {

  @Mock private UnifiedAuthGate unifiedAuthGate;

  @Test
  void authenticate_acceptedCredential_returnsPrincipal() throws Exception {
    when(unifiedAuthGate.authenticate("good")).thenReturn(new AdminPrincipal("admin"));

    assertThat(new PairingAuthenticator(unifiedAuthGate).authenticate("good"))
        .contains(new AdminPrincipal("admin"));
  }

  @Test
  void authenticate_rejectedCredential_returnsEmpty() throws Exception {
    when(unifiedAuthGate.authenticate("bad")).thenThrow(PairingException.authentication("Authentication failed"));

    assertThat(new PairingAuthenticator(unifiedAuthGate).authenticate("bad")).isEmpty();
  }
}
