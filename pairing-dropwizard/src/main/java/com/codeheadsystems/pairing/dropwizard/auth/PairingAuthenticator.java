package com.codeheadsystems.pairing.dropwizard.auth;

import com.codeheadsystems.pairing.server.auth.AuthenticatedPrincipal;
import com.codeheadsystems.pairing.server.auth.UnifiedAuthGate;
import com.codeheadsystems.pairing.server.exception.PairingException;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that resolves bearer credentials through the
 * {@link UnifiedAuthGate}. A rejected credential yields an empty result, which the auth
 * filter turns into a 401.
 */
public class PairingAuthenticator implements Authenticator<String, AuthenticatedPrincipal> {

  private final UnifiedAuthGate unifiedAuthGate;

  /**
   * Instantiates a new Pairing authenticator.
   *
   * @param unifiedAuthGate the unified auth gate
   */
  public PairingAuthenticator(UnifiedAuthGate unifiedAuthGate) {
    this.unifiedAuthGate = unifiedAuthGate;
  }

  @Override
  public Optional<AuthenticatedPrincipal> authenticate(String credential) throws AuthenticationException {
    try {
      return Optional.of(unifiedAuthGate.authenticate(credential));
    } catch (PairingException e) {
      return Optional.empty();
    }
  }
}
