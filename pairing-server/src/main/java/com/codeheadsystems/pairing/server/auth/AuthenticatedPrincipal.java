package com.codeheadsystems.pairing.server.auth;

import java.security.Principal;
import java.util.function.Function;

/**
 * Identity resolved from a verified bearer credential. Exactly two variants exist; callers
 * dispatch with {@link #match} rather than comparing role strings.
 */
public sealed interface AuthenticatedPrincipal extends Principal
    permits AdminPrincipal, ClientPrincipal {

  /**
   * Applies the function for this principal's variant.
   *
   * @param <R>      the result type
   * @param onAdmin  applied to an administrator
   * @param onClient applied to a paired client
   * @return the function's result
   */
  <R> R match(Function<AdminPrincipal, R> onAdmin, Function<ClientPrincipal, R> onClient);
}
