package com.codeheadsystems.pairing.server.auth;

import java.util.function.Function;

/**
 * An administrator authenticated by a stateless admin credential.
 *
 * @param username the administrator's user name
 */
public record AdminPrincipal(String username) implements AuthenticatedPrincipal {

  @Override
  public String getName() {
    return username;
  }

  @Override
  public <R> R match(Function<AdminPrincipal, R> onAdmin,
                     Function<ClientPrincipal, R> onClient) {
    return onAdmin.apply(this);
  }
}
