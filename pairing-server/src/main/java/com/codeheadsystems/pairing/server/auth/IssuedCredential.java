package com.codeheadsystems.pairing.server.auth;

import com.codeheadsystems.pairing.server.store.ClientToken;

/**
 * A freshly minted client credential and its stored record.
 *
 * @param credential the plaintext credential; hand it to the caller once and drop it
 * @param token      the persisted record, holding only the credential's hash
 */
public record IssuedCredential(String credential, ClientToken token) {

  @Override
  public String toString() {
    return "IssuedCredential[tokenId=" + token.id() + ", clientId=" + token.clientId() + "]";
  }
}
