package com.codeheadsystems.pairing.server.manager;

import com.codeheadsystems.pairing.server.auth.IssuedCredential;
import com.codeheadsystems.pairing.server.store.Client;
import com.codeheadsystems.pairing.server.store.PairingSession;

/**
 * Outcome of a completed pairing.
 *
 * @param session    the session, now completed
 * @param client     the created client
 * @param credential the minted credential; its plaintext must be returned to the caller once
 */
public record PairingResult(PairingSession session, Client client, IssuedCredential credential) {
}
