package com.codeheadsystems.pairing.server.manager;

import com.codeheadsystems.pairing.server.auth.AdminCredential;
import com.codeheadsystems.pairing.server.auth.TokenService;
import com.codeheadsystems.pairing.server.exception.PairingException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exchanges the configured administrator user name and password for an admin credential.
 * When either is not configured every login fails.
 */
public class AdminLoginManager {

  private static final Logger log = LoggerFactory.getLogger(AdminLoginManager.class);

  private final String adminUsername;
  private final String adminPassword;
  private final TokenService tokenService;

  /**
   * Instantiates a new Admin login manager.
   *
   * @param adminUsername the configured user name, may be empty
   * @param adminPassword the configured password, may be empty
   * @param tokenService  the token service
   */
  public AdminLoginManager(String adminUsername, String adminPassword, TokenService tokenService) {
    this.adminUsername = adminUsername;
    this.adminPassword = adminPassword;
    this.tokenService = tokenService;
    if (!isConfigured()) {
      log.warn("No admin credentials configured; admin login is disabled");
    }
  }

  /**
   * Checks the credentials in constant time and issues an admin credential.
   *
   * @param username the user name
   * @param password the password
   * @return the admin credential
   * @throws PairingException VALIDATION if either value is missing, AUTHENTICATION if wrong
   */
  public AdminCredential login(String username, String password) {
    if (username == null || username.isBlank()) {
      throw PairingException.validation("username is required", "username");
    }
    if (password == null || password.isEmpty()) {
      throw PairingException.validation("password is required", "password");
    }
    // Evaluate both comparisons so timing does not reveal which one failed.
    boolean userOk = constantTimeEquals(username, adminUsername);
    boolean passOk = constantTimeEquals(password, adminPassword);
    if (!isConfigured() || !(userOk & passOk)) {
      log.warn("Failed admin login for '{}'", username);
      throw PairingException.authentication("Invalid credentials");
    }
    return tokenService.issueAdmin(adminUsername);
  }

  private boolean isConfigured() {
    return adminUsername != null && !adminUsername.isBlank()
        && adminPassword != null && !adminPassword.isEmpty();
  }

  private static boolean constantTimeEquals(String a, String b) {
    if (b == null) {
      return false;
    }
    return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
  }
}
