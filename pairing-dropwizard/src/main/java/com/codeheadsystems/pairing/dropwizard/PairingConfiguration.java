package com.codeheadsystems.pairing.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for the pairing backend.
 * <p>
 * For production, supply {@code jwtSecretHex} (a hex-encoded random value of at least 32
 * bytes) so that issued credentials survive restarts, and set {@code adminUsername} and
 * {@code adminPassword}, typically from the environment:
 * <pre>{@code
 *   adminPassword: ${PAIRING_ADMIN_PASSWORD:-}
 * }</pre>
 * Generate a secret with: {@code openssl rand -hex 32}
 */
public class PairingConfiguration extends Configuration {

  /**
   * Hex-encoded HMAC-SHA256 signing secret shared by admin and client credentials.
   * Leave empty for random generation (dev only; every credential becomes invalid on restart).
   */
  private String jwtSecretHex = "";

  /**
   * Issuer claim of every credential.
   */
  @NotEmpty
  private String jwtIssuer = "pairing-backend";

  /**
   * Audience claim of every credential.
   */
  @NotEmpty
  private String jwtAudience = "pairing-client";

  /**
   * Lifetime of an admin credential, in seconds.
   */
  @Min(1)
  private long adminTokenTtlSeconds = 86400;

  /**
   * Lifetime of a client credential, in days.
   */
  @Min(1)
  private long clientTokenTtlDays = 3650;

  /**
   * How long a pairing PIN is accepted, in seconds.
   */
  @Min(1)
  private long pinTtlSeconds = 300;

  /**
   * How long a verified session waits for administrator approval, in seconds.
   */
  @Min(1)
  private long verifiedSessionTtlSeconds = 600;

  /**
   * How long completed and expired sessions are kept before the sweep deletes them, in seconds.
   */
  @Min(0)
  private long sessionRetentionSeconds = 86400;

  /**
   * Interval between expiry sweeps, in seconds.
   */
  @Min(1)
  private long sweepIntervalSeconds = 300;

  /**
   * Delay between sending {@code token_revoked} and closing the connection, in milliseconds.
   */
  @Min(0)
  private long disconnectGraceMillis = 500;

  /**
   * Interval between keep-alive writes on realtime connections, in seconds. Connections that
   * fail it are dropped.
   */
  @Min(1)
  private long keepAliveSeconds = 30;

  /**
   * Wrong PIN entries allowed per pairing session before it expires.
   */
  @Min(1)
  private int maxPinAttempts = 5;

  /**
   * Administrator user name. Admin login is disabled while empty.
   */
  private String adminUsername = "";

  /**
   * Administrator password. Admin login is disabled while empty.
   */
  private String adminPassword = "";

  /**
   * Gets jwt secret hex.
   *
   * @return the jwt secret hex
   */
  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  /**
   * Sets jwt secret hex.
   *
   * @param jwtSecretHex the jwt secret hex
   */
  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  /**
   * Gets jwt issuer.
   *
   * @return the jwt issuer
   */
  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  /**
   * Sets jwt issuer.
   *
   * @param jwtIssuer the jwt issuer
   */
  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  /**
   * Gets jwt audience.
   *
   * @return the jwt audience
   */
  @JsonProperty
  public String getJwtAudience() {
    return jwtAudience;
  }

  /**
   * Sets jwt audience.
   *
   * @param jwtAudience the jwt audience
   */
  @JsonProperty
  public void setJwtAudience(String jwtAudience) {
    this.jwtAudience = jwtAudience;
  }

  /**
   * Gets admin token ttl seconds.
   *
   * @return the admin token ttl seconds
   */
  @JsonProperty
  public long getAdminTokenTtlSeconds() {
    return adminTokenTtlSeconds;
  }

  /**
   * Sets admin token ttl seconds.
   *
   * @param adminTokenTtlSeconds the admin token ttl seconds
   */
  @JsonProperty
  public void setAdminTokenTtlSeconds(long adminTokenTtlSeconds) {
    this.adminTokenTtlSeconds = adminTokenTtlSeconds;
  }

  /**
   * Gets client token ttl days.
   *
   * @return the client token ttl days
   */
  @JsonProperty
  public long getClientTokenTtlDays() {
    return clientTokenTtlDays;
  }

  /**
   * Sets client token ttl days.
   *
   * @param clientTokenTtlDays the client token ttl days
   */
  @JsonProperty
  public void setClientTokenTtlDays(long clientTokenTtlDays) {
    this.clientTokenTtlDays = clientTokenTtlDays;
  }

  /**
   * Gets pin ttl seconds.
   *
   * @return the pin ttl seconds
   */
  @JsonProperty
  public long getPinTtlSeconds() {
    return pinTtlSeconds;
  }

  /**
   * Sets pin ttl seconds.
   *
   * @param pinTtlSeconds the pin ttl seconds
   */
  @JsonProperty
  public void setPinTtlSeconds(long pinTtlSeconds) {
    this.pinTtlSeconds = pinTtlSeconds;
  }

  /**
   * Gets verified session ttl seconds.
   *
   * @return the verified session ttl seconds
   */
  @JsonProperty
  public long getVerifiedSessionTtlSeconds() {
    return verifiedSessionTtlSeconds;
  }

  /**
   * Sets verified session ttl seconds.
   *
   * @param verifiedSessionTtlSeconds the verified session ttl seconds
   */
  @JsonProperty
  public void setVerifiedSessionTtlSeconds(long verifiedSessionTtlSeconds) {
    this.verifiedSessionTtlSeconds = verifiedSessionTtlSeconds;
  }

  /**
   * Gets session retention seconds.
   *
   * @return the session retention seconds
   */
  @JsonProperty
  public long getSessionRetentionSeconds() {
    return sessionRetentionSeconds;
  }

  /**
   * Sets session retention seconds.
   *
   * @param sessionRetentionSeconds the session retention seconds
   */
  @JsonProperty
  public void setSessionRetentionSeconds(long sessionRetentionSeconds) {
    this.sessionRetentionSeconds = sessionRetentionSeconds;
  }

  /**
   * Gets sweep interval seconds.
   *
   * @return the sweep interval seconds
   */
  @JsonProperty
  public long getSweepIntervalSeconds() {
    return sweepIntervalSeconds;
  }

  /**
   * Sets sweep interval seconds.
   *
   * @param sweepIntervalSeconds the sweep interval seconds
   */
  @JsonProperty
  public void setSweepIntervalSeconds(long sweepIntervalSeconds) {
    this.sweepIntervalSeconds = sweepIntervalSeconds;
  }

  /**
   * Gets disconnect grace millis.
   *
   * @return the disconnect grace millis
   */
  @JsonProperty
  public long getDisconnectGraceMillis() {
    return disconnectGraceMillis;
  }

  /**
   * Sets disconnect grace millis.
   *
   * @param disconnectGraceMillis the disconnect grace millis
   */
  @JsonProperty
  public void setDisconnectGraceMillis(long disconnectGraceMillis) {
    this.disconnectGraceMillis = disconnectGraceMillis;
  }

  /**
   * Gets admin username.
   *
   * @return the admin username
   */
  @JsonProperty
  public String getAdminUsername() {
    return adminUsername;
  }

  /**
   * Sets admin username.
   *
   * @param adminUsername the admin username
   */
  @JsonProperty
  public void setAdminUsername(String adminUsername) {
    this.adminUsername = adminUsername;
  }

  /**
   * Gets admin password.
   *
   * @return the admin password
   */
  @JsonProperty
  public String getAdminPassword() {
    return adminPassword;
  }

  /**
   * Sets admin password.
   *
   * @param adminPassword the admin password
   */
  @JsonProperty
  public void setAdminPassword(String adminPassword) {
    this.adminPassword = adminPassword;
  }

  /**
   * Gets keep alive seconds.
   *
   * @return the keep alive seconds
   */
  @JsonProperty
  public long getKeepAliveSeconds() {
    return keepAliveSeconds;
  }

  /**
   * Sets keep alive seconds.
   *
   * @param keepAliveSeconds the keep alive seconds
   */
  @JsonProperty
  public void setKeepAliveSeconds(long keepAliveSeconds) {
    this.keepAliveSeconds = keepAliveSeconds;
  }

  /**
   * Gets max pin attempts.
   *
   * @return the max pin attempts
   */
  @JsonProperty
  public int getMaxPinAttempts() {
    return maxPinAttempts;
  }

  /**
   * Sets max pin attempts.
   *
   * @param maxPinAttempts the max pin attempts
   */
  @JsonProperty
  public void setMaxPinAttempts(int maxPinAttempts) {
    this.maxPinAttempts = maxPinAttempts;
  }
}
