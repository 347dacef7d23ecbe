package com.codeheadsystems.pairing.server.resource;

import com.codeheadsystems.pairing.model.auth.LoginRequest;
import com.codeheadsystems.pairing.model.auth.LoginResponse;
import com.codeheadsystems.pairing.server.auth.AdminCredential;
import com.codeheadsystems.pairing.server.exception.PairingException;
import com.codeheadsystems.pairing.server.manager.AdminLoginManager;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Administrator login: {@code POST /api/auth/login}.
 */
@Path("/api/auth")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

  private final AdminLoginManager adminLoginManager;

  /**
   * Instantiates a new Auth resource.
   *
   * @param adminLoginManager the admin login manager
   */
  public AuthResource(AdminLoginManager adminLoginManager) {
    this.adminLoginManager = adminLoginManager;
  }

  @POST
  @Path("/login")
  public LoginResponse login(LoginRequest request) {
    if (request == null) {
      throw PairingException.validation("Request body is required", "username");
    }
    AdminCredential credential = adminLoginManager.login(request.username(), request.password());
    return new LoginResponse(credential.credential(), credential.username(),
        WireMapper.iso(credential.expiresAt()));
  }
}
