package com.codeheadsystems.pairing.server.resource;

import com.codeheadsystems.pairing.model.token.CleanupResponse;
import com.codeheadsystems.pairing.model.token.CreateTokenRequest;
import com.codeheadsystems.pairing.model.token.CreateTokenResponse;
import com.codeheadsystems.pairing.model.token.RevokeTokenRequest;
import com.codeheadsystems.pairing.model.token.TokenResponse;
import com.codeheadsystems.pairing.model.token.TokenStatsResponse;
import com.codeheadsystems.pairing.model.token.UpdateTokenAreasRequest;
import com.codeheadsystems.pairing.server.auth.IssuedCredential;
import com.codeheadsystems.pairing.server.exception.PairingException;
import com.codeheadsystems.pairing.server.manager.ClientTokenManager;
import jakarta.annotation.security.PermitAll;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.SecurityContext;
import java.util.List;

/**
 * JAX-RS resource for client token records. Administrator only.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /api/client-tokens}                   issue for an existing client</li>
 *   <li>{@code GET /api/client-tokens?clientId=}          list, newest first</li>
 *   <li>{@code GET /api/client-tokens/{tokenId}}          one record</li>
 *   <li>{@code POST /api/client-tokens/{tokenId}/revoke}  revoke and disconnect</li>
 *   <li>{@code PATCH /api/client-tokens/{tokenId}}        change scope</li>
 *   <li>{@code POST /api/client-tokens/cleanup}           delete expired records</li>
 *   <li>{@code GET /api/client-tokens/stats}              counts</li>
 * </ul>
 */
@Path("/api/client-tokens")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ClientTokenResource {

  private final ClientTokenManager clientTokenManager;

  /**
   * Instantiates a new Client token resource.
   *
   * @param clientTokenManager the client token manager
   */
  public ClientTokenResource(ClientTokenManager clientTokenManager) {
    this.clientTokenManager = clientTokenManager;
  }

  @POST
  @PermitAll
  public CreateTokenResponse create(@Context SecurityContext securityContext, CreateTokenRequest request) {
    Principals.requireAdmin(securityContext);
    if (request == null) {
      throw PairingException.validation("Request body is required", "clientId");
    }
    IssuedCredential issued = clientTokenManager.issueToken(request.clientId(), request.assignedAreas());
    return new CreateTokenResponse(issued.token().id(), issued.credential(), issued.token().clientId(),
        issued.token().assignedAreas(), WireMapper.iso(issued.token().expiresAt()));
  }

  @GET
  @PermitAll
  public List<TokenResponse> list(@Context SecurityContext securityContext,
                                  @QueryParam("clientId") String clientId) {
    Principals.requireAdmin(securityContext);
    return clientTokenManager.listTokens(clientId).stream().map(WireMapper::toResponse).toList();
  }

  @GET
  @Path("/stats")
  @PermitAll
  public TokenStatsResponse stats(@Context SecurityContext securityContext) {
    Principals.requireAdmin(securityContext);
    return WireMapper.toResponse(clientTokenManager.stats());
  }

  @POST
  @Path("/cleanup")
  @PermitAll
  public CleanupResponse cleanup(@Context SecurityContext securityContext) {
    Principals.requireAdmin(securityContext);
    return new CleanupResponse(clientTokenManager.cleanupExpired());
  }

  @GET
  @Path("/{tokenId}")
  @PermitAll
  public TokenResponse get(@Context SecurityContext securityContext, @PathParam("tokenId") String tokenId) {
    Principals.requireAdmin(securityContext);
    return WireMapper.toResponse(clientTokenManager.getToken(tokenId));
  }

  @POST
  @Path("/{tokenId}/revoke")
  @PermitAll
  public TokenResponse revoke(@Context SecurityContext securityContext,
                              @PathParam("tokenId") String tokenId,
                              RevokeTokenRequest request) {
    Principals.requireAdmin(securityContext);
    String reason = request == null ? null : request.reason();
    return WireMapper.toResponse(clientTokenManager.revokeToken(tokenId, reason));
  }

  @PATCH
  @Path("/{tokenId}")
  @PermitAll
  public TokenResponse updateAreas(@Context SecurityContext securityContext,
                                   @PathParam("tokenId") String tokenId,
                                   UpdateTokenAreasRequest request) {
    Principals.requireAdmin(securityContext);
    if (request == null) {
      throw PairingException.validation("Request body is required", "assignedAreas");
    }
    return WireMapper.toResponse(clientTokenManager.updateTokenAreas(tokenId, request.assignedAreas()));
  }
}
