package com.codeheadsystems.pairing.server.resource;

import com.codeheadsystems.pairing.model.client.ClientResponse;
import com.codeheadsystems.pairing.model.client.UpdateClientRequest;
import com.codeheadsystems.pairing.server.auth.ClientPrincipal;
import com.codeheadsystems.pairing.server.exception.PairingException;
import com.codeheadsystems.pairing.server.manager.ClientManager;
import jakarta.annotation.security.PermitAll;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import java.util.List;

/**
 * JAX-RS resource for paired clients. Every route requires a bearer credential; all but
 * {@code GET /api/clients/me} and {@code GET /api/clients/me/areas/{areaId}} require an
 * administrator.
 */
@Path("/api/clients")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ClientResource {

  private final ClientManager clientManager;

  /**
   * Instantiates a new Client resource.
   *
   * @param clientManager the client manager
   */
  public ClientResource(ClientManager clientManager) {
    this.clientManager = clientManager;
  }

  @GET
  @PermitAll
  public List<ClientResponse> list(@Context SecurityContext securityContext) {
    Principals.requireAdmin(securityContext);
    return clientManager.listActiveClients().stream().map(WireMapper::toResponse).toList();
  }

  @GET
  @Path("/me")
  @PermitAll
  public ClientResponse me(@Context SecurityContext securityContext) {
    ClientPrincipal principal = Principals.requireClient(securityContext);
    return WireMapper.toResponse(clientManager.getClient(principal.clientId()));
  }

  /**
   * Area access check for area-scoped handlers: 204 if the caller's credential covers the
   * area, 403 if not. Administrators cover every area.
   *
   * @param securityContext the security context
   * @param areaId          the area id
   * @return an empty response
   */
  @GET
  @Path("/me/areas/{areaId}")
  @PermitAll
  public Response checkArea(@Context SecurityContext securityContext, @PathParam("areaId") String areaId) {
    Principals.requireArea(securityContext, areaId);
    return Response.noContent().build();
  }

  @GET
  @Path("/{id}")
  @PermitAll
  public ClientResponse get(@Context SecurityContext securityContext, @PathParam("id") String id) {
    Principals.requireAdmin(securityContext);
    return WireMapper.toResponse(clientManager.getClient(id));
  }

  @PUT
  @Path("/{id}")
  @PermitAll
  public ClientResponse update(@Context SecurityContext securityContext,
                               @PathParam("id") String id,
                               UpdateClientRequest request) {
    Principals.requireAdmin(securityContext);
    if (request == null) {
      throw PairingException.validation("Request body is required", "name");
    }
    return WireMapper.toResponse(clientManager.updateClient(id, request.name(), request.assignedAreas()));
  }

  @DELETE
  @Path("/{id}")
  @PermitAll
  public Response delete(@Context SecurityContext securityContext, @PathParam("id") String id) {
    Principals.requireAdmin(securityContext);
    clientManager.deleteClient(id);
    return Response.noContent().build();
  }
}
