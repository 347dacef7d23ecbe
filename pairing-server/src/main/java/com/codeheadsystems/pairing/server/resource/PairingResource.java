package com.codeheadsystems.pairing.server.resource;

import com.codeheadsystems.pairing.model.pairing.CompletePairingRequest;
import com.codeheadsystems.pairing.model.pairing.CompletePairingResponse;
import com.codeheadsystems.pairing.model.pairing.CreatePairingResponse;
import com.codeheadsystems.pairing.model.pairing.PairingStatusResponse;
import com.codeheadsystems.pairing.model.pairing.VerifyPinRequest;
import com.codeheadsystems.pairing.model.pairing.VerifyPinResponse;
import com.codeheadsystems.pairing.server.exception.PairingException;
import com.codeheadsystems.pairing.server.manager.PairingResult;
import com.codeheadsystems.pairing.server.manager.PairingSessionManager;
import com.codeheadsystems.pairing.server.store.PairingSession;
import jakarta.annotation.security.PermitAll;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for the pairing flow.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /api/pairing/create}        (admin) open a session, returns the PIN</li>
 *   <li>{@code POST /api/pairing/{id}/verify}   (public) device submits the PIN</li>
 *   <li>{@code POST /api/pairing/{id}/complete} (admin) approve, returns the credential</li>
 *   <li>{@code GET /api/pairing/{id}}           (public) status, never the PIN</li>
 *   <li>{@code DELETE /api/pairing/{id}}        (admin) cancel</li>
 * </ul>
 * Methods marked {@link PermitAll} require a bearer credential; the admin check is done here.
 */
@Path("/api/pairing")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class PairingResource {

  private static final Logger log = LoggerFactory.getLogger(PairingResource.class);

  private final PairingSessionManager pairingSessionManager;

  /**
   * Instantiates a new Pairing resource.
   *
   * @param pairingSessionManager the pairing session manager
   */
  public PairingResource(PairingSessionManager pairingSessionManager) {
    this.pairingSessionManager = pairingSessionManager;
  }

  @POST
  @Path("/create")
  @PermitAll
  public CreatePairingResponse create(@Context SecurityContext securityContext) {
    Principals.requireAdmin(securityContext);
    PairingSession session = pairingSessionManager.createSession();
    return new CreatePairingResponse(session.id(), session.pin(), WireMapper.iso(session.expiresAt()));
  }

  @POST
  @Path("/{id}/verify")
  public VerifyPinResponse verify(@PathParam("id") String id, VerifyPinRequest request) {
    log.debug("verify(session={})", id);
    if (request == null) {
      throw PairingException.validation("Request body is required", "pin");
    }
    PairingSession session = pairingSessionManager.verifyPin(
        id, request.pin(), request.deviceName(), request.deviceType());
    return new VerifyPinResponse(session.id(), session.status().wireName(), session.deviceName(),
        WireMapper.wire(session.deviceType()), "PIN verified. Waiting for administrator approval.");
  }

  @POST
  @Path("/{id}/complete")
  @PermitAll
  public CompletePairingResponse complete(@Context SecurityContext securityContext,
                                          @PathParam("id") String id,
                                          CompletePairingRequest request) {
    Principals.requireAdmin(securityContext);
    if (request == null) {
      throw PairingException.validation("Request body is required", "clientName");
    }
    PairingResult result = pairingSessionManager.completePairing(
        id, request.clientName(), request.assignedAreas());
    return new CompletePairingResponse(
        result.client().id(),
        result.client().name(),
        result.credential().credential(),
        result.credential().token().assignedAreas(),
        WireMapper.iso(result.credential().token().expiresAt()));
  }

  @GET
  @Path("/{id}")
  public PairingStatusResponse status(@PathParam("id") String id) {
    PairingSession session = pairingSessionManager.getSession(id);
    return new PairingStatusResponse(
        session.id(),
        pairingSessionManager.effectiveStatus(session).wireName(),
        session.deviceName(),
        WireMapper.wire(session.deviceType()),
        WireMapper.iso(session.expiresAt()),
        WireMapper.iso(session.createdAt()));
  }

  @DELETE
  @Path("/{id}")
  @PermitAll
  public Response cancel(@Context SecurityContext securityContext, @PathParam("id") String id) {
    Principals.requireAdmin(securityContext);
    pairingSessionManager.cancelSession(id);
    return Response.noContent().build();
  }
}
