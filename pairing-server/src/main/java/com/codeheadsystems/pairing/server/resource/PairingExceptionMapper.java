package com.codeheadsystems.pairing.server.resource;

import com.codeheadsystems.pairing.model.ErrorResponse;
import com.codeheadsystems.pairing.server.exception.ErrorKind;
import com.codeheadsystems.pairing.server.exception.PairingException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps {@link PairingException} to a status code and an {@link ErrorResponse} body.
 * AUTHENTICATION and INTERNAL failures always carry a fixed message so nothing about the
 * cause reaches the caller.
 */
@Provider
public class PairingExceptionMapper implements ExceptionMapper<PairingException> {

  private static final Logger log = LoggerFactory.getLogger(PairingExceptionMapper.class);

  /**
   * HTTP status for an error kind.
   *
   * @param kind the kind
   * @return the status code
   */
  public static int statusFor(ErrorKind kind) {
    return switch (kind) {
      case VALIDATION -> 400;
      case AUTHENTICATION -> 401;
      case FORBIDDEN -> 403;
      case NOT_FOUND -> 404;
      case CONFLICT -> 409;
      case INTERNAL -> 500;
    };
  }

  @Override
  public Response toResponse(PairingException exception) {
    ErrorKind kind = exception.kind();
    String message = switch (kind) {
      case AUTHENTICATION -> "Authentication required";
      case INTERNAL -> "Internal server error";
      default -> exception.getMessage();
    };
    if (kind == ErrorKind.INTERNAL) {
      log.error("Internal failure: {}", exception.getMessage(), exception);
    } else {
      log.debug("{}: {}", kind, exception.getMessage());
    }
    return Response.status(statusFor(kind))
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(kind.name(), message, exception.field()))
        .build();
  }
}
