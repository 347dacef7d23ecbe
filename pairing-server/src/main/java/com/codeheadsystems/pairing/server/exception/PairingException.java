package com.codeheadsystems.pairing.server.exception;

/**
 * The single failure type raised by pairing, credential and client operations.
 * <p>
 * Framework adapters translate {@link #kind()} into a status code; callers inside the core
 * never need to inspect the message.
 */
public class PairingException extends RuntimeException {

  private final ErrorKind kind;
  private final String field;

  /**
   * Instantiates a new Pairing exception.
   *
   * @param kind    the kind
   * @param message the message
   * @param field   the offending field, or null
   * @param cause   the cause, or null
   */
  public PairingException(ErrorKind kind, String message, String field, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.field = field;
  }

  /**
   * Validation failure on a request field.
   *
   * @param message the message
   * @param field   the field name
   * @return the pairing exception
   */
  public static PairingException validation(String message, String field) {
    return new PairingException(ErrorKind.VALIDATION, message, field, null);
  }

  /**
   * Not found pairing exception.
   *
   * @param message the message
   * @return the pairing exception
   */
  public static PairingException notFound(String message) {
    return new PairingException(ErrorKind.NOT_FOUND, message, null, null);
  }

  /**
   * Authentication pairing exception. The message is for server-side logs only.
   *
   * @param message the message
   * @return the pairing exception
   */
  public static PairingException authentication(String message) {
    return new PairingException(ErrorKind.AUTHENTICATION, message, null, null);
  }

  /**
   * Forbidden pairing exception.
   *
   * @param message the message
   * @return the pairing exception
   */
  public static PairingException forbidden(String message) {
    return new PairingException(ErrorKind.FORBIDDEN, message, null, null);
  }

  /**
   * Conflict pairing exception.
   *
   * @param message the message
   * @return the pairing exception
   */
  public static PairingException conflict(String message) {
    return new PairingException(ErrorKind.CONFLICT, message, null, null);
  }

  /**
   * Internal pairing exception.
   *
   * @param message the message
   * @param cause   the cause
   * @return the pairing exception
   */
  public static PairingException internal(String message, Throwable cause) {
    return new PairingException(ErrorKind.INTERNAL, message, null, cause);
  }

  /**
   * Kind error kind.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * The request field that failed validation, or null.
   *
   * @return the field
   */
  public String field() {
    return field;
  }
}
