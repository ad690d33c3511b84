package com.codeheadsystems.netdash.client.exceptions;

/**
 * The credential file could not be written or removed.
 */
public class CredentialStoreException extends RuntimeException {

  /**
   * Instantiates a new Credential store exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CredentialStoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
