package com.codeheadsystems.netdash.client.exceptions;

/**
 * Login or password computation was attempted before any application token was stored.
 * Raised before any network call is made.
 */
public class MissingCredentialException extends DeviceAuthException {

  /**
   * Instantiates a new Missing credential exception.
   *
   * @param message the message
   */
  public MissingCredentialException(final String message) {
    super(message);
  }
}
