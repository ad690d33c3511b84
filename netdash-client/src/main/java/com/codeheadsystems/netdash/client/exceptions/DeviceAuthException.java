package com.codeheadsystems.netdash.client.exceptions;

/**
 * A step of the registration or login protocol was refused or could not be completed.
 */
public class DeviceAuthException extends RuntimeException {

  /**
   * Instantiates a new Device auth exception.
   *
   * @param message the message
   */
  public DeviceAuthException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Device auth exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DeviceAuthException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
