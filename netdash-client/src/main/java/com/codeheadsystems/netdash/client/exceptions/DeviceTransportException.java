package com.codeheadsystems.netdash.client.exceptions;

/**
 * The transport to the device could not be set up, e.g. an unreadable CA certificate.
 * Requests themselves never raise it; their failures come back as results.
 */
public class DeviceTransportException extends RuntimeException {

  /**
   * Instantiates a new Device transport exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DeviceTransportException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
