package com.codeheadsystems.netdash.client.model;

import java.util.Locale;

/**
 * Status of a pending application registration as reported by the device.
 */
public enum RegistrationStatus {
  UNKNOWN,
  PENDING,
  TIMEOUT,
  GRANTED,
  DENIED;

  /**
   * Parses the device's lowercase status string.  Anything unrecognized maps to {@link #UNKNOWN}.
   *
   * @param value the wire value
   * @return the status
   */
  public static RegistrationStatus fromWire(String value) {
    if (value == null) {
      return UNKNOWN;
    }
    try {
      return valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return UNKNOWN;
    }
  }

  /**
   * The lowercase wire value.
   *
   * @return the wire value
   */
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Whether the device will never grant this registration any more.
   *
   * @return true for {@link #DENIED} and {@link #TIMEOUT}
   */
  public boolean isFinalRefusal() {
    return this == DENIED || this == TIMEOUT;
  }
}
