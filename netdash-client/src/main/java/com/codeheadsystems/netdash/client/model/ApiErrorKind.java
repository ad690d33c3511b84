package com.codeheadsystems.netdash.client.model;

/**
 * Classes of failure a device call can end in.
 */
public enum ApiErrorKind {
  /** DNS failure, refused or reset connection. */
  NETWORK,
  /** The request deadline expired.  The only kind that can be retried. */
  TIMEOUT,
  /** The body was not JSON or could not be parsed. */
  MALFORMED_RESPONSE,
  /** {@code auth_required} or {@code invalid_session}: the session is gone. */
  SESSION_EXPIRED,
  /** {@code insufficient_rights}: the session lacks a permission. */
  INSUFFICIENT_RIGHTS,
  /** {@code deprecated}: the endpoint was withdrawn from this API version. */
  DEPRECATED,
  /** Any other failure reported by the device. */
  APPLICATION_ERROR
}
