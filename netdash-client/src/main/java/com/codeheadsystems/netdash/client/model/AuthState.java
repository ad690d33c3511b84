package com.codeheadsystems.netdash.client.model;

/**
 * Where the client stands in the registration and login protocol.
 */
public enum AuthState {
  /** No application token is stored. */
  UNREGISTERED,
  /** A token was issued but the registration has not been accepted on the device yet. */
  PENDING_APPROVAL,
  /** A usable token is stored and no session is open. */
  REGISTERED,
  /** A session is open. */
  AUTHENTICATED
}
