package com.codeheadsystems.netdash.client.manager;

import com.codeheadsystems.netdash.client.model.ApiError;

/**
 * Told when the device rejected the session of a call.  The session has already been cleared;
 * the listener decides whether to log in again.
 */
@FunctionalInterface
public interface SessionExpiredListener {

  /**
   * Called on the caller's thread after the session was cleared.
   *
   * @param method the method of the rejected call
   * @param path   the path of the rejected call
   * @param error  the error the device answered with
   */
  void onSessionExpired(String method, String path, ApiError error);
}
