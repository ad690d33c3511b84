package com.codeheadsystems.netdash.client.accessor;

import com.codeheadsystems.netdash.client.model.HttpMethod;
import java.time.Duration;
import java.util.Objects;

/**
 * One request to the device.
 *
 * @param method       the http method
 * @param path         the path; relative to {@code /api/{version}} when {@code versioned}, else to
 *                     the base URL
 * @param body         the JSON body, null for none
 * @param sessionToken the session token to authenticate with, null for an unauthenticated call
 * @param timeout      the deadline for the whole exchange
 * @param versioned    whether the path lives under the versioned API root and answers with an
 *                     envelope
 */
public record TransportRequest(HttpMethod method,
                               String path,
                               Object body,
                               String sessionToken,
                               Duration timeout,
                               boolean versioned) {

  public TransportRequest {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(timeout, "timeout");
  }

  /**
   * A request to an endpoint of the versioned API.
   *
   * @param method       the method
   * @param path         the path, e.g. {@code /system/}
   * @param body         the body
   * @param sessionToken the session token, null when unauthenticated
   * @param timeout      the timeout
   * @return the transport request
   */
  public static TransportRequest api(HttpMethod method, String path, Object body,
                                     String sessionToken, Duration timeout) {
    return new TransportRequest(method, path, body, sessionToken, timeout, true);
  }

  /**
   * An unauthenticated GET outside the versioned API whose body is not wrapped in an envelope.
   *
   * @param path    the path, e.g. {@code /api_version}
   * @param timeout the timeout
   * @return the transport request
   */
  public static TransportRequest raw(String path, Duration timeout) {
    return new TransportRequest(HttpMethod.GET, path, null, null, timeout, false);
  }

  public boolean authenticated() {
    return sessionToken != null;
  }

  @Override
  public String toString() {
    return "TransportRequest[" + method + " " + path + ", authenticated=" + authenticated()
        + ", timeout=" + timeout.toMillis() + "ms]";
  }
}
