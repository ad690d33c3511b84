package com.codeheadsystems.netdash.client.model;

import java.util.Objects;

/**
 * Identity of a logical operation for request deduplication: method plus path.
 * <p>
 * The request body is deliberately not part of the key, so two writes with different payloads
 * to the same path coalesce while one of them is in flight.
 *
 * @param method the http method
 * @param path   the API path, relative to the versioned API root
 */
public record OperationKey(HttpMethod method, String path) {

  public OperationKey {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(path, "path");
  }

  /**
   * Of operation key.
   *
   * @param method the method
   * @param path   the path
   * @return the operation key
   */
  public static OperationKey of(HttpMethod method, String path) {
    return new OperationKey(method, path);
  }

  @Override
  public String toString() {
    return method + ":" + path;
  }
}
