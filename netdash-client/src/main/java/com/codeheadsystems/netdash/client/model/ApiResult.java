package com.codeheadsystems.netdash.client.model;

import com.codeheadsystems.netdash.model.api.ApiEnvelope;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Outcome of one device call: either a payload or an {@link ApiError}, never both.
 * <p>
 * This is what the transport and the request coordinator hand around internally; it becomes an
 * {@link ApiEnvelope} only at the facade.
 *
 * @param result the payload, {@link NullNode} for successful calls without one, null on failure
 * @param error  the error, null on success
 */
public record ApiResult(JsonNode result, ApiError error) {

  public ApiResult {
    if (error == null && result == null) {
      result = NullNode.getInstance();
    }
    if (error != null && result != null) {
      throw new IllegalArgumentException("A failed result carries no payload");
    }
  }

  public static ApiResult success(JsonNode result) {
    return new ApiResult(result, null);
  }

  public static ApiResult failure(ApiError error) {
    return new ApiResult(null, error);
  }

  public boolean isSuccess() {
    return error == null;
  }

  public boolean isTimeout() {
    return error != null && error.isTimeout();
  }

  /**
   * Whether the call succeeded and carried a non-null payload.
   *
   * @return true when a payload is present
   */
  public boolean hasResult() {
    return error == null && !result.isNull() && !result.isMissingNode();
  }

  /**
   * Converts to the wire envelope.
   *
   * @return the envelope
   */
  public ApiEnvelope<JsonNode> toEnvelope() {
    if (error != null) {
      return error.toEnvelope();
    }
    return ApiEnvelope.success(hasResult() ? result : null);
  }
}
