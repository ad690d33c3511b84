package com.codeheadsystems.netdash.model.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for the uniform response wrapper returned by every router API call.
 * <p>
 * The device answers {@code {"success": true, "result": ...}} on success and
 * {@code {"success": false, "error_code": "...", "msg": "..."}} on failure.  An
 * {@code insufficient_rights} failure additionally names the permission in {@code missing_right}.
 * <p>
 * The client reproduces this same shape for failures it synthesizes itself (timeouts,
 * connection errors, non-JSON bodies) so callers only ever deal with one type.  The
 * {@code timeout} flag is never sent by the device; it is only written when the client gave up
 * waiting for an answer.
 *
 * @param success      whether the call succeeded
 * @param result       the call's payload, absent on failure and on some write calls
 * @param errorCode    machine-readable error code such as {@code auth_required}
 * @param message      human-readable error message
 * @param missingRight the permission the session lacks, only with {@code insufficient_rights}
 * @param timeout      true when the client abandoned the request at its deadline
 * @param <T>          the payload type
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiEnvelope<T>(
    @JsonProperty("success") boolean success,
    @JsonProperty("result") T result,
    @JsonProperty("error_code") String errorCode,
    @JsonProperty("msg") String message,
    @JsonProperty("missing_right") String missingRight,
    @JsonProperty("timeout") @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean timeout) {

  /**
   * Successful envelope carrying the given payload.
   *
   * @param result the payload, may be null
   * @param <T>    the payload type
   * @return the envelope
   */
  public static <T> ApiEnvelope<T> success(T result) {
    return new ApiEnvelope<>(true, result, null, null, null, false);
  }

  /**
   * Failed envelope with an error code and message.
   *
   * @param errorCode the error code
   * @param message   the message
   * @param <T>       the payload type
   * @return the envelope
   */
  public static <T> ApiEnvelope<T> failure(String errorCode, String message) {
    return new ApiEnvelope<>(false, null, errorCode, message, null, false);
  }
}
