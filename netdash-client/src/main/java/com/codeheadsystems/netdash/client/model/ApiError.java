package com.codeheadsystems.netdash.client.model;

import com.codeheadsystems.netdash.model.api.ApiEnvelope;
import java.util.Objects;

/**
 * A classified failure of a device call.
 *
 * @param kind         the failure class
 * @param errorCode    the wire error code
 * @param message      human-readable message
 * @param missingRight the missing permission, only for {@link ApiErrorKind#INSUFFICIENT_RIGHTS}
 */
public record ApiError(ApiErrorKind kind, String errorCode, String message, String missingRight) {

  public static final String REQUEST_FAILED = "request_failed";
  public static final String INVALID_RESPONSE = "invalid_response";
  public static final String INVALID_REQUEST = "invalid_request";
  public static final String AUTH_REQUIRED = "auth_required";
  public static final String INVALID_SESSION = "invalid_session";
  public static final String INSUFFICIENT_RIGHTS = "insufficient_rights";
  public static final String DEPRECATED = "deprecated";

  public ApiError {
    Objects.requireNonNull(kind, "kind");
  }

  public static ApiError timeout(String message) {
    return new ApiError(ApiErrorKind.TIMEOUT, REQUEST_FAILED, message, null);
  }

  public static ApiError network(String message) {
    return new ApiError(ApiErrorKind.NETWORK, REQUEST_FAILED, message, null);
  }

  public static ApiError malformed(String message) {
    return new ApiError(ApiErrorKind.MALFORMED_RESPONSE, INVALID_RESPONSE, message, null);
  }

  /**
   * Classifies a failed envelope received from the device.
   *
   * @param envelope the envelope, expected to have {@code success == false}
   * @return the api error
   */
  public static ApiError fromEnvelope(ApiEnvelope<?> envelope) {
    String code = envelope.errorCode();
    return new ApiError(classify(code), code, envelope.message(), envelope.missingRight());
  }

  /**
   * Maps a device error code to its failure class.
   *
   * @param errorCode the error code, may be null
   * @return the kind
   */
  public static ApiErrorKind classify(String errorCode) {
    if (errorCode == null) {
      return ApiErrorKind.APPLICATION_ERROR;
    }
    return switch (errorCode) {
      case AUTH_REQUIRED, INVALID_SESSION -> ApiErrorKind.SESSION_EXPIRED;
      case INSUFFICIENT_RIGHTS -> ApiErrorKind.INSUFFICIENT_RIGHTS;
      case DEPRECATED -> ApiErrorKind.DEPRECATED;
      case INVALID_RESPONSE -> ApiErrorKind.MALFORMED_RESPONSE;
      default -> ApiErrorKind.APPLICATION_ERROR;
    };
  }

  public boolean isTimeout() {
    return kind == ApiErrorKind.TIMEOUT;
  }

  public boolean isSessionExpired() {
    return kind == ApiErrorKind.SESSION_EXPIRED;
  }

  /**
   * The best message to show for this error: the message, else the code, else the fallback.
   *
   * @param fallback the fallback
   * @return the description
   */
  public String describe(String fallback) {
    if (message != null && !message.isEmpty()) {
      return message;
    }
    if (errorCode != null && !errorCode.isEmpty()) {
      return errorCode;
    }
    return fallback;
  }

  /**
   * Converts to the wire envelope.
   *
   * @param <T> the payload type
   * @return the failed envelope
   */
  public <T> ApiEnvelope<T> toEnvelope() {
    return new ApiEnvelope<>(false, null, errorCode, message, missingRight, isTimeout());
  }
}
