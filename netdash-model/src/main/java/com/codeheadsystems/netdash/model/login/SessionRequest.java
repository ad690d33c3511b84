package com.codeheadsystems.netdash.model.login;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Session opening request.  The password is the lowercase hex HMAC-SHA1 of the current
 * challenge keyed by the application token; the token itself never leaves the client.
 * <p>
 * Used by: {@code POST /login/session/}
 *
 * @param appId      application identifier used at registration
 * @param appVersion application version
 * @param password   challenge response
 */
public record SessionRequest(
    @JsonProperty("app_id") String appId,
    @JsonProperty("app_version") String appVersion,
    @JsonProperty("password") String password) {
}
