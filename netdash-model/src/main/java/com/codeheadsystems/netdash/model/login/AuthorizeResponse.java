package com.codeheadsystems.netdash.model.login;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of an application registration request.
 * <p>
 * Used by: {@code POST /login/authorize/} response
 *
 * @param appToken long-lived application secret; only becomes usable once the request is granted
 * @param trackId  identifier to poll the registration status with
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthorizeResponse(
    @JsonProperty("app_token") String appToken,
    @JsonProperty("track_id") Integer trackId) {
}
