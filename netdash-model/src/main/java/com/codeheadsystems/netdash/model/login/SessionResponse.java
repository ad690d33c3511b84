package com.codeheadsystems.netdash.model.login;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * A freshly opened session.
 * <p>
 * Used by: {@code POST /login/session/} response
 *
 * @param sessionToken token to send in {@code X-Fbx-App-Auth} on authenticated calls
 * @param challenge    the next challenge
 * @param permissions  permission name to granted flag, e.g. {@code settings -> true}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionResponse(
    @JsonProperty("session_token") String sessionToken,
    @JsonProperty("challenge") String challenge,
    @JsonProperty("permissions") Map<String, Boolean> permissions) {
}
