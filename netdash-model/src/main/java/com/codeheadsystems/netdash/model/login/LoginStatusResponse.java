package com.codeheadsystems.netdash.model.login;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Login status.  Called without a session it hands out a fresh challenge; called with a
 * session token it reports whether that session is still alive.
 * <p>
 * Used by: {@code GET /login/} response
 *
 * @param loggedIn     whether the presented session token is valid
 * @param challenge    the challenge to answer in the next login
 * @param passwordSalt salt of the device's own admin password, unused by this client
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LoginStatusResponse(
    @JsonProperty("logged_in") boolean loggedIn,
    @JsonProperty("challenge") String challenge,
    @JsonProperty("password_salt") String passwordSalt) {
}
