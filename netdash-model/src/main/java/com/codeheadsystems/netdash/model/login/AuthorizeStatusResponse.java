package com.codeheadsystems.netdash.model.login;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Progress of a pending application registration.
 * <p>
 * Used by: {@code GET /login/authorize/{track_id}} response
 *
 * @param status       one of {@code unknown}, {@code pending}, {@code timeout}, {@code granted},
 *                     {@code denied}
 * @param challenge    current login challenge, when the device includes one
 * @param passwordSalt salt of the device's own admin password, unused by this client
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthorizeStatusResponse(
    @JsonProperty("status") String status,
    @JsonProperty("challenge") String challenge,
    @JsonProperty("password_salt") String passwordSalt) {
}
