package com.codeheadsystems.netdash.model.login;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Application registration request.  The device shows a prompt on its front panel and the
 * request stays pending until someone accepts or refuses it there.
 * <p>
 * Used by: {@code POST /login/authorize/}
 *
 * @param appId      stable application identifier
 * @param appName    human-readable application name shown on the device
 * @param appVersion application version
 * @param deviceName name of the machine the application runs on
 */
public record AuthorizeRequest(
    @JsonProperty("app_id") String appId,
    @JsonProperty("app_name") String appName,
    @JsonProperty("app_version") String appVersion,
    @JsonProperty("device_name") String deviceName) {
}
