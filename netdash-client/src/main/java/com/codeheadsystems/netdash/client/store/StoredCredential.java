package com.codeheadsystems.netdash.client.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * On-disk form of the credential file.
 *
 * @param appToken the app token
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record StoredCredential(@JsonProperty("appToken") String appToken) {
}
