package com.codeheadsystems.netdash.model.wifi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Global Wi-Fi switch.
 * <p>
 * Used by: {@code GET /wifi/config/} response
 *
 * @param enabled        whether Wi-Fi is on
 * @param macFilterState disabled, whitelist or blacklist
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WifiConfig(
    @JsonProperty("enabled") Boolean enabled,
    @JsonProperty("mac_filter_state") String macFilterState) {
}
