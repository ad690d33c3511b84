package com.codeheadsystems.netdash.model.connection;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * State of the WAN link.  Rates are in bytes per second, bandwidths in bits per second.
 * <p>
 * Used by: {@code GET /connection/} response
 *
 * @param type          ethernet, rfc2684, pppoatm
 * @param state         going_up, up, going_down, down
 * @param media         ftth, xdsl, backup_4g
 * @param ipv4          public IPv4 address
 * @param ipv6          public IPv6 address
 * @param rateDown      current download rate
 * @param rateUp        current upload rate
 * @param bandwidthDown available download bandwidth
 * @param bandwidthUp   available upload bandwidth
 * @param bytesDown     total bytes received
 * @param bytesUp       total bytes sent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConnectionStatus(
    @JsonProperty("type") String type,
    @JsonProperty("state") String state,
    @JsonProperty("media") String media,
    @JsonProperty("ipv4") String ipv4,
    @JsonProperty("ipv6") String ipv6,
    @JsonProperty("rate_down") Long rateDown,
    @JsonProperty("rate_up") Long rateUp,
    @JsonProperty("bandwidth_down") Long bandwidthDown,
    @JsonProperty("bandwidth_up") Long bandwidthUp,
    @JsonProperty("bytes_down") Long bytesDown,
    @JsonProperty("bytes_up") Long bytesUp) {

  public boolean isUp() {
    return "up".equals(state);
  }
}
