package com.codeheadsystems.netdash.model.dhcp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One DHCP lease.
 * <p>
 * Used by: {@code GET /dhcp/dynamic_lease/} response (as a list)
 *
 * @param mac            client MAC address
 * @param hostname       client host name
 * @param ip             leased address
 * @param leaseRemaining seconds until the lease expires
 * @param assignTime     assignment time, epoch seconds
 * @param refreshTime    last refresh time, epoch seconds
 * @param isStatic       whether a static lease exists for the client
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DhcpLease(
    @JsonProperty("mac") String mac,
    @JsonProperty("hostname") String hostname,
    @JsonProperty("ip") String ip,
    @JsonProperty("lease_remaining") Long leaseRemaining,
    @JsonProperty("assign_time") Long assignTime,
    @JsonProperty("refresh_time") Long refreshTime,
    @JsonProperty("is_static") Boolean isStatic) {
}
