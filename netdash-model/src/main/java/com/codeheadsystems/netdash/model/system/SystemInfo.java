package com.codeheadsystems.netdash.model.system;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * General device status.
 * <p>
 * Used by: {@code GET /system/} response
 *
 * @param firmwareVersion  the firmware version
 * @param mac              the device MAC address
 * @param serial           the serial number
 * @param uptime           human-readable uptime
 * @param uptimeSeconds    uptime in seconds
 * @param boardName        the board name
 * @param boxAuthenticated whether the device is authenticated against the operator network
 * @param diskStatus       internal disk status
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SystemInfo(
    @JsonProperty("firmware_version") String firmwareVersion,
    @JsonProperty("mac") String mac,
    @JsonProperty("serial") String serial,
    @JsonProperty("uptime") String uptime,
    @JsonProperty("uptime_val") Long uptimeSeconds,
    @JsonProperty("board_name") String boardName,
    @JsonProperty("box_authenticated") Boolean boxAuthenticated,
    @JsonProperty("disk_status") String diskStatus) {
}
