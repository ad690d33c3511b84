package com.codeheadsystems.netdash.client.manager;

import com.codeheadsystems.netdash.client.accessor.DeviceEndpoints;
import java.util.List;

/**
 * Endpoint families that the slow hardware generation answers measurably slower than the rest
 * of its API.  Matched by substring so sub-resources ({@code /dhcp/static_lease/12}) count too.
 */
public final class SlowEndpoints {

  public static final List<String> PATH_FRAGMENTS = List.of(
      DeviceEndpoints.DHCP_DYNAMIC_LEASES,
      DeviceEndpoints.DHCP_STATIC_LEASES,
      DeviceEndpoints.PORT_FORWARDING,
      DeviceEndpoints.LAN_BROWSER_PUB);

  private SlowEndpoints() {
  }

  /**
   * Whether the path belongs to a slow endpoint family.
   *
   * @param path the path
   * @return true when slow
   */
  public static boolean matches(String path) {
    if (path == null) {
      return false;
    }
    for (String fragment : PATH_FRAGMENTS) {
      if (path.contains(fragment)) {
        return true;
      }
    }
    return false;
  }
}
