package com.codeheadsystems.netdash.client.accessor;

/**
 * Paths of the router API used by this client, relative to {@code /api/{version}} unless noted.
 */
public final class DeviceEndpoints {

  /** Served at the base URL itself, outside the versioned API. */
  public static final String API_VERSION = "/api_version";

  public static final String LOGIN = "/login/";
  public static final String LOGIN_AUTHORIZE = "/login/authorize/";
  public static final String LOGIN_SESSION = "/login/session/";
  public static final String LOGIN_LOGOUT = "/login/logout/";

  public static final String SYSTEM = "/system/";
  public static final String SYSTEM_REBOOT = "/system/reboot/";
  public static final String CONNECTION = "/connection/";
  public static final String WIFI_CONFIG = "/wifi/config/";
  public static final String DHCP_DYNAMIC_LEASES = "/dhcp/dynamic_lease/";
  public static final String DHCP_STATIC_LEASES = "/dhcp/static_lease/";
  public static final String PORT_FORWARDING = "/fw/redir/";
  public static final String LAN_BROWSER_PUB = "/lan/browser/pub/";

  private DeviceEndpoints() {
  }

  /**
   * Path to poll a pending registration.
   *
   * @param trackId the track id
   * @return the path
   */
  public static String authorizeStatus(int trackId) {
    return LOGIN_AUTHORIZE + trackId;
  }
}
