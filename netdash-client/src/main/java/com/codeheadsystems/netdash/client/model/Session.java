package com.codeheadsystems.netdash.client.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An open session on the device.  Never persisted.
 *
 * @param sessionToken the token sent in {@code X-Fbx-App-Auth}
 * @param challenge    the challenge returned with the session
 * @param permissions  permission name to granted flag
 */
public record Session(String sessionToken, String challenge, Map<String, Boolean> permissions) {

  public Session {
    permissions = permissions == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(permissions));
  }

  /**
   * Whether the session was granted the named permission.
   *
   * @param permission the permission, e.g. {@code settings}
   * @return true when granted
   */
  public boolean hasPermission(String permission) {
    return Boolean.TRUE.equals(permissions.get(permission));
  }

  @Override
  public String toString() {
    return "Session[sessionToken=***, permissions=" + permissions + "]";
  }
}
