package com.codeheadsystems.netdash.client.manager;

import com.codeheadsystems.netdash.client.accessor.DeviceEndpoints;
import com.codeheadsystems.netdash.client.accessor.DeviceTransport;
import com.codeheadsystems.netdash.client.exceptions.MissingCredentialException;
import com.codeheadsystems.netdash.client.model.ApiError;
import com.codeheadsystems.netdash.client.model.ApiResult;
import com.codeheadsystems.netdash.client.model.Credential;
import com.codeheadsystems.netdash.client.model.HttpMethod;
import com.codeheadsystems.netdash.client.model.RegistrationStatus;
import com.codeheadsystems.netdash.client.model.RegistrationTicket;
import com.codeheadsystems.netdash.client.model.Session;
import com.codeheadsystems.netdash.model.api.ApiEnvelope;
import com.codeheadsystems.netdash.model.api.ApiVersionInfo;
import com.codeheadsystems.netdash.model.connection.ConnectionStatus;
import com.codeheadsystems.netdash.model.dhcp.DhcpLease;
import com.codeheadsystems.netdash.model.system.SystemInfo;
import com.codeheadsystems.netdash.model.wifi.WifiConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the client.  Every API call goes through {@link #execute}: the device is
 * identified if needed, the current session token is attached, and the call is handed to the
 * {@link RequestCoordinator}.  Calls never throw; the outcome is always an {@link ApiEnvelope}.
 * <p>
 * A call rejected with {@code auth_required} or {@code invalid_session} clears the session and
 * notifies the {@link SessionExpiredListener}s.  The call itself is not retried.
 */
@Singleton
public class DeviceClientManager {

  private static final Logger log = LoggerFactory.getLogger(DeviceClientManager.class);

  private final DeviceTransport transport;
  private final DeviceProfile profile;
  private final RequestCoordinator coordinator;
  private final SessionAuthenticator authenticator;
  private final ObjectMapper objectMapper;
  private final List<SessionExpiredListener> listeners = new CopyOnWriteArrayList<>();

  /**
   * Instantiates a new Device client manager.
   *
   * @param transport     the transport
   * @param profile       the device profile
   * @param coordinator   the request coordinator
   * @param authenticator the session authenticator
   * @param objectMapper  the object mapper
   */
  @Inject
  public DeviceClientManager(final DeviceTransport transport,
                             final DeviceProfile profile,
                             final RequestCoordinator coordinator,
                             final SessionAuthenticator authenticator,
                             final ObjectMapper objectMapper) {
    log.info("DeviceClientManager({})", transport.baseUrl());
    this.transport = transport;
    this.profile = profile;
    this.coordinator = coordinator;
    this.authenticator = authenticator;
    this.objectMapper = objectMapper;
  }

  // ── Generic calls ─────────────────────────────────────────────────────────

  /**
   * Executes an API call with the current session.
   *
   * @param method the method
   * @param path   the path under the versioned API root, e.g. {@code /system/}
   * @param body   the body, null for none
   * @return the envelope
   */
  public ApiEnvelope<JsonNode> execute(HttpMethod method, String path, Object body) {
    return call(method, path, body).toEnvelope();
  }

  /**
   * Executes an API call and maps the result.  A result that does not map to the type comes
   * back as an {@code invalid_response} failure.
   *
   * @param method the method
   * @param path   the path
   * @param body   the body
   * @param type   the result type
   * @param <T>    the result type
   * @return the envelope
   */
  public <T> ApiEnvelope<T> execute(HttpMethod method, String path, Object body, Class<T> type) {
    return convert(call(method, path, body), objectMapper.constructType(type));
  }

  /**
   * Executes an API call and maps the result to a generic type.
   *
   * @param method the method
   * @param path   the path
   * @param body   the body
   * @param type   the result type
   * @param <T>    the result type
   * @return the envelope
   */
  public <T> ApiEnvelope<T> execute(HttpMethod method, String path, Object body, TypeReference<T> type) {
    return convert(call(method, path, body), objectMapper.constructType(type));
  }

  public void addSessionExpiredListener(SessionExpiredListener listener) {
    listeners.add(listener);
  }

  private ApiResult call(HttpMethod method, String path, Object body) {
    profile.ensureLoaded();
    final String token = authenticator.sessionToken().orElse(null);
    log.debug("execute({} {}, authenticated={})", method, path, token != null);
    final ApiResult result = coordinator.execute(method, path, body, token);
    if (!result.isSuccess() && result.error().isSessionExpired()) {
      onSessionExpired(method, path, token, result.error());
    }
    return result;
  }

  private void onSessionExpired(HttpMethod method, String path, String token, ApiError error) {
    if (token != null) {
      log.info("{} {} rejected with '{}', clearing the session", method, path, error.errorCode());
      authenticator.invalidateSession(token);
    } else {
      log.debug("{} {} rejected with '{}' without a session", method, path, error.errorCode());
    }
    for (SessionExpiredListener listener : listeners) {
      try {
        listener.onSessionExpired(method.name(), path, error);
      } catch (RuntimeException e) {
        log.warn("Session expiry listener failed", e);
      }
    }
  }

  @SuppressWarnings("unchecked")
  private <T> ApiEnvelope<T> convert(ApiResult result, JavaType type) {
    if (!result.isSuccess()) {
      return result.error().toEnvelope();
    }
    if (!result.hasResult()) {
      return ApiEnvelope.success(null);
    }
    try {
      return ApiEnvelope.success((T) objectMapper.treeToValue(result.result(), type));
    } catch (JsonProcessingException | IllegalArgumentException e) {
      log.warn("Result does not map to {}: {}", type, e.getMessage());
      return ApiError.malformed("Unexpected result: " + e.getMessage()).toEnvelope();
    }
  }

  // ── Typed calls ───────────────────────────────────────────────────────────

  public ApiEnvelope<SystemInfo> systemInfo() {
    return execute(HttpMethod.GET, DeviceEndpoints.SYSTEM, null, SystemInfo.class);
  }

  public ApiEnvelope<ConnectionStatus> connectionStatus() {
    return execute(HttpMethod.GET, DeviceEndpoints.CONNECTION, null, ConnectionStatus.class);
  }

  public ApiEnvelope<List<DhcpLease>> dhcpDynamicLeases() {
    return execute(HttpMethod.GET, DeviceEndpoints.DHCP_DYNAMIC_LEASES, null, new TypeReference<List<DhcpLease>>() {
    });
  }

  public ApiEnvelope<WifiConfig> wifiConfig() {
    return execute(HttpMethod.GET, DeviceEndpoints.WIFI_CONFIG, null, WifiConfig.class);
  }

  /**
   * Reboots the device.  Needs the {@code settings} permission.
   *
   * @return the envelope
   */
  public ApiEnvelope<JsonNode> reboot() {
    log.warn("Rebooting the device");
    final ApiEnvelope<JsonNode> envelope = execute(HttpMethod.POST, DeviceEndpoints.SYSTEM_REBOOT, null);
    if (!envelope.success()) {
      log.warn("Reboot refused: {} {}", envelope.errorCode(), envelope.message());
    }
    return envelope;
  }

  // ── Authentication ────────────────────────────────────────────────────────

  public RegistrationTicket register() {
    profile.ensureLoaded();
    return authenticator.register();
  }

  public RegistrationStatus pollStatus(int registrationId) {
    return authenticator.pollStatus(registrationId);
  }

  /**
   * Opens a session.  The device is identified only once a stored app token is known to exist.
   *
   * @return the session
   * @throws MissingCredentialException if no app token is stored; no request is made
   */
  public Session login() {
    if (!authenticator.isRegistered()) {
      throw new MissingCredentialException("No app_token available. Please register first.");
    }
    profile.ensureLoaded();
    return authenticator.login();
  }

  public void logout() {
    authenticator.logout();
  }

  public boolean checkSession() {
    return authenticator.checkSession();
  }

  public boolean isRegistered() {
    return authenticator.isRegistered();
  }

  public boolean isAuthenticated() {
    return authenticator.isAuthenticated();
  }

  public void resetCredential() {
    authenticator.resetCredential();
  }

  public Optional<Credential> reloadCredential() {
    return authenticator.reloadCredential();
  }

  public Map<String, Boolean> permissions() {
    return authenticator.permissions();
  }

  public SessionAuthenticator authenticator() {
    return authenticator;
  }

  // ── Device ────────────────────────────────────────────────────────────────

  /**
   * The device identification, fetching it if needed.
   *
   * @return the version info, empty when the device could not be reached
   */
  public Optional<ApiVersionInfo> versionInfo() {
    profile.ensureLoaded();
    return profile.versionInfo();
  }

  /**
   * Points the client at another address of the same device, e.g. its LAN IP.  The session
   * stays valid.
   *
   * @param baseUrl the base url
   */
  public void setBaseUrl(URI baseUrl) {
    log.info("setBaseUrl({})", baseUrl);
    transport.setBaseUrl(baseUrl);
  }

  public URI baseUrl() {
    return transport.baseUrl();
  }
}
