package com.codeheadsystems.netdash.client.config;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Client-side configuration for talking to one router.
 * <p>
 * The application identity ({@code appId}, {@code appName}, {@code appVersion},
 * {@code deviceName}) is what the device shows when asking its owner to accept the registration,
 * and {@code appId} must stay the same between registration and every later login, or the
 * stored token will be refused.
 * <p>
 * {@code credentialFile} may be relative; it is then resolved against the nearest ancestor of the
 * working directory that holds {@code projectMarker} (see
 * {@link com.codeheadsystems.netdash.client.store.FileCredentialStore#resolvePath()}).
 *
 * @param baseUrl           base URL of the device, e.g. {@code https://mafreebox.freebox.fr}
 * @param apiVersion        API version path segment, e.g. {@code v14}
 * @param appId             application identifier
 * @param appName           application name
 * @param appVersion        application version
 * @param deviceName        name of the machine this client runs on
 * @param requestTimeout    default request deadline for devices of the normal timing class
 * @param credentialFile    where the application token is stored
 * @param projectMarker     file name identifying the project root
 * @param caCertificateFile PEM file of the CA to pin for the device, null to accept the device's
 *                          self-signed certificate without verification
 */
public record DeviceClientConfig(URI baseUrl,
                                 String apiVersion,
                                 String appId,
                                 String appName,
                                 String appVersion,
                                 String deviceName,
                                 Duration requestTimeout,
                                 String credentialFile,
                                 String projectMarker,
                                 Path caCertificateFile) {

  public static final String DEFAULT_HOST = "mafreebox.freebox.fr";
  public static final String DEFAULT_API_VERSION = "v14";
  public static final String DEFAULT_APP_ID = "com.codeheadsystems.netdash";
  public static final String DEFAULT_APP_NAME = "netdash";
  public static final String DEFAULT_APP_VERSION = "1.0.0";
  public static final String DEFAULT_DEVICE_NAME = "netdash client";
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);
  public static final String DEFAULT_CREDENTIAL_FILE = "data/freebox_token.json";
  public static final String DEFAULT_PROJECT_MARKER = "pom.xml";

  public DeviceClientConfig {
    Objects.requireNonNull(baseUrl, "baseUrl");
    Objects.requireNonNull(apiVersion, "apiVersion");
    Objects.requireNonNull(appId, "appId");
    Objects.requireNonNull(requestTimeout, "requestTimeout");
    Objects.requireNonNull(credentialFile, "credentialFile");
    if (requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException("requestTimeout must be positive: " + requestTimeout);
    }
    if (projectMarker == null || projectMarker.isBlank()) {
      projectMarker = DEFAULT_PROJECT_MARKER;
    }
  }

  /**
   * Configuration with every default applied.
   *
   * @return the device client config
   */
  public static DeviceClientConfig defaults() {
    return new DeviceClientConfig(URI.create("https://" + DEFAULT_HOST), DEFAULT_API_VERSION,
        DEFAULT_APP_ID, DEFAULT_APP_NAME, DEFAULT_APP_VERSION, DEFAULT_DEVICE_NAME,
        DEFAULT_REQUEST_TIMEOUT, DEFAULT_CREDENTIAL_FILE, DEFAULT_PROJECT_MARKER, null);
  }

  /**
   * Builds the configuration from environment variables, falling back to the defaults.
   * <ul>
   *   <li>{@code FREEBOX_URL}, else {@code https://} + {@code FREEBOX_HOST}</li>
   *   <li>{@code FREEBOX_API_VERSION}</li>
   *   <li>{@code FREEBOX_APP_ID}, {@code FREEBOX_APP_NAME}, {@code FREEBOX_APP_VERSION},
   *       {@code FREEBOX_DEVICE_NAME}</li>
   *   <li>{@code FREEBOX_REQUEST_TIMEOUT_MS}</li>
   *   <li>{@code FREEBOX_TOKEN_FILE}</li>
   *   <li>{@code FREEBOX_CA_FILE}</li>
   * </ul>
   *
   * @param env the environment, usually {@link System#getenv()}
   * @return the device client config
   */
  public static DeviceClientConfig fromEnvironment(Map<String, String> env) {
    String url = env.get("FREEBOX_URL");
    if (isBlank(url)) {
      url = "https://" + env.getOrDefault("FREEBOX_HOST", DEFAULT_HOST);
    }
    String timeout = env.get("FREEBOX_REQUEST_TIMEOUT_MS");
    String caFile = env.get("FREEBOX_CA_FILE");
    return new DeviceClientConfig(
        URI.create(stripTrailingSlash(url)),
        valueOr(env, "FREEBOX_API_VERSION", DEFAULT_API_VERSION),
        valueOr(env, "FREEBOX_APP_ID", DEFAULT_APP_ID),
        valueOr(env, "FREEBOX_APP_NAME", DEFAULT_APP_NAME),
        valueOr(env, "FREEBOX_APP_VERSION", DEFAULT_APP_VERSION),
        valueOr(env, "FREEBOX_DEVICE_NAME", DEFAULT_DEVICE_NAME),
        isBlank(timeout) ? DEFAULT_REQUEST_TIMEOUT : Duration.ofMillis(Long.parseLong(timeout.trim())),
        valueOr(env, "FREEBOX_TOKEN_FILE", DEFAULT_CREDENTIAL_FILE),
        DEFAULT_PROJECT_MARKER,
        isBlank(caFile) ? null : Path.of(caFile));
  }

  public DeviceClientConfig withBaseUrl(URI newBaseUrl) {
    return new DeviceClientConfig(newBaseUrl, apiVersion, appId, appName, appVersion, deviceName,
        requestTimeout, credentialFile, projectMarker, caCertificateFile);
  }

  public DeviceClientConfig withApiVersion(String newApiVersion) {
    return new DeviceClientConfig(baseUrl, newApiVersion, appId, appName, appVersion, deviceName,
        requestTimeout, credentialFile, projectMarker, caCertificateFile);
  }

  public DeviceClientConfig withCredentialFile(String newCredentialFile) {
    return new DeviceClientConfig(baseUrl, apiVersion, appId, appName, appVersion, deviceName,
        requestTimeout, newCredentialFile, projectMarker, caCertificateFile);
  }

  public DeviceClientConfig withRequestTimeout(Duration newRequestTimeout) {
    return new DeviceClientConfig(baseUrl, apiVersion, appId, appName, appVersion, deviceName,
        newRequestTimeout, credentialFile, projectMarker, caCertificateFile);
  }

  private static String valueOr(Map<String, String> env, String key, String fallback) {
    String value = env.get(key);
    return isBlank(value) ? fallback : value;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
