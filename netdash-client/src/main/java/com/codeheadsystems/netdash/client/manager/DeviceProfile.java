package com.codeheadsystems.netdash.client.manager;

import com.codeheadsystems.netdash.client.accessor.DeviceEndpoints;
import com.codeheadsystems.netdash.client.accessor.DeviceTransport;
import com.codeheadsystems.netdash.client.accessor.TransportRequest;
import com.codeheadsystems.netdash.client.config.DeviceClientConfig;
import com.codeheadsystems.netdash.client.model.ApiResult;
import com.codeheadsystems.netdash.model.api.ApiVersionInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Identification of the device, fetched once from {@code /api_version}, and the timing class it
 * falls in.
 * <p>
 * One legacy hardware generation answers some endpoints far slower than current models; it is
 * recognized by its model name.  Until the identification has been fetched the device counts as
 * normal, so nothing ever waits on it just to pick a timeout.
 */
@Singleton
public class DeviceProfile {

  /** Lowercase model name fragments of the slow hardware generation. */
  public static final List<String> SLOW_MODEL_MARKERS = List.of("revolution", "v6", "fbxgw1");

  static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofSeconds(60);

  private static final Logger log = LoggerFactory.getLogger(DeviceProfile.class);

  private final DeviceTransport transport;
  private final ObjectMapper objectMapper;
  private final Duration timeout;
  private final long retryIntervalNanos;
  private final AtomicReference<ApiVersionInfo> versionInfo = new AtomicReference<>();
  private final Object loadLock = new Object();
  private long nextAttemptNanos;
  private boolean attempted;

  /**
   * Instantiates a new Device profile.
   *
   * @param transport    the transport
   * @param objectMapper the object mapper
   * @param config       the config
   */
  @Inject
  public DeviceProfile(final DeviceTransport transport,
                       final ObjectMapper objectMapper,
                       final DeviceClientConfig config) {
    this(transport, objectMapper, config.requestTimeout(), DEFAULT_RETRY_INTERVAL);
  }

  /**
   * Instantiates a new Device profile.
   *
   * @param transport     the transport, null for a profile that never fetches
   * @param objectMapper  the object mapper
   * @param timeout       deadline of the identification request
   * @param retryInterval how long to wait after a failed fetch before fetching again
   */
  public DeviceProfile(final DeviceTransport transport,
                       final ObjectMapper objectMapper,
                       final Duration timeout,
                       final Duration retryInterval) {
    log.info("DeviceProfile()");
    this.transport = transport;
    this.objectMapper = objectMapper;
    this.timeout = timeout;
    this.retryIntervalNanos = retryInterval.toNanos();
  }

  /**
   * A profile that is already identified and never fetches.
   *
   * @param info the version info
   * @return the device profile
   */
  public static DeviceProfile fixed(final ApiVersionInfo info) {
    DeviceProfile profile = new DeviceProfile(null, null, Duration.ofSeconds(1), DEFAULT_RETRY_INTERVAL);
    profile.versionInfo.set(info);
    return profile;
  }

  /**
   * Fetches the identification if it is not known yet.  After a failed fetch, further calls
   * return false without I/O until the retry interval has passed.
   *
   * @return true when the identification is known
   */
  public boolean ensureLoaded() {
    if (versionInfo.get() != null) {
      return true;
    }
    synchronized (loadLock) {
      if (versionInfo.get() != null) {
        return true;
      }
      if (transport == null || (attempted && System.nanoTime() - nextAttemptNanos < 0)) {
        return false;
      }
      attempted = true;
      nextAttemptNanos = System.nanoTime() + retryIntervalNanos;
      ApiResult result = transport.send(TransportRequest.raw(DeviceEndpoints.API_VERSION, timeout));
      if (!result.hasResult()) {
        log.warn("Unable to identify the device: {}",
            result.isSuccess() ? "empty response" : result.error().describe("unknown error"));
        return false;
      }
      try {
        ApiVersionInfo info = objectMapper.treeToValue(result.result(), ApiVersionInfo.class);
        versionInfo.set(info);
        log.info("Device identified as '{}' (api {}), slow class: {}",
            info.modelIdentifier(), info.apiVersion(), isSlowClass());
        return true;
      } catch (JsonProcessingException e) {
        log.warn("Unable to read the device identification: {}", e.getOriginalMessage());
        return false;
      }
    }
  }

  /**
   * Whether the device belongs to the slow hardware generation.  Never does I/O.
   *
   * @return true for the slow generation, false for any other model or when not identified yet
   */
  public boolean isSlowClass() {
    String identifier = modelIdentifier().toLowerCase(Locale.ROOT);
    if (identifier.isEmpty()) {
      return false;
    }
    for (String marker : SLOW_MODEL_MARKERS) {
      if (identifier.contains(marker)) {
        return true;
      }
    }
    return false;
  }

  /**
   * The model name, or the model when the name is absent.
   *
   * @return the identifier, empty when not identified yet
   */
  public String modelIdentifier() {
    ApiVersionInfo info = versionInfo.get();
    return info == null ? "" : info.modelIdentifier();
  }

  public Optional<ApiVersionInfo> versionInfo() {
    return Optional.ofNullable(versionInfo.get());
  }
}
