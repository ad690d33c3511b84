package com.codeheadsystems.netdash.client.manager;

import com.codeheadsystems.netdash.client.config.DeviceClientConfig;
import java.time.Duration;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Picks the deadline of a request from its path and the device's timing class.
 * <ul>
 *   <li>normal devices: the configured default for every path</li>
 *   <li>slow devices, slow endpoint families: {@link #SLOW_ENDPOINT_TIMEOUT}</li>
 *   <li>slow devices, anything else: {@link #SLOW_DEVICE_TIMEOUT}</li>
 * </ul>
 * Applying the long deadline everywhere would hide real outages; applying the default on the
 * slow generation produces timeouts for answers that were on their way.
 */
@Singleton
public class TimeoutPolicy {

  public static final Duration SLOW_ENDPOINT_TIMEOUT = Duration.ofSeconds(45);
  public static final Duration SLOW_DEVICE_TIMEOUT = Duration.ofSeconds(25);

  private final Duration defaultTimeout;

  @Inject
  public TimeoutPolicy(final DeviceClientConfig config) {
    this(config.requestTimeout());
  }

  public TimeoutPolicy(final Duration defaultTimeout) {
    this.defaultTimeout = defaultTimeout;
  }

  /**
   * The deadline for a request.
   *
   * @param path    the API path
   * @param profile the device profile
   * @return the deadline
   */
  public Duration deadlineFor(String path, DeviceProfile profile) {
    if (!profile.isSlowClass()) {
      return defaultTimeout;
    }
    return SlowEndpoints.matches(path) ? SLOW_ENDPOINT_TIMEOUT : SLOW_DEVICE_TIMEOUT;
  }

  public Duration defaultTimeout() {
    return defaultTimeout;
  }
}
