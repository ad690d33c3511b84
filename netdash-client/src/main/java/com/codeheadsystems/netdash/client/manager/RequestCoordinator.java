package com.codeheadsystems.netdash.client.manager;

import com.codeheadsystems.netdash.client.accessor.DeviceTransport;
import com.codeheadsystems.netdash.client.accessor.TransportRequest;
import com.codeheadsystems.netdash.client.model.ApiError;
import com.codeheadsystems.netdash.client.model.ApiResult;
import com.codeheadsystems.netdash.client.model.HttpMethod;
import com.codeheadsystems.netdash.client.model.OperationKey;
import java.time.Duration;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends API calls with the right deadline, retries timeouts where the retry policy allows, and
 * coalesces concurrent calls for the same method and path into one attempt sequence.
 * <p>
 * The coalescing key ignores the body: a caller joining an in-flight POST gets the result of the
 * body that was actually sent.  That is logged at WARN since it is rarely what a writer wants.
 */
@Singleton
public class RequestCoordinator {

  private static final Logger log = LoggerFactory.getLogger(RequestCoordinator.class);

  private final DeviceTransport transport;
  private final DeviceProfile profile;
  private final TimeoutPolicy timeoutPolicy;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;
  private final SingleFlight<OperationKey, ApiResult> inFlight = new SingleFlight<>();

  /**
   * Instantiates a new Request coordinator.
   *
   * @param transport     the transport
   * @param profile       the device profile
   * @param timeoutPolicy the timeout policy
   * @param retryPolicy   the retry policy
   */
  @Inject
  public RequestCoordinator(final DeviceTransport transport,
                            final DeviceProfile profile,
                            final TimeoutPolicy timeoutPolicy,
                            final RetryPolicy retryPolicy) {
    this(transport, profile, timeoutPolicy, retryPolicy, Sleeper.SYSTEM);
  }

  /**
   * Instantiates a new Request coordinator.
   *
   * @param transport     the transport
   * @param profile       the device profile
   * @param timeoutPolicy the timeout policy
   * @param retryPolicy   the retry policy
   * @param sleeper       waits between retries
   */
  public RequestCoordinator(final DeviceTransport transport,
                            final DeviceProfile profile,
                            final TimeoutPolicy timeoutPolicy,
                            final RetryPolicy retryPolicy,
                            final Sleeper sleeper) {
    log.info("RequestCoordinator()");
    this.transport = transport;
    this.profile = profile;
    this.timeoutPolicy = timeoutPolicy;
    this.retryPolicy = retryPolicy;
    this.sleeper = sleeper;
  }

  /**
   * Executes an API call.  Never throws; failures come back as a failed result.
   *
   * @param method       the method
   * @param path         the path under the versioned API root
   * @param body         the body, null for none
   * @param sessionToken the session token, null for an unauthenticated call
   * @return the result
   */
  public ApiResult execute(HttpMethod method, String path, Object body, String sessionToken) {
    final OperationKey key = OperationKey.of(method, path);
    return inFlight.execute(key,
        () -> attemptWithRetries(key, body, sessionToken),
        () -> onJoin(key, body));
  }

  int waitingCallers(OperationKey key) {
    return inFlight.followers(key);
  }

  private void onJoin(OperationKey key, Object body) {
    if (body != null) {
      log.warn("Joining in-flight {}: this caller's body is not sent, the in-flight result is shared", key);
    } else {
      log.debug("Joining in-flight {}", key);
    }
  }

  private ApiResult attemptWithRetries(OperationKey key, Object body, String sessionToken) {
    int remaining = retryPolicy.maxRetries();
    ApiResult result = attempt(key, body, sessionToken);
    while (!result.isSuccess()
        && retryPolicy.shouldRetry(key.path(), profile, remaining, result.isTimeout())) {
      final Duration backoff = retryPolicy.backoffFor(remaining);
      log.warn("{} timed out on slow device '{}', retrying in {}ms ({} retries left)",
          key, profile.modelIdentifier(), backoff.toMillis(), remaining);
      try {
        sleeper.sleep(backoff);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting to retry {}", key);
        return result;
      }
      remaining--;
      result = attempt(key, body, sessionToken);
    }
    return result;
  }

  private ApiResult attempt(OperationKey key, Object body, String sessionToken) {
    final Duration deadline = timeoutPolicy.deadlineFor(key.path(), profile);
    final TransportRequest request = TransportRequest.api(key.method(), key.path(), body, sessionToken, deadline);
    log.trace("attempt({})", request);
    try {
      return transport.send(request);
    } catch (RuntimeException e) {
      log.warn("Transport failed for {}: {}", key, e.toString());
      return ApiResult.failure(ApiError.network(e.getMessage() == null ? e.toString() : e.getMessage()));
    }
  }
}
