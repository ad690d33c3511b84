package com.codeheadsystems.netdash.client.manager;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Decides whether a failed attempt is tried again.
 * <p>
 * Only timeouts on the slow endpoint families of a slow-class device are retried.  Any other
 * failure (an application error, missing rights, an expired session) would come back the same
 * way, and retrying it could hide a permission problem.
 * <p>
 * The backoff schedule lists the wait before each retry, first retry first; its length is the
 * number of retries allowed after the first attempt.  The default waits 1 s then 2 s.
 */
@Singleton
public class RetryPolicy {

  public static final int DEFAULT_MAX_RETRIES = 2;
  public static final Duration DEFAULT_BASE_BACKOFF = Duration.ofSeconds(1);

  private final List<Duration> backoffSchedule;

  @Inject
  public RetryPolicy() {
    this(exponentialSchedule(DEFAULT_MAX_RETRIES, DEFAULT_BASE_BACKOFF));
  }

  /**
   * Instantiates a new Retry policy.
   *
   * @param backoffSchedule wait before each retry, first retry first
   */
  public RetryPolicy(final List<Duration> backoffSchedule) {
    this.backoffSchedule = List.copyOf(backoffSchedule);
  }

  /**
   * Schedule doubling from {@code base}: base, 2 * base, 4 * base ...
   *
   * @param retries the number of retries
   * @param base    the first wait
   * @return the schedule
   */
  public static List<Duration> exponentialSchedule(int retries, Duration base) {
    List<Duration> schedule = new ArrayList<>(retries);
    for (int i = 0; i < retries; i++) {
      schedule.add(base.multipliedBy(1L << i));
    }
    return schedule;
  }

  public int maxRetries() {
    return backoffSchedule.size();
  }

  /**
   * Whether to try again after a failed attempt.
   *
   * @param path              the API path
   * @param profile           the device profile
   * @param attemptsRemaining retries still allowed
   * @param wasTimeout        whether the attempt failed by hitting its deadline
   * @return true to retry
   */
  public boolean shouldRetry(String path, DeviceProfile profile, int attemptsRemaining, boolean wasTimeout) {
    return wasTimeout
        && attemptsRemaining > 0
        && profile.isSlowClass()
        && SlowEndpoints.matches(path);
  }

  /**
   * Wait before the retry made with {@code attemptsRemaining} retries left.
   *
   * @param attemptsRemaining retries left before this one, between 1 and {@link #maxRetries()}
   * @return the backoff
   */
  public Duration backoffFor(int attemptsRemaining) {
    if (attemptsRemaining < 1 || attemptsRemaining > maxRetries()) {
      throw new IllegalArgumentException("attemptsRemaining out of range: " + attemptsRemaining);
    }
    return backoffSchedule.get(maxRetries() - attemptsRemaining);
  }
}
