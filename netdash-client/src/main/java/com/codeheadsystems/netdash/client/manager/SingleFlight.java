package com.codeheadsystems.netdash.client.manager;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs at most one unit of work per key at a time.  The first caller for a key does the work on
 * its own thread; callers arriving while it runs block until it finishes and get the same value
 * (or the same exception).  Once the work settles the key is free again and the next caller
 * starts fresh work.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class SingleFlight<K, V> {

  private final ConcurrentHashMap<K, Flight<V>> flights = new ConcurrentHashMap<>();

  /**
   * Runs the work, or joins the run already in flight for the key.
   *
   * @param key  the key
   * @param work the work
   * @return the value
   */
  public V execute(K key, Supplier<V> work) {
    return execute(key, work, () -> {
    });
  }

  /**
   * Runs the work, or joins the run already in flight for the key.
   *
   * @param key    the key
   * @param work   the work
   * @param onJoin called on the caller's thread when it joins a run instead of starting one
   * @return the value
   */
  public V execute(K key, Supplier<V> work, Runnable onJoin) {
    final Flight<V> mine = new Flight<>();
    final Flight<V> existing = flights.putIfAbsent(key, mine);
    if (existing != null) {
      existing.followers.incrementAndGet();
      onJoin.run();
      return await(existing);
    }
    final V value;
    try {
      value = work.get();
    } catch (RuntimeException | Error e) {
      flights.remove(key, mine);
      mine.future.completeExceptionally(e);
      throw e;
    }
    flights.remove(key, mine);
    mine.future.complete(value);
    return value;
  }

  /**
   * Number of callers currently waiting on the run in flight for the key.
   *
   * @param key the key
   * @return the follower count, 0 when nothing is in flight
   */
  public int followers(K key) {
    Flight<V> flight = flights.get(key);
    return flight == null ? 0 : flight.followers.get();
  }

  public int inFlightCount() {
    return flights.size();
  }

  private V await(Flight<V> flight) {
    try {
      return flight.future.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw e;
    }
  }

  private static final class Flight<V> {
    private final CompletableFuture<V> future = new CompletableFuture<>();
    private final AtomicInteger followers = new AtomicInteger();
  }
}
