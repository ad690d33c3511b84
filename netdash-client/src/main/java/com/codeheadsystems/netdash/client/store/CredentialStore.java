package com.codeheadsystems.netdash.client.store;

import com.codeheadsystems.netdash.client.model.Credential;
import java.util.Optional;

/**
 * Storage abstraction for the application credential.
 * <p>
 * The stored token is the only state that survives a restart: losing it means registering
 * again, which needs someone at the device.  Implementations must be thread-safe.
 */
public interface CredentialStore {

  /**
   * The currently stored credential.  Does no I/O; see {@link #reload()}.
   *
   * @return the credential, or empty when none is stored
   */
  Optional<Credential> load();

  /**
   * Stores or replaces the application token.
   *
   * @param appToken the app token
   */
  void save(String appToken);

  /**
   * Removes the stored token.  Does nothing when none is stored.
   */
  void reset();

  /**
   * Re-reads the backing storage, picking up a token written by another process.
   *
   * @return the credential now loaded, or empty
   */
  Optional<Credential> reload();
}
