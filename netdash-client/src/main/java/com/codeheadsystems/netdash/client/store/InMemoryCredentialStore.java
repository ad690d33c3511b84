package com.codeheadsystems.netdash.client.store;

import com.codeheadsystems.netdash.client.model.Credential;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link CredentialStore}.
 * <p>
 * The token is lost on restart, after which the application has to be accepted on the device
 * again.  Suitable for tests and short-lived tools only.
 */
public class InMemoryCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialStore.class);

  private final AtomicReference<Credential> credential = new AtomicReference<>();

  public InMemoryCredentialStore() {
    log.warn("Using InMemoryCredentialStore: the app token will NOT survive restarts.");
  }

  /**
   * Instantiates a store that already holds a token.
   *
   * @param appToken the app token
   */
  public InMemoryCredentialStore(final String appToken) {
    this();
    credential.set(Credential.of(appToken));
  }

  @Override
  public Optional<Credential> load() {
    return Optional.ofNullable(credential.get());
  }

  @Override
  public void save(String appToken) {
    credential.set(Credential.of(appToken));
    log.debug("Stored app token");
  }

  @Override
  public void reset() {
    credential.set(null);
  }

  @Override
  public Optional<Credential> reload() {
    return load();
  }
}
