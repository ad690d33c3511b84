package com.codeheadsystems.netdash.client.store;

import com.codeheadsystems.netdash.client.config.DeviceClientConfig;
import com.codeheadsystems.netdash.client.exceptions.CredentialStoreException;
import com.codeheadsystems.netdash.client.model.Credential;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CredentialStore} backed by a small JSON file, {@code {"appToken": "..."}}.
 * <p>
 * The file is read once at construction and again on {@link #reload()}; {@link #load()} serves
 * the cached value.  A missing, unreadable or malformed file counts as "no credential" so the
 * caller falls back to registering.
 */
@Singleton
public class FileCredentialStore implements CredentialStore {

  static final int MAX_ROOT_SEARCH_DEPTH = 10;

  private static final Logger log = LoggerFactory.getLogger(FileCredentialStore.class);

  private final ObjectMapper objectMapper;
  private final String credentialFile;
  private final String projectMarker;
  private final Path workingDirectory;
  private volatile Credential credential;

  /**
   * Production constructor, resolving relative paths from the process working directory.
   *
   * @param objectMapper the object mapper
   * @param config       the config
   */
  @Inject
  public FileCredentialStore(final ObjectMapper objectMapper, final DeviceClientConfig config) {
    this(objectMapper, config.credentialFile(), config.projectMarker(), Path.of("").toAbsolutePath());
  }

  /**
   * Instantiates a new File credential store.
   *
   * @param objectMapper     the object mapper
   * @param credentialFile   absolute path, or path relative to the project root
   * @param projectMarker    file name that marks the project root
   * @param workingDirectory directory the project root search starts from
   */
  public FileCredentialStore(final ObjectMapper objectMapper,
                             final String credentialFile,
                             final String projectMarker,
                             final Path workingDirectory) {
    this.objectMapper = objectMapper;
    this.credentialFile = credentialFile;
    this.projectMarker = projectMarker;
    this.workingDirectory = workingDirectory.toAbsolutePath();
    log.info("FileCredentialStore({})", resolvePath());
    this.credential = read();
  }

  @Override
  public Optional<Credential> load() {
    return Optional.ofNullable(credential);
  }

  @Override
  public Optional<Credential> reload() {
    log.debug("reload()");
    credential = read();
    return load();
  }

  @Override
  public synchronized void save(final String appToken) {
    Path path = resolvePath();
    try {
      Path parent = path.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      String json = objectMapper.writerWithDefaultPrettyPrinter()
          .writeValueAsString(new StoredCredential(appToken));
      Files.writeString(path, json, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new CredentialStoreException("Unable to write credential file: " + path, e);
    }
    credential = Credential.of(appToken);
    log.info("Saved app token to {}", path);
  }

  @Override
  public synchronized void reset() {
    Path path = resolvePath();
    try {
      if (Files.deleteIfExists(path)) {
        log.info("Deleted credential file {}", path);
      }
    } catch (IOException e) {
      throw new CredentialStoreException("Unable to delete credential file: " + path, e);
    }
    credential = null;
  }

  /**
   * Where the credential file lives.
   * <p>
   * An absolute configured path is used as is.  A relative one is resolved against the first
   * directory, walking up from the working directory at most {@value #MAX_ROOT_SEARCH_DEPTH}
   * levels, that contains the project marker; when none does, against the working directory
   * itself.
   *
   * @return the path
   */
  public Path resolvePath() {
    Path configured = Path.of(credentialFile);
    if (configured.isAbsolute()) {
      return configured;
    }
    Path root = workingDirectory;
    Path current = workingDirectory;
    for (int depth = 0; current != null && depth < MAX_ROOT_SEARCH_DEPTH; depth++) {
      if (Files.exists(current.resolve(projectMarker))) {
        root = current;
        break;
      }
      current = current.getParent();
    }
    return root.resolve(configured).normalize();
  }

  private Credential read() {
    Path path = resolvePath();
    if (!Files.isRegularFile(path)) {
      log.info("No credential file at {}; registration required", path);
      return null;
    }
    try {
      StoredCredential stored = objectMapper.readValue(Files.readString(path, StandardCharsets.UTF_8),
          StoredCredential.class);
      if (stored == null || stored.appToken() == null || stored.appToken().isBlank()) {
        log.warn("Credential file {} holds no app token", path);
        return null;
      }
      log.info("Loaded app token from {}", path);
      return Credential.of(stored.appToken());
    } catch (IOException e) {
      log.warn("Unable to read credential file {}: {}", path, e.getMessage());
      return null;
    }
  }
}
