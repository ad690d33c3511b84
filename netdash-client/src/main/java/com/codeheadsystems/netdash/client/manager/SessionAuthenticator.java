package com.codeheadsystems.netdash.client.manager;

import com.codeheadsystems.netdash.client.accessor.DeviceEndpoints;
import com.codeheadsystems.netdash.client.accessor.DeviceTransport;
import com.codeheadsystems.netdash.client.accessor.TransportRequest;
import com.codeheadsystems.netdash.client.config.DeviceClientConfig;
import com.codeheadsystems.netdash.client.exceptions.DeviceAuthException;
import com.codeheadsystems.netdash.client.exceptions.MissingCredentialException;
import com.codeheadsystems.netdash.client.model.ApiResult;
import com.codeheadsystems.netdash.client.model.AuthState;
import com.codeheadsystems.netdash.client.model.Credential;
import com.codeheadsystems.netdash.client.model.HttpMethod;
import com.codeheadsystems.netdash.client.model.RegistrationStatus;
import com.codeheadsystems.netdash.client.model.RegistrationTicket;
import com.codeheadsystems.netdash.client.model.Session;
import com.codeheadsystems.netdash.client.store.CredentialStore;
import com.codeheadsystems.netdash.model.login.AuthorizeRequest;
import com.codeheadsystems.netdash.model.login.AuthorizeResponse;
import com.codeheadsystems.netdash.model.login.AuthorizeStatusResponse;
import com.codeheadsystems.netdash.model.login.LoginStatusResponse;
import com.codeheadsystems.netdash.model.login.SessionRequest;
import com.codeheadsystems.netdash.model.login.SessionResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.crypto.digests.SHA1Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the device's application authorization and challenge/response login.
 * <p>
 * <strong>Registration</strong> (once per installation):
 * <ol>
 *   <li>{@link #register()} asks the device for an app token, which is stored right away.</li>
 *   <li>Someone presses the button on the device front panel.</li>
 *   <li>{@link #pollStatus(int)} reports {@code granted} once that happened.</li>
 * </ol>
 * <strong>Login</strong> (every session):
 * <ol>
 *   <li>Fetch a fresh challenge from {@code /login/}.</li>
 *   <li>Send {@code hex(HMAC-SHA1(app_token, challenge))} to {@code /login/session/}.</li>
 *   <li>Keep the returned session token for the {@code X-Fbx-App-Auth} header.</li>
 * </ol>
 * The session lives in memory only and is swapped as one value.  {@link #login()} is serialized
 * so concurrent callers never race two challenge/response exchanges.
 */
@Singleton
public class SessionAuthenticator {

  private static final Logger log = LoggerFactory.getLogger(SessionAuthenticator.class);

  private final DeviceTransport transport;
  private final CredentialStore credentialStore;
  private final DeviceProfile profile;
  private final TimeoutPolicy timeoutPolicy;
  private final ObjectMapper objectMapper;
  private final DeviceClientConfig config;
  private final AtomicReference<Session> session = new AtomicReference<>();

  private volatile String challenge;
  private volatile Integer pendingTrackId;
  private volatile RegistrationStatus lastStatus;

  /**
   * Instantiates a new Session authenticator.
   *
   * @param transport       the transport
   * @param credentialStore the credential store
   * @param profile         the device profile
   * @param timeoutPolicy   the timeout policy
   * @param objectMapper    the object mapper
   * @param config          the config
   */
  @Inject
  public SessionAuthenticator(final DeviceTransport transport,
                              final CredentialStore credentialStore,
                              final DeviceProfile profile,
                              final TimeoutPolicy timeoutPolicy,
                              final ObjectMapper objectMapper,
                              final DeviceClientConfig config) {
    log.info("SessionAuthenticator({})", config.appId());
    this.transport = transport;
    this.credentialStore = credentialStore;
    this.profile = profile;
    this.timeoutPolicy = timeoutPolicy;
    this.objectMapper = objectMapper;
    this.config = config;
  }

  // ── Registration ──────────────────────────────────────────────────────────

  /**
   * Requests a new app token.  The token is stored before this returns; it only becomes usable
   * once the request has been approved on the device.
   *
   * @return the registration ticket
   * @throws IllegalStateException if a registration is pending or a session is open
   * @throws DeviceAuthException   if the device refused or could not be reached
   */
  public RegistrationTicket register() {
    final AuthState current = state();
    if (current != AuthState.UNREGISTERED && current != AuthState.REGISTERED) {
      throw new IllegalStateException("Cannot register while " + current);
    }
    log.debug("register(appId={}, deviceName={})", config.appId(), config.deviceName());
    final AuthorizeRequest request = new AuthorizeRequest(
        config.appId(), config.appName(), config.appVersion(), config.deviceName());
    final ApiResult result = send(HttpMethod.POST, DeviceEndpoints.LOGIN_AUTHORIZE, request, null);
    if (!result.isSuccess()) {
      throw new DeviceAuthException(result.error().describe("Registration failed"));
    }
    final AuthorizeResponse response = read(result, AuthorizeResponse.class, "Registration failed");
    if (response.appToken() == null || response.trackId() == null) {
      throw new DeviceAuthException("Registration failed: incomplete response");
    }
    credentialStore.save(response.appToken());
    pendingTrackId = response.trackId();
    lastStatus = RegistrationStatus.PENDING;
    log.info("Registration requested (track id {}), waiting for approval on the device", response.trackId());
    return new RegistrationTicket(response.trackId(), response.appToken());
  }

  /**
   * Checks whether a registration was approved.  The stored token is kept whatever the answer;
   * after {@code denied} or {@code timeout} it is up to the caller to {@link #resetCredential()}.
   *
   * @param registrationId the track id from {@link #register()}
   * @return the status
   * @throws DeviceAuthException if the status could not be read
   */
  public RegistrationStatus pollStatus(final int registrationId) {
    log.trace("pollStatus({})", registrationId);
    final ApiResult result = send(HttpMethod.GET, DeviceEndpoints.authorizeStatus(registrationId), null, null);
    if (!result.isSuccess()) {
      throw new DeviceAuthException(result.error().describe("Failed to check registration status"));
    }
    final AuthorizeStatusResponse response =
        read(result, AuthorizeStatusResponse.class, "Failed to check registration status");
    final RegistrationStatus status = RegistrationStatus.fromWire(response.status());
    if (response.challenge() != null) {
      challenge = response.challenge();
    }
    lastStatus = status;
    if (status == RegistrationStatus.GRANTED) {
      pendingTrackId = null;
      log.info("Registration {} granted", registrationId);
    } else if (status.isFinalRefusal()) {
      log.warn("Registration {} ended with '{}'", registrationId, status.wireValue());
    }
    return status;
  }

  // ── Session ───────────────────────────────────────────────────────────────

  /**
   * Opens a new session with a fresh challenge.
   *
   * @return the session
   * @throws MissingCredentialException if no app token is stored; no request is made
   * @throws DeviceAuthException        if the challenge or the login failed
   */
  public synchronized Session login() {
    final Credential credential = credentialStore.load()
        .orElseThrow(() -> new MissingCredentialException("No app_token available. Please register first."));
    log.debug("login()");

    final ApiResult challengeResult = send(HttpMethod.GET, DeviceEndpoints.LOGIN, null, null);
    if (!challengeResult.isSuccess()) {
      throw new DeviceAuthException(
          "Failed to get challenge: " + challengeResult.error().describe("request failed"));
    }
    final LoginStatusResponse status = read(challengeResult, LoginStatusResponse.class, "Failed to get challenge");
    if (status.challenge() == null || status.challenge().isEmpty()) {
      throw new DeviceAuthException("Failed to get challenge: No challenge available");
    }
    challenge = status.challenge();

    final String password = hmacSha1Hex(credential.appToken(), status.challenge());
    final ApiResult loginResult = send(HttpMethod.POST, DeviceEndpoints.LOGIN_SESSION,
        new SessionRequest(config.appId(), config.appVersion(), password), null);
    if (!loginResult.isSuccess()) {
      throw new DeviceAuthException(loginResult.error().describe("Login failed"));
    }
    final SessionResponse response = read(loginResult, SessionResponse.class, "Login failed");
    if (response.sessionToken() == null || response.sessionToken().isEmpty()) {
      throw new DeviceAuthException("Login failed");
    }
    if (response.challenge() != null) {
      challenge = response.challenge();
    }
    final Session opened = new Session(response.sessionToken(), response.challenge(), response.permissions());
    session.set(opened);
    log.info("Logged in, permissions: {}", opened.permissions());
    return opened;
  }

  /**
   * Closes the session on the device.  The local session is cleared whatever the device says.
   */
  public void logout() {
    final Session current = session.get();
    if (current == null) {
      return;
    }
    log.debug("logout()");
    try {
      final ApiResult result = send(HttpMethod.POST, DeviceEndpoints.LOGIN_LOGOUT, null, current.sessionToken());
      if (!result.isSuccess()) {
        log.warn("Logout was not acknowledged: {}", result.error().describe("unknown error"));
      }
    } finally {
      session.compareAndSet(current, null);
    }
  }

  /**
   * Asks the device whether the current session is still logged in, clearing it when not.
   *
   * @return true when the session is valid; false without I/O when there is none
   */
  public boolean checkSession() {
    final Session current = session.get();
    if (current == null) {
      return false;
    }
    final ApiResult result = send(HttpMethod.GET, DeviceEndpoints.LOGIN, null, current.sessionToken());
    if (!result.isSuccess()) {
      log.debug("Session check failed: {}", result.error().describe("unknown error"));
      session.compareAndSet(current, null);
      return false;
    }
    final LoginStatusResponse status;
    try {
      status = read(result, LoginStatusResponse.class, "Session check failed");
    } catch (DeviceAuthException e) {
      log.debug("Session check failed: {}", e.getMessage());
      session.compareAndSet(current, null);
      return false;
    }
    if (status.challenge() != null) {
      challenge = status.challenge();
    }
    if (!status.loggedIn()) {
      log.info("Session is no longer logged in");
      session.compareAndSet(current, null);
      return false;
    }
    return true;
  }

  /**
   * Drops the current session only if it still carries the given token, so that a session
   * opened in the meantime survives.
   *
   * @param sessionToken the token that was rejected
   */
  public void invalidateSession(final String sessionToken) {
    final Session current = session.get();
    if (current != null && current.sessionToken().equals(sessionToken) && session.compareAndSet(current, null)) {
      log.info("Session invalidated");
    }
  }

  /**
   * Deletes the stored app token and forgets all session and registration state.
   */
  public void resetCredential() {
    log.info("resetCredential()");
    credentialStore.reset();
    session.set(null);
    challenge = null;
    pendingTrackId = null;
    lastStatus = null;
  }

  /**
   * Re-reads the stored credential.
   *
   * @return the credential now loaded
   */
  public Optional<Credential> reloadCredential() {
    return credentialStore.reload();
  }

  /**
   * The login password for a challenge: {@code hex(HMAC-SHA1(key = app_token, msg = challenge))}.
   *
   * @param challenge the challenge
   * @return lowercase hex password
   * @throws MissingCredentialException if no app token is stored
   */
  public String computePassword(final String challenge) {
    final Credential credential = credentialStore.load()
        .orElseThrow(() -> new MissingCredentialException("No app_token available. Please register first."));
    return hmacSha1Hex(credential.appToken(), challenge);
  }

  // ── State ─────────────────────────────────────────────────────────────────

  public AuthState state() {
    if (session.get() != null) {
      return AuthState.AUTHENTICATED;
    }
    if (credentialStore.load().isEmpty()) {
      return AuthState.UNREGISTERED;
    }
    final RegistrationStatus status = lastStatus;
    if (pendingTrackId != null
        && (status == null || status == RegistrationStatus.PENDING || status == RegistrationStatus.UNKNOWN)) {
      return AuthState.PENDING_APPROVAL;
    }
    return AuthState.REGISTERED;
  }

  public boolean isRegistered() {
    return credentialStore.load().isPresent();
  }

  public boolean isAuthenticated() {
    return session.get() != null;
  }

  public Optional<Session> currentSession() {
    return Optional.ofNullable(session.get());
  }

  public Optional<String> sessionToken() {
    return currentSession().map(Session::sessionToken);
  }

  public Map<String, Boolean> permissions() {
    return currentSession().map(Session::permissions).orElse(Map.of());
  }

  /**
   * The last challenge received from the device.
   *
   * @return the challenge
   */
  public Optional<String> lastChallenge() {
    return Optional.ofNullable(challenge);
  }

  private ApiResult send(HttpMethod method, String path, Object body, String sessionToken) {
    return transport.send(TransportRequest.api(method, path, body, sessionToken,
        timeoutPolicy.deadlineFor(path, profile)));
  }

  private <T> T read(ApiResult result, Class<T> type, String failure) {
    if (!result.hasResult()) {
      throw new DeviceAuthException(failure + ": empty response");
    }
    try {
      return objectMapper.treeToValue(result.result(), type);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new DeviceAuthException(failure + ": unexpected response", e);
    }
  }

  private static String hmacSha1Hex(String key, String message) {
    final HMac hmac = new HMac(new SHA1Digest());
    hmac.init(new KeyParameter(key.getBytes(StandardCharsets.UTF_8)));
    final byte[] input = message.getBytes(StandardCharsets.UTF_8);
    hmac.update(input, 0, input.length);
    final byte[] out = new byte[hmac.getMacSize()];
    hmac.doFinal(out, 0);
    return Hex.toHexString(out);
  }
}
