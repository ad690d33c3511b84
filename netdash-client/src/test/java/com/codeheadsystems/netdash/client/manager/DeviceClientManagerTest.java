package com.codeheadsystems.netdash.client.manager;

import static com.codeheadsystems.netdash.client.manager.ScriptedTransport.failure;
import static com.codeheadsystems.netdash.client.manager.ScriptedTransport.ok;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.codeheadsystems.netdash.client.DeviceClientFactory;
import com.codeheadsystems.netdash.client.accessor.DeviceEndpoints;
import com.codeheadsystems.netdash.client.config.DeviceClientConfig;
import com.codeheadsystems.netdash.client.exceptions.MissingCredentialException;
import com.codeheadsystems.netdash.client.model.ApiError;
import com.codeheadsystems.netdash.client.model.ApiErrorKind;
import com.codeheadsystems.netdash.client.model.ApiResult;
import com.codeheadsystems.netdash.client.model.HttpMethod;
import com.codeheadsystems.netdash.client.store.InMemoryCredentialStore;
import com.codeheadsystems.netdash.model.api.ApiEnvelope;
import com.codeheadsystems.netdash.model.dhcp.DhcpLease;
import com.codeheadsystems.netdash.model.system.SystemInfo;
import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DeviceClientManagerTest {

  private static final String VERSION =
      "{\"box_model\":\"fbxgw7-r1/full\",\"box_model_name\":\"Freebox v7 (r1)\",\"api_version\":\"14.0\"}";

  @Mock private SessionExpiredListener listener;
  @Mock private SessionExpiredListener secondListener;

  private final ScriptedTransport transport = new ScriptedTransport();
  private DeviceClientManager manager;

  @BeforeEach
  void setUp() {
    transport.on(HttpMethod.GET, DeviceEndpoints.API_VERSION, ok(VERSION));
    manager = DeviceClientFactory.create(DeviceClientConfig.defaults(), DeviceClientFactory.objectMapper(),
        transport, new InMemoryCredentialStore("app-token"));
  }

  private void logIn() {
    transport.on(HttpMethod.GET, DeviceEndpoints.LOGIN, ok("{\"logged_in\":false,\"challenge\":\"c\"}"))
        .on(HttpMethod.POST, DeviceEndpoints.LOGIN_SESSION,
            ok("{\"session_token\":\"sess\",\"permissions\":{\"settings\":true}}"));
    manager.login();
  }

  // ── execute ───────────────────────────────────────────────────────────────

  @Test
  void execute_identifiesDeviceOnceAndAttachesSession() {
    logIn();
    transport.on(HttpMethod.GET, "/system/", ok("{\"firmware_version\":\"4.9.2\"}"));

    ApiEnvelope<JsonNode> first = manager.execute(HttpMethod.GET, "/system/", null);
    manager.execute(HttpMethod.GET, "/system/", null);

    assertThat(first.success()).isTrue();
    assertThat(first.result().get("firmware_version").asText()).isEqualTo("4.9.2");
    assertThat(transport.count(HttpMethod.GET, DeviceEndpoints.API_VERSION)).isEqualTo(1);
    assertThat(transport.last(HttpMethod.GET, "/system/").sessionToken()).isEqualTo("sess");
    assertThat(manager.versionInfo()).hasValueSatisfying(v -> assertThat(v.apiVersion()).isEqualTo("14.0"));
  }

  @Test
  void execute_withoutSession_sendsUnauthenticated() {
    transport.on(HttpMethod.GET, "/system/", failure("auth_required", "Invalid session token, or no session token sent"));

    ApiEnvelope<JsonNode> envelope = manager.execute(HttpMethod.GET, "/system/", null);

    assertThat(envelope.success()).isFalse();
    assertThat(envelope.errorCode()).isEqualTo("auth_required");
    assertThat(transport.last(HttpMethod.GET, "/system/").authenticated()).isFalse();
  }

  @Test
  void execute_sessionExpired_clearsSessionNotifiesAndDoesNotRetry() {
    logIn();
    manager.addSessionExpiredListener(listener);
    transport.on(HttpMethod.GET, "/system/", failure("auth_required", "Invalid session token"));

    ApiEnvelope<JsonNode> envelope = manager.execute(HttpMethod.GET, "/system/", null);

    assertThat(envelope.success()).isFalse();
    assertThat(envelope.message()).isEqualTo("Invalid session token");
    assertThat(manager.isAuthenticated()).isFalse();
    assertThat(transport.count(HttpMethod.GET, "/system/")).isEqualTo(1);
    ArgumentCaptor<ApiError> error = ArgumentCaptor.forClass(ApiError.class);
    verify(listener).onSessionExpired(eq("GET"), eq("/system/"), error.capture());
    assertThat(error.getValue().isSessionExpired()).isTrue();
  }

  @Test
  void execute_unauthenticatedRejected_keepsSessionOpenedMeanwhile() {
    manager.addSessionExpiredListener(listener);
    transport.on(HttpMethod.GET, DeviceEndpoints.LOGIN, ok("{\"logged_in\":false,\"challenge\":\"c\"}"))
        .on(HttpMethod.POST, DeviceEndpoints.LOGIN_SESSION, ok("{\"session_token\":\"sess\",\"permissions\":{}}"))
        .answer(HttpMethod.GET, "/system/", request -> {
          manager.login();
          return failure("auth_required", "Invalid session token, or no session token sent");
        });

    ApiEnvelope<JsonNode> envelope = manager.execute(HttpMethod.GET, "/system/", null);

    assertThat(envelope.errorCode()).isEqualTo("auth_required");
    assertThat(transport.last(HttpMethod.GET, "/system/").authenticated()).isFalse();
    assertThat(manager.isAuthenticated()).isTrue();
    assertThat(manager.authenticator().sessionToken()).contains("sess");
    verify(listener).onSessionExpired(eq("GET"), eq("/system/"), any());
  }

  @Test
  void execute_throwingListener_otherListenersStillNotified() {
    logIn();
    doThrow(new IllegalStateException("listener bug")).when(listener).onSessionExpired(any(), any(), any());
    manager.addSessionExpiredListener(listener);
    manager.addSessionExpiredListener(secondListener);
    transport.on(HttpMethod.POST, "/fw/redir/", failure("invalid_session", "Session invalide"));

    ApiEnvelope<JsonNode> envelope = manager.execute(HttpMethod.POST, "/fw/redir/", "{}");

    assertThat(envelope.errorCode()).isEqualTo("invalid_session");
    verify(secondListener).onSessionExpired(eq("POST"), eq("/fw/redir/"), any());
  }

  @Test
  void execute_insufficientRights_keepsSession() {
    logIn();
    manager.addSessionExpiredListener(listener);
    transport.on(HttpMethod.POST, DeviceEndpoints.SYSTEM_REBOOT, ApiResult.failure(
        new ApiError(ApiErrorKind.INSUFFICIENT_RIGHTS, "insufficient_rights", "Acces refuse", "settings")));

    ApiEnvelope<JsonNode> envelope = manager.reboot();

    assertThat(envelope.errorCode()).isEqualTo("insufficient_rights");
    assertThat(envelope.missingRight()).isEqualTo("settings");
    assertThat(manager.isAuthenticated()).isTrue();
    verifyNoInteractions(listener);
  }

  // ── Authentication ────────────────────────────────────────────────────────

  @Test
  void login_noCredential_throwsWithoutIo() {
    DeviceClientManager unregistered = DeviceClientFactory.create(DeviceClientConfig.defaults(),
        DeviceClientFactory.objectMapper(), transport, new InMemoryCredentialStore());

    assertThatThrownBy(unregistered::login)
        .isInstanceOf(MissingCredentialException.class)
        .hasMessage("No app_token available. Please register first.");
    assertThat(transport.requests()).isEmpty();
  }

  @Test
  void login_identifiesDeviceBeforeChallenge() {
    logIn();

    assertThat(transport.requests()).extracting(r -> r.path())
        .containsExactly(DeviceEndpoints.API_VERSION, DeviceEndpoints.LOGIN, DeviceEndpoints.LOGIN_SESSION);
    assertThat(manager.isAuthenticated()).isTrue();
  }

  // ── Typed calls ───────────────────────────────────────────────────────────

  @Test
  void systemInfo_mapsResult() {
    transport.on(HttpMethod.GET, DeviceEndpoints.SYSTEM,
        ok("{\"firmware_version\":\"4.9.2\",\"uptime_val\":3600,\"board_name\":\"fbxgw7r\",\"new_field\":1}"));

    ApiEnvelope<SystemInfo> envelope = manager.systemInfo();

    assertThat(envelope.success()).isTrue();
    assertThat(envelope.result().firmwareVersion()).isEqualTo("4.9.2");
    assertThat(envelope.result().uptimeSeconds()).isEqualTo(3600L);
  }

  @Test
  void dhcpDynamicLeases_mapsList() {
    transport.on(HttpMethod.GET, DeviceEndpoints.DHCP_DYNAMIC_LEASES,
        ok("[{\"mac\":\"00:24:d4:7e:00:4c\",\"hostname\":\"nas\",\"ip\":\"192.168.1.10\",\"is_static\":false}]"));

    ApiEnvelope<List<DhcpLease>> envelope = manager.dhcpDynamicLeases();

    assertThat(envelope.result()).singleElement().satisfies(lease -> {
      assertThat(lease.hostname()).isEqualTo("nas");
      assertThat(lease.isStatic()).isFalse();
    });
  }

  @Test
  void typedCall_resultOfWrongShape_isInvalidResponse() {
    transport.on(HttpMethod.GET, DeviceEndpoints.DHCP_DYNAMIC_LEASES, ok("\"not a list\""));

    ApiEnvelope<List<DhcpLease>> envelope = manager.dhcpDynamicLeases();

    assertThat(envelope.success()).isFalse();
    assertThat(envelope.errorCode()).isEqualTo("invalid_response");
  }

  @Test
  void typedCall_failure_passesErrorThrough() {
    transport.on(HttpMethod.GET, DeviceEndpoints.WIFI_CONFIG, failure("internal_error", "Erreur interne"));

    assertThat(manager.wifiConfig().errorCode()).isEqualTo("internal_error");
  }

  // ── Forwarding ────────────────────────────────────────────────────────────

  @Test
  void setBaseUrl_forwardsToTransport() {
    manager.setBaseUrl(URI.create("http://192.168.1.254"));

    assertThat(manager.baseUrl()).isEqualTo(URI.create("http://192.168.1.254"));
    assertThat(transport.baseUrl()).isEqualTo(URI.create("http://192.168.1.254"));
  }

  @Test
  void resetCredential_dropsSessionAndToken() {
    logIn();

    manager.resetCredential();

    assertThat(manager.isRegistered()).isFalse();
    assertThat(manager.isAuthenticated()).isFalse();
    assertThat(manager.permissions()).isEmpty();
  }
}
