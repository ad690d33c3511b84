package com.codeheadsystems.netdash.client.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DeviceClientConfigTest {

  @Test
  void fromEnvironment_empty_usesDefaults() {
    DeviceClientConfig config = DeviceClientConfig.fromEnvironment(Map.of());

    assertThat(config).isEqualTo(DeviceClientConfig.defaults());
    assertThat(config.baseUrl()).isEqualTo(URI.create("https://mafreebox.freebox.fr"));
    assertThat(config.requestTimeout()).isEqualTo(Duration.ofSeconds(10));
    assertThat(config.caCertificateFile()).isNull();
  }

  @Test
  void fromEnvironment_readsEveryVariable() {
    DeviceClientConfig config = DeviceClientConfig.fromEnvironment(Map.of(
        "FREEBOX_URL", "https://192.168.1.254/",
        "FREEBOX_API_VERSION", "v8",
        "FREEBOX_APP_ID", "fr.example.dash",
        "FREEBOX_APP_NAME", "Dash",
        "FREEBOX_APP_VERSION", "2.1",
        "FREEBOX_DEVICE_NAME", "nas",
        "FREEBOX_REQUEST_TIMEOUT_MS", "1500",
        "FREEBOX_TOKEN_FILE", "/var/lib/dash/token.json",
        "FREEBOX_CA_FILE", "/etc/dash/ca.pem"));

    assertThat(config.baseUrl()).isEqualTo(URI.create("https://192.168.1.254"));
    assertThat(config.apiVersion()).isEqualTo("v8");
    assertThat(config.appId()).isEqualTo("fr.example.dash");
    assertThat(config.appName()).isEqualTo("Dash");
    assertThat(config.appVersion()).isEqualTo("2.1");
    assertThat(config.deviceName()).isEqualTo("nas");
    assertThat(config.requestTimeout()).isEqualTo(Duration.ofMillis(1500));
    assertThat(config.credentialFile()).isEqualTo("/var/lib/dash/token.json");
    assertThat(config.caCertificateFile()).isEqualTo(Path.of("/etc/dash/ca.pem"));
  }

  @Test
  void fromEnvironment_hostOnly_buildsHttpsUrl() {
    DeviceClientConfig config = DeviceClientConfig.fromEnvironment(Map.of("FREEBOX_HOST", "box.local"));

    assertThat(config.baseUrl()).isEqualTo(URI.create("https://box.local"));
  }

  @Test
  void constructor_nonPositiveTimeout_throws() {
    assertThatThrownBy(() -> DeviceClientConfig.defaults().withRequestTimeout(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void constructor_blankMarker_defaultsToPom() {
    DeviceClientConfig config = new DeviceClientConfig(URI.create("http://localhost"), "v14", "id", "n", "1",
        "d", Duration.ofSeconds(1), "token.json", " ", null);

    assertThat(config.projectMarker()).isEqualTo(DeviceClientConfig.DEFAULT_PROJECT_MARKER);
  }

  @Test
  void withers_replaceOneField() {
    DeviceClientConfig base = DeviceClientConfig.defaults();

    assertThat(base.withApiVersion("v10").apiVersion()).isEqualTo("v10");
    assertThat(base.withBaseUrl(URI.create("http://10.0.0.1")).baseUrl()).isEqualTo(URI.create("http://10.0.0.1"));
    assertThat(base.withCredentialFile("x.json").credentialFile()).isEqualTo("x.json");
    assertThat(base.withCredentialFile("x.json").appId()).isEqualTo(base.appId());
  }
}
