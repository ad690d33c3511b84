package com.codeheadsystems.netdash.client.accessor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.netdash.client.config.DeviceClientConfig;
import com.codeheadsystems.netdash.client.exceptions.DeviceTransportException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import javax.net.ssl.SSLContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DeviceHttpClientsTest {

  @TempDir
  Path tempDir;

  @Test
  void create_withoutCa_usesOwnContextAndNeverFollowsRedirects() throws Exception {
    SSLContext jvmDefault = SSLContext.getDefault();

    HttpClient client = DeviceHttpClients.create(DeviceClientConfig.defaults());

    assertThat(client.followRedirects()).isEqualTo(HttpClient.Redirect.NEVER);
    assertThat(client.sslContext()).isNotSameAs(jvmDefault);
    assertThat(SSLContext.getDefault()).isSameAs(jvmDefault);
  }

  @Test
  void pinnedContext_missingFile_throws() {
    assertThatThrownBy(() -> DeviceHttpClients.pinnedContext(tempDir.resolve("missing.pem")))
        .isInstanceOf(DeviceTransportException.class)
        .hasMessageContaining("missing.pem");
  }

  @Test
  void pinnedContext_garbageFile_throws() throws Exception {
    Path pem = Files.writeString(tempDir.resolve("ca.pem"), "-----BEGIN CERTIFICATE-----\nnope\n-----END CERTIFICATE-----\n");

    assertThatThrownBy(() -> DeviceHttpClients.pinnedContext(pem))
        .isInstanceOf(DeviceTransportException.class);
  }

  @Test
  void deviceTrustManager_acceptsServersRefusesClients() {
    DeviceHttpClients.DeviceTrustManager trustManager = new DeviceHttpClients.DeviceTrustManager();

    trustManager.checkServerTrusted(new X509Certificate[0], "RSA");
    assertThat(trustManager.getAcceptedIssuers()).isEmpty();
    assertThatThrownBy(() -> trustManager.checkClientTrusted(new X509Certificate[0], "RSA"))
        .isInstanceOf(CertificateException.class);
  }
}
