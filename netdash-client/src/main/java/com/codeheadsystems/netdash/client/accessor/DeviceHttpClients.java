package com.codeheadsystems.netdash.client.accessor;

import com.codeheadsystems.netdash.client.config.DeviceClientConfig;
import com.codeheadsystems.netdash.client.exceptions.DeviceTransportException;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.Collection;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link HttpClient} used to reach the device.
 * <p>
 * The device serves HTTPS with a certificate issued by its vendor's private CA, which no
 * default trust store contains.  The trust decision is therefore carried by an
 * {@link SSLContext} owned by this one client: either a trust store holding only the configured
 * CA, or, when none is configured, a trust manager that accepts the device's certificate
 * unverified.  The JVM default {@code SSLContext} and system properties are never touched, so
 * every other outbound connection keeps full verification.
 */
public final class DeviceHttpClients {

  private static final Logger log = LoggerFactory.getLogger(DeviceHttpClients.class);

  private DeviceHttpClients() {
  }

  /**
   * Creates a client for the configured device.
   *
   * @param config the config
   * @return the http client
   * @throws DeviceTransportException if the configured CA file cannot be loaded
   */
  public static HttpClient create(final DeviceClientConfig config) {
    SSLContext sslContext;
    if (config.caCertificateFile() != null) {
      log.info("Trusting only the CA in {} for {}", config.caCertificateFile(), config.baseUrl());
      sslContext = pinnedContext(config.caCertificateFile());
    } else {
      log.warn("No device CA configured: certificates presented by {} are accepted without "
          + "verification on this client only", config.baseUrl());
      sslContext = acceptingContext();
    }
    return HttpClient.newBuilder()
        .sslContext(sslContext)
        .followRedirects(HttpClient.Redirect.NEVER)
        .build();
  }

  /**
   * SSL context trusting exactly the certificates in the given PEM or DER file.
   *
   * @param caFile the ca file
   * @return the ssl context
   */
  static SSLContext pinnedContext(final Path caFile) {
    try (InputStream in = Files.newInputStream(caFile)) {
      Collection<? extends Certificate> certificates =
          CertificateFactory.getInstance("X.509").generateCertificates(in);
      if (certificates.isEmpty()) {
        throw new DeviceTransportException("No certificate found in " + caFile, null);
      }
      KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
      trustStore.load(null, null);
      int index = 0;
      for (Certificate certificate : certificates) {
        trustStore.setCertificateEntry("device-ca-" + index++, certificate);
      }
      TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
      factory.init(trustStore);
      SSLContext context = SSLContext.getInstance("TLS");
      context.init(null, factory.getTrustManagers(), null);
      return context;
    } catch (IOException | GeneralSecurityException e) {
      throw new DeviceTransportException("Unable to load device CA certificate: " + caFile, e);
    }
  }

  /**
   * SSL context whose trust manager accepts any server certificate.
   *
   * @return the ssl context
   */
  static SSLContext acceptingContext() {
    try {
      SSLContext context = SSLContext.getInstance("TLS");
      context.init(null, new TrustManager[]{new DeviceTrustManager()}, null);
      return context;
    } catch (GeneralSecurityException e) {
      throw new DeviceTransportException("Unable to initialise TLS for the device", e);
    }
  }

  /**
   * Accepts every server chain.  Being an extended trust manager, it also replaces the JSSE
   * host name check, which the device's certificate would fail when reached by IP.
   * Client-side checks are refused: this client never acts as a TLS server.
   */
  static final class DeviceTrustManager extends X509ExtendedTrustManager {

    private static final X509Certificate[] NO_ISSUERS = new X509Certificate[0];

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {
      // accepted
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
      // accepted
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
      // accepted
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) throws CertificateException {
      throw new CertificateException("Client certificates are not accepted");
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket)
        throws CertificateException {
      throw new CertificateException("Client certificates are not accepted");
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine)
        throws CertificateException {
      throw new CertificateException("Client certificates are not accepted");
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return NO_ISSUERS;
    }
  }
}
