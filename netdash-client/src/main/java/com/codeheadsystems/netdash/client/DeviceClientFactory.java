package com.codeheadsystems.netdash.client;

import com.codeheadsystems.netdash.client.accessor.DeviceHttpClients;
import com.codeheadsystems.netdash.client.accessor.DeviceTransport;
import com.codeheadsystems.netdash.client.accessor.HttpDeviceTransport;
import com.codeheadsystems.netdash.client.config.DeviceClientConfig;
import com.codeheadsystems.netdash.client.manager.DeviceClientManager;
import com.codeheadsystems.netdash.client.manager.DeviceProfile;
import com.codeheadsystems.netdash.client.manager.RequestCoordinator;
import com.codeheadsystems.netdash.client.manager.RetryPolicy;
import com.codeheadsystems.netdash.client.manager.SessionAuthenticator;
import com.codeheadsystems.netdash.client.manager.TimeoutPolicy;
import com.codeheadsystems.netdash.client.store.CredentialStore;
import com.codeheadsystems.netdash.client.store.FileCredentialStore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Wires a {@link DeviceClientManager} by hand for callers without a DI container.
 */
public final class DeviceClientFactory {

  private DeviceClientFactory() {
  }

  /**
   * The object mapper the client expects: lenient about fields added by newer firmware.
   *
   * @return the object mapper
   */
  public static ObjectMapper objectMapper() {
    return new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  /**
   * A client talking HTTP to the configured device, with its token in the configured file.
   *
   * @param config the config
   * @return the manager
   */
  public static DeviceClientManager create(final DeviceClientConfig config) {
    final ObjectMapper objectMapper = objectMapper();
    final DeviceTransport transport =
        new HttpDeviceTransport(DeviceHttpClients.create(config), objectMapper, config);
    return create(config, objectMapper, transport, new FileCredentialStore(objectMapper, config));
  }

  /**
   * A client over the given transport and credential store.
   *
   * @param config          the config
   * @param objectMapper    the object mapper
   * @param transport       the transport
   * @param credentialStore the credential store
   * @return the manager
   */
  public static DeviceClientManager create(final DeviceClientConfig config,
                                           final ObjectMapper objectMapper,
                                           final DeviceTransport transport,
                                           final CredentialStore credentialStore) {
    final DeviceProfile profile = new DeviceProfile(transport, objectMapper, config);
    final TimeoutPolicy timeoutPolicy = new TimeoutPolicy(config);
    final RequestCoordinator coordinator =
        new RequestCoordinator(transport, profile, timeoutPolicy, new RetryPolicy());
    final SessionAuthenticator authenticator =
        new SessionAuthenticator(transport, credentialStore, profile, timeoutPolicy, objectMapper, config);
    return new DeviceClientManager(transport, profile, coordinator, authenticator, objectMapper);
  }
}
