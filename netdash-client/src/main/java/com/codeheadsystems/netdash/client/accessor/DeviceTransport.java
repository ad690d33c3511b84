package com.codeheadsystems.netdash.client.accessor;

import com.codeheadsystems.netdash.client.model.ApiResult;
import java.net.URI;

/**
 * Issues single requests to the device.
 * <p>
 * Implementations never throw: connection failures, expired deadlines, HTTP errors and
 * unparsable bodies all come back as a failed {@link ApiResult}.
 */
public interface DeviceTransport {

  /**
   * Sends one request and waits for its outcome, at most until the request's deadline.
   *
   * @param request the request
   * @return the outcome
   */
  ApiResult send(TransportRequest request);

  /**
   * The base URL requests are currently sent to.
   *
   * @return the base url
   */
  URI baseUrl();

  /**
   * Points the transport at another address of the same device, e.g. its LAN IP instead of
   * its public host name.  In-flight requests keep their original address.
   *
   * @param baseUrl the new base url
   */
  void setBaseUrl(URI baseUrl);
}
