package com.codeheadsystems.netdash.client.model;

/**
 * What a successful registration request returns: the id to poll, and the token that becomes
 * usable once someone accepts the request on the device.
 *
 * @param trackId  the registration id
 * @param appToken the application token, already persisted
 */
public record RegistrationTicket(int trackId, String appToken) {

  @Override
  public String toString() {
    return "RegistrationTicket[trackId=" + trackId + ", appToken=***]";
  }
}
