package com.codeheadsystems.netdash.client.model;

/**
 * The long-lived application credential handed out by the device at registration.
 *
 * @param appToken       the application secret, key of the login HMAC
 * @param registrationId the track id of the registration that produced the token, when known
 * @param status         the last registration status seen for it, when known
 */
public record Credential(String appToken, Integer registrationId, RegistrationStatus status) {

  /**
   * A credential known only by its token, as loaded from storage.
   *
   * @param appToken the app token
   * @return the credential
   */
  public static Credential of(String appToken) {
    return new Credential(appToken, null, null);
  }

  @Override
  public String toString() {
    return "Credential[appToken=***, registrationId=" + registrationId + ", status=" + status + "]";
  }
}
