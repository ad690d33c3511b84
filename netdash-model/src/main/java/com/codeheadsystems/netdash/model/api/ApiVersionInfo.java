package com.codeheadsystems.netdash.model.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Hardware and firmware identification served by the unauthenticated {@code /api_version}
 * endpoint.  Unlike every other endpoint the body is not wrapped in an {@link ApiEnvelope}.
 *
 * @param apiVersion     highest API version the firmware speaks, e.g. {@code 14.0}
 * @param apiBaseUrl     path prefix of the API, normally {@code /api/}
 * @param apiDomain      public domain name of the device
 * @param boxModel       short model identifier, e.g. {@code fbxgw-r2/full}
 * @param boxModelName   marketing model name, e.g. {@code Freebox v6 (r3)}
 * @param deviceName     device name
 * @param deviceType     device type string
 * @param httpsAvailable whether remote https access is enabled
 * @param httpsPort      remote https port
 * @param uid            unique device identifier
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiVersionInfo(
    @JsonProperty("api_version") String apiVersion,
    @JsonProperty("api_base_url") String apiBaseUrl,
    @JsonProperty("api_domain") String apiDomain,
    @JsonProperty("box_model") String boxModel,
    @JsonProperty("box_model_name") String boxModelName,
    @JsonProperty("device_name") String deviceName,
    @JsonProperty("device_type") String deviceType,
    @JsonProperty("https_available") Boolean httpsAvailable,
    @JsonProperty("https_port") Integer httpsPort,
    @JsonProperty("uid") String uid) {

  /**
   * Version info carrying only the model fields.
   *
   * @param boxModel     the box model
   * @param boxModelName the box model name
   * @return the version info
   */
  public static ApiVersionInfo ofModel(String boxModel, String boxModelName) {
    return new ApiVersionInfo(null, null, null, boxModel, boxModelName, null, null, null, null, null);
  }

  /**
   * The string the device is identified by: the model name when present, otherwise the model.
   *
   * @return the identifier, empty when neither field is set
   */
  public String modelIdentifier() {
    if (boxModelName != null && !boxModelName.isEmpty()) {
      return boxModelName;
    }
    return boxModel == null ? "" : boxModel;
  }
}
