package com.codeheadsystems.netdash.client.accessor;

import com.codeheadsystems.netdash.client.config.DeviceClientConfig;
import com.codeheadsystems.netdash.client.model.ApiError;
import com.codeheadsystems.netdash.client.model.ApiErrorKind;
import com.codeheadsystems.netdash.client.model.ApiResult;
import com.codeheadsystems.netdash.model.api.ApiEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DeviceTransport} over the JDK {@link HttpClient}.
 * <p>
 * Handles request serialization, the session header, the per-request deadline, and turns
 * every outcome into an {@link ApiResult}.  Versioned paths are sent to
 * {@code {baseUrl}/api/{apiVersion}{path}} and their body must be an {@link ApiEnvelope};
 * raw paths go to {@code {baseUrl}{path}} and their JSON body is the payload.
 * <p>
 * The HTTP status code is not inspected: the device reports failures inside the envelope with
 * 4xx statuses, so the envelope is what counts.  A body that is not declared as JSON is never
 * parsed.
 * <p>
 * Certificate handling lives in the {@link HttpClient} handed in, see {@link DeviceHttpClients}.
 */
@Singleton
public class HttpDeviceTransport implements DeviceTransport {

  public static final String AUTH_HEADER = "X-Fbx-App-Auth";

  private static final Logger log = LoggerFactory.getLogger(HttpDeviceTransport.class);
  private static final TypeReference<ApiEnvelope<JsonNode>> ENVELOPE = new TypeReference<>() {
  };
  private static final int LOGGED_BODY_CHARS = 200;

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String apiVersion;
  private final AtomicReference<URI> baseUrl;

  /**
   * Instantiates a new Http device transport.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param config       the config
   */
  @Inject
  public HttpDeviceTransport(final HttpClient httpClient,
                             final ObjectMapper objectMapper,
                             final DeviceClientConfig config) {
    log.info("HttpDeviceTransport({}, apiVersion={})", config.baseUrl(), config.apiVersion());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.apiVersion = config.apiVersion();
    this.baseUrl = new AtomicReference<>(config.baseUrl());
  }

  @Override
  public URI baseUrl() {
    return baseUrl.get();
  }

  @Override
  public void setBaseUrl(final URI newBaseUrl) {
    log.info("setBaseUrl({})", newBaseUrl);
    baseUrl.set(newBaseUrl);
  }

  @Override
  public ApiResult send(final TransportRequest request) {
    log.trace("send({})", request);
    final long started = System.nanoTime();
    final URI uri;
    final HttpRequest httpRequest;
    try {
      uri = uriFor(request);
      httpRequest = buildRequest(uri, request);
    } catch (JsonProcessingException e) {
      log.error("Unable to serialize body for {} {}", request.method(), request.path(), e);
      return ApiResult.failure(new ApiError(ApiErrorKind.APPLICATION_ERROR, ApiError.INVALID_REQUEST,
          "Request body could not be serialized: " + e.getOriginalMessage(), null));
    } catch (IllegalArgumentException e) {
      log.error("Invalid request {} {}: {}", request.method(), request.path(), e.getMessage());
      return ApiResult.failure(new ApiError(ApiErrorKind.APPLICATION_ERROR, ApiError.INVALID_REQUEST,
          e.getMessage(), null));
    }

    try {
      HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      log.debug("{} {} -> {} in {}ms", request.method(), uri, response.statusCode(), elapsedMillis(started));
      return interpret(request, uri, response);
    } catch (HttpTimeoutException e) {
      log.warn("Request timed out: {} {} after {}ms (deadline {}ms)",
          request.method(), uri, elapsedMillis(started), request.timeout().toMillis());
      return ApiResult.failure(ApiError.timeout(
          "Request timed out after " + request.timeout().toMillis() + "ms"));
    } catch (IOException e) {
      log.error("Request failed: {} {}: {}", request.method(), uri, e.toString());
      return ApiResult.failure(ApiError.network(e.getMessage() == null ? e.toString() : e.getMessage()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Request interrupted: {} {}", request.method(), uri);
      return ApiResult.failure(ApiError.network("Request interrupted"));
    }
  }

  private URI uriFor(TransportRequest request) {
    String base = baseUrl.get().toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    String prefix = request.versioned() ? "/api/" + apiVersion : "";
    return URI.create(base + prefix + request.path());
  }

  private HttpRequest buildRequest(URI uri, TransportRequest request) throws JsonProcessingException {
    HttpRequest.BodyPublisher publisher = request.body() == null
        ? HttpRequest.BodyPublishers.noBody()
        : HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(request.body()));
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(uri)
        .timeout(request.timeout())
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .method(request.method().name(), publisher);
    if (request.authenticated()) {
      builder.header(AUTH_HEADER, request.sessionToken());
    }
    return builder.build();
  }

  private ApiResult interpret(TransportRequest request, URI uri, HttpResponse<String> response) {
    String contentType = response.headers().firstValue("Content-Type").orElse("");
    String body = response.body();
    if (!contentType.contains("application/json")) {
      log.error("Non-JSON response: {} {} ({}): {}", request.method(), uri, response.statusCode(),
          abbreviate(body));
      return ApiResult.failure(ApiError.malformed(
          "API returned non-JSON response (" + response.statusCode() + ")"));
    }
    try {
      if (!request.versioned()) {
        return ApiResult.success(objectMapper.readTree(body));
      }
      ApiEnvelope<JsonNode> envelope = objectMapper.readValue(body, ENVELOPE);
      if (envelope == null) {
        return ApiResult.failure(ApiError.malformed(
            "API returned an empty response (" + response.statusCode() + ")"));
      }
      if (envelope.success()) {
        return ApiResult.success(envelope.result());
      }
      ApiError error = ApiError.fromEnvelope(envelope);
      log.debug("{} {} failed: {} ({})", request.method(), uri, error.errorCode(), error.message());
      return ApiResult.failure(error);
    } catch (JsonProcessingException e) {
      log.error("Unparsable response: {} {} ({}): {}", request.method(), uri, response.statusCode(),
          e.getOriginalMessage());
      return ApiResult.failure(ApiError.malformed(
          "API returned an unparsable response (" + response.statusCode() + ")"));
    }
  }

  private static long elapsedMillis(long startedNanos) {
    return (System.nanoTime() - startedNanos) / 1_000_000L;
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= LOGGED_BODY_CHARS ? body : body.substring(0, LOGGED_BODY_CHARS);
  }
}
