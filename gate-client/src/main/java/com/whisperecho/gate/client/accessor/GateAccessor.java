package com.whisperecho.gate.client.accessor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whisperecho.gate.client.exceptions.GateAccessException;
import com.whisperecho.gate.client.manager.ElevatedSessionManager;
import com.whisperecho.gate.client.model.ElevatedSession;
import com.whisperecho.gate.client.model.GateConnectionInfo;
import com.whisperecho.gate.model.ErrorResponse;
import com.whisperecho.gate.model.FailureReason;
import com.whisperecho.gate.model.GateHeaders;
import com.whisperecho.gate.model.PrincipalView;
import com.whisperecho.gate.model.TokenRequest;
import com.whisperecho.gate.model.TokenResponse;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP access to a gated server.
 * <p>
 * Attaches the elevated-access headers when an elevated session is active and the bearer token
 * when one is held. Rejections are decoded from the server's error body into a
 * {@link GateAccessException}. Only the credential the reason condemns is dropped, and only if it
 * is still the one that was sent; server faults and role denials keep everything.
 */
@Singleton
public class GateAccessor {
  private static final Logger log = LoggerFactory.getLogger(GateAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final GateConnectionInfo connectionInfo;
  private final ElevatedSessionManager elevatedSessionManager;
  private final AtomicReference<String> bearerToken = new AtomicReference<>();

  /**
   * Instantiates a new gate accessor.
   *
   * @param httpClient             the http client
   * @param objectMapper           the object mapper
   * @param connectionInfo         the server to talk to
   * @param elevatedSessionManager the elevated session manager
   */
  @Inject
  public GateAccessor(final HttpClient httpClient,
                      final ObjectMapper objectMapper,
                      final GateConnectionInfo connectionInfo,
                      final ElevatedSessionManager elevatedSessionManager) {
    log.info("GateAccessor({})", connectionInfo);
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.connectionInfo = connectionInfo;
    this.elevatedSessionManager = elevatedSessionManager;
  }

  /**
   * Uses a bearer token for subsequent requests.
   *
   * @param token the token, or null to stop sending one
   */
  public void useBearerToken(final String token) {
    bearerToken.set(token);
  }

  public Optional<String> bearerToken() {
    return Optional.ofNullable(bearerToken.get());
  }

  /**
   * GET a gated path.
   *
   * @param path         path relative to the base URI
   * @param responseType the response type
   * @param <T>          the response type
   * @return the decoded response
   */
  public <T> T get(final String path, final Class<T> responseType) {
    log.trace("get({})", path);
    return send(builder(path).GET().build(), responseType);
  }

  /**
   * POST a JSON body to a gated path.
   *
   * @param path         path relative to the base URI
   * @param body         the request body
   * @param responseType the response type
   * @param <T>          the response type
   * @return the decoded response
   */
  public <T> T post(final String path, final Object body, final Class<T> responseType) {
    log.trace("post({})", path);
    final String json;
    try {
      json = objectMapper.writeValueAsString(body);
    } catch (IOException e) {
      throw new GateAccessException("Could not serialize request for " + path, e);
    }
    return send(builder(path)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(json))
        .build(), responseType);
  }

  /**
   * Asks the server who the held bearer token belongs to.
   *
   * @return the principal view
   */
  public PrincipalView verifyToken() {
    return post("auth/token/verify", new TokenRequest(requireBearer()), PrincipalView.class);
  }

  /**
   * Exchanges the held bearer token for a fresh one and starts using it.
   *
   * @return the new token
   */
  public TokenResponse refreshToken() {
    final TokenResponse response = post("auth/token/refresh", new TokenRequest(requireBearer()),
        TokenResponse.class);
    bearerToken.set(response.token());
    return response;
  }

  private String requireBearer() {
    final String token = bearerToken.get();
    if (token == null) {
      throw new IllegalStateException("No bearer token held");
    }
    return token;
  }

  private HttpRequest.Builder builder(final String path) {
    final HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(connectionInfo.baseUri().resolve(path))
        .header("Accept", "application/json");
    final Optional<ElevatedSession> elevated = elevatedSessionManager.current();
    elevated.ifPresent(s -> builder
        .header(GateHeaders.ELEVATED_MODE, GateHeaders.ELEVATED_MODE_ENABLED)
        .header(GateHeaders.ELEVATED_TOKEN, s.token()));
    final String token = bearerToken.get();
    if (token != null) {
      builder.header(GateHeaders.AUTHORIZATION, GateHeaders.BEARER_PREFIX + token);
    }
    return builder;
  }

  private <T> T send(final HttpRequest request, final Class<T> responseType) {
    try {
      final HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() >= 400) {
        throw rejected(request, response);
      }
      return objectMapper.readValue(response.body(), responseType);
    } catch (IOException e) {
      throw new GateAccessException("HTTP request failed for " + request.uri(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GateAccessException("HTTP request interrupted for " + request.uri(), e);
    }
  }

  private GateAccessException rejected(final HttpRequest request, final HttpResponse<String> response) {
    final int status = response.statusCode();
    final FailureReason reason = parseReason(response.body());
    if (reason != null && reason.discardsCredential()) {
      request.headers().firstValue(GateHeaders.ELEVATED_TOKEN)
          .ifPresent(sent -> elevatedSessionManager.invalidateOn(reason, sent));
      sentBearer(request)
          .filter(sent -> condemnsBearer(reason))
          .ifPresent(this::discardBearer);
    }
    log.debug("Request to {} rejected: status={} reason={}", request.uri(), status, reason);
    return new GateAccessException("Server returned HTTP " + status + " for " + request.uri()
        + (reason == null ? "" : " (" + reason + ")"), null, reason, status);
  }

  private static Optional<String> sentBearer(final HttpRequest request) {
    return request.headers().firstValue(GateHeaders.AUTHORIZATION)
        .filter(value -> value.startsWith(GateHeaders.BEARER_PREFIX))
        .map(value -> value.substring(GateHeaders.BEARER_PREFIX.length()));
  }

  private static boolean condemnsBearer(final FailureReason reason) {
    return reason == FailureReason.INVALID_BEARER_CREDENTIAL
        || reason == FailureReason.PRINCIPAL_NOT_FOUND
        || reason == FailureReason.NO_CREDENTIAL;
  }

  // A token stored by a concurrent refresh is not the one that failed.
  private void discardBearer(final String sent) {
    final String current = bearerToken.get();
    if (sent.equals(current) && bearerToken.compareAndSet(current, null)) {
      log.debug("Bearer token discarded");
    }
  }

  private FailureReason parseReason(final String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(body, ErrorResponse.class).failureReason();
    } catch (IOException e) {
      log.debug("Error body was not an ErrorResponse: {}", e.getMessage());
      return null;
    }
  }
}
