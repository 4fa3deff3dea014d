package io.github.themoah.vigil.source;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin JSON-over-HTTP client shared by the backend collaborators.
 * Every failure is surfaced as a failed future carrying a {@link TelemetryException}.
 */
public class HttpJsonClient {

  private static final Logger log = LoggerFactory.getLogger(HttpJsonClient.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final HttpClient client;
  private final long timeoutMs;

  public HttpJsonClient(Vertx vertx, long timeoutMs) {
    this(vertx.createHttpClient(new HttpClientOptions().setKeepAlive(true)), timeoutMs);
  }

  HttpJsonClient(HttpClient client, long timeoutMs) {
    this.client = Objects.requireNonNull(client, "client cannot be null");
    this.timeoutMs = timeoutMs;
  }

  /**
   * Performs a GET and parses the response body as a JSON object.
   */
  public Future<JsonObject> getJson(String absoluteUri) {
    return send(HttpMethod.GET, absoluteUri, null, Map.of())
      .map(body -> parse(absoluteUri, body));
  }

  /**
   * POSTs a JSON body and parses the response body as a JSON object.
   */
  public Future<JsonObject> postJson(String absoluteUri, JsonObject body, Map<String, String> headers) {
    return send(HttpMethod.POST, absoluteUri, body.toBuffer(), headers)
      .map(response -> parse(absoluteUri, response));
  }

  /**
   * Sends a request and returns the raw response body of a 2xx response.
   *
   * @param method the HTTP method
   * @param absoluteUri the full request URI including query string
   * @param body JSON request body, or null for none
   * @param headers extra request headers
   * @return the response body
   */
  public Future<Buffer> send(HttpMethod method, String absoluteUri, Buffer body, Map<String, String> headers) {
    RequestOptions options = new RequestOptions()
      .setMethod(method)
      .setAbsoluteURI(absoluteUri)
      .setTimeout(timeoutMs);
    if (body != null) {
      options.putHeader("content-type", CONTENT_TYPE_JSON);
    }
    headers.forEach(options::putHeader);

    log.debug("{} {}", method, absoluteUri);
    return client.request(options)
      .compose(request -> body == null ? request.send() : request.send(body))
      .compose(response -> response.body().compose(responseBody -> {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
          return Future.<Buffer>failedFuture(new TelemetryException(String.format(
            "Received non-success response code on %s %s, response code = %d, response body = %s",
            method, absoluteUri, status, responseBody.toString())));
        }
        return Future.succeededFuture(responseBody);
      }))
      .recover(err -> {
        if (err instanceof TelemetryException) {
          return Future.failedFuture(err);
        }
        return Future.failedFuture(new TelemetryException(
          String.format("%s %s failed: %s", method, absoluteUri, err.getMessage()), err));
      });
  }

  public Future<Void> close() {
    return client.close();
  }

  /**
   * Builds a URI with URL-encoded query parameters, in the given map's iteration order.
   */
  public static String uri(String baseUrl, String path, Map<String, String> params) {
    StringJoiner query = new StringJoiner("&");
    params.forEach((name, value) -> query.add(
      URLEncoder.encode(name, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8)));
    String base = baseUrl + path;
    return params.isEmpty() ? base : base + "?" + query;
  }

  private static JsonObject parse(String uri, Buffer body) {
    try {
      JsonObject json = body.toJsonObject();
      if (json == null) {
        throw new TelemetryException("Empty response body from " + uri);
      }
      return json;
    } catch (DecodeException e) {
      throw new TelemetryException(String.format(
        "Response from %s is not a JSON object, response body = %s", uri, body.toString()), e);
    }
  }
}
