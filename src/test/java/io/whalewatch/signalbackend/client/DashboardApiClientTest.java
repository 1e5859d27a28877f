package io.whalewatch.signalbackend.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.whalewatch.signalbackend.config.DashboardProperties;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class DashboardApiClientTest {
  private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();
  private final AtomicInteger calls = new AtomicInteger();
  private final ObjectMapper mapper = new ObjectMapper();

  private WebClient respondingWith(HttpStatus status, String contentType, String body) {
    ExchangeFunction exchange =
        request -> {
          lastRequest.set(request);
          calls.incrementAndGet();
          ClientResponse.Builder response = ClientResponse.create(status);
          if (contentType != null) {
            response.header(HttpHeaders.CONTENT_TYPE, contentType);
          }
          return Mono.just(response.body(body).build());
        };
    return WebClient.builder().exchangeFunction(exchange).build();
  }

  private static DashboardProperties properties(String baseUrl, String apiKey) {
    DashboardProperties props = new DashboardProperties();
    props.setBaseUrl(baseUrl);
    props.setApiKey(apiKey);
    return props;
  }

  @Test
  void missingBaseUrlFailsWithoutCallingUpstream() {
    WebClient webClient = respondingWith(HttpStatus.OK, MediaType.APPLICATION_JSON_VALUE, "{}");
    DashboardApiClient client = new DashboardApiClient(webClient, mapper, properties("", ""));

    assertTrue(client.fetch("/api/market").isEmpty());
    assertEquals(0, calls.get());
  }

  @Test
  void successReturnsParsedJsonAndSendsHeaders() {
    WebClient webClient =
        respondingWith(
            HttpStatus.OK, MediaType.APPLICATION_JSON_VALUE, "{\"symbol\":\"ETH\",\"price_usd\":3757.84}");
    DashboardApiClient client =
        new DashboardApiClient(
            webClient, mapper, properties("https://dash.example.com/", "secret-key"));

    Optional<JsonNode> result = client.fetch("/api/market");

    assertTrue(result.isPresent());
    assertEquals("ETH", result.get().path("symbol").asText());
    assertEquals(3757.84, result.get().path("price_usd").asDouble());

    ClientRequest request = lastRequest.get();
    assertEquals("https://dash.example.com/api/market", request.url().toString());
    assertEquals("Bearer secret-key", request.headers().getFirst(HttpHeaders.AUTHORIZATION));
    assertTrue(request.headers().getAccept().contains(MediaType.APPLICATION_JSON));
  }

  @Test
  void noAuthorizationHeaderWithoutApiKey() {
    WebClient webClient = respondingWith(HttpStatus.OK, MediaType.APPLICATION_JSON_VALUE, "[]");
    DashboardApiClient client =
        new DashboardApiClient(webClient, mapper, properties("https://dash.example.com", ""));

    Optional<JsonNode> result = client.fetch("/api/whale_transfers");

    assertTrue(result.isPresent());
    assertTrue(result.get().isArray());
    assertNull(lastRequest.get().headers().getFirst(HttpHeaders.AUTHORIZATION));
  }

  @Test
  void jsonServedAsPlainTextIsAccepted() {
    WebClient webClient =
        respondingWith(HttpStatus.OK, MediaType.TEXT_PLAIN_VALUE, "{\"net_flow\":-60000000}");
    DashboardApiClient client =
        new DashboardApiClient(webClient, mapper, properties("https://dash.example.com", ""));

    Optional<JsonNode> result = client.fetch("/api/exchange_flows");

    assertTrue(result.isPresent());
    assertEquals(-60_000_000d, result.get().path("net_flow").asDouble());
  }

  @Test
  void jsonWithoutContentTypeIsAccepted() {
    WebClient webClient = respondingWith(HttpStatus.OK, null, "{\"net_flow\":-60000000}");
    DashboardApiClient client =
        new DashboardApiClient(webClient, mapper, properties("https://dash.example.com", ""));

    Optional<JsonNode> result = client.fetch("/api/exchange_flows");

    assertTrue(result.isPresent());
    assertEquals(-60_000_000d, result.get().path("net_flow").asDouble());
  }

  @Test
  void emptyBodyFails() {
    WebClient webClient = respondingWith(HttpStatus.OK, MediaType.APPLICATION_JSON_VALUE, "");
    DashboardApiClient client =
        new DashboardApiClient(webClient, mapper, properties("https://dash.example.com", ""));

    assertTrue(client.fetch("/api/market").isEmpty());
  }

  @Test
  void nonSuccessStatusFails() {
    WebClient webClient =
        respondingWith(
            HttpStatus.SERVICE_UNAVAILABLE, MediaType.APPLICATION_JSON_VALUE, "{\"error\":\"down\"}");
    DashboardApiClient client =
        new DashboardApiClient(webClient, mapper, properties("https://dash.example.com", ""));

    assertTrue(client.fetch("/api/exchange_flows").isEmpty());
  }

  @Test
  void htmlBodyFails() {
    WebClient webClient =
        respondingWith(HttpStatus.OK, MediaType.TEXT_HTML_VALUE, "<html><body>login</body></html>");
    DashboardApiClient client =
        new DashboardApiClient(webClient, mapper, properties("https://dash.example.com", ""));

    assertTrue(client.fetch("/api/stablecoin").isEmpty());
  }

  @Test
  void malformedJsonFails() {
    WebClient webClient =
        respondingWith(HttpStatus.OK, MediaType.APPLICATION_JSON_VALUE, "{\"net_flow\": ");
    DashboardApiClient client =
        new DashboardApiClient(webClient, mapper, properties("https://dash.example.com", ""));

    assertTrue(client.fetch("/api/exchange_flows").isEmpty());
  }

  @Test
  void transportErrorFails() {
    WebClient webClient =
        WebClient.builder()
            .exchangeFunction(request -> Mono.error(new IOException("connection refused")))
            .build();
    DashboardApiClient client =
        new DashboardApiClient(webClient, mapper, properties("https://dash.example.com", ""));

    assertTrue(client.fetch("/api/market").isEmpty());
  }

  @Test
  void slowUpstreamTimesOut() {
    WebClient webClient = WebClient.builder().exchangeFunction(request -> Mono.never()).build();
    DashboardProperties props = properties("https://dash.example.com", "");
    props.setTimeoutMs(50);
    DashboardApiClient client = new DashboardApiClient(webClient, mapper, props);

    assertTrue(client.fetch("/api/market").isEmpty());
  }
}
