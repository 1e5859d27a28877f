package io.whalewatch.signalbackend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.whalewatch.signalbackend.config.DashboardProperties;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Reads the blockchain dashboard API.
 *
 * <p>Every failure (no base URL, transport error, timeout, non-2xx status, body that is not JSON)
 * comes back as {@link Optional#empty()}; nothing is thrown to the caller. A present value may
 * still be an empty object or array, which callers judge for themselves.
 */
@Component
public class DashboardApiClient {
  private static final Logger log = LoggerFactory.getLogger(DashboardApiClient.class);

  private final WebClient webClient;
  private final ObjectMapper mapper;
  private final String baseUrl;
  private final String apiKey;
  private final Duration timeout;

  public DashboardApiClient(
      WebClient webClient, ObjectMapper mapper, DashboardProperties properties) {
    this.webClient = webClient;
    this.mapper = mapper;
    String url = properties.getBaseUrl();
    this.baseUrl = (url == null ? "" : url.trim()).replaceAll("/+$", "");
    this.apiKey = properties.getApiKey() == null ? "" : properties.getApiKey().trim();
    this.timeout = Duration.ofMillis(Math.max(1L, properties.getTimeoutMs()));
  }

  public boolean isEnabled() {
    return !baseUrl.isBlank();
  }

  public Optional<JsonNode> fetch(String path) {
    if (!isEnabled()) {
      log.debug("GET {} skipped: dashboard base URL not configured", path);
      return Optional.empty();
    }

    URI uri;
    try {
      uri = URI.create(baseUrl + path);
    } catch (IllegalArgumentException e) {
      log.debug("GET {}{} failed: invalid URL ({})", baseUrl, path, e.getMessage());
      return Optional.empty();
    }

    try {
      // parsed here rather than by the codec so a missing or wrong Content-Type does not matter
      String body =
          webClient
              .get()
              .uri(uri)
              .headers(h -> {
                h.setAccept(List.of(MediaType.APPLICATION_JSON));
                if (!apiKey.isBlank()) h.setBearerAuth(apiKey);
              })
              .retrieve()
              .bodyToMono(String.class)
              .timeout(timeout)
              .block();
      if (body == null || body.isBlank()) {
        log.debug("GET {} failed: empty body", uri);
        return Optional.empty();
      }
      JsonNode root = mapper.readTree(body);
      if (root == null || root.isMissingNode()) {
        log.debug("GET {} failed: empty body", uri);
        return Optional.empty();
      }
      return Optional.of(root);
    } catch (Exception e) {
      log.debug("GET {} failed: {}", uri, e.toString());
      return Optional.empty();
    }
  }
}
