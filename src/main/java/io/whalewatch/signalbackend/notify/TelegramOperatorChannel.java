package io.whalewatch.signalbackend.notify;

import io.whalewatch.signalbackend.config.AlertProperties;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/** Sends plain-text messages through the Telegram Bot API {@code sendMessage} method. */
@Component
public class TelegramOperatorChannel implements OperatorChannel {
  private static final Logger log = LoggerFactory.getLogger(TelegramOperatorChannel.class);

  private final WebClient webClient;
  private final String botToken;
  private final String apiBaseUrl;

  public TelegramOperatorChannel(WebClient webClient, AlertProperties properties) {
    this.webClient = webClient;
    AlertProperties.Telegram telegram = properties.getTelegram();
    this.botToken = telegram.getBotToken() == null ? "" : telegram.getBotToken().trim();
    String base = telegram.getApiBaseUrl() == null ? "" : telegram.getApiBaseUrl().trim();
    this.apiBaseUrl = base.replaceAll("/+$", "");
  }

  public boolean isEnabled() {
    return !botToken.isBlank() && !apiBaseUrl.isBlank();
  }

  @Override
  public boolean send(String chatId, String text) {
    if (!isEnabled()) {
      log.info("Telegram bot token not configured; alert not sent: {}", text);
      return false;
    }
    if (chatId == null || chatId.isBlank() || text == null || text.isBlank()) {
      return false;
    }

    try {
      webClient
          .post()
          .uri(URI.create(apiBaseUrl + "/bot" + botToken + "/sendMessage"))
          .contentType(MediaType.APPLICATION_JSON)
          .bodyValue(Map.of("chat_id", chatId.trim(), "text", text))
          .retrieve()
          .toBodilessEntity()
          .timeout(Duration.ofSeconds(10))
          .block();
      return true;
    } catch (WebClientResponseException e) {
      log.warn("Telegram sendMessage rejected for chatId={} status={}", chatId, e.getStatusCode().value());
      return false;
    } catch (Exception e) {
      // exception messages may embed the request URI, which carries the bot token
      log.warn("Telegram sendMessage failed for chatId={}: {}", chatId, e.getClass().getSimpleName());
      return false;
    }
  }
}
