package io.whalewatch.signalbackend.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class AppConfig {

  @Bean
  public WebClient webClient() {
    // Whale transfer lists can be long; keep the buffer bounded but above the 256k default.
    ExchangeStrategies strategies =
        ExchangeStrategies.builder()
            .codecs(
                c -> c.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build();

    return WebClient.builder()
        .exchangeStrategies(strategies)
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .build();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
