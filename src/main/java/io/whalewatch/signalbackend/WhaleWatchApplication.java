package io.whalewatch.signalbackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class WhaleWatchApplication {

  public static void main(String[] args) {
    SpringApplication.run(WhaleWatchApplication.class, args);
  }
}
