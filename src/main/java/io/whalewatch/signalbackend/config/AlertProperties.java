package io.whalewatch.signalbackend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.alerts")
public class AlertProperties {
  private boolean enabled = true;
  private String chatId = "";
  private long intervalMs = 300_000;
  private double accumulationNetFlow = -50_000_000;
  private double distributionNetFlow = 50_000_000;
  private double bigTransferAmount = 10_000_000;

  private Telegram telegram = new Telegram();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getChatId() {
    return chatId;
  }

  public void setChatId(String chatId) {
    this.chatId = chatId;
  }

  public long getIntervalMs() {
    return intervalMs;
  }

  public void setIntervalMs(long intervalMs) {
    this.intervalMs = intervalMs;
  }

  public double getAccumulationNetFlow() {
    return accumulationNetFlow;
  }

  public void setAccumulationNetFlow(double accumulationNetFlow) {
    this.accumulationNetFlow = accumulationNetFlow;
  }

  public double getDistributionNetFlow() {
    return distributionNetFlow;
  }

  public void setDistributionNetFlow(double distributionNetFlow) {
    this.distributionNetFlow = distributionNetFlow;
  }

  public double getBigTransferAmount() {
    return bigTransferAmount;
  }

  public void setBigTransferAmount(double bigTransferAmount) {
    this.bigTransferAmount = bigTransferAmount;
  }

  public Telegram getTelegram() {
    return telegram;
  }

  public void setTelegram(Telegram telegram) {
    this.telegram = telegram;
  }

  public boolean hasChatId() {
    return chatId != null && !chatId.isBlank();
  }

  public static class Telegram {
    private String botToken = "";
    private String apiBaseUrl = "https://api.telegram.org";

    public String getBotToken() {
      return botToken;
    }

    public void setBotToken(String botToken) {
      this.botToken = botToken;
    }

    public String getApiBaseUrl() {
      return apiBaseUrl;
    }

    public void setApiBaseUrl(String apiBaseUrl) {
      this.apiBaseUrl = apiBaseUrl;
    }
  }
}
