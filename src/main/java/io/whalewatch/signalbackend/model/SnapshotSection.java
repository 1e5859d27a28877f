package io.whalewatch.signalbackend.model;

import java.util.Locale;

public enum SnapshotSection {
  MARKET("/api/market"),
  EXCHANGE_FLOWS("/api/exchange_flows"),
  STABLECOIN("/api/stablecoin"),
  WHALE_TRANSFERS("/api/whale_transfers");

  private final String path;

  SnapshotSection(String path) {
    this.path = path;
  }

  public String path() {
    return path;
  }

  public String metricTag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
