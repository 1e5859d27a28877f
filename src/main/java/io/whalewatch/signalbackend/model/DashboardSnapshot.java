package io.whalewatch.signalbackend.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * One aggregated read of the dashboard API.
 *
 * <p>Each section is either entirely live or entirely the sample default; {@code
 * fallbackSections} names the ones that came from the defaults.
 */
public record DashboardSnapshot(
    MarketOverview market,
    ExchangeFlows exchangeFlows,
    StablecoinFlows stablecoin,
    List<WhaleTransfer> whaleTransfers,
    Set<SnapshotSection> fallbackSections,
    long fetchedAt) {

  public DashboardSnapshot {
    whaleTransfers = whaleTransfers == null ? List.of() : List.copyOf(whaleTransfers);
    fallbackSections =
        fallbackSections == null || fallbackSections.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(fallbackSections));
  }

  public boolean isFullyLive() {
    return fallbackSections.isEmpty();
  }
}
