package io.whalewatch.signalbackend.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.whalewatch.signalbackend.client.DashboardApiClient;
import io.whalewatch.signalbackend.model.DashboardSnapshot;
import io.whalewatch.signalbackend.model.ExchangeFlows;
import io.whalewatch.signalbackend.model.MarketOverview;
import io.whalewatch.signalbackend.model.SnapshotSection;
import io.whalewatch.signalbackend.model.StablecoinFlows;
import io.whalewatch.signalbackend.model.WhaleTransfer;
import io.whalewatch.signalbackend.util.SampleOverview;
import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SnapshotAggregatorService {
  private static final Logger log = LoggerFactory.getLogger(SnapshotAggregatorService.class);

  private final DashboardApiClient client;
  private final SnapshotMapper mapper;
  private final SnapshotMetrics metrics;
  private final Clock clock;

  public SnapshotAggregatorService(
      DashboardApiClient client, SnapshotMapper mapper, SnapshotMetrics metrics, Clock clock) {
    this.client = client;
    this.mapper = mapper;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * Fetches the four dashboard sections and merges them. Sections fall back to {@link
   * SampleOverview} independently of each other; no retries happen here.
   */
  public DashboardSnapshot buildSnapshot() {
    Set<SnapshotSection> fallbacks = EnumSet.noneOf(SnapshotSection.class);

    MarketOverview market =
        section(SnapshotSection.MARKET, mapper::market, SampleOverview.MARKET, fallbacks);
    ExchangeFlows flows =
        section(
            SnapshotSection.EXCHANGE_FLOWS,
            mapper::exchangeFlows,
            SampleOverview.EXCHANGE_FLOWS,
            fallbacks);
    StablecoinFlows stablecoin =
        section(SnapshotSection.STABLECOIN, mapper::stablecoin, SampleOverview.STABLECOIN, fallbacks);
    List<WhaleTransfer> whales =
        section(
            SnapshotSection.WHALE_TRANSFERS,
            mapper::whaleTransfers,
            SampleOverview.WHALE_TRANSFERS,
            fallbacks);

    DashboardSnapshot snapshot =
        new DashboardSnapshot(market, flows, stablecoin, whales, fallbacks, clock.millis());
    if (!snapshot.isFullyLive()) {
      log.debug("dashboard snapshot using sample data for sections {}", snapshot.fallbackSections());
    }
    return snapshot;
  }

  private <T> T section(
      SnapshotSection section,
      Function<JsonNode, Optional<T>> mapping,
      T fallback,
      Set<SnapshotSection> fallbacks) {
    Optional<JsonNode> raw = client.fetch(section.path());
    if (raw.isEmpty()) {
      metrics.upstreamFailure(section);
    }
    Optional<T> live = raw.flatMap(mapping);
    if (live.isPresent()) {
      return live.get();
    }
    fallbacks.add(section);
    metrics.fallbackUsed(section);
    return fallback;
  }
}
