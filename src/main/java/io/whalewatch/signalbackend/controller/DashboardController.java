package io.whalewatch.signalbackend.controller;

import io.whalewatch.signalbackend.model.AlertPreview;
import io.whalewatch.signalbackend.model.DashboardSnapshot;
import io.whalewatch.signalbackend.model.ExchangeFlows;
import io.whalewatch.signalbackend.model.InsightReport;
import io.whalewatch.signalbackend.model.MarketOverview;
import io.whalewatch.signalbackend.model.StablecoinFlows;
import io.whalewatch.signalbackend.model.WhaleTransfer;
import io.whalewatch.signalbackend.service.AlertEvaluator;
import io.whalewatch.signalbackend.service.SentimentEngine;
import io.whalewatch.signalbackend.service.SnapshotAggregatorService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/** Read-only views over a fresh snapshot; every request fetches upstream again. */
@RestController
@RequestMapping(path = "/api/v1", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class DashboardController {
  private final SnapshotAggregatorService aggregator;
  private final SentimentEngine sentiment;
  private final AlertEvaluator alerts;

  public DashboardController(
      SnapshotAggregatorService aggregator, SentimentEngine sentiment, AlertEvaluator alerts) {
    this.aggregator = aggregator;
    this.sentiment = sentiment;
    this.alerts = alerts;
  }

  @GetMapping("/overview")
  public Mono<DashboardSnapshot> overview() {
    return snapshot();
  }

  @GetMapping("/market")
  public Mono<MarketOverview> market() {
    return snapshot().map(DashboardSnapshot::market);
  }

  @GetMapping("/flows")
  public Mono<ExchangeFlows> flows() {
    return snapshot().map(DashboardSnapshot::exchangeFlows);
  }

  @GetMapping("/risk")
  public Mono<StablecoinFlows> risk() {
    return snapshot().map(DashboardSnapshot::stablecoin);
  }

  @GetMapping("/whales")
  public Mono<List<WhaleTransfer>> whales(
      @RequestParam(value = "limit", required = false, defaultValue = "10") @Min(1) @Max(100)
          int limit) {
    return snapshot()
        .map(s -> s.whaleTransfers().stream().limit(limit).toList());
  }

  @GetMapping("/insight")
  public Mono<InsightReport> insight() {
    return snapshot()
        .map(s -> new InsightReport(sentiment.deriveInsight(s), s.fallbackSections()));
  }

  @GetMapping("/alerts")
  public Mono<AlertPreview> alerts() {
    return snapshot().map(s -> new AlertPreview(alerts.evaluate(s), s.fallbackSections()));
  }

  private Mono<DashboardSnapshot> snapshot() {
    return Mono.fromCallable(aggregator::buildSnapshot).subscribeOn(Schedulers.boundedElastic());
  }
}
