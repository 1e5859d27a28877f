package io.whalewatch.signalbackend.service;

import io.whalewatch.signalbackend.model.DashboardSnapshot;
import io.whalewatch.signalbackend.util.UsdFormat;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Turns a snapshot into human-readable market insight lines.
 *
 * <p>Line order is fixed: price header, flow direction, stablecoin posture, combined reading,
 * timestamp. A line whose inputs are unknown is left out.
 */
@Service
public class SentimentEngine {
  static final double RISK_OFF_RATIO_PCT = 70;
  static final double DEPLOYING_RATIO_PCT = 30;

  static final String FLOWS_ACCUMULATION = "🔵 Flows: Net outflows → accumulation (bullish signal).";
  static final String FLOWS_DISTRIBUTION = "🔴 Flows: Net inflows → distribution / sell pressure.";
  static final String FLOWS_NEUTRAL = "⚪ Flows: Neutral.";
  static final String STABLE_RISK_OFF =
      "🟠 Stablecoin: High inflow ratio → risk-off (whales holding safety).";
  static final String STABLE_DEPLOYING =
      "🟢 Stablecoin: Low ratio → deploying into crypto (accumulation).";
  static final String STABLE_MIXED = "🟡 Stablecoin: Mixed / transitional state.";
  static final String COMBINED_ACCUMULATION =
      "✅ Combined: Whales pulling assets and deploying stablecoins → strong accumulation.";
  static final String COMBINED_DIVERGENCE =
      "⚠ Tokens leaving but stablecoins coming in, watch closely.";
  static final String COMBINED_BEARISH = "❌ Distribution + stablecoin build-up → bearish posture.";

  private static final DateTimeFormatter AS_OF =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

  private final Clock clock;

  public SentimentEngine(Clock clock) {
    this.clock = clock;
  }

  public List<String> deriveInsight(DashboardSnapshot snapshot) {
    Double netFlow = snapshot.exchangeFlows() == null ? null : snapshot.exchangeFlows().netFlow();
    Double ratio = snapshot.stablecoin() == null ? null : snapshot.stablecoin().inflowRatioPct();
    Double stableNet = snapshot.stablecoin() == null ? null : snapshot.stablecoin().netFlow();

    List<String> lines = new ArrayList<>();
    lines.add(header(snapshot));

    if (netFlow != null) {
      lines.add(flowLine(netFlow));
    }
    if (ratio != null) {
      lines.add(stablecoinLine(ratio));
    }
    if (netFlow != null && stableNet != null) {
      String combined = combinedLine(netFlow, stableNet);
      if (combined != null) lines.add(combined);
    }

    lines.add("As of " + AS_OF.format(clock.instant()) + " UTC");
    return lines;
  }

  private static String header(DashboardSnapshot snapshot) {
    String symbol = "ETH";
    Double price = null;
    if (snapshot.market() != null) {
      if (snapshot.market().symbol() != null && !snapshot.market().symbol().isBlank()) {
        symbol = snapshot.market().symbol();
      }
      price = snapshot.market().priceUsd();
    }
    return "Insight - " + symbol + " " + UsdFormat.usd(price);
  }

  static String flowLine(double netFlow) {
    if (netFlow < 0) return FLOWS_ACCUMULATION;
    if (netFlow > 0) return FLOWS_DISTRIBUTION;
    return FLOWS_NEUTRAL;
  }

  static String stablecoinLine(double ratioPct) {
    if (ratioPct >= RISK_OFF_RATIO_PCT) return STABLE_RISK_OFF;
    if (ratioPct <= DEPLOYING_RATIO_PCT) return STABLE_DEPLOYING;
    return STABLE_MIXED;
  }

  /** Only three sign combinations have a reading; the rest (zeros included) return null. */
  static String combinedLine(double netFlow, double stableNet) {
    if (netFlow < 0 && stableNet < 0) return COMBINED_ACCUMULATION;
    if (netFlow < 0 && stableNet > 0) return COMBINED_DIVERGENCE;
    if (netFlow > 0 && stableNet > 0) return COMBINED_BEARISH;
    return null;
  }
}
