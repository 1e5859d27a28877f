package io.whalewatch.signalbackend.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.whalewatch.signalbackend.model.ExchangeFlows;
import io.whalewatch.signalbackend.model.MarketOverview;
import io.whalewatch.signalbackend.model.StablecoinFlows;
import io.whalewatch.signalbackend.model.WhaleTransfer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Maps dashboard API payloads onto snapshot sections.
 *
 * <p>An object section is usable only when it is a JSON object with at least one field; the
 * whale transfer section only when it is a JSON array, empty or not. Numeric fields that are
 * absent or not numbers map to {@code null}.
 */
@Component
public class SnapshotMapper {

  public Optional<MarketOverview> market(JsonNode node) {
    if (!isNonEmptyObject(node)) return Optional.empty();
    return Optional.of(
        new MarketOverview(
            text(node, "symbol"),
            number(node, "price_usd"),
            number(node, "price_change_24h_pct"),
            number(node, "volume_24h_usd"),
            number(node, "market_cap_usd")));
  }

  public Optional<ExchangeFlows> exchangeFlows(JsonNode node) {
    if (!isNonEmptyObject(node)) return Optional.empty();
    return Optional.of(
        new ExchangeFlows(
            number(node, "total_inflow"),
            number(node, "total_outflow"),
            number(node, "net_flow"),
            text(node, "sentiment")));
  }

  public Optional<StablecoinFlows> stablecoin(JsonNode node) {
    if (!isNonEmptyObject(node)) return Optional.empty();
    return Optional.of(
        new StablecoinFlows(
            number(node, "stablecoin_inflow_ratio_pct"),
            number(node, "stablecoin_net_flow"),
            text(node, "mode")));
  }

  public Optional<List<WhaleTransfer>> whaleTransfers(JsonNode node) {
    if (node == null || !node.isArray()) return Optional.empty();
    List<WhaleTransfer> out = new ArrayList<>();
    for (JsonNode row : node) {
      if (!row.isObject()) continue;
      out.add(
          new WhaleTransfer(
              text(row, "token"), text(row, "from"), text(row, "to"), number(row, "amount")));
    }
    return Optional.of(out);
  }

  private static boolean isNonEmptyObject(JsonNode node) {
    return node != null && node.isObject() && node.size() > 0;
  }

  private static Double number(JsonNode node, String field) {
    JsonNode value = node.path(field);
    return value.isNumber() ? value.asDouble() : null;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isMissingNode() || value.isNull() || !value.isValueNode()) return null;
    return value.asText();
  }
}
