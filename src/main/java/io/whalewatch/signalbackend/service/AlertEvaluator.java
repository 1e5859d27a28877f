package io.whalewatch.signalbackend.service;

import io.whalewatch.signalbackend.config.AlertProperties;
import io.whalewatch.signalbackend.model.DashboardSnapshot;
import io.whalewatch.signalbackend.model.WhaleTransfer;
import io.whalewatch.signalbackend.util.UsdFormat;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class AlertEvaluator {
  private final double accumulationNetFlow;
  private final double distributionNetFlow;
  private final double bigTransferAmount;

  public AlertEvaluator(AlertProperties properties) {
    this.accumulationNetFlow = properties.getAccumulationNetFlow();
    this.distributionNetFlow = properties.getDistributionNetFlow();
    this.bigTransferAmount = properties.getBigTransferAmount();
  }

  /**
   * Flow thresholds are inclusive; every transfer at or above the big-transfer amount gets its
   * own line, in upstream order. An empty result means there is nothing to send.
   */
  public List<String> evaluate(DashboardSnapshot snapshot) {
    List<String> alerts = new ArrayList<>();

    Double netFlow = snapshot.exchangeFlows() == null ? null : snapshot.exchangeFlows().netFlow();
    if (netFlow != null) {
      if (netFlow <= accumulationNetFlow) {
        alerts.add("🚨 Strong accumulation: Net Flow = " + UsdFormat.usd(netFlow));
      }
      if (netFlow >= distributionNetFlow) {
        alerts.add("⚠ Strong distribution: Net Flow = " + UsdFormat.usd(netFlow));
      }
    }

    for (WhaleTransfer t : snapshot.whaleTransfers()) {
      if (t.amount() != null && t.amount() >= bigTransferAmount) {
        alerts.add(
            "🐋 Whale transfer: "
                + UsdFormat.usd(t.amount())
                + " "
                + (t.token() == null ? "" : t.token())
                + " from "
                + UsdFormat.shortAddress(t.from())
                + " to "
                + UsdFormat.shortAddress(t.to()));
      }
    }
    return alerts;
  }
}
