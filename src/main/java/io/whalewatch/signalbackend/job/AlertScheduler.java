package io.whalewatch.signalbackend.job;

import io.whalewatch.signalbackend.config.AlertProperties;
import io.whalewatch.signalbackend.model.DashboardSnapshot;
import io.whalewatch.signalbackend.notify.OperatorChannel;
import io.whalewatch.signalbackend.service.AlertEvaluator;
import io.whalewatch.signalbackend.service.SnapshotAggregatorService;
import io.whalewatch.signalbackend.service.SnapshotMetrics;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic alert cycle: snapshot, evaluate, and send one message to the operator chat when
 * anything fired.
 *
 * <p>Runs with a fixed delay, so a slow cycle postpones the next one instead of overlapping it.
 * Configure with {@code app.alerts.interval-ms} (default five minutes).
 */
@Component
public class AlertScheduler {
  private static final Logger log = LoggerFactory.getLogger(AlertScheduler.class);

  private final SnapshotAggregatorService aggregator;
  private final AlertEvaluator evaluator;
  private final OperatorChannel channel;
  private final SnapshotMetrics metrics;
  private final AlertProperties properties;

  public AlertScheduler(
      SnapshotAggregatorService aggregator,
      AlertEvaluator evaluator,
      OperatorChannel channel,
      SnapshotMetrics metrics,
      AlertProperties properties) {
    this.aggregator = aggregator;
    this.evaluator = evaluator;
    this.channel = channel;
    this.metrics = metrics;
    this.properties = properties;
  }

  @Scheduled(
      fixedDelayString = "${app.alerts.interval-ms:300000}",
      initialDelayString = "${app.alerts.interval-ms:300000}")
  public void scheduledCycle() {
    long t0 = System.currentTimeMillis();
    try {
      int sent = runCycle();
      log.debug("alert cycle done: {} line(s) sent ({} ms)", sent, System.currentTimeMillis() - t0);
    } catch (RuntimeException e) {
      log.warn("alert cycle error: {}", e.getMessage(), e);
    }
  }

  /** Returns the number of alert lines handed to the channel. */
  public int runCycle() {
    if (!properties.isEnabled() || !properties.hasChatId()) {
      log.debug("alert cycle skipped: alerts disabled or no chat id configured");
      return 0;
    }

    DashboardSnapshot snapshot = aggregator.buildSnapshot();
    List<String> alerts = evaluator.evaluate(snapshot);
    if (alerts.isEmpty()) {
      return 0;
    }

    String text = String.join("\n", alerts);
    if (!channel.send(properties.getChatId().trim(), text)) {
      metrics.dispatchFailure();
      return 0;
    }
    metrics.alertsDispatched(alerts.size());
    log.info("sent {} alert line(s) to operator chat", alerts.size());
    return alerts.size();
  }
}
