package io.whalewatch.signalbackend.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.whalewatch.signalbackend.config.DashboardProperties;
import io.whalewatch.signalbackend.model.SnapshotSection;
import org.springframework.stereotype.Component;

@Component
public class SnapshotMetrics {
  private final MeterRegistry meterRegistry;
  private final DashboardProperties dashboardProperties;

  public SnapshotMetrics(MeterRegistry meterRegistry, DashboardProperties dashboardProperties) {
    this.meterRegistry = meterRegistry;
    this.dashboardProperties = dashboardProperties;
  }

  public void upstreamFailure(SnapshotSection section) {
    if (!dashboardProperties.isMetricsEnabled()) return;
    meterRegistry.counter("dashboard.upstream.failure", "section", section.metricTag()).increment();
  }

  public void fallbackUsed(SnapshotSection section) {
    if (!dashboardProperties.isMetricsEnabled()) return;
    meterRegistry.counter("dashboard.snapshot.fallback", "section", section.metricTag()).increment();
  }

  public void alertsDispatched(int lines) {
    if (!dashboardProperties.isMetricsEnabled()) return;
    meterRegistry.counter("alerts.dispatched").increment(lines);
  }

  public void dispatchFailure() {
    if (!dashboardProperties.isMetricsEnabled()) return;
    meterRegistry.counter("alerts.dispatch.failure").increment();
  }
}
