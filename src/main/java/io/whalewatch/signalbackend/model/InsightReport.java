package io.whalewatch.signalbackend.model;

import java.util.List;
import java.util.Set;

public record InsightReport(List<String> lines, Set<SnapshotSection> fallbackSections) {}
