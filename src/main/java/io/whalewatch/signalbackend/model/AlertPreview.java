package io.whalewatch.signalbackend.model;

import java.util.List;
import java.util.Set;

public record AlertPreview(List<String> alerts, Set<SnapshotSection> fallbackSections) {}
