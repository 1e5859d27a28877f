package io.whalewatch.signalbackend.model;

public record StablecoinFlows(
    Double inflowRatioPct,
    Double netFlow,
    String mode) {}
