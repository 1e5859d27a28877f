package io.whalewatch.signalbackend.model;

public record MarketOverview(
    String symbol,
    Double priceUsd,
    Double priceChange24hPct,
    Double volume24hUsd,
    Double marketCapUsd) {}
