package io.whalewatch.signalbackend.model;

/** Net flow is outflow minus inflow: negative means more left exchanges than arrived. */
public record ExchangeFlows(
    Double totalInflow,
    Double totalOutflow,
    Double netFlow,
    String sentiment) {}
