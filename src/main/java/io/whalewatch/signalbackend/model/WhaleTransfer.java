package io.whalewatch.signalbackend.model;

public record WhaleTransfer(
    String token,
    String from,
    String to,
    Double amount) {}
