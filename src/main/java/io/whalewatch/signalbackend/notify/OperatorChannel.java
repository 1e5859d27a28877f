package io.whalewatch.signalbackend.notify;

/** Outbound text channel to the operator who receives alerts. */
public interface OperatorChannel {

  /** Returns true when the message was accepted by the channel. */
  boolean send(String chatId, String text);
}
