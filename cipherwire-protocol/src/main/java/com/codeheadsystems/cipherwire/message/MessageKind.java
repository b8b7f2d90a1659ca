package com.codeheadsystems.cipherwire.message;

/**
 * Names the message family a version failure belongs to. Diagnostic only; it has no wire value.
 */
public enum MessageKind {
  SIGNAL_MESSAGE("SignalMessage"),
  PRE_KEY_SIGNAL_MESSAGE("PreKeySignalMessage"),
  SENDER_KEY_MESSAGE("SenderKeyMessage"),
  SENDER_KEY_DISTRIBUTION_MESSAGE("SenderKeyDistributionMessage");

  private final String displayName;

  MessageKind(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }
}
