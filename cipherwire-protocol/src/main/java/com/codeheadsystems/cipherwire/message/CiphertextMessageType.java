package com.codeheadsystems.cipherwire.message;

import com.codeheadsystems.cipherwire.error.ProtocolException;

/**
 * Wire-type codes of the ciphertext message kinds, shared with the outer envelope type space.
 * The values are fixed and must not be renumbered.
 */
public enum CiphertextMessageType {
  WHISPER(2),
  PRE_KEY(3),
  // Later kinds line up with the envelope type numbers; the first two predate that alignment.
  SENDER_KEY(7);

  private final int value;

  CiphertextMessageType(int value) {
    this.value = value;
  }

  public int value() {
    return value;
  }

  /**
   * Looks up a type by its wire code.
   *
   * @param value the wire code
   * @return the ciphertext message type
   * @throws ProtocolException {@code INVALID_ARGUMENT} for an unknown code
   */
  public static CiphertextMessageType fromValue(final int value) {
    for (CiphertextMessageType type : values()) {
      if (type.value == value) {
        return type;
      }
    }
    throw ProtocolException.invalidArgument("unknown ciphertext message type " + value);
  }
}
