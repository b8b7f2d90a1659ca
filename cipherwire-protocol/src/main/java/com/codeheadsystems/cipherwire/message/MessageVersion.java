package com.codeheadsystems.cipherwire.message;

import com.codeheadsystems.cipherwire.error.ProtocolException;

/**
 * The version of the message chain format.
 * <p>
 * {@link #V2} is never produced and never accepted; it exists so version errors can name it.
 */
public enum MessageVersion {
  V2(2),
  V3(CiphertextVersion.CURRENT_VERSION);

  /** The version every constructor produces. */
  public static final MessageVersion CURRENT = V3;

  private final int value;

  MessageVersion(int value) {
    this.value = value;
  }

  public int value() {
    return value;
  }

  /**
   * Maps a 32-bit version field to its enumerator.
   *
   * @param value       the unsigned version value
   * @param messageKind the message family, for the error message
   * @return the message version
   * @throws ProtocolException {@code UNRECOGNIZED_MESSAGE_VERSION} when no enumerator matches
   */
  public static MessageVersion fromValue(final long value, final MessageKind messageKind) {
    for (MessageVersion version : values()) {
      if (version.value == value) {
        return version;
      }
    }
    throw ProtocolException.unrecognizedMessageVersion(value, messageKind);
  }
}
