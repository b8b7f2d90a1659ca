package com.codeheadsystems.cipherwire.message;

/**
 * A message that travels as opaque ciphertext between a session or group and its peers.
 * <p>
 * Exactly three kinds exist. Transport code sees only the type code and the serialized bytes;
 * session code inspects the concrete kind.
 */
public sealed interface CiphertextMessage permits SignalMessage, PreKeySignalMessage, SenderKeyMessage {

  /**
   * Decodes bytes as the kind named by {@code type}.
   *
   * @param type       the wire-type code that accompanied the bytes
   * @param serialized the message bytes
   * @return the ciphertext message
   */
  static CiphertextMessage deserialize(final CiphertextMessageType type, final byte[] serialized) {
    return switch (type) {
      case WHISPER -> SignalMessage.deserialize(serialized);
      case PRE_KEY -> PreKeySignalMessage.deserialize(serialized);
      case SENDER_KEY -> SenderKeyMessage.deserialize(serialized);
    };
  }

  /**
   * The stable wire-type code of this kind.
   *
   * @return the ciphertext message type
   */
  CiphertextMessageType messageType();

  /**
   * The exact bytes this message was built or parsed from.
   *
   * @return a copy of the serialized form
   */
  byte[] serialize();
}
