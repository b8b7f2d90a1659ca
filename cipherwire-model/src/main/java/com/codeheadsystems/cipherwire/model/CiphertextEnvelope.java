package com.codeheadsystems.cipherwire.model;

import com.codeheadsystems.cipherwire.message.CiphertextMessage;
import com.codeheadsystems.cipherwire.message.CiphertextMessageType;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Base64;

/**
 * Wire model that carries any ciphertext message between clients and a relay.
 * <p>
 * The relay never looks inside the message. It only stores and forwards the wire-type code and
 * the exact serialized bytes; the receiving client routes them back to the right codec through
 * {@link #message()}.
 *
 * @param type          the ciphertext message type code (2 pairwise, 3 pre-key, 7 sender-key)
 * @param contentBase64 base64-encoded serialized message
 */
public record CiphertextEnvelope(
    @JsonProperty("type") int type,
    @JsonProperty("content") String contentBase64) {

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  /**
   * Wraps a message for transport.
   *
   * @param message the ciphertext message
   * @return the ciphertext envelope
   */
  public static CiphertextEnvelope of(CiphertextMessage message) {
    return new CiphertextEnvelope(message.messageType().value(), B64.encodeToString(message.serialize()));
  }

  private static byte[] decode(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    try {
      return B64D.decode(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid base64 in field: " + fieldName, e);
    }
  }

  public byte[] content() {
    return decode(contentBase64, "content");
  }

  public CiphertextMessage message() {
    return CiphertextMessage.deserialize(CiphertextMessageType.fromValue(type), content());
  }
}
