package com.codeheadsystems.cipherwire.message;

import com.codeheadsystems.cipherwire.auth.MessageMac;
import com.codeheadsystems.cipherwire.common.ByteUtils;
import com.codeheadsystems.cipherwire.curve.Curve;
import com.codeheadsystems.cipherwire.curve.ECPublicKey;
import com.codeheadsystems.cipherwire.error.ProtocolException;
import com.codeheadsystems.cipherwire.identity.IdentityKey;
import com.codeheadsystems.cipherwire.proto.FieldType;
import com.codeheadsystems.cipherwire.proto.ProtoFields;
import com.codeheadsystems.cipherwire.proto.ProtoWriter;
import java.util.Arrays;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pairwise ratchet message.
 * <p>
 * Wire format: {@code versionByte || body || mac[8]}, where body is a protobuf message
 * {@code 1: ratchet_key, 2: counter, 3: previous_counter, 4: ciphertext} and the MAC covers every
 * byte before it.
 */
public final class SignalMessage implements CiphertextMessage {

  private static final Logger log = LoggerFactory.getLogger(SignalMessage.class);

  public static final int MAC_LENGTH = MessageMac.MAC_LENGTH;

  private static final int RATCHET_KEY_FIELD = 1;
  private static final int COUNTER_FIELD = 2;
  private static final int PREVIOUS_COUNTER_FIELD = 3;
  private static final int CIPHERTEXT_FIELD = 4;

  private static final Map<Integer, FieldType> SCHEMA = Map.of(
      RATCHET_KEY_FIELD, FieldType.BYTES,
      COUNTER_FIELD, FieldType.UINT32,
      PREVIOUS_COUNTER_FIELD, FieldType.UINT32,
      CIPHERTEXT_FIELD, FieldType.BYTES);

  private final MessageVersion messageVersion;
  private final ECPublicKey senderRatchetKey;
  private final int counter;
  private final int previousCounter;
  private final byte[] ciphertext;
  private final byte[] serialized;

  private SignalMessage(MessageVersion messageVersion, ECPublicKey senderRatchetKey, int counter,
                        int previousCounter, byte[] ciphertext, byte[] serialized) {
    this.messageVersion = messageVersion;
    this.senderRatchetKey = senderRatchetKey;
    this.counter = counter;
    this.previousCounter = previousCounter;
    this.ciphertext = ciphertext;
    this.serialized = serialized;
  }

  /**
   * Builds and authenticates a new message.
   *
   * @param messageVersion   must be {@link MessageVersion#CURRENT}
   * @param macKey           the 32-byte MAC key for this message
   * @param senderRatchetKey the sender's current ratchet public key
   * @param counter          the message number in the sending chain
   * @param previousCounter  the length of the previous sending chain
   * @param ciphertext       the encrypted body
   * @param senderIdentity   the sender's identity key
   * @param receiverIdentity the receiver's identity key
   * @return the signal message
   * @throws ProtocolException {@code INVALID_ARGUMENT} for a non-current version,
   *                           {@code INVALID_MAC_KEY_LENGTH} for a bad key
   */
  public static SignalMessage create(final MessageVersion messageVersion,
                                     final byte[] macKey,
                                     final ECPublicKey senderRatchetKey,
                                     final int counter,
                                     final int previousCounter,
                                     final byte[] ciphertext,
                                     final IdentityKey senderIdentity,
                                     final IdentityKey receiverIdentity) {
    requireCurrent(messageVersion);
    if (macKey == null || macKey.length != MessageMac.MAC_KEY_LENGTH) {
      throw ProtocolException.invalidMacKeyLength(macKey == null ? 0 : macKey.length);
    }
    log.trace("create(counter={}, previousCounter={})", counter, previousCounter);
    byte[] body = new ProtoWriter()
        .bytes(RATCHET_KEY_FIELD, senderRatchetKey.serialize())
        .uint32(COUNTER_FIELD, counter)
        .uint32(PREVIOUS_COUNTER_FIELD, previousCounter)
        .bytes(CIPHERTEXT_FIELD, ciphertext)
        .toByteArray();
    byte[] authenticated = ByteUtils.concat(new byte[]{CiphertextVersion.pack(messageVersion)}, body);
    byte[] mac = MessageMac.compute(senderIdentity, receiverIdentity, macKey, authenticated);
    return new SignalMessage(messageVersion, senderRatchetKey, counter, previousCounter,
        ciphertext.clone(), ByteUtils.concat(authenticated, mac));
  }

  /**
   * Parses a serialized message. The MAC is not checked; call {@link #verifyMac}.
   *
   * @param serialized the wire bytes
   * @return the signal message
   * @throws ProtocolException {@code CIPHERTEXT_MESSAGE_TOO_SHORT} below 9 bytes, version errors,
   *                           protobuf errors, or key errors for a malformed ratchet key
   */
  public static SignalMessage deserialize(final byte[] serialized) {
    if (serialized == null || serialized.length < MAC_LENGTH + 1) {
      throw ProtocolException.ciphertextTooShort(serialized == null ? 0 : serialized.length);
    }
    MessageVersion messageVersion = CiphertextVersion.unpack(serialized[0], MessageKind.SIGNAL_MESSAGE);
    ProtoFields fields = ProtoFields.parse(serialized, 1, serialized.length - 1 - MAC_LENGTH, SCHEMA);

    byte[] ratchetKey = fields.requireBytes(RATCHET_KEY_FIELD);
    int counter = fields.requireUint32(COUNTER_FIELD);
    int previousCounter = fields.uint32(PREVIOUS_COUNTER_FIELD).orElse(0);
    byte[] ciphertext = fields.requireBytes(CIPHERTEXT_FIELD);

    return new SignalMessage(messageVersion, Curve.decodePoint(ratchetKey), counter, previousCounter,
        ciphertext, serialized.clone());
  }

  static void requireCurrent(final MessageVersion messageVersion) {
    if (messageVersion != MessageVersion.CURRENT) {
      throw ProtocolException.invalidArgument("only version " + MessageVersion.CURRENT.value()
          + " messages can be constructed, got " + messageVersion);
    }
  }

  /**
   * Checks the trailing MAC against the stored bytes.
   *
   * @param senderIdentity   the sender's identity key
   * @param receiverIdentity the receiver's identity key
   * @param macKey           the 32-byte MAC key
   * @return false when the MAC does not match
   * @throws ProtocolException {@code INVALID_MAC_KEY_LENGTH} when the key is not 32 bytes
   */
  public boolean verifyMac(final IdentityKey senderIdentity,
                           final IdentityKey receiverIdentity,
                           final byte[] macKey) {
    int macOffset = serialized.length - MAC_LENGTH;
    return MessageMac.verify(senderIdentity, receiverIdentity, macKey,
        ByteUtils.slice(serialized, 0, macOffset),
        ByteUtils.tail(serialized, MAC_LENGTH));
  }

  public MessageVersion messageVersion() {
    return messageVersion;
  }

  public ECPublicKey senderRatchetKey() {
    return senderRatchetKey;
  }

  public int counter() {
    return counter;
  }

  public int previousCounter() {
    return previousCounter;
  }

  /**
   * The encrypted body.
   *
   * @return a copy of the ciphertext
   */
  public byte[] body() {
    return ciphertext.clone();
  }

  @Override
  public CiphertextMessageType messageType() {
    return CiphertextMessageType.WHISPER;
  }

  @Override
  public byte[] serialize() {
    return serialized.clone();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof SignalMessage that && Arrays.equals(serialized, that.serialized);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(serialized);
  }
}
