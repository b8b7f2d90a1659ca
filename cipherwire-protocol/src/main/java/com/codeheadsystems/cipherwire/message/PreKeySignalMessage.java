package com.codeheadsystems.cipherwire.message;

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
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session-establishing message that wraps the first {@link SignalMessage} of a session with
 * the key material the receiver needs to build that session.
 * <p>
 * Wire format: {@code versionByte || body}. No tag of its own; the inner message carries the MAC.
 */
public final class PreKeySignalMessage implements CiphertextMessage {

  private static final Logger log = LoggerFactory.getLogger(PreKeySignalMessage.class);

  private static final int PRE_KEY_ID_FIELD = 1;
  private static final int BASE_KEY_FIELD = 2;
  private static final int IDENTITY_KEY_FIELD = 3;
  private static final int MESSAGE_FIELD = 4;
  private static final int REGISTRATION_ID_FIELD = 5;
  private static final int SIGNED_PRE_KEY_ID_FIELD = 6;

  private static final Map<Integer, FieldType> SCHEMA = Map.of(
      PRE_KEY_ID_FIELD, FieldType.UINT32,
      BASE_KEY_FIELD, FieldType.BYTES,
      IDENTITY_KEY_FIELD, FieldType.BYTES,
      MESSAGE_FIELD, FieldType.BYTES,
      REGISTRATION_ID_FIELD, FieldType.UINT32,
      SIGNED_PRE_KEY_ID_FIELD, FieldType.UINT32);

  private final MessageVersion messageVersion;
  private final int registrationId;
  private final OptionalInt preKeyId;
  private final int signedPreKeyId;
  private final ECPublicKey baseKey;
  private final IdentityKey identityKey;
  private final SignalMessage message;
  private final byte[] serialized;

  private PreKeySignalMessage(MessageVersion messageVersion, int registrationId, OptionalInt preKeyId,
                              int signedPreKeyId, ECPublicKey baseKey, IdentityKey identityKey,
                              SignalMessage message, byte[] serialized) {
    this.messageVersion = messageVersion;
    this.registrationId = registrationId;
    this.preKeyId = preKeyId;
    this.signedPreKeyId = signedPreKeyId;
    this.baseKey = baseKey;
    this.identityKey = identityKey;
    this.message = message;
    this.serialized = serialized;
  }

  /**
   * Builds a new pre-key message around an already authenticated inner message.
   *
   * @param messageVersion must be {@link MessageVersion#CURRENT}
   * @param registrationId the sender's registration id
   * @param preKeyId       the one-time pre-key used, or empty if none
   * @param signedPreKeyId the signed pre-key used
   * @param baseKey        the sender's ephemeral base key
   * @param identityKey    the sender's identity key
   * @param message        the inner pairwise message
   * @return the pre-key signal message
   */
  public static PreKeySignalMessage create(final MessageVersion messageVersion,
                                           final int registrationId,
                                           final OptionalInt preKeyId,
                                           final int signedPreKeyId,
                                           final ECPublicKey baseKey,
                                           final IdentityKey identityKey,
                                           final SignalMessage message) {
    SignalMessage.requireCurrent(messageVersion);
    log.trace("create(registrationId={}, preKeyId={}, signedPreKeyId={})",
        registrationId, preKeyId, signedPreKeyId);
    ProtoWriter writer = new ProtoWriter();
    preKeyId.ifPresent(id -> writer.uint32(PRE_KEY_ID_FIELD, id));
    byte[] body = writer
        .bytes(BASE_KEY_FIELD, baseKey.serialize())
        .bytes(IDENTITY_KEY_FIELD, identityKey.serialize())
        .bytes(MESSAGE_FIELD, message.serialize())
        .uint32(REGISTRATION_ID_FIELD, registrationId)
        .uint32(SIGNED_PRE_KEY_ID_FIELD, signedPreKeyId)
        .toByteArray();
    byte[] serialized = ByteUtils.concat(new byte[]{CiphertextVersion.pack(messageVersion)}, body);
    return new PreKeySignalMessage(messageVersion, registrationId, preKeyId, signedPreKeyId,
        baseKey, identityKey, message, serialized);
  }

  /**
   * Parses a serialized pre-key message and its inner pairwise message.
   *
   * @param serialized the wire bytes
   * @return the pre-key signal message
   * @throws ProtocolException {@code CIPHERTEXT_MESSAGE_TOO_SHORT} for empty input, version errors,
   *                           protobuf errors, key errors, or any error of the inner message
   */
  public static PreKeySignalMessage deserialize(final byte[] serialized) {
    if (serialized == null || serialized.length == 0) {
      throw ProtocolException.ciphertextTooShort(0);
    }
    MessageVersion messageVersion = CiphertextVersion.unpack(serialized[0], MessageKind.PRE_KEY_SIGNAL_MESSAGE);
    ProtoFields fields = ProtoFields.parse(serialized, 1, serialized.length - 1, SCHEMA);

    byte[] baseKey = fields.requireBytes(BASE_KEY_FIELD);
    byte[] identityKey = fields.requireBytes(IDENTITY_KEY_FIELD);
    byte[] message = fields.requireBytes(MESSAGE_FIELD);
    int signedPreKeyId = fields.requireUint32(SIGNED_PRE_KEY_ID_FIELD);
    int registrationId = fields.uint32(REGISTRATION_ID_FIELD).orElse(0);
    OptionalInt preKeyId = fields.uint32(PRE_KEY_ID_FIELD);

    return new PreKeySignalMessage(messageVersion, registrationId, preKeyId, signedPreKeyId,
        Curve.decodePoint(baseKey), IdentityKey.decode(identityKey),
        SignalMessage.deserialize(message), serialized.clone());
  }

  public MessageVersion messageVersion() {
    return messageVersion;
  }

  public int registrationId() {
    return registrationId;
  }

  public OptionalInt preKeyId() {
    return preKeyId;
  }

  public int signedPreKeyId() {
    return signedPreKeyId;
  }

  public ECPublicKey baseKey() {
    return baseKey;
  }

  public IdentityKey identityKey() {
    return identityKey;
  }

  public SignalMessage message() {
    return message;
  }

  @Override
  public CiphertextMessageType messageType() {
    return CiphertextMessageType.PRE_KEY;
  }

  @Override
  public byte[] serialize() {
    return serialized.clone();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PreKeySignalMessage that && Arrays.equals(serialized, that.serialized);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(serialized);
  }
}
