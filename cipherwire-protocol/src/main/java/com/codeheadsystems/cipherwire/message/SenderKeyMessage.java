package com.codeheadsystems.cipherwire.message;

import com.codeheadsystems.cipherwire.auth.MessageSignature;
import com.codeheadsystems.cipherwire.common.ByteUtils;
import com.codeheadsystems.cipherwire.common.RandomProvider;
import com.codeheadsystems.cipherwire.curve.ECPrivateKey;
import com.codeheadsystems.cipherwire.curve.ECPublicKey;
import com.codeheadsystems.cipherwire.error.ProtocolException;
import com.codeheadsystems.cipherwire.proto.FieldType;
import com.codeheadsystems.cipherwire.proto.ProtoFields;
import com.codeheadsystems.cipherwire.proto.ProtoWriter;
import java.util.Arrays;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Group message encrypted under a sender key and signed with the distribution's signing key.
 * <p>
 * Wire format: {@code versionByte || body || signature[64]}, where body is
 * {@code 1: distribution_uuid, 2: chain_id, 3: iteration, 4: ciphertext}.
 */
public final class SenderKeyMessage implements CiphertextMessage {

  private static final Logger log = LoggerFactory.getLogger(SenderKeyMessage.class);

  public static final int SIGNATURE_LENGTH = MessageSignature.SIGNATURE_LENGTH;

  private static final int DISTRIBUTION_UUID_FIELD = 1;
  private static final int CHAIN_ID_FIELD = 2;
  private static final int ITERATION_FIELD = 3;
  private static final int CIPHERTEXT_FIELD = 4;

  private static final Map<Integer, FieldType> SCHEMA = Map.of(
      DISTRIBUTION_UUID_FIELD, FieldType.BYTES,
      CHAIN_ID_FIELD, FieldType.UINT32,
      ITERATION_FIELD, FieldType.UINT32,
      CIPHERTEXT_FIELD, FieldType.BYTES);

  private final MessageVersion messageVersion;
  private final UUID distributionId;
  private final int chainId;
  private final int iteration;
  private final byte[] ciphertext;
  private final byte[] serialized;

  private SenderKeyMessage(MessageVersion messageVersion, UUID distributionId, int chainId,
                           int iteration, byte[] ciphertext, byte[] serialized) {
    this.messageVersion = messageVersion;
    this.distributionId = distributionId;
    this.chainId = chainId;
    this.iteration = iteration;
    this.ciphertext = ciphertext;
    this.serialized = serialized;
  }

  /**
   * Builds and signs a new group message.
   *
   * @param messageVersion must be {@link MessageVersion#CURRENT}
   * @param distributionId the sender-key distribution this message belongs to
   * @param chainId        the sender's chain id
   * @param iteration      the chain iteration that produced the message key
   * @param ciphertext     the encrypted body
   * @param randomProvider randomness for the signature
   * @param signatureKey   the distribution's private signing key
   * @return the sender key message
   */
  public static SenderKeyMessage create(final MessageVersion messageVersion,
                                        final UUID distributionId,
                                        final int chainId,
                                        final int iteration,
                                        final byte[] ciphertext,
                                        final RandomProvider randomProvider,
                                        final ECPrivateKey signatureKey) {
    SignalMessage.requireCurrent(messageVersion);
    log.trace("create(distributionId={}, chainId={}, iteration={})", distributionId, chainId, iteration);
    byte[] body = new ProtoWriter()
        .bytes(DISTRIBUTION_UUID_FIELD, Uuids.toBytes(distributionId))
        .uint32(CHAIN_ID_FIELD, chainId)
        .uint32(ITERATION_FIELD, iteration)
        .bytes(CIPHERTEXT_FIELD, ciphertext)
        .toByteArray();
    byte[] signed = ByteUtils.concat(new byte[]{CiphertextVersion.pack(messageVersion)}, body);
    byte[] signature = MessageSignature.sign(signatureKey, signed, randomProvider);
    return new SenderKeyMessage(messageVersion, distributionId, chainId, iteration,
        ciphertext.clone(), ByteUtils.concat(signed, signature));
  }

  /**
   * Parses a serialized group message. The signature is not checked; call
   * {@link #verifySignature}.
   *
   * @param serialized the wire bytes
   * @return the sender key message
   * @throws ProtocolException {@code CIPHERTEXT_MESSAGE_TOO_SHORT} below 65 bytes, version errors,
   *                           or protobuf errors
   */
  public static SenderKeyMessage deserialize(final byte[] serialized) {
    if (serialized == null || serialized.length < 1 + SIGNATURE_LENGTH) {
      throw ProtocolException.ciphertextTooShort(serialized == null ? 0 : serialized.length);
    }
    MessageVersion messageVersion = CiphertextVersion.unpack(serialized[0], MessageKind.SENDER_KEY_MESSAGE);
    ProtoFields fields = ProtoFields.parse(serialized, 1, serialized.length - 1 - SIGNATURE_LENGTH, SCHEMA);

    byte[] distributionId = fields.requireBytes(DISTRIBUTION_UUID_FIELD);
    int chainId = fields.requireUint32(CHAIN_ID_FIELD);
    int iteration = fields.requireUint32(ITERATION_FIELD);
    byte[] ciphertext = fields.requireBytes(CIPHERTEXT_FIELD);

    return new SenderKeyMessage(messageVersion, Uuids.fromBytes(distributionId), chainId, iteration,
        ciphertext, serialized.clone());
  }

  /**
   * Checks the trailing signature against the stored bytes.
   *
   * @param signatureKey the distribution's public signing key
   * @throws ProtocolException {@code SIGNATURE_VALIDATION_FAILED} when it does not verify
   */
  public void verifySignature(final ECPublicKey signatureKey) {
    int signatureOffset = serialized.length - SIGNATURE_LENGTH;
    MessageSignature.verify(signatureKey,
        ByteUtils.slice(serialized, 0, signatureOffset),
        ByteUtils.tail(serialized, SIGNATURE_LENGTH));
  }

  public MessageVersion messageVersion() {
    return messageVersion;
  }

  public UUID distributionId() {
    return distributionId;
  }

  public int chainId() {
    return chainId;
  }

  public int iteration() {
    return iteration;
  }

  public byte[] ciphertext() {
    return ciphertext.clone();
  }

  @Override
  public CiphertextMessageType messageType() {
    return CiphertextMessageType.SENDER_KEY;
  }

  @Override
  public byte[] serialize() {
    return serialized.clone();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof SenderKeyMessage that && Arrays.equals(serialized, that.serialized);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(serialized);
  }
}
