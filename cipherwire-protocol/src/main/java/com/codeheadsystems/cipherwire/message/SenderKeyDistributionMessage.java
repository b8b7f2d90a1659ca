package com.codeheadsystems.cipherwire.message;

import com.codeheadsystems.cipherwire.common.ByteUtils;
import com.codeheadsystems.cipherwire.curve.Curve;
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
 * Control message that hands a group member the chain key and signing key of a sender-key
 * distribution. It carries no tag; it is trusted because it arrives over an authenticated
 * pairwise session.
 * <p>
 * Wire format: {@code versionByte || body}, where body is
 * {@code 1: distribution_uuid, 2: chain_id, 3: iteration, 4: chain_key, 5: signing_key}.
 */
public final class SenderKeyDistributionMessage {

  private static final Logger log = LoggerFactory.getLogger(SenderKeyDistributionMessage.class);

  public static final int CHAIN_KEY_LENGTH = 32;

  /** Shortest buffer that can hold a version byte, a chain key and a signing key. */
  public static final int MINIMUM_LENGTH = 1 + CHAIN_KEY_LENGTH + Curve.KEY_LENGTH;

  private static final int DISTRIBUTION_UUID_FIELD = 1;
  private static final int CHAIN_ID_FIELD = 2;
  private static final int ITERATION_FIELD = 3;
  private static final int CHAIN_KEY_FIELD = 4;
  private static final int SIGNING_KEY_FIELD = 5;

  private static final Map<Integer, FieldType> SCHEMA = Map.of(
      DISTRIBUTION_UUID_FIELD, FieldType.BYTES,
      CHAIN_ID_FIELD, FieldType.UINT32,
      ITERATION_FIELD, FieldType.UINT32,
      CHAIN_KEY_FIELD, FieldType.BYTES,
      SIGNING_KEY_FIELD, FieldType.BYTES);

  private final MessageVersion messageVersion;
  private final UUID distributionId;
  private final int chainId;
  private final int iteration;
  private final byte[] chainKey;
  private final ECPublicKey signingKey;
  private final byte[] serialized;

  private SenderKeyDistributionMessage(MessageVersion messageVersion, UUID distributionId, int chainId,
                                       int iteration, byte[] chainKey, ECPublicKey signingKey,
                                       byte[] serialized) {
    this.messageVersion = messageVersion;
    this.distributionId = distributionId;
    this.chainId = chainId;
    this.iteration = iteration;
    this.chainKey = chainKey;
    this.signingKey = signingKey;
    this.serialized = serialized;
  }

  /**
   * Builds a new distribution message.
   *
   * @param messageVersion must be {@link MessageVersion#CURRENT}
   * @param distributionId the distribution id
   * @param chainId        the sender's chain id
   * @param iteration      the chain iteration the chain key belongs to
   * @param chainKey       the 32-byte chain key
   * @param signingKey     the distribution's public signing key
   * @return the sender key distribution message
   * @throws ProtocolException {@code INVALID_ARGUMENT} for a non-current version or a chain key that
   *                           is not 32 bytes
   */
  public static SenderKeyDistributionMessage create(final MessageVersion messageVersion,
                                                    final UUID distributionId,
                                                    final int chainId,
                                                    final int iteration,
                                                    final byte[] chainKey,
                                                    final ECPublicKey signingKey) {
    SignalMessage.requireCurrent(messageVersion);
    if (chainKey == null || chainKey.length != CHAIN_KEY_LENGTH) {
      throw ProtocolException.invalidArgument("chain key must be " + CHAIN_KEY_LENGTH + " bytes, got "
          + (chainKey == null ? 0 : chainKey.length));
    }
    log.trace("create(distributionId={}, chainId={}, iteration={})", distributionId, chainId, iteration);
    byte[] body = new ProtoWriter()
        .bytes(DISTRIBUTION_UUID_FIELD, Uuids.toBytes(distributionId))
        .uint32(CHAIN_ID_FIELD, chainId)
        .uint32(ITERATION_FIELD, iteration)
        .bytes(CHAIN_KEY_FIELD, chainKey)
        .bytes(SIGNING_KEY_FIELD, signingKey.serialize())
        .toByteArray();
    byte[] serialized = ByteUtils.concat(new byte[]{CiphertextVersion.pack(messageVersion)}, body);
    return new SenderKeyDistributionMessage(messageVersion, distributionId, chainId, iteration,
        chainKey.clone(), signingKey, serialized);
  }

  /**
   * Parses a serialized distribution message.
   *
   * @param serialized the wire bytes
   * @return the sender key distribution message
   * @throws ProtocolException {@code CIPHERTEXT_MESSAGE_TOO_SHORT} below 65 bytes, version errors,
   *                           protobuf errors, {@code INVALID_PROTOBUF_ENCODING} for a wrong-length
   *                           id or key, or key errors for a malformed signing key
   */
  public static SenderKeyDistributionMessage deserialize(final byte[] serialized) {
    if (serialized == null || serialized.length < MINIMUM_LENGTH) {
      throw ProtocolException.ciphertextTooShort(serialized == null ? 0 : serialized.length);
    }
    MessageVersion messageVersion = CiphertextVersion.unpack(serialized[0],
        MessageKind.SENDER_KEY_DISTRIBUTION_MESSAGE);
    ProtoFields fields = ProtoFields.parse(serialized, 1, serialized.length - 1, SCHEMA);

    byte[] distributionId = fields.requireBytes(DISTRIBUTION_UUID_FIELD);
    int chainId = fields.requireUint32(CHAIN_ID_FIELD);
    int iteration = fields.requireUint32(ITERATION_FIELD);
    byte[] chainKey = fields.requireBytes(CHAIN_KEY_FIELD);
    byte[] signingKey = fields.requireBytes(SIGNING_KEY_FIELD);

    if (chainKey.length != CHAIN_KEY_LENGTH || signingKey.length != Curve.SERIALIZED_PUBLIC_KEY_LENGTH) {
      log.debug("deserialize(): chain key {} bytes, signing key {} bytes", chainKey.length, signingKey.length);
      throw ProtocolException.invalidProtobufEncoding();
    }

    return new SenderKeyDistributionMessage(messageVersion, Uuids.fromBytes(distributionId), chainId,
        iteration, chainKey, Curve.decodePoint(signingKey), serialized.clone());
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

  public byte[] chainKey() {
    return chainKey.clone();
  }

  public ECPublicKey signingKey() {
    return signingKey;
  }

  public byte[] serialize() {
    return serialized.clone();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof SenderKeyDistributionMessage that && Arrays.equals(serialized, that.serialized);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(serialized);
  }
}
