package com.codeheadsystems.cipherwire.identity;

import com.codeheadsystems.cipherwire.common.RandomProvider;
import com.codeheadsystems.cipherwire.curve.Curve;
import com.codeheadsystems.cipherwire.curve.ECKeyPair;
import com.codeheadsystems.cipherwire.curve.ECPrivateKey;
import com.codeheadsystems.cipherwire.curve.ECPublicKey;
import com.codeheadsystems.cipherwire.error.ProtocolException;
import com.codeheadsystems.cipherwire.proto.FieldType;
import com.codeheadsystems.cipherwire.proto.ProtoFields;
import com.codeheadsystems.cipherwire.proto.ProtoWriter;
import java.util.Map;

/**
 * The private identity of a user.
 * <p>
 * Serialized form is a protobuf body: {@code 1: public_key (bytes), 2: private_key (bytes)}.
 *
 * @param identityKey the public identity
 * @param privateKey  the matching private key
 */
public record IdentityKeyPair(IdentityKey identityKey, ECPrivateKey privateKey) {

  private static final int PUBLIC_KEY_FIELD = 1;
  private static final int PRIVATE_KEY_FIELD = 2;

  private static final Map<Integer, FieldType> SCHEMA = Map.of(
      PUBLIC_KEY_FIELD, FieldType.BYTES,
      PRIVATE_KEY_FIELD, FieldType.BYTES);

  /**
   * Generates a new random identity.
   *
   * @param randomProvider the randomness source
   * @return the identity key pair
   */
  public static IdentityKeyPair generate(final RandomProvider randomProvider) {
    return fromKeyPair(Curve.generateKeyPair(randomProvider));
  }

  /**
   * Wraps an existing key pair.
   *
   * @param keyPair the key pair
   * @return the identity key pair
   */
  public static IdentityKeyPair fromKeyPair(final ECKeyPair keyPair) {
    return new IdentityKeyPair(new IdentityKey(keyPair.publicKey()), keyPair.privateKey());
  }

  /**
   * Rebuilds the identity from its private key alone.
   *
   * @param privateKey the private key
   * @return the identity key pair
   */
  public static IdentityKeyPair fromPrivateKey(final ECPrivateKey privateKey) {
    return new IdentityKeyPair(new IdentityKey(privateKey.publicKey()), privateKey);
  }

  /**
   * Decodes a pair written by {@link #serialize()}.
   *
   * @param bytes the serialized pair
   * @return the identity key pair
   * @throws ProtocolException {@code PROTOBUF_DECODING_ERROR} for a malformed body, key errors for
   *                           malformed key bytes
   */
  public static IdentityKeyPair deserialize(final byte[] bytes) {
    ProtoFields fields = ProtoFields.parse(bytes, SCHEMA);
    // proto3 semantics: an absent bytes field is empty, which then fails key decoding.
    byte[] publicKey = fields.bytes(PUBLIC_KEY_FIELD).orElse(new byte[0]);
    byte[] privateKey = fields.bytes(PRIVATE_KEY_FIELD).orElse(new byte[0]);
    return new IdentityKeyPair(IdentityKey.decode(publicKey), Curve.decodePrivatePoint(privateKey));
  }

  public ECPublicKey publicKey() {
    return identityKey.publicKey();
  }

  /**
   * Serializes both halves.
   *
   * @return the byte [ ]
   */
  public byte[] serialize() {
    return new ProtoWriter()
        .bytes(PUBLIC_KEY_FIELD, identityKey.serialize())
        .bytes(PRIVATE_KEY_FIELD, privateKey.serialize())
        .toByteArray();
  }
}
