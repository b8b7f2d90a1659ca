package com.codeheadsystems.cipherwire.curve;

import com.codeheadsystems.cipherwire.common.ByteUtils;
import com.codeheadsystems.cipherwire.common.RandomProvider;
import com.codeheadsystems.cipherwire.error.ProtocolException;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;

/**
 * Entry point for the curve key primitives: key generation and key decoding.
 * <p>
 * Public keys serialize as a one-byte type identifier followed by the 32-byte key.
 * Only the {@link #DJB_TYPE} identifier is defined.
 */
public class Curve {

  /** Type identifier of the 25519 key family. */
  public static final int DJB_TYPE = 0x05;

  /** Raw key length, public or private. */
  public static final int KEY_LENGTH = 32;

  /** Serialized public key length: type byte plus key. */
  public static final int SERIALIZED_PUBLIC_KEY_LENGTH = 1 + KEY_LENGTH;

  /** Length of every signature produced by {@link ECPrivateKey#calculateSignature}. */
  public static final int SIGNATURE_LENGTH = 64;

  private Curve() {
  }

  /**
   * Generates a fresh key pair.
   *
   * @param randomProvider the source of the private key bytes
   * @return the ec key pair
   */
  public static ECKeyPair generateKeyPair(final RandomProvider randomProvider) {
    ECPrivateKey privateKey = new ECPrivateKey(
        new Ed25519PrivateKeyParameters(randomProvider.randomBytes(KEY_LENGTH), 0));
    return new ECKeyPair(privateKey.publicKey(), privateKey);
  }

  /**
   * Decodes a serialized public key.
   *
   * @param bytes type byte followed by the key
   * @return the ec public key
   * @throws ProtocolException {@code NO_KEY_TYPE_IDENTIFIER} when empty, {@code BAD_KEY_TYPE} for an
   *                           unknown type byte, {@code BAD_KEY_LENGTH} when not 33 bytes
   */
  public static ECPublicKey decodePoint(final byte[] bytes) {
    if (bytes == null || bytes.length == 0) {
      throw ProtocolException.noKeyTypeIdentifier();
    }
    int type = bytes[0] & 0xFF;
    if (type != DJB_TYPE) {
      throw ProtocolException.badKeyType(type);
    }
    if (bytes.length != SERIALIZED_PUBLIC_KEY_LENGTH) {
      throw ProtocolException.badKeyLength(type, bytes.length);
    }
    return new ECPublicKey(ByteUtils.slice(bytes, 1, KEY_LENGTH));
  }

  /**
   * Decodes a serialized private key.
   *
   * @param bytes the 32 raw key bytes
   * @return the ec private key
   * @throws ProtocolException {@code BAD_KEY_LENGTH} when not 32 bytes
   */
  public static ECPrivateKey decodePrivatePoint(final byte[] bytes) {
    if (bytes == null || bytes.length != KEY_LENGTH) {
      throw ProtocolException.badKeyLength(DJB_TYPE, bytes == null ? 0 : bytes.length);
    }
    return new ECPrivateKey(new Ed25519PrivateKeyParameters(bytes, 0));
  }
}
