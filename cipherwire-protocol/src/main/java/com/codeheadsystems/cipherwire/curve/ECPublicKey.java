package com.codeheadsystems.cipherwire.curve;

import com.codeheadsystems.cipherwire.common.ByteUtils;
import java.math.BigInteger;
import java.util.Arrays;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.bouncycastle.util.encoders.Hex;

/**
 * A public key of the {@link Curve#DJB_TYPE} family. Immutable.
 */
public final class ECPublicKey implements Comparable<ECPublicKey> {

  private final byte[] publicKey;

  ECPublicKey(byte[] publicKey) {
    this.publicKey = publicKey;
  }

  /**
   * Serializes as the type byte followed by the raw key.
   *
   * @return the 33-byte encoding
   */
  public byte[] serialize() {
    return ByteUtils.concat(new byte[]{(byte) Curve.DJB_TYPE}, publicKey);
  }

  /**
   * Checks a signature over {@code message}.
   * <p>
   * A signature of the wrong length, or key bytes that are not a valid curve point, verify as
   * {@code false}.
   *
   * @param message   the signed bytes
   * @param signature the signature
   * @return true when the signature is valid for this key
   */
  public boolean verifySignature(final byte[] message, final byte[] signature) {
    if (signature == null || signature.length != Curve.SIGNATURE_LENGTH) {
      return false;
    }
    Ed25519PublicKeyParameters params;
    try {
      params = new Ed25519PublicKeyParameters(publicKey, 0);
    } catch (IllegalArgumentException e) {
      return false;
    }
    Ed25519Signer verifier = new Ed25519Signer();
    verifier.init(false, params);
    verifier.update(message, 0, message.length);
    return verifier.verifySignature(signature);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ECPublicKey that && Arrays.equals(this.publicKey, that.publicKey);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(publicKey);
  }

  @Override
  public int compareTo(ECPublicKey another) {
    return new BigInteger(1, publicKey).compareTo(new BigInteger(1, another.publicKey));
  }

  @Override
  public String toString() {
    return "ECPublicKey[" + Hex.toHexString(publicKey) + "]";
  }
}
