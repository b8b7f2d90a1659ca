package com.codeheadsystems.cipherwire.identity;

import com.codeheadsystems.cipherwire.curve.Curve;
import com.codeheadsystems.cipherwire.curve.ECPublicKey;
import java.util.Objects;

/**
 * The long-term public identity of a user: a wrapper over an {@link ECPublicKey}.
 */
public final class IdentityKey {

  private final ECPublicKey publicKey;

  public IdentityKey(final ECPublicKey publicKey) {
    this.publicKey = Objects.requireNonNull(publicKey, "publicKey");
  }

  /**
   * Decodes a serialized identity key.
   *
   * @param bytes the serialized public key
   * @return the identity key
   */
  public static IdentityKey decode(final byte[] bytes) {
    return new IdentityKey(Curve.decodePoint(bytes));
  }

  public ECPublicKey publicKey() {
    return publicKey;
  }

  public byte[] serialize() {
    return publicKey.serialize();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof IdentityKey that && publicKey.equals(that.publicKey);
  }

  @Override
  public int hashCode() {
    return publicKey.hashCode();
  }

  @Override
  public String toString() {
    return "IdentityKey[" + publicKey + "]";
  }
}
