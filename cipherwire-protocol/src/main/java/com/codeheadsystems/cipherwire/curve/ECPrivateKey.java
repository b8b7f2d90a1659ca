package com.codeheadsystems.cipherwire.curve;

import com.codeheadsystems.cipherwire.common.RandomProvider;
import java.util.Arrays;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

/**
 * A private key of the {@link Curve#DJB_TYPE} family. Immutable.
 */
public final class ECPrivateKey {

  private final Ed25519PrivateKeyParameters params;

  ECPrivateKey(Ed25519PrivateKeyParameters params) {
    this.params = params;
  }

  /**
   * Serializes the raw 32 key bytes, readable by {@link Curve#decodePrivatePoint}.
   *
   * @return the byte [ ]
   */
  public byte[] serialize() {
    return params.getEncoded();
  }

  /**
   * Derives the matching public key.
   *
   * @return the ec public key
   */
  public ECPublicKey publicKey() {
    return new ECPublicKey(params.generatePublicKey().getEncoded());
  }

  /**
   * Signs {@code message}, producing {@link Curve#SIGNATURE_LENGTH} bytes.
   * <p>
   * Ed25519 derives its nonce from the key and message, so this implementation never draws
   * from {@code randomProvider}; schemes with a random nonce take it from there.
   *
   * @param message        the bytes to sign
   * @param randomProvider the nonce source for randomized schemes
   * @return the signature
   */
  public byte[] calculateSignature(final byte[] message, final RandomProvider randomProvider) {
    Ed25519Signer signer = new Ed25519Signer();
    signer.init(true, params);
    signer.update(message, 0, message.length);
    return signer.generateSignature();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ECPrivateKey that && Arrays.equals(params.getEncoded(), that.params.getEncoded());
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(params.getEncoded());
  }
}
