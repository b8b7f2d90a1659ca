package com.codeheadsystems.cipherwire.auth;

import com.codeheadsystems.cipherwire.common.RandomProvider;
import com.codeheadsystems.cipherwire.curve.Curve;
import com.codeheadsystems.cipherwire.curve.ECPrivateKey;
import com.codeheadsystems.cipherwire.curve.ECPublicKey;
import com.codeheadsystems.cipherwire.error.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asymmetric signature binding a group message to its sender's signing key.
 */
public class MessageSignature {

  private static final Logger log = LoggerFactory.getLogger(MessageSignature.class);

  /** Length of the signature appended to a message. */
  public static final int SIGNATURE_LENGTH = Curve.SIGNATURE_LENGTH;

  private MessageSignature() {
  }

  /**
   * Signs the exact bytes that precede the signature on the wire.
   *
   * @param signingKey     the private signing key
   * @param message        the bytes to sign
   * @param randomProvider nonce source for randomized schemes
   * @return the {@link #SIGNATURE_LENGTH}-byte signature
   */
  public static byte[] sign(final ECPrivateKey signingKey,
                            final byte[] message,
                            final RandomProvider randomProvider) {
    byte[] signature = signingKey.calculateSignature(message, randomProvider);
    if (signature.length != SIGNATURE_LENGTH) {
      throw new IllegalStateException("Signature length " + signature.length + ", expected " + SIGNATURE_LENGTH);
    }
    return signature;
  }

  /**
   * Verifies a signature over the stored pre-signature bytes.
   *
   * @param verificationKey the public signing key
   * @param message         the signed bytes
   * @param signature       the stored signature
   * @throws ProtocolException {@code SIGNATURE_VALIDATION_FAILED} when the signature does not verify
   */
  public static void verify(final ECPublicKey verificationKey,
                            final byte[] message,
                            final byte[] signature) {
    if (!verificationKey.verifySignature(message, signature)) {
      log.debug("verify(): signature rejected for key {}", verificationKey);
      throw ProtocolException.signatureValidationFailed();
    }
  }
}
