package com.codeheadsystems.cipherwire.auth;

import com.codeheadsystems.cipherwire.error.ProtocolException;
import com.codeheadsystems.cipherwire.identity.IdentityKey;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Truncated HMAC-SHA256 tag binding a pairwise message to both parties' identities.
 * <p>
 * {@code tag = HMAC-SHA256(macKey, sender.serialize() || receiver.serialize() || message)[0..8]}
 */
public class MessageMac {

  private static final Logger log = LoggerFactory.getLogger(MessageMac.class);

  /** Length of the tag appended to a message. */
  public static final int MAC_LENGTH = 8;

  /** Required MAC key length. */
  public static final int MAC_KEY_LENGTH = 32;

  private static final String HMAC_ALGORITHM = "HmacSHA256";

  private MessageMac() {
  }

  /**
   * Computes the tag over {@code message}.
   *
   * @param senderIdentity   the sender's identity key
   * @param receiverIdentity the receiver's identity key
   * @param macKey           the 32-byte MAC key
   * @param message          the exact bytes to authenticate
   * @return the 8-byte tag
   * @throws ProtocolException {@code INVALID_MAC_KEY_LENGTH} when the key is not 32 bytes
   */
  public static byte[] compute(final IdentityKey senderIdentity,
                               final IdentityKey receiverIdentity,
                               final byte[] macKey,
                               final byte[] message) {
    if (macKey == null || macKey.length != MAC_KEY_LENGTH) {
      throw ProtocolException.invalidMacKeyLength(macKey == null ? 0 : macKey.length);
    }
    byte[] full;
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(macKey, HMAC_ALGORITHM));
      mac.update(senderIdentity.serialize());
      mac.update(receiverIdentity.serialize());
      full = mac.doFinal(message);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException(HMAC_ALGORITHM + " not available", e);
    }
    byte[] tag = new byte[MAC_LENGTH];
    System.arraycopy(full, 0, tag, 0, MAC_LENGTH);
    return tag;
  }

  /**
   * Recomputes the tag over {@code message} and compares it with {@code theirMac} in constant time.
   *
   * @param senderIdentity   the sender's identity key
   * @param receiverIdentity the receiver's identity key
   * @param macKey           the 32-byte MAC key
   * @param message          the stored bytes that were authenticated
   * @param theirMac         the stored tag
   * @return false when the tags differ
   * @throws ProtocolException {@code INVALID_MAC_KEY_LENGTH} when the key is not 32 bytes
   */
  public static boolean verify(final IdentityKey senderIdentity,
                               final IdentityKey receiverIdentity,
                               final byte[] macKey,
                               final byte[] message,
                               final byte[] theirMac) {
    byte[] ourMac = compute(senderIdentity, receiverIdentity, macKey, message);
    boolean result = MessageDigest.isEqual(ourMac, theirMac);
    if (!result) {
      log.error("Bad Mac! Their Mac: {} Our Mac: {}", Hex.toHexString(theirMac), Hex.toHexString(ourMac));
    }
    return result;
  }
}
