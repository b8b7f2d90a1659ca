package com.codeheadsystems.cipherwire.message;

import com.codeheadsystems.cipherwire.error.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Packs and unpacks the version byte that leads every serialized message.
 * <p>
 * The high nibble carries the message version. The low nibble always carries
 * {@link #CURRENT_VERSION}, whatever version is packed above it. Decoding accepts only the
 * current version; older and newer nibbles are both rejected.
 */
public class CiphertextVersion {

  private static final Logger log = LoggerFactory.getLogger(CiphertextVersion.class);

  /** The wire version this library produces and accepts. */
  public static final int CURRENT_VERSION = 3;

  private CiphertextVersion() {
  }

  /**
   * Packs a version into a wire header byte.
   *
   * @param version the version for the high nibble
   * @return the header byte
   */
  public static byte pack(final MessageVersion version) {
    return (byte) (((version.value() & 0xF) << 4) | CURRENT_VERSION);
  }

  /**
   * Classifies the high nibble of a wire header byte.
   *
   * @param header      the first byte of the message
   * @param messageKind the family being decoded, for error messages
   * @return the current message version
   * @throws ProtocolException {@code LEGACY_CIPHERTEXT_VERSION} below current,
   *                           {@code UNRECOGNIZED_CIPHERTEXT_VERSION} above it
   */
  public static MessageVersion unpack(final byte header, final MessageKind messageKind) {
    int version = (header & 0xFF) >>> 4;
    if (version < CURRENT_VERSION) {
      log.debug("unpack({}): legacy version {}", messageKind, version);
      throw ProtocolException.legacyCiphertextVersion(version, messageKind);
    }
    if (version > CURRENT_VERSION) {
      log.debug("unpack({}): unrecognized version {}", messageKind, version);
      throw ProtocolException.unrecognizedCiphertextVersion(version, messageKind);
    }
    return MessageVersion.fromValue(version, messageKind);
  }
}
