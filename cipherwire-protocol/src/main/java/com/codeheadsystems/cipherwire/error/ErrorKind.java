package com.codeheadsystems.cipherwire.error;

/**
 * The closed set of failures produced while constructing, decoding, or authenticating a message.
 * <p>
 * Each {@link ProtocolException} carries exactly one kind. The set is stable: callers may
 * switch over it exhaustively.
 */
public enum ErrorKind {

  /** The caller passed a structurally invalid argument not covered by a more specific kind. */
  INVALID_ARGUMENT,

  /** The protobuf body could not be parsed. */
  PROTOBUF_DECODING_ERROR,

  /** The protobuf body could not be written. */
  PROTOBUF_ENCODING_ERROR,

  /** The body parsed, but a mandatory field was absent or a fixed-length field had the wrong length. */
  INVALID_PROTOBUF_ENCODING,

  /** The buffer is shorter than the structural minimum for its message kind. */
  CIPHERTEXT_MESSAGE_TOO_SHORT,

  /** The version nibble is below the current version. */
  LEGACY_CIPHERTEXT_VERSION,

  /** The version nibble is above the current version. */
  UNRECOGNIZED_CIPHERTEXT_VERSION,

  /** A 32-bit version value does not name a known {@code MessageVersion}. */
  UNRECOGNIZED_MESSAGE_VERSION,

  /** Serialized key bytes were empty. */
  NO_KEY_TYPE_IDENTIFIER,

  /** Serialized key bytes began with an unknown type byte. */
  BAD_KEY_TYPE,

  /** Serialized key bytes had the wrong length for their type. */
  BAD_KEY_LENGTH,

  /** An asymmetric signature did not verify. */
  SIGNATURE_VALIDATION_FAILED,

  /** A MAC key was not exactly 32 bytes. */
  INVALID_MAC_KEY_LENGTH,

  /** An application-supplied callback failed; the cause is carried opaquely. */
  APPLICATION_CALLBACK_ERROR
}
