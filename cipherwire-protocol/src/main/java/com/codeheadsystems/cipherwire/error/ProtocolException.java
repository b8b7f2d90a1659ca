package com.codeheadsystems.cipherwire.error;

import com.codeheadsystems.cipherwire.message.MessageKind;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Thrown when a message cannot be constructed, decoded, or authenticated.
 * <p>
 * The failure is identified by its {@link ErrorKind}, never by the exception type. Kinds that
 * carry a number (a buffer length, a version, a key length) expose it through {@link #detail()};
 * version failures also name the message family through {@link #messageKind()}.
 */
public class ProtocolException extends RuntimeException {

  private final ErrorKind kind;
  private final Long detail;
  private final MessageKind messageKind;

  private ProtocolException(ErrorKind kind, String message, Long detail,
                            MessageKind messageKind, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.detail = detail;
    this.messageKind = messageKind;
  }

  private static ProtocolException of(ErrorKind kind, String message) {
    return new ProtocolException(kind, message, null, null, null);
  }

  /**
   * Invalid argument protocol exception.
   *
   * @param reason what was wrong with the argument
   * @return the protocol exception
   */
  public static ProtocolException invalidArgument(final String reason) {
    return of(ErrorKind.INVALID_ARGUMENT, "invalid argument: " + reason);
  }

  /**
   * The protobuf codec failed to parse a body.
   *
   * @param cause the codec failure
   * @return the protocol exception
   */
  public static ProtocolException protobufDecoding(final Throwable cause) {
    return new ProtocolException(ErrorKind.PROTOBUF_DECODING_ERROR,
        "failed to decode protobuf: " + cause.getMessage(), null, null, cause);
  }

  /**
   * The protobuf codec failed to write a body.
   *
   * @param cause the codec failure
   * @return the protocol exception
   */
  public static ProtocolException protobufEncoding(final Throwable cause) {
    return new ProtocolException(ErrorKind.PROTOBUF_ENCODING_ERROR,
        "failed to encode protobuf: " + cause.getMessage(), null, null, cause);
  }

  /**
   * A mandatory field is missing or a fixed-length field has the wrong length.
   *
   * @return the protocol exception
   */
  public static ProtocolException invalidProtobufEncoding() {
    return of(ErrorKind.INVALID_PROTOBUF_ENCODING, "protobuf encoding was invalid");
  }

  /**
   * Ciphertext too short protocol exception.
   *
   * @param length the length of the rejected buffer
   * @return the protocol exception
   */
  public static ProtocolException ciphertextTooShort(final int length) {
    return new ProtocolException(ErrorKind.CIPHERTEXT_MESSAGE_TOO_SHORT,
        "ciphertext serialized bytes were too short <" + length + ">", (long) length, null, null);
  }

  /**
   * Legacy ciphertext version protocol exception.
   *
   * @param version     the version nibble
   * @param messageKind the message family being decoded
   * @return the protocol exception
   */
  public static ProtocolException legacyCiphertextVersion(final int version, final MessageKind messageKind) {
    return new ProtocolException(ErrorKind.LEGACY_CIPHERTEXT_VERSION,
        messageKind.displayName() + " ciphertext version was too old <" + version + ">",
        (long) version, messageKind, null);
  }

  /**
   * Unrecognized ciphertext version protocol exception.
   *
   * @param version     the version nibble
   * @param messageKind the message family being decoded
   * @return the protocol exception
   */
  public static ProtocolException unrecognizedCiphertextVersion(final int version, final MessageKind messageKind) {
    return new ProtocolException(ErrorKind.UNRECOGNIZED_CIPHERTEXT_VERSION,
        messageKind.displayName() + " ciphertext version was unrecognized <" + version + ">",
        (long) version, messageKind, null);
  }

  /**
   * Unrecognized message version protocol exception.
   *
   * @param value       the unsigned 32-bit version value
   * @param messageKind the message family the value belongs to
   * @return the protocol exception
   */
  public static ProtocolException unrecognizedMessageVersion(final long value, final MessageKind messageKind) {
    return new ProtocolException(ErrorKind.UNRECOGNIZED_MESSAGE_VERSION,
        "unrecognized " + messageKind.displayName() + " message version <" + value + ">",
        value, messageKind, null);
  }

  /**
   * Serialized key bytes were empty.
   *
   * @return the protocol exception
   */
  public static ProtocolException noKeyTypeIdentifier() {
    return of(ErrorKind.NO_KEY_TYPE_IDENTIFIER, "no key type identifier");
  }

  /**
   * Serialized key bytes carried an unknown type byte.
   *
   * @param type the type byte
   * @return the protocol exception
   */
  public static ProtocolException badKeyType(final int type) {
    return new ProtocolException(ErrorKind.BAD_KEY_TYPE,
        String.format("bad key type <0x%02x>", type & 0xFF), (long) (type & 0xFF), null, null);
  }

  /**
   * Serialized key bytes had the wrong length.
   *
   * @param type   the key type byte
   * @param length the rejected length
   * @return the protocol exception
   */
  public static ProtocolException badKeyLength(final int type, final int length) {
    return new ProtocolException(ErrorKind.BAD_KEY_LENGTH,
        String.format("bad key length <%d> for key with type <0x%02x>", length, type & 0xFF),
        (long) length, null, null);
  }

  /**
   * Signature validation failed protocol exception.
   *
   * @return the protocol exception
   */
  public static ProtocolException signatureValidationFailed() {
    return of(ErrorKind.SIGNATURE_VALIDATION_FAILED, "invalid signature detected");
  }

  /**
   * Invalid mac key length protocol exception.
   *
   * @param length the rejected key length
   * @return the protocol exception
   */
  public static ProtocolException invalidMacKeyLength(final int length) {
    return new ProtocolException(ErrorKind.INVALID_MAC_KEY_LENGTH,
        "invalid MAC key length <" + length + ">", (long) length, null, null);
  }

  /**
   * Wraps a failure raised by application code invoked through a callback.
   *
   * @param method the callback method that failed
   * @param cause  the application's failure, kept opaque
   * @return the protocol exception
   */
  public static ProtocolException applicationCallback(final String method, final Throwable cause) {
    return new ProtocolException(ErrorKind.APPLICATION_CALLBACK_ERROR,
        "error in method call '" + method + "': " + cause, null, null, cause);
  }

  public ErrorKind kind() {
    return kind;
  }

  public OptionalLong detail() {
    return detail == null ? OptionalLong.empty() : OptionalLong.of(detail);
  }

  public Optional<MessageKind> messageKind() {
    return Optional.ofNullable(messageKind);
  }
}
