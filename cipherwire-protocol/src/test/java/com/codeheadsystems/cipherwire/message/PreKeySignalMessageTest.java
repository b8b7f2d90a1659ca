package com.codeheadsystems.cipherwire.message;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.cipherwire.common.ByteUtils;
import com.codeheadsystems.cipherwire.common.RandomProvider;
import com.codeheadsystems.cipherwire.curve.Curve;
import com.codeheadsystems.cipherwire.curve.ECPublicKey;
import com.codeheadsystems.cipherwire.error.ErrorKind;
import com.codeheadsystems.cipherwire.error.ProtocolException;
import com.codeheadsystems.cipherwire.identity.IdentityKey;
import com.codeheadsystems.cipherwire.identity.IdentityKeyPair;
import com.codeheadsystems.cipherwire.proto.ProtoWriter;
import java.util.OptionalInt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PreKeySignalMessageTest {

  private static final RandomProvider RANDOM = new RandomProvider();

  private IdentityKey sender;
  private IdentityKey receiver;
  private ECPublicKey baseKey;
  private byte[] macKey;
  private SignalMessage inner;

  @BeforeEach
  void setUp() {
    sender = IdentityKeyPair.generate(RANDOM).identityKey();
    receiver = IdentityKeyPair.generate(RANDOM).identityKey();
    baseKey = Curve.generateKeyPair(RANDOM).publicKey();
    macKey = RANDOM.randomBytes(32);
    inner = SignalMessage.create(MessageVersion.CURRENT, macKey, Curve.generateKeyPair(RANDOM).publicKey(),
        0, 0, RANDOM.randomBytes(48), sender, receiver);
  }

  @Test
  void roundTrip_withOneTimePreKey() {
    PreKeySignalMessage message = PreKeySignalMessage.create(MessageVersion.CURRENT, 1234,
        OptionalInt.of(77), 9, baseKey, sender, inner);

    PreKeySignalMessage parsed = PreKeySignalMessage.deserialize(message.serialize());

    assertThat(parsed.registrationId()).isEqualTo(1234);
    assertThat(parsed.preKeyId()).hasValue(77);
    assertThat(parsed.signedPreKeyId()).isEqualTo(9);
    assertThat(parsed.baseKey()).isEqualTo(baseKey);
    assertThat(parsed.identityKey()).isEqualTo(sender);
    assertThat(parsed.message()).isEqualTo(inner);
    assertThat(parsed.messageVersion()).isEqualTo(MessageVersion.V3);
    assertThat(parsed.serialize()).isEqualTo(message.serialize());
    assertThat(parsed).isEqualTo(message).hasSameHashCodeAs(message);
  }

  @Test
  void roundTrip_withoutOneTimePreKey() {
    PreKeySignalMessage message = PreKeySignalMessage.create(MessageVersion.CURRENT, 1,
        OptionalInt.empty(), 9, baseKey, sender, inner);

    assertThat(PreKeySignalMessage.deserialize(message.serialize()).preKeyId()).isEmpty();
  }

  @Test
  void innerMessage_keepsItsMac() {
    PreKeySignalMessage message = PreKeySignalMessage.create(MessageVersion.CURRENT, 1,
        OptionalInt.empty(), 9, baseKey, sender, inner);

    SignalMessage parsedInner = PreKeySignalMessage.deserialize(message.serialize()).message();

    assertThat(parsedInner.verifyMac(sender, receiver, macKey)).isTrue();
  }

  @Test
  void unsignedIdsSurvive() {
    PreKeySignalMessage message = PreKeySignalMessage.create(MessageVersion.CURRENT, -1,
        OptionalInt.of(-2), -3, baseKey, sender, inner);

    PreKeySignalMessage parsed = PreKeySignalMessage.deserialize(message.serialize());

    assertThat(Integer.toUnsignedLong(parsed.registrationId())).isEqualTo(0xFFFFFFFFL);
    assertThat(parsed.preKeyId()).hasValue(-2);
    assertThat(parsed.signedPreKeyId()).isEqualTo(-3);
  }

  @Test
  void messageType_isPreKey() {
    PreKeySignalMessage message = PreKeySignalMessage.create(MessageVersion.CURRENT, 1,
        OptionalInt.empty(), 9, baseKey, sender, inner);
    assertThat(message.messageType()).isEqualTo(CiphertextMessageType.PRE_KEY);
  }

  @Test
  void create_legacyVersionIsRejected() {
    assertThatThrownBy(() -> PreKeySignalMessage.create(MessageVersion.V2, 1, OptionalInt.empty(), 9,
        baseKey, sender, inner))
        .isInstanceOfSatisfying(ProtocolException.class,
            e -> assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_ARGUMENT));
  }

  // ─── rejection ────────────────────────────────────────────────────────────

  @Test
  void deserialize_empty() {
    assertThatThrownBy(() -> PreKeySignalMessage.deserialize(new byte[0]))
        .isInstanceOfSatisfying(ProtocolException.class, e -> {
          assertThat(e.kind()).isEqualTo(ErrorKind.CIPHERTEXT_MESSAGE_TOO_SHORT);
          assertThat(e.detail()).hasValue(0L);
        });
  }

  @Test
  void deserialize_versionOnlyIsMissingFields() {
    assertThatThrownBy(() -> PreKeySignalMessage.deserialize(new byte[]{0x33}))
        .isInstanceOfSatisfying(ProtocolException.class,
            e -> assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_PROTOBUF_ENCODING));
  }

  @Test
  void deserialize_legacyVersion() {
    assertThatThrownBy(() -> PreKeySignalMessage.deserialize(new byte[]{0x23}))
        .isInstanceOfSatisfying(ProtocolException.class, e -> {
          assertThat(e.kind()).isEqualTo(ErrorKind.LEGACY_CIPHERTEXT_VERSION);
          assertThat(e.messageKind()).contains(MessageKind.PRE_KEY_SIGNAL_MESSAGE);
        });
  }

  @Test
  void deserialize_futureVersion() {
    assertThatThrownBy(() -> PreKeySignalMessage.deserialize(new byte[]{0x53}))
        .isInstanceOfSatisfying(ProtocolException.class,
            e -> assertThat(e.kind()).isEqualTo(ErrorKind.UNRECOGNIZED_CIPHERTEXT_VERSION));
  }

  @Test
  void deserialize_missingSignedPreKeyId() {
    byte[] body = new ProtoWriter()
        .bytes(2, baseKey.serialize())
        .bytes(3, sender.serialize())
        .bytes(4, inner.serialize())
        .uint32(5, 1)
        .toByteArray();

    assertThatThrownBy(() -> PreKeySignalMessage.deserialize(ByteUtils.concat(new byte[]{0x33}, body)))
        .isInstanceOfSatisfying(ProtocolException.class,
            e -> assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_PROTOBUF_ENCODING));
  }

  @Test
  void deserialize_missingRegistrationIdDefaultsToZero() {
    byte[] body = new ProtoWriter()
        .bytes(2, baseKey.serialize())
        .bytes(3, sender.serialize())
        .bytes(4, inner.serialize())
        .uint32(6, 9)
        .toByteArray();

    PreKeySignalMessage parsed = PreKeySignalMessage.deserialize(ByteUtils.concat(new byte[]{0x33}, body));

    assertThat(parsed.registrationId()).isZero();
    assertThat(parsed.preKeyId()).isEmpty();
  }

  @Test
  void deserialize_badInnerMessageIsRejected() {
    byte[] body = new ProtoWriter()
        .bytes(2, baseKey.serialize())
        .bytes(3, sender.serialize())
        .bytes(4, new byte[]{0x33, 1, 2})
        .uint32(6, 9)
        .toByteArray();

    assertThatThrownBy(() -> PreKeySignalMessage.deserialize(ByteUtils.concat(new byte[]{0x33}, body)))
        .isInstanceOfSatisfying(ProtocolException.class,
            e -> assertThat(e.kind()).isEqualTo(ErrorKind.CIPHERTEXT_MESSAGE_TOO_SHORT));
  }

  @Test
  void deserialize_shortIdentityKey() {
    byte[] body = new ProtoWriter()
        .bytes(2, baseKey.serialize())
        .bytes(3, ByteUtils.slice(sender.serialize(), 0, 20))
        .bytes(4, inner.serialize())
        .uint32(6, 9)
        .toByteArray();

    assertThatThrownBy(() -> PreKeySignalMessage.deserialize(ByteUtils.concat(new byte[]{0x33}, body)))
        .isInstanceOfSatisfying(ProtocolException.class, e -> {
          assertThat(e.kind()).isEqualTo(ErrorKind.BAD_KEY_LENGTH);
          assertThat(e.detail()).hasValue(20L);
        });
  }
}
