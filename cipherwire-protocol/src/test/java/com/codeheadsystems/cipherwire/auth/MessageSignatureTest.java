package com.codeheadsystems.cipherwire.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.cipherwire.common.RandomProvider;
import com.codeheadsystems.cipherwire.curve.Curve;
import com.codeheadsystems.cipherwire.curve.ECKeyPair;
import com.codeheadsystems.cipherwire.error.ErrorKind;
import com.codeheadsystems.cipherwire.error.ProtocolException;
import org.junit.jupiter.api.Test;

class MessageSignatureTest {

  private static final RandomProvider RANDOM = new RandomProvider();
  private static final byte[] MESSAGE = {0x33, 0x0A, 0x01, 0x7F};

  @Test
  void sign_producesFixedLengthSignature() {
    ECKeyPair keyPair = Curve.generateKeyPair(RANDOM);
    assertThat(MessageSignature.sign(keyPair.privateKey(), MESSAGE, RANDOM))
        .hasSize(MessageSignature.SIGNATURE_LENGTH);
  }

  @Test
  void verify_acceptsValidSignature() {
    ECKeyPair keyPair = Curve.generateKeyPair(RANDOM);
    byte[] signature = MessageSignature.sign(keyPair.privateKey(), MESSAGE, RANDOM);

    assertThatCode(() -> MessageSignature.verify(keyPair.publicKey(), MESSAGE, signature))
        .doesNotThrowAnyException();
  }

  @Test
  void verify_tamperedMessageThrows() {
    ECKeyPair keyPair = Curve.generateKeyPair(RANDOM);
    byte[] signature = MessageSignature.sign(keyPair.privateKey(), MESSAGE, RANDOM);
    byte[] tampered = MESSAGE.clone();
    tampered[1] ^= 0x40;

    assertThatThrownBy(() -> MessageSignature.verify(keyPair.publicKey(), tampered, signature))
        .isInstanceOfSatisfying(ProtocolException.class,
            e -> assertThat(e.kind()).isEqualTo(ErrorKind.SIGNATURE_VALIDATION_FAILED));
  }

  @Test
  void verify_wrongKeyThrows() {
    ECKeyPair keyPair = Curve.generateKeyPair(RANDOM);
    byte[] signature = MessageSignature.sign(keyPair.privateKey(), MESSAGE, RANDOM);

    assertThatThrownBy(() -> MessageSignature.verify(Curve.generateKeyPair(RANDOM).publicKey(), MESSAGE, signature))
        .isInstanceOfSatisfying(ProtocolException.class,
            e -> assertThat(e.kind()).isEqualTo(ErrorKind.SIGNATURE_VALIDATION_FAILED));
  }
}
