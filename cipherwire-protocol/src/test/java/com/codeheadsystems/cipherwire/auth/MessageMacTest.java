package com.codeheadsystems.cipherwire.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.cipherwire.common.RandomProvider;
import com.codeheadsystems.cipherwire.error.ErrorKind;
import com.codeheadsystems.cipherwire.error.ProtocolException;
import com.codeheadsystems.cipherwire.identity.IdentityKey;
import com.codeheadsystems.cipherwire.identity.IdentityKeyPair;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MessageMacTest {

  private static final RandomProvider RANDOM = new RandomProvider();
  private static final byte[] MESSAGE = "hello".getBytes(StandardCharsets.UTF_8);

  private IdentityKey sender;
  private IdentityKey receiver;
  private byte[] macKey;

  @BeforeEach
  void setUp() {
    sender = IdentityKeyPair.generate(RANDOM).identityKey();
    receiver = IdentityKeyPair.generate(RANDOM).identityKey();
    macKey = RANDOM.randomBytes(MessageMac.MAC_KEY_LENGTH);
  }

  @Test
  void compute_isTruncatedHmacOverBothIdentities() throws Exception {
    Mac hmac = Mac.getInstance("HmacSHA256");
    hmac.init(new SecretKeySpec(macKey, "HmacSHA256"));
    hmac.update(sender.serialize());
    hmac.update(receiver.serialize());
    byte[] expected = Arrays.copyOf(hmac.doFinal(MESSAGE), MessageMac.MAC_LENGTH);

    assertThat(MessageMac.compute(sender, receiver, macKey, MESSAGE)).isEqualTo(expected);
  }

  @Test
  void compute_identityOrderMatters() {
    assertThat(MessageMac.compute(sender, receiver, macKey, MESSAGE))
        .isNotEqualTo(MessageMac.compute(receiver, sender, macKey, MESSAGE));
  }

  @Test
  void verify_acceptsOwnTag() {
    byte[] tag = MessageMac.compute(sender, receiver, macKey, MESSAGE);
    assertThat(MessageMac.verify(sender, receiver, macKey, MESSAGE, tag)).isTrue();
  }

  @Test
  void verify_rejectsFlippedTagBit() {
    byte[] tag = MessageMac.compute(sender, receiver, macKey, MESSAGE);
    tag[3] ^= 0x01;
    assertThat(MessageMac.verify(sender, receiver, macKey, MESSAGE, tag)).isFalse();
  }

  @Test
  void verify_rejectsWrongKey() {
    byte[] tag = MessageMac.compute(sender, receiver, macKey, MESSAGE);
    byte[] otherKey = RANDOM.randomBytes(MessageMac.MAC_KEY_LENGTH);
    assertThat(MessageMac.verify(sender, receiver, otherKey, MESSAGE, tag)).isFalse();
  }

  @Test
  void compute_shortKeyIsRejected() {
    assertThatThrownBy(() -> MessageMac.compute(sender, receiver, new byte[31], MESSAGE))
        .isInstanceOfSatisfying(ProtocolException.class, e -> {
          assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_MAC_KEY_LENGTH);
          assertThat(e.detail()).hasValue(31L);
        });
  }
}
