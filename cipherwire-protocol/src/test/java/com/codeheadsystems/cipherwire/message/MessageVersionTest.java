package com.codeheadsystems.cipherwire.message;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.cipherwire.error.ErrorKind;
import com.codeheadsystems.cipherwire.error.ProtocolException;
import org.junit.jupiter.api.Test;

class MessageVersionTest {

  @Test
  void current_isV3() {
    assertThat(MessageVersion.CURRENT).isEqualTo(MessageVersion.V3);
    assertThat(MessageVersion.CURRENT.value()).isEqualTo(CiphertextVersion.CURRENT_VERSION);
  }

  @Test
  void fromValue_knownValues() {
    assertThat(MessageVersion.fromValue(2, MessageKind.SIGNAL_MESSAGE)).isEqualTo(MessageVersion.V2);
    assertThat(MessageVersion.fromValue(3, MessageKind.SIGNAL_MESSAGE)).isEqualTo(MessageVersion.V3);
  }

  @Test
  void fromValue_unknownValueIsRejected() {
    assertThatThrownBy(() -> MessageVersion.fromValue(9, MessageKind.SENDER_KEY_DISTRIBUTION_MESSAGE))
        .isInstanceOfSatisfying(ProtocolException.class, e -> {
          assertThat(e.kind()).isEqualTo(ErrorKind.UNRECOGNIZED_MESSAGE_VERSION);
          assertThat(e.detail()).hasValue(9L);
          assertThat(e.messageKind()).contains(MessageKind.SENDER_KEY_DISTRIBUTION_MESSAGE);
        });
  }
}
