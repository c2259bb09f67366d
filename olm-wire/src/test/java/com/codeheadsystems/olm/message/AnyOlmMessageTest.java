package com.codeheadsystems.olm.message;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.olm.model.Curve25519PublicKey;
import com.codeheadsystems.olm.model.Mac;
import com.codeheadsystems.olm.model.MessageType;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class AnyOlmMessageTest {

  private static Curve25519PublicKey key(int fill) {
    byte[] bytes = new byte[Curve25519PublicKey.KEY_LENGTH];
    Arrays.fill(bytes, (byte) fill);
    return Curve25519PublicKey.fromBytes(bytes);
  }

  private static OlmMessage normalMessage() {
    OlmMessage message = OlmMessage.fromParts(key(1), 5, new byte[]{1, 2, 3});
    byte[] mac = new byte[Mac.LENGTH];
    Arrays.fill(mac, (byte) 0x5A);
    message.appendMac(new Mac(mac));
    return message;
  }

  @Test
  void normal_toParts_typeOne() {
    OlmMessage message = normalMessage();
    AnyOlmMessage.Parts parts = AnyOlmMessage.normal(message).toParts();

    assertThat(parts.messageType()).isEqualTo(1);
    assertThat(parts.body()).isEqualTo(message.toBase64());
  }

  @Test
  void preKey_toParts_typeZero() {
    PreKeyMessage message = PreKeyMessage.fromParts(key(1), key(2), key(3), normalMessage());
    AnyOlmMessage.Parts parts = AnyOlmMessage.preKey(message).toParts();

    assertThat(parts.messageType()).isZero();
    assertThat(parts.body()).isEqualTo(message.toBase64());
  }

  @Test
  void fromParts_normal() {
    OlmMessage message = normalMessage();
    AnyOlmMessage any = AnyOlmMessage.fromParts(1, message.toBase64());

    assertThat(any.messageType()).isEqualTo(MessageType.NORMAL);
    assertThat(any.normal()).isEqualTo(message);
    assertThat(any.preKey()).isNull();
    assertThat(any.normal().decode()).isEqualTo(message.decode());
  }

  @Test
  void fromParts_preKey() {
    PreKeyMessage message = PreKeyMessage.fromParts(key(1), key(2), key(3), normalMessage());
    AnyOlmMessage any = AnyOlmMessage.fromParts(0, message.toBase64());

    assertThat(any.messageType()).isEqualTo(MessageType.PRE_KEY);
    assertThat(any.preKey()).isEqualTo(message);
    assertThat(any.toBytes()).isEqualTo(message.toBytes());
  }

  @Test
  void partsRoundTrip() {
    AnyOlmMessage original = AnyOlmMessage.normal(normalMessage());
    AnyOlmMessage.Parts parts = original.toParts();

    assertThat(AnyOlmMessage.fromParts(parts.messageType(), parts.body())).isEqualTo(original);
  }

  @Test
  void fromParts_unknownType_throwsIAE() {
    assertThatThrownBy(() -> AnyOlmMessage.fromParts(7, "AAAA"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Unknown Olm message type");
  }

  @Test
  void fromParts_invalidBase64_throwsIAE() {
    assertThatThrownBy(() -> AnyOlmMessage.fromParts(1, "%%%"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void constructor_mismatchedContent_throwsIAE() {
    assertThatThrownBy(() -> new AnyOlmMessage(MessageType.PRE_KEY, normalMessage(), null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("does not match type PRE_KEY");
  }

  @Test
  void constructor_nullType_throwsIAE() {
    assertThatThrownBy(() -> new AnyOlmMessage(null, normalMessage(), null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
