package com.codeheadsystems.cipherwire.message;

import com.codeheadsystems.cipherwire.error.ProtocolException;
import java.nio.ByteBuffer;
import java.util.UUID;

/**
 * Distribution ids travel as the 16 big-endian bytes of the UUID.
 */
final class Uuids {

  static final int UUID_LENGTH = 16;

  private Uuids() {
  }

  static byte[] toBytes(final UUID uuid) {
    return ByteBuffer.allocate(UUID_LENGTH)
        .putLong(uuid.getMostSignificantBits())
        .putLong(uuid.getLeastSignificantBits())
        .array();
  }

  static UUID fromBytes(final byte[] bytes) {
    if (bytes.length != UUID_LENGTH) {
      throw ProtocolException.invalidProtobufEncoding();
    }
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    return new UUID(buffer.getLong(), buffer.getLong());
  }
}
