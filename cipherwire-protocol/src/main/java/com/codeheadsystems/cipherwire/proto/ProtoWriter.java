package com.codeheadsystems.cipherwire.proto;

import com.codeheadsystems.cipherwire.error.ProtocolException;
import com.google.protobuf.CodedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Writes a protobuf message body field by field. Fields are emitted in call order, so callers
 * add them in ascending field-number order to match the canonical encoding.
 */
public class ProtoWriter {

  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private final CodedOutputStream out = CodedOutputStream.newInstance(buffer);

  /**
   * Appends a length-delimited bytes field.
   *
   * @param field the field number
   * @param value the value
   * @return this writer
   */
  public ProtoWriter bytes(final int field, final byte[] value) {
    try {
      out.writeByteArray(field, value);
    } catch (IOException e) {
      throw ProtocolException.protobufEncoding(e);
    }
    return this;
  }

  /**
   * Appends a uint32 varint field. The int is read as an unsigned 32-bit value.
   *
   * @param field the field number
   * @param value the value
   * @return this writer
   */
  public ProtoWriter uint32(final int field, final int value) {
    try {
      out.writeUInt32(field, value);
    } catch (IOException e) {
      throw ProtocolException.protobufEncoding(e);
    }
    return this;
  }

  /**
   * Returns the encoded body.
   *
   * @return the byte [ ]
   */
  public byte[] toByteArray() {
    try {
      out.flush();
    } catch (IOException e) {
      throw ProtocolException.protobufEncoding(e);
    }
    return buffer.toByteArray();
  }
}
