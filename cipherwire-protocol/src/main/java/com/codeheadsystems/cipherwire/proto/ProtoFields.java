package com.codeheadsystems.cipherwire.proto;

import com.codeheadsystems.cipherwire.error.ProtocolException;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.WireFormat;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * The fields of a decoded protobuf message body, keyed by field number.
 * <p>
 * Parsing is driven by a schema naming each known field and its {@link FieldType}. A known field
 * that arrives with any other wire type is a decoding error. Unknown fields of any wire type are
 * skipped. Every field is optional on the wire; presence is reported explicitly so callers can
 * reject a missing mandatory field instead of reading a default value. When a field repeats, the
 * last occurrence wins.
 */
public class ProtoFields {

  private final Map<Integer, byte[]> lengthDelimited;
  private final Map<Integer, Long> varints;

  private ProtoFields(Map<Integer, byte[]> lengthDelimited, Map<Integer, Long> varints) {
    this.lengthDelimited = lengthDelimited;
    this.varints = varints;
  }

  /**
   * Parses a whole buffer.
   *
   * @param data   the encoded body
   * @param schema the known fields and their types
   * @return the proto fields
   */
  public static ProtoFields parse(final byte[] data, final Map<Integer, FieldType> schema) {
    return parse(data, 0, data.length, schema);
  }

  /**
   * Parses {@code length} bytes of {@code data} starting at {@code offset}.
   *
   * @param data   the buffer
   * @param offset the first body byte
   * @param length the body length
   * @param schema the known fields and their types
   * @return the proto fields
   * @throws ProtocolException {@code PROTOBUF_DECODING_ERROR} when the bytes are not a valid body or
   *                           a known field has the wrong wire type
   */
  public static ProtoFields parse(final byte[] data, final int offset, final int length,
                                  final Map<Integer, FieldType> schema) {
    Map<Integer, byte[]> lengthDelimited = new HashMap<>();
    Map<Integer, Long> varints = new HashMap<>();
    CodedInputStream in = CodedInputStream.newInstance(data, offset, length);
    try {
      while (true) {
        int tag = in.readTag();
        if (tag == 0) {
          break;
        }
        int field = WireFormat.getTagFieldNumber(tag);
        int wireType = WireFormat.getTagWireType(tag);
        FieldType type = schema.get(field);
        if (type == null) {
          if (!in.skipField(tag)) {
            throw new InvalidProtocolBufferException("unexpected end-group tag for field " + field);
          }
          continue;
        }
        if (wireType != type.wireType()) {
          throw new InvalidProtocolBufferException("field " + field + " has wire type " + wireType
              + ", expected " + type);
        }
        switch (type) {
          case BYTES -> lengthDelimited.put(field, in.readByteArray());
          case UINT32 -> varints.put(field, in.readUInt64());
        }
      }
    } catch (IOException e) {
      throw ProtocolException.protobufDecoding(e);
    }
    return new ProtoFields(lengthDelimited, varints);
  }

  /**
   * Returns a copy of a bytes field, if present.
   *
   * @param field the field number
   * @return the value
   */
  public Optional<byte[]> bytes(final int field) {
    return Optional.ofNullable(lengthDelimited.get(field)).map(byte[]::clone);
  }

  /**
   * Returns a uint32 field, if present. Wider varints are truncated to their low 32 bits.
   *
   * @param field the field number
   * @return the value
   */
  public OptionalInt uint32(final int field) {
    Long value = varints.get(field);
    return value == null ? OptionalInt.empty() : OptionalInt.of(value.intValue());
  }

  /**
   * Returns a mandatory bytes field.
   *
   * @param field the field number
   * @return the value
   * @throws ProtocolException {@code INVALID_PROTOBUF_ENCODING} when absent
   */
  public byte[] requireBytes(final int field) {
    return bytes(field).orElseThrow(ProtocolException::invalidProtobufEncoding);
  }

  /**
   * Returns a mandatory uint32 field.
   *
   * @param field the field number
   * @return the value
   * @throws ProtocolException {@code INVALID_PROTOBUF_ENCODING} when absent
   */
  public int requireUint32(final int field) {
    return uint32(field).orElseThrow(ProtocolException::invalidProtobufEncoding);
  }
}
