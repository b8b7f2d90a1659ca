package com.codeheadsystems.cipherwire.proto;

import com.google.protobuf.WireFormat;

/**
 * Declared type of a body field. Each maps to the one wire type it may arrive with.
 */
public enum FieldType {
  BYTES(WireFormat.WIRETYPE_LENGTH_DELIMITED),
  UINT32(WireFormat.WIRETYPE_VARINT);

  private final int wireType;

  FieldType(int wireType) {
    this.wireType = wireType;
  }

  public int wireType() {
    return wireType;
  }
}
