package com.codeheadsystems.cipherwire.common;

/**
 * Utility methods for assembling and splitting serialized message bytes.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Copies {@code len} bytes of {@code src} starting at {@code off}.
   *
   * @param src the source
   * @param off the offset
   * @param len the length
   * @return the byte [ ]
   */
  public static byte[] slice(byte[] src, int off, int len) {
    if (off < 0 || len < 0 || off + len > src.length) {
      throw new IllegalArgumentException("Slice [" + off + ", " + (off + len) + ") out of range for "
          + src.length + " bytes");
    }
    byte[] out = new byte[len];
    System.arraycopy(src, off, out, 0, len);
    return out;
  }

  /**
   * Returns the trailing {@code len} bytes of {@code src}.
   *
   * @param src the source
   * @param len the length
   * @return the byte [ ]
   */
  public static byte[] tail(byte[] src, int len) {
    return slice(src, src.length - len, len);
  }
}
