// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0

package io.github.simbo1905.binary_tree;

import java.nio.ByteBuffer;

/// LEB128 varints of ZigZag mapped `int` values, so small negative node values stay as short as small positive ones.
/// An `int` takes between one and five bytes.
final class ZigZagEncoding {

  static final int MAX_INT_BYTES = 5;

  private ZigZagEncoding() {
  }

  /// Writes an int value to the given buffer in LEB128 ZigZag encoded format
  /// @param buffer the buffer to write to
  /// @param value  the value to write to the buffer
  /// @return the number of bytes written
  static int putInt(ByteBuffer buffer, int value) {
    final int start = buffer.position();
    int zigzag = (value << 1) ^ (value >> 31);
    while ((zigzag & ~0x7F) != 0) {
      buffer.put((byte) ((zigzag & 0x7F) | 0x80));
      zigzag >>>= 7;
    }
    buffer.put((byte) zigzag);
    return buffer.position() - start;
  }

  /// Read an LEB128 ZigZag encoded int value from the given buffer
  /// @param buffer the buffer to read from
  /// @return the value read from the buffer
  /// @throws java.nio.BufferUnderflowException if the buffer ends inside the varint
  /// @throws IllegalArgumentException if the varint runs past five bytes or its fifth byte overflows an int
  static int getInt(ByteBuffer buffer) {
    int zigzag = 0;
    for (int shift = 0; shift < 35; shift += 7) {
      final byte b = buffer.get();
      // the fifth byte carries only the top four bits of an int
      if (shift == 28 && (b & 0x70) != 0) {
        throw new IllegalArgumentException("Fifth varint byte 0x" + Integer.toHexString(b & 0xFF) +
            " overflows an int at position " + (buffer.position() - 1));
      }
      zigzag |= (b & 0x7F) << shift;
      if ((b & 0x80) == 0) {
        return (zigzag >>> 1) ^ -(zigzag & 1);
      }
    }
    throw new IllegalArgumentException("Varint longer than " + MAX_INT_BYTES + " bytes ending at position " +
        buffer.position());
  }

  /// Counts the number of bytes needed to encode the given int value in LEB128 ZigZag format
  /// @param value the value that would be encoded
  /// @return the number of bytes [#putInt(ByteBuffer, int)] writes for the value
  static int sizeOf(int value) {
    final int zigzag = (value << 1) ^ (value >> 31);
    if (zigzag >>> 7 == 0) return 1;
    if (zigzag >>> 14 == 0) return 2;
    if (zigzag >>> 21 == 0) return 3;
    if (zigzag >>> 28 == 0) return 4;
    return MAX_INT_BYTES;
  }
}
