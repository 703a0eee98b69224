// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0

package io.github.simbo1905.binary_tree;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.binary_tree.TreeCodec.LOGGER;
import static io.github.simbo1905.binary_tree.TreeCodec.malformed;

/// Binary framing of a token sequence over a [ByteBuffer].
///
/// The layout is the ZigZag varint token count followed by one marker byte per token, `0` for null and `1` for a
/// value, with a value marker followed by the ZigZag varint of the value. The buffer is read and written from its
/// current position and is left positioned after the last byte.
public final class BinaryTokens {

  static final byte NULL_MARKER = 0;
  static final byte VALUE_MARKER = 1;

  private BinaryTokens() {
  }

  /// The exact number of bytes [#write(ByteBuffer, List)] needs for the tokens
  public static int sizeOf(@NotNull List<Token> tokens) {
    Objects.requireNonNull(tokens, "tokens must not be null");
    int size = ZigZagEncoding.sizeOf(tokens.size());
    for (Token token : tokens) {
      size += 1;
      if (token instanceof Token.Value v) {
        size += ZigZagEncoding.sizeOf(v.value());
      }
    }
    return size;
  }

  /// Write the tokens to the buffer
  /// @return the number of bytes written
  /// @throws java.nio.BufferOverflowException if the buffer has fewer than [#sizeOf(List)] bytes remaining
  public static int write(@NotNull ByteBuffer buffer, @NotNull List<Token> tokens) {
    Objects.requireNonNull(buffer, "buffer must not be null");
    Objects.requireNonNull(tokens, "tokens must not be null");
    final int start = buffer.position();
    ZigZagEncoding.putInt(buffer, tokens.size());
    for (Token token : tokens) {
      if (token instanceof Token.Value v) {
        buffer.put(VALUE_MARKER);
        ZigZagEncoding.putInt(buffer, v.value());
      } else {
        buffer.put(NULL_MARKER);
      }
    }
    final int written = buffer.position() - start;
    LOGGER.finer(() -> "write - " + tokens.size() + " tokens in " + written + " bytes");
    return written;
  }

  /// Read a token sequence written by [#write(ByteBuffer, List)]
  /// @throws MalformedTokenSequenceException if the buffer ends early, the count is negative or a marker is unknown
  public static @NotNull List<Token> read(@NotNull ByteBuffer buffer) {
    Objects.requireNonNull(buffer, "buffer must not be null");
    final int start = buffer.position();
    try {
      final int count = ZigZagEncoding.getInt(buffer);
      if (count < 0) {
        throw malformed("Negative token count " + count + " at position " + start);
      }
      // every token takes at least its marker byte
      if (count > buffer.remaining()) {
        throw malformed("Token count " + count + " exceeds the " + buffer.remaining() + " bytes remaining");
      }
      final List<Token> tokens = new ArrayList<>(count);
      for (int i = 0; i < count; i++) {
        final byte marker = buffer.get();
        switch (marker) {
          case NULL_MARKER -> tokens.add(Token.NULL);
          case VALUE_MARKER -> tokens.add(Token.of(ZigZagEncoding.getInt(buffer)));
          default -> throw malformed("Unknown token marker " + marker + " for token " + i + " at position " +
              (buffer.position() - 1));
        }
      }
      LOGGER.finer(() -> "read - " + tokens.size() + " tokens from " + (buffer.position() - start) + " bytes");
      return tokens;
    } catch (BufferUnderflowException e) {
      throw malformed("Buffer ends at position " + buffer.position() + " inside a token sequence starting at " +
          start, e);
    } catch (MalformedTokenSequenceException e) {
      throw e;
    } catch (IllegalArgumentException e) {
      throw malformed(e.getMessage(), e);
    }
  }

  /// Serialize a tree straight into the buffer
  public static int encode(@NotNull ByteBuffer buffer, @Nullable BinaryTreeNode root) {
    return write(buffer, TreeCodec.serialize(root));
  }

  public static @Nullable BinaryTreeNode decode(@NotNull ByteBuffer buffer) {
    return TreeCodec.deserialize(read(buffer));
  }
}
