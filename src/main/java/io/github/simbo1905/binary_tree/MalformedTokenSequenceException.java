// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0

package io.github.simbo1905.binary_tree;

/// Thrown when a token sequence, or one of its text or binary framings, is not a valid level-order encoding.
public class MalformedTokenSequenceException extends IllegalArgumentException {

  public MalformedTokenSequenceException(String message) {
    super(message);
  }

  public MalformedTokenSequenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
