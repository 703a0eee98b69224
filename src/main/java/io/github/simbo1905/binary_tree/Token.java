// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0

package io.github.simbo1905.binary_tree;

/// One element of the level-order wire form of a tree. A token either carries a node value or marks an empty slot.
/// The null slot is its own variant rather than a reserved `int` so that every `int` is a legal node value.
public sealed interface Token permits Token.Value, Token.Null {

  /// The canonical null token.
  Null NULL = new Null();

  static Value of(int value) {
    return new Value(value);
  }

  /// A slot occupied by a node with the given value
  record Value(int value) implements Token {
    @Override
    public String toString() {
      return Integer.toString(value);
    }
  }

  /// An empty slot: the empty tree, or a missing child of a real node
  record Null() implements Token {
    @Override
    public String toString() {
      return "null";
    }
  }
}
