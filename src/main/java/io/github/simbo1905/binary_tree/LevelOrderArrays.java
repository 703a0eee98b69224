// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0

package io.github.simbo1905.binary_tree;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.binary_tree.TreeCodec.malformed;

/// The compact array form commonly used to write trees down, e.g. `[3, 9, 20, null, null, 15, 7]`. It is the
/// level-order token sequence with the trailing null slots left off, and `null` elements for the remaining null slots.
public final class LevelOrderArrays {

  private LevelOrderArrays() {
  }

  public static @NotNull Integer[] toArray(@Nullable BinaryTreeNode root) {
    final List<Token> tokens = TreeCodec.serialize(root);
    int end = tokens.size();
    while (end > 0 && tokens.get(end - 1) instanceof Token.Null) {
      end--;
    }
    final Integer[] values = new Integer[end];
    for (int i = 0; i < end; i++) {
      values[i] = tokens.get(i) instanceof Token.Value v ? v.value() : null;
    }
    return values;
  }

  /// Build a tree from the compact array form. Missing trailing slots are read as null.
  /// @throws MalformedTokenSequenceException if elements remain after every node has been given its children
  public static @Nullable BinaryTreeNode fromArray(@NotNull Integer... values) {
    Objects.requireNonNull(values, "values must not be null");
    if (values.length == 0 || values[0] == null) {
      if (values.length > 1) {
        throw malformed("Null root followed by " + (values.length - 1) + " further elements");
      }
      return null;
    }
    final BinaryTreeNode root = new BinaryTreeNode(values[0]);
    final Deque<BinaryTreeNode> parents = new ArrayDeque<>();
    parents.add(root);
    int index = 1;
    while (index < values.length) {
      final BinaryTreeNode parent = parents.poll();
      if (parent == null) {
        throw malformed((values.length - index) + " unconsumed elements from index " + index +
            " after every node received its children");
      }
      if (values[index] != null) {
        final BinaryTreeNode left = new BinaryTreeNode(values[index]);
        parent.attachLeft(left);
        parents.add(left);
      }
      index++;
      if (index < values.length && values[index] != null) {
        final BinaryTreeNode right = new BinaryTreeNode(values[index]);
        parent.attachRight(right);
        parents.add(right);
      }
      index++;
    }
    return root;
  }
}
