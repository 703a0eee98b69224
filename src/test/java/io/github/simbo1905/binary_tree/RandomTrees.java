// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0

package io.github.simbo1905.binary_tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/// Seeded random tree shapes for property style tests
final class RandomTrees {

  private RandomTrees() {
  }

  /// A tree of `size` nodes with a random shape and distinct values drawn from a range that includes negatives
  static BinaryTreeNode distinct(Random random, int size) {
    final List<Integer> values = new ArrayList<>();
    IntStream.range(-size, 2 * size).forEach(values::add);
    Collections.shuffle(values, random);
    return shape(random, values.subList(0, size).iterator(), size);
  }

  /// A tree of `size` nodes whose values repeat freely
  static BinaryTreeNode repeating(Random random, int size) {
    final List<Integer> values = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      values.add(random.nextInt(3) - 1);
    }
    return shape(random, values.iterator(), size);
  }

  /// A chain in which every node is the left child of its parent
  static BinaryTreeNode leftChain(int size) {
    BinaryTreeNode node = null;
    for (int i = size; i > 0; i--) {
      node = new BinaryTreeNode(i, node, null);
    }
    return node;
  }

  private static BinaryTreeNode shape(Random random, Iterator<Integer> values, int size) {
    if (size == 0) {
      return null;
    }
    final int value = values.next();
    final int leftSize = random.nextInt(size);
    final BinaryTreeNode left = shape(random, values, leftSize);
    final BinaryTreeNode right = shape(random, values, size - 1 - leftSize);
    return new BinaryTreeNode(value, left, right);
  }
}
