// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0

package io.github.simbo1905.binary_tree;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/// A node of a binary tree holding an `int` value and up to two children.
/// The children are owned exclusively by their parent. Outside this package a node is an immutable value holder;
/// the codec links children breadth-first while it is still building the tree.
///
/// Equality is structural: two trees are equal when they have the same shape and the same value at every position.
public final class BinaryTreeNode {

  private final int value;
  private BinaryTreeNode left;
  private BinaryTreeNode right;

  public BinaryTreeNode(int value) {
    this(value, null, null);
  }

  public BinaryTreeNode(int value, @Nullable BinaryTreeNode left, @Nullable BinaryTreeNode right) {
    this.value = value;
    this.left = left;
    this.right = right;
  }

  public int value() {
    return value;
  }

  public @Nullable BinaryTreeNode left() {
    return left;
  }

  public @Nullable BinaryTreeNode right() {
    return right;
  }

  public boolean isLeaf() {
    return left == null && right == null;
  }

  void attachLeft(BinaryTreeNode child) {
    assert this.left == null : "left child already attached to " + value;
    this.left = child;
  }

  void attachRight(BinaryTreeNode child) {
    assert this.right == null : "right child already attached to " + value;
    this.right = child;
  }

  /// Compares two possibly empty trees by shape and values without recursion.
  public static boolean sameTree(@Nullable BinaryTreeNode a, @Nullable BinaryTreeNode b) {
    final Deque<BinaryTreeNode[]> pending = new ArrayDeque<>();
    pending.push(new BinaryTreeNode[]{a, b});
    while (!pending.isEmpty()) {
      final BinaryTreeNode[] pair = pending.pop();
      final BinaryTreeNode l = pair[0];
      final BinaryTreeNode r = pair[1];
      if (l == r) {
        continue;
      }
      if (l == null || r == null || l.value != r.value) {
        return false;
      }
      pending.push(new BinaryTreeNode[]{l.right, r.right});
      pending.push(new BinaryTreeNode[]{l.left, r.left});
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof BinaryTreeNode that)) return false;
    return sameTree(this, that);
  }

  /// Hashes the preorder walk including the null slots so that shape contributes as well as values.
  @Override
  public int hashCode() {
    int result = 1;
    final Deque<BinaryTreeNode> stack = new ArrayDeque<>();
    stack.push(this);
    while (!stack.isEmpty()) {
      final BinaryTreeNode node = stack.pop();
      result = 31 * result + Integer.hashCode(node.value);
      if (node.right != null) {
        stack.push(node.right);
      } else {
        result = 31 * result + 7;
      }
      if (node.left != null) {
        stack.push(node.left);
      } else {
        result = 31 * result + 3;
      }
    }
    return result;
  }

  /// The compact level-order form, e.g. `[3, 9, 20, null, null, 15, 7]`. Unlike the codec this does not check
  /// ownership, so a node linked under two parents is simply listed at both positions.
  @Override
  public String toString() {
    final List<Integer> values = new ArrayList<>();
    final Deque<Optional<BinaryTreeNode>> slots = new ArrayDeque<>();
    slots.add(Optional.of(this));
    while (!slots.isEmpty()) {
      final Optional<BinaryTreeNode> slot = slots.poll();
      if (slot.isEmpty()) {
        values.add(null);
        continue;
      }
      final BinaryTreeNode node = slot.get();
      values.add(node.value);
      slots.add(Optional.ofNullable(node.left));
      slots.add(Optional.ofNullable(node.right));
    }
    int end = values.size();
    while (end > 0 && values.get(end - 1) == null) {
      end--;
    }
    return values.subList(0, end).toString();
  }
}
