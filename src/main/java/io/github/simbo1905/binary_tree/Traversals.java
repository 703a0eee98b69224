// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0

package io.github.simbo1905.binary_tree;

import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.TestOnly;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/// Depth-first and breadth-first walks over a tree. All walks use an explicit stack or queue so the depth of the
/// tree is bounded only by the heap. The empty tree yields empty results.
public final class Traversals {

  private Traversals() {
  }

  /// Root, then left subtree, then right subtree
  public static List<Integer> preorder(@Nullable BinaryTreeNode root) {
    final List<Integer> values = new ArrayList<>();
    final Deque<BinaryTreeNode> stack = new ArrayDeque<>();
    if (root != null) {
      stack.push(root);
    }
    while (!stack.isEmpty()) {
      final BinaryTreeNode node = stack.pop();
      values.add(node.value());
      if (node.right() != null) {
        stack.push(node.right());
      }
      if (node.left() != null) {
        stack.push(node.left());
      }
    }
    return values;
  }

  /// Left subtree, then root, then right subtree
  public static List<Integer> inorder(@Nullable BinaryTreeNode root) {
    final List<Integer> values = new ArrayList<>();
    final Deque<BinaryTreeNode> stack = new ArrayDeque<>();
    BinaryTreeNode current = root;
    while (current != null || !stack.isEmpty()) {
      while (current != null) {
        stack.push(current);
        current = current.left();
      }
      final BinaryTreeNode node = stack.pop();
      values.add(node.value());
      current = node.right();
    }
    return values;
  }

  /// Left subtree, then right subtree, then root
  public static List<Integer> postorder(@Nullable BinaryTreeNode root) {
    // reversed root, right, left
    final Deque<Integer> values = new ArrayDeque<>();
    final Deque<BinaryTreeNode> stack = new ArrayDeque<>();
    if (root != null) {
      stack.push(root);
    }
    while (!stack.isEmpty()) {
      final BinaryTreeNode node = stack.pop();
      values.push(node.value());
      if (node.left() != null) {
        stack.push(node.left());
      }
      if (node.right() != null) {
        stack.push(node.right());
      }
    }
    return new ArrayList<>(values);
  }

  /// Values grouped by depth, each level listed left to right
  public static List<List<Integer>> levelOrder(@Nullable BinaryTreeNode root) {
    final List<List<Integer>> levels = new ArrayList<>();
    final Deque<BinaryTreeNode> queue = new ArrayDeque<>();
    if (root != null) {
      queue.add(root);
    }
    while (!queue.isEmpty()) {
      final int width = queue.size();
      final List<Integer> level = new ArrayList<>(width);
      for (int i = 0; i < width; i++) {
        final BinaryTreeNode node = queue.poll();
        level.add(node.value());
        if (node.left() != null) {
          queue.add(node.left());
        }
        if (node.right() != null) {
          queue.add(node.right());
        }
      }
      levels.add(level);
    }
    return levels;
  }

  public static int size(@Nullable BinaryTreeNode root) {
    return preorder(root).size();
  }

  /// Number of levels; the empty tree has height 0 and a single node height 1
  public static int height(@Nullable BinaryTreeNode root) {
    return levelOrder(root).size();
  }

  @TestOnly
  static int[] toArray(List<Integer> values) {
    return values.stream().mapToInt(Integer::intValue).toArray();
  }
}
