// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0

package io.github.simbo1905.binary_tree;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Reconstructs the unique binary tree described by its preorder and inorder listings.
///
/// Values must be distinct: the inorder position of every value is indexed once up front, so each split of an inorder
/// range is a constant time lookup and the whole build is linear. Subtrees are split off as index ranges of the two
/// arrays, never copies, and are taken from an explicit stack so the height of the tree is bounded only by the heap.
/// A node is linked to its parent as soon as its range is checked; any inconsistency abandons the whole tree.
public final class TreeBuilder {

  static final Logger LOGGER = Logger.getLogger(TreeBuilder.class.getName());

  private final int[] preorder;
  private final Map<Integer, Integer> inorderIndex;

  private TreeBuilder(int[] preorder, Map<Integer, Integer> inorderIndex) {
    this.preorder = preorder;
    this.inorderIndex = inorderIndex;
  }

  /// Build the tree whose preorder and inorder traversals are the given arrays
  /// @param preorder values in root, left, right order
  /// @param inorder values in left, root, right order
  /// @return the root, or null when both arrays are empty
  /// @throws InconsistentTraversalPairException if the lengths differ, a value repeats, or the arrays do not list
  ///  the same values in an order some binary tree could produce
  public static @Nullable BinaryTreeNode build(int[] preorder, int[] inorder) {
    Objects.requireNonNull(preorder, "preorder must not be null");
    Objects.requireNonNull(inorder, "inorder must not be null");
    LOGGER.fine(() -> "build - " + preorder.length + " values");
    if (preorder.length != inorder.length) {
      throw inconsistent("Traversal lengths differ: preorder has " + preorder.length +
          " values but inorder has " + inorder.length);
    }
    if (preorder.length == 0) {
      return null;
    }
    final var builder = new TreeBuilder(preorder, indexOf(inorder));
    return builder.tree();
  }

  /// Build from boxed lists, see [#build(int\[\], int\[\])]
  public static @Nullable BinaryTreeNode build(@NotNull List<Integer> preorder, @NotNull List<Integer> inorder) {
    Objects.requireNonNull(preorder, "preorder must not be null");
    Objects.requireNonNull(inorder, "inorder must not be null");
    return build(unbox("preorder", preorder), unbox("inorder", inorder));
  }

  /// Maps each inorder value to its position. A pure function of its argument.
  static Map<Integer, Integer> indexOf(int[] inorder) {
    final Map<Integer, Integer> index = new HashMap<>(Math.max(16, inorder.length * 4 / 3 + 1));
    for (int i = 0; i < inorder.length; i++) {
      final Integer previous = index.put(inorder[i], i);
      if (previous != null) {
        throw inconsistent("Duplicate value " + inorder[i] + " in inorder at positions " + previous + " and " + i);
      }
    }
    return index;
  }

  /// A pending subtree: inclusive ranges of both arrays and the slot of the parent it hangs from
  private record Frame(int preL, int preR, int inL, int inR, BinaryTreeNode parent, boolean left) {}

  private BinaryTreeNode tree() {
    BinaryTreeNode root = null;
    final Deque<Frame> pending = new ArrayDeque<>();
    pending.push(new Frame(0, preorder.length - 1, 0, preorder.length - 1, null, false));
    while (!pending.isEmpty()) {
      final Frame frame = pending.pop();
      if (frame.preL() > frame.preR()) {
        continue;
      }
      final BinaryTreeNode node = node(frame);
      if (frame.parent() == null) {
        root = node;
      } else if (frame.left()) {
        frame.parent().attachLeft(node);
      } else {
        frame.parent().attachRight(node);
      }
      final int mid = inorderIndex.get(node.value());
      final int leftSize = mid - frame.inL();
      pending.push(new Frame(frame.preL() + leftSize + 1, frame.preR(), mid + 1, frame.inR(), node, false));
      pending.push(new Frame(frame.preL() + 1, frame.preL() + leftSize, frame.inL(), mid - 1, node, true));
    }
    return root;
  }

  private BinaryTreeNode node(Frame frame) {
    final int preL = frame.preL();
    final int inL = frame.inL();
    final int inR = frame.inR();
    final int rootValue = preorder[preL];
    final Integer position = inorderIndex.get(rootValue);
    if (position == null) {
      throw inconsistent("Preorder value " + rootValue + " at position " + preL + " does not occur in inorder");
    }
    final int mid = position;
    if (mid < inL || mid > inR) {
      throw inconsistent("Preorder value " + rootValue + " at position " + preL + " lies at inorder position " + mid +
          " outside its subtree range [" + inL + ", " + inR + "]; the value repeats or the orders disagree");
    }
    LOGGER.finer(() -> "build - node " + rootValue + " with " + (mid - inL) + " left and " + (inR - mid) + " right");
    return new BinaryTreeNode(rootValue);
  }

  private static int[] unbox(String name, List<Integer> values) {
    final int[] result = new int[values.size()];
    for (int i = 0; i < result.length; i++) {
      final Integer value = values.get(i);
      if (value == null) {
        throw inconsistent("Null value in " + name + " at position " + i);
      }
      result[i] = value;
    }
    return result;
  }

  private static InconsistentTraversalPairException inconsistent(String msg) {
    LOGGER.severe(() -> msg);
    return new InconsistentTraversalPairException(msg);
  }
}
