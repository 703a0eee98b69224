// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0

package io.github.simbo1905.binary_tree;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.logging.Logger;

/// Converts a binary tree to its level-order token sequence and back.
///
/// The sequence is produced breadth-first from a FIFO queue seeded with the root. Every dequeued slot emits exactly one
/// token: a real node emits its value and enqueues both of its child slots, an empty slot emits [Token#NULL] and
/// enqueues nothing. The tree `[3, 9, 20, null, null, 15, 7]` therefore serializes to
/// `3, 9, 20, null, null, 15, 7, null, null, null, null` and a tree of `k` nodes always yields `2k + 1` tokens.
/// The empty tree is the single token `null`.
///
/// Both directions are pure functions of their argument and are safe to call concurrently.
public final class TreeCodec {

  static final Logger LOGGER = Logger.getLogger(TreeCodec.class.getName());

  private TreeCodec() {
  }

  /// Serialize a tree to its level-order token sequence
  /// @param root the root of the tree, or null for the empty tree
  /// @return an unmodifiable list of tokens
  /// @throws IllegalArgumentException if a node is reachable from two parents
  public static @NotNull List<Token> serialize(@Nullable BinaryTreeNode root) {
    if (root == null) {
      LOGGER.fine(() -> "serialize - empty tree");
      return List.of(Token.NULL);
    }
    final List<Token> tokens = new ArrayList<>();
    final Set<BinaryTreeNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    final Deque<Optional<BinaryTreeNode>> slots = new ArrayDeque<>();
    slots.add(Optional.of(root));
    while (!slots.isEmpty()) {
      final Optional<BinaryTreeNode> slot = slots.poll();
      if (slot.isEmpty()) {
        tokens.add(Token.NULL);
        continue;
      }
      final BinaryTreeNode node = slot.get();
      if (!visited.add(node)) {
        final var msg = "Node with value " + node.value() + " is reachable from more than one parent at token " +
            tokens.size() + "; only trees can be serialized";
        LOGGER.severe(() -> msg);
        throw new IllegalArgumentException(msg);
      }
      tokens.add(Token.of(node.value()));
      slots.add(Optional.ofNullable(node.left()));
      slots.add(Optional.ofNullable(node.right()));
    }
    LOGGER.fine(() -> "serialize - " + visited.size() + " nodes as " + tokens.size() + " tokens");
    return List.copyOf(tokens);
  }

  /// Rebuild the tree described by a level-order token sequence
  /// @param tokens the tokens as produced by [#serialize(BinaryTreeNode)]
  /// @return the root of the rebuilt tree, or null when the sequence is the single null token
  /// @throws MalformedTokenSequenceException if the sequence is empty, ends while a parent still expects a child
  ///  token, or has tokens left over once every node has received both of its children
  public static @Nullable BinaryTreeNode deserialize(@NotNull List<Token> tokens) {
    Objects.requireNonNull(tokens, "tokens must not be null");
    LOGGER.fine(() -> "deserialize - " + tokens.size() + " tokens");
    if (tokens.isEmpty()) {
      throw malformed("Empty token sequence; the empty tree is encoded as a single null token");
    }
    final Token first = tokenAt(tokens, 0);
    if (first instanceof Token.Null) {
      if (tokens.size() != 1) {
        throw malformed("Null root followed by " + (tokens.size() - 1) + " further tokens");
      }
      return null;
    }
    final BinaryTreeNode root = new BinaryTreeNode(((Token.Value) first).value());
    final Deque<BinaryTreeNode> parents = new ArrayDeque<>();
    parents.add(root);
    int index = 1;
    while (index < tokens.size()) {
      final BinaryTreeNode parent = parents.poll();
      if (parent == null) {
        throw malformed((tokens.size() - index) + " unconsumed tokens from index " + index +
            " after every node received its children");
      }
      if (index + 1 >= tokens.size()) {
        throw malformed("Sequence ends after the left child of node " + parent.value() +
            " at index " + index + "; its right child token is missing");
      }
      final BinaryTreeNode left = childAt(tokens, index);
      if (left != null) {
        parent.attachLeft(left);
        parents.add(left);
      }
      final BinaryTreeNode right = childAt(tokens, index + 1);
      if (right != null) {
        parent.attachRight(right);
        parents.add(right);
      }
      index += 2;
    }
    if (!parents.isEmpty()) {
      throw malformed("Sequence of " + tokens.size() + " tokens ends while " + parents.size() +
          " nodes still expect child tokens, starting with node " + parents.peek().value());
    }
    return root;
  }

  private static BinaryTreeNode childAt(List<Token> tokens, int index) {
    final Token token = tokenAt(tokens, index);
    if (token instanceof Token.Value v) {
      LOGGER.finer(() -> "deserialize - node " + v.value() + " at index " + index);
      return new BinaryTreeNode(v.value());
    }
    return null;
  }

  private static Token tokenAt(List<Token> tokens, int index) {
    final Token token = tokens.get(index);
    if (token == null) {
      throw malformed("Missing token at index " + index + "; use Token.NULL for an empty slot");
    }
    return token;
  }

  static MalformedTokenSequenceException malformed(String msg) {
    LOGGER.severe(() -> msg);
    return new MalformedTokenSequenceException(msg);
  }

  static MalformedTokenSequenceException malformed(String msg, Throwable cause) {
    LOGGER.severe(() -> msg);
    return new MalformedTokenSequenceException(msg, cause);
  }
}
