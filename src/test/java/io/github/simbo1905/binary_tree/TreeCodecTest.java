// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0

package io.github.simbo1905.binary_tree;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static io.github.simbo1905.binary_tree.Token.NULL;
import static io.github.simbo1905.binary_tree.Token.of;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class TreeCodecTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  /// 3 with children 9 and 20, where 20 has children 15 and 7
  static BinaryTreeNode sample() {
    return new BinaryTreeNode(3,
        new BinaryTreeNode(9),
        new BinaryTreeNode(20, new BinaryTreeNode(15), new BinaryTreeNode(7)));
  }

  @Test
  void serializesInLevelOrderWithNullSlots() {
    final List<Token> tokens = TreeCodec.serialize(sample());
    assertThat(tokens).containsExactly(
        of(3), of(9), of(20), NULL, NULL, of(15), of(7), NULL, NULL, NULL, NULL);
  }

  @Test
  void deserializesSample() {
    final BinaryTreeNode root = TreeCodec.deserialize(List.of(
        of(3), of(9), of(20), NULL, NULL, of(15), of(7), NULL, NULL, NULL, NULL));
    assertNotNull(root);
    assertEquals(3, root.value());
    assertTrue(root.left().isLeaf());
    assertEquals(9, root.left().value());
    assertEquals(20, root.right().value());
    assertEquals(15, root.right().left().value());
    assertEquals(7, root.right().right().value());
    assertEquals(sample(), root);
  }

  @Test
  void singleNode() {
    final List<Token> tokens = TreeCodec.serialize(new BinaryTreeNode(5));
    assertThat(tokens).containsExactly(of(5), NULL, NULL);
    assertEquals(new BinaryTreeNode(5), TreeCodec.deserialize(tokens));
  }

  @Test
  void emptyTreeIsSingleNullToken() {
    assertThat(TreeCodec.serialize(null)).containsExactly(NULL);
    assertNull(TreeCodec.deserialize(List.of(NULL)));
  }

  @Test
  void nullChildrenAreNotExpanded() {
    // 1 has only a right child 2, which has only a left child 3
    final BinaryTreeNode root = new BinaryTreeNode(1, null, new BinaryTreeNode(2, new BinaryTreeNode(3), null));
    assertThat(TreeCodec.serialize(root)).containsExactly(
        of(1), NULL, of(2), of(3), NULL, NULL, NULL);
  }

  @Test
  void valuesMayRepeatAndTakeAnyInt() {
    final BinaryTreeNode root = new BinaryTreeNode(Integer.MIN_VALUE,
        new BinaryTreeNode(Integer.MIN_VALUE), new BinaryTreeNode(Integer.MAX_VALUE, null, new BinaryTreeNode(0)));
    assertEquals(root, TreeCodec.deserialize(TreeCodec.serialize(root)));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 3, 10, 64, 500})
  void tokenCountIsTwiceTheNodesPlusOne(int size) {
    final Random random = new Random(size);
    final BinaryTreeNode root = RandomTrees.repeating(random, size);
    final List<Token> tokens = TreeCodec.serialize(root);
    final long values = tokens.stream().filter(t -> t instanceof Token.Value).count();
    assertEquals(size, values);
    assertEquals(size + 1, tokens.size() - values);
  }

  @Test
  void randomTreesRoundTrip() {
    final Random random = new Random(1905);
    for (int i = 0; i < 200; i++) {
      final BinaryTreeNode original = RandomTrees.repeating(random, random.nextInt(40));
      final List<Token> tokens = TreeCodec.serialize(original);
      final BinaryTreeNode copy = TreeCodec.deserialize(tokens);
      assertEquals(original, copy, "round trip of " + tokens);
      assertEquals(tokens, TreeCodec.serialize(copy));
    }
  }

  @Test
  void deepChainRoundTrips() {
    final BinaryTreeNode chain = RandomTrees.leftChain(50_000);
    final BinaryTreeNode copy = TreeCodec.deserialize(TreeCodec.serialize(chain));
    assertTrue(chain.equals(copy));
  }

  @Test
  void deserializedTreesAreIndependentlyAllocated() {
    final List<Token> tokens = TreeCodec.serialize(sample());
    final BinaryTreeNode a = TreeCodec.deserialize(tokens);
    final BinaryTreeNode b = TreeCodec.deserialize(tokens);
    assertEquals(a, b);
    assertNotSame(a, b);
    assertNotSame(a.right(), b.right());
  }

  @Test
  void serializedTokensAreUnmodifiable() {
    final List<Token> tokens = TreeCodec.serialize(sample());
    assertThrows(UnsupportedOperationException.class, () -> tokens.add(NULL));
  }

  @Test
  void rejectsEmptySequence() {
    assertThatThrownBy(() -> TreeCodec.deserialize(List.of()))
        .isInstanceOf(MalformedTokenSequenceException.class)
        .hasMessageContaining("Empty token sequence");
  }

  @Test
  void rejectsNullRootWithTrailingTokens() {
    assertThrows(MalformedTokenSequenceException.class, () -> TreeCodec.deserialize(List.of(NULL, NULL)));
  }

  @Test
  void rejectsMissingRightChildToken() {
    assertThatThrownBy(() -> TreeCodec.deserialize(List.of(of(1), of(2))))
        .isInstanceOf(MalformedTokenSequenceException.class)
        .hasMessageContaining("right child token is missing");
  }

  @Test
  void rejectsSequenceEndingWhileParentsWait() {
    // 2 is created but its two child tokens never arrive
    assertThatThrownBy(() -> TreeCodec.deserialize(List.of(of(1), of(2), NULL)))
        .isInstanceOf(MalformedTokenSequenceException.class)
        .hasMessageContaining("still expect child tokens");
    assertThrows(MalformedTokenSequenceException.class, () -> TreeCodec.deserialize(List.of(of(1))));
  }

  @Test
  void rejectsLeftoverTokens() {
    assertThatThrownBy(() -> TreeCodec.deserialize(List.of(of(1), NULL, NULL, of(4), NULL)))
        .isInstanceOf(MalformedTokenSequenceException.class)
        .hasMessageContaining("unconsumed tokens from index 3");
  }

  @Test
  void rejectsNullElement() {
    final List<Token> tokens = new ArrayList<>(List.of(of(1), NULL, NULL));
    tokens.set(1, null);
    assertThrows(MalformedTokenSequenceException.class, () -> TreeCodec.deserialize(tokens));
  }

  @Test
  void rejectsSharedSubtree() {
    final BinaryTreeNode shared = new BinaryTreeNode(2);
    final BinaryTreeNode root = new BinaryTreeNode(1, shared, shared);
    assertThatThrownBy(() -> TreeCodec.serialize(root))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("more than one parent");
  }

  @Test
  void nullSequenceIsRejected() {
    assertThrows(NullPointerException.class, () -> TreeCodec.deserialize(null));
  }
}
