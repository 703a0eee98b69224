// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0

package io.github.simbo1905.binary_tree;

/// Thrown when a preorder and inorder listing cannot both describe the same tree of distinct values.
public class InconsistentTraversalPairException extends IllegalArgumentException {

  public InconsistentTraversalPairException(String message) {
    super(message);
  }
}
