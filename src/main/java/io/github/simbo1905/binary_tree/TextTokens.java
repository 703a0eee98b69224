// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0

package io.github.simbo1905.binary_tree;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static io.github.simbo1905.binary_tree.TreeCodec.LOGGER;
import static io.github.simbo1905.binary_tree.TreeCodec.malformed;

/// Text framing of a token sequence: tokens joined by a delimiter with a reserved marker for the null token.
/// With the defaults the tree `[3, 9, 20, null, null, 15, 7]` is written as `3,9,20,#,#,15,7,#,#,#,#` and the empty
/// tree as `#`.
///
/// The defaults can be changed with the system properties `binary_tree.TextTokens.delimiter` and
/// `binary_tree.TextTokens.nullMarker`.
public record TextTokens(@NotNull String delimiter, @NotNull String nullMarker) {

  public static final String DELIMITER_PROPERTY = "binary_tree.TextTokens.delimiter";
  public static final String NULL_MARKER_PROPERTY = "binary_tree.TextTokens.nullMarker";

  private static final Pattern NUMERIC = Pattern.compile("[+-]?\\d+");

  /// Framing configured from system properties, falling back to `,` and `#`
  public static final TextTokens DEFAULT = new TextTokens(
      System.getProperty(DELIMITER_PROPERTY, ","),
      System.getProperty(NULL_MARKER_PROPERTY, "#"));

  public TextTokens {
    Objects.requireNonNull(delimiter, "delimiter must not be null");
    Objects.requireNonNull(nullMarker, "nullMarker must not be null");
    if (delimiter.isEmpty() || nullMarker.isBlank()) {
      throw new IllegalArgumentException("Delimiter and null marker must not be empty: delimiter='" + delimiter +
          "' nullMarker='" + nullMarker + "'");
    }
    if (nullMarker.contains(delimiter) || delimiter.contains(nullMarker)) {
      throw new IllegalArgumentException("Delimiter '" + delimiter + "' and null marker '" + nullMarker +
          "' must not overlap");
    }
    if (isInteger(nullMarker.trim())) {
      throw new IllegalArgumentException("Null marker '" + nullMarker + "' would be read as a node value");
    }
  }

  public @NotNull String format(@NotNull List<Token> tokens) {
    Objects.requireNonNull(tokens, "tokens must not be null");
    return tokens.stream()
        .map(token -> token instanceof Token.Value v ? Integer.toString(v.value()) : nullMarker)
        .collect(Collectors.joining(delimiter));
  }

  /// Split text into tokens. Surrounding whitespace of each token is ignored.
  /// @throws MalformedTokenSequenceException if the text is blank or a token is neither an `int` nor the null marker
  public @NotNull List<Token> parse(@NotNull String text) {
    Objects.requireNonNull(text, "text must not be null");
    if (text.isBlank()) {
      throw malformed("Blank text; the empty tree is written as '" + nullMarker + "'");
    }
    final String[] parts = text.split(Pattern.quote(delimiter), -1);
    final List<Token> tokens = new ArrayList<>(parts.length);
    for (int i = 0; i < parts.length; i++) {
      final String part = parts[i].trim();
      if (part.equals(nullMarker.trim())) {
        tokens.add(Token.NULL);
      } else {
        try {
          tokens.add(Token.of(Integer.parseInt(part)));
        } catch (NumberFormatException e) {
          throw malformed("Token " + i + " '" + part + "' is neither an int nor the null marker '" +
              nullMarker + "'", e);
        }
      }
    }
    LOGGER.finer(() -> "parse - " + tokens.size() + " tokens from " + text.length() + " chars");
    return tokens;
  }

  public @NotNull String encode(@Nullable BinaryTreeNode root) {
    return format(TreeCodec.serialize(root));
  }

  public @Nullable BinaryTreeNode decode(@NotNull String text) {
    return TreeCodec.deserialize(parse(text));
  }

  private static boolean isInteger(String s) {
    return NUMERIC.matcher(s).matches();
  }
}
