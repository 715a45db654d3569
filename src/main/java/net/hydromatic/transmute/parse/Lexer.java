/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.transmute.parse;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.transmute.ast.Pos;

/** Splits Ruby source text into tokens. */
class Lexer {
  static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of("do", "end", "nil", "true", "false", "self");

  /** Two-character operators; checked before single characters. */
  private static final ImmutableList<String> OPERATORS2 =
      ImmutableList.of("==", "!=", "<=", ">=");

  private static final String OPERATORS1 = "+-*/%<>=!.,()[]{}|";

  private final String source;
  private final String file;
  private final int[] lineStarts;

  Lexer(String source, String file) {
    this.source = requireNonNull(source);
    this.file = requireNonNull(file);
    final List<Integer> starts = new ArrayList<>();
    starts.add(0);
    for (int i = 0; i < source.length(); i++) {
      if (source.charAt(i) == '\n') {
        starts.add(i + 1);
      }
    }
    this.lineStarts = starts.stream().mapToInt(i -> i).toArray();
  }

  /** Creates a position from two offsets. */
  Pos pos(int startOffset, int endOffset) {
    final int startLine = line(startOffset);
    final int endLine = line(endOffset);
    return new Pos(
        file,
        startLine + 1,
        startOffset - lineStarts[startLine] + 1,
        endLine + 1,
        endOffset - lineStarts[endLine] + 1,
        startOffset,
        endOffset);
  }

  /** Returns the 0-based line containing an offset. */
  private int line(int offset) {
    final int i = Arrays.binarySearch(lineStarts, offset);
    return i >= 0 ? i : -i - 2;
  }

  /** Converts the whole source into a list of tokens, ending in EOF. */
  List<Token> tokenize() {
    final List<Token> tokens = new ArrayList<>();
    int i = 0;
    boolean space = true;
    final int n = source.length();
    while (i < n) {
      final char c = source.charAt(i);
      if (c == ' ' || c == '\t' || c == '\r') {
        ++i;
        space = true;
        continue;
      }
      if (c == '\\' && i + 1 < n && source.charAt(i + 1) == '\n') {
        // line continuation
        i += 2;
        space = true;
        continue;
      }
      if (c == '#') {
        while (i < n && source.charAt(i) != '\n') {
          ++i;
        }
        continue;
      }
      final int start = i;
      final Kind kind;
      if (c == '\n' || c == ';') {
        kind = Kind.NEWLINE;
        ++i;
      } else if (Character.isDigit(c)) {
        i = scanDigits(i);
        if (i + 1 < n
            && source.charAt(i) == '.'
            && Character.isDigit(source.charAt(i + 1))) {
          i = scanDigits(i + 1);
          kind = Kind.FLOAT;
        } else {
          kind = Kind.INT;
        }
      } else if (c == '_' || Character.isLetter(c)) {
        i = scanName(i);
        final String name = source.substring(start, i);
        kind = KEYWORDS.contains(name) ? Kind.KEYWORD
            : Character.isUpperCase(c) ? Kind.CONSTANT
            : Kind.IDENT;
      } else if (c == '"' || c == '\'') {
        i = scanString(i);
        kind = Kind.STRING;
      } else if (c == ':' && i + 1 < n
          && (source.charAt(i + 1) == '_'
              || Character.isLetter(source.charAt(i + 1)))) {
        i = scanName(i + 1);
        kind = Kind.SYMBOL;
      } else if (c == ':' && i + 1 < n && source.charAt(i + 1) == '"') {
        i = scanString(i + 1);
        kind = Kind.SYMBOL;
      } else if (i + 1 < n
          && OPERATORS2.contains(source.substring(i, i + 2))) {
        i += 2;
        kind = Kind.OP;
      } else if (OPERATORS1.indexOf(c) >= 0) {
        ++i;
        kind = Kind.OP;
      } else {
        throw new ParseException("unexpected character '" + c + "'",
            pos(start, start + 1));
      }
      tokens.add(
          new Token(kind, source.substring(start, i), pos(start, i), space));
      space = kind == Kind.NEWLINE;
    }
    tokens.add(new Token(Kind.EOF, "", pos(n, n), true));
    return tokens;
  }

  private int scanDigits(int i) {
    while (i < source.length()
        && (Character.isDigit(source.charAt(i)) || source.charAt(i) == '_')) {
      ++i;
    }
    return i;
  }

  /** Scans an identifier, which may end in '?' or '!'. */
  private int scanName(int i) {
    final int n = source.length();
    while (i < n
        && (Character.isLetterOrDigit(source.charAt(i))
            || source.charAt(i) == '_')) {
      ++i;
    }
    if (i < n
        && (source.charAt(i) == '?' || source.charAt(i) == '!')
        && (i + 1 >= n || source.charAt(i + 1) != '=')) {
      ++i;
    }
    return i;
  }

  /** Scans a string literal starting at a quote character. */
  private int scanString(int start) {
    final char quote = source.charAt(start);
    int i = start + 1;
    while (i < source.length()) {
      final char c = source.charAt(i);
      if (c == '\\') {
        i += 2;
      } else if (c == quote) {
        return i + 1;
      } else {
        ++i;
      }
    }
    throw new ParseException("unterminated string",
        pos(start, source.length()));
  }

  /** Kind of token. */
  enum Kind {
    IDENT,
    CONSTANT,
    KEYWORD,
    INT,
    FLOAT,
    STRING,
    SYMBOL,
    OP,
    NEWLINE,
    EOF
  }

  /** Token. */
  static class Token {
    final Kind kind;
    final String text;
    final Pos pos;
    /** Whether the token was preceded by white space. */
    final boolean spaceBefore;

    Token(Kind kind, String text, Pos pos, boolean spaceBefore) {
      this.kind = kind;
      this.text = text;
      this.pos = pos;
      this.spaceBefore = spaceBefore;
    }

    boolean is(Kind kind, String text) {
      return this.kind == kind && this.text.equals(text);
    }

    boolean isOp(String text) {
      return is(Kind.OP, text);
    }

    @Override
    public String toString() {
      return kind == Kind.EOF ? "end of input"
          : kind == Kind.NEWLINE ? "end of line"
          : text;
    }
  }
}

// End Lexer.java
