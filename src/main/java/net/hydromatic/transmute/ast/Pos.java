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
package net.hydromatic.transmute.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.Maps;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Position of a parse-tree node.
 *
 * <p>A position records both the line and column (1-based, for humans) and
 * the character offsets (0-based, end exclusive) of a range of source text.
 * Rewrites are computed from the offsets; diagnostics are printed using the
 * lines and columns.
 */
public class Pos {
  public static final Pos ZERO = new Pos("", 1, 1, 1, 1, 0, 0);

  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;
  public final int startOffset;
  public final int endOffset;

  /** Creates a Pos. */
  public Pos(
      String file,
      int startLine,
      int startColumn,
      int endLine,
      int endColumn,
      int startOffset,
      int endOffset) {
    checkArgument(
        startOffset <= endOffset,
        "start offset %s after end offset %s",
        startOffset,
        endOffset);
    this.file = file;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
    this.startOffset = startOffset;
    this.endOffset = endOffset;
  }

  /** Creates a Pos from two offsets into a piece of source text. */
  public static Pos of(
      String text, String file, int startOffset, int endOffset) {
    final int[] start = lineCol(text, startOffset);
    final int[] end = lineCol(text, endOffset);
    return new Pos(
        file, start[0], start[1], end[0], end[1], startOffset, endOffset);
  }

  /**
   * Creates a Pos from a filename and a string with a delimiter character.
   * The delimiter must occur exactly twice in the string.
   *
   * <p>Returns the string with the delimiters removed, and the position of
   * the text that was between them.
   */
  public static Map.Entry<String, Pos> split(
      String s, char delimiter, String file) {
    final int i = s.indexOf(delimiter);
    final int j = s.indexOf(delimiter, i + 1);
    final int k = s.indexOf(delimiter, j + 1);
    if (i < 0 || j <= i || k >= 0) {
      throw new IllegalArgumentException(
          "expected exactly two occurrences of delimiter, '" + delimiter + "'");
    }
    final String s2 = s.substring(0, i) + s.substring(i + 1, j)
        + s.substring(j + 1);
    final Pos pos = of(s2, file, i, j - 1);
    return Maps.immutableEntry(s2, pos);
  }

  /** Returns whether this position covers no characters. */
  public boolean isEmpty() {
    return startOffset == endOffset;
  }

  /** Returns a zero-width position at the start of this position. */
  public Pos begin() {
    return new Pos(
        file, startLine, startColumn, startLine, startColumn, startOffset,
        startOffset);
  }

  /** Returns a zero-width position at the end of this position. */
  public Pos end() {
    return new Pos(
        file, endLine, endColumn, endLine, endColumn, endOffset, endOffset);
  }

  /**
   * Returns whether this position shares at least one character with
   * another. Zero-width positions never overlap anything.
   */
  public boolean overlaps(Pos pos) {
    return startOffset < pos.endOffset && pos.startOffset < endOffset;
  }

  /** Returns the text covered by this position. */
  public String text(String source) {
    return source.substring(startOffset, endOffset);
  }

  @Override
  public int hashCode() {
    return Objects.hash(startLine, startColumn, endLine, endColumn);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
            && this.startLine == ((Pos) o).startLine
            && this.startColumn == ((Pos) o).startColumn
            && this.endLine == ((Pos) o).endLine
            && this.endColumn == ((Pos) o).endColumn
            && this.startOffset == ((Pos) o).startOffset
            && this.endOffset == ((Pos) o).endOffset;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(file)
        .append(file.isEmpty() ? "" : ":")
        .append(startLine)
        .append('.')
        .append(startColumn);
    if (endColumn != startColumn + 1 || endLine != startLine) {
      buf.append('-').append(endLine).append('.').append(endColumn);
    }
    return buf;
  }

  /**
   * Combines a list of positions to create a position which spans from the
   * beginning of the first to the end of the last.
   */
  public static Pos sum(List<Pos> positions) {
    switch (positions.size()) {
      case 0:
        throw new AssertionError();
      case 1:
        return positions.get(0);
      default:
        Pos p = positions.get(0);
        for (Pos pos : positions.subList(1, positions.size())) {
          p = p.plus(pos);
        }
        return p;
    }
  }

  /** Returns a position spanning both this and another position. */
  public Pos plus(Pos pos) {
    int startLine = this.startLine;
    int startColumn = this.startColumn;
    int startOffset = this.startOffset;
    if (pos.startOffset < startOffset) {
      startLine = pos.startLine;
      startColumn = pos.startColumn;
      startOffset = pos.startOffset;
    }
    int endLine = pos.endLine;
    int endColumn = pos.endColumn;
    int endOffset = pos.endOffset;
    if (this.endOffset > endOffset) {
      endLine = this.endLine;
      endColumn = this.endColumn;
      endOffset = this.endOffset;
    }
    return new Pos(
        file, startLine, startColumn, endLine, endColumn, startOffset,
        endOffset);
  }

  /** Returns the 1-based line and column of an offset. */
  private static int[] lineCol(String s, int offset) {
    int line = 1;
    int lineStart = 0;
    int i;
    final int n = Math.min(s.length(), offset);
    for (i = 0; i < n; i++) {
      if (s.charAt(i) == '\n') {
        ++line;
        lineStart = i + 1;
      }
    }
    if (i == offset) {
      return new int[] {line, offset - lineStart + 1};
    } else {
      throw new IllegalArgumentException("not found");
    }
  }
}

// End Pos.java
