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
package net.hydromatic.transmute.correct;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import net.hydromatic.transmute.rule.Edit;
import net.hydromatic.transmute.rule.Offense;

/**
 * Applies edits to source text.
 *
 * <p>Positions in the edits are offsets into the source text that was
 * parsed; all edits of one call to {@link #apply} must therefore come from
 * the same parse.
 */
public abstract class Corrector {
  private Corrector() {}

  /** Number of passes that {@link #correctFully(String, Function)} makes
   * before giving up. */
  public static final int DEFAULT_MAX_PASSES = 10;

  private static final Ordering<Edit> BY_START =
      Ordering.from(
          Comparator.<Edit>comparingInt(e -> e.pos.startOffset)
              .thenComparingInt(e -> e.pos.endOffset));

  /**
   * Applies a list of edits, given in any order, to a string.
   *
   * @throws ClobberingException if two edits overlap
   */
  public static String apply(String source, List<Edit> edits) {
    final List<Edit> sorted = BY_START.sortedCopy(edits);
    final StringBuilder buf = new StringBuilder();
    int offset = 0;
    Edit previous = null;
    for (Edit edit : sorted) {
      checkArgument(edit.pos.endOffset <= source.length(),
          "edit %s is beyond end of source", edit);
      if (previous != null && edit.overlaps(previous)
          || edit.pos.startOffset < offset) {
        throw new ClobberingException(requireNonNull(previous), edit);
      }
      buf.append(source, offset, edit.pos.startOffset)
          .append(edit.replacement);
      offset = edit.pos.endOffset;
      previous = edit;
    }
    return buf.append(source, offset, source.length()).toString();
  }

  /**
   * Applies the edits of several offenses.
   *
   * <p>If the edits of an offense overlap the edits of an offense earlier in
   * the list, that offense is deferred: it is not applied, and will be found
   * again when the corrected source is inspected. Offenses without edits are
   * ignored.
   */
  public static Correction correct(String source, List<Offense> offenses) {
    final List<Offense> applied = new ArrayList<>();
    final List<Offense> deferred = new ArrayList<>();
    final List<Edit> edits = new ArrayList<>();
    for (Offense offense : offenses) {
      if (offense.edits.isEmpty()) {
        continue;
      }
      if (applied.stream().anyMatch(offense::overlaps)) {
        deferred.add(offense);
      } else {
        applied.add(offense);
        edits.addAll(offense.edits);
      }
    }
    return new Correction(apply(source, edits), applied, deferred);
  }

  /** As {@link #correctFully(String, Function, int)}, with the default
   * number of passes. */
  public static String correctFully(String source,
      Function<String, List<Offense>> inspector) {
    return correctFully(source, inspector, DEFAULT_MAX_PASSES);
  }

  /**
   * Inspects and corrects a source text repeatedly, until no correctable
   * offense remains or {@code maxPasses} passes have been made.
   *
   * @param source Source text
   * @param inspector Parses and inspects a source text, returning offenses
   *   with edits
   * @param maxPasses Maximum number of passes
   * @return Corrected source text
   */
  public static String correctFully(String source,
      Function<String, List<Offense>> inspector, int maxPasses) {
    checkArgument(maxPasses > 0, "maxPasses must be positive");
    String s = source;
    for (int pass = 0; pass < maxPasses; pass++) {
      final Correction correction = correct(s, inspector.apply(s));
      if (correction.applied.isEmpty()) {
        break;
      }
      s = correction.source;
    }
    return s;
  }

  /** Result of {@link #correct}. */
  public static class Correction {
    /** Source text after applying the edits. */
    public final String source;
    public final List<Offense> applied;
    /** Offenses that overlapped an applied offense. */
    public final List<Offense> deferred;

    Correction(String source, List<Offense> applied, List<Offense> deferred) {
      this.source = requireNonNull(source);
      this.applied = ImmutableList.copyOf(applied);
      this.deferred = ImmutableList.copyOf(deferred);
    }
  }
}

// End Corrector.java
