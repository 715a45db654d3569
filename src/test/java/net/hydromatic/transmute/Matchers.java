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
package net.hydromatic.transmute;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.transmute.ast.AstNode;
import net.hydromatic.transmute.ast.Pos;
import net.hydromatic.transmute.rule.Diagnostic;
import net.hydromatic.transmute.util.TransmuteException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

/** Matchers for use in Transmute tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches an AST node by its s-expression. */
  static <T extends AstNode> Matcher<T> isAst(Class<? extends T> clazz,
      String expected) {
    return new CustomTypeSafeMatcher<T>("ast with value " + expected) {
      @Override protected boolean matchesSafely(T t) {
        assertThat(clazz.isInstance(t), is(true));
        return t.toString().equals(expected);
      }
    };
  }

  /** Matches a position by its line and column description, such as
   * "1.6-1.33". */
  static Matcher<Pos> hasRange(String expected) {
    return new CustomTypeSafeMatcher<Pos>("position " + expected) {
      @Override protected boolean matchesSafely(Pos pos) {
        return describe(pos).equals(expected);
      }

      @Override protected void describeMismatchSafely(Pos pos,
          Description description) {
        description.appendText("was ").appendValue(describe(pos));
      }
    };
  }

  private static String describe(Pos pos) {
    final Pos pos2 = new Pos("", pos.startLine, pos.startColumn, pos.endLine,
        pos.endColumn, pos.startOffset, pos.endOffset);
    return pos2.toString();
  }

  /** Matches a diagnostic by position and message. The position is not
   * checked if {@code pos} is null. */
  static Matcher<Diagnostic> isDiagnostic(@Nullable Pos pos,
      String message) {
    return new TypeSafeMatcher<Diagnostic>() {
      @Override protected boolean matchesSafely(Diagnostic diagnostic) {
        return (pos == null || diagnostic.pos.equals(pos))
            && diagnostic.message.equals(message);
      }

      @Override public void describeTo(Description description) {
        description.appendText("diagnostic ")
            .appendValue(message)
            .appendText(" at ")
            .appendValue(pos);
      }
    };
  }

  /** Matches an exception of a given class whose message contains a
   * string. */
  static <T extends Throwable> Matcher<Throwable> throwsA(Class<T> clazz,
      String message) {
    return new CustomTypeSafeMatcher<Throwable>(clazz + " with message "
        + message) {
      @Override protected boolean matchesSafely(Throwable item) {
        return clazz.isInstance(item)
            && item.getMessage() != null
            && item.getMessage().contains(message);
      }
    };
  }

  /** Matches an exception that has a given position. */
  static Matcher<Throwable> throwsAt(Pos pos) {
    return new CustomTypeSafeMatcher<Throwable>("exception at " + pos) {
      @Override protected boolean matchesSafely(Throwable item) {
        return item instanceof TransmuteException
            && ((TransmuteException) item).pos().equals(pos);
      }
    };
  }
}

// End Matchers.java
