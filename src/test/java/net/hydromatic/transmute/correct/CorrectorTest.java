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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.function.Function;
import net.hydromatic.transmute.ast.Pos;
import net.hydromatic.transmute.config.Prop;
import net.hydromatic.transmute.parse.RubyParser;
import net.hydromatic.transmute.rule.Diagnostic;
import net.hydromatic.transmute.rule.Edit;
import net.hydromatic.transmute.rule.Inspector;
import net.hydromatic.transmute.rule.Offense;
import net.hydromatic.transmute.rule.RuleVariant;
import net.hydromatic.transmute.rule.SurfaceShape;
import net.hydromatic.transmute.rule.Tracers;
import org.junit.jupiter.api.Test;

/** Tests {@link Corrector}. */
class CorrectorTest {
  private static Pos pos(String s, int start, int end) {
    return Pos.of(s, "", start, end);
  }

  private static Offense offense(Edit... edits) {
    final Diagnostic diagnostic =
        new Diagnostic(edits[0].pos, "message", RuleVariant.VALUE_TRANSFORM,
            SurfaceShape.CHAINED_TO_H);
    return new Offense(diagnostic, ImmutableList.copyOf(edits));
  }

  @Test void testApply() {
    final String s = "abcdefgh";
    final List<Edit> edits =
        ImmutableList.of(Edit.replace(pos(s, 6, 7), "G"),
            Edit.remove(pos(s, 0, 2)),
            Edit.replace(pos(s, 3, 4), "xyz"));
    assertThat(Corrector.apply(s, edits), is("cxyzefGh"));
    assertThat(Corrector.apply(s, ImmutableList.of()), is(s));
    // Adjacent edits do not overlap
    assertThat(
        Corrector.apply(s,
            ImmutableList.of(Edit.remove(pos(s, 0, 2)),
                Edit.remove(pos(s, 2, 4)))),
        is("efgh"));
  }

  @Test void testClobbering() {
    final String s = "abcdefgh";
    final ClobberingException e =
        assertThrows(ClobberingException.class,
            () -> Corrector.apply(s,
                ImmutableList.of(Edit.remove(pos(s, 3, 6)),
                    Edit.replace(pos(s, 1, 4), "x"))));
    assertThat(e.pos().startOffset, is(3));
    assertThat(e.describeTo(new StringBuilder()).toString(),
        is("1.4-1.7 Error: edit [replace 1.2-1.5 with 'x'] overlaps "
            + "edit [remove 1.4-1.7]"));
  }

  @Test void testCorrectDefersOverlappingOffense() {
    final String s = "abcdefgh";
    final Offense o1 = offense(Edit.remove(pos(s, 0, 2)));
    final Offense o2 = offense(Edit.remove(pos(s, 1, 3)));
    final Offense o3 = offense(Edit.replace(pos(s, 5, 6), "F"));
    final Offense o4 = offense(Edit.remove(pos(s, 5, 6)));
    final Corrector.Correction correction =
        Corrector.correct(s, ImmutableList.of(o1, o2, o3, o4));
    assertThat(correction.source, is("cdeFgh"));
    assertThat(correction.applied, is(ImmutableList.of(o1, o3)));
    assertThat(correction.deferred, is(ImmutableList.of(o2, o4)));
  }

  @Test void testCorrectIgnoresOffenseWithoutEdits() {
    final String s = "abc";
    final Offense o =
        new Offense(
            new Diagnostic(pos(s, 0, 1), "m", RuleVariant.PURE_SWAP,
                SurfaceShape.CONSTRUCTOR_WRAP),
            ImmutableList.of());
    final Corrector.Correction correction =
        Corrector.correct(s, ImmutableList.of(o));
    assertThat(correction.source, is(s));
    assertThat(correction.applied, hasSize(0));
    assertThat(correction.deferred, hasSize(0));
  }

  /** An "inspector" that finds the first "aa" and removes one "a". */
  private static List<Offense> findDoubleA(String s) {
    final int i = s.indexOf("aa");
    if (i < 0) {
      return ImmutableList.of();
    }
    return ImmutableList.of(offense(Edit.remove(pos(s, i, i + 1))));
  }

  @Test void testCorrectFully() {
    final Function<String, List<Offense>> inspector =
        CorrectorTest::findDoubleA;
    assertThat(Corrector.correctFully("baaaab", inspector), is("bab"));
    assertThat(Corrector.correctFully("baaaab", inspector, 1), is("baaab"));
    assertThat(Corrector.correctFully("bcd", inspector), is("bcd"));
    assertThrows(IllegalArgumentException.class,
        () -> Corrector.correctFully("x", inspector, 0));
  }

  @Test void testCorrectFullyWithInspector() {
    final Inspector inspector = new Inspector(
        ImmutableMap.of(Prop.AUTOCORRECT, true), Tracers.empty());
    final String source = "h.map { |k, v| [k, v * 2] }.to_h\n"
        + "Hash[h.map { |k, v| [k.to_s, v] }]\n";
    assertThat(
        Corrector.correctFully(source,
            s -> inspector.inspect(RubyParser.parse(s))),
        is("h.transform_values { |v| v * 2 }\n"
            + "Hash[h.map { |k, v| [k.to_s, v] }]\n"));
  }
}

// End CorrectorTest.java
