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
package net.hydromatic.transmute.rule;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Stream;
import net.hydromatic.transmute.ast.Pos;
import net.hydromatic.transmute.correct.Corrector;
import net.hydromatic.transmute.parse.RubyParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/** Tests {@link RewritePlanner}. */
class RewritePlannerTest {
  private static Binding bind(String source) {
    final Binding binding =
        new TreeQuery("Hash").match(RubyParser.parse(source), null);
    assertThat(binding, notNullValue());
    return binding;
  }

  /** Source, rule, rewritten source. */
  static Stream<Arguments> cases() {
    return Stream.of(
        Arguments.of("h.map { |k, v| [k, v.to_s] }.to_h",
            RuleVariant.VALUE_TRANSFORM, "h.transform_values { |v| v.to_s }"),
        Arguments.of("Hash[h.map { |k, v| [k, v.to_s] }]",
            RuleVariant.VALUE_TRANSFORM, "h.transform_values { |v| v.to_s }"),
        Arguments.of("h.to_h { |k, v| [k, v.to_s] }",
            RuleVariant.VALUE_TRANSFORM, "h.transform_values { |v| v.to_s }"),
        Arguments.of("h.collect { |k, v| [k.to_s, v] }.to_h",
            RuleVariant.KEY_TRANSFORM, "h.transform_keys { |k| k.to_s }"),
        Arguments.of("Hash[h.map { |k, v| [k.to_s, v] }]",
            RuleVariant.KEY_TRANSFORM, "h.transform_keys { |k| k.to_s }"),
        Arguments.of("h.to_h { |k, v| [k.to_s, v] }",
            RuleVariant.KEY_TRANSFORM, "h.transform_keys { |k| k.to_s }"),
        Arguments.of("h.map { |k, v| [v, k] }.to_h",
            RuleVariant.PURE_SWAP, "h.to_h { |k, v| [v, k] }"),
        Arguments.of("Hash[h.map { |k, v| [v, k] }]",
            RuleVariant.PURE_SWAP, "h.to_h { |k, v| [v, k] }"),
        Arguments.of("h.map { |k,v|[k,v+1] }.to_h",
            RuleVariant.VALUE_TRANSFORM, "h.transform_values { |v|v+1 }"));
  }

  @ParameterizedTest
  @MethodSource("cases")
  void testPlan(String source, RuleVariant variant, String expected) {
    final List<Edit> edits = RewritePlanner.plan(bind(source), variant);
    for (int i = 0; i < edits.size(); i++) {
      assertThat(edits.get(i).pos.isEmpty(), is(false));
      for (int j = i + 1; j < edits.size(); j++) {
        assertThat(edits.get(i) + " overlaps " + edits.get(j),
            edits.get(i).overlaps(edits.get(j)), is(false));
      }
    }
    assertThat(Corrector.apply(source, edits), is(expected));
  }

  @Test void testEditsForChained() {
    final String source = "h.map { |k, v| [k, v.to_s] }.to_h";
    final List<Edit> edits =
        RewritePlanner.plan(bind(source), RuleVariant.VALUE_TRANSFORM);
    final StringBuilder b = new StringBuilder();
    for (Edit edit : edits) {
      b.append('[').append(edit.pos.text(source)).append("]->[")
          .append(edit.replacement).append("] ");
    }
    assertThat(b.toString(),
        is("[.to_h]->[] []]->[] [[k, ]->[] [k, ]->[] "
            + "[map]->[transform_values] "));
  }

  @Test void testSurvivor() {
    final Binding binding = bind("h.map { |k, v| [k.to_s, v.to_i] }.to_h");
    assertThat(RewritePlanner.survivor(binding, RuleVariant.VALUE_TRANSFORM)
        .toString(), is("(send (lvar :v) :to_i)"));
    assertThat(RewritePlanner.survivor(binding, RuleVariant.KEY_TRANSFORM)
        .toString(), is("(send (lvar :k) :to_s)"));
  }

  @Test void testCheckDisjoint() {
    final String s = "abcdef";
    final Edit e0 = Edit.remove(Pos.of(s, "", 0, 2));
    final Edit e1 = Edit.remove(Pos.of(s, "", 2, 4));
    final Edit e2 = Edit.replace(Pos.of(s, "", 3, 5), "x");
    RewritePlanner.checkDisjoint(ImmutableList.of(e0, e1));
    assertThrows(VerifyException.class,
        () -> RewritePlanner.checkDisjoint(ImmutableList.of(e0, e1, e2)));
  }
}

// End RewritePlannerTest.java
