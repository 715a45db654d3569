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

import static com.google.common.base.Verify.verify;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.transmute.ast.Ast;
import net.hydromatic.transmute.ast.Pos;

/**
 * Computes the edits that rewrite a matched construct into a single call.
 *
 * <p>For example, the edits for
 *
 * <blockquote><pre>Hash[hash.map { |k, v| [k, v.to_s] }]</pre></blockquote>
 *
 * <p>delete {@code ]}, {@code ]}, {@code [k, }, {@code k, } and
 * {@code Hash[}, and replace {@code map} with {@code transform_values},
 * giving
 *
 * <blockquote><pre>hash.transform_values { |v| v.to_s }</pre></blockquote>
 *
 * <p>All positions come from the same tree, so the edits of one construct
 * never overlap each other.
 */
public abstract class RewritePlanner {
  private RewritePlanner() {}

  /**
   * Returns the edits for a binding whose pair has been classified as
   * {@code variant}. Empty deletions are omitted.
   */
  public static List<Edit> plan(Binding binding, RuleVariant variant) {
    final ImmutableList.Builder<Edit> edits = ImmutableList.builder();

    // ".to_h", or the "]" of "Hash[...]"
    remove(edits, between(binding.block.pos.end(), binding.node.pos.end()));

    if (variant != RuleVariant.PURE_SWAP) {
      final Ast.Exp expression = survivor(binding, variant);
      final Ast.Array pair = binding.pair;
      remove(edits, between(expression.pos.end(), pair.end.end()));
      remove(edits, between(pair.begin.begin(), expression.pos.begin()));
      remove(edits, otherParameter(binding, variant));
    }

    edits.add(Edit.replace(binding.call.selector, variant.targetMethod));

    // "Hash["
    remove(edits, between(binding.node.pos.begin(), binding.block.pos.begin()));

    final List<Edit> list = edits.build();
    checkDisjoint(list);
    return list;
  }

  /** Returns the element of the pair that is kept: the new value for
   * {@link RuleVariant#VALUE_TRANSFORM}, the new key for
   * {@link RuleVariant#KEY_TRANSFORM}. */
  static Ast.Exp survivor(Binding binding, RuleVariant variant) {
    switch (variant) {
      case VALUE_TRANSFORM:
        return binding.slot1();
      case KEY_TRANSFORM:
        return binding.slot0();
      default:
        throw new AssertionError(variant);
    }
  }

  /** Returns the range of the parameter that is no longer used, with its
   * separator: "k, " or ", v". */
  private static Pos otherParameter(Binding binding, RuleVariant variant) {
    final Pos key = binding.keyArg.pos;
    final Pos value = binding.valueArg.pos;
    switch (variant) {
      case VALUE_TRANSFORM:
        return between(key.begin(), value.begin());
      case KEY_TRANSFORM:
        return between(key.end(), value.end());
      default:
        throw new AssertionError(variant);
    }
  }

  private static Pos between(Pos begin, Pos end) {
    verify(begin.startOffset <= end.endOffset, "range %s is reversed",
        begin);
    return begin.plus(end);
  }

  private static void remove(ImmutableList.Builder<Edit> edits, Pos pos) {
    if (!pos.isEmpty()) {
      edits.add(Edit.remove(pos));
    }
  }

  /** Throws if any two edits overlap. */
  static void checkDisjoint(List<Edit> edits) {
    for (int i = 0; i < edits.size(); i++) {
      for (int j = i + 1; j < edits.size(); j++) {
        verify(!edits.get(i).overlaps(edits.get(j)),
            "edits overlap: %s, %s", edits.get(i), edits.get(j));
      }
    }
  }
}

// End RewritePlanner.java
