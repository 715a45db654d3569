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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import net.hydromatic.transmute.ast.AstNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Result of checking a rule against a node. */
public class Check {
  public final AstNode node;
  public final RuleVariant variant;
  public final Verdict verdict;
  /** Bound nodes; null if the verdict is {@link Verdict#NO_MATCH}. */
  public final @Nullable Binding binding;
  /** Offense; not null if and only if the verdict reports a diagnostic. */
  public final @Nullable Offense offense;

  Check(AstNode node, RuleVariant variant, Verdict verdict,
      @Nullable Binding binding, @Nullable Offense offense) {
    this.node = requireNonNull(node);
    this.variant = requireNonNull(variant);
    this.verdict = requireNonNull(verdict);
    this.binding = binding;
    this.offense = offense;
    checkArgument((binding == null) == (verdict == Verdict.NO_MATCH));
    checkArgument((offense == null) == !verdict.isReported());
  }

  @Override
  public String toString() {
    return variant + " " + verdict;
  }
}

// End Check.java
