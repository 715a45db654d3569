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

import net.hydromatic.transmute.ast.Ast;
import net.hydromatic.transmute.ast.Pos;

/** Builds the range and message of a diagnostic. */
public abstract class Offenses {
  private Offenses() {}

  /**
   * Returns the range of source text that a diagnostic highlights.
   *
   * <ul>
   *   <li>Chained: from the iterating method name to the end of
   *       {@code to_h}; the receiver is not highlighted.
   *   <li>Constructor: the whole {@code Hash[...]} expression.
   *   <li>Bare: from {@code to_h} to the end of the block.
   * </ul>
   */
  public static Pos range(Binding binding) {
    switch (binding.shape) {
      case CHAINED_TO_H:
        final Ast.Send collapse = (Ast.Send) binding.node;
        return binding.call.selector.plus(collapse.selector);
      case CONSTRUCTOR_WRAP:
        return binding.node.pos;
      case BARE_BLOCK_TO_H:
        return binding.call.selector.plus(binding.block.end);
      default:
        throw new AssertionError(binding.shape);
    }
  }

  /** Returns the message, such as "Use `transform_values { ... }` instead of
   * `map { ... }.to_h`.". */
  public static String message(Binding binding, RuleVariant variant,
      String constructorName) {
    return variant.message(
        binding.shape.describe(binding.iterateMethod(), constructorName));
  }

  /** Creates a diagnostic. */
  public static Diagnostic diagnostic(Binding binding, RuleVariant variant,
      String constructorName) {
    return new Diagnostic(range(binding),
        message(binding, variant, constructorName), variant, binding.shape);
  }
}

// End Offenses.java
