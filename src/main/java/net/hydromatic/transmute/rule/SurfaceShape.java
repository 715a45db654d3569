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

/**
 * Which of the three equivalent syntaxes collapses the pairs into a hash.
 *
 * <p>The shape determines the range that a diagnostic highlights, the way
 * the message quotes the offending code, and which wrapping syntax the
 * rewrite removes. It is independent of {@link RuleVariant}.
 */
public enum SurfaceShape {
  /** {@code hash.map { |k, v| [k, v.to_s] }.to_h}. */
  CHAINED_TO_H,

  /** {@code Hash[hash.map { |k, v| [k, v.to_s] }]}. */
  CONSTRUCTOR_WRAP,

  /** {@code hash.to_h { |k, v| [k, v.to_s] }}. */
  BARE_BLOCK_TO_H;

  /**
   * Describes the offending code, for use in a message.
   *
   * <p>For example, {@code CHAINED_TO_H.describe("collect", "Hash")}
   * returns "collect { ... }.to_h".
   *
   * @param iterateMethod Name of the iterating method, "map" or "collect"
   * @param constructorName Name of the constant that wraps the call
   */
  public String describe(String iterateMethod, String constructorName) {
    switch (this) {
      case CHAINED_TO_H:
        return iterateMethod + " { ... }." + TreeQuery.COLLAPSE_METHOD;
      case CONSTRUCTOR_WRAP:
        return constructorName + "[" + iterateMethod + " { ... }]";
      case BARE_BLOCK_TO_H:
        return TreeQuery.COLLAPSE_METHOD + " { ... }";
      default:
        throw new AssertionError(this);
    }
  }
}

// End SurfaceShape.java
