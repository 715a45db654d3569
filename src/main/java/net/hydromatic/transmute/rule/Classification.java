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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Result of classifying the two slots of a pair.
 *
 * <p>The classes are mutually exclusive, so a pair belongs to at most one
 * {@link RuleVariant}.
 *
 * @see SlotClassifier#classify
 */
public enum Classification {
  /** Neither slot is idle, both are, or the shape is otherwise not a
   * candidate. */
  NONE(null),
  /** {@code [k, f(v)]}. */
  VALUE_TRANSFORM(RuleVariant.VALUE_TRANSFORM),
  /** {@code [f(k), v]}. */
  KEY_TRANSFORM(RuleVariant.KEY_TRANSFORM),
  /** {@code [v, k]}. */
  PURE_SWAP(RuleVariant.PURE_SWAP);

  /** The rule that handles pairs of this class, or null. */
  public final @Nullable RuleVariant variant;

  Classification(@Nullable RuleVariant variant) {
    this.variant = variant;
  }
}

// End Classification.java
