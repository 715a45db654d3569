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
package net.hydromatic.transmute.config;

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.Locale;
import java.util.function.Function;

/**
 * Version of Ruby that the rewritten code will run on.
 *
 * <p>Tiers are ordered; a rewrite that produces a call introduced in a
 * particular version is only offered if the target version is at least that
 * version.
 */
public enum FeatureTier {
  RUBY_2_0("2.0"),
  RUBY_2_1("2.1"),
  RUBY_2_2("2.2"),
  RUBY_2_3("2.3"),
  /** Introduces {@code Hash#transform_values}. */
  RUBY_2_4("2.4"),
  /** Introduces {@code Hash#transform_keys}. */
  RUBY_2_5("2.5"),
  /** {@code to_h} accepts a block. */
  RUBY_2_6("2.6"),
  RUBY_2_7("2.7"),
  RUBY_3_0("3.0"),
  RUBY_3_1("3.1"),
  RUBY_3_2("3.2"),
  RUBY_3_3("3.3");

  /** Version string, e.g. "2.6". */
  public final String version;

  private static final ImmutableMap<String, FeatureTier> BY_VERSION =
      Arrays.stream(values())
          .collect(ImmutableMap.toImmutableMap(t -> t.version,
              Function.identity()));

  FeatureTier(String version) {
    this.version = version;
  }

  /**
   * Looks up a tier by version string ("2.6") or by name ("RUBY_2_6",
   * case-insensitive). Throws if not found; never returns null.
   */
  public static FeatureTier of(String s) {
    final FeatureTier tier = BY_VERSION.get(s.trim());
    if (tier != null) {
      return tier;
    }
    try {
      return valueOf(s.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("unknown target version '" + s
          + "'; expected one of " + BY_VERSION.keySet(), e);
    }
  }

  /** Returns whether this tier is the same as or later than another. */
  public boolean atLeast(FeatureTier tier) {
    return compareTo(tier) >= 0;
  }

  @Override
  public String toString() {
    return version;
  }
}

// End FeatureTier.java
