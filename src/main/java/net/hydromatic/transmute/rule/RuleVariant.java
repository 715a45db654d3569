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

import java.util.Map;
import net.hydromatic.transmute.config.FeatureTier;
import net.hydromatic.transmute.config.Prop;

/**
 * Rule that simplifies a "build pairs, then collapse to a hash" construct.
 *
 * <p>Each variant requires one slot of the pair to be a bare reference to a
 * block parameter, and rewrites to a call that exists only from a given
 * version of Ruby.
 */
public enum RuleVariant {
  /**
   * The key is unchanged and the value is transformed:
   * {@code map { |k, v| [k, v.to_s] }.to_h} becomes {@code transform_values
   * { |v| v.to_s }}.
   */
  VALUE_TRANSFORM("transform_values", FeatureTier.RUBY_2_4,
      Prop.VALUE_TRANSFORMATION),

  /**
   * The value is unchanged and the key is transformed:
   * {@code map { |k, v| [k.to_s, v] }.to_h} becomes {@code transform_keys
   * { |k| k.to_s }}.
   */
  KEY_TRANSFORM("transform_keys", FeatureTier.RUBY_2_5,
      Prop.KEY_TRANSFORMATION),

  /**
   * Key and value are exchanged:
   * {@code map { |k, v| [v, k] }.to_h} becomes {@code to_h { |k, v| [v, k]
   * }}. Requires the version in which {@code to_h} accepts a block.
   */
  PURE_SWAP("to_h", FeatureTier.RUBY_2_6, Prop.HASH_TRANSFORMATION);

  /** Name of the method that the construct is rewritten to. */
  public final String targetMethod;

  /** Earliest version of Ruby that has {@link #targetMethod}. */
  public final FeatureTier minimumTier;

  /** Boolean property that enables this rule. */
  public final Prop enabledProp;

  RuleVariant(String targetMethod, FeatureTier minimumTier,
      Prop enabledProp) {
    this.targetMethod = targetMethod;
    this.minimumTier = minimumTier;
    this.enabledProp = enabledProp;
  }

  /**
   * Returns whether this rule is enabled and the target version is recent
   * enough for it.
   */
  public boolean isApplicable(Map<Prop, Object> propMap) {
    final FeatureTier tier =
        Prop.TARGET_VERSION.enumValue(propMap, FeatureTier.class);
    return enabledProp.booleanValue(propMap) && tier.atLeast(minimumTier);
  }

  /**
   * Returns whether this rule applies to a given surface shape.
   *
   * <p>A pure swap written as {@code to_h { |k, v| [v, k] }} is already in
   * its simplest form.
   */
  public boolean appliesTo(SurfaceShape shape) {
    return this != PURE_SWAP || shape != SurfaceShape.BARE_BLOCK_TO_H;
  }

  /** Returns the message for an offense, given the offending code. */
  public String message(String current) {
    return "Use `" + targetMethod + " { ... }` instead of `" + current + "`.";
  }
}

// End RuleVariant.java
