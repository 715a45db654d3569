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

import static java.util.Objects.requireNonNull;

import net.hydromatic.transmute.ast.Pos;

/** Finding reported by a rule: a range of source text and a message. */
public class Diagnostic {
  public final Pos pos;
  public final String message;
  public final RuleVariant variant;
  public final SurfaceShape shape;

  public Diagnostic(Pos pos, String message, RuleVariant variant,
      SurfaceShape shape) {
    this.pos = requireNonNull(pos);
    this.message = requireNonNull(message);
    this.variant = requireNonNull(variant);
    this.shape = requireNonNull(shape);
  }

  /** Writes "file:1.6-1.33: message". */
  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf).append(": ").append(message);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }
}

// End Diagnostic.java
