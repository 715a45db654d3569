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
package net.hydromatic.transmute.ast;

import java.util.Locale;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // calls
  /** Method call, with or without a receiver; also binary operators. */
  SEND,
  /** Method call with a literal block attached. */
  BLOCK,

  // block parameters
  ARGS,
  ARG,

  // variables
  /** Read of a local variable. */
  LVAR,
  /** Assignment to a local variable. */
  LVASGN,
  CONST,

  // value constructors
  ARRAY,
  /** Sequence of statements, or a parenthesized expression. */
  BEGIN,

  // literals
  INT(true),
  FLOAT(true),
  STR(true),
  SYM(true),
  NIL(true),
  TRUE(true),
  FALSE(true),
  SELF(true);

  /** Whether nodes of this kind are literals. */
  public final boolean literal;

  Op() {
    this(false);
  }

  Op(boolean literal) {
    this.literal = literal;
  }

  /** Returns the name used in s-expressions, e.g. "send" for {@link #SEND}. */
  public String lowerName() {
    return name().toLowerCase(Locale.ROOT);
  }
}

// End Op.java
