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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Context for writing an AST out as an s-expression.
 *
 * <p>For example, {@code hash.map { |k, v| [k, v] }} is written as
 *
 * <pre>{@code
 * (block (send (send nil :hash) :map) (args (arg :k) (arg :v))
 *   (array (lvar :k) (lvar :v)))
 * }</pre>
 *
 * <p>(but on one line).
 */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Starts a node, e.g. "(send". */
  public AstWriter open(Op op) {
    b.append('(').append(op.lowerName());
    return this;
  }

  /** Ends a node. */
  public AstWriter close() {
    b.append(')');
    return this;
  }

  /** Appends a symbol, e.g. " :to_s". */
  public AstWriter sym(String name) {
    b.append(" :").append(name);
    return this;
  }

  /** Appends a child node, or " nil" if the child is absent. */
  public AstWriter child(@Nullable AstNode node) {
    b.append(' ');
    if (node == null) {
      b.append("nil");
      return this;
    }
    return node.unparse(this);
  }

  /** Appends each of a list of child nodes. */
  public AstWriter children(Iterable<? extends AstNode> nodes) {
    for (AstNode node : nodes) {
      child(node);
    }
    return this;
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
