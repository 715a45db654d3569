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

import static java.util.Objects.requireNonNull;

import java.util.List;

/** Abstract syntax tree node. */
public abstract class AstNode {
  public final Pos pos;
  public final Op op;

  public AstNode(Pos pos, Op op) {
    this.pos = requireNonNull(pos);
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into an s-expression string, such as {@code (send
   * (lvar :v) :to_s)}.
   *
   * <p>The purpose of this string is debugging and testing. To get the
   * source text of a node, use {@link Pos#text(String)} on {@link #pos}.
   */
  @Override
  public final String toString() {
    // Marked final because you should override unparse, not toString
    return unparse(new AstWriter()).toString();
  }

  abstract AstWriter unparse(AstWriter w);

  /** Returns the child nodes, in source order. Never null; may be empty. */
  public abstract List<AstNode> children();

  /**
   * Accepts a visitor, calling the {@link
   * net.hydromatic.transmute.ast.Visitor#visit} method appropriate to the
   * type of this node.
   */
  public abstract void accept(Visitor visitor);
}

// End AstNode.java
