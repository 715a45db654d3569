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
package net.hydromatic.transmute.parse;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.transmute.ast.AstNode;
import net.hydromatic.transmute.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Accumulates the positions of the tokens and nodes that make up a construct,
 * and computes the position that covers all of them.
 *
 * <p>For example, a method call spans its receiver (if any), its name, and
 * the closing parenthesis of its argument list (if any):
 *
 * <blockquote><pre>
 * final Span span = Span.of(name.pos).addIf(receiver);
 * ...
 * return ast.send(span.pos(), receiver, name.text, args, name.pos);
 * </pre></blockquote>
 */
public final class Span {
  private final List<Pos> posList = new ArrayList<>();

  private Span() {}

  /** Creates an empty Span. */
  public static Span of() {
    return new Span();
  }

  /** Creates a Span with one position. */
  public static Span of(Pos p) {
    return new Span().add(p);
  }

  /** Adds a node's position, and returns this Span. */
  public Span add(AstNode n) {
    return add(n.pos);
  }

  /** Adds a node's position if the node is not null. */
  public Span addIf(@Nullable AstNode n) {
    return n == null ? this : add(n);
  }

  public Span add(Pos pos) {
    posList.add(pos);
    return this;
  }

  /** Adds the positions of several nodes. */
  public Span addAll(Iterable<? extends AstNode> nodes) {
    for (AstNode node : nodes) {
      add(node);
    }
    return this;
  }

  /**
   * Returns a position from the earliest start to the latest end. The
   * positions need not be sorted. Throws if there are none.
   */
  public Pos pos() {
    if (posList.isEmpty()) {
      throw new IllegalStateException("empty span");
    }
    return Pos.sum(posList);
  }
}

// End Span.java
