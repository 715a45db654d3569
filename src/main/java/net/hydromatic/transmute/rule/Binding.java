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

import com.google.common.collect.ImmutableMap;
import net.hydromatic.transmute.ast.Ast;
import net.hydromatic.transmute.ast.AstNode;

/**
 * Nodes bound by a successful {@link TreeQuery#match}.
 *
 * <p>A binding refers to nodes of one tree and is valid only while
 * inspecting the call-site that produced it.
 */
public class Binding {
  /** Which syntax wraps the iteration. */
  public final SurfaceShape shape;
  /** The node that was matched: the {@code to_h} call, the constructor
   * call, or (for {@link SurfaceShape#BARE_BLOCK_TO_H}) the block. */
  public final AstNode node;
  /** The block whose body builds the pairs. */
  public final Ast.Block block;
  /** The iterating call: {@code map}, {@code collect}, or {@code to_h}. */
  public final Ast.Send call;
  public final Ast.Arg keyArg;
  public final Ast.Arg valueArg;
  /** The two-element array literal that is the block body. */
  public final Ast.Array pair;

  Binding(SurfaceShape shape, AstNode node, Ast.Block block, Ast.Send call,
      Ast.Arg keyArg, Ast.Arg valueArg, Ast.Array pair) {
    this.shape = requireNonNull(shape);
    this.node = requireNonNull(node);
    this.block = requireNonNull(block);
    this.call = requireNonNull(call);
    this.keyArg = requireNonNull(keyArg);
    this.valueArg = requireNonNull(valueArg);
    this.pair = requireNonNull(pair);
  }

  public String keyName() {
    return keyArg.name;
  }

  public String valueName() {
    return valueArg.name;
  }

  /** Returns the first element of the pair, the new key. */
  public Ast.Exp slot0() {
    return pair.elements.get(0);
  }

  /** Returns the second element of the pair, the new value. */
  public Ast.Exp slot1() {
    return pair.elements.get(1);
  }

  /** Returns the name of the iterating method, e.g. "collect". */
  public String iterateMethod() {
    return call.method;
  }

  /**
   * Returns the bound nodes keyed by pattern variable name.
   *
   * <p>Parameter names are bound to their {@link Ast.Arg} nodes.
   */
  public ImmutableMap<String, AstNode> asMap() {
    return ImmutableMap.<String, AstNode>builder()
        .put("key_name", keyArg)
        .put("value_name", valueArg)
        .put("inner_call", call)
        .put("pair_block", block)
        .put("pair", pair)
        .put("pair_slot0", slot0())
        .put("pair_slot1", slot1())
        .put("collapse_node", node)
        .build();
  }

  @Override
  public String toString() {
    return shape + " " + asMap();
  }
}

// End Binding.java
