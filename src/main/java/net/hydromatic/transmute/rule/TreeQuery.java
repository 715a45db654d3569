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

import com.google.common.collect.ImmutableSet;
import net.hydromatic.transmute.ast.Ast;
import net.hydromatic.transmute.ast.AstNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Matches the "iterate, build pairs, collapse to a hash" construct.
 *
 * <p>Three surface shapes are recognized, and tried in this order:
 *
 * <ol>
 *   <li>{@link SurfaceShape#CHAINED_TO_H}: {@code recv.map { |k, v| [a, b]
 *       }.to_h}, where {@code to_h} has no arguments and no block;
 *   <li>{@link SurfaceShape#CONSTRUCTOR_WRAP}: {@code Hash[recv.map { |k, v|
 *       [a, b] }]};
 *   <li>{@link SurfaceShape#BARE_BLOCK_TO_H}: {@code recv.to_h { |k, v| [a,
 *       b] }}.
 * </ol>
 *
 * <p>In every shape the block has exactly two plain parameters, its body is
 * a two-element array literal, and the iterating call has no arguments and
 * is not applied to {@code each_with_index}.
 */
public class TreeQuery {
  /** Methods that iterate and return an array, one element per pair. */
  public static final ImmutableSet<String> ITERATE_METHODS =
      ImmutableSet.of("map", "collect");

  /** Method that converts an array of pairs into a hash. */
  public static final String COLLAPSE_METHOD = "to_h";

  /** Method that wraps the constructor's argument. */
  static final String CONSTRUCTOR_METHOD = "[]";

  /** Iterators whose pairs are (element, index), not (key, value). */
  public static final ImmutableSet<String> INDEXED_ADAPTERS =
      ImmutableSet.of("each_with_index");

  private final String constructorName;

  /**
   * Creates a TreeQuery.
   *
   * @param constructorName Name of the constant whose {@code []} method
   *   builds a hash, usually "Hash"
   */
  public TreeQuery(String constructorName) {
    this.constructorName = requireNonNull(constructorName);
  }

  public String constructorName() {
    return constructorName;
  }

  /**
   * Matches a node against each surface shape in turn.
   *
   * @param node Candidate node
   * @param parent Parent of the candidate node, or null if it is the root
   * @return Binding for the first shape that matches, or null
   */
  public @Nullable Binding match(AstNode node, @Nullable AstNode parent) {
    Binding binding = matchChained(node, parent);
    if (binding == null) {
      binding = matchConstructor(node);
    }
    if (binding == null) {
      binding = matchBare(node);
    }
    return binding;
  }

  /** Matches {@code recv.map { ... }.to_h}. */
  private @Nullable Binding matchChained(AstNode node,
      @Nullable AstNode parent) {
    if (!(node instanceof Ast.Send)) {
      return null;
    }
    final Ast.Send send = (Ast.Send) node;
    if (!send.isNiladic(COLLAPSE_METHOD)
        || !(send.receiver instanceof Ast.Block)) {
      return null;
    }
    if (parent instanceof Ast.Block && ((Ast.Block) parent).call == send) {
      // "to_h" has a block of its own
      return null;
    }
    return matchIteration(SurfaceShape.CHAINED_TO_H, node,
        (Ast.Block) send.receiver);
  }

  /** Matches {@code Hash[recv.map { ... }]}. */
  private @Nullable Binding matchConstructor(AstNode node) {
    if (!(node instanceof Ast.Send)) {
      return null;
    }
    final Ast.Send send = (Ast.Send) node;
    if (!send.method.equals(CONSTRUCTOR_METHOD)
        || !(send.receiver instanceof Ast.Const)
        || !((Ast.Const) send.receiver).name.equals(constructorName)
        || send.args.size() != 1
        || !(send.args.get(0) instanceof Ast.Block)) {
      return null;
    }
    return matchIteration(SurfaceShape.CONSTRUCTOR_WRAP, node,
        (Ast.Block) send.args.get(0));
  }

  /** Matches {@code recv.to_h { ... }}. */
  private @Nullable Binding matchBare(AstNode node) {
    if (!(node instanceof Ast.Block)) {
      return null;
    }
    final Ast.Block block = (Ast.Block) node;
    if (!block.call.isNiladic(COLLAPSE_METHOD)
        || isIndexedAdapter(block.call.receiver)) {
      return null;
    }
    return matchPairBlock(SurfaceShape.BARE_BLOCK_TO_H, node, block);
  }

  /** Matches a block whose call is {@code map} or {@code collect}. */
  private @Nullable Binding matchIteration(SurfaceShape shape, AstNode node,
      Ast.Block block) {
    final Ast.Send call = block.call;
    if (!ITERATE_METHODS.contains(call.method)
        || !call.args.isEmpty()
        || isIndexedAdapter(call.receiver)) {
      return null;
    }
    return matchPairBlock(shape, node, block);
  }

  /** Matches {@code { |k, v| [a, b] }}. */
  private static @Nullable Binding matchPairBlock(SurfaceShape shape,
      AstNode node, Ast.Block block) {
    if (block.args.args.size() != 2
        || !(block.body instanceof Ast.Array)) {
      return null;
    }
    final Ast.Array pair = (Ast.Array) block.body;
    if (pair.elements.size() != 2) {
      return null;
    }
    return new Binding(shape, node, block, block.call,
        block.args.args.get(0), block.args.args.get(1), pair);
  }

  /** Returns whether an expression is a call such as
   * {@code array.each_with_index}. */
  private static boolean isIndexedAdapter(Ast.@Nullable Exp receiver) {
    if (!(receiver instanceof Ast.Send)) {
      return false;
    }
    final Ast.Send send = (Ast.Send) receiver;
    return INDEXED_ADAPTERS.contains(send.method) && send.args.isEmpty();
  }
}

// End TreeQuery.java
