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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.Map;
import net.hydromatic.transmute.ast.Ast;
import net.hydromatic.transmute.ast.AstNode;
import net.hydromatic.transmute.parse.RubyParser;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests {@link TreeQuery}. */
class TreeQueryTest {
  private final TreeQuery query = new TreeQuery("Hash");

  private @Nullable Binding match(String source) {
    return query.match(RubyParser.parse(source), null);
  }

  @Test void testChained() {
    final Binding binding = match("hash.map { |k, v| [k, v.to_s] }.to_h");
    assertThat(binding, notNullValue());
    assertThat(binding.shape, is(SurfaceShape.CHAINED_TO_H));
    assertThat(binding.keyName(), is("k"));
    assertThat(binding.valueName(), is("v"));
    assertThat(binding.iterateMethod(), is("map"));
    assertThat(binding.slot0().toString(), is("(lvar :k)"));
    assertThat(binding.slot1().toString(), is("(send (lvar :v) :to_s)"));
  }

  @Test void testBindingMap() {
    final Binding binding = match("Hash[h.collect { |a, b| [b, a] }]");
    assertThat(binding, notNullValue());
    assertThat(binding.shape, is(SurfaceShape.CONSTRUCTOR_WRAP));
    final Map<String, AstNode> map = binding.asMap();
    assertThat(ImmutableList.copyOf(map.keySet()),
        is(
            ImmutableList.of("key_name", "value_name", "inner_call",
                "pair_block", "pair", "pair_slot0", "pair_slot1",
                "collapse_node")));
    assertThat(map.get("key_name").toString(), is("(arg :a)"));
    assertThat(map.get("value_name").toString(), is("(arg :b)"));
    assertThat(map.get("inner_call").toString(),
        is("(send (send nil :h) :collect)"));
    assertThat(map.get("pair").toString(), is("(array (lvar :b) (lvar :a))"));
    assertThat(map.get("collapse_node").op.lowerName(), is("send"));
  }

  @Test void testBare() {
    final Binding binding = match("hash.to_h { |k, v| [k, v.to_s] }");
    assertThat(binding, notNullValue());
    assertThat(binding.shape, is(SurfaceShape.BARE_BLOCK_TO_H));
    assertThat(binding.iterateMethod(), is("to_h"));

  }

  /** Every shape matches a call that has no receiver. */
  @Test void testImplicitReceiver() {
    assertThat(match("to_h { |k, v| [k, v.to_s] }").shape,
        is(SurfaceShape.BARE_BLOCK_TO_H));
    assertThat(match("map { |k, v| [k, v.to_s] }.to_h").shape,
        is(SurfaceShape.CHAINED_TO_H));
    final Binding binding = match("Hash[collect { |k, v| [k, v.to_s] }]");
    assertThat(binding.shape, is(SurfaceShape.CONSTRUCTOR_WRAP));
    assertThat(binding.call.receiver, nullValue());
  }

  /** If {@code to_h} has a block, the chained shape does not match the
   * {@code to_h} call, but the bare shape matches the block. */
  @Test void testToHashWithBlock() {
    final AstNode root =
        RubyParser.parse("hash.map { |k, v| [k, v] }.to_h { |k, v| [v, k] }");
    final Ast.Block block = (Ast.Block) root;
    assertThat(query.match(block.call, block), nullValue());
    assertThat(query.match(block.call, null), notNullValue());
    final Binding binding = query.match(block, null);
    assertThat(binding, notNullValue());
    assertThat(binding.shape, is(SurfaceShape.BARE_BLOCK_TO_H));
    assertThat(binding.pair.toString(), is("(array (lvar :v) (lvar :k))"));
  }

  @Test void testNoMatch() {
    assertThat(match("hash.map { |k, v| [k, v] }.to_h(1)"), nullValue());
    assertThat(match("hash.map(1) { |k, v| [k, v] }.to_h"), nullValue());
    assertThat(match("hash.each { |k, v| [k, v] }.to_h"), nullValue());
    assertThat(match("hash.map { |k| [k, k] }.to_h"), nullValue());
    assertThat(match("hash.map { |k, v, w| [k, v] }.to_h"), nullValue());
    assertThat(match("hash.map { |k, v| [k, v, 1] }.to_h"), nullValue());
    assertThat(match("hash.map { |k, v| k }.to_h"), nullValue());
    assertThat(match("hash.map { |k, v| k; [k, v] }.to_h"), nullValue());
    assertThat(match("hash.map.to_h"), nullValue());
    assertThat(match("Hash[hash.map { |k, v| [k, v] }, 1]"), nullValue());
    assertThat(match("Foo[hash.map { |k, v| [k, v] }]"), nullValue());
    assertThat(match("hash.to_h(1) { |k, v| [k, v] }"), nullValue());
  }

  @Test void testIndexedAdapter() {
    assertThat(match("a.each_with_index.map { |e, i| [e, i] }.to_h"),
        nullValue());
    assertThat(match("Hash[a.each_with_index.map { |e, i| [e, i] }]"),
        nullValue());
    assertThat(match("a.each_with_index.to_h { |e, i| [e, i] }"),
        nullValue());
    // With arguments, it is just another method
    assertThat(match("a.each_with_index(1).map { |e, i| [e, i] }.to_h"),
        notNullValue());
  }

  @Test void testConstructorName() {
    final TreeQuery query2 = new TreeQuery("Container");
    assertThat(query2.constructorName(), is("Container"));
    final AstNode node =
        RubyParser.parse("Container[pairs.map { |k, v| [k.to_s, v] }]");
    final Binding binding = query2.match(node, null);
    assertThat(binding, notNullValue());
    assertThat(binding.shape, is(SurfaceShape.CONSTRUCTOR_WRAP));
    assertThat(query.match(node, null), nullValue());
  }
}

// End TreeQueryTest.java
