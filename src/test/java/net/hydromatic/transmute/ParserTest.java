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
package net.hydromatic.transmute;

import static net.hydromatic.transmute.Matchers.hasRange;
import static net.hydromatic.transmute.Rb.rb;
import static net.hydromatic.transmute.Rb.rbE;
import static net.hydromatic.transmute.parse.Parsers.isIdentifier;
import static net.hydromatic.transmute.parse.Parsers.unquoteString;
import static net.hydromatic.transmute.parse.Parsers.unquoteSymbol;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.transmute.ast.Ast;
import net.hydromatic.transmute.ast.AstNode;
import org.junit.jupiter.api.Test;

/** Tests the parser. */
public class ParserTest {
  @Test
  void testUnquoteString() {
    assertThat("abc", unquoteString("\"abc\""), is("abc"));
    assertThat("empty", unquoteString("\"\""), is(""));
    assertThat("double-quote", unquoteString("\"\\\"\""), is("\""));
    assertThat("tab", unquoteString("\"ab\\tc\""), is("ab\tc"));
    assertThat("newline", unquoteString("\"ab\\nc\""), is("ab\nc"));
    assertThat("space", unquoteString("\"a\\sb\""), is("a b"));
    assertThat("single", unquoteString("'abc'"), is("abc"));
    assertThat("single, escaped quote", unquoteString("'it\\'s'"),
        is("it's"));
    assertThat("single, tab is not an escape", unquoteString("'a\\tb'"),
        is("a\\tb"));
  }

  @Test
  void testUnquoteSymbol() {
    assertThat(unquoteSymbol(":abc"), is("abc"));
    assertThat(unquoteSymbol(":\"a b\""), is("a b"));
  }

  @Test
  void testIsIdentifier() {
    assertThat(isIdentifier("to_h"), is(true));
    assertThat(isIdentifier("_x1"), is(true));
    assertThat(isIdentifier("Hash"), is(false));
    assertThat(isIdentifier("1x"), is(false));
    assertThat(isIdentifier(""), is(false));
  }

  @Test
  void testParseCandidates() {
    rb("hash.map { |k, v| [k, v.to_s] }.to_h")
        .assertParse("(send (block (send (send nil :hash) :map) "
            + "(args (arg :k) (arg :v)) "
            + "(array (lvar :k) (send (lvar :v) :to_s))) :to_h)");
    rb("Hash[x.collect { |k, v| [v, k] }]")
        .assertParse("(send (const nil :Hash) :[] "
            + "(block (send (send nil :x) :collect) "
            + "(args (arg :k) (arg :v)) (array (lvar :v) (lvar :k))))");
    rb("to_h { |a, b| [a, b] }")
        .assertParse("(block (send nil :to_h) (args (arg :a) (arg :b)) "
            + "(array (lvar :a) (lvar :b)))");
    rb("h.each do |a|\n  a\nend")
        .assertParse("(block (send (send nil :h) :each) (args (arg :a)) "
            + "(lvar :a))");
  }

  @Test
  void testParseBlocks() {
    rb("f { 1 }").assertParse("(block (send nil :f) (args) (int 1))");
    rb("f { }").assertParse("(block (send nil :f) (args) nil)");
    rb("f { |a| a; 2 }")
        .assertParse("(block (send nil :f) (args (arg :a)) "
            + "(begin (lvar :a) (int 2)))");
    // A block parameter is not visible after the block
    rb("f { |a| a }; a")
        .assertParse("(begin (block (send nil :f) (args (arg :a)) (lvar :a)) "
            + "(send nil :a))");
  }

  @Test
  void testParseLocals() {
    rb("x = 1; x + 2")
        .assertParse("(begin (lvasgn :x (int 1)) "
            + "(send (lvar :x) :+ (int 2)))");
    rb("x; x = 1; x")
        .assertParse("(begin (send nil :x) (lvasgn :x (int 1)) (lvar :x))");
    rb("").assertParse("(begin)");
  }

  @Test
  void testParseExpressions() {
    rb("a.b(1, \"s\", :sym)")
        .assertParse("(send (send nil :a) :b (int 1) (str \"s\") (sym :sym))");
    rb("1 + 2 * 3").assertParse("(send (int 1) :+ (send (int 2) :* (int 3)))");
    rb("1 < 2 + 3").assertParse("(send (int 1) :< (send (int 2) :+ (int 3)))");
    rb("a == b")
        .assertParse("(send (send nil :a) :== (send nil :b))");
    rb("-1").assertParse("(int -1)");
    rb("1_000").assertParse("(int 1000)");
    rb("1.5").assertParse("(float 1.5)");
    rb("-x").assertParse("(send (send nil :x) :-@)");
    rb("!x").assertParse("(send (send nil :x) :!)");
    rb("a[1]").assertParse("(send (send nil :a) :[] (int 1))");
    rb("[]").assertParse("(array)");
    rb("(1)").assertParse("(begin (int 1))");
    rb("x.empty?").assertParse("(send (send nil :x) :empty?)");
    rb("self.foo").assertParse("(send (self) :foo)");
    rb("[nil, true, false]").assertParse("(array (nil) (true) (false))");
    rb("'a' # comment").assertParse("(str \"a\")");
  }

  @Test
  void testParseMultiLineChain() {
    rb("hash\n  .map { |k, v| [k, v] }\n  .to_h")
        .assertParse("(send (block (send (send nil :hash) :map) "
            + "(args (arg :k) (arg :v)) (array (lvar :k) (lvar :v))) :to_h)");
  }

  @Test
  void testPositions() {
    final AstNode node = rb("hash.map { |k, v| [k, v] }.to_h").parse();
    assertThat(node, instanceOf(Ast.Send.class));
    final Ast.Send send = (Ast.Send) node;
    assertThat(send.pos, hasRange("1.1-1.32"));
    assertThat(send.selector, hasRange("1.28-1.32"));
    final Ast.Block block = (Ast.Block) send.receiver;
    assertThat(block.pos, hasRange("1.1-1.27"));
    assertThat(block.begin, hasRange("1.10"));
    assertThat(block.end, hasRange("1.26"));
    assertThat(block.args.pos, hasRange("1.12-1.18"));
    final Ast.Array array = (Ast.Array) block.body;
    assertThat(array.begin, hasRange("1.19"));
    assertThat(array.end, hasRange("1.24"));

    final Ast.Send index = (Ast.Send) rb("Hash[\n  x\n]").parse();
    assertThat(index.pos, hasRange("1.1-3.2"));
    assertThat(index.selector, hasRange("1.5-3.2"));
  }

  @Test
  void testParseErrors() {
    rbE("hash.map { |k, $k$| k }")
        .assertParseThrows("duplicated argument name");
    rbE("[1, 2$)$]").assertParseThrows("expected ',', got ')'");
    rbE("x = 1 $@$ 2").assertParseThrows("unexpected character '@'");
    rbE("f { |a| a $$").assertParseThrows("expected '}', got 'end of input'");
    rb("\"abc").assertParseThrows("unterminated string");
    rb("x.1").assertParseThrows("expected method name");
  }
}

// End ParserTest.java
