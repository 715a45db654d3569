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

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a method call. */
  public Ast.Send send(
      Pos pos,
      Ast.@Nullable Exp receiver,
      String method,
      List<? extends Ast.Exp> args,
      Pos selector) {
    return new Ast.Send(
        pos, receiver, method, ImmutableList.copyOf(args), selector);
  }

  /** Creates a call to a binary operator, such as {@code a + b}. */
  public Ast.Send binaryCall(Ast.Exp left, String operator, Pos selector,
      Ast.Exp right) {
    return send(left.pos.plus(right.pos), left, operator,
        ImmutableList.of(right), selector);
  }

  /** Creates a method call with a block. */
  public Ast.Block block(Pos pos, Ast.Send call, Ast.Args args,
      Ast.@Nullable Exp body, Pos begin, Pos end) {
    return new Ast.Block(pos, call, args, body, begin, end);
  }

  /** Creates a list of block parameters. */
  public Ast.Args args(Pos pos, List<Ast.Arg> args) {
    return new Ast.Args(pos, ImmutableList.copyOf(args));
  }

  /** Creates a block parameter. */
  public Ast.Arg arg(Pos pos, String name) {
    return new Ast.Arg(pos, name);
  }

  /** Creates a read of a local variable. */
  public Ast.LVar lvar(Pos pos, String name) {
    return new Ast.LVar(pos, name);
  }

  /** Creates an assignment to a local variable. */
  public Ast.LVasgn lvasgn(Pos pos, String name, Ast.Exp value) {
    return new Ast.LVasgn(pos, name, value);
  }

  /** Creates a constant reference. */
  public Ast.Const constant(Pos pos, String name) {
    return new Ast.Const(pos, name);
  }

  /** Creates an array literal. */
  public Ast.Array array(Pos pos, List<? extends Ast.Exp> elements, Pos begin,
      Pos end) {
    return new Ast.Array(pos, ImmutableList.copyOf(elements), begin, end);
  }

  /** Creates a sequence of statements or a parenthesized expression. */
  public Ast.Begin begin(Pos pos, List<? extends Ast.Exp> exps) {
    return new Ast.Begin(pos, ImmutableList.copyOf(exps));
  }

  /** Creates an integer literal. */
  public Ast.Literal intLiteral(Pos pos, BigInteger value) {
    return new Ast.Literal(pos, Op.INT, value);
  }

  /** Creates a floating-point literal. */
  public Ast.Literal floatLiteral(Pos pos, BigDecimal value) {
    return new Ast.Literal(pos, Op.FLOAT, value);
  }

  /** Creates a string literal. */
  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STR, value);
  }

  /** Creates a symbol literal. */
  public Ast.Literal symbolLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.SYM, value);
  }

  /** Creates a boolean literal. */
  public Ast.Literal boolLiteral(Pos pos, boolean value) {
    return new Ast.Literal(pos, value ? Op.TRUE : Op.FALSE, value);
  }

  /** Creates {@code nil}. */
  public Ast.Literal nil(Pos pos) {
    return new Ast.Literal(pos, Op.NIL, null);
  }

  /** Creates {@code self}. */
  public Ast.Literal self(Pos pos) {
    return new Ast.Literal(pos, Op.SELF, null);
  }
}

// End AstBuilder.java
