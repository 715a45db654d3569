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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Base class of expressions. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /**
   * Method call.
   *
   * <p>For example, {@code v.to_s} is a call to method "to_s" with receiver
   * {@code v}; {@code hash} (if {@code hash} is not a local variable) is a
   * call to method "hash" with no receiver; {@code a + b} is a call to method
   * "+"; {@code Hash[x]} is a call to method "[]" with receiver {@code Hash}.
   */
  public static class Send extends Exp {
    public final @Nullable Exp receiver;
    public final String method;
    public final List<Exp> args;
    /** Position of the method name token, or of the brackets of "[]". */
    public final Pos selector;

    Send(
        Pos pos,
        @Nullable Exp receiver,
        String method,
        ImmutableList<Exp> args,
        Pos selector) {
      super(pos, Op.SEND);
      this.receiver = receiver;
      this.method = requireNonNull(method);
      this.args = requireNonNull(args);
      this.selector = requireNonNull(selector);
    }

    /** Returns whether this is a call to a given method with no arguments. */
    public boolean isNiladic(String method) {
      return this.method.equals(method) && args.isEmpty();
    }

    @Override
    public List<AstNode> children() {
      final ImmutableList.Builder<AstNode> b = ImmutableList.builder();
      if (receiver != null) {
        b.add(receiver);
      }
      return b.addAll(args).build();
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.open(op).child(receiver).sym(method).children(args).close();
    }
  }

  /**
   * Method call with a literal block.
   *
   * <p>For example, {@code hash.map { |k, v| [k, v] }} is a block whose
   * {@link #call} is {@code hash.map}, whose {@link #args} are {@code k} and
   * {@code v}, and whose {@link #body} is the array {@code [k, v]}.
   */
  public static class Block extends Exp {
    public final Send call;
    public final Args args;
    public final @Nullable Exp body;
    /** Position of the opening "{" or "do". */
    public final Pos begin;
    /** Position of the closing "}" or "end". */
    public final Pos end;

    Block(
        Pos pos, Send call, Args args, @Nullable Exp body, Pos begin,
        Pos end) {
      super(pos, Op.BLOCK);
      this.call = requireNonNull(call);
      this.args = requireNonNull(args);
      this.body = body;
      this.begin = requireNonNull(begin);
      this.end = requireNonNull(end);
    }

    @Override
    public List<AstNode> children() {
      return body == null
          ? ImmutableList.of(call, args)
          : ImmutableList.of(call, args, body);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.open(op).child(call).child(args).child(body).close();
    }
  }

  /** List of block parameters, for example {@code |k, v|}. */
  public static class Args extends AstNode {
    public final List<Arg> args;

    Args(Pos pos, ImmutableList<Arg> args) {
      super(pos, Op.ARGS);
      this.args = requireNonNull(args);
    }

    @Override
    public List<AstNode> children() {
      return ImmutableList.copyOf(args);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.open(op).children(args).close();
    }
  }

  /** Block parameter, for example {@code k} in {@code |k, v|}. */
  public static class Arg extends AstNode {
    public final String name;

    Arg(Pos pos, String name) {
      super(pos, Op.ARG);
      this.name = requireNonNull(name);
    }

    @Override
    public List<AstNode> children() {
      return ImmutableList.of();
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.open(op).sym(name).close();
    }
  }

  /** Read of a local variable. */
  public static class LVar extends Exp {
    public final String name;

    LVar(Pos pos, String name) {
      super(pos, Op.LVAR);
      this.name = requireNonNull(name);
    }

    @Override
    public List<AstNode> children() {
      return ImmutableList.of();
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.open(op).sym(name).close();
    }
  }

  /** Assignment to a local variable, for example {@code x = 1}. */
  public static class LVasgn extends Exp {
    public final String name;
    public final Exp value;

    LVasgn(Pos pos, String name, Exp value) {
      super(pos, Op.LVASGN);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }

    @Override
    public List<AstNode> children() {
      return ImmutableList.of(value);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.open(op).sym(name).child(value).close();
    }
  }

  /** Reference to a constant, for example {@code Hash}. */
  public static class Const extends Exp {
    public final String name;

    Const(Pos pos, String name) {
      super(pos, Op.CONST);
      this.name = requireNonNull(name);
    }

    @Override
    public List<AstNode> children() {
      return ImmutableList.of();
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.open(op).child(null).sym(name).close();
    }
  }

  /** Array literal, for example {@code [k, v]}. */
  public static class Array extends Exp {
    public final List<Exp> elements;
    /** Position of the opening "[". */
    public final Pos begin;
    /** Position of the closing "]". */
    public final Pos end;

    Array(Pos pos, ImmutableList<Exp> elements, Pos begin, Pos end) {
      super(pos, Op.ARRAY);
      this.elements = requireNonNull(elements);
      this.begin = requireNonNull(begin);
      this.end = requireNonNull(end);
    }

    @Override
    public List<AstNode> children() {
      return ImmutableList.copyOf(elements);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.open(op).children(elements).close();
    }
  }

  /**
   * Sequence of statements, or a parenthesized expression.
   *
   * <p>For example, {@code (a + b)}, or the body of a block that contains
   * more than one statement.
   */
  public static class Begin extends Exp {
    public final List<Exp> exps;

    Begin(Pos pos, ImmutableList<Exp> exps) {
      super(pos, Op.BEGIN);
      this.exps = requireNonNull(exps);
    }

    @Override
    public List<AstNode> children() {
      return ImmutableList.copyOf(exps);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.open(op).children(exps).close();
    }
  }

  /**
   * Literal.
   *
   * <p>The value is a {@link BigInteger} for {@link Op#INT}, a {@link
   * BigDecimal} for {@link Op#FLOAT}, a {@link String} for {@link Op#STR} and
   * {@link Op#SYM}, a {@link Boolean} for {@link Op#TRUE} and {@link
   * Op#FALSE}, and null for {@link Op#NIL} and {@link Op#SELF}.
   */
  @SuppressWarnings("rawtypes")
  public static class Literal extends Exp {
    public final @Nullable Comparable value;

    Literal(Pos pos, Op op, @Nullable Comparable value) {
      super(pos, op);
      checkArgument(op.literal, "not a literal: %s", op);
      this.value = value;
    }

    @Override
    public List<AstNode> children() {
      return ImmutableList.of();
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      switch (op) {
        case INT:
        case FLOAT:
          return w.open(op).append(" " + value).close();
        case STR:
          return w.open(op).append(" \"" + value + "\"").close();
        case SYM:
          return w.open(op).sym(String.valueOf(value)).close();
        default:
          return w.open(op).close();
      }
    }
  }
}

// End Ast.java
