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

import static net.hydromatic.transmute.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import net.hydromatic.transmute.ast.Ast;
import net.hydromatic.transmute.ast.Pos;
import net.hydromatic.transmute.parse.Lexer.Kind;
import net.hydromatic.transmute.parse.Lexer.Token;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Recursive-descent parser for the subset of Ruby that the rewrite rules
 * inspect.
 *
 * <p>Supports local variables and assignment, receiver-less and dotted
 * method calls (with optional parenthesized arguments), index calls such as
 * {@code Hash[x]}, blocks in both {@code { |a, b| ... }} and {@code do |a, b|
 * ... end} form, array literals, parenthesized expressions, arithmetic and
 * comparison operators, and integer, float, string and symbol literals.
 *
 * <p>As in Ruby, an identifier is a local variable read ({@link Ast.LVar}) if
 * it has been assigned or is a parameter of an enclosing block, and is
 * otherwise a call to a method with no receiver ({@link Ast.Send}).
 *
 * <p>A parser instance parses one piece of source text and is not
 * thread-safe.
 */
public class RubyParser {
  private static final ImmutableSet<String> EQUALITY_OPS =
      ImmutableSet.of("==", "!=");
  private static final ImmutableSet<String> COMPARISON_OPS =
      ImmutableSet.of("<", ">", "<=", ">=");
  private static final ImmutableSet<String> ADDITIVE_OPS =
      ImmutableSet.of("+", "-");
  private static final ImmutableSet<String> MULTIPLICATIVE_OPS =
      ImmutableSet.of("*", "/", "%");

  private final Lexer lexer;
  private final List<Token> tokens;
  private int i = 0;

  /** Local variables in scope. The innermost scope is first. */
  private final Deque<Set<String>> scopes = new ArrayDeque<>();

  /** Creates a parser. */
  public RubyParser(String source, String file) {
    this.lexer = new Lexer(source, file);
    this.tokens = lexer.tokenize();
    scopes.push(new HashSet<>());
  }

  /** Parses a program, with no file name. */
  public static Ast.Exp parse(String source) {
    return parse(source, "");
  }

  /** Parses a program. */
  public static Ast.Exp parse(String source, String file) {
    return new RubyParser(source, file).program();
  }

  /**
   * Parses a whole program.
   *
   * <p>If the program has one statement, returns that statement; otherwise
   * returns a {@link Ast.Begin} containing the statements (possibly none).
   */
  public Ast.Exp program() {
    final List<Ast.Exp> statements = statements(t -> false);
    final Token eof = expect(Kind.EOF);
    if (statements.size() == 1) {
      return statements.get(0);
    }
    final Pos pos = statements.isEmpty()
        ? eof.pos
        : Span.of().addAll(statements).pos();
    return ast.begin(pos, statements);
  }

  /** Parses statements until end of input or a token matching a predicate. */
  private List<Ast.Exp> statements(Predicate<Token> isEnd) {
    final List<Ast.Exp> list = new ArrayList<>();
    skipNewlines();
    while (!isEnd.test(peek()) && peek().kind != Kind.EOF) {
      list.add(statement());
      if (!isEnd.test(peek()) && peek().kind != Kind.EOF) {
        expect(Kind.NEWLINE);
      }
      skipNewlines();
    }
    return list;
  }

  private Ast.Exp statement() {
    if (peek().kind == Kind.IDENT && peek(1).isOp("=")) {
      final Token name = next();
      next();
      skipNewlines();
      final Ast.Exp value = expression();
      scopes.element().add(name.text);
      return ast.lvasgn(name.pos.plus(value.pos), name.text, value);
    }
    return expression();
  }

  /** Parses an expression. */
  public Ast.Exp expression() {
    return binary(0);
  }

  /** Parses a left-associative binary expression at a given level. */
  private Ast.Exp binary(int level) {
    final Set<String> ops;
    switch (level) {
      case 0:
        ops = EQUALITY_OPS;
        break;
      case 1:
        ops = COMPARISON_OPS;
        break;
      case 2:
        ops = ADDITIVE_OPS;
        break;
      case 3:
        ops = MULTIPLICATIVE_OPS;
        break;
      default:
        return unary();
    }
    Ast.Exp left = binary(level + 1);
    while (peek().kind == Kind.OP && ops.contains(peek().text)) {
      final Token op = next();
      skipNewlines();
      final Ast.Exp right = binary(level + 1);
      left = ast.binaryCall(left, op.text, op.pos, right);
    }
    return left;
  }

  private Ast.Exp unary() {
    final Token t = peek();
    if (t.isOp("-")
        && !peek(1).spaceBefore
        && (peek(1).kind == Kind.INT || peek(1).kind == Kind.FLOAT)) {
      next();
      final Token number = next();
      return postfix(number(number, t.pos.plus(number.pos), true));
    }
    if (t.isOp("!") || t.isOp("-")) {
      next();
      final Ast.Exp operand = unary();
      final String method = t.text.equals("-") ? "-@" : "!";
      return ast.send(t.pos.plus(operand.pos), operand, method,
          ImmutableList.of(), t.pos);
    }
    return postfix(primary());
  }

  /** Parses method calls and index calls that follow an expression. */
  private Ast.Exp postfix(Ast.Exp e) {
    for (;;) {
      final Token t = peek();
      if (t.isOp(".") || t.kind == Kind.NEWLINE && nextSignificantIsDot()) {
        skipNewlines();
        next();
        final Token name = next();
        if (name.kind != Kind.IDENT
            && name.kind != Kind.CONSTANT
            && name.kind != Kind.KEYWORD) {
          throw error(name, "expected method name");
        }
        e = call(e, name);
      } else if (t.isOp("[") && !t.spaceBefore) {
        next();
        final List<Ast.Exp> args = list("]");
        final Token close = expect(Kind.OP, "]");
        final Pos selector = t.pos.plus(close.pos);
        e = ast.send(e.pos.plus(close.pos), e, "[]", args, selector);
      } else {
        return e;
      }
    }
  }

  private boolean nextSignificantIsDot() {
    int j = i;
    while (tokens.get(j).kind == Kind.NEWLINE) {
      ++j;
    }
    return tokens.get(j).isOp(".");
  }

  /**
   * Parses the rest of a method call, after the method name: optional
   * parenthesized arguments, then an optional block.
   */
  private Ast.Exp call(Ast.@Nullable Exp receiver, Token name) {
    final Span span = Span.of(name.pos).addIf(receiver);
    final List<Ast.Exp> args;
    if (peek().isOp("(") && !peek().spaceBefore) {
      next();
      args = list(")");
      span.add(expect(Kind.OP, ")").pos);
    } else {
      args = ImmutableList.of();
    }
    final Ast.Send send =
        ast.send(span.pos(), receiver, name.text, args, name.pos);
    if (peek().isOp("{") || peek().is(Kind.KEYWORD, "do")) {
      return block(send);
    }
    return send;
  }

  /** Parses a block attached to a method call. */
  private Ast.Block block(Ast.Send send) {
    final Token begin = next();
    final boolean brace = begin.isOp("{");
    final Set<String> params = new HashSet<>();
    final Ast.Args args;
    skipNewlines();
    if (peek().isOp("|")) {
      final Token open = next();
      final List<Ast.Arg> argList = new ArrayList<>();
      while (!peek().isOp("|")) {
        if (!argList.isEmpty()) {
          expect(Kind.OP, ",");
        }
        final Token name = expect(Kind.IDENT);
        if (!params.add(name.text)) {
          throw error(name, "duplicated argument name");
        }
        argList.add(ast.arg(name.pos, name.text));
      }
      final Token close = next();
      args = ast.args(open.pos.plus(close.pos), argList);
    } else {
      args = ast.args(begin.pos.end(), ImmutableList.of());
    }
    scopes.push(params);
    final List<Ast.Exp> statements;
    try {
      statements = statements(t ->
          brace ? t.isOp("}") : t.is(Kind.KEYWORD, "end"));
    } finally {
      scopes.pop();
    }
    final Token end =
        brace ? expect(Kind.OP, "}") : expect(Kind.KEYWORD, "end");
    final Ast.Exp body;
    switch (statements.size()) {
      case 0:
        body = null;
        break;
      case 1:
        body = statements.get(0);
        break;
      default:
        body = ast.begin(Span.of().addAll(statements).pos(), statements);
    }
    return ast.block(send.pos.plus(end.pos), send, args, body, begin.pos,
        end.pos);
  }

  private Ast.Exp primary() {
    final Token t = next();
    switch (t.kind) {
      case INT:
      case FLOAT:
        return number(t, t.pos, false);
      case STRING:
        return ast.stringLiteral(t.pos, Parsers.unquoteString(t.text));
      case SYMBOL:
        return ast.symbolLiteral(t.pos, Parsers.unquoteSymbol(t.text));
      case CONSTANT:
        return ast.constant(t.pos, t.text);
      case IDENT:
        if (isLocal(t.text) && !(peek().isOp("(") && !peek().spaceBefore)) {
          return ast.lvar(t.pos, t.text);
        }
        return call(null, t);
      case KEYWORD:
        switch (t.text) {
          case "nil":
            return ast.nil(t.pos);
          case "true":
            return ast.boolLiteral(t.pos, true);
          case "false":
            return ast.boolLiteral(t.pos, false);
          case "self":
            return ast.self(t.pos);
          default:
            throw error(t, "unexpected keyword '" + t.text + "'");
        }
      case OP:
        if (t.isOp("[")) {
          final List<Ast.Exp> elements = list("]");
          final Token close = expect(Kind.OP, "]");
          return ast.array(t.pos.plus(close.pos), elements, t.pos, close.pos);
        }
        if (t.isOp("(")) {
          final List<Ast.Exp> statements = statements(t2 -> t2.isOp(")"));
          final Token close = expect(Kind.OP, ")");
          return ast.begin(t.pos.plus(close.pos), statements);
        }
        // fall through
      default:
        throw error(t, "unexpected '" + t + "'");
    }
  }

  private Ast.Literal number(Token t, Pos pos, boolean negate) {
    final String digits = (negate ? "-" : "") + t.text.replace("_", "");
    return t.kind == Kind.INT
        ? ast.intLiteral(pos, new BigInteger(digits))
        : ast.floatLiteral(pos, new BigDecimal(digits));
  }

  /**
   * Parses a comma-separated list of expressions, up to but not including a
   * closing token. Allows newlines after commas and a trailing comma.
   */
  private List<Ast.Exp> list(String close) {
    final List<Ast.Exp> list = new ArrayList<>();
    skipNewlines();
    while (!peek().isOp(close)) {
      list.add(expression());
      skipNewlines();
      if (!peek().isOp(close)) {
        expect(Kind.OP, ",");
        skipNewlines();
      }
    }
    return list;
  }

  private boolean isLocal(String name) {
    for (Set<String> scope : scopes) {
      if (scope.contains(name)) {
        return true;
      }
    }
    return false;
  }

  private Token peek() {
    return tokens.get(i);
  }

  private Token peek(int ahead) {
    return tokens.get(Math.min(i + ahead, tokens.size() - 1));
  }

  private Token next() {
    final Token t = tokens.get(i);
    if (t.kind != Kind.EOF) {
      ++i;
    }
    return t;
  }

  private void skipNewlines() {
    while (peek().kind == Kind.NEWLINE) {
      next();
    }
  }

  private Token expect(Kind kind) {
    final Token t = peek();
    if (t.kind != kind) {
      final String kindName = kind.name().toLowerCase(Locale.ROOT);
      throw error(t, "expected " + kindName + ", got '" + t + "'");
    }
    return next();
  }

  private Token expect(Kind kind, String text) {
    final Token t = peek();
    if (!t.is(kind, text)) {
      throw error(t, "expected '" + text + "', got '" + t + "'");
    }
    return next();
  }

  private static ParseException error(Token t, String message) {
    return new ParseException(message, t.pos);
  }
}

// End RubyParser.java
