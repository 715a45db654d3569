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

/**
 * Visits syntax trees.
 *
 * <p>Every child is visited via {@link #accept}, so a sub-class that
 * overrides {@code accept} sees every node in the tree, in source order.
 */
public class Visitor {

  /** Visits a node. Also for use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  // calls

  protected void visit(Ast.Send send) {
    if (send.receiver != null) {
      accept(send.receiver);
    }
    send.args.forEach(this::accept);
  }

  protected void visit(Ast.Block block) {
    accept(block.call);
    accept(block.args);
    if (block.body != null) {
      accept(block.body);
    }
  }

  protected void visit(Ast.Args args) {
    args.args.forEach(this::accept);
  }

  protected void visit(Ast.Arg arg) {}

  // variables

  protected void visit(Ast.LVar lvar) {}

  protected void visit(Ast.LVasgn lvasgn) {
    accept(lvasgn.value);
  }

  protected void visit(Ast.Const constant) {}

  // value constructors

  protected void visit(Ast.Array array) {
    array.elements.forEach(this::accept);
  }

  protected void visit(Ast.Begin begin) {
    begin.exps.forEach(this::accept);
  }

  protected void visit(Ast.Literal literal) {}
}

// End Visitor.java
