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

import java.util.ArrayDeque;
import java.util.Deque;
import net.hydromatic.transmute.ast.Ast;
import net.hydromatic.transmute.ast.AstNode;

/**
 * Finds reads of a local variable within an expression.
 *
 * <p>Like {@link SlotClassifier}, compares by name only.
 */
public abstract class RefFinder {
  private RefFinder() {}

  /** Returns whether {@code root} or any node beneath it reads local
   * variable {@code name}. */
  public static boolean references(AstNode root, String name) {
    final Deque<AstNode> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      final AstNode node = stack.pop();
      if (node instanceof Ast.LVar && ((Ast.LVar) node).name.equals(name)) {
        return true;
      }
      node.children().forEach(stack::push);
    }
    return false;
  }
}

// End RefFinder.java
