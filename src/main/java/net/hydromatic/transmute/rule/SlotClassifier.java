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

import net.hydromatic.transmute.ast.Ast;

/**
 * Decides which slot of a pair is unchanged.
 *
 * <p>Variables are compared by name. There is no scope analysis, so a
 * parameter of an inner block that shadows {@code k} is treated as
 * {@code k}.
 */
public abstract class SlotClassifier {
  private SlotClassifier() {}

  /** Classifies the pair of a binding. */
  public static Classification classify(Binding binding) {
    return classify(binding.slot0(), binding.slot1(), binding.keyName(),
        binding.valueName());
  }

  /**
   * Classifies a pair {@code [slot0, slot1]} built in a block with
   * parameters {@code |keyName, valueName|}.
   */
  public static Classification classify(Ast.Exp slot0, Ast.Exp slot1,
      String keyName, String valueName) {
    final boolean keyKept = isBareReference(slot0, keyName);
    final boolean valueKept = isBareReference(slot1, valueName);
    if (keyKept && !valueKept) {
      return Classification.VALUE_TRANSFORM;
    }
    if (valueKept && !keyKept) {
      return Classification.KEY_TRANSFORM;
    }
    if (isBareReference(slot0, valueName)
        && isBareReference(slot1, keyName)) {
      return Classification.PURE_SWAP;
    }
    return Classification.NONE;
  }

  /** Returns whether an expression is a read of a given local variable. */
  public static boolean isBareReference(Ast.Exp exp, String name) {
    return exp instanceof Ast.LVar && ((Ast.LVar) exp).name.equals(name);
  }
}

// End SlotClassifier.java
