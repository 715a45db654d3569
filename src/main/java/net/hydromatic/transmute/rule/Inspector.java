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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import net.hydromatic.transmute.ast.AstNode;
import net.hydromatic.transmute.ast.Visitor;
import net.hydromatic.transmute.config.Prop;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Walks a syntax tree and checks every node against each {@link
 * RuleVariant}.
 *
 * <p>An inspector holds only immutable configuration, and may be used by
 * several threads at once.
 */
public class Inspector {
  private final ImmutableMap<Prop, Object> propMap;
  private final Tracer tracer;
  private final TreeQuery treeQuery;
  private final String constructorName;

  /** Creates an Inspector. */
  public Inspector(Map<Prop, Object> propMap, Tracer tracer) {
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = requireNonNull(tracer);
    this.constructorName = Prop.MAPPING_CONSTRUCTOR.stringValue(this.propMap);
    this.treeQuery = new TreeQuery(constructorName);
  }

  /** Creates an Inspector with the default configuration. */
  public static Inspector create() {
    return new Inspector(ImmutableMap.of(), Tracers.empty());
  }

  /** Returns the offenses in a tree, in the order that their nodes are
   * visited (parents before children). */
  public List<Offense> inspect(AstNode root) {
    final List<Offense> offenses = new ArrayList<>();
    final Walker walker = new Walker(offenses);
    walker.walk(root);
    return ImmutableList.copyOf(offenses);
  }

  /**
   * Checks one rule against a node.
   *
   * @param node Node
   * @param parent Parent of the node, or null if it is the root
   * @param variant Rule
   */
  public Check check(AstNode node, @Nullable AstNode parent,
      RuleVariant variant) {
    final Binding binding = treeQuery.match(node, parent);
    if (binding == null) {
      return new Check(node, variant, Verdict.NO_MATCH, null, null);
    }
    return check(binding, variant);
  }

  private Check check(Binding binding, RuleVariant variant) {
    final Check check = evaluate(binding, variant);
    tracer.onVerdict(check);
    return check;
  }

  private Check evaluate(Binding binding, RuleVariant variant) {
    final AstNode node = binding.node;
    if (!variant.isApplicable(propMap)) {
      return new Check(node, variant, Verdict.SKIPPED, binding, null);
    }
    if (!variant.appliesTo(binding.shape)
        || SlotClassifier.classify(binding).variant != variant) {
      return new Check(node, variant, Verdict.REJECTED, binding, null);
    }
    if (readsDroppedParameter(binding, variant)) {
      return new Check(node, variant, Verdict.REJECTED_REFERENCE, binding,
          null);
    }

    final Diagnostic diagnostic =
        Offenses.diagnostic(binding, variant, constructorName);
    tracer.onDiagnostic(diagnostic);
    if (!Prop.AUTOCORRECT.booleanValue(propMap)) {
      return new Check(node, variant, Verdict.REPORTED_ONLY, binding,
          new Offense(diagnostic, ImmutableList.of()));
    }
    final List<Edit> edits = RewritePlanner.plan(binding, variant);
    tracer.onEdits(diagnostic, edits);
    return new Check(node, variant, Verdict.EDITS_PLANNED, binding,
        new Offense(diagnostic, edits));
  }

  /** Returns whether the expression that survives the rewrite reads the
   * block parameter that the rewrite removes. */
  private static boolean readsDroppedParameter(Binding binding,
      RuleVariant variant) {
    switch (variant) {
      case VALUE_TRANSFORM:
        return RefFinder.references(binding.slot1(), binding.keyName());
      case KEY_TRANSFORM:
        return RefFinder.references(binding.slot0(), binding.valueName());
      default:
        return false;
    }
  }

  /** Visitor that checks each node, knowing its parent. */
  private class Walker extends Visitor {
    private final Deque<AstNode> ancestors = new ArrayDeque<>();
    private final List<Offense> offenses;

    Walker(List<Offense> offenses) {
      this.offenses = offenses;
    }

    void walk(AstNode root) {
      accept(root);
    }

    @Override protected <E extends AstNode> void accept(E e) {
      final Binding binding = treeQuery.match(e, ancestors.peek());
      if (binding != null) {
        for (RuleVariant variant : RuleVariant.values()) {
          final Check check = check(binding, variant);
          if (check.offense != null) {
            offenses.add(check.offense);
          }
        }
      }
      ancestors.push(e);
      try {
        e.accept(this);
      } finally {
        ancestors.pop();
      }
    }
  }
}

// End Inspector.java
