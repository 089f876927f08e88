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
package net.hydromatic.solvent.solve;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.compile.ModelingException;
import net.hydromatic.solvent.value.Values;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.logicng.datastructures.Assignment;
import org.logicng.formulas.Literal;
import org.logicng.knowledgecompilation.bdds.BDD;

/**
 * Session that solves constraints by building a binary decision diagram.
 *
 * <p>The conjunction of all constraints is one LogicNG {@link BDD};
 * {@link #check()} asks it for a model. Models are exact, so blocking a
 * model excludes precisely that assignment of values.
 *
 * <p>Every variable must occur in the first constraint that is added.
 */
public class BddSession implements SolverSession {
  private final BddTranslator translator;
  private @Nullable BDD constraint;
  private @Nullable List<Literal> assignment;
  /** Whether the only model of an empty set of constraints is blocked. */
  private boolean exhausted;

  /**
   * Creates a session.
   *
   * @param maxMapKeyBits largest number of bits in the key of a general map;
   *     a map is encoded as a table of 2<sup>bits</sup> entries
   */
  public BddSession(int maxMapKeyBits) {
    this.translator = new BddTranslator(maxMapKeyBits);
  }

  @Override public Backend backend() {
    return Backend.BDD;
  }

  @Override public void add(Core.Exp constraint) {
    translator.check(constraint);
    final BDD bdd = translator.predicate(constraint);
    this.constraint =
        this.constraint == null ? bdd : this.constraint.and(bdd);
  }

  @Override public boolean check() {
    final BDD constraint = this.constraint;
    if (constraint == null) {
      // No constraints, and therefore no variables
      assignment = exhausted ? null : translator.assignment(new HashSet<>());
      return !exhausted;
    }
    if (constraint.isContradiction()) {
      assignment = null;
      return false;
    }
    final Assignment model = constraint.model();
    assignment =
        translator.assignment(new HashSet<>(model.positiveVariables()));
    return true;
  }

  private List<Literal> assignment() {
    if (assignment == null) {
      throw new ModelingException("no model; the constraints have not been "
          + "checked, or are unsatisfiable");
    }
    return assignment;
  }

  @Override public Object value(Core.Var var) {
    final List<Literal> assignment = assignment();
    final BddValue v = translator.varValue(var);
    if (v == null) {
      return Values.defaultValue(var.type);
    }
    return translator.read(var.type, v, assignment);
  }

  @Override public void block(Map<Core.Var, Object> values) {
    assignment();
    final BDD constraint = this.constraint;
    if (constraint == null) {
      exhausted = true;
      assignment = null;
      return;
    }
    BDD same = translator.truth();
    for (Map.Entry<Core.Var, Object> entry : values.entrySet()) {
      final Core.Var var = entry.getKey();
      final BddValue v = translator.varValue(var);
      if (v != null) {
        same = same.and(
            translator.eq(v, translator.constant(var.type, entry.getValue())));
      }
    }
    this.constraint = constraint.and(same.negate());
    assignment = null;
  }

  @Override public void close() {
    assignment = null;
    constraint = null;
  }

  /** Returns the number of nodes in the diagram of the constraints, for
   * diagnostics. */
  public int nodeCount() {
    return constraint == null ? 0 : constraint.nodeCount();
  }
}

// End BddSession.java
