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
package net.hydromatic.solvent.ast;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Visits expressions.
 *
 * <p>Each distinct node is visited once, even if it occurs several times in
 * the expression DAG.
 */
public class Visitor {
  private final Set<Core.Exp> visited =
      Collections.newSetFromMap(new IdentityHashMap<>());

  /** Visits an expression if it has not been visited before. */
  public void go(Core.Exp exp) {
    if (visited.add(exp)) {
      exp.accept(this);
    }
  }

  protected void visitOperands(Core.Exp exp) {
    exp.operands().forEach(this::go);
  }

  protected void visit(Core.Literal literal) {
    // leaf
  }

  protected void visit(Core.Var var) {
    // leaf
  }

  protected void visit(Core.Call call) {
    visitOperands(call);
  }

  protected void visit(Core.Field field) {
    visitOperands(field);
  }

  protected void visit(Core.WithField withField) {
    visitOperands(withField);
  }

  protected void visit(Core.RegexMatch regexMatch) {
    visitOperands(regexMatch);
  }
}

// End Visitor.java
