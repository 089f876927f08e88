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

import static net.hydromatic.solvent.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Visits and transforms expressions.
 *
 * <p>Results are memoized by node identity, so a node shared by several
 * parents is transformed once.
 */
public class Shuttle {
  private final Map<Core.Exp, Core.Exp> memo = new IdentityHashMap<>();

  /** Transforms an expression. */
  public Core.Exp go(Core.Exp exp) {
    final Core.Exp e = memo.get(exp);
    if (e != null) {
      return e;
    }
    final Core.Exp e2 = exp.accept(this);
    memo.put(exp, e2);
    return e2;
  }

  protected ImmutableList<Core.Exp> visitList(ImmutableList<Core.Exp> exps) {
    final ImmutableList.Builder<Core.Exp> b = ImmutableList.builder();
    exps.forEach(exp -> b.add(go(exp)));
    return b.build();
  }

  protected Core.Exp visit(Core.Literal literal) {
    return literal; // leaf
  }

  protected Core.Exp visit(Core.Var var) {
    return var; // leaf
  }

  protected Core.Exp visit(Core.Call call) {
    return core.copy(call, visitList(call.args));
  }

  protected Core.Exp visit(Core.Field field) {
    return core.field(go(field.exp), field.ordinal);
  }

  protected Core.Exp visit(Core.WithField withField) {
    return core.withField(go(withField.exp), withField.ordinal,
        go(withField.value));
  }

  protected Core.Exp visit(Core.RegexMatch regexMatch) {
    return core.regexMatch(go(regexMatch.exp), regexMatch.pattern);
  }
}

// End Shuttle.java
