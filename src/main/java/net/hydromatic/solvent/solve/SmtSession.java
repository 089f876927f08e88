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

import com.google.common.collect.ImmutableMap;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Global;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.compile.ModelingException;
import net.hydromatic.solvent.value.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Session with the Z3 SMT solver. Each session has its own Z3
 * {@link Context}. */
@SuppressWarnings("rawtypes")
public class SmtSession implements SolverSession {
  private final Context ctx;
  private final Solver solver;
  private final SmtTranslator translator;
  private @Nullable Model model;
  private boolean closed;

  /**
   * Creates a session.
   *
   * @param timeoutMillis time limit for each check, in milliseconds;
   *     0 means no limit
   */
  public SmtSession(int timeoutMillis) {
    final Context ctx;
    try {
      // Strings are sequences of 16-bit characters, like Java's.
      Global.setParameter("encoding", "bmp");
      ctx = new Context(ImmutableMap.of("model", "true"));
    } catch (Z3Exception e) {
      throw new EngineException("cannot create Z3 context", e);
    }
    try {
      solver = ctx.mkSolver();
      if (timeoutMillis > 0) {
        final Params params = ctx.mkParams();
        params.add("timeout", timeoutMillis);
        solver.setParameters(params);
      }
    } catch (Z3Exception e) {
      ctx.close();
      throw new EngineException("cannot create Z3 solver", e);
    }
    this.ctx = ctx;
    this.translator = new SmtTranslator(ctx);
  }

  @Override public Backend backend() {
    return Backend.SMT;
  }

  @Override public void add(Core.Exp constraint) {
    final BoolExpr e;
    try {
      e = translator.predicate(constraint);
    } catch (Z3Exception ex) {
      throw new EngineException("Z3 failed to translate " + constraint, ex);
    }
    addExpr(e);
  }

  private void addExpr(BoolExpr e) {
    try {
      solver.add(e);
    } catch (Z3Exception ex) {
      throw new EngineException("Z3 failed to assert " + e, ex);
    }
  }

  @Override public boolean check() {
    final Status status;
    try {
      status = solver.check();
    } catch (Z3Exception e) {
      throw new EngineException("Z3 failed: " + e.getMessage(), e);
    }
    switch (status) {
      case SATISFIABLE:
        model = solver.getModel();
        return true;
      case UNSATISFIABLE:
        model = null;
        return false;
      default:
        model = null;
        throw new EngineException("Z3 could not decide: "
            + solver.getReasonUnknown());
    }
  }

  private Model model() {
    if (model == null) {
      throw new ModelingException("no model; the constraints have not been "
          + "checked, or are unsatisfiable");
    }
    return model;
  }

  @Override public Object value(Core.Var var) {
    final Model model = model();
    final Expr e = translator.varExpr(var);
    if (e == null) {
      return Values.defaultValue(var.type);
    }
    try {
      return translator.read(model, var.type, e);
    } catch (Z3Exception ex) {
      throw new EngineException("Z3 failed to read " + var.name, ex);
    }
  }

  @Override public void block(Map<Core.Var, Object> values) {
    final Model model = model();
    final List<BoolExpr> list = new ArrayList<>();
    try {
      values.forEach((var, value) -> {
        final Expr e = translator.varExpr(var);
        if (e != null) {
          list.add(translator.sameAs(model, var.type, e, value));
        }
      });
      addExpr(ctx.mkNot(ctx.mkAnd(list.toArray(new BoolExpr[0]))));
    } catch (Z3Exception ex) {
      throw new EngineException("Z3 failed to block model", ex);
    }
  }

  @Override public void close() {
    if (!closed) {
      closed = true;
      model = null;
      ctx.close();
    }
  }
}

// End SmtSession.java
