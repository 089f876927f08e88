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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.compile.DefaultMapLowering;
import net.hydromatic.solvent.compile.Tracer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Iterator over the solutions of a predicate.
 *
 * <p>Owns one solver session. After returning a solution, it asserts that
 * the variables do not all have those values again, and checks again. It
 * closes the session when there are no more solutions, when it reaches its
 * limit, or when {@link #close()} is called, whichever is first.
 */
public class SolutionIterator implements Iterator<Solution>, AutoCloseable {
  private final Tracer tracer;
  private final Core.Exp predicate;
  private final DefaultMapLowering lowering;
  private final ImmutableList<Core.Var> vars;
  private final @Nullable Integer limit;
  private @Nullable SolverSession session;
  private @Nullable Solution next;
  private int count;

  SolutionIterator(Tracer tracer, Core.Exp predicate,
      DefaultMapLowering lowering, ImmutableList<Core.Var> vars,
      SolverSession session, @Nullable Integer limit) {
    this.tracer = requireNonNull(tracer);
    this.predicate = requireNonNull(predicate);
    this.lowering = requireNonNull(lowering);
    this.vars = requireNonNull(vars);
    this.session = requireNonNull(session);
    this.limit = limit;
  }

  @Override public boolean hasNext() {
    if (next != null) {
      return true;
    }
    final SolverSession session = this.session;
    if (session == null) {
      return false;
    }
    if (limit != null && count >= limit) {
      close();
      return false;
    }
    try {
      final boolean satisfiable = session.check();
      tracer.onSolve(session.backend(), predicate, satisfiable);
      if (!satisfiable) {
        close();
        return false;
      }
      final Map<Core.Var, Object> values = new LinkedHashMap<>();
      final Map<Core.Var, Object> loweredValues = new LinkedHashMap<>();
      for (Core.Var var : vars) {
        final Core.Var loweredVar = lowering.lower(var);
        final Object value = session.value(loweredVar);
        loweredValues.put(loweredVar, value);
        values.put(var, lowering.lift(var.type, value));
      }
      next = Solution.of(values);
      ++count;
      if (!vars.isEmpty()) {
        session.block(loweredValues);
      } else {
        // Without variables there is only one solution.
        close();
      }
      return true;
    } catch (RuntimeException e) {
      close();
      throw e;
    }
  }

  @Override public Solution next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    final Solution solution = requireNonNull(next);
    next = null;
    return solution;
  }

  /** Returns whether the session has been released. */
  public boolean isClosed() {
    return session == null;
  }

  /** Releases the solver session. Solutions already found remain valid. */
  @Override public void close() {
    final SolverSession session = this.session;
    if (session != null) {
      this.session = null;
      session.close();
    }
  }
}

// End SolutionIterator.java
