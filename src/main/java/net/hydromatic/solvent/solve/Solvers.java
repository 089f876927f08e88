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
import static net.hydromatic.solvent.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.ast.CoreBuilder;
import net.hydromatic.solvent.ast.Visitor;
import net.hydromatic.solvent.compile.CapabilityException;
import net.hydromatic.solvent.compile.DefaultMapLowering;
import net.hydromatic.solvent.compile.ModelingException;
import net.hydromatic.solvent.compile.Tracer;
import net.hydromatic.solvent.eval.Prop;
import net.hydromatic.solvent.type.DefaultMapType;
import net.hydromatic.solvent.type.OptionType;
import net.hydromatic.solvent.type.PrimitiveType;
import net.hydromatic.solvent.type.RecordType;
import net.hydromatic.solvent.type.SeqType;
import net.hydromatic.solvent.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Answers satisfiability questions about predicates.
 *
 * <p>The backend and its limits come from {@link Prop properties}. Each call
 * to {@link #solve}, {@link #findFirst} or {@link #isValid} uses a new
 * session, and closes it before returning; each iterator returned by
 * {@link #findAll} has its own session.
 */
public class Solvers {
  private final ImmutableMap<Prop, Object> props;
  private final Tracer tracer;

  public Solvers(Map<Prop, Object> props, Tracer tracer) {
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer);
  }

  /** Returns the backend that this solver uses. */
  public Backend backend() {
    return Prop.BACKEND.enumValue(props, Backend.class);
  }

  /**
   * Decides whether a predicate is satisfiable.
   *
   * @throws ModelingException if the predicate is not boolean
   * @throws CapabilityException if the backend cannot encode the predicate
   * @throws EngineException if the engine fails or cannot decide
   */
  public Solution solve(Core.Exp predicate) {
    try (SolutionIterator iterator = iterator(predicate, 1)) {
      return iterator.hasNext() ? iterator.next() : Solution.unsatisfiable();
    }
  }

  /** Returns a solution of a predicate, or empty if it is unsatisfiable. */
  public Optional<Solution> findFirst(Core.Exp predicate) {
    final Solution solution = solve(predicate);
    return solution.isSatisfiable() ? Optional.of(solution) : Optional.empty();
  }

  /**
   * Returns the solutions of a predicate.
   *
   * <p>The result is lazy. Each call to {@link Iterable#iterator()} starts
   * a new enumeration with its own session. Solutions differ in the value
   * of at least one variable. If property {@link Prop#FIND_ALL_LIMIT} is
   * set, each enumeration stops after that many solutions. Closing the
   * result releases the sessions of enumerations that were abandoned
   * before they were exhausted.
   *
   * <p>The predicate is checked when this method is called, so a predicate
   * that the backend cannot encode fails immediately.
   */
  public Solutions findAll(Core.Exp predicate) {
    final Integer limit = Prop.FIND_ALL_LIMIT.optionalIntValue(props);
    iterator(predicate, 0).close();
    return new Solutions(() -> iterator(predicate, limit));
  }

  /** Returns whether a predicate is true for every value of its
   * variables. */
  public boolean isValid(Core.Exp predicate) {
    checkPredicate(predicate);
    return !solve(core.not(predicate)).isSatisfiable();
  }

  /**
   * Creates an iterator over the solutions of a predicate.
   *
   * <p>The caller must close the iterator if it does not exhaust it.
   *
   * @param limit maximum number of solutions, or null
   */
  public SolutionIterator iterator(Core.Exp predicate,
      @Nullable Integer limit) {
    checkPredicate(predicate);
    final Backend backend = backend();
    checkDefaultMaps(predicate, backend);
    final ImmutableList<Core.Var> vars = CoreBuilder.freeVars(predicate);
    final DefaultMapLowering lowering = DefaultMapLowering.of(predicate);
    final Core.Exp lowered = lowering.lower(predicate);
    if (lowered != predicate) {
      tracer.onLowered(predicate, lowered);
    }
    final SolverSession session = open(backend);
    try {
      session.add(lowered);
    } catch (RuntimeException e) {
      session.close();
      throw e;
    }
    return new SolutionIterator(tracer, predicate, lowering, vars, session,
        limit);
  }

  private SolverSession open(Backend backend) {
    switch (backend) {
      case SMT:
        return new SmtSession(Prop.SMT_TIMEOUT.intValue(props));
      case BDD:
        return new BddSession(Prop.BDD_MAX_MAP_KEY_BITS.intValue(props));
      default:
        throw new AssertionError(backend);
    }
  }

  private static void checkPredicate(Core.Exp predicate) {
    if (predicate.type != PrimitiveType.BOOL) {
      throw new ModelingException("predicate must have type bool; got "
          + predicate.type);
    }
  }

  /** Rejects default-valued maps whose values are sequences of records or
   * options, if the backend cannot encode such sequences. */
  private static void checkDefaultMaps(Core.Exp exp, Backend backend) {
    if (backend.supportsCompositeSequences()) {
      return;
    }
    new Visitor() {
      @Override protected void visit(Core.Literal literal) {
        check(literal.type);
      }

      @Override protected void visit(Core.Var var) {
        check(var.type);
      }

      @Override protected void visitOperands(Core.Exp e) {
        check(e.type);
        super.visitOperands(e);
      }

      private void check(Type type) {
        if (type instanceof DefaultMapType) {
          final Type valueType = ((DefaultMapType) type).valueType;
          if (valueType instanceof SeqType) {
            final Type elementType = ((SeqType) valueType).elementType;
            if (elementType instanceof RecordType
                || elementType instanceof OptionType) {
              throw new CapabilityException(backend.name(),
                  "cannot encode default-valued map " + type
                      + " whose values are sequences of " + elementType);
            }
          }
        }
      }
    }.go(exp);
  }
}

// End Solvers.java
