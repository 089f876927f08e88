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
package net.hydromatic.solvent;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.compile.CompiledFunction;
import net.hydromatic.solvent.compile.Compiler;
import net.hydromatic.solvent.compile.Tracer;
import net.hydromatic.solvent.compile.Tracers;
import net.hydromatic.solvent.eval.Interpreter;
import net.hydromatic.solvent.eval.Prop;
import net.hydromatic.solvent.solve.Backend;
import net.hydromatic.solvent.solve.Solution;
import net.hydromatic.solvent.solve.SolutionIterator;
import net.hydromatic.solvent.solve.Solutions;
import net.hydromatic.solvent.solve.Solvers;

/**
 * Entry point: evaluates, compiles and solves expressions.
 *
 * <p>Expressions are built using
 * {@link net.hydromatic.solvent.ast.CoreBuilder#core}. An instance of this
 * class holds property values and a tracer, and is immutable; methods such as
 * {@link #withProp} return a new instance.
 *
 * <pre>{@code
 * Core.Var x = core.var("x", PrimitiveType.INT32);
 * Solution s = Solvent.create()
 *     .withBackend(Backend.BDD)
 *     .solve(core.eq(core.add(x, core.int32Literal(1)),
 *         core.int32Literal(10)));
 * s.get(x); // 9L
 * }</pre>
 */
public class Solvent {
  private final ImmutableMap<Prop, Object> props;
  private final Tracer tracer;

  private Solvent(ImmutableMap<Prop, Object> props, Tracer tracer) {
    this.props = requireNonNull(props);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates an instance with default property values and no tracer. */
  public static Solvent create() {
    return new Solvent(ImmutableMap.of(), Tracers.empty());
  }

  /** Returns a copy of this instance with a given property value. */
  public Solvent withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(props);
    prop.setLenient(map, value);
    return new Solvent(ImmutableMap.copyOf(map), tracer);
  }

  /** Returns a copy of this instance with the given property values. */
  public Solvent withProps(Map<Prop, Object> props) {
    final Map<Prop, Object> map = new LinkedHashMap<>(this.props);
    props.forEach((prop, value) -> prop.setLenient(map, value));
    return new Solvent(ImmutableMap.copyOf(map), tracer);
  }

  /** Returns a copy of this instance that uses a given backend. */
  public Solvent withBackend(Backend backend) {
    return withProp(Prop.BACKEND, backend);
  }

  /** Returns a copy of this instance with a given tracer. */
  public Solvent withTracer(Tracer tracer) {
    return new Solvent(props, tracer);
  }

  public ImmutableMap<Prop, Object> props() {
    return props;
  }

  public Tracer tracer() {
    return tracer;
  }

  /**
   * Evaluates an expression by interpretation.
   *
   * @param bindings value of each free variable
   */
  public Object evaluate(Core.Exp exp, Map<Core.Var, Object> bindings) {
    final Object result = Interpreter.evaluate(exp, bindings);
    tracer.onResult(result);
    return result;
  }

  /** Evaluates an expression that has no free variables. */
  public Object evaluate(Core.Exp exp) {
    return evaluate(exp, ImmutableMap.of());
  }

  /** Compiles an expression to code that can be applied many times. */
  public CompiledFunction compile(List<Core.Var> params, Core.Exp exp) {
    return new Compiler(tracer).compile(params, exp);
  }

  /** Creates a function with the given parameters and body. */
  public ExprFunction function(List<Core.Var> params, Core.Exp body) {
    return new ExprFunction(this, ImmutableList.copyOf(params), body, null);
  }

  private Solvers solvers() {
    return new Solvers(props, tracer);
  }

  /** Decides whether a predicate is satisfiable, and if so, returns values
   * of its variables. */
  public Solution solve(Core.Exp predicate) {
    return solvers().solve(predicate);
  }

  /** Returns a solution of a predicate, or empty. */
  public Optional<Solution> findFirst(Core.Exp predicate) {
    return solvers().findFirst(predicate);
  }

  /** Returns a lazy sequence of distinct solutions of a predicate. Close it
   * to release the sessions of enumerations that stopped early. */
  public Solutions findAll(Core.Exp predicate) {
    return solvers().findAll(predicate);
  }

  /** Returns an iterator over the solutions of a predicate; the caller must
   * close it if it does not exhaust it. */
  public SolutionIterator solutions(Core.Exp predicate) {
    return solvers().iterator(predicate,
        Prop.FIND_ALL_LIMIT.optionalIntValue(props));
  }

  /** Returns whether a predicate holds for all values of its variables. */
  public boolean isValid(Core.Exp predicate) {
    return solvers().isValid(predicate);
  }
}

// End Solvent.java
