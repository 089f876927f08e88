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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.compile.CompiledFunction;
import net.hydromatic.solvent.compile.ModelingException;
import net.hydromatic.solvent.solve.Solution;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Function whose body is an expression over its parameters.
 *
 * <p>It can be evaluated by interpretation, or, after {@link #compile()}, by
 * running generated code; the results are the same. It can also be run
 * backwards: {@link #find} searches for arguments that make the result
 * satisfy a predicate.
 */
public class ExprFunction {
  private final Solvent solvent;
  public final ImmutableList<Core.Var> params;
  public final Core.Exp body;
  private final @Nullable CompiledFunction compiled;

  ExprFunction(Solvent solvent, ImmutableList<Core.Var> params, Core.Exp body,
      @Nullable CompiledFunction compiled) {
    this.solvent = requireNonNull(solvent);
    this.params = requireNonNull(params);
    this.body = requireNonNull(body);
    this.compiled = compiled;
  }

  /** Returns a function that evaluates by running compiled code. */
  public ExprFunction compile() {
    if (compiled != null) {
      return this;
    }
    return new ExprFunction(solvent, params, body,
        solvent.compile(params, body));
  }

  public boolean isCompiled() {
    return compiled != null;
  }

  /** Applies this function to arguments, one per parameter. */
  public Object evaluate(Object... args) {
    if (compiled != null) {
      final Object result = compiled.apply(args);
      solvent.tracer().onResult(result);
      return result;
    }
    return solvent.evaluate(body, bindings(args));
  }

  private Map<Core.Var, Object> bindings(Object[] args) {
    if (args.length != params.size()) {
      throw new ModelingException("expected " + params.size()
          + " arguments, got " + args.length);
    }
    final Map<Core.Var, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < args.length; i++) {
      map.put(params.get(i), args[i]);
    }
    return map;
  }

  /**
   * Finds arguments for which the result satisfies a predicate.
   *
   * @param predicate given the body, returns a boolean expression; it may
   *     also refer to the parameters
   * @return values of the parameters, or empty if there are none
   */
  public Optional<ImmutableList<Object>> find(
      Function<Core.Exp, Core.Exp> predicate) {
    return solvent.findFirst(predicate.apply(body)).map(this::arguments);
  }

  /** Returns all lists of arguments for which the result satisfies a
   * predicate. The stream is lazy, and must be closed if it is not
   * consumed to the end; see {@link Solvent#findAll}. */
  public Stream<ImmutableList<Object>> findAll(
      Function<Core.Exp, Core.Exp> predicate) {
    return solvent.findAll(predicate.apply(body)).stream()
        .map(this::arguments);
  }

  private ImmutableList<Object> arguments(Solution solution) {
    final ImmutableList.Builder<Object> b = ImmutableList.builder();
    params.forEach(param -> b.add(solution.get(param)));
    return b.build();
  }

  @Override public String toString() {
    return "fn " + params + " => " + body;
  }
}

// End ExprFunction.java
