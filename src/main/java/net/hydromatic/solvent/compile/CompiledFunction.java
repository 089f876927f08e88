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
package net.hydromatic.solvent.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Map;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.eval.Code;
import net.hydromatic.solvent.eval.Codes;
import net.hydromatic.solvent.eval.EvalEnv;
import net.hydromatic.solvent.value.Values;

/**
 * Result of compiling an expression; can be applied to values of its
 * parameters many times.
 *
 * <p>Each call uses its own environment, so a compiled function may be called
 * from several threads at once.
 */
public class CompiledFunction {
  public final ImmutableList<Core.Var> params;
  private final Code code;
  private final int memoCount;

  CompiledFunction(ImmutableList<Core.Var> params, Code code, int memoCount) {
    this.params = requireNonNull(params);
    this.code = requireNonNull(code);
    this.memoCount = memoCount;
  }

  /**
   * Evaluates the function.
   *
   * @param args one value for each parameter
   * @throws ModelingException if the number of arguments is wrong, or an
   *     argument is not a valid value of its parameter's type
   */
  public Object apply(Object... args) {
    if (args.length != params.size()) {
      throw new ModelingException("expected " + params.size()
          + " arguments, got " + args.length);
    }
    final Object[] values = new Object[args.length];
    for (int i = 0; i < args.length; i++) {
      values[i] = Values.check(params.get(i).type, args[i]);
    }
    return code.eval(EvalEnv.of(values, memoCount));
  }

  /** Evaluates the function, taking the value of each parameter from a
   * map. */
  public Object apply(Map<Core.Var, Object> bindings) {
    final Object[] args = new Object[params.size()];
    for (int i = 0; i < args.length; i++) {
      final Core.Var param = params.get(i);
      args[i] = bindings.get(param);
      if (args[i] == null) {
        throw new ModelingException("no value for variable '" + param.name
            + "'");
      }
    }
    return apply(args);
  }

  /** Returns the generated code. */
  public Code code() {
    return code;
  }

  /** Returns a description of the plan, e.g.
   * "{@code apply2(fn add, get x, constant 1)}". */
  public String describe() {
    return Codes.describe(code);
  }

  @Override
  public String toString() {
    return describe();
  }
}

// End CompiledFunction.java
