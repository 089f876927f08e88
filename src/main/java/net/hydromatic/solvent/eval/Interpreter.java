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
package net.hydromatic.solvent.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.IdentityHashMap;
import java.util.Map;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.compile.ModelingException;
import net.hydromatic.solvent.value.Values;

/**
 * Evaluates an expression by walking its tree.
 *
 * <p>Each distinct node is evaluated at most once; the value is memoized by
 * node identity, so shared sub-expressions cost nothing extra.
 */
public class Interpreter {
  private final Map<Core.Var, Object> bindings;
  private final Map<Core.Exp, Object> memo = new IdentityHashMap<>();

  private Interpreter(Map<Core.Var, Object> bindings) {
    this.bindings = requireNonNull(bindings);
  }

  /**
   * Evaluates an expression.
   *
   * @param exp expression
   * @param bindings value of each free variable
   * @throws ModelingException if a variable has no binding, or its value is
   *     not valid for its type
   */
  public static Object evaluate(Core.Exp exp, Map<Core.Var, Object> bindings) {
    return new Interpreter(bindings).eval(exp);
  }

  private Object eval(Core.Exp exp) {
    final Object value = memo.get(exp);
    if (value != null) {
      return value;
    }
    final Object value2 = eval2(exp);
    memo.put(exp, value2);
    return value2;
  }

  private Object eval2(Core.Exp exp) {
    switch (exp.op) {
      case LITERAL:
        return ((Core.Literal) exp).value;

      case VAR:
        final Core.Var var = (Core.Var) exp;
        final Object value = bindings.get(var);
        if (value == null) {
          throw new ModelingException("no value for variable '" + var.name
              + "'");
        }
        return Values.check(var.type, value);

      case AND:
        // Lazy evaluation, same as compiled code.
        return (Boolean) eval(exp.arg(0)) && (Boolean) eval(exp.arg(1));

      case OR:
        return (Boolean) eval(exp.arg(0)) || (Boolean) eval(exp.arg(1));

      case IF:
        return (Boolean) eval(exp.arg(0))
            ? eval(exp.arg(1))
            : eval(exp.arg(2));

      case RECORD:
        final ImmutableList.Builder<Object> b = ImmutableList.builder();
        exp.operands().forEach(arg -> b.add(eval(arg)));
        return b.build();

      default:
        final ImmutableList<Core.Exp> args = exp.operands();
        switch (args.size()) {
          case 1:
            return Codes.applicable1(exp).apply(eval(args.get(0)));
          case 2:
            return Codes.applicable2(exp)
                .apply(eval(args.get(0)), eval(args.get(1)));
          case 3:
            return Codes.applicable3(exp)
                .apply(eval(args.get(0)), eval(args.get(1)),
                    eval(args.get(2)));
          default:
            throw new AssertionError("unknown " + exp.op);
        }
    }
  }
}

// End Interpreter.java
