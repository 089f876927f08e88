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
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.ast.Visitor;
import net.hydromatic.solvent.eval.Code;
import net.hydromatic.solvent.eval.Codes;

/**
 * Compiles an expression to a tree of {@link Code} objects.
 *
 * <p>Parameters are resolved to slots in the environment once, at compile
 * time. A sub-expression that occurs more than once in the expression DAG is
 * given a memo slot, so that it is computed at most once per call.
 *
 * <p>Compiled code uses the same operator implementations as the
 * {@link net.hydromatic.solvent.eval.Interpreter}, and so returns the same
 * results.
 */
public class Compiler {
  private final Tracer tracer;

  public Compiler(Tracer tracer) {
    this.tracer = requireNonNull(tracer);
  }

  /**
   * Compiles an expression.
   *
   * @param params parameters, in the order that their values will be passed
   * @param exp expression
   * @throws ModelingException if the expression has a variable that is not
   *     a parameter, or a parameter occurs twice
   */
  public CompiledFunction compile(List<Core.Var> params, Core.Exp exp) {
    final Map<Core.Var, Integer> slots = new IdentityHashMap<>();
    for (Core.Var param : params) {
      if (slots.put(param, slots.size()) != null) {
        throw new ModelingException("duplicate parameter '" + param.name
            + "'");
      }
    }
    final Map<Core.Exp, Integer> parentCounts = new IdentityHashMap<>();
    new Visitor() {
      @Override protected void visitOperands(Core.Exp e) {
        e.operands().forEach(o -> parentCounts.merge(o, 1, Integer::sum));
        super.visitOperands(e);
      }
    }.go(exp);
    final Context cx = new Context(slots, parentCounts);
    final Code code = cx.toCode(exp);
    tracer.onPlan(code);
    return new CompiledFunction(ImmutableList.copyOf(params), code,
        cx.memoCount);
  }

  /** State of a compilation. */
  private static class Context {
    final Map<Core.Var, Integer> slots;
    final Map<Core.Exp, Integer> parentCounts;
    final Map<Core.Exp, Code> codes = new IdentityHashMap<>();
    int memoCount = 0;

    Context(Map<Core.Var, Integer> slots,
        Map<Core.Exp, Integer> parentCounts) {
      this.slots = slots;
      this.parentCounts = parentCounts;
    }

    Code toCode(Core.Exp exp) {
      final Code code = codes.get(exp);
      if (code != null) {
        return code;
      }
      Code code2 = toCode2(exp);
      if (parentCounts.getOrDefault(exp, 0) > 1
          && !exp.operands().isEmpty()) {
        code2 = Codes.memo(slots.size() + memoCount++, code2);
      }
      codes.put(exp, code2);
      return code2;
    }

    private Code toCode2(Core.Exp exp) {
      switch (exp.op) {
        case LITERAL:
          return Codes.constant(((Core.Literal) exp).value);

        case VAR:
          final Core.Var var = (Core.Var) exp;
          final Integer slot = slots.get(var);
          if (slot == null) {
            throw new ModelingException("variable '" + var.name
                + "' is not a parameter");
          }
          return Codes.get(slot, var.name);

        case AND:
          return Codes.andAlso(toCode(exp.arg(0)), toCode(exp.arg(1)));

        case OR:
          return Codes.orElse(toCode(exp.arg(0)), toCode(exp.arg(1)));

        case IF:
          return Codes.ifThenElse(toCode(exp.arg(0)), toCode(exp.arg(1)),
              toCode(exp.arg(2)));

        case RECORD:
          final List<Code> fieldCodes = new ArrayList<>();
          exp.operands().forEach(e -> fieldCodes.add(toCode(e)));
          return Codes.record(fieldCodes);

        default:
          final List<Core.Exp> args = exp.operands();
          switch (args.size()) {
            case 1:
              return Codes.apply1(Codes.applicable1(exp),
                  toCode(args.get(0)));
            case 2:
              return Codes.apply2(Codes.applicable2(exp),
                  toCode(args.get(0)), toCode(args.get(1)));
            case 3:
              return Codes.apply3(Codes.applicable3(exp),
                  toCode(args.get(0)), toCode(args.get(1)),
                  toCode(args.get(2)));
            default:
              throw new AssertionError("unknown " + exp.op);
          }
      }
    }
  }
}

// End Compiler.java
