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
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.type.OptionType;
import net.hydromatic.solvent.type.PrimitiveType;
import net.hydromatic.solvent.util.Regexes;
import net.hydromatic.solvent.value.DefaultMap;
import net.hydromatic.solvent.value.Values;

/**
 * Helpers for {@link Code} and for the functions that implement each
 * operator.
 *
 * <p>{@link #applicable1}, {@link #applicable2} and {@link #applicable3}
 * return the function that computes an operator from the values of its
 * operands. The {@link Interpreter} and the
 * {@link net.hydromatic.solvent.compile.Compiler} both use them.
 */
@SuppressWarnings({"rawtypes", "unchecked"})
public abstract class Codes {
  private Codes() {}

  /** Describes a {@link Code}. */
  public static String describe(Code code) {
    final Code code2 = Codes.strip(code);
    return code2.describe(new DescriberImpl()).toString();
  }

  /** Removes wrappers, in particular the one that memoizes the result. */
  public static Code strip(Code code) {
    return code instanceof MemoCode ? ((MemoCode) code).code : code;
  }

  // -- code factories --------------------------------------------------------

  /** Returns a Code that evaluates to the same value in all environments. */
  public static Code constant(Object value) {
    return new ConstantCode(value);
  }

  /** Returns a Code that returns the value of a parameter. */
  public static Code get(int slot, String name) {
    return new GetCode(slot, name);
  }

  /** Returns a Code that evaluates {@code code} once per environment and
   * stores the result in {@code slot}. */
  public static Code memo(int slot, Code code) {
    return code.isConstant() ? code : new MemoCode(slot, code);
  }

  /** Returns a Code that evaluates {@code code0} and, if it is true, then
   * evaluates {@code code1}. */
  public static Code andAlso(Code code0, Code code1) {
    return new AndAlsoCode(code0, code1);
  }

  /** Returns a Code that evaluates {@code code0} and, if it is false, then
   * evaluates {@code code1}. */
  public static Code orElse(Code code0, Code code1) {
    return new OrElseCode(code0, code1);
  }

  /** Returns a Code that evaluates one of two branches, depending on a
   * condition. */
  public static Code ifThenElse(Code condition, Code ifTrue, Code ifFalse) {
    return new IfCode(condition, ifTrue, ifFalse);
  }

  /** Returns a Code that creates a record. */
  public static Code record(List<Code> codes) {
    return new RecordCode(ImmutableList.copyOf(codes));
  }

  public static Code apply1(Applicable1 fn, Code code0) {
    return new ApplyCode1(fn, code0);
  }

  public static Code apply2(Applicable2 fn, Code code0, Code code1) {
    return new ApplyCode2(fn, code0, code1);
  }

  public static Code apply3(Applicable3 fn, Code code0, Code code1,
      Code code2) {
    return new ApplyCode3(fn, code0, code1, code2);
  }

  // -- operator implementations ----------------------------------------------

  /** Returns the function that computes a unary expression from the value of
   * its operand. */
  public static Applicable1 applicable1(Core.Exp exp) {
    switch (exp.op) {
      case NOT:
        return fn1("not", a -> !(Boolean) a);
      case BIT_NOT:
        final PrimitiveType bitNotType = (PrimitiveType) exp.type;
        return fn1("bitNot", a -> bitNotType.wrap(~(Long) a));
      case CAST:
        final PrimitiveType castType = (PrimitiveType) exp.type;
        return fn1("cast", a -> cast(castType, a));
      case FIELD:
        final int ordinal = ((Core.Field) exp).ordinal;
        return fn1("field" + ordinal, a -> ((List) a).get(ordinal));
      case SOME:
        return fn1("some", Optional::of);
      case IS_SOME:
        return fn1("isSome", a -> ((Optional) a).isPresent());
      case OPTION_VALUE:
        final Object defaultValue =
            Values.defaultValue(((OptionType) exp.arg(0).type).elementType);
        return fn1("optionValue", a -> ((Optional) a).orElse(defaultValue));
      case SEQ_UNIT:
        return fn1("seqUnit", ImmutableList::of);
      case SEQ_LENGTH:
        return fn1("length", a -> BigInteger.valueOf(length(a)));
      case REGEX_MATCH:
        final Core.RegexMatch regexMatch = (Core.RegexMatch) exp;
        return fn1("matches", a ->
            Regexes.matches(regexMatch.automaton(), (String) a));
      case DMAP_COUNT:
        return fn1("dmapCount", a -> (long) ((DefaultMap) a).count());
      default:
        throw new AssertionError("not unary: " + exp.op);
    }
  }

  /** Returns the function that computes a binary expression from the values
   * of its operands. */
  public static Applicable2 applicable2(Core.Exp exp) {
    switch (exp.op) {
      case AND:
        return fn2("and", (a, b) -> (Boolean) a && (Boolean) b);
      case OR:
        return fn2("or", (a, b) -> (Boolean) a || (Boolean) b);
      case EQ:
        return fn2("eq", Object::equals);
      case LT:
        return fn2("lt", (a, b) -> ((Comparable) a).compareTo(b) < 0);
      case LE:
        return fn2("le", (a, b) -> ((Comparable) a).compareTo(b) <= 0);
      case ADD:
        if (exp.type == PrimitiveType.BIG_INT) {
          return fn2("add", (a, b) -> ((BigInteger) a).add((BigInteger) b));
        }
        final PrimitiveType addType = (PrimitiveType) exp.type;
        return fn2("add", (a, b) -> addType.wrap((Long) a + (Long) b));
      case SUB:
        if (exp.type == PrimitiveType.BIG_INT) {
          return fn2("sub",
              (a, b) -> ((BigInteger) a).subtract((BigInteger) b));
        }
        final PrimitiveType subType = (PrimitiveType) exp.type;
        return fn2("sub", (a, b) -> subType.wrap((Long) a - (Long) b));
      case MUL:
        if (exp.type == PrimitiveType.BIG_INT) {
          return fn2("mul",
              (a, b) -> ((BigInteger) a).multiply((BigInteger) b));
        }
        final PrimitiveType mulType = (PrimitiveType) exp.type;
        return fn2("mul", (a, b) -> mulType.wrap((Long) a * (Long) b));
      case BIT_AND:
        final PrimitiveType andType = (PrimitiveType) exp.type;
        return fn2("bitAnd", (a, b) -> andType.wrap((Long) a & (Long) b));
      case BIT_OR:
        final PrimitiveType orType = (PrimitiveType) exp.type;
        return fn2("bitOr", (a, b) -> orType.wrap((Long) a | (Long) b));
      case BIT_XOR:
        final PrimitiveType xorType = (PrimitiveType) exp.type;
        return fn2("bitXor", (a, b) -> xorType.wrap((Long) a ^ (Long) b));
      case WITH_FIELD:
        final int ordinal = ((Core.WithField) exp).ordinal;
        return fn2("withField" + ordinal, (a, b) -> {
          final List<Object> list = new ArrayList<>((List) a);
          list.set(ordinal, b);
          return ImmutableList.copyOf(list);
        });
      case SEQ_CONCAT:
        return fn2("concat", Codes::concat);
      case SEQ_AT:
        return fn2("at", (a, b) -> slice(a, (BigInteger) b, BigInteger.ONE));
      case SEQ_CONTAINS:
        return fn2("contains", (a, b) -> indexOf(a, b, 0) >= 0);
      case SEQ_STARTS_WITH:
        return fn2("startsWith", Codes::startsWith);
      case SEQ_ENDS_WITH:
        return fn2("endsWith", Codes::endsWith);
      case MAP_GET:
        return fn2("mapGet", (a, b) -> Optional.ofNullable(((Map) a).get(b)));
      case MAP_DELETE:
        return fn2("mapDelete", (a, b) -> {
          final Map<Object, Object> map = new LinkedHashMap<>((Map) a);
          map.remove(b);
          return ImmutableMap.copyOf(map);
        });
      case DMAP_GET:
        return fn2("dmapGet", (a, b) -> ((DefaultMap) a).get(b));
      default:
        throw new AssertionError("not binary: " + exp.op);
    }
  }

  /** Returns the function that computes a ternary expression from the values
   * of its operands. */
  public static Applicable3 applicable3(Core.Exp exp) {
    switch (exp.op) {
      case IF:
        return fn3("if", (a, b, c) -> (Boolean) a ? b : c);
      case SEQ_SLICE:
        return fn3("slice",
            (a, b, c) -> slice(a, (BigInteger) b, (BigInteger) c));
      case SEQ_INDEX_OF:
        return fn3("indexOf", (a, b, c) -> indexOf(a, b, (BigInteger) c));
      case SEQ_REPLACE_FIRST:
        return fn3("replaceFirst", Codes::replaceFirst);
      case MAP_SET:
        return fn3("mapSet", (a, b, c) -> {
          final Map<Object, Object> map = new LinkedHashMap<>((Map) a);
          map.put(b, c);
          return ImmutableMap.copyOf(map);
        });
      case DMAP_SET:
        return fn3("dmapSet", (a, b, c) -> ((DefaultMap) a).set(b, c));
      default:
        throw new AssertionError("not ternary: " + exp.op);
    }
  }

  /** Converts a bit-vector value to another bit-vector type. */
  static Object cast(PrimitiveType type, Object a) {
    final long v = a instanceof Character ? (long) (Character) a : (Long) a;
    final long w = type.wrap(v);
    return type == PrimitiveType.CHAR ? (Object) (char) w : (Object) w;
  }

  // -- sequences -------------------------------------------------------------
  //
  // A sequence value is either a String or a List. Indexes are 0-based;
  // out-of-range accesses return an empty sequence or -1, as in the SMT
  // theory of sequences.

  static int length(Object s) {
    return s instanceof String ? ((String) s).length() : ((List) s).size();
  }

  static Object concat(Object s, Object t) {
    if (s instanceof String) {
      return (String) s + t;
    }
    return ImmutableList.builder().addAll((List) s).addAll((List) t).build();
  }

  static Object empty(Object s) {
    return s instanceof String ? "" : ImmutableList.of();
  }

  private static Object sub(Object s, int start, int end) {
    if (s instanceof String) {
      return ((String) s).substring(start, end);
    }
    return ImmutableList.copyOf(((List) s).subList(start, end));
  }

  /** Returns the sub-sequence of {@code s} that starts at {@code offset} and
   * has at most {@code length} elements. Empty if {@code offset} is out of
   * range or {@code length} is not positive. */
  static Object slice(Object s, BigInteger offset, BigInteger length) {
    final int n = length(s);
    if (offset.signum() < 0
        || offset.compareTo(BigInteger.valueOf(n)) >= 0
        || length.signum() <= 0) {
      return empty(s);
    }
    final int start = offset.intValueExact();
    final BigInteger end = offset.add(length);
    return sub(s, start,
        end.compareTo(BigInteger.valueOf(n)) > 0 ? n : end.intValueExact());
  }

  /** Returns the first index at or after {@code offset} where {@code t}
   * occurs in {@code s}, or -1. */
  static BigInteger indexOf(Object s, Object t, BigInteger offset) {
    final int n = length(s);
    if (offset.signum() < 0 || offset.compareTo(BigInteger.valueOf(n)) > 0) {
      return BigInteger.ONE.negate();
    }
    return BigInteger.valueOf(indexOf(s, t, offset.intValueExact()));
  }

  private static int indexOf(Object s, Object t, int offset) {
    if (s instanceof String) {
      return ((String) s).indexOf((String) t, offset);
    }
    final List list = (List) s;
    final int i =
        Collections.indexOfSubList(list.subList(offset, list.size()), (List) t);
    return i < 0 ? -1 : i + offset;
  }

  static boolean startsWith(Object s, Object t) {
    final int n = length(t);
    return n <= length(s) && sub(s, 0, n).equals(t);
  }

  static boolean endsWith(Object s, Object t) {
    final int n = length(s);
    final int m = length(t);
    return m <= n && sub(s, n - m, n).equals(t);
  }

  /** Replaces the first occurrence of {@code t} in {@code s} with
   * {@code r}. If {@code t} is empty, returns {@code r ++ s}. */
  static Object replaceFirst(Object s, Object t, Object r) {
    final int i = indexOf(s, t, 0);
    if (i < 0) {
      return s;
    }
    return concat(concat(sub(s, 0, i), r), sub(s, i + length(t), length(s)));
  }

  // -- applicables -----------------------------------------------------------

  private static Applicable1 fn1(String name, Applicable1 fn) {
    return new Applicable1() {
      @Override
      public Object apply(Object a0) {
        return fn.apply(a0);
      }

      @Override
      public Describer describe(Describer describer) {
        return describer.start(name, d -> {});
      }

      @Override
      public String toString() {
        return name;
      }
    };
  }

  private static Applicable2 fn2(String name, Applicable2 fn) {
    return new Applicable2() {
      @Override
      public Object apply(Object a0, Object a1) {
        return fn.apply(a0, a1);
      }

      @Override
      public Describer describe(Describer describer) {
        return describer.start(name, d -> {});
      }

      @Override
      public String toString() {
        return name;
      }
    };
  }

  private static Applicable3 fn3(String name, Applicable3 fn) {
    return new Applicable3() {
      @Override
      public Object apply(Object a0, Object a1, Object a2) {
        return fn.apply(a0, a1, a2);
      }

      @Override
      public Describer describe(Describer describer) {
        return describer.start(name, d -> {});
      }

      @Override
      public String toString() {
        return name;
      }
    };
  }

  // -- code implementations --------------------------------------------------

  /** Code that returns a constant. */
  private static class ConstantCode implements Code {
    private final Object value;

    ConstantCode(Object value) {
      this.value = requireNonNull(value);
    }

    @Override
    public Describer describe(Describer describer) {
      return describer.start("constant", d -> d.arg("", value));
    }

    @Override
    public Object eval(EvalEnv env) {
      return value;
    }

    @Override
    public boolean isConstant() {
      return true;
    }
  }

  /** Code that retrieves the value of a parameter from the environment. */
  private static class GetCode implements Code {
    private final int slot;
    private final String name;

    GetCode(int slot, String name) {
      this.slot = slot;
      this.name = requireNonNull(name);
    }

    @Override
    public Describer describe(Describer describer) {
      return describer.start("get", d -> d.arg("", name));
    }

    @Override
    public String toString() {
      return "get(" + name + ")";
    }

    @Override
    public Object eval(EvalEnv env) {
      return env.get(slot);
    }
  }

  /** Code that evaluates a sub-expression at most once per environment. */
  private static class MemoCode implements Code {
    private final int slot;
    private final Code code;

    MemoCode(int slot, Code code) {
      this.slot = slot;
      this.code = requireNonNull(code);
    }

    @Override
    public Describer describe(Describer describer) {
      return describer.start("memo", d -> d.arg("", slot).arg("", code));
    }

    @Override
    public Object eval(EvalEnv env) {
      final Object o = env.get(slot);
      if (o != null) {
        return o;
      }
      final Object o2 = code.eval(env);
      env.set(slot, o2);
      return o2;
    }
  }

  /** Code that implements {@link #andAlso(Code, Code)}. */
  private static class AndAlsoCode implements Code {
    private final Code code0;
    private final Code code1;

    AndAlsoCode(Code code0, Code code1) {
      this.code0 = code0;
      this.code1 = code1;
    }

    @Override
    public Describer describe(Describer describer) {
      return describer.start("andalso", d -> d.arg("", code0).arg("", code1));
    }

    @Override
    public Object eval(EvalEnv env) {
      // Lazy evaluation. If code0 returns false, code1 is never evaluated.
      return (boolean) code0.eval(env) && (boolean) code1.eval(env);
    }
  }

  /** Code that implements {@link #orElse(Code, Code)}. */
  private static class OrElseCode implements Code {
    private final Code code0;
    private final Code code1;

    OrElseCode(Code code0, Code code1) {
      this.code0 = code0;
      this.code1 = code1;
    }

    @Override
    public Describer describe(Describer describer) {
      return describer.start("orelse", d -> d.arg("", code0).arg("", code1));
    }

    @Override
    public Object eval(EvalEnv env) {
      return (boolean) code0.eval(env) || (boolean) code1.eval(env);
    }
  }

  /** Code that implements {@link #ifThenElse(Code, Code, Code)}. */
  private static class IfCode implements Code {
    private final Code condition;
    private final Code ifTrue;
    private final Code ifFalse;

    IfCode(Code condition, Code ifTrue, Code ifFalse) {
      this.condition = condition;
      this.ifTrue = ifTrue;
      this.ifFalse = ifFalse;
    }

    @Override
    public Describer describe(Describer describer) {
      return describer.start("if",
          d -> d.arg("", condition).arg("", ifTrue).arg("", ifFalse));
    }

    @Override
    public Object eval(EvalEnv env) {
      return (boolean) condition.eval(env)
          ? ifTrue.eval(env)
          : ifFalse.eval(env);
    }
  }

  /** Code that creates a record from the values of its fields. */
  private static class RecordCode implements Code {
    private final ImmutableList<Code> codes;

    RecordCode(ImmutableList<Code> codes) {
      this.codes = codes;
    }

    @Override
    public Describer describe(Describer describer) {
      return describer.start("record", d -> d.args("", codes));
    }

    @Override
    public Object eval(EvalEnv env) {
      final Object[] values = new Object[codes.size()];
      for (int i = 0; i < values.length; i++) {
        values[i] = codes.get(i).eval(env);
      }
      return ImmutableList.copyOf(values);
    }
  }

  /** Applies an {@link Applicable1} to a {@link Code} argument. */
  private static class ApplyCode1 implements Code {
    private final Applicable1 fn;
    private final Code argCode0;

    ApplyCode1(Applicable1 fn, Code argCode0) {
      this.fn = fn;
      this.argCode0 = argCode0;
    }

    @Override
    public Object eval(EvalEnv env) {
      return fn.apply(argCode0.eval(env));
    }

    @Override
    public Describer describe(Describer describer) {
      return describer.start("apply",
          d -> d.arg("fn", fn).arg("", argCode0));
    }
  }

  /** Applies an {@link Applicable2} to two {@link Code} arguments. */
  private static class ApplyCode2 implements Code {
    private final Applicable2 fn;
    private final Code argCode0;
    private final Code argCode1;

    ApplyCode2(Applicable2 fn, Code argCode0, Code argCode1) {
      this.fn = fn;
      this.argCode0 = argCode0;
      this.argCode1 = argCode1;
    }

    @Override
    public Object eval(EvalEnv env) {
      final Object arg0 = argCode0.eval(env);
      final Object arg1 = argCode1.eval(env);
      return fn.apply(arg0, arg1);
    }

    @Override
    public Describer describe(Describer describer) {
      return describer.start("apply2",
          d -> d.arg("fn", fn).arg("", argCode0).arg("", argCode1));
    }
  }

  /** Applies an {@link Applicable3} to three {@link Code} arguments. */
  private static class ApplyCode3 implements Code {
    private final Applicable3 fn;
    private final Code argCode0;
    private final Code argCode1;
    private final Code argCode2;

    ApplyCode3(Applicable3 fn, Code argCode0, Code argCode1, Code argCode2) {
      this.fn = fn;
      this.argCode0 = argCode0;
      this.argCode1 = argCode1;
      this.argCode2 = argCode2;
    }

    @Override
    public Object eval(EvalEnv env) {
      final Object arg0 = argCode0.eval(env);
      final Object arg1 = argCode1.eval(env);
      final Object arg2 = argCode2.eval(env);
      return fn.apply(arg0, arg1, arg2);
    }

    @Override
    public Describer describe(Describer describer) {
      return describer.start("apply3",
          d -> d.arg("fn", fn)
              .arg("", argCode0)
              .arg("", argCode1)
              .arg("", argCode2));
    }
  }
}

// End Codes.java
