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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.CharSort;
import com.microsoft.z3.Constructor;
import com.microsoft.z3.Context;
import com.microsoft.z3.DatatypeSort;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.FuncInterp;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Model;
import com.microsoft.z3.ReExpr;
import com.microsoft.z3.ReSort;
import com.microsoft.z3.SeqSort;
import com.microsoft.z3.Sort;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.compile.CapabilityException;
import net.hydromatic.solvent.type.MapType;
import net.hydromatic.solvent.type.OptionType;
import net.hydromatic.solvent.type.PrimitiveType;
import net.hydromatic.solvent.type.RecordType;
import net.hydromatic.solvent.type.SeqType;
import net.hydromatic.solvent.type.Type;
import net.hydromatic.solvent.type.Types;
import net.hydromatic.solvent.util.Regexes;
import net.hydromatic.solvent.value.Values;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Translates expressions to Z3 terms, and Z3 models back to values.
 *
 * <p>Types map to sorts as follows: {@code bool} to Bool; fixed-width
 * integers and {@code char} to bit-vectors; {@code bigint} to Int;
 * {@code string} to String; sequences to Seq; records and options to
 * algebraic datatypes; {@code (K, V) map} to an array from K to
 * {@code V option}.
 *
 * <p>A variable that is, or contains, a map is not a free array. Its map is
 * a chain of stores, over the empty map, of symbolic keys and symbolic
 * values; there are as many stores as there are places in the predicate
 * where a map can be observed. Any model of the predicate restricted to
 * those places is still a model, so the encoding loses no solutions, and
 * every map that it produces has finitely many keys.
 *
 * <p>Translations are memoized by node identity, so a DAG is translated in
 * time proportional to its number of distinct nodes. A variable always maps
 * to the same constant.
 */
@SuppressWarnings({"rawtypes", "unchecked"})
class SmtTranslator {
  private final Context ctx;
  private final Map<Type, Sort> sorts = new HashMap<>();
  private final Map<Core.Var, Expr> vars = new LinkedHashMap<>();
  private final Map<Core.Exp, Expr> memo = new IdentityHashMap<>();
  private final Map<String, ReExpr<SeqSort<CharSort>>> regexes =
      new HashMap<>();

  /** Key terms used with each map type. Blocking a model compares maps at
   * these keys. */
  private final Map<MapType, Set<Expr>> keyTerms = new HashMap<>();

  private int datatypeCount;

  /** Number of stores in the term of each map variable. */
  private int mapSlots;

  SmtTranslator(Context ctx) {
    this.ctx = ctx;
  }

  /** Translates a boolean expression. */
  BoolExpr predicate(Core.Exp exp) {
    mapSlots = Math.max(mapSlots, mapSlots(exp));
    return (BoolExpr) translate(exp);
  }

  /** Returns the constant of a variable, or null if the variable has not
   * been translated. */
  @Nullable Expr varExpr(Core.Var var) {
    return vars.get(var);
  }

  // -- sorts -----------------------------------------------------------------

  Sort sort(Type type) {
    Sort sort = sorts.get(type);
    if (sort == null) {
      sort = sort2(type);
      sorts.put(type, sort);
    }
    return sort;
  }

  private Sort sort2(Type type) {
    if (type instanceof PrimitiveType) {
      final PrimitiveType primitiveType = (PrimitiveType) type;
      switch (primitiveType) {
        case BOOL:
          return ctx.getBoolSort();
        case BIG_INT:
          return ctx.getIntSort();
        case STRING:
          return ctx.getStringSort();
        default:
          return ctx.mkBitVecSort(primitiveType.width);
      }
    }
    if (type instanceof RecordType) {
      final RecordType recordType = (RecordType) type;
      final String name = "Record" + ++datatypeCount;
      final int n = recordType.fieldTypes.size();
      final String[] fieldNames = new String[n];
      final Sort[] fieldSorts = new Sort[n];
      for (int i = 0; i < n; i++) {
        fieldNames[i] = name + "_" + i;
        fieldSorts[i] = sort(recordType.fieldTypes.get(i));
      }
      final Constructor c =
          ctx.mkConstructor(name + "_mk", "is_" + name, fieldNames,
              fieldSorts, new int[n]);
      return ctx.mkDatatypeSort(name, new Constructor[] {c});
    }
    if (type instanceof OptionType) {
      final Type elementType = ((OptionType) type).elementType;
      final String name = "Option" + ++datatypeCount;
      final Constructor none =
          ctx.mkConstructor(name + "_none", "is_" + name + "_none",
              new String[0], new Sort[0], new int[0]);
      final Constructor some =
          ctx.mkConstructor(name + "_some", "is_" + name + "_some",
              new String[] {name + "_value"},
              new Sort[] {sort(elementType)}, new int[1]);
      return ctx.mkDatatypeSort(name, new Constructor[] {none, some});
    }
    if (type instanceof SeqType) {
      return ctx.mkSeqSort(sort(((SeqType) type).elementType));
    }
    if (type instanceof MapType) {
      final MapType mapType = (MapType) type;
      return ctx.mkArraySort(sort(mapType.keyType),
          sort(Types.option(mapType.valueType)));
    }
    throw new CapabilityException(Backend.SMT.name(),
        "cannot encode type " + type);
  }

  private DatatypeSort datatype(Type type) {
    return (DatatypeSort) sort(type);
  }

  private Expr field(RecordType type, Expr e, int i) {
    return ctx.mkApp(datatype(type).getAccessors()[0][i], e);
  }

  private Expr record(RecordType type, Expr[] args) {
    return ctx.mkApp(datatype(type).getConstructors()[0], args);
  }

  private Expr none(OptionType type) {
    return ctx.mkApp(datatype(type).getConstructors()[0]);
  }

  private Expr some(OptionType type, Expr e) {
    return ctx.mkApp(datatype(type).getConstructors()[1], e);
  }

  private BoolExpr isSome(OptionType type, Expr e) {
    return (BoolExpr) ctx.mkApp(datatype(type).getRecognizers()[1], e);
  }

  private Expr optionValue(OptionType type, Expr e) {
    return ctx.mkApp(datatype(type).getAccessors()[1][0], e);
  }

  // -- literals --------------------------------------------------------------

  /** Translates a value. */
  Expr literal(Type type, Object value) {
    if (type instanceof PrimitiveType) {
      final PrimitiveType primitiveType = (PrimitiveType) type;
      switch (primitiveType) {
        case BOOL:
          return ctx.mkBool((Boolean) value);
        case BIG_INT:
          return ctx.mkInt(value.toString());
        case STRING:
          return ctx.mkString(escape((String) value));
        case CHAR:
          return ctx.mkBV((long) (Character) value, primitiveType.width);
        default:
          return ctx.mkBV((Long) value, primitiveType.width);
      }
    }
    if (type instanceof RecordType) {
      final RecordType recordType = (RecordType) type;
      final List<?> values = (List<?>) value;
      final Expr[] args = new Expr[values.size()];
      for (int i = 0; i < args.length; i++) {
        args[i] = literal(recordType.fieldTypes.get(i), values.get(i));
      }
      return record(recordType, args);
    }
    if (type instanceof OptionType) {
      final OptionType optionType = (OptionType) type;
      final Optional<?> o = (Optional<?>) value;
      return o.isPresent()
          ? some(optionType, literal(optionType.elementType, o.get()))
          : none(optionType);
    }
    if (type instanceof SeqType) {
      final Type elementType = ((SeqType) type).elementType;
      final List<?> values = (List<?>) value;
      if (values.isEmpty()) {
        return ctx.mkEmptySeq(sort(type));
      }
      final Expr[] units = new Expr[values.size()];
      for (int i = 0; i < units.length; i++) {
        units[i] = ctx.mkUnit(literal(elementType, values.get(i)));
      }
      return units.length == 1 ? units[0] : ctx.mkConcat(units);
    }
    if (type instanceof MapType) {
      final MapType mapType = (MapType) type;
      final OptionType optionType = Types.option(mapType.valueType);
      Expr e = ctx.mkConstArray(sort(mapType.keyType), none(optionType));
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        final Expr key = literal(mapType.keyType, entry.getKey());
        useKey(mapType, key);
        e = ctx.mkStore(e, key,
            some(optionType, literal(mapType.valueType, entry.getValue())));
      }
      return e;
    }
    throw new CapabilityException(Backend.SMT.name(),
        "cannot encode value of type " + type);
  }

  private void useKey(MapType mapType, Expr key) {
    keyTerms.computeIfAbsent(mapType, t -> new LinkedHashSet<>()).add(key);
  }

  // -- expressions -----------------------------------------------------------

  Expr translate(Core.Exp exp) {
    Expr e = memo.get(exp);
    if (e == null) {
      e = translate2(exp);
      memo.put(exp, e);
    }
    return e;
  }

  private Expr translate2(Core.Exp exp) {
    switch (exp.op) {
      case LITERAL:
        return literal(exp.type, ((Core.Literal) exp).value);

      case VAR:
        final Core.Var var = (Core.Var) exp;
        return vars.computeIfAbsent(var,
            v -> fresh(v.name + "!" + v.id, v.type));

      case AND:
        return ctx.mkAnd(arg(exp, 0), arg(exp, 1));
      case OR:
        return ctx.mkOr(arg(exp, 0), arg(exp, 1));
      case NOT:
        return ctx.mkNot(arg(exp, 0));
      case EQ:
        return ctx.mkEq(arg(exp, 0), arg(exp, 1));

      case LT:
        if (exp.arg(0).type == PrimitiveType.BIG_INT) {
          return ctx.mkLt(arg(exp, 0), arg(exp, 1));
        }
        return isSigned(exp.arg(0))
            ? ctx.mkBVSLT(arg(exp, 0), arg(exp, 1))
            : ctx.mkBVULT(arg(exp, 0), arg(exp, 1));
      case LE:
        if (exp.arg(0).type == PrimitiveType.BIG_INT) {
          return ctx.mkLe(arg(exp, 0), arg(exp, 1));
        }
        return isSigned(exp.arg(0))
            ? ctx.mkBVSLE(arg(exp, 0), arg(exp, 1))
            : ctx.mkBVULE(arg(exp, 0), arg(exp, 1));

      case ADD:
        return exp.type == PrimitiveType.BIG_INT
            ? ctx.mkAdd(arg(exp, 0), arg(exp, 1))
            : ctx.mkBVAdd(arg(exp, 0), arg(exp, 1));
      case SUB:
        return exp.type == PrimitiveType.BIG_INT
            ? ctx.mkSub(arg(exp, 0), arg(exp, 1))
            : ctx.mkBVSub(arg(exp, 0), arg(exp, 1));
      case MUL:
        return exp.type == PrimitiveType.BIG_INT
            ? ctx.mkMul(arg(exp, 0), arg(exp, 1))
            : ctx.mkBVMul(arg(exp, 0), arg(exp, 1));
      case BIT_AND:
        return ctx.mkBVAND(arg(exp, 0), arg(exp, 1));
      case BIT_OR:
        return ctx.mkBVOR(arg(exp, 0), arg(exp, 1));
      case BIT_XOR:
        return ctx.mkBVXOR(arg(exp, 0), arg(exp, 1));
      case BIT_NOT:
        return ctx.mkBVNot(arg(exp, 0));

      case IF:
        return ctx.mkITE(arg(exp, 0), arg(exp, 1), arg(exp, 2));

      case CAST:
        final PrimitiveType from = (PrimitiveType) exp.arg(0).type;
        final PrimitiveType to = (PrimitiveType) exp.type;
        final Expr a = arg(exp, 0);
        if (to.width < from.width) {
          return ctx.mkExtract(to.width - 1, 0, a);
        } else if (to.width > from.width) {
          return from.signed
              ? ctx.mkSignExt(to.width - from.width, a)
              : ctx.mkZeroExt(to.width - from.width, a);
        } else {
          return a;
        }

      case RECORD:
        final Expr[] args = new Expr[exp.operands().size()];
        for (int i = 0; i < args.length; i++) {
          args[i] = arg(exp, i);
        }
        return record((RecordType) exp.type, args);
      case FIELD:
        final Core.Field f = (Core.Field) exp;
        return field((RecordType) f.exp.type, translate(f.exp), f.ordinal);
      case WITH_FIELD:
        final Core.WithField w = (Core.WithField) exp;
        final RecordType recordType = (RecordType) w.type;
        final Expr r = translate(w.exp);
        final Expr[] fields = new Expr[recordType.fieldTypes.size()];
        for (int i = 0; i < fields.length; i++) {
          fields[i] = i == w.ordinal
              ? translate(w.value)
              : field(recordType, r, i);
        }
        return record(recordType, fields);

      case SOME:
        return some((OptionType) exp.type, arg(exp, 0));
      case IS_SOME:
        return isSome((OptionType) exp.arg(0).type, arg(exp, 0));
      case OPTION_VALUE:
        final OptionType optionType = (OptionType) exp.arg(0).type;
        final Expr o = arg(exp, 0);
        return ctx.mkITE(isSome(optionType, o), optionValue(optionType, o),
            literal(exp.type, Values.defaultValue(exp.type)));

      case SEQ_UNIT:
        return ctx.mkUnit(arg(exp, 0));
      case SEQ_CONCAT:
        return ctx.mkConcat(new Expr[] {arg(exp, 0), arg(exp, 1)});
      case SEQ_LENGTH:
        return ctx.mkLength(arg(exp, 0));
      case SEQ_SLICE:
        // Z3's extract is empty if the offset is out of range or the length
        // is not positive, and stops at the end of the sequence.
        return ctx.mkExtract(arg(exp, 0), arg(exp, 1), arg(exp, 2));
      case SEQ_AT:
        return ctx.mkAt(arg(exp, 0), arg(exp, 1));
      case SEQ_INDEX_OF:
        return ctx.mkIndexOf(arg(exp, 0), arg(exp, 1), arg(exp, 2));
      case SEQ_CONTAINS:
        return ctx.mkContains(arg(exp, 0), arg(exp, 1));
      case SEQ_STARTS_WITH:
        return ctx.mkPrefixOf(arg(exp, 1), arg(exp, 0));
      case SEQ_ENDS_WITH:
        return ctx.mkSuffixOf(arg(exp, 1), arg(exp, 0));
      case SEQ_REPLACE_FIRST:
        return ctx.mkReplace(arg(exp, 0), arg(exp, 1), arg(exp, 2));
      case REGEX_MATCH:
        final Core.RegexMatch regexMatch = (Core.RegexMatch) exp;
        return ctx.mkInRe(arg(exp, 0), regex(regexMatch));

      case MAP_SET:
        final MapType setType = (MapType) exp.type;
        useKey(setType, arg(exp, 1));
        return ctx.mkStore(arg(exp, 0), arg(exp, 1),
            some(Types.option(setType.valueType), arg(exp, 2)));
      case MAP_GET:
        useKey((MapType) exp.arg(0).type, arg(exp, 1));
        return ctx.mkSelect(arg(exp, 0), arg(exp, 1));
      case MAP_DELETE:
        final MapType deleteType = (MapType) exp.type;
        useKey(deleteType, arg(exp, 1));
        return ctx.mkStore(arg(exp, 0), arg(exp, 1),
            none(Types.option(deleteType.valueType)));

      default:
        // Default-valued maps are lowered before translation.
        throw new CapabilityException(Backend.SMT.name(),
            "cannot encode " + exp.op);
    }
  }

  /** Creates the term of a variable. */
  private Expr fresh(String name, Type type) {
    if (type instanceof MapType) {
      final MapType mapType = (MapType) type;
      final OptionType optionType = Types.option(mapType.valueType);
      Expr e = ctx.mkConstArray(sort(mapType.keyType), none(optionType));
      for (int i = 0; i < mapSlots; i++) {
        e = ctx.mkStore(e,
            ctx.mkConst(name + "#k" + i, sort(mapType.keyType)),
            ctx.mkConst(name + "#v" + i, sort(optionType)));
      }
      return e;
    }
    if (type instanceof RecordType && containsMap(type)) {
      final RecordType recordType = (RecordType) type;
      final Expr[] fields = new Expr[recordType.fieldTypes.size()];
      for (int i = 0; i < fields.length; i++) {
        fields[i] = fresh(name + "#" + i, recordType.fieldTypes.get(i));
      }
      return record(recordType, fields);
    }
    if (type instanceof OptionType && containsMap(type)) {
      final OptionType optionType = (OptionType) type;
      return ctx.mkITE(ctx.mkBoolConst(name + "#some"),
          some(optionType, fresh(name + "#value", optionType.elementType)),
          none(optionType));
    }
    // Maps inside sequences are free arrays
    return ctx.mkConst(name, sort(type));
  }

  /** Returns whether a record or option type contains a map. */
  private static boolean containsMap(Type type) {
    return mapCount(type) > 0;
  }

  /** Returns the number of maps in a value of a given type, not counting
   * maps inside sequences or inside other maps. */
  private static int mapCount(Type type) {
    if (type instanceof MapType) {
      return 1;
    }
    if (type instanceof RecordType) {
      int n = 0;
      for (Type fieldType : ((RecordType) type).fieldTypes) {
        n += mapCount(fieldType);
      }
      return n;
    }
    if (type instanceof OptionType) {
      return mapCount(((OptionType) type).elementType);
    }
    return 0;
  }

  /** Returns an upper bound on the number of keys at which an expression
   * can observe a map: one for each map operand of each call, and one for
   * each key of each map literal. */
  private static int mapSlots(Core.Exp exp) {
    final Set<Core.Exp> seen =
        Collections.newSetFromMap(new IdentityHashMap<>());
    final Deque<Core.Exp> stack = new ArrayDeque<>();
    stack.push(exp);
    int n = 0;
    while (!stack.isEmpty()) {
      final Core.Exp e = stack.pop();
      if (!seen.add(e)) {
        continue;
      }
      if (e instanceof Core.Literal) {
        n += entryCount(e.type, ((Core.Literal) e).value);
      }
      for (Core.Exp operand : e.operands()) {
        n += mapCount(operand.type);
        stack.push(operand);
      }
    }
    return n;
  }

  /** Returns the number of map entries in a value. */
  private static int entryCount(Type type, Object value) {
    if (type instanceof MapType) {
      return ((Map<?, ?>) value).size();
    }
    if (type instanceof RecordType) {
      final List<Type> fieldTypes = ((RecordType) type).fieldTypes;
      final List<?> values = (List<?>) value;
      int n = 0;
      for (int i = 0; i < fieldTypes.size(); i++) {
        n += entryCount(fieldTypes.get(i), values.get(i));
      }
      return n;
    }
    if (type instanceof OptionType) {
      final Optional<?> o = (Optional<?>) value;
      return o.isPresent()
          ? entryCount(((OptionType) type).elementType, o.get())
          : 0;
    }
    return 0;
  }

  private Expr arg(Core.Exp exp, int i) {
    return translate(exp.arg(i));
  }

  private static boolean isSigned(Core.Exp exp) {
    return ((PrimitiveType) exp.type).signed;
  }

  private ReExpr<SeqSort<CharSort>> regex(Core.RegexMatch regexMatch) {
    ReExpr<SeqSort<CharSort>> re = regexes.get(regexMatch.pattern);
    if (re == null) {
      re = Regexes.toRegex(regexMatch.automaton(), new Z3RegexAlgebra());
      regexes.put(regexMatch.pattern, re);
    }
    return re;
  }

  // -- models ----------------------------------------------------------------

  /** Reads the value of a term in a model. */
  Object read(Model model, Type type, Expr e) {
    if (type instanceof PrimitiveType) {
      final Expr v = model.eval(e, true);
      final PrimitiveType primitiveType = (PrimitiveType) type;
      switch (primitiveType) {
        case BOOL:
          return v.isTrue();
        case BIG_INT:
          return ((IntNum) v).getBigInteger();
        case STRING:
          return unescape(v.getString());
        case CHAR:
          return (char) ((BitVecNum) v).getBigInteger().intValue();
        default:
          final BigInteger b = ((BitVecNum) v).getBigInteger();
          return primitiveType.wrap(b.longValue());
      }
    }
    if (type instanceof RecordType) {
      final RecordType recordType = (RecordType) type;
      final ImmutableList.Builder<Object> b = ImmutableList.builder();
      for (int i = 0; i < recordType.fieldTypes.size(); i++) {
        b.add(
            read(model, recordType.fieldTypes.get(i),
                field(recordType, e, i)));
      }
      return b.build();
    }
    if (type instanceof OptionType) {
      final OptionType optionType = (OptionType) type;
      if (!model.eval(isSome(optionType, e), true).isTrue()) {
        return Optional.empty();
      }
      return Optional.of(
          read(model, optionType.elementType, optionValue(optionType, e)));
    }
    if (type instanceof SeqType) {
      final Type elementType = ((SeqType) type).elementType;
      final int n =
          ((IntNum) model.eval(ctx.mkLength(e), true)).getInt();
      final ImmutableList.Builder<Object> b = ImmutableList.builder();
      for (int i = 0; i < n; i++) {
        b.add(read(model, elementType, ctx.mkNth(e, ctx.mkInt(i))));
      }
      return b.build();
    }
    if (type instanceof MapType) {
      return readMap(model, (MapType) type, model.eval(e, true));
    }
    throw new CapabilityException(Backend.SMT.name(),
        "cannot read value of type " + type);
  }

  /** Reads a map from the value of an array in a model. The value is a
   * chain of stores over a constant array, or refers to the interpretation
   * of a function. */
  private ImmutableMap<Object, Object> readMap(Model model, MapType mapType,
      Expr array) {
    final OptionType optionType = Types.option(mapType.valueType);
    final Map<Object, Optional<?>> entries = new LinkedHashMap<>();
    Expr otherwise;
    Expr v = array;
    for (;;) {
      if (v.isStore()) {
        final Expr[] args = v.getArgs();
        // An outer store overrides an inner store of the same key
        entries.putIfAbsent(read(model, mapType.keyType, args[1]),
            (Optional<?>) read(model, optionType, args[2]));
        v = args[0];
      } else if (v.isConstantArray()) {
        otherwise = v.getArgs()[0];
        break;
      } else if (v.isAsArray()) {
        final FuncDecl f = v.getFuncDecl().getParameters()[0].getFuncDecl();
        final FuncInterp interp = model.getFuncInterp(f);
        for (FuncInterp.Entry entry : interp.getEntries()) {
          entries.putIfAbsent(read(model, mapType.keyType, entry.getArgs()[0]),
              (Optional<?>) read(model, optionType, entry.getValue()));
        }
        otherwise = interp.getElse();
        break;
      } else {
        throw new EngineException("cannot read map from " + array);
      }
    }
    if (((Optional<?>) read(model, optionType, otherwise)).isPresent()) {
      throw new EngineException("map has a value at every key: " + array);
    }
    final ImmutableMap.Builder<Object, Object> b = ImmutableMap.builder();
    entries.forEach((key, o) -> o.ifPresent(value -> b.put(key, value)));
    return b.build();
  }

  /** Returns the values, in a model, of the key terms used with a map
   * type. */
  private Set<Object> keyValues(Model model, MapType mapType) {
    final Set<Object> keys = new LinkedHashSet<>();
    for (Expr key : keyTerms.getOrDefault(mapType, ImmutableSet.of())) {
      keys.add(read(model, mapType.keyType, key));
    }
    return keys;
  }

  /**
   * Returns a constraint that a term has the same value as it has in a
   * model. Maps are compared at the keys that the constraints read or write
   * and at the keys of the map in the model, so that two models that differ
   * only in keys that are absent from both are considered the same.
   */
  BoolExpr sameAs(Model model, Type type, Expr e, Object value) {
    if (type instanceof RecordType) {
      final RecordType recordType = (RecordType) type;
      final List<?> values = (List<?>) value;
      final List<BoolExpr> list = new ArrayList<>();
      for (int i = 0; i < values.size(); i++) {
        list.add(
            sameAs(model, recordType.fieldTypes.get(i),
                field(recordType, e, i), values.get(i)));
      }
      return ctx.mkAnd(list.toArray(new BoolExpr[0]));
    }
    if (type instanceof OptionType) {
      final OptionType optionType = (OptionType) type;
      final Optional<?> o = (Optional<?>) value;
      if (!o.isPresent()) {
        return ctx.mkNot(isSome(optionType, e));
      }
      return ctx.mkAnd(isSome(optionType, e),
          sameAs(model, optionType.elementType, optionValue(optionType, e),
              o.get()));
    }
    if (type instanceof MapType) {
      final MapType mapType = (MapType) type;
      final OptionType optionType = Types.option(mapType.valueType);
      final Map<?, ?> map = (Map<?, ?>) value;
      final Set<Object> keys = keyValues(model, mapType);
      keys.addAll(map.keySet());
      final List<BoolExpr> list = new ArrayList<>();
      for (Object key : keys) {
        list.add(
            ctx.mkEq(ctx.mkSelect(e, literal(mapType.keyType, key)),
                literal(optionType, Optional.ofNullable(map.get(key)))));
      }
      return ctx.mkAnd(list.toArray(new BoolExpr[0]));
    }
    return ctx.mkEq(e, literal(type, value));
  }

  // -- strings ---------------------------------------------------------------

  /** Converts a Java string to the form that Z3 parses: printable ASCII
   * characters as themselves, other characters as <code>&#92;u{h}</code>. */
  static String escape(String s) {
    final StringBuilder buf = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c >= 0x20 && c < 0x7f && c != '\\') {
        buf.append(c);
      } else {
        buf.append("\\u{").append(Integer.toHexString(c)).append('}');
      }
    }
    return buf.toString();
  }

  /** Converts a string printed by Z3 to a Java string. */
  static String unescape(String s) {
    final StringBuilder buf = new StringBuilder();
    int i = 0;
    while (i < s.length()) {
      final char c = s.charAt(i);
      if (c == '\\' && s.startsWith("\\u{", i)) {
        final int end = s.indexOf('}', i);
        buf.appendCodePoint(Integer.parseInt(s.substring(i + 3, end), 16));
        i = end + 1;
      } else if (c == '\\' && s.startsWith("\\u", i) && i + 6 <= s.length()) {
        buf.appendCodePoint(Integer.parseInt(s.substring(i + 2, i + 6), 16));
        i += 6;
      } else if (c == '\\' && s.startsWith("\\x", i) && i + 4 <= s.length()) {
        buf.appendCodePoint(Integer.parseInt(s.substring(i + 2, i + 4), 16));
        i += 4;
      } else {
        buf.append(c);
        ++i;
      }
    }
    return buf.toString();
  }

  /** Builds Z3 regular expressions over strings. */
  private class Z3RegexAlgebra
      implements Regexes.RegexAlgebra<ReExpr<SeqSort<CharSort>>> {
    private final ReSort<SeqSort<CharSort>> reSort =
        ctx.mkReSort(ctx.getStringSort());

    @Override public ReExpr<SeqSort<CharSort>> empty() {
      return (ReExpr) ctx.mkEmptyRe(reSort);
    }

    @Override public ReExpr<SeqSort<CharSort>> epsilon() {
      return ctx.mkToRe(ctx.mkString(""));
    }

    @Override public ReExpr<SeqSort<CharSort>> range(char min, char max) {
      return ctx.mkRange(ctx.mkString(escape(String.valueOf(min))),
          ctx.mkString(escape(String.valueOf(max))));
    }

    @Override public ReExpr<SeqSort<CharSort>> concat(
        ReExpr<SeqSort<CharSort>> a, ReExpr<SeqSort<CharSort>> b) {
      return ctx.mkConcat(a, b);
    }

    @Override public ReExpr<SeqSort<CharSort>> union(
        ReExpr<SeqSort<CharSort>> a, ReExpr<SeqSort<CharSort>> b) {
      return ctx.mkUnion(a, b);
    }

    @Override public ReExpr<SeqSort<CharSort>> star(
        ReExpr<SeqSort<CharSort>> a) {
      return ctx.mkStar(a);
    }
  }
}

// End SmtTranslator.java
