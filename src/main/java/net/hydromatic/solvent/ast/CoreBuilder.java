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
package net.hydromatic.solvent.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.solvent.compile.ModelingException;
import net.hydromatic.solvent.eval.Interpreter;
import net.hydromatic.solvent.type.DefaultMapType;
import net.hydromatic.solvent.type.MapType;
import net.hydromatic.solvent.type.OptionType;
import net.hydromatic.solvent.type.PrimitiveType;
import net.hydromatic.solvent.type.RecordType;
import net.hydromatic.solvent.type.SeqType;
import net.hydromatic.solvent.type.Type;
import net.hydromatic.solvent.type.Types;
import net.hydromatic.solvent.util.Regexes;
import net.hydromatic.solvent.value.DefaultMap;
import net.hydromatic.solvent.value.Values;

/**
 * Builds expressions.
 *
 * <p>Every method checks the types of its operands, and throws
 * {@link ModelingException} if they are not valid. The result is interned, so
 * calling a method twice with the same arguments returns the same object.
 * Some methods simplify; for example, {@code ifThenElse(true, a, b)} returns
 * {@code a}, and a call whose operands are all literals is folded to a
 * literal.
 */
public enum CoreBuilder {
  /**
   * The singleton instance of the expression builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  core;

  private static final Interner<Core.Exp> INTERNER =
      Interners.newStrongInterner();

  private static final AtomicInteger VAR_ID = new AtomicInteger();

  @SuppressWarnings("unchecked")
  private static <E extends Core.Exp> E intern(E e) {
    return (E) INTERNER.intern(e);
  }

  // -- leaves ----------------------------------------------------------------

  /**
   * Creates a literal.
   *
   * @throws ModelingException if the value is null, out of range for the
   *     type, or otherwise not a valid value of the type
   */
  public Core.Literal literal(Type type, Object value) {
    if (value == null) {
      throw new ModelingException("null literal of type " + type);
    }
    return intern(new Core.Literal(type, Values.check(type, value)));
  }

  public Core.Literal boolLiteral(boolean b) {
    return literal(PrimitiveType.BOOL, b);
  }

  public Core.Literal trueLiteral() {
    return boolLiteral(true);
  }

  public Core.Literal falseLiteral() {
    return boolLiteral(false);
  }

  /** Creates a literal of a fixed-width integer type. */
  public Core.Literal intLiteral(PrimitiveType type, long value) {
    if (!type.isFixedInt()) {
      throw new ModelingException("not a fixed-width integer type: " + type);
    }
    return literal(type, value);
  }

  public Core.Literal int32Literal(long value) {
    return intLiteral(PrimitiveType.INT32, value);
  }

  public Core.Literal bigIntLiteral(BigInteger value) {
    return literal(PrimitiveType.BIG_INT, value);
  }

  public Core.Literal bigIntLiteral(long value) {
    return bigIntLiteral(BigInteger.valueOf(value));
  }

  public Core.Literal charLiteral(char c) {
    return literal(PrimitiveType.CHAR, c);
  }

  public Core.Literal stringLiteral(String s) {
    return literal(PrimitiveType.STRING, s);
  }

  /** Creates a free variable. Each call returns a distinct variable. */
  public Core.Var var(String name, Type type) {
    if (name == null || type == null) {
      throw new ModelingException("variable must have name and type");
    }
    return intern(new Core.Var(name, type, VAR_ID.incrementAndGet()));
  }

  // -- logic -----------------------------------------------------------------

  public Core.Exp and(Core.Exp a0, Core.Exp a1) {
    checkBool(Op.AND, a0);
    checkBool(Op.AND, a1);
    if (isFalse(a0) || isFalse(a1)) {
      return falseLiteral();
    }
    if (isTrue(a0)) {
      return a1;
    }
    if (isTrue(a1) || a0 == a1) {
      return a0;
    }
    return call(Op.AND, PrimitiveType.BOOL, a0, a1);
  }

  /** Creates the conjunction of a list of expressions; true if empty. */
  public Core.Exp and(List<? extends Core.Exp> exps) {
    Core.Exp e = trueLiteral();
    for (Core.Exp exp : exps) {
      e = and(e, exp);
    }
    return e;
  }

  public Core.Exp or(Core.Exp a0, Core.Exp a1) {
    checkBool(Op.OR, a0);
    checkBool(Op.OR, a1);
    if (isTrue(a0) || isTrue(a1)) {
      return trueLiteral();
    }
    if (isFalse(a0)) {
      return a1;
    }
    if (isFalse(a1) || a0 == a1) {
      return a0;
    }
    return call(Op.OR, PrimitiveType.BOOL, a0, a1);
  }

  /** Creates the disjunction of a list of expressions; false if empty. */
  public Core.Exp or(List<? extends Core.Exp> exps) {
    Core.Exp e = falseLiteral();
    for (Core.Exp exp : exps) {
      e = or(e, exp);
    }
    return e;
  }

  public Core.Exp not(Core.Exp a0) {
    checkBool(Op.NOT, a0);
    if (a0.op == Op.NOT) {
      return a0.arg(0);
    }
    return call(Op.NOT, PrimitiveType.BOOL, a0);
  }

  public Core.Exp implies(Core.Exp a0, Core.Exp a1) {
    return or(not(a0), a1);
  }

  public Core.Exp xor(Core.Exp a0, Core.Exp a1) {
    checkBool(Op.EQ, a0);
    return neq(a0, a1);
  }

  // -- comparison ------------------------------------------------------------

  public Core.Exp eq(Core.Exp a0, Core.Exp a1) {
    checkSameType(Op.EQ, a0, a1);
    if (a0 == a1) {
      return trueLiteral();
    }
    return call(Op.EQ, PrimitiveType.BOOL, a0, a1);
  }

  public Core.Exp neq(Core.Exp a0, Core.Exp a1) {
    return not(eq(a0, a1));
  }

  public Core.Exp lt(Core.Exp a0, Core.Exp a1) {
    checkOrdered(Op.LT, a0, a1);
    if (a0 == a1) {
      return falseLiteral();
    }
    return call(Op.LT, PrimitiveType.BOOL, a0, a1);
  }

  public Core.Exp le(Core.Exp a0, Core.Exp a1) {
    checkOrdered(Op.LE, a0, a1);
    if (a0 == a1) {
      return trueLiteral();
    }
    return call(Op.LE, PrimitiveType.BOOL, a0, a1);
  }

  public Core.Exp gt(Core.Exp a0, Core.Exp a1) {
    return lt(a1, a0);
  }

  public Core.Exp ge(Core.Exp a0, Core.Exp a1) {
    return le(a1, a0);
  }

  // -- arithmetic ------------------------------------------------------------

  public Core.Exp add(Core.Exp a0, Core.Exp a1) {
    return arithmetic(Op.ADD, a0, a1);
  }

  public Core.Exp sub(Core.Exp a0, Core.Exp a1) {
    return arithmetic(Op.SUB, a0, a1);
  }

  public Core.Exp mul(Core.Exp a0, Core.Exp a1) {
    return arithmetic(Op.MUL, a0, a1);
  }

  private Core.Exp arithmetic(Op op, Core.Exp a0, Core.Exp a1) {
    checkSameType(op, a0, a1);
    if (!(a0.type instanceof PrimitiveType)
        || !((PrimitiveType) a0.type).isArithmetic()) {
      throw typeError(op, "an integer", a0);
    }
    return call(op, a0.type, a0, a1);
  }

  public Core.Exp bitAnd(Core.Exp a0, Core.Exp a1) {
    return bitwise(Op.BIT_AND, a0, a1);
  }

  public Core.Exp bitOr(Core.Exp a0, Core.Exp a1) {
    return bitwise(Op.BIT_OR, a0, a1);
  }

  public Core.Exp bitXor(Core.Exp a0, Core.Exp a1) {
    return bitwise(Op.BIT_XOR, a0, a1);
  }

  private Core.Exp bitwise(Op op, Core.Exp a0, Core.Exp a1) {
    checkSameType(op, a0, a1);
    checkFixedInt(op, a0);
    return call(op, a0.type, a0, a1);
  }

  public Core.Exp bitNot(Core.Exp a0) {
    checkFixedInt(Op.BIT_NOT, a0);
    if (a0.op == Op.BIT_NOT) {
      return a0.arg(0);
    }
    return call(Op.BIT_NOT, a0.type, a0);
  }

  /** Converts between fixed-width integer types and {@code char},
   * truncating or extending according to the signedness of the source. */
  public Core.Exp cast(Core.Exp a0, PrimitiveType type) {
    if (!a0.type.isBitVector()) {
      throw typeError(Op.CAST, "a fixed-width integer or char", a0);
    }
    if (!type.isBitVector()) {
      throw new ModelingException("cannot cast to " + type);
    }
    if (a0.type == type) {
      return a0;
    }
    return call(Op.CAST, type, a0);
  }

  public Core.Exp ifThenElse(Core.Exp c, Core.Exp a0, Core.Exp a1) {
    checkBool(Op.IF, c);
    checkSameType(Op.IF, a0, a1);
    if (isTrue(c)) {
      return a0;
    }
    if (isFalse(c)) {
      return a1;
    }
    if (a0 == a1) {
      return a0;
    }
    if (isTrue(a0) && isFalse(a1)) {
      return c;
    }
    if (isFalse(a0) && isTrue(a1)) {
      return not(c);
    }
    return call(Op.IF, a0.type, c, a0, a1);
  }

  // -- records ---------------------------------------------------------------

  /** Creates a record of a given type. */
  public Core.Exp record(RecordType type, List<? extends Core.Exp> args) {
    if (args.size() != type.fieldTypes.size()) {
      throw new ModelingException("record of type " + type + " needs "
          + type.fieldTypes.size() + " fields, got " + args.size());
    }
    for (int i = 0; i < args.size(); i++) {
      if (args.get(i).type != type.fieldTypes.get(i)) {
        throw new ModelingException("field '" + type.fieldNames.get(i)
            + "' of record " + type + " has type " + args.get(i).type);
      }
    }
    return call(Op.RECORD, type, ImmutableList.copyOf(args));
  }

  /** Creates a record, deducing its type from its field names and the types
   * of its arguments. */
  public Core.Exp record(List<String> names, List<? extends Core.Exp> args) {
    final List<Type> types = new ArrayList<>();
    args.forEach(arg -> types.add(arg.type));
    return record(Types.record(names, types), args);
  }

  public Core.Exp tuple(Core.Exp... args) {
    return tuple(Arrays.asList(args));
  }

  public Core.Exp tuple(List<? extends Core.Exp> args) {
    final List<Type> types = new ArrayList<>();
    args.forEach(arg -> types.add(arg.type));
    return record(Types.tuple(types), args);
  }

  public Core.Exp field(Core.Exp a0, String name) {
    return field(a0, recordType(Op.FIELD, a0).fieldOrdinal(name));
  }

  public Core.Exp field(Core.Exp a0, int ordinal) {
    final RecordType recordType = recordType(Op.FIELD, a0);
    if (ordinal < 0 || ordinal >= recordType.fieldTypes.size()) {
      throw new ModelingException("no field " + ordinal + " in " + recordType);
    }
    if (a0.op == Op.RECORD) {
      return a0.arg(ordinal);
    }
    if (a0 instanceof Core.WithField) {
      final Core.WithField withField = (Core.WithField) a0;
      return withField.ordinal == ordinal
          ? withField.value
          : field(withField.exp, ordinal);
    }
    if (a0 instanceof Core.Literal) {
      final List<?> list = ((Core.Literal) a0).unwrap(List.class);
      return literal(recordType.fieldTypes.get(ordinal), list.get(ordinal));
    }
    return intern(
        new Core.Field(recordType.fieldTypes.get(ordinal), a0, ordinal));
  }

  public Core.Exp withField(Core.Exp a0, String name, Core.Exp value) {
    return withField(a0, recordType(Op.WITH_FIELD, a0).fieldOrdinal(name),
        value);
  }

  public Core.Exp withField(Core.Exp a0, int ordinal, Core.Exp value) {
    final RecordType recordType = recordType(Op.WITH_FIELD, a0);
    if (ordinal < 0 || ordinal >= recordType.fieldTypes.size()) {
      throw new ModelingException("no field " + ordinal + " in " + recordType);
    }
    final Type fieldType = recordType.fieldTypes.get(ordinal);
    if (value.type != fieldType) {
      throw new ModelingException("field '"
          + recordType.fieldNames.get(ordinal) + "' has type " + fieldType
          + ", but value " + value + " has type " + value.type);
    }
    if (a0.op == Op.RECORD) {
      final List<Core.Exp> args = new ArrayList<>(a0.operands());
      args.set(ordinal, value);
      return record(recordType, args);
    }
    if (a0 instanceof Core.Literal && value instanceof Core.Literal) {
      final List<Object> list =
          new ArrayList<>(((Core.Literal) a0).unwrap(List.class));
      list.set(ordinal, ((Core.Literal) value).value);
      return literal(recordType, list);
    }
    if (field(a0, ordinal) == value) {
      return a0;
    }
    return intern(new Core.WithField(a0, ordinal, value));
  }

  // -- options ---------------------------------------------------------------

  public Core.Exp some(Core.Exp a0) {
    return call(Op.SOME, Types.option(a0.type), a0);
  }

  /** Creates the empty option of a given element type. */
  public Core.Literal none(Type elementType) {
    return literal(Types.option(elementType), Optional.empty());
  }

  public Core.Exp isSome(Core.Exp a0) {
    optionType(Op.IS_SOME, a0);
    if (a0.op == Op.SOME) {
      return trueLiteral();
    }
    return call(Op.IS_SOME, PrimitiveType.BOOL, a0);
  }

  public Core.Exp isNone(Core.Exp a0) {
    return not(isSome(a0));
  }

  /** Returns the value inside an option, or the default value of the element
   * type if the option is empty. */
  public Core.Exp optionValue(Core.Exp a0) {
    final OptionType optionType = optionType(Op.OPTION_VALUE, a0);
    if (a0.op == Op.SOME) {
      return a0.arg(0);
    }
    return call(Op.OPTION_VALUE, optionType.elementType, a0);
  }

  /** Returns the value inside an option, or {@code a1} if it is empty. */
  public Core.Exp valueOr(Core.Exp a0, Core.Exp a1) {
    return ifThenElse(isSome(a0), optionValue(a0), a1);
  }

  // -- sequences and strings -------------------------------------------------

  /** Creates a sequence with one element. */
  public Core.Exp seqUnit(Core.Exp a0) {
    return call(Op.SEQ_UNIT, Types.seq(a0.type), a0);
  }

  /** Creates an empty sequence of a given element type. */
  public Core.Literal emptySeq(Type elementType) {
    return literal(Types.seq(elementType), ImmutableList.of());
  }

  public Core.Exp concat(Core.Exp a0, Core.Exp a1) {
    checkSequence(Op.SEQ_CONCAT, a0);
    checkSameType(Op.SEQ_CONCAT, a0, a1);
    if (isEmptySequence(a0)) {
      return a1;
    }
    if (isEmptySequence(a1)) {
      return a0;
    }
    return call(Op.SEQ_CONCAT, a0.type, a0, a1);
  }

  /** Returns the length of a sequence, as a {@code bigint}. */
  public Core.Exp length(Core.Exp a0) {
    checkSequence(Op.SEQ_LENGTH, a0);
    return call(Op.SEQ_LENGTH, PrimitiveType.BIG_INT, a0);
  }

  /** Returns the sub-sequence starting at {@code offset} with at most
   * {@code length} elements; empty if the offset is out of range. */
  public Core.Exp slice(Core.Exp a0, Core.Exp offset, Core.Exp length) {
    checkSequence(Op.SEQ_SLICE, a0);
    checkType(Op.SEQ_SLICE, offset, PrimitiveType.BIG_INT);
    checkType(Op.SEQ_SLICE, length, PrimitiveType.BIG_INT);
    return call(Op.SEQ_SLICE, a0.type, a0, offset, length);
  }

  /** Returns the sequence containing only the element at {@code index}, or
   * the empty sequence if the index is out of range. */
  public Core.Exp at(Core.Exp a0, Core.Exp index) {
    checkSequence(Op.SEQ_AT, a0);
    checkType(Op.SEQ_AT, index, PrimitiveType.BIG_INT);
    return call(Op.SEQ_AT, a0.type, a0, index);
  }

  /** Returns the first position at or after {@code offset} where
   * {@code a1} occurs in {@code a0}, or -1. */
  public Core.Exp indexOf(Core.Exp a0, Core.Exp a1, Core.Exp offset) {
    checkSequence(Op.SEQ_INDEX_OF, a0);
    checkSameType(Op.SEQ_INDEX_OF, a0, a1);
    checkType(Op.SEQ_INDEX_OF, offset, PrimitiveType.BIG_INT);
    return call(Op.SEQ_INDEX_OF, PrimitiveType.BIG_INT, a0, a1, offset);
  }

  public Core.Exp contains(Core.Exp a0, Core.Exp a1) {
    return seqPredicate(Op.SEQ_CONTAINS, a0, a1);
  }

  public Core.Exp startsWith(Core.Exp a0, Core.Exp a1) {
    return seqPredicate(Op.SEQ_STARTS_WITH, a0, a1);
  }

  public Core.Exp endsWith(Core.Exp a0, Core.Exp a1) {
    return seqPredicate(Op.SEQ_ENDS_WITH, a0, a1);
  }

  private Core.Exp seqPredicate(Op op, Core.Exp a0, Core.Exp a1) {
    checkSequence(op, a0);
    checkSameType(op, a0, a1);
    if (isEmptySequence(a1)) {
      return trueLiteral();
    }
    return call(op, PrimitiveType.BOOL, a0, a1);
  }

  /** Replaces the first occurrence of {@code a1} in {@code a0} with
   * {@code a2}. */
  public Core.Exp replaceFirst(Core.Exp a0, Core.Exp a1, Core.Exp a2) {
    checkSequence(Op.SEQ_REPLACE_FIRST, a0);
    checkSameType(Op.SEQ_REPLACE_FIRST, a0, a1);
    checkSameType(Op.SEQ_REPLACE_FIRST, a0, a2);
    return call(Op.SEQ_REPLACE_FIRST, a0.type, a0, a1, a2);
  }

  /** Whether a string matches a regular expression.
   *
   * @throws ModelingException if the pattern is null or invalid */
  public Core.Exp regexMatch(Core.Exp a0, String pattern) {
    checkType(Op.REGEX_MATCH, a0, PrimitiveType.STRING);
    Regexes.compile(pattern);
    final Core.RegexMatch regexMatch = intern(new Core.RegexMatch(a0, pattern));
    if (a0 instanceof Core.Literal) {
      return fold(regexMatch);
    }
    return regexMatch;
  }

  // -- general maps ----------------------------------------------------------

  /** Creates an empty map of a given type. */
  public Core.Literal emptyMap(MapType type) {
    return literal(type, ImmutableMap.of());
  }

  public Core.Exp mapSet(Core.Exp a0, Core.Exp key, Core.Exp value) {
    final MapType mapType = mapType(Op.MAP_SET, a0);
    checkType(Op.MAP_SET, key, mapType.keyType);
    checkType(Op.MAP_SET, value, mapType.valueType);
    return call(Op.MAP_SET, mapType, a0, key, value);
  }

  /** Returns the value of a key, as an option. */
  public Core.Exp mapGet(Core.Exp a0, Core.Exp key) {
    final MapType mapType = mapType(Op.MAP_GET, a0);
    checkType(Op.MAP_GET, key, mapType.keyType);
    if (a0.op == Op.MAP_SET && a0.arg(1) == key) {
      return some(a0.arg(2));
    }
    return call(Op.MAP_GET, Types.option(mapType.valueType), a0, key);
  }

  public Core.Exp mapDelete(Core.Exp a0, Core.Exp key) {
    final MapType mapType = mapType(Op.MAP_DELETE, a0);
    checkType(Op.MAP_DELETE, key, mapType.keyType);
    return call(Op.MAP_DELETE, mapType, a0, key);
  }

  public Core.Exp mapContainsKey(Core.Exp a0, Core.Exp key) {
    return isSome(mapGet(a0, key));
  }

  // -- sets ------------------------------------------------------------------

  /** Creates an empty set; see {@link Types#set}. */
  public Core.Literal emptySet(Type elementType) {
    return emptyMap(Types.set(elementType));
  }

  /** Creates a set literal. */
  public Core.Literal setOf(Type elementType, Iterable<?> elements) {
    final ImmutableMap.Builder<Object, Object> b = ImmutableMap.builder();
    for (Object element : ImmutableSet.copyOf(elements)) {
      b.put(element, true);
    }
    return literal(Types.set(elementType), b.build());
  }

  public Core.Exp setAdd(Core.Exp a0, Core.Exp element) {
    setType(Op.MAP_SET, a0);
    return mapSet(a0, element, trueLiteral());
  }

  public Core.Exp setDelete(Core.Exp a0, Core.Exp element) {
    setType(Op.MAP_DELETE, a0);
    return mapDelete(a0, element);
  }

  public Core.Exp setContains(Core.Exp a0, Core.Exp element) {
    setType(Op.MAP_GET, a0);
    return mapContainsKey(a0, element);
  }

  // -- default-valued maps ---------------------------------------------------

  /** Creates an empty default-valued map of a given type. */
  public Core.Literal emptyDefaultMap(DefaultMapType type) {
    return literal(type, DefaultMap.empty(Values.defaultValue(type.valueType)));
  }

  /**
   * Sets the value of a key in a default-valued map.
   *
   * @throws ModelingException if the key is not a literal
   */
  public Core.Exp dmapSet(Core.Exp a0, Core.Exp key, Core.Exp value) {
    final DefaultMapType mapType = defaultMapType(Op.DMAP_SET, a0);
    checkType(Op.DMAP_SET, key, mapType.keyType);
    checkType(Op.DMAP_SET, value, mapType.valueType);
    if (!(key instanceof Core.Literal)) {
      throw new ModelingException(
          "key of " + Op.DMAP_SET.opName + " must be a literal: " + key);
    }
    return call(Op.DMAP_SET, mapType, a0, key, value);
  }

  /** Sets the value of a key in a default-valued map. */
  public Core.Exp dmapSet(Core.Exp a0, Object key, Core.Exp value) {
    final DefaultMapType mapType = defaultMapType(Op.DMAP_SET, a0);
    return dmapSet(a0, literal(mapType.keyType, key), value);
  }

  /**
   * Returns the value of a key in a default-valued map, or the default value
   * if the key has not been set.
   *
   * @throws ModelingException if the key is not a literal
   */
  public Core.Exp dmapGet(Core.Exp a0, Core.Exp key) {
    final DefaultMapType mapType = defaultMapType(Op.DMAP_GET, a0);
    checkType(Op.DMAP_GET, key, mapType.keyType);
    if (!(key instanceof Core.Literal)) {
      throw new ModelingException(
          "key of " + Op.DMAP_GET.opName + " must be a literal: " + key);
    }
    if (a0.op == Op.DMAP_SET) {
      // Keys of dmapSet are literals, and literals are interned.
      return a0.arg(1) == key
          ? a0.arg(2)
          : dmapGet(a0.arg(0), key);
    }
    return call(Op.DMAP_GET, mapType.valueType, a0, key);
  }

  /** Returns the value of a key in a default-valued map. */
  public Core.Exp dmapGet(Core.Exp a0, Object key) {
    final DefaultMapType mapType = defaultMapType(Op.DMAP_GET, a0);
    return dmapGet(a0, literal(mapType.keyType, key));
  }

  /** Returns the number of keys whose value is not the default, as an
   * {@code int32}. */
  public Core.Exp dmapCount(Core.Exp a0) {
    defaultMapType(Op.DMAP_COUNT, a0);
    return call(Op.DMAP_COUNT, PrimitiveType.INT32, a0);
  }

  // -- generic ---------------------------------------------------------------

  /**
   * Creates a call to an operator, deducing its type from its arguments.
   *
   * <p>Not valid for {@link Op#RECORD}, {@link Op#CAST}, {@link Op#FIELD},
   * {@link Op#WITH_FIELD}, {@link Op#REGEX_MATCH}, which need a payload;
   * use {@link #copy} for those.
   */
  public Core.Exp call(Op op, List<Core.Exp> args) {
    if (op.arity >= 0 && op.arity != args.size()) {
      throw new ModelingException(
          op.opName + " requires " + op.arity + " arguments: " + args);
    }
    switch (op) {
      case AND:
        return and(args.get(0), args.get(1));
      case OR:
        return or(args.get(0), args.get(1));
      case NOT:
        return not(args.get(0));
      case EQ:
        return eq(args.get(0), args.get(1));
      case LT:
        return lt(args.get(0), args.get(1));
      case LE:
        return le(args.get(0), args.get(1));
      case ADD:
        return add(args.get(0), args.get(1));
      case SUB:
        return sub(args.get(0), args.get(1));
      case MUL:
        return mul(args.get(0), args.get(1));
      case BIT_AND:
        return bitAnd(args.get(0), args.get(1));
      case BIT_OR:
        return bitOr(args.get(0), args.get(1));
      case BIT_XOR:
        return bitXor(args.get(0), args.get(1));
      case BIT_NOT:
        return bitNot(args.get(0));
      case IF:
        return ifThenElse(args.get(0), args.get(1), args.get(2));
      case SOME:
        return some(args.get(0));
      case IS_SOME:
        return isSome(args.get(0));
      case OPTION_VALUE:
        return optionValue(args.get(0));
      case SEQ_UNIT:
        return seqUnit(args.get(0));
      case SEQ_CONCAT:
        return concat(args.get(0), args.get(1));
      case SEQ_LENGTH:
        return length(args.get(0));
      case SEQ_SLICE:
        return slice(args.get(0), args.get(1), args.get(2));
      case SEQ_AT:
        return at(args.get(0), args.get(1));
      case SEQ_INDEX_OF:
        return indexOf(args.get(0), args.get(1), args.get(2));
      case SEQ_CONTAINS:
        return contains(args.get(0), args.get(1));
      case SEQ_STARTS_WITH:
        return startsWith(args.get(0), args.get(1));
      case SEQ_ENDS_WITH:
        return endsWith(args.get(0), args.get(1));
      case SEQ_REPLACE_FIRST:
        return replaceFirst(args.get(0), args.get(1), args.get(2));
      case MAP_SET:
        return mapSet(args.get(0), args.get(1), args.get(2));
      case MAP_GET:
        return mapGet(args.get(0), args.get(1));
      case MAP_DELETE:
        return mapDelete(args.get(0), args.get(1));
      case DMAP_SET:
        return dmapSet(args.get(0), args.get(1), args.get(2));
      case DMAP_GET:
        return dmapGet(args.get(0), args.get(1));
      case DMAP_COUNT:
        return dmapCount(args.get(0));
      default:
        throw new ModelingException("cannot create " + op + " from operands");
    }
  }

  /** Creates an expression like an existing one but with new operands.
   * Returns the existing expression if the operands are the same. */
  public Core.Exp copy(Core.Exp exp, List<Core.Exp> operands) {
    if (Core.sameOperands(exp.operands(), operands)) {
      return exp;
    }
    switch (exp.op) {
      case RECORD:
        return record(((RecordType) exp.type).fieldNames, operands);
      case CAST:
        return cast(operands.get(0), (PrimitiveType) exp.type);
      case FIELD:
        return field(operands.get(0), ((Core.Field) exp).ordinal);
      case WITH_FIELD:
        return withField(operands.get(0), ((Core.WithField) exp).ordinal,
            operands.get(1));
      case REGEX_MATCH:
        return regexMatch(operands.get(0), ((Core.RegexMatch) exp).pattern);
      default:
        return call(exp.op, operands);
    }
  }

  private Core.Exp call(Op op, Type type, Core.Exp... args) {
    return call(op, type, ImmutableList.copyOf(args));
  }

  /** Creates a call; if every argument is a literal, folds it. */
  private Core.Exp call(Op op, Type type, ImmutableList<Core.Exp> args) {
    final Core.Call call = new Core.Call(op, type, args);
    if (!args.isEmpty() && args.stream().allMatch(Core.Exp::isConstant)) {
      return fold(call);
    }
    return intern(call);
  }

  /** Evaluates an expression that has no variables, and returns a literal. */
  private Core.Literal fold(Core.Exp exp) {
    return literal(exp.type, Interpreter.evaluate(exp, ImmutableMap.of()));
  }

  // -- checks ----------------------------------------------------------------

  private static boolean isTrue(Core.Exp e) {
    return e instanceof Core.Literal && Boolean.TRUE.equals(
        ((Core.Literal) e).value);
  }

  private static boolean isFalse(Core.Exp e) {
    return e instanceof Core.Literal && Boolean.FALSE.equals(
        ((Core.Literal) e).value);
  }

  private static boolean isEmptySequence(Core.Exp e) {
    if (!(e instanceof Core.Literal)) {
      return false;
    }
    final Object value = ((Core.Literal) e).value;
    return value instanceof String && ((String) value).isEmpty()
        || value instanceof List && ((List<?>) value).isEmpty();
  }

  private static ModelingException typeError(Op op, String expected,
      Core.Exp e) {
    return new ModelingException("operand of " + op.opName + " must be "
        + expected + ", but " + e + " has type " + e.type);
  }

  private static void checkType(Op op, Core.Exp e, Type type) {
    if (e.type != type) {
      throw typeError(op, "of type " + type, e);
    }
  }

  private static void checkBool(Op op, Core.Exp e) {
    checkType(op, e, PrimitiveType.BOOL);
  }

  private static void checkFixedInt(Op op, Core.Exp e) {
    if (!e.type.isFixedInt()) {
      throw typeError(op, "a fixed-width integer", e);
    }
  }

  private static void checkSequence(Op op, Core.Exp e) {
    if (!e.type.isSequence()) {
      throw typeError(op, "a string or sequence", e);
    }
  }

  private static void checkSameType(Op op, Core.Exp a0, Core.Exp a1) {
    if (a0.type != a1.type) {
      throw new ModelingException("operands of " + op.opName
          + " must have the same type, but " + a0 + " has type " + a0.type
          + " and " + a1 + " has type " + a1.type);
    }
  }

  private static void checkOrdered(Op op, Core.Exp a0, Core.Exp a1) {
    checkSameType(op, a0, a1);
    if (!(a0.type instanceof PrimitiveType)
        || !((PrimitiveType) a0.type).isOrdered()) {
      throw typeError(op, "an integer or char", a0);
    }
  }

  private static RecordType recordType(Op op, Core.Exp e) {
    if (!(e.type instanceof RecordType)) {
      throw typeError(op, "a record", e);
    }
    return (RecordType) e.type;
  }

  private static OptionType optionType(Op op, Core.Exp e) {
    if (!(e.type instanceof OptionType)) {
      throw typeError(op, "an option", e);
    }
    return (OptionType) e.type;
  }

  private static MapType mapType(Op op, Core.Exp e) {
    if (!(e.type instanceof MapType)) {
      throw typeError(op, "a map", e);
    }
    return (MapType) e.type;
  }

  private static MapType setType(Op op, Core.Exp e) {
    final MapType mapType = mapType(op, e);
    if (mapType != Types.set(mapType.keyType)) {
      throw typeError(op, "a set", e);
    }
    return mapType;
  }

  private static DefaultMapType defaultMapType(Op op, Core.Exp e) {
    if (!(e.type instanceof DefaultMapType)) {
      throw typeError(op, "a default-valued map", e);
    }
    return (DefaultMapType) e.type;
  }

  /** Returns the element type of a sequence type; {@code char} for
   * {@code string}. */
  public static Type elementType(Type type) {
    if (type == PrimitiveType.STRING) {
      return PrimitiveType.CHAR;
    }
    if (type instanceof SeqType) {
      return ((SeqType) type).elementType;
    }
    throw new ModelingException("not a sequence type: " + type);
  }

  /** Returns the free variables of an expression, in the order in which
   * they are first reached. */
  public static ImmutableList<Core.Var> freeVars(Core.Exp exp) {
    final ImmutableList.Builder<Core.Var> b = ImmutableList.builder();
    new Visitor() {
      @Override protected void visit(Core.Var var) {
        b.add(var);
      }
    }.go(exp);
    return b.build();
  }

  /** Returns the bindings of variables as a map, validating each value. */
  public static ImmutableMap<Core.Var, Object> bindings(
      Map<Core.Var, Object> values) {
    final ImmutableMap.Builder<Core.Var, Object> b = ImmutableMap.builder();
    values.forEach((var, value) -> b.put(var, Values.check(var.type, value)));
    return b.buildOrThrow();
  }
}

// End CoreBuilder.java
