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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BinaryOperator;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.ast.CoreBuilder;
import net.hydromatic.solvent.ast.Visitor;
import net.hydromatic.solvent.compile.CapabilityException;
import net.hydromatic.solvent.type.MapType;
import net.hydromatic.solvent.type.OptionType;
import net.hydromatic.solvent.type.PrimitiveType;
import net.hydromatic.solvent.type.RecordType;
import net.hydromatic.solvent.type.Type;
import net.hydromatic.solvent.type.Types;
import net.hydromatic.solvent.value.Values;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.logicng.formulas.FormulaFactory;
import org.logicng.formulas.Literal;
import org.logicng.formulas.Variable;
import org.logicng.knowledgecompilation.bdds.BDD;
import org.logicng.knowledgecompilation.bdds.BDDFactory;
import org.logicng.knowledgecompilation.bdds.jbuddy.BDDKernel;

/**
 * Translates expressions to binary decision diagrams.
 *
 * <p>Diagrams are LogicNG {@link BDD} objects over one {@link BDDKernel}.
 * The kernel is created when the first predicate is translated, with one
 * BDD variable for each bit of that predicate's variables.
 *
 * <p>A {@code bool} is one diagram; a fixed-width integer or {@code char} is
 * a vector of diagrams, one per bit. Records are lists of values, and options
 * are a "present" node and a value. A general map is a table with one option
 * for each possible key, so its key type must be narrow.
 *
 * <p>Types with infinitely many values (strings, sequences, {@code bigint})
 * cannot be encoded, and {@link #check} rejects them before any translation.
 */
class BddTranslator {
  private static final int NODE_SIZE = 10_000;
  private static final int CACHE_SIZE = 1_000;

  private final FormulaFactory f = new FormulaFactory();
  private final int maxMapKeyBits;
  private final Map<Core.Var, BddValue> vars = new LinkedHashMap<>();
  private final Map<Core.Exp, BddValue> memo = new IdentityHashMap<>();
  private final List<Variable> variables = new ArrayList<>();
  private @Nullable BDDKernel kernel;
  private @Nullable BDD truth;
  private @Nullable BDD falsity;

  BddTranslator(int maxMapKeyBits) {
    this.maxMapKeyBits = maxMapKeyBits;
  }

  // -- capabilities ----------------------------------------------------------

  /**
   * Checks that every node of an expression can be encoded.
   *
   * @throws CapabilityException if a node has a type that cannot be encoded
   */
  void check(Core.Exp exp) {
    new Visitor() {
      @Override protected void visit(Core.Literal literal) {
        checkType(literal.type);
      }

      @Override protected void visit(Core.Var var) {
        checkType(var.type);
      }

      @Override protected void visitOperands(Core.Exp e) {
        checkType(e.type);
        switch (e.op) {
          case REGEX_MATCH:
          case DMAP_SET:
          case DMAP_GET:
          case DMAP_COUNT:
            throw new CapabilityException(Backend.BDD.name(),
                "cannot encode " + e.op.opName);
          default:
            super.visitOperands(e);
        }
      }
    }.go(exp);
  }

  private void checkType(Type type) {
    if (type instanceof PrimitiveType) {
      final PrimitiveType primitiveType = (PrimitiveType) type;
      if (primitiveType == PrimitiveType.BOOL || primitiveType.isBitVector()) {
        return;
      }
    } else if (type instanceof RecordType) {
      ((RecordType) type).fieldTypes.forEach(this::checkType);
      return;
    } else if (type instanceof OptionType) {
      checkType(((OptionType) type).elementType);
      return;
    } else if (type instanceof MapType) {
      final MapType mapType = (MapType) type;
      final int keyBits = width(mapType.keyType);
      if (keyBits < 0) {
        throw new CapabilityException(Backend.BDD.name(),
            "key of map type " + type + " must be bool, char or a "
                + "fixed-width integer");
      }
      if (keyBits > maxMapKeyBits) {
        throw new CapabilityException(Backend.BDD.name(),
            "key of map type " + type + " has " + keyBits
                + " bits; the limit is " + maxMapKeyBits);
      }
      checkType(mapType.valueType);
      return;
    }
    throw new CapabilityException(Backend.BDD.name(),
        "cannot encode type " + type);
  }

  /** Returns the number of bits of a scalar type, or -1. */
  private static int width(Type type) {
    if (type == PrimitiveType.BOOL) {
      return 1;
    }
    if (type instanceof PrimitiveType && type.isBitVector()) {
      return ((PrimitiveType) type).width;
    }
    return -1;
  }

  // -- translation -----------------------------------------------------------

  /** Translates a boolean expression, returning its diagram. */
  BDD predicate(Core.Exp exp) {
    int bits = 0;
    for (Core.Var var : CoreBuilder.freeVars(exp)) {
      if (!vars.containsKey(var)) {
        bits += bitCount(var.type);
      }
    }
    if (kernel == null) {
      kernel = new BDDKernel(f, Math.max(bits, 1), NODE_SIZE, CACHE_SIZE);
      truth = BDDFactory.build(f.verum(), kernel);
      falsity = BDDFactory.build(f.falsum(), kernel);
    } else if (bits > 0) {
      throw new IllegalStateException("variables of later constraints must "
          + "occur in the first constraint");
    }
    return bit(translate(exp));
  }

  /** Returns the number of BDD variables in a value of a given type. */
  private static int bitCount(Type type) {
    if (type instanceof RecordType) {
      int n = 0;
      for (Type fieldType : ((RecordType) type).fieldTypes) {
        n += bitCount(fieldType);
      }
      return n;
    }
    if (type instanceof OptionType) {
      return 1 + bitCount(((OptionType) type).elementType);
    }
    if (type instanceof MapType) {
      final MapType mapType = (MapType) type;
      return tableSize(mapType) * bitCount(Types.option(mapType.valueType));
    }
    return width(type);
  }

  /** Returns the diagram that is always true. */
  BDD truth() {
    return requireNonNull(truth, "no constraint has been translated");
  }

  private BDD falsity() {
    return requireNonNull(falsity, "no constraint has been translated");
  }

  private BDD constant(boolean b) {
    return b ? truth() : falsity();
  }

  /** Creates a BDD variable. */
  private BDD newVar() {
    final Variable variable = f.variable("b" + variables.size());
    variables.add(variable);
    return BDDFactory.build(variable, requireNonNull(kernel));
  }

  /** Converts a model of a diagram to a value for every BDD variable, so
   * that {@link #read} can evaluate any diagram. Variables that the model
   * does not mention are false. */
  List<Literal> assignment(Set<Variable> trueVariables) {
    final List<Literal> literals = new ArrayList<>();
    for (Variable variable : variables) {
      literals.add(trueVariables.contains(variable)
          ? variable
          : variable.negate());
    }
    return literals;
  }

  /** Returns the value of a variable, or null if it has not been
   * translated. */
  @Nullable BddValue varValue(Core.Var var) {
    return vars.get(var);
  }

  BddValue translate(Core.Exp exp) {
    BddValue v = memo.get(exp);
    if (v == null) {
      v = translate2(exp);
      memo.put(exp, v);
    }
    return v;
  }

  private BddValue arg(Core.Exp exp, int i) {
    return translate(exp.arg(i));
  }

  private BDD bitArg(Core.Exp exp, int i) {
    return bit(arg(exp, i));
  }

  private BDD[] bitsArg(Core.Exp exp, int i) {
    return ((BddValue.Bits) arg(exp, i)).bits;
  }

  private BddValue translate2(Core.Exp exp) {
    switch (exp.op) {
      case LITERAL:
        return constant(exp.type, ((Core.Literal) exp).value);

      case VAR:
        return vars.computeIfAbsent((Core.Var) exp, v -> fresh(v.type));

      case AND:
        return bool(bitArg(exp, 0).and(bitArg(exp, 1)));
      case OR:
        return bool(bitArg(exp, 0).or(bitArg(exp, 1)));
      case NOT:
        return bool(bitArg(exp, 0).negate());
      case EQ:
        return bool(eq(arg(exp, 0), arg(exp, 1)));
      case LT:
        return bool(
            lessThan(bitsArg(exp, 0), bitsArg(exp, 1), isSigned(exp.arg(0)),
                false));
      case LE:
        return bool(
            lessThan(bitsArg(exp, 0), bitsArg(exp, 1), isSigned(exp.arg(0)),
                true));

      case ADD:
        return new BddValue.Bits(
            add(bitsArg(exp, 0), bitsArg(exp, 1), falsity()));
      case SUB:
        return new BddValue.Bits(
            add(bitsArg(exp, 0), not(bitsArg(exp, 1)), truth()));
      case MUL:
        return new BddValue.Bits(multiply(bitsArg(exp, 0), bitsArg(exp, 1)));
      case BIT_AND:
        return new BddValue.Bits(
            zip(bitsArg(exp, 0), bitsArg(exp, 1), BDD::and));
      case BIT_OR:
        return new BddValue.Bits(
            zip(bitsArg(exp, 0), bitsArg(exp, 1), BDD::or));
      case BIT_XOR:
        return new BddValue.Bits(
            zip(bitsArg(exp, 0), bitsArg(exp, 1), BddTranslator::xor));
      case BIT_NOT:
        return new BddValue.Bits(not(bitsArg(exp, 0)));

      case IF:
        return ite(bitArg(exp, 0), arg(exp, 1), arg(exp, 2));

      case CAST:
        return new BddValue.Bits(
            cast(bitsArg(exp, 0), isSigned(exp.arg(0)),
                ((PrimitiveType) exp.type).width, falsity()));

      case RECORD:
        final ImmutableList.Builder<BddValue> fields = ImmutableList.builder();
        exp.operands().forEach(e -> fields.add(translate(e)));
        return new BddValue.Record(fields.build());
      case FIELD:
        final Core.Field field = (Core.Field) exp;
        return ((BddValue.Record) translate(field.exp)).fields
            .get(field.ordinal);
      case WITH_FIELD:
        final Core.WithField withField = (Core.WithField) exp;
        final List<BddValue> list =
            new ArrayList<>(((BddValue.Record) translate(withField.exp)).fields);
        list.set(withField.ordinal, translate(withField.value));
        return new BddValue.Record(ImmutableList.copyOf(list));

      case SOME:
        return new BddValue.Option(truth(), arg(exp, 0));
      case IS_SOME:
        return bool(((BddValue.Option) arg(exp, 0)).present);
      case OPTION_VALUE:
        final BddValue.Option option = (BddValue.Option) arg(exp, 0);
        return ite(option.present, option.value,
            constant(exp.type, Values.defaultValue(exp.type)));

      case MAP_SET:
        final MapType setType = (MapType) exp.type;
        return update(setType, (BddValue.Table) arg(exp, 0), arg(exp, 1),
            new BddValue.Option(truth(), arg(exp, 2)));
      case MAP_DELETE:
        final MapType deleteType = (MapType) exp.type;
        return update(deleteType, (BddValue.Table) arg(exp, 0), arg(exp, 1),
            none(deleteType.valueType));
      case MAP_GET:
        final MapType getType = (MapType) exp.arg(0).type;
        final BddValue.Table table = (BddValue.Table) arg(exp, 0);
        final BDD[] key = keyBits(arg(exp, 1));
        BddValue result = none(getType.valueType);
        for (int i = 0; i < table.entries.size(); i++) {
          result = ite(equalsIndex(key, i), table.entries.get(i), result);
        }
        return result;

      default:
        throw new CapabilityException(Backend.BDD.name(),
            "cannot encode " + exp.op.opName);
    }
  }

  private static boolean isSigned(Core.Exp exp) {
    return ((PrimitiveType) exp.type).signed;
  }

  private static BddValue bool(BDD node) {
    return new BddValue.Bits(new BDD[] {node});
  }

  private static BDD bit(BddValue value) {
    return ((BddValue.Bits) value).bits[0];
  }

  // -- values ----------------------------------------------------------------

  /** Creates a value whose bits are new variables. */
  private BddValue fresh(Type type) {
    if (type instanceof RecordType) {
      final ImmutableList.Builder<BddValue> b = ImmutableList.builder();
      ((RecordType) type).fieldTypes.forEach(t -> b.add(fresh(t)));
      return new BddValue.Record(b.build());
    }
    if (type instanceof OptionType) {
      final BDD present = newVar();
      return new BddValue.Option(present,
          fresh(((OptionType) type).elementType));
    }
    if (type instanceof MapType) {
      final MapType mapType = (MapType) type;
      final OptionType optionType = Types.option(mapType.valueType);
      final ImmutableList.Builder<BddValue.Option> b = ImmutableList.builder();
      for (int i = 0; i < tableSize(mapType); i++) {
        b.add((BddValue.Option) fresh(optionType));
      }
      return new BddValue.Table(b.build());
    }
    final BDD[] bits = new BDD[width(type)];
    for (int i = 0; i < bits.length; i++) {
      bits[i] = newVar();
    }
    return new BddValue.Bits(bits);
  }

  /** Creates a value that does not depend on any variable. */
  BddValue constant(Type type, Object value) {
    if (type instanceof RecordType) {
      final List<Type> fieldTypes = ((RecordType) type).fieldTypes;
      final List<?> values = (List<?>) value;
      final ImmutableList.Builder<BddValue> b = ImmutableList.builder();
      for (int i = 0; i < fieldTypes.size(); i++) {
        b.add(constant(fieldTypes.get(i), values.get(i)));
      }
      return new BddValue.Record(b.build());
    }
    if (type instanceof OptionType) {
      final Type elementType = ((OptionType) type).elementType;
      final Optional<?> o = (Optional<?>) value;
      return o.isPresent()
          ? new BddValue.Option(truth(), constant(elementType, o.get()))
          : none(elementType);
    }
    if (type instanceof MapType) {
      final MapType mapType = (MapType) type;
      final Map<?, ?> map = (Map<?, ?>) value;
      final ImmutableList.Builder<BddValue.Option> b = ImmutableList.builder();
      for (int i = 0; i < tableSize(mapType); i++) {
        final Object v = map.get(keyValue(mapType.keyType, i));
        b.add(v == null
            ? none(mapType.valueType)
            : new BddValue.Option(truth(), constant(mapType.valueType, v)));
      }
      return new BddValue.Table(b.build());
    }
    final long v = toLong(value);
    final BDD[] bits = new BDD[width(type)];
    for (int i = 0; i < bits.length; i++) {
      bits[i] = constant(((v >>> i) & 1L) != 0);
    }
    return new BddValue.Bits(bits);
  }

  private BddValue.Option none(Type elementType) {
    return new BddValue.Option(falsity(),
        constant(elementType, Values.defaultValue(elementType)));
  }

  private static long toLong(Object value) {
    if (value instanceof Boolean) {
      return (Boolean) value ? 1L : 0L;
    }
    if (value instanceof Character) {
      return (Character) value;
    }
    return (Long) value;
  }

  private static int tableSize(MapType mapType) {
    return 1 << width(mapType.keyType);
  }

  /** Returns the key whose bits are {@code i}. */
  private static Object keyValue(Type keyType, int i) {
    if (keyType == PrimitiveType.BOOL) {
      return i != 0;
    }
    if (keyType == PrimitiveType.CHAR) {
      return (char) i;
    }
    return ((PrimitiveType) keyType).wrap(i);
  }

  /** Reads the value of a {@link BddValue} under an assignment of every
   * BDD variable. */
  Object read(Type type, BddValue value, List<Literal> assignment) {
    if (type instanceof RecordType) {
      final List<Type> fieldTypes = ((RecordType) type).fieldTypes;
      final List<BddValue> fields = ((BddValue.Record) value).fields;
      final ImmutableList.Builder<Object> b = ImmutableList.builder();
      for (int i = 0; i < fieldTypes.size(); i++) {
        b.add(read(fieldTypes.get(i), fields.get(i), assignment));
      }
      return b.build();
    }
    if (type instanceof OptionType) {
      final BddValue.Option option = (BddValue.Option) value;
      if (!eval(option.present, assignment)) {
        return Optional.empty();
      }
      return Optional.of(
          read(((OptionType) type).elementType, option.value, assignment));
    }
    if (type instanceof MapType) {
      final MapType mapType = (MapType) type;
      final OptionType optionType = Types.option(mapType.valueType);
      final List<BddValue.Option> entries = ((BddValue.Table) value).entries;
      final Map<Object, Object> map = new LinkedHashMap<>();
      for (int i = 0; i < entries.size(); i++) {
        final Optional<?> o =
            (Optional<?>) read(optionType, entries.get(i), assignment);
        final Object key = keyValue(mapType.keyType, i);
        o.ifPresent(v -> map.put(key, v));
      }
      return ImmutableMap.copyOf(map);
    }
    final BDD[] bits = ((BddValue.Bits) value).bits;
    long v = 0;
    for (int i = 0; i < bits.length; i++) {
      if (eval(bits[i], assignment)) {
        v |= 1L << i;
      }
    }
    if (type == PrimitiveType.BOOL) {
      return v != 0;
    }
    if (type == PrimitiveType.CHAR) {
      return (char) v;
    }
    return ((PrimitiveType) type).wrap(v);
  }

  private static boolean eval(BDD node, List<Literal> assignment) {
    return node.restrict(assignment).isTautology();
  }

  // -- operations ------------------------------------------------------------

  /** Returns the diagram that is true where two values are equal. Absent
   * options are equal regardless of their value bits. */
  BDD eq(BddValue a, BddValue b) {
    if (a instanceof BddValue.Bits) {
      final BDD[] x = ((BddValue.Bits) a).bits;
      final BDD[] y = ((BddValue.Bits) b).bits;
      BDD r = truth();
      for (int i = 0; i < x.length; i++) {
        r = r.and(x[i].equivalence(y[i]));
      }
      return r;
    }
    if (a instanceof BddValue.Record) {
      final List<BddValue> x = ((BddValue.Record) a).fields;
      final List<BddValue> y = ((BddValue.Record) b).fields;
      BDD r = truth();
      for (int i = 0; i < x.size(); i++) {
        r = r.and(eq(x.get(i), y.get(i)));
      }
      return r;
    }
    if (a instanceof BddValue.Option) {
      final BddValue.Option x = (BddValue.Option) a;
      final BddValue.Option y = (BddValue.Option) b;
      return x.present.equivalence(y.present)
          .and(x.present.implies(eq(x.value, y.value)));
    }
    final List<BddValue.Option> x = ((BddValue.Table) a).entries;
    final List<BddValue.Option> y = ((BddValue.Table) b).entries;
    BDD r = truth();
    for (int i = 0; i < x.size(); i++) {
      r = r.and(eq(x.get(i), y.get(i)));
    }
    return r;
  }

  /** Returns a value that is {@code a} where {@code c} is true and {@code b}
   * elsewhere. */
  BddValue ite(BDD c, BddValue a, BddValue b) {
    if (c.isTautology()) {
      return a;
    }
    if (c.isContradiction()) {
      return b;
    }
    if (a instanceof BddValue.Bits) {
      final BDD[] x = ((BddValue.Bits) a).bits;
      final BDD[] y = ((BddValue.Bits) b).bits;
      final BDD[] r = new BDD[x.length];
      for (int i = 0; i < r.length; i++) {
        r[i] = ite(c, x[i], y[i]);
      }
      return new BddValue.Bits(r);
    }
    if (a instanceof BddValue.Record) {
      final List<BddValue> x = ((BddValue.Record) a).fields;
      final List<BddValue> y = ((BddValue.Record) b).fields;
      final ImmutableList.Builder<BddValue> r = ImmutableList.builder();
      for (int i = 0; i < x.size(); i++) {
        r.add(ite(c, x.get(i), y.get(i)));
      }
      return new BddValue.Record(r.build());
    }
    if (a instanceof BddValue.Option) {
      final BddValue.Option x = (BddValue.Option) a;
      final BddValue.Option y = (BddValue.Option) b;
      return new BddValue.Option(ite(c, x.present, y.present),
          ite(c, x.value, y.value));
    }
    final List<BddValue.Option> x = ((BddValue.Table) a).entries;
    final List<BddValue.Option> y = ((BddValue.Table) b).entries;
    final ImmutableList.Builder<BddValue.Option> r = ImmutableList.builder();
    for (int i = 0; i < x.size(); i++) {
      r.add((BddValue.Option) ite(c, x.get(i), y.get(i)));
    }
    return new BddValue.Table(r.build());
  }

  /** Returns a table like {@code table} but whose entry for {@code key} is
   * {@code entry}. */
  private BddValue update(MapType mapType, BddValue.Table table,
      BddValue key, BddValue.Option entry) {
    final BDD[] keyBits = keyBits(key);
    final ImmutableList.Builder<BddValue.Option> b = ImmutableList.builder();
    for (int i = 0; i < tableSize(mapType); i++) {
      b.add(
          (BddValue.Option) ite(equalsIndex(keyBits, i), entry,
              table.entries.get(i)));
    }
    return new BddValue.Table(b.build());
  }

  private static BDD[] keyBits(BddValue key) {
    return ((BddValue.Bits) key).bits;
  }

  /** Returns the diagram that is true where a vector of bits equals
   * {@code i}. */
  private BDD equalsIndex(BDD[] bits, int i) {
    BDD r = truth();
    for (int j = 0; j < bits.length; j++) {
      r = r.and(((i >>> j) & 1) != 0 ? bits[j] : bits[j].negate());
    }
    return r;
  }

  private static BDD xor(BDD a, BDD b) {
    return a.equivalence(b).negate();
  }

  private static BDD ite(BDD c, BDD a, BDD b) {
    return c.and(a).or(c.negate().and(b));
  }

  private static BDD[] not(BDD[] x) {
    final BDD[] r = new BDD[x.length];
    for (int i = 0; i < r.length; i++) {
      r[i] = x[i].negate();
    }
    return r;
  }

  private static BDD[] zip(BDD[] x, BDD[] y, BinaryOperator<BDD> op) {
    final BDD[] r = new BDD[x.length];
    for (int i = 0; i < r.length; i++) {
      r[i] = op.apply(x[i], y[i]);
    }
    return r;
  }

  /** Ripple-carry addition, modulo 2<sup>width</sup>. */
  private static BDD[] add(BDD[] x, BDD[] y, BDD carryIn) {
    final BDD[] r = new BDD[x.length];
    BDD carry = carryIn;
    for (int i = 0; i < r.length; i++) {
      final BDD xor = xor(x[i], y[i]);
      r[i] = xor(xor, carry);
      carry = x[i].and(y[i]).or(carry.and(xor));
    }
    return r;
  }

  /** Shift-and-add multiplication, modulo 2<sup>width</sup>. */
  private BDD[] multiply(BDD[] x, BDD[] y) {
    final BDD zero = falsity();
    BDD[] r = new BDD[x.length];
    Arrays.fill(r, zero);
    for (int j = 0; j < y.length; j++) {
      final BDD[] partial = new BDD[x.length];
      for (int k = 0; k < partial.length; k++) {
        partial[k] = k < j ? zero : y[j].and(x[k - j]);
      }
      r = add(r, partial, zero);
    }
    return r;
  }

  /** Returns the node that is true where {@code x < y} (or
   * {@code x <= y} if {@code orEqual}). */
  private BDD lessThan(BDD[] x, BDD[] y, boolean signed, boolean orEqual) {
    BDD r = constant(orEqual);
    for (int i = 0; i < x.length; i++) {
      final boolean sign = signed && i == x.length - 1;
      // At the sign bit, 1 is less than 0.
      final BDD less = sign
          ? x[i].and(y[i].negate())
          : x[i].negate().and(y[i]);
      r = less.or(x[i].equivalence(y[i]).and(r));
    }
    return r;
  }

  private static BDD[] cast(BDD[] x, boolean signed, int width, BDD zero) {
    final BDD[] r = new BDD[width];
    for (int i = 0; i < width; i++) {
      if (i < x.length) {
        r[i] = x[i];
      } else {
        r[i] = signed ? x[x.length - 1] : zero;
      }
    }
    return r;
  }
}

// End BddTranslator.java
