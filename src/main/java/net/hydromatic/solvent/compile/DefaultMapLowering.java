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

import static net.hydromatic.solvent.ast.CoreBuilder.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.ast.Shuttle;
import net.hydromatic.solvent.type.DefaultMapType;
import net.hydromatic.solvent.type.OptionType;
import net.hydromatic.solvent.type.PrimitiveType;
import net.hydromatic.solvent.type.RecordType;
import net.hydromatic.solvent.type.Type;
import net.hydromatic.solvent.type.Types;
import net.hydromatic.solvent.value.DefaultMap;
import net.hydromatic.solvent.value.Values;

/**
 * Rewrites an expression so that it contains no default-valued maps.
 *
 * <p>Each default-valued map type becomes a tuple with one field for each
 * key in the {@link KeyUniverse}. {@code dmapSet} becomes a field update,
 * {@code dmapGet} becomes a field access, and {@code dmapCount} counts the
 * fields that differ from the default. Keys of both {@code dmapSet} and
 * {@code dmapGet} are literals, so every key that the expression can
 * observe has a field.
 *
 * <p>A variable whose type contains a default-valued map is replaced by a
 * new variable of the lowered type; {@link #lift} converts a value of the
 * new variable back to a value of the original.
 */
public class DefaultMapLowering {
  public final KeyUniverse universe;
  private final Map<Core.Var, Core.Var> vars = new LinkedHashMap<>();
  private final Map<Type, Type> types = new IdentityHashMap<>();

  private DefaultMapLowering(KeyUniverse universe) {
    this.universe = universe;
  }

  /** Creates a lowering for a given expression. */
  public static DefaultMapLowering of(Core.Exp exp) {
    return new DefaultMapLowering(KeyUniverse.of(exp));
  }

  /** Rewrites an expression. */
  public Core.Exp lower(Core.Exp exp) {
    if (universe.isEmpty()) {
      return exp;
    }
    return new LoweringShuttle().go(exp);
  }

  /** Returns the variable that replaces a variable in the lowered
   * expression; the variable itself if its type is unchanged. */
  public Core.Var lower(Core.Var var) {
    final Type type = lowerType(var.type);
    if (type == var.type) {
      return var;
    }
    return vars.computeIfAbsent(var, v -> core.var(v.name, type));
  }

  /** Returns the type of values of a given type after lowering. */
  public Type lowerType(Type type) {
    final Type t = types.get(type);
    if (t != null) {
      return t;
    }
    final Type t2 = lowerType2(type);
    types.put(type, t2);
    return t2;
  }

  private Type lowerType2(Type type) {
    if (type instanceof DefaultMapType) {
      final DefaultMapType mapType = (DefaultMapType) type;
      final List<Type> fieldTypes = new ArrayList<>();
      universe.keys(mapType).forEach(k -> fieldTypes.add(mapType.valueType));
      return Types.tuple(fieldTypes);
    }
    if (type instanceof RecordType) {
      final RecordType recordType = (RecordType) type;
      final List<Type> fieldTypes = new ArrayList<>();
      recordType.fieldTypes.forEach(t -> fieldTypes.add(lowerType(t)));
      return fieldTypes.equals(recordType.fieldTypes)
          ? type
          : Types.record(recordType.fieldNames, fieldTypes);
    }
    if (type instanceof OptionType) {
      final Type elementType = ((OptionType) type).elementType;
      final Type elementType2 = lowerType(elementType);
      return elementType2 == elementType ? type : Types.option(elementType2);
    }
    return type;
  }

  /** Converts a value of a type to a value of the lowered type. */
  public Object lowerValue(Type type, Object value) {
    if (type instanceof DefaultMapType) {
      final DefaultMap map = (DefaultMap) value;
      final ImmutableList.Builder<Object> b = ImmutableList.builder();
      universe.keys((DefaultMapType) type).forEach(k -> b.add(map.get(k)));
      return b.build();
    }
    if (type instanceof RecordType) {
      final List<Type> fieldTypes = ((RecordType) type).fieldTypes;
      final List<?> values = (List<?>) value;
      final ImmutableList.Builder<Object> b = ImmutableList.builder();
      for (int i = 0; i < fieldTypes.size(); i++) {
        b.add(lowerValue(fieldTypes.get(i), values.get(i)));
      }
      return b.build();
    }
    if (type instanceof OptionType) {
      final Type elementType = ((OptionType) type).elementType;
      return ((Optional<?>) value).map(v -> lowerValue(elementType, v));
    }
    return value;
  }

  /** Converts a value of the lowered type back to a value of the original
   * type. */
  public Object lift(Type type, Object value) {
    if (type instanceof DefaultMapType) {
      final DefaultMapType mapType = (DefaultMapType) type;
      final List<?> values = (List<?>) value;
      final ImmutableList<Object> keys = universe.keys(mapType);
      final Object defaultValue =
          Values.defaultValue(mapType.valueType);
      DefaultMap map = DefaultMap.empty(defaultValue);
      for (int i = 0; i < keys.size(); i++) {
        if (!values.get(i).equals(defaultValue)) {
          map = map.set(keys.get(i), values.get(i));
        }
      }
      return map;
    }
    if (type instanceof RecordType) {
      final List<Type> fieldTypes = ((RecordType) type).fieldTypes;
      final List<?> values = (List<?>) value;
      final ImmutableList.Builder<Object> b = ImmutableList.builder();
      for (int i = 0; i < fieldTypes.size(); i++) {
        b.add(lift(fieldTypes.get(i), values.get(i)));
      }
      return b.build();
    }
    if (type instanceof OptionType) {
      final Type elementType = ((OptionType) type).elementType;
      return ((Optional<?>) value).map(v -> lift(elementType, v));
    }
    return value;
  }

  /** Returns the variables that were replaced, and their replacements. */
  public ImmutableMap<Core.Var, Core.Var> vars() {
    return ImmutableMap.copyOf(vars);
  }

  /** Shuttle that performs the rewrite. */
  private class LoweringShuttle extends Shuttle {
    @Override protected Core.Exp visit(Core.Literal literal) {
      final Type type = lowerType(literal.type);
      if (type == literal.type) {
        return literal;
      }
      return core.literal(type, lowerValue(literal.type, literal.value));
    }

    @Override protected Core.Exp visit(Core.Var var) {
      return lower(var);
    }

    @Override protected Core.Exp visit(Core.Call call) {
      switch (call.op) {
        case DMAP_SET:
          return core.withField(go(call.arg(0)),
              ordinal(call.arg(0), call.arg(1)), go(call.arg(2)));

        case DMAP_GET:
          return core.field(go(call.arg(0)),
              ordinal(call.arg(0), call.arg(1)));

        case DMAP_COUNT:
          return count(call);

        default:
          return super.visit(call);
      }
    }

    private int ordinal(Core.Exp map, Core.Exp key) {
      return universe.ordinal((DefaultMapType) map.type,
          ((Core.Literal) key).value);
    }

    private Core.Exp count(Core.Call call) {
      final Core.Exp map = go(call.arg(0));
      final DefaultMapType mapType = (DefaultMapType) call.arg(0).type;
      final Core.Exp defaultValue = core.literal(mapType.valueType,
          Values.defaultValue(mapType.valueType));
      final Core.Exp zero = core.int32Literal(0);
      final Core.Exp one = core.int32Literal(1);
      Core.Exp e = zero;
      final int n = universe.keys(mapType).size();
      for (int i = 0; i < n; i++) {
        e = core.add(e,
            core.ifThenElse(core.eq(core.field(map, i), defaultValue),
                zero, one));
      }
      Preconditions.checkState(e.type == PrimitiveType.INT32,
          "count has type %s", e.type);
      return e;
    }
  }
}

// End DefaultMapLowering.java
