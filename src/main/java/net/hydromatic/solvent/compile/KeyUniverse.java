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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.ast.Op;
import net.hydromatic.solvent.ast.Visitor;
import net.hydromatic.solvent.type.DefaultMapType;
import net.hydromatic.solvent.type.OptionType;
import net.hydromatic.solvent.type.RecordType;
import net.hydromatic.solvent.type.Type;
import net.hydromatic.solvent.value.DefaultMap;

/**
 * The keys that an expression can distinguish in each default-valued map
 * type.
 *
 * <p>Keys of {@code dmapSet} and {@code dmapGet} are literals. Every key
 * that is set or read is tracked, and so is every key of a map literal. A key
 * that is not tracked reads back the default value in every map the
 * expression can construct, so a map is fully described by the values of its
 * tracked keys.
 */
public class KeyUniverse {
  private final ImmutableMap<DefaultMapType, ImmutableList<Object>> keys;

  private KeyUniverse(
      ImmutableMap<DefaultMapType, ImmutableList<Object>> keys) {
    this.keys = keys;
  }

  /** Collects the tracked keys of an expression. */
  public static KeyUniverse of(Core.Exp exp) {
    final Map<DefaultMapType, Set<Object>> map = new LinkedHashMap<>();
    new Visitor() {
      @Override protected void visit(Core.Literal literal) {
        addValue(map, literal.type, literal.value);
      }

      @Override protected void visit(Core.Var var) {
        addType(map, var.type);
      }

      @Override protected void visit(Core.Call call) {
        addType(map, call.type);
        if (call.op == Op.DMAP_SET || call.op == Op.DMAP_GET) {
          add(map, (DefaultMapType) call.arg(0).type,
              ((Core.Literal) call.arg(1)).value);
        }
        super.visit(call);
      }
    }.go(exp);
    final ImmutableMap.Builder<DefaultMapType, ImmutableList<Object>> b =
        ImmutableMap.builder();
    map.forEach((type, keys) -> b.put(type, ImmutableList.copyOf(keys)));
    return new KeyUniverse(b.build());
  }

  private static void add(Map<DefaultMapType, Set<Object>> map,
      DefaultMapType type, Object key) {
    map.computeIfAbsent(type, t -> new LinkedHashSet<>()).add(key);
  }

  /** Registers every default-valued map type inside a type, so that a type
   * with no tracked keys still has an (empty) entry. */
  private static void addType(Map<DefaultMapType, Set<Object>> map,
      Type type) {
    if (type instanceof DefaultMapType) {
      map.computeIfAbsent((DefaultMapType) type, t -> new LinkedHashSet<>());
    } else if (type instanceof RecordType) {
      ((RecordType) type).fieldTypes.forEach(t -> addType(map, t));
    } else if (type instanceof OptionType) {
      addType(map, ((OptionType) type).elementType);
    }
  }

  /** Adds the keys of the maps inside a literal value. Default-valued maps
   * only occur inside records and options. */
  private static void addValue(Map<DefaultMapType, Set<Object>> map,
      Type type, Object value) {
    if (type instanceof DefaultMapType) {
      for (Object key : ((DefaultMap) value).touchedKeys()) {
        add(map, (DefaultMapType) type, key);
      }
      addType(map, type);
    } else if (type instanceof RecordType) {
      final List<Type> fieldTypes = ((RecordType) type).fieldTypes;
      final List<?> values = (List<?>) value;
      for (int i = 0; i < fieldTypes.size(); i++) {
        addValue(map, fieldTypes.get(i), values.get(i));
      }
    } else if (type instanceof OptionType) {
      final Optional<?> o = (Optional<?>) value;
      final Type elementType = ((OptionType) type).elementType;
      o.ifPresent(v -> addValue(map, elementType, v));
      addType(map, elementType);
    }
  }

  /** Returns whether the expression uses default-valued maps at all. */
  public boolean isEmpty() {
    return keys.isEmpty();
  }

  /** Returns the tracked keys of a map type. */
  public ImmutableList<Object> keys(DefaultMapType type) {
    final ImmutableList<Object> list = keys.get(type);
    return list == null ? ImmutableList.of() : list;
  }

  /** Returns the position of a key among the tracked keys of a type. */
  public int ordinal(DefaultMapType type, Object key) {
    final int i = keys(type).indexOf(key);
    if (i < 0) {
      throw new AssertionError("key " + key + " not tracked in " + type);
    }
    return i;
  }

  @Override
  public String toString() {
    return keys.toString();
  }
}

// End KeyUniverse.java
