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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.solvent.ast.Core;
import net.hydromatic.solvent.compile.ModelingException;
import net.hydromatic.solvent.type.RecordType;
import net.hydromatic.solvent.value.ObjectConstructor;
import net.hydromatic.solvent.value.Values;

/**
 * Result of solving a predicate: whether it is satisfiable, and if so, a
 * value for each of its free variables.
 *
 * <p>Immutable.
 */
public class Solution {
  private static final Solution UNSATISFIABLE =
      new Solution(false, ImmutableMap.of());

  private final boolean satisfiable;
  private final ImmutableMap<Core.Var, Object> values;

  private Solution(boolean satisfiable, ImmutableMap<Core.Var, Object> values) {
    this.satisfiable = satisfiable;
    this.values = requireNonNull(values);
  }

  /** Creates a satisfiable solution. */
  public static Solution of(Map<Core.Var, Object> values) {
    return new Solution(true, ImmutableMap.copyOf(values));
  }

  /** Returns the unsatisfiable solution. */
  public static Solution unsatisfiable() {
    return UNSATISFIABLE;
  }

  public boolean isSatisfiable() {
    return satisfiable;
  }

  /**
   * Returns the value of a variable.
   *
   * <p>A variable that did not occur in the predicate has the default value
   * of its type.
   *
   * @throws ModelingException if the predicate is unsatisfiable
   */
  public Object get(Core.Var var) {
    if (!satisfiable) {
      throw new ModelingException("cannot get value of '" + var.name
          + "'; predicate is unsatisfiable");
    }
    final Object value = values.get(var);
    return value != null ? value : Values.defaultValue(var.type);
  }

  /**
   * Returns the value of a variable as an instance of a given class.
   *
   * <p>If the variable has a record type, constructs an object from the
   * record's field names and values via
   * {@link ObjectConstructor#reflective(Class)}. Otherwise the value must
   * already be an instance of the class.
   */
  public <T> T get(Core.Var var, Class<T> clazz) {
    final Object value = get(var);
    if (var.type instanceof RecordType) {
      final RecordType recordType = (RecordType) var.type;
      final List<?> list = (List<?>) value;
      final Map<String, Object> map = new LinkedHashMap<>();
      for (int i = 0; i < list.size(); i++) {
        map.put(recordType.fieldNames.get(i), list.get(i));
      }
      return ObjectConstructor.reflective(clazz).construct(map);
    }
    if (!clazz.isInstance(value)) {
      throw new ModelingException("value of '" + var.name + "' is a "
          + value.getClass().getSimpleName() + ", not a "
          + clazz.getSimpleName());
    }
    return clazz.cast(value);
  }

  /** Returns the values of the variables that occurred in the predicate. */
  public ImmutableMap<Core.Var, Object> values() {
    return values;
  }

  @Override public String toString() {
    if (!satisfiable) {
      return "unsat";
    }
    final StringBuilder b = new StringBuilder("sat {");
    values.forEach((var, value) -> {
      if (b.length() > 5) {
        b.append(", ");
      }
      b.append(var.name).append('=');
      Core.appendValue(b, value);
    });
    return b.append('}').toString();
  }
}

// End Solution.java
