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
package net.hydromatic.solvent.type;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Objects;
import net.hydromatic.solvent.compile.ModelingException;

/**
 * Record type, e.g. "{@code {a: int32, b: string}}".
 *
 * <p>A tuple is a record whose field names are "1", "2", etc.; it prints as
 * "{@code (int32, string)}".
 */
public class RecordType implements Type {
  public final ImmutableList<String> fieldNames;
  public final ImmutableList<Type> fieldTypes;

  RecordType(ImmutableList<String> fieldNames, ImmutableList<Type> fieldTypes) {
    this.fieldNames = requireNonNull(fieldNames);
    this.fieldTypes = requireNonNull(fieldTypes);
  }

  /** Returns the ordinal of a field, or throws. */
  public int fieldOrdinal(String name) {
    final int i = fieldNames.indexOf(name);
    if (i < 0) {
      throw new ModelingException(
          "no field '" + name + "' in record type " + this);
    }
    return i;
  }

  /** Returns whether this record's fields are named "1", "2", etc. */
  public boolean isTuple() {
    if (fieldNames.isEmpty()) {
      return false;
    }
    for (int i = 0; i < fieldNames.size(); i++) {
      if (!fieldNames.get(i).equals(Integer.toString(i + 1))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String moniker() {
    final StringBuilder b = new StringBuilder();
    if (isTuple()) {
      b.append('(');
      for (int i = 0; i < fieldTypes.size(); i++) {
        b.append(i > 0 ? ", " : "").append(fieldTypes.get(i).moniker());
      }
      return b.append(')').toString();
    }
    b.append('{');
    for (int i = 0; i < fieldTypes.size(); i++) {
      b.append(i > 0 ? ", " : "")
          .append(fieldNames.get(i))
          .append(": ")
          .append(fieldTypes.get(i).moniker());
    }
    return b.append('}').toString();
  }

  @Override
  public String toString() {
    return moniker();
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public boolean isFinite() {
    return fieldTypes.stream().allMatch(Type::isFinite);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fieldNames, fieldTypes);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof RecordType
            && fieldNames.equals(((RecordType) o).fieldNames)
            && fieldTypes.equals(((RecordType) o).fieldTypes);
  }
}

// End RecordType.java
