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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import java.util.List;
import net.hydromatic.solvent.compile.ModelingException;

/**
 * Factory for types.
 *
 * <p>Every type returned is interned, so structurally equal types are the same
 * object and may be compared using {@code ==}.
 */
public abstract class Types {
  private static final Interner<Type> INTERNER = Interners.newStrongInterner();

  private Types() {}

  /** Creates a record type. */
  public static RecordType record(List<String> names, List<Type> types) {
    checkArgument(
        names.size() == types.size(),
        "names and types must have same size: %s, %s",
        names,
        types);
    if (names.stream().distinct().count() != names.size()) {
      throw new ModelingException("duplicate field name in " + names);
    }
    return (RecordType)
        INTERNER.intern(
            new RecordType(ImmutableList.copyOf(names), ImmutableList.copyOf(types)));
  }

  /** Creates a tuple type; fields are named "1", "2", etc. */
  public static RecordType tuple(List<Type> types) {
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    for (int i = 0; i < types.size(); i++) {
      names.add(Integer.toString(i + 1));
    }
    return record(names.build(), types);
  }

  /** Creates a tuple type. */
  public static RecordType tuple(Type... types) {
    return tuple(ImmutableList.copyOf(types));
  }

  /** Creates an option type. */
  public static OptionType option(Type elementType) {
    return (OptionType) INTERNER.intern(new OptionType(elementType));
  }

  /** Creates a sequence type. Throws if the element type contains a map. */
  public static SeqType seq(Type elementType) {
    if (elementType.containsMap()) {
      throw new ModelingException(
          "sequence element type may not contain a map: " + elementType);
    }
    return (SeqType) INTERNER.intern(new SeqType(elementType));
  }

  /** Creates a general map type. Throws if key or value contains a map. */
  public static MapType map(Type keyType, Type valueType) {
    checkNoNestedMap("map", keyType, valueType);
    return (MapType) INTERNER.intern(new MapType(keyType, valueType));
  }

  /** Creates the type of a set. A set is a {@code (T, bool) map} whose keys
   * are its elements, each mapped to {@code true}. */
  public static MapType set(Type elementType) {
    return map(elementType, PrimitiveType.BOOL);
  }

  /** Creates a default-valued map type. Throws if key or value contains a
   * map. */
  public static DefaultMapType defaultMap(Type keyType, Type valueType) {
    checkNoNestedMap("dmap", keyType, valueType);
    return (DefaultMapType)
        INTERNER.intern(new DefaultMapType(keyType, valueType));
  }

  private static void checkNoNestedMap(
      String kind, Type keyType, Type valueType) {
    if (keyType.containsMap()) {
      throw new ModelingException(
          kind + " key type may not contain a map: " + keyType);
    }
    if (valueType.containsMap()) {
      throw new ModelingException(
          kind + " value type may not contain a map: " + valueType);
    }
  }

  /** Returns the moniker of a type, parenthesized if it is a map type or a
   * postfix type such as option. */
  static String parenthesize(Type type) {
    if (type instanceof OptionType
        || type instanceof SeqType
        || type instanceof MapType
        || type instanceof DefaultMapType) {
      return "(" + type.moniker() + ")";
    }
    return type.moniker();
  }
}

// End Types.java
