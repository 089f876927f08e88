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
package net.hydromatic.solvent.value;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.solvent.compile.ModelingException;
import net.hydromatic.solvent.type.DefaultMapType;
import net.hydromatic.solvent.type.MapType;
import net.hydromatic.solvent.type.OptionType;
import net.hydromatic.solvent.type.PrimitiveType;
import net.hydromatic.solvent.type.RecordType;
import net.hydromatic.solvent.type.SeqType;
import net.hydromatic.solvent.type.Type;
import net.hydromatic.solvent.type.TypeVisitor;

/**
 * Utilities for concrete values.
 *
 * <p>Every value of a type has a canonical Java representation: {@link Long}
 * for fixed-width integers, {@link BigInteger} for {@code bigint},
 * {@link Character}, {@link String}, {@link Boolean}, {@link Optional} for
 * options, an immutable {@link List} for records and sequences, an immutable
 * {@link Map} for general maps, and {@link DefaultMap}.
 */
public abstract class Values {
  private Values() {}

  /** Returns the default value of a type: zero, false, empty, none. */
  public static Object defaultValue(Type type) {
    return type.accept(DEFAULT_VISITOR);
  }

  private static final TypeVisitor<Object> DEFAULT_VISITOR =
      new TypeVisitor<Object>() {
        @Override
        public Object visit(PrimitiveType primitiveType) {
          switch (primitiveType) {
            case BOOL:
              return false;
            case BIG_INT:
              return BigInteger.ZERO;
            case CHAR:
              return (char) 0;
            case STRING:
              return "";
            default:
              return 0L;
          }
        }

        @Override
        public Object visit(RecordType recordType) {
          final ImmutableList.Builder<Object> b = ImmutableList.builder();
          recordType.fieldTypes.forEach(t -> b.add(t.accept(this)));
          return b.build();
        }

        @Override
        public Object visit(OptionType optionType) {
          return Optional.empty();
        }

        @Override
        public Object visit(SeqType seqType) {
          return ImmutableList.of();
        }

        @Override
        public Object visit(MapType mapType) {
          return ImmutableMap.of();
        }

        @Override
        public Object visit(DefaultMapType defaultMapType) {
          return DefaultMap.empty(defaultValue(defaultMapType.valueType));
        }
      };

  /**
   * Checks that a Java object is a valid value of a type, and converts it to
   * the canonical representation.
   *
   * @throws ModelingException if the value is null, out of range, or of the
   *     wrong kind
   */
  public static Object check(Type type, Object value) {
    if (value == null) {
      throw new ModelingException("null value for type " + type);
    }
    if (type instanceof PrimitiveType) {
      return checkPrimitive((PrimitiveType) type, value);
    }
    if (type instanceof OptionType) {
      final Optional<?> o = cast(type, value, Optional.class);
      return o.map(v -> check(((OptionType) type).elementType, v));
    }
    if (type instanceof RecordType) {
      final RecordType recordType = (RecordType) type;
      final List<?> list = cast(type, value, List.class);
      if (list.size() != recordType.fieldTypes.size()) {
        throw new ModelingException(
            "record value " + value + " has wrong number of fields for type "
                + type);
      }
      final ImmutableList.Builder<Object> b = ImmutableList.builder();
      for (int i = 0; i < list.size(); i++) {
        b.add(check(recordType.fieldTypes.get(i), list.get(i)));
      }
      return b.build();
    }
    if (type instanceof SeqType) {
      final Type elementType = ((SeqType) type).elementType;
      final List<?> list = cast(type, value, List.class);
      final ImmutableList.Builder<Object> b = ImmutableList.builder();
      for (Object o : list) {
        b.add(check(elementType, o));
      }
      return b.build();
    }
    if (type instanceof MapType) {
      final MapType mapType = (MapType) type;
      final Map<?, ?> map = cast(type, value, Map.class);
      final ImmutableMap.Builder<Object, Object> b = ImmutableMap.builder();
      for (Map.Entry<?, ?> e : map.entrySet()) {
        b.put(check(mapType.keyType, e.getKey()),
            check(mapType.valueType, e.getValue()));
      }
      return b.buildOrThrow();
    }
    if (type instanceof DefaultMapType) {
      final DefaultMapType mapType = (DefaultMapType) type;
      final DefaultMap map = cast(type, value, DefaultMap.class);
      final Object defaultValue = defaultValue(mapType.valueType);
      if (!map.defaultValue.equals(defaultValue)) {
        throw new ModelingException(
            "default of map " + map + " must be " + defaultValue);
      }
      DefaultMap result = DefaultMap.empty(defaultValue);
      for (Object key : map.touchedKeys()) {
        result =
            result.set(check(mapType.keyType, key),
                check(mapType.valueType, map.get(key)));
      }
      return result;
    }
    throw new AssertionError("unknown type " + type);
  }

  private static Object checkPrimitive(PrimitiveType type, Object value) {
    switch (type) {
      case BOOL:
        return cast(type, value, Boolean.class);
      case CHAR:
        return cast(type, value, Character.class);
      case STRING:
        return cast(type, value, String.class);
      case BIG_INT:
        if (value instanceof BigInteger) {
          return value;
        }
        if (value instanceof Long
            || value instanceof Integer
            || value instanceof Short
            || value instanceof Byte) {
          return BigInteger.valueOf(((Number) value).longValue());
        }
        throw wrongKind(type, value);
      default:
        final long v;
        if (value instanceof Long
            || value instanceof Integer
            || value instanceof Short
            || value instanceof Byte) {
          v = ((Number) value).longValue();
        } else if (value instanceof BigInteger
            && ((BigInteger) value).bitLength() < 64) {
          v = ((BigInteger) value).longValue();
        } else {
          throw wrongKind(type, value);
        }
        if (v < type.minValue() || v > type.maxValue()) {
          throw new ModelingException(
              "value " + value + " out of range for type " + type);
        }
        return v;
    }
  }

  private static <T> T cast(Type type, Object value, Class<T> clazz) {
    if (!clazz.isInstance(value)) {
      throw wrongKind(type, value);
    }
    return clazz.cast(value);
  }

  private static ModelingException wrongKind(Type type, Object value) {
    return new ModelingException(
        "value " + value + " (" + value.getClass().getSimpleName()
            + ") is not valid for type " + type);
  }

  /** Returns whether a value is the default value of its type. */
  public static boolean isDefault(Type type, Object value) {
    return defaultValue(type).equals(value);
  }
}

// End Values.java
