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

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.solvent.compile.ModelingException;

/**
 * Constructs a Java object from a set of named values.
 *
 * @param <T> type of object constructed
 */
public interface ObjectConstructor<T> {
  /**
   * Creates an instance.
   *
   * @param values field values, keyed by field name
   * @throws ModelingException if a name does not match, or matches more than
   *     one constructor parameter
   */
  T construct(Map<String, Object> values);

  /**
   * Returns a constructor that uses reflection.
   *
   * <p>It first looks for a public constructor whose parameters match the
   * names (ignoring case) one-for-one. Parameter names are only available if
   * the class was compiled with {@code -parameters}. Failing that, it calls
   * the public no-argument constructor and assigns public non-final fields.
   */
  static <T> ObjectConstructor<T> reflective(Class<T> clazz) {
    return values -> Reflective.construct(clazz, values);
  }

  /** Implementation of {@link #reflective(Class)}. */
  final class Reflective {
    private Reflective() {}

    static <T> T construct(Class<T> clazz, Map<String, Object> values) {
      for (Constructor<?> c : clazz.getConstructors()) {
        final Object[] args = match(c, values);
        if (args != null) {
          return clazz.cast(newInstance(c, args));
        }
      }
      final Constructor<T> c;
      try {
        c = clazz.getConstructor();
      } catch (NoSuchMethodException e) {
        throw new ModelingException(
            "no constructor of " + clazz.getName() + " matches " + values.keySet(),
            e);
      }
      final T o = clazz.cast(newInstance(c, new Object[0]));
      for (Map.Entry<String, Object> entry : values.entrySet()) {
        final Field field = findField(clazz, entry.getKey());
        try {
          field.set(o, coerce(entry.getValue(), field.getType()));
        } catch (IllegalAccessException | IllegalArgumentException e) {
          throw new ModelingException(
              "cannot set field " + field.getName() + " of " + clazz.getName(),
              e);
        }
      }
      return o;
    }

    /** Returns arguments for a constructor, or null if its parameters do not
     * match the names. */
    private static Object[] match(Constructor<?> c, Map<String, Object> values) {
      final Parameter[] parameters = c.getParameters();
      if (parameters.length != values.size() || parameters.length == 0) {
        return null;
      }
      final Object[] args = new Object[parameters.length];
      final boolean[] assigned = new boolean[parameters.length];
      for (Map.Entry<String, Object> entry : values.entrySet()) {
        final List<Integer> ordinals = new ArrayList<>();
        for (int i = 0; i < parameters.length; i++) {
          if (parameters[i].isNamePresent()
              && parameters[i].getName().equalsIgnoreCase(entry.getKey())) {
            ordinals.add(i);
          }
        }
        if (ordinals.size() > 1) {
          throw new ModelingException(
              "name '" + entry.getKey() + "' is ambiguous in constructor " + c);
        }
        if (ordinals.isEmpty()) {
          return null;
        }
        final int i = ordinals.get(0);
        if (assigned[i]) {
          return null;
        }
        final Object arg = coerce(entry.getValue(), parameters[i].getType());
        if (!box(parameters[i].getType()).isInstance(arg)) {
          return null;
        }
        assigned[i] = true;
        args[i] = arg;
      }
      return args;
    }

    private static Field findField(Class<?> clazz, String name) {
      final List<Field> fields = new ArrayList<>();
      for (Field field : clazz.getFields()) {
        if (field.getName().equalsIgnoreCase(name)
            && !Modifier.isStatic(field.getModifiers())
            && !Modifier.isFinal(field.getModifiers())) {
          fields.add(field);
        }
      }
      if (fields.isEmpty()) {
        throw new ModelingException(
            "no constructor parameter or settable field '" + name + "' in "
                + clazz.getName());
      }
      if (fields.size() > 1) {
        throw new ModelingException(
            "field name '" + name + "' is ambiguous in " + clazz.getName());
      }
      return fields.get(0);
    }

    private static Object newInstance(Constructor<?> c, Object[] args) {
      try {
        return c.newInstance(args);
      } catch (InstantiationException
          | IllegalAccessException
          | InvocationTargetException e) {
        throw new ModelingException("cannot invoke " + c, e);
      }
    }

    /** Converts a canonical value to the Java type a parameter expects;
     * for example a {@code Long} to an {@code int}. */
    static Object coerce(Object value, Class<?> target) {
      final Class<?> boxed = box(target);
      if (boxed.isInstance(value)) {
        return value;
      }
      if (value instanceof Long) {
        final long v = (Long) value;
        if (boxed == Integer.class) {
          return (int) v;
        }
        if (boxed == Short.class) {
          return (short) v;
        }
        if (boxed == Byte.class) {
          return (byte) v;
        }
        if (boxed == BigInteger.class) {
          return BigInteger.valueOf(v);
        }
      }
      return value;
    }

    private static Class<?> box(Class<?> c) {
      if (!c.isPrimitive()) {
        return c;
      }
      if (c == int.class) {
        return Integer.class;
      } else if (c == long.class) {
        return Long.class;
      } else if (c == short.class) {
        return Short.class;
      } else if (c == byte.class) {
        return Byte.class;
      } else if (c == boolean.class) {
        return Boolean.class;
      } else if (c == char.class) {
        return Character.class;
      } else if (c == double.class) {
        return Double.class;
      } else if (c == float.class) {
        return Float.class;
      }
      return Void.class;
    }
  }
}

// End ObjectConstructor.java
