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
package net.hydromatic.solvent.eval;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;
import net.hydromatic.solvent.solve.Backend;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that configures how expressions are solved.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that is not
 * in the map has its default value.
 *
 * @see net.hydromatic.solvent.Solvent
 */
public enum Prop {
  /**
   * Enum property "backend" is the backend used to solve predicates. Default
   * is {@link Backend#SMT}.
   */
  BACKEND("backend", Backend.class, true, Backend.SMT),

  /**
   * Integer property "smtTimeout" is the number of milliseconds the SMT
   * solver may spend on a query before giving up. Default is 0, which means no
   * limit.
   */
  SMT_TIMEOUT("smtTimeout", Integer.class, true, 0),

  /**
   * Integer property "bddMaxMapKeyBits" is the largest width, in bits, of the
   * key type of a general map on the BDD backend. The backend represents
   * a map as a table with one entry for each possible key. Default is 8.
   */
  BDD_MAX_MAP_KEY_BITS("bddMaxMapKeyBits", Integer.class, true, 8),

  /**
   * Integer property "findAllLimit" is the maximum number of solutions that
   * {@code findAll} returns. Default is null, which means no limit.
   */
  FIND_ALL_LIMIT("findAllLimit", Integer.class, false, null);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and
   * {@link #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    if (defaultValue == null) {
      checkArgument(
          !required, "required property %s must have default value", camelName);
    } else {
      checkArgument(type.isInstance(defaultValue));
    }
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName + " not found");
    }
    return prop;
  }

  /**
   * Creates a map of property values from a {@link Properties}, such as one
   * loaded from a file. Keys may be camel-case or upper-case names. Integer
   * and enum values are parsed from strings.
   */
  public static Map<Prop, Object> fromProperties(Properties properties) {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    for (String name : properties.stringPropertyNames()) {
      lookup(name).setLenient(map, properties.getProperty(name));
    }
    return map;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    Object o = map.get(this);
    return this.<Integer>typeValue(o);
  }

  /** Returns the value of an optional integer property, or null. */
  public @Nullable Integer optionalIntValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map, Class<E> type) {
    checkType(type);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(Object o) {
    if (o == null) {
      if (defaultValue == null) {
        throw new IllegalArgumentException(
            "no value for property " + camelName + " and no default value");
      }
      return (T) defaultValue;
    }
    return (T) o;
  }

  /** Sets the value of a property, allowing strings for enum and integer
   * types. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (type.isEnum() && value instanceof String) {
      Optional<Enum> optional =
          Enums.getIfPresent(
              (Class<Enum>) type, ((String) value).toUpperCase(Locale.ROOT));
      if (!optional.isPresent()) {
        String values =
            Arrays.stream((Enum[]) type.getEnumConstants())
                .map(Enum::name)
                .collect(Collectors.joining("', '", "'", "'"));
        throw new IllegalArgumentException("value must be one of: " + values);
      }
      set(map, optional.get());
      return;
    }
    if (type == Integer.class && value instanceof String) {
      try {
        set(map, Integer.valueOf(((String) value).trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "value for property " + camelName + " must be an integer", e);
      }
      return;
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException("property is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException(
            "value for property must have type " + type);
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
