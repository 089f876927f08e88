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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.AbstractMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Value of a default-valued map.
 *
 * <p>A map is a list of (key, value) overrides, most recent first, over a
 * default value. Reading a key walks the list and returns the first match,
 * else the default.
 *
 * <p>Two maps are equal if they have the same default and agree on every key
 * that either has touched; the order of the overrides does not matter.
 */
public final class DefaultMap {
  /** Overrides, most recent first. */
  private final ImmutableList<Map.Entry<Object, Object>> overrides;

  public final Object defaultValue;

  private DefaultMap(
      ImmutableList<Map.Entry<Object, Object>> overrides, Object defaultValue) {
    this.overrides = requireNonNull(overrides);
    this.defaultValue = requireNonNull(defaultValue);
  }

  /** Creates an empty map; every key reads back {@code defaultValue}. */
  public static DefaultMap empty(Object defaultValue) {
    return new DefaultMap(ImmutableList.of(), defaultValue);
  }

  /** Returns a map that is the same as this but maps {@code key} to
   * {@code value}. */
  public DefaultMap set(Object key, Object value) {
    requireNonNull(key, "key");
    requireNonNull(value, "value");
    return new DefaultMap(
        ImmutableList.<Map.Entry<Object, Object>>builder()
            .add(new AbstractMap.SimpleImmutableEntry<>(key, value))
            .addAll(overrides)
            .build(),
        defaultValue);
  }

  /** Returns the value of a key, or the default value if it has never been
   * set. */
  public Object get(Object key) {
    for (Map.Entry<Object, Object> entry : overrides) {
      if (entry.getKey().equals(key)) {
        return entry.getValue();
      }
    }
    return defaultValue;
  }

  /** Returns every key that has been set, in the order first set. */
  public Set<Object> touchedKeys() {
    final Set<Object> keys = new LinkedHashSet<>();
    for (Map.Entry<Object, Object> entry : overrides.reverse()) {
      keys.add(entry.getKey());
    }
    return keys;
  }

  /** Returns the entries whose value differs from the default. */
  public ImmutableMap<Object, Object> asMap() {
    final Map<Object, Object> map = new LinkedHashMap<>();
    for (Object key : touchedKeys()) {
      final Object value = get(key);
      if (!value.equals(defaultValue)) {
        map.put(key, value);
      }
    }
    return ImmutableMap.copyOf(map);
  }

  /** Returns the number of keys whose value differs from the default. */
  public int count() {
    int n = 0;
    for (Object key : touchedKeys()) {
      if (!get(key).equals(defaultValue)) {
        ++n;
      }
    }
    return n;
  }

  @Override
  public int hashCode() {
    return Objects.hash(defaultValue, asMap());
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof DefaultMap)) {
      return false;
    }
    final DefaultMap that = (DefaultMap) o;
    if (!defaultValue.equals(that.defaultValue)) {
      return false;
    }
    final Set<Object> keys = touchedKeys();
    keys.addAll(that.touchedKeys());
    for (Object key : keys) {
      if (!get(key).equals(that.get(key))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return asMap().toString();
  }
}

// End DefaultMap.java
