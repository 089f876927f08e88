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

import java.util.Objects;

/**
 * Default-valued map type, e.g. "{@code (int32, int32) dmap}".
 *
 * <p>A key that has never been set reads back the default value of the value
 * type.
 */
public class DefaultMapType implements Type {
  public final Type keyType;
  public final Type valueType;

  DefaultMapType(Type keyType, Type valueType) {
    this.keyType = requireNonNull(keyType);
    this.valueType = requireNonNull(valueType);
  }

  @Override
  public String moniker() {
    return "(" + keyType.moniker() + ", " + valueType.moniker() + ") dmap";
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
    return valueType.isFinite();
  }

  @Override
  public int hashCode() {
    return Objects.hash(keyType, valueType, 4);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof DefaultMapType
            && keyType.equals(((DefaultMapType) o).keyType)
            && valueType.equals(((DefaultMapType) o).valueType);
  }
}

// End DefaultMapType.java
