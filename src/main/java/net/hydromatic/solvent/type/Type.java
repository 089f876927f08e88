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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Type of an expression or value.
 *
 * <p>Types are interned (see {@link Types}), so two structurally equal types
 * are the same object.
 */
public interface Type {
  /** Description of the type, e.g. "{@code int32}", "{@code string seq}". */
  String moniker();

  <R> R accept(TypeVisitor<R> typeVisitor);

  /** Whether this is {@code bool}. */
  default boolean isBool() {
    return this == PrimitiveType.BOOL;
  }

  /** Whether values of this type are bit-vectors (fixed-width ints, char). */
  default boolean isBitVector() {
    return false;
  }

  /** Whether this is a fixed-width integer type. */
  default boolean isFixedInt() {
    return false;
  }

  /** Whether this type is {@code string} or a sequence type. */
  default boolean isSequence() {
    return false;
  }

  /**
   * Whether this type has a small, fixed set of instances, and can therefore
   * be encoded as a vector of bits. True for {@code bool}, fixed-width
   * integers, {@code char}, and options and records over finite types.
   */
  default boolean isFinite() {
    return false;
  }

  /** Returns whether this type contains a general or default-valued map. */
  default boolean containsMap() {
    final AtomicInteger c = new AtomicInteger();
    accept(
        new TypeVisitor<Void>() {
          @Override
          public Void visit(MapType mapType) {
            c.incrementAndGet();
            return null;
          }

          @Override
          public Void visit(DefaultMapType defaultMapType) {
            c.incrementAndGet();
            return null;
          }
        });
    return c.get() > 0;
  }

  /** Returns whether this type contains a default-valued map. */
  default boolean containsDefaultMap() {
    final AtomicInteger c = new AtomicInteger();
    accept(
        new TypeVisitor<Void>() {
          @Override
          public Void visit(DefaultMapType defaultMapType) {
            c.incrementAndGet();
            return null;
          }
        });
    return c.get() > 0;
  }
}

// End Type.java
