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

import java.math.BigInteger;

/** Primitive type. */
public enum PrimitiveType implements Type {
  BOOL("bool", 1, false),
  INT8("int8", 8, true),
  UINT8("uint8", 8, false),
  INT16("int16", 16, true),
  UINT16("uint16", 16, false),
  INT32("int32", 32, true),
  UINT32("uint32", 32, false),
  INT64("int64", 64, true),
  /** Arbitrary-precision integer. */
  BIG_INT("bigint", 0, true),
  /** 16-bit unsigned character. */
  CHAR("char", 16, false),
  STRING("string", 0, false);

  /** The name in the language, e.g. {@code int32}. */
  public final String moniker;

  /** Number of bits, for bit-vector types; 1 for bool; 0 otherwise. */
  public final int width;

  public final boolean signed;

  PrimitiveType(String moniker, int width, boolean signed) {
    this.moniker = moniker;
    this.width = width;
    this.signed = signed;
  }

  @Override
  public String toString() {
    return moniker;
  }

  @Override
  public String moniker() {
    return moniker;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public boolean isBitVector() {
    return isFixedInt() || this == CHAR;
  }

  @Override
  public boolean isFixedInt() {
    switch (this) {
      case INT8:
      case UINT8:
      case INT16:
      case UINT16:
      case INT32:
      case UINT32:
      case INT64:
        return true;
      default:
        return false;
    }
  }

  /** Whether values of this type support {@code +}, {@code -}, {@code *}. */
  public boolean isArithmetic() {
    return isFixedInt() || this == BIG_INT;
  }

  /** Whether values of this type are ordered ({@code <}, {@code <=}). */
  public boolean isOrdered() {
    return isArithmetic() || this == CHAR;
  }

  @Override
  public boolean isSequence() {
    return this == STRING;
  }

  @Override
  public boolean isFinite() {
    return this == BOOL || isBitVector();
  }

  /** Smallest value of a fixed-width integer type. */
  public long minValue() {
    if (!isBitVector()) {
      throw new UnsupportedOperationException(moniker);
    }
    return signed ? -(1L << (width - 1)) : 0L;
  }

  /** Largest value of a fixed-width integer type. */
  public long maxValue() {
    if (!isBitVector()) {
      throw new UnsupportedOperationException(moniker);
    }
    if (width == 64) {
      return Long.MAX_VALUE;
    }
    return signed ? (1L << (width - 1)) - 1 : (1L << width) - 1;
  }

  /**
   * Wraps a value into the range of this bit-vector type: keeps the low
   * {@link #width} bits, then sign-extends if the type is signed.
   */
  public long wrap(long v) {
    if (width == 64) {
      return v;
    }
    final long masked = v & ((1L << width) - 1);
    if (signed && (masked & (1L << (width - 1))) != 0) {
      return masked - (1L << width);
    }
    return masked;
  }

  /** Converts a value to its unsigned two's-complement bit pattern. */
  public BigInteger toUnsigned(long v) {
    final BigInteger b = BigInteger.valueOf(v);
    return v >= 0 ? b : b.add(BigInteger.ONE.shiftLeft(width));
  }
}

// End PrimitiveType.java
